package com.ai.guardrails.seeder;

import com.ai.guardrails.model.ModelCapability;
import com.ai.guardrails.model.ModelConfig;
import com.ai.guardrails.model.ModelProvider;

import java.util.List;

/**
 * Built-in backend model catalogue. Costs are per 1k tokens.
 */
public final class DefaultModelCatalog {

    private DefaultModelCatalog() {}

    public static List<ModelConfig> all() {
        return List.of(
                ModelConfig.builder()
                        .modelId("gpt-4-turbo")
                        .provider(ModelProvider.OPENAI)
                        .endpoint("https://api.openai.com/v1/chat/completions")
                        .apiKeyEnv("OPENAI_API_KEY")
                        .capability(ModelCapability.TEXT_GENERATION)
                        .capability(ModelCapability.CHAT)
                        .capability(ModelCapability.CODE_GENERATION)
                        .capability(ModelCapability.FUNCTION_CALLING)
                        .maxTokens(128_000)
                        .costPerUnit(0.01)
                        .priority(90)
                        .build(),
                ModelConfig.builder()
                        .modelId("gpt-3.5-turbo")
                        .provider(ModelProvider.OPENAI)
                        .endpoint("https://api.openai.com/v1/chat/completions")
                        .apiKeyEnv("OPENAI_API_KEY")
                        .capability(ModelCapability.TEXT_GENERATION)
                        .capability(ModelCapability.CHAT)
                        .capability(ModelCapability.FUNCTION_CALLING)
                        .maxTokens(16_385)
                        .costPerUnit(0.0015)
                        .priority(70)
                        .build(),
                ModelConfig.builder()
                        .modelId("claude-3-opus")
                        .provider(ModelProvider.ANTHROPIC)
                        .endpoint("https://api.anthropic.com/v1/messages")
                        .apiKeyEnv("ANTHROPIC_API_KEY")
                        .capability(ModelCapability.TEXT_GENERATION)
                        .capability(ModelCapability.CHAT)
                        .capability(ModelCapability.CODE_GENERATION)
                        .maxTokens(200_000)
                        .costPerUnit(0.015)
                        .priority(95)
                        .build(),
                ModelConfig.builder()
                        .modelId("claude-3-sonnet")
                        .provider(ModelProvider.ANTHROPIC)
                        .endpoint("https://api.anthropic.com/v1/messages")
                        .apiKeyEnv("ANTHROPIC_API_KEY")
                        .capability(ModelCapability.TEXT_GENERATION)
                        .capability(ModelCapability.CHAT)
                        .capability(ModelCapability.CODE_GENERATION)
                        .maxTokens(200_000)
                        .costPerUnit(0.003)
                        .priority(85)
                        .build(),
                ModelConfig.builder()
                        .modelId("gemini-pro")
                        .provider(ModelProvider.GOOGLE)
                        .endpoint("https://generativelanguage.googleapis.com/v1/models/gemini-pro:generateContent")
                        .apiKeyEnv("GOOGLE_API_KEY")
                        .capability(ModelCapability.TEXT_GENERATION)
                        .capability(ModelCapability.CHAT)
                        .maxTokens(30_720)
                        .costPerUnit(0.00025)
                        .priority(75)
                        .build(),
                ModelConfig.builder()
                        .modelId("azure-gpt-4")
                        .provider(ModelProvider.AZURE)
                        .endpoint("https://{resource}.openai.azure.com/openai/deployments/{deployment}/chat/completions")
                        .apiKeyEnv("AZURE_OPENAI_KEY")
                        .capability(ModelCapability.TEXT_GENERATION)
                        .capability(ModelCapability.CHAT)
                        .capability(ModelCapability.CODE_GENERATION)
                        .maxTokens(128_000)
                        .costPerUnit(0.01)
                        .priority(88)
                        .build()
        );
    }
}
