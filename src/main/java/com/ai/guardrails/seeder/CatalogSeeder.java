package com.ai.guardrails.seeder;

import com.ai.guardrails.model.AttackVector;
import com.ai.guardrails.model.ModelConfig;
import com.ai.guardrails.repository.AttackVectorRegistry;
import com.ai.guardrails.repository.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Registers the built-in attack vectors and model catalogue at start-up.
 * Disable with {@code guardrails.seed-defaults=false}.
 */
@Component
@ConditionalOnProperty(prefix = "guardrails", name = "seed-defaults", havingValue = "true", matchIfMissing = true)
@Order(1)
public class CatalogSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CatalogSeeder.class);

    private final AttackVectorRegistry attackVectorRegistry;
    private final ModelRegistry modelRegistry;

    public CatalogSeeder(AttackVectorRegistry attackVectorRegistry, ModelRegistry modelRegistry) {
        this.attackVectorRegistry = attackVectorRegistry;
        this.modelRegistry = modelRegistry;
    }

    @Override
    public void run(String... args) {
        for (AttackVector vector : DefaultAttackVectors.all()) {
            attackVectorRegistry.register(vector);
        }
        for (ModelConfig model : DefaultModelCatalog.all()) {
            modelRegistry.register(model);
        }
        log.info("Seeded {} attack vectors and {} models", attackVectorRegistry.size(), modelRegistry.size());
    }
}
