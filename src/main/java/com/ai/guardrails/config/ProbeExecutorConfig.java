package com.ai.guardrails.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ProbeExecutorConfig {

    @Bean(name = "probeExecutor")
    public ThreadPoolTaskExecutor probeExecutor(RoutingProperties routingProperties) {
        int poolSize = Math.max(1, routingProperties.getHealth().getProbePoolSize());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(poolSize);
        ex.setMaxPoolSize(poolSize);
        ex.setQueueCapacity(1000);
        ex.setThreadNamePrefix("model-probe-");
        ex.setAwaitTerminationSeconds(10);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
