package com.ai.guardrails.service;

import com.ai.guardrails.config.RoutingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Periodic sweep over all registered models.
 */
@Service
public class HealthCheckScheduler {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckScheduler.class);

    private final ModelHealthService modelHealthService;
    private final RoutingProperties routingProperties;

    public HealthCheckScheduler(ModelHealthService modelHealthService, RoutingProperties routingProperties) {
        this.modelHealthService = modelHealthService;
        this.routingProperties = routingProperties;
    }

    @Scheduled(fixedRateString = "${guardrails.routing.health.check-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${guardrails.routing.health.check-interval-seconds:60}")
    public void sweep() {
        if (!routingProperties.getHealth().isScheduled()) {
            return;
        }
        try {
            modelHealthService.checkAll();
        } catch (RuntimeException e) {
            // keep the schedule alive; the next sweep retries
            log.error("Scheduled health check failed", e);
        }
    }
}
