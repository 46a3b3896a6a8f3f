package com.ai.guardrails.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "guardrails.routing")
public class RoutingProperties {

    // Cost per 1k tokens that maps to a zero cost component.
    private double costReferenceCeiling = 0.02;

    // Below this cost the routing reason mentions cost efficiency.
    private double costEfficientBelow = 0.005;

    // Priority from which a model is called out as high priority.
    private int highPriorityFrom = 90;

    // Latency estimate for models never probed successfully.
    private long defaultEstimatedLatencyMs = 1000;

    private int failoverSize = 3;

    private Health health = new Health();

    @Data
    public static class Health {
        private boolean scheduled = true;
        private int checkIntervalSeconds = 60;
        private long probeTimeoutMs = 5000;
        private int probePoolSize = 8;
        private int failuresUntilUnavailable = 3;
        // EWMA smoothing factor for the probe success rate.
        private double successRateAlpha = 0.1;
        private long recoveryBackoffBaseMs = 30_000;
        private long recoveryBackoffMaxMs = 600_000;
    }
}
