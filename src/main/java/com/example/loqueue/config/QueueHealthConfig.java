package com.example.loqueue.config;

import com.example.loqueue.service.QueueStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QueueHealthConfig {

    @Bean
    public HealthIndicator queueBacklogHealth(QueueStore queueStore) {
        return () -> {
            try {
                return Health.up()
                        .withDetail("pendingJobs", queueStore.countAllJobs())
                        .withDetail("unacknowledgedResults", queueStore.countAllResults())
                        .build();
            } catch (Exception e) {
                return Health.down(e).withDetail("store", "unreachable").build();
            }
        };
    }
}
