package com.example.loqueue.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configures polling and the scheduler that runs claim loops.
 */
@Validated
@ConfigurationProperties(prefix = "loqueue")
public class QueueProperties {

    /**
     * Delay before the next claim attempt after an empty or failed iteration. Also the interval
     * between result polls in {@code JobHandle.done()}.
     */
    @NotNull
    private Duration pollInterval = Duration.ofSeconds(1);

    @Min(1)
    private int schedulerPoolSize = 8;

    @NotBlank
    private String threadNamePrefix = "loqueue-";

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    @AssertTrue(message = "loqueue.poll-interval must be positive")
    public boolean isPollIntervalPositive() {
        return pollInterval == null || (!pollInterval.isZero() && !pollInterval.isNegative());
    }

    public int getSchedulerPoolSize() {
        return schedulerPoolSize;
    }

    public void setSchedulerPoolSize(int schedulerPoolSize) {
        this.schedulerPoolSize = schedulerPoolSize;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
