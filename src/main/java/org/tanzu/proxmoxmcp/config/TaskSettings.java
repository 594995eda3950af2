package org.tanzu.proxmoxmcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Task tracking and submission settings, bound with the "proxmox.tasks" prefix.
 *
 * Defaults: 300 s tracking deadline, 1500 ms between status polls, one
 * resubmission after a failure that produced no response. A submission is never
 * sent more than twice, so configured retries are clamped to 0..1.
 */
@Component
@ConfigurationProperties(prefix = "proxmox.tasks")
public class TaskSettings {

    static final int MAX_SUBMIT_RETRIES = 1;

    private int timeoutSeconds = 300;

    private long pollIntervalMillis = 1500;

    private int submitRetries = 1;

    public TaskSettings() {
    }

    public TaskSettings(int timeoutSeconds, long pollIntervalMillis, int submitRetries) {
        this.timeoutSeconds = timeoutSeconds;
        this.pollIntervalMillis = pollIntervalMillis;
        this.submitRetries = clampRetries(submitRetries);
    }

    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public long getPollIntervalMillis() { return pollIntervalMillis; }
    public void setPollIntervalMillis(long pollIntervalMillis) { this.pollIntervalMillis = pollIntervalMillis; }

    public int getSubmitRetries() { return submitRetries; }
    public void setSubmitRetries(int submitRetries) { this.submitRetries = clampRetries(submitRetries); }

    private static int clampRetries(int submitRetries) {
        return Math.max(0, Math.min(submitRetries, MAX_SUBMIT_RETRIES));
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public Duration getPollInterval() {
        return Duration.ofMillis(pollIntervalMillis);
    }

    @Override
    public String toString() {
        return "TaskSettings{timeoutSeconds=" + timeoutSeconds + ", pollIntervalMillis=" + pollIntervalMillis
                + ", submitRetries=" + submitRetries + "}";
    }
}
