package io.newsclusters.digest.api.util;

import io.newsclusters.digest.config.DigestConfig;
import org.springframework.stereotype.Component;

@Component
public class DigestProps {
    private final int maxAttempts;
    private final long retryDelay;
    private final String dailyCron;
    private final String zone;

    public DigestProps(DigestConfig config) {
        this.maxAttempts = config.http().maxRetries();
        this.retryDelay = config.http().retryDelay();
        this.dailyCron = config.schedule().dailyCron();
        this.zone = config.schedule().zone();
    }

    // retry
    public int getMaxAttempts() { return maxAttempts; }
    public long getRetryDelay() { return retryDelay; }

    // schedule
    public String getDailyCron() { return dailyCron; }
    public String getZone() { return zone; }
}
