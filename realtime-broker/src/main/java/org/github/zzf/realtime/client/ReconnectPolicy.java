package org.github.zzf.realtime.client;

import static com.google.common.base.Preconditions.checkArgument;

import lombok.Getter;
import lombok.ToString;

/**
 * bounded exponential backoff: {@code delay(n) = min(base * 2^n, maxDelay)}
 */
@Getter
@ToString
public class ReconnectPolicy {

    public static final ReconnectPolicy DEFAULT = new ReconnectPolicy(1000, 30_000, 5);

    private final long baseDelayMillis;
    private final long maxDelayMillis;
    /* 0: retry forever */
    private final int maxAttempts;

    public ReconnectPolicy(long baseDelayMillis, long maxDelayMillis, int maxAttempts) {
        checkArgument(baseDelayMillis > 0, "baseDelayMillis must be positive");
        checkArgument(maxDelayMillis >= baseDelayMillis, "maxDelayMillis < baseDelayMillis");
        checkArgument(maxAttempts >= 0, "maxAttempts must not be negative");
        this.baseDelayMillis = baseDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param attempt number of consecutive failures so far, starting at 0
     * @return milliseconds to wait before the next try
     */
    public long delay(int attempt) {
        checkArgument(attempt >= 0, "attempt must not be negative");
        // base * 2^attempt overflows long quickly
        if (attempt >= Long.numberOfLeadingZeros(baseDelayMillis) - 1) {
            return maxDelayMillis;
        }
        return Math.min(baseDelayMillis << attempt, maxDelayMillis);
    }

    public boolean exhausted(int attempt) {
        return maxAttempts > 0 && attempt >= maxAttempts;
    }

}
