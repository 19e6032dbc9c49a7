package com.selfheal.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff between remediation attempts.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 * <p>
 * Two remediators racing on the same Deployment both lose a conflict at the same moment;
 * the jitter keeps their re-reads from landing together again.
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the delay before the next attempt.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay (cap, jitter excluded)
     * @param jitterMax Maximum jitter to add
     * @return base * 2^attempt capped at max, plus jitter
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20)); // Cap exponent to avoid overflow

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterMs = jitterMax.isZero() || jitterMax.isNegative()
            ? 0
            : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }
}
