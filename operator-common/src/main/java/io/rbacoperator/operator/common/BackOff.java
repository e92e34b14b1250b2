/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common;

/**
 * <p>Encapsulates computing delays for an exponential back-off, when an operation has to be retried.
 * The {@link #delayMs()} method will return an increasing delay to be used between operation attempts.</p>
 * <p>The delay after the 0th attempt is always 0ms and the remaining delays are computed by the formula:</p>
 * <pre>  delayMs(n) = min(scaleMs * base ^ (n - 1), maxDelayMs)</pre>
 * <p>Thus the delay after the 1st attempt is {@code scaleMs}, and after the 2nd attempt is {@code scaleMs * base}.</p>
 */
public class BackOff {
    /**
     * Delay of the first retry and the smallest allowed maximum delay
     */
    public static final long DEFAULT_SCALE_MS = 200L;
    private static final int DEFAULT_BASE = 2;
    private static final int DEFAULT_MAX_ATTEMPTS = 6;

    private final long scaleMs;
    private final int base;
    private final int maxAttempts;
    private final long maxDelayMs;
    private int attempt = 0;

    /**
     * Computes delays according to {@code 200 * 2^attempt} with a maximum of 6 attempts.
     */
    public BackOff() {
        this(DEFAULT_SCALE_MS, DEFAULT_BASE, DEFAULT_MAX_ATTEMPTS, Long.MAX_VALUE);
    }

    /**
     * Computes delays according to {@code 200 * 2^attempt} without limiting the number of attempts. The delay never
     * grows over {@code maxDelayMs}.
     *
     * @param maxDelayMs    The longest delay which will be returned
     */
    public BackOff(long maxDelayMs) {
        this(DEFAULT_SCALE_MS, DEFAULT_BASE, Integer.MAX_VALUE, maxDelayMs);
    }

    /**
     * Computes delays according to {@code scaleMs * base^attempt} with the given maximum number of attempts.
     *
     * @param scaleMs       The scale.
     * @param base          The base.
     * @param maxAttempts   The maximum number of attempts to make before {@code MaxAttemptsExceededException} is thrown.
     * @param maxDelayMs    The longest delay which will be returned
     */
    public BackOff(long scaleMs, int base, int maxAttempts, long maxDelayMs) {
        if (scaleMs <= 0) {
            throw new IllegalArgumentException("The scale has to be positive");
        }
        if (base <= 0) {
            throw new IllegalArgumentException("The base has to be positive");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("The maximum number of attempts has to be positive");
        }
        if (maxDelayMs < scaleMs) {
            throw new IllegalArgumentException("The maximum delay cannot be shorter than the scale");
        }

        this.scaleMs = scaleMs;
        this.base = base;
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Return the next delay to use, in milliseconds.
     * The first delay is always zero, the 2nd delay is scaleMs, and the delay increases exponentially from there.
     *
     * @return Return the next delay to use, in milliseconds.
     *
     * @throws MaxAttemptsExceededException if the next attempt would exceed the configured number of attempts.
     */
    public long delayMs() {
        if (attempt == maxAttempts) {
            throw new MaxAttemptsExceededException();
        }
        return delay(attempt++);
    }

    /**
     * @return Whether the next call to {@link #delayMs()} will throw MaxAttemptsExceededException.
     */
    public boolean done() {
        return attempt >= maxAttempts;
    }

    /**
     * @return  Number of delays issued so far
     */
    public int attempts() {
        return attempt;
    }

    private long delay(int n) {
        if (n == 0) {
            return 0L;
        }

        long delay = scaleMs;
        while (n-- > 1 && delay < maxDelayMs) {
            delay *= base;
        }

        return Math.min(delay, maxDelayMs);
    }
}
