package dao.whalevault.relay.swap;

import dao.whalevault.relay.exception.AggregatorException;
import dao.whalevault.relay.util.Sleeper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Exponential backoff for aggregator reads. Only transient {@link AggregatorException}s are retried;
 * retry {@code n} waits {@code baseDelay * multiplier^(n-1)}, doubled once when the provider rate-limited us.
 */
@Slf4j
@Getter
public class RetryPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final double multiplier;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, Duration baseDelay, double multiplier, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        AggregatorException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                long delay = delayBeforeRetry(attempt);
                if (last.isRateLimited()) {
                    delay *= 2;
                }
                log.warn("{} failed ({}), retry {}/{} in {} ms", operation, last.getMessage(), attempt, maxRetries, delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw AggregatorException.transientFailure(operation + " interrupted", e);
                }
            }
            try {
                return call.get();
            } catch (AggregatorException e) {
                if (!e.isTransientFailure()) {
                    throw e;
                }
                last = e;
            }
        }
        log.error("{} failed after {} attempts", operation, maxRetries + 1);
        throw AggregatorException.transientFailure(
                operation + " failed after " + (maxRetries + 1) + " attempts: " + last.getMessage(), last);
    }

    /**
     * @param retry 1-based retry number
     */
    long delayBeforeRetry(int retry) {
        return Math.round(baseDelay.toMillis() * Math.pow(multiplier, retry - 1));
    }
}
