package dao.whalevault.relay.exception;

import lombok.Getter;

/**
 * Swap aggregator failure. Transient failures (rate limit, network, 5xx) may be retried;
 * permanent ones (no route, bad parameters) may not.
 */
@Getter
public class AggregatorException extends DomainException {

    private final boolean transientFailure;
    private final boolean rateLimited;

    private AggregatorException(String message, boolean transientFailure, boolean rateLimited, int status, Throwable cause) {
        super(message, status, cause);
        this.transientFailure = transientFailure;
        this.rateLimited = rateLimited;
    }

    public static AggregatorException rateLimited(String message) {
        return new AggregatorException(message, true, true, 503, null);
    }

    public static AggregatorException transientFailure(String message, Throwable cause) {
        return new AggregatorException(message, true, false, 503, cause);
    }

    public static AggregatorException permanent(String message, int status) {
        return new AggregatorException(message, false, false, status, null);
    }

    public static AggregatorException permanent(String message, int status, Throwable cause) {
        return new AggregatorException(message, false, false, status, cause);
    }
}
