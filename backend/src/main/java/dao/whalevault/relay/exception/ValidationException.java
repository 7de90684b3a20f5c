package dao.whalevault.relay.exception;

/**
 * Malformed input. Never retried.
 */
public class ValidationException extends DomainException {

    public ValidationException(String message) {
        super(message, 400);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
