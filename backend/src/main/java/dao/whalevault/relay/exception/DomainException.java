package dao.whalevault.relay.exception;

import lombok.Getter;

/**
 * Failure whose message is safe to return to the caller, together with the HTTP status it maps to.
 */
@Getter
public class DomainException extends RuntimeException {

    private final int status;

    public DomainException(String message, int status) {
        super(message);
        this.status = status;
    }

    public DomainException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
