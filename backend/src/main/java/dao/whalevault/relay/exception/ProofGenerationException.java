package dao.whalevault.relay.exception;

/**
 * Raised by the proof generator for conditions it can describe without leaking secret material.
 */
public class ProofGenerationException extends DomainException {

    public ProofGenerationException(String message) {
        super(message, 422);
    }
}
