package dao.whalevault.relay.service.proof;

import dao.whalevault.relay.model.ProofInputs;
import dao.whalevault.relay.model.ProofResult;

/**
 * Produces the withdrawal proof for a shielded note. Implementations may throw
 * {@link dao.whalevault.relay.exception.ValidationException} for malformed inputs and
 * {@link dao.whalevault.relay.exception.ProofGenerationException} for failures that are safe to
 * show to the caller; anything else is treated as an internal error.
 */
public interface ProofGenerator {

    ProofResult generate(ProofInputs inputs);
}
