package dao.whalevault.relay.model;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Map;

/**
 * Output of a completed proof job. Validated once here so consumers can rely on the shapes.
 *
 * @param proof        hex-encoded proof bytes
 * @param nullifier    hex-encoded 32-byte nullifier
 * @param publicInputs public inputs as reported by the generator
 */
public record ProofResult(String proof, String nullifier, Map<String, Object> publicInputs) {

    public static final int NULLIFIER_LENGTH = 32;

    public ProofResult {
        if (proof == null || proof.isBlank()) {
            throw new IllegalArgumentException("Proof is missing");
        }
        if (nullifier == null || nullifier.isBlank()) {
            throw new IllegalArgumentException("Nullifier is missing");
        }
        if (decode(proof, "proof").length == 0) {
            throw new IllegalArgumentException("Proof is empty");
        }
        if (decode(nullifier, "nullifier").length != NULLIFIER_LENGTH) {
            throw new IllegalArgumentException("Nullifier must be " + NULLIFIER_LENGTH + " bytes");
        }
        publicInputs = publicInputs == null ? Map.of() : Map.copyOf(publicInputs);
    }

    public byte[] proofBytes() {
        return Hex.decode(proof);
    }

    public byte[] nullifierBytes() {
        return Hex.decode(nullifier);
    }

    private static byte[] decode(String hex, String field) {
        try {
            return Hex.decode(hex);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex in " + field, e);
        }
    }
}
