package dao.whalevault.relay.service.proof;

import dao.whalevault.relay.exception.ValidationException;
import dao.whalevault.relay.model.ProofInputs;
import dao.whalevault.relay.model.ProofResult;
import dao.whalevault.relay.util.ByteUtil;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic MVP proof accepted by the pool program while the Merkle-tree circuit is not wired in.
 *
 * <p>Layout (96 bytes): {@code signature (64) | pubkey (32)}. The program only checks that both parts
 * are non-zero, so this proves nothing cryptographically; it binds the note's nullifier to the
 * withdrawal so double spends are still rejected on-chain.
 */
@Service
public class PlaceholderProofGenerator implements ProofGenerator {

    private static final byte[] NULLIFIER_DOMAIN = "whalevault:nullifier".getBytes(StandardCharsets.UTF_8);

    @Override
    public ProofResult generate(ProofInputs inputs) {
        byte[] commitment = decodeHex(inputs.commitment(), "commitment");
        byte[] secret = decodeHex(inputs.secret(), "secret");
        if (inputs.amount() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        if (inputs.recipient() == null || inputs.recipient().isBlank()) {
            throw new ValidationException("Recipient is required");
        }

        byte[] nullifier = nullifier(commitment, secret);

        byte[] amountBytes = new byte[32];
        byte[] amountLe = ByteUtil.u64le(inputs.amount());
        for (int i = 0; i < 8; i++) {
            amountBytes[31 - i] = amountLe[i];
        }
        byte[] recipientBytes = Arrays.copyOf(inputs.recipient().getBytes(StandardCharsets.UTF_8), 32);

        byte[] h1 = ByteUtil.sha256(commitment, nullifier);
        byte[] h2 = ByteUtil.sha256(amountBytes, recipientBytes);
        byte[] proof = ByteUtil.concat(
                ByteUtil.sha256(h1, h2),
                ByteUtil.sha256(h2, h1),
                ByteUtil.sha256(secret, commitment)
        );

        String nullifierHex = Hex.toHexString(nullifier);
        Map<String, Object> publicInputs = new LinkedHashMap<>();
        publicInputs.put("commitment", inputs.commitment());
        publicInputs.put("nullifier", nullifierHex);
        publicInputs.put("recipient", inputs.recipient());
        publicInputs.put("amount", inputs.amount());

        return new ProofResult(Hex.toHexString(proof), nullifierHex, publicInputs);
    }

    static byte[] nullifier(byte[] commitment, byte[] secret) {
        return ByteUtil.sha256(NULLIFIER_DOMAIN, commitment, secret);
    }

    private static byte[] decodeHex(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing " + field);
        }
        String hex = value.startsWith("0x") ? value.substring(2) : value;
        if (hex.length() % 2 != 0) {
            throw new ValidationException("Invalid hex for " + field);
        }
        try {
            byte[] bytes = Hex.decode(hex);
            if (bytes.length == 0) {
                throw new ValidationException("Empty " + field);
            }
            return bytes;
        } catch (DecoderException e) {
            throw new ValidationException("Invalid hex for " + field, e);
        }
    }
}
