package dao.whalevault.relay.solana;

import org.bitcoinj.core.Base58;
import org.p2p.solanaj.core.Account;
import org.p2p.solanaj.utils.TweetNaclFast;

import java.util.Arrays;

/**
 * Loads the custodial relayer account from configuration.
 */
public final class RelayerAccounts {
    private RelayerAccounts() {}

    private static final int SEED_LENGTH = 32;
    private static final int SECRET_LENGTH = 64;

    public static Account fromSeed(byte[] seed) {
        if (seed == null || seed.length != SEED_LENGTH) {
            throw new IllegalArgumentException("Ed25519 seed must be 32 bytes");
        }
        return new Account(TweetNaclFast.Signature.keyPair_fromSeed(seed).getSecretKey());
    }

    /**
     * Accepts a base58 secret (32-byte seed or 64-byte seed+pubkey) or the JSON byte array
     * written by solana-keygen.
     */
    public static Account fromSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Relayer secret is empty");
        }
        String s = secret.trim();
        byte[] raw = s.startsWith("[") ? parseJsonBytes(s) : Base58.decode(s);
        if (raw.length != SEED_LENGTH && raw.length != SECRET_LENGTH) {
            throw new IllegalArgumentException("Relayer secret must be 32 or 64 bytes, got " + raw.length);
        }
        Account account = fromSeed(Arrays.copyOf(raw, SEED_LENGTH));
        if (raw.length == SECRET_LENGTH
                && !Arrays.equals(account.getPublicKey().toByteArray(), Arrays.copyOfRange(raw, SEED_LENGTH, SECRET_LENGTH))) {
            throw new IllegalArgumentException("Relayer secret public half does not match its seed");
        }
        return account;
    }

    private static byte[] parseJsonBytes(String json) {
        String body = json.substring(1, json.length() - (json.endsWith("]") ? 1 : 0)).trim();
        if (body.isEmpty()) return new byte[0];
        String[] parts = body.split(",");
        byte[] out = new byte[parts.length];
        for (int i = 0; i < parts.length; i++) {
            int v = Integer.parseInt(parts[i].trim());
            if (v < 0 || v > 255) {
                throw new IllegalArgumentException("Key byte out of range at index " + i);
            }
            out[i] = (byte) v;
        }
        return out;
    }
}
