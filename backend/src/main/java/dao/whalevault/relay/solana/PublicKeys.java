package dao.whalevault.relay.solana;

import org.p2p.solanaj.core.PublicKey;

public final class PublicKeys {
    private PublicKeys() {}

    public static boolean isValid(String base58) {
        return tryParse(base58) != null;
    }

    /**
     * @return the key, or null when {@code base58} is not a 32-byte base58 string
     */
    public static PublicKey tryParse(String base58) {
        if (base58 == null || base58.isBlank()) {
            return null;
        }
        try {
            return new PublicKey(base58.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
