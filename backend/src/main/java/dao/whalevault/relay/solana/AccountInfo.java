package dao.whalevault.relay.solana;

import org.p2p.solanaj.core.PublicKey;

/**
 * Subset of getAccountInfo the relay needs.
 */
public record AccountInfo(PublicKey owner, long lamports, byte[] data) {

    public AccountInfo {
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }
}
