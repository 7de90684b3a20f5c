package dao.whalevault.relay.solana;

import dao.whalevault.relay.util.ByteUtil;
import org.bitcoinj.core.Base58;
import org.p2p.solanaj.core.Account;
import org.p2p.solanaj.utils.TweetNaclFast;

import java.util.Arrays;

/**
 * Signing of serialized transactions built elsewhere (aggregator swap transactions).
 * Handles both legacy and v0 messages, which solanaj's Transaction cannot parse.
 */
public final class VersionedTransactions {
    private VersionedTransactions() {}

    private static final int VERSION_PREFIX = 0x80;
    private static final int KEY_LENGTH = 32;

    /**
     * Writes the relayer's signature into its slot and returns the signed wire bytes.
     *
     * @throws IllegalArgumentException if the transaction is malformed or does not expect the relayer as signer
     */
    public static byte[] sign(byte[] transaction, Account signer) {
        try {
            int[] sigCount = ByteUtil.readCompactU16(transaction, 0);
            int numSignatures = sigCount[0];
            int signaturesOffset = sigCount[1];
            int messageOffset = signaturesOffset + SolanaConstants.SIGNATURE_LENGTH * numSignatures;
            byte[] message = Arrays.copyOfRange(transaction, messageOffset, transaction.length);

            int headerOffset = (message[0] & VERSION_PREFIX) != 0 ? 1 : 0;
            int numRequired = message[headerOffset] & 0xFF;
            if (numRequired != numSignatures) {
                throw new IllegalArgumentException("Signature count " + numSignatures
                        + " does not match header " + numRequired);
            }

            int[] keyCount = ByteUtil.readCompactU16(message, headerOffset + 3);
            int keysOffset = headerOffset + 3 + keyCount[1];
            byte[] relayerKey = signer.getPublicKey().toByteArray();
            int slot = -1;
            for (int i = 0; i < Math.min(numRequired, keyCount[0]); i++) {
                int from = keysOffset + KEY_LENGTH * i;
                if (Arrays.equals(relayerKey, Arrays.copyOfRange(message, from, from + KEY_LENGTH))) {
                    slot = i;
                    break;
                }
            }
            if (slot < 0) {
                throw new IllegalArgumentException("Transaction does not require a signature from " + signer.getPublicKey());
            }

            byte[] signed = transaction.clone();
            byte[] signature = new TweetNaclFast.Signature(relayerKey, signer.getSecretKey()).detached(message);
            System.arraycopy(signature, 0, signed,
                    signaturesOffset + SolanaConstants.SIGNATURE_LENGTH * slot, SolanaConstants.SIGNATURE_LENGTH);
            return signed;
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Truncated transaction", e);
        }
    }

    /**
     * The first signature is the transaction id.
     */
    public static String signature(byte[] signedTransaction) {
        int[] sigCount = ByteUtil.readCompactU16(signedTransaction, 0);
        if (sigCount[0] == 0) {
            throw new IllegalArgumentException("Transaction carries no signatures");
        }
        int from = sigCount[1];
        return Base58.encode(Arrays.copyOfRange(signedTransaction, from, from + SolanaConstants.SIGNATURE_LENGTH));
    }
}
