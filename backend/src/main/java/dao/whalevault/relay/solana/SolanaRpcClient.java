package dao.whalevault.relay.solana;

import org.p2p.solanaj.core.Account;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.core.TransactionInstruction;

import java.util.List;
import java.util.Optional;

/**
 * Chain capabilities used by the relay. All failures surface as
 * {@link dao.whalevault.relay.exception.SolanaRpcException}.
 */
public interface SolanaRpcClient {

    Optional<AccountInfo> getAccountInfo(PublicKey account);

    long getBalance(PublicKey account);

    /**
     * Builds a legacy transaction over a fresh blockhash, signs it with {@code signer} as fee payer and sends it.
     *
     * @return the transaction signature
     */
    String sendTransaction(List<TransactionInstruction> instructions, Account signer);

    /**
     * @return the transaction signature
     */
    String sendRawTransaction(byte[] signedTransaction);

    /**
     * Blocks until the signature reaches the configured commitment.
     * Fails if the transaction errored on-chain or the confirmation timeout elapses.
     */
    void confirmTransaction(String signature);

    /**
     * Raw token amount held by an SPL token account. Fails if the account does not exist.
     */
    long getTokenAccountBalance(PublicKey tokenAccount);

    String requestAirdrop(PublicKey account, long lamports);
}
