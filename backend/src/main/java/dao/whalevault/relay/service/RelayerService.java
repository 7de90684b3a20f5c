package dao.whalevault.relay.service;

import dao.whalevault.relay.config.RelayerProperties;
import dao.whalevault.relay.exception.RelayerException;
import dao.whalevault.relay.model.RelayResult;
import dao.whalevault.relay.solana.PublicKeys;
import dao.whalevault.relay.solana.RelayerAccounts;
import dao.whalevault.relay.solana.SolanaRpcClient;
import dao.whalevault.relay.solana.VersionedTransactions;
import dao.whalevault.relay.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.p2p.solanaj.core.Account;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.core.TransactionInstruction;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Custodial signer. Submits withdrawals on behalf of users so the depositor's wallet never signs
 * next to the recipient, and signs every follow-up transaction of the swap saga.
 */
@Slf4j
@Service
public class RelayerService {

    private static final int NULLIFIER_LENGTH = 32;

    private final RelayerProperties props;
    private final SolanaRpcClient rpc;
    private final UnshieldInstructionBuilder unshieldBuilder;
    private final Sleeper sleeper;
    private final Account account;

    public RelayerService(RelayerProperties props, SolanaRpcClient rpc, UnshieldInstructionBuilder unshieldBuilder,
                          Sleeper sleeper) {
        this.props = props;
        this.rpc = rpc;
        this.unshieldBuilder = unshieldBuilder;
        this.sleeper = sleeper;

        String secret = props.getPrivateKey();
        Account loaded = null;
        if (secret == null || secret.isBlank() || secret.equals("YOUR_PRIVATE_KEY_HERE")) {
            log.warn("No relayer key configured. Set RELAYER_PRIVATE_KEY to enable relayed withdrawals.");
        } else {
            try {
                loaded = RelayerAccounts.fromSecret(secret);
                log.info("RelayerService initialized: relayer={}, feeBps={}, minFee={}",
                        loaded.getPublicKey(), props.getFeeBps(), props.getMinFeeLamports());
            } catch (IllegalArgumentException e) {
                log.error("Failed to load relayer key: {}", e.getMessage());
            }
        }
        this.account = loaded;
    }

    public boolean isEnabled() {
        return props.isEnabled() && account != null;
    }

    public PublicKey getPublicKey() {
        return requireAccount().getPublicKey();
    }

    public int getFeeBps() {
        return props.getFeeBps();
    }

    public long getMinFee() {
        return props.getMinFeeLamports();
    }

    public long calculateFee(long amount) {
        long fee = Math.multiplyExact(amount, (long) props.getFeeBps()) / 10_000L;
        return Math.max(fee, props.getMinFeeLamports());
    }

    public long calculateAmountAfterFee(long amount) {
        return amount - calculateFee(amount);
    }

    /**
     * Submits the pool withdrawal signed by the relayer. Inputs are validated before anything is signed.
     *
     * @throws RelayerException DISABLED, INVALID_INPUT (no side effect) or CHAIN_REJECTED
     */
    public RelayResult relayUnshield(byte[] nullifier, String recipient, long amount, byte[] proof, long denomination) {
        if (!props.isEnabled()) {
            throw new RelayerException(RelayerException.Kind.DISABLED, "Relayer is disabled");
        }
        if (nullifier == null || nullifier.length != NULLIFIER_LENGTH) {
            throw new RelayerException(RelayerException.Kind.INVALID_INPUT,
                    "Invalid nullifier length: " + (nullifier == null ? 0 : nullifier.length));
        }
        PublicKey recipientKey = PublicKeys.tryParse(recipient);
        if (recipientKey == null) {
            throw new RelayerException(RelayerException.Kind.INVALID_INPUT, "Invalid recipient address: " + recipient);
        }
        if (amount <= 0) {
            throw new RelayerException(RelayerException.Kind.INVALID_INPUT, "Amount must be positive");
        }
        if (proof == null || proof.length == 0) {
            throw new RelayerException(RelayerException.Kind.INVALID_INPUT, "Proof is empty");
        }
        Account signer = requireAccount();

        long fee = calculateFee(amount);
        TransactionInstruction ix = unshieldBuilder.build(proof, nullifier, amount, recipientKey, signer.getPublicKey(), denomination);

        // Full amount goes on-chain; the fee is accounted off-chain.
        String signature;
        try {
            signature = submitAndConfirm(List.of(ix));
        } catch (RuntimeException e) {
            log.error("Unshield transaction failed: recipient={}, amount={}", recipient, amount, e);
            throw new RelayerException(RelayerException.Kind.CHAIN_REJECTED,
                    "Failed to submit transaction: " + e.getMessage(), e);
        }

        log.info("Unshield relayed: signature={}, recipient={}, amount={}, fee={}", signature, recipient, amount, fee);
        return new RelayResult(signature, fee, amount, recipient);
    }

    public long getBalance() {
        return rpc.getBalance(getPublicKey());
    }

    /**
     * Signs relayer-built instructions (fee paid by the relayer), submits and waits for confirmation.
     */
    public String submitAndConfirm(List<TransactionInstruction> instructions) {
        String signature = rpc.sendTransaction(instructions, requireAccount());
        rpc.confirmTransaction(signature);
        return signature;
    }

    /**
     * Adds the relayer signature to a transaction built by a third party and submits it.
     * The caller confirms.
     */
    public String signAndSubmit(byte[] unsignedTransaction) {
        byte[] signed = VersionedTransactions.sign(unsignedTransaction, requireAccount());
        return rpc.sendRawTransaction(signed);
    }

    public void confirm(String signature) {
        rpc.confirmTransaction(signature);
    }

    /**
     * Devnet only: asks the faucet for SOL when the relayer runs low. Never fails the caller.
     */
    public void ensureFunded() {
        RelayerProperties.DevnetAirdrop airdrop = props.getDevnetAirdrop();
        if (!airdrop.isEnabled() || account == null) {
            return;
        }
        try {
            long balance = getBalance();
            if (balance >= airdrop.getMinBalanceLamports()) {
                return;
            }
            log.info("Relayer balance low ({} lamports), requesting airdrop of {}", balance, airdrop.getAmountLamports());
            String signature = rpc.requestAirdrop(account.getPublicKey(), airdrop.getAmountLamports());
            log.info("Airdrop requested: {}", signature);
            sleeper.sleep(airdrop.getSettleDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for airdrop to settle");
        } catch (RuntimeException e) {
            log.warn("Airdrop failed (may be rate-limited): {}", e.getMessage());
        }
    }

    private Account requireAccount() {
        if (account == null) {
            throw new RelayerException(RelayerException.Kind.DISABLED, "Relayer key is not configured");
        }
        return account;
    }
}
