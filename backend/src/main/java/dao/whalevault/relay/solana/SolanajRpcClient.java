package dao.whalevault.relay.solana;

import dao.whalevault.relay.config.SolanaProperties;
import dao.whalevault.relay.exception.SolanaRpcException;
import dao.whalevault.relay.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.p2p.solanaj.core.Account;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.core.Transaction;
import org.p2p.solanaj.core.TransactionInstruction;
import org.p2p.solanaj.rpc.RpcApi;
import org.p2p.solanaj.rpc.RpcClient;
import org.p2p.solanaj.rpc.RpcException;
import org.p2p.solanaj.rpc.types.ConfirmedTransaction;
import org.p2p.solanaj.rpc.types.SignatureStatuses;
import org.p2p.solanaj.rpc.types.config.Commitment;
import org.p2p.solanaj.rpc.types.config.RpcSendTransactionConfig;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class SolanajRpcClient implements SolanaRpcClient {

    private final RpcApi api;
    private final SolanaProperties props;
    private final Commitment commitment;
    private final Clock clock;
    private final Sleeper sleeper;

    public SolanajRpcClient(RpcClient rpcClient, SolanaProperties props, Clock clock, Sleeper sleeper) {
        this.api = rpcClient.getApi();
        this.props = props;
        this.commitment = Commitment.valueOf(props.getCommitment().toUpperCase(Locale.ROOT));
        this.clock = clock;
        this.sleeper = sleeper;
        log.info("SolanajRpcClient initialized: rpcUrl={}, commitment={}", props.getRpcUrl(), commitment.getValue());
    }

    @Override
    public Optional<AccountInfo> getAccountInfo(PublicKey account) {
        org.p2p.solanaj.rpc.types.AccountInfo info;
        try {
            info = api.getAccountInfo(account, Map.of("encoding", "base64", "commitment", commitment.getValue()));
        } catch (RpcException e) {
            throw new SolanaRpcException("getAccountInfo failed for " + account + ": " + e.getMessage(), e);
        }
        if (info == null || info.getValue() == null) {
            return Optional.empty();
        }
        org.p2p.solanaj.rpc.types.AccountInfo.Value value = info.getValue();
        List<String> data = value.getData();
        byte[] raw = data != null && !data.isEmpty() && data.get(0) != null
                ? Base64.getDecoder().decode(data.get(0))
                : new byte[0];
        return Optional.of(new AccountInfo(new PublicKey(value.getOwner()), (long) value.getLamports(), raw));
    }

    @Override
    public long getBalance(PublicKey account) {
        try {
            return api.getBalance(account, commitment);
        } catch (RpcException e) {
            throw new SolanaRpcException("getBalance failed for " + account + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String sendTransaction(List<TransactionInstruction> instructions, Account signer) {
        Transaction transaction = new Transaction();
        instructions.forEach(transaction::addInstruction);
        try {
            String blockhash = api.getLatestBlockhash(commitment).getValue().getBlockhash();
            return requireSignature(api.sendTransaction(transaction, List.of(signer), blockhash, sendConfig()));
        } catch (RpcException e) {
            throw new SolanaRpcException("sendTransaction failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String sendRawTransaction(byte[] signedTransaction) {
        try {
            return requireSignature(api.sendRawTransaction(Base64.getEncoder().encodeToString(signedTransaction), sendConfig()));
        } catch (RpcException e) {
            throw new SolanaRpcException("sendTransaction failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void confirmTransaction(String signature) {
        SolanaProperties.Polling polling = props.getPolling();
        long deadline = clock.millis() + Duration.ofSeconds(polling.getConfirmTimeoutSeconds()).toMillis();
        long sleepMs = Math.max(100, polling.getPollInitialMs());
        long maxSleepMs = Math.max(sleepMs, polling.getPollMaxMs());

        while (clock.millis() < deadline) {
            if (reachedCommitment(statusOf(signature))) {
                failIfErrored(signature);
                return;
            }
            try {
                sleeper.sleep(sleepMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new SolanaRpcException("Interrupted while confirming " + signature, ie);
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        throw new SolanaRpcException("Transaction not confirmed within " + polling.getConfirmTimeoutSeconds()
                + "s. signature=" + signature);
    }

    @Override
    public long getTokenAccountBalance(PublicKey tokenAccount) {
        String amount;
        try {
            amount = api.getTokenAccountBalance(tokenAccount, commitment).getAmount();
        } catch (RpcException e) {
            throw new SolanaRpcException("getTokenAccountBalance failed for " + tokenAccount + ": " + e.getMessage(), e);
        }
        try {
            return Long.parseLong(amount);
        } catch (NumberFormatException e) {
            throw new SolanaRpcException("getTokenAccountBalance returned invalid amount: '" + amount + "'", e);
        }
    }

    @Override
    public String requestAirdrop(PublicKey account, long lamports) {
        try {
            return api.requestAirdrop(account, lamports, commitment);
        } catch (RpcException e) {
            throw new SolanaRpcException("requestAirdrop failed for " + account + ": " + e.getMessage(), e);
        }
    }

    private String statusOf(String signature) {
        try {
            SignatureStatuses statuses = api.getSignatureStatuses(List.of(signature), true);
            if (statuses == null || statuses.getValue() == null || statuses.getValue().isEmpty()) {
                return "";
            }
            SignatureStatuses.Value status = statuses.getValue().get(0);
            return status == null || status.getConfirmationStatus() == null ? "" : status.getConfirmationStatus();
        } catch (RpcException e) {
            log.debug("Signature status not available yet for {}: {}", signature, e.getMessage());
            return "";
        }
    }

    // Signature statuses omit the error; it is read from the transaction meta.
    private void failIfErrored(String signature) {
        ConfirmedTransaction tx;
        try {
            tx = api.getTransaction(signature, commitment == Commitment.FINALIZED ? Commitment.FINALIZED : Commitment.CONFIRMED);
        } catch (RpcException e) {
            throw new SolanaRpcException("getTransaction failed for " + signature + ": " + e.getMessage(), e);
        }
        if (tx != null && tx.getMeta() != null && tx.getMeta().getErr() != null) {
            throw new SolanaRpcException("Transaction failed on-chain: " + tx.getMeta().getErr() + ". signature=" + signature);
        }
    }

    private boolean reachedCommitment(String confirmationStatus) {
        if ("finalized".equals(confirmationStatus)) return true;
        if ("confirmed".equals(confirmationStatus)) return commitment != Commitment.FINALIZED;
        return "processed".equals(confirmationStatus) && commitment == Commitment.PROCESSED;
    }

    private RpcSendTransactionConfig sendConfig() {
        return RpcSendTransactionConfig.builder()
                .encoding(RpcSendTransactionConfig.Encoding.base64)
                .build();
    }

    private static String requireSignature(String signature) {
        if (signature == null || signature.isEmpty()) {
            throw new SolanaRpcException("sendTransaction returned no signature");
        }
        return signature;
    }
}
