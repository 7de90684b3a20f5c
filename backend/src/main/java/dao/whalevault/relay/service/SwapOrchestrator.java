package dao.whalevault.relay.service;

import dao.whalevault.relay.config.SwapProperties;
import dao.whalevault.relay.exception.JobNotFoundException;
import dao.whalevault.relay.exception.JobNotReadyException;
import dao.whalevault.relay.exception.RelayerException;
import dao.whalevault.relay.exception.ValidationException;
import dao.whalevault.relay.model.JobStatus;
import dao.whalevault.relay.model.ProofJob;
import dao.whalevault.relay.model.ProofResult;
import dao.whalevault.relay.model.Quote;
import dao.whalevault.relay.model.RelayResult;
import dao.whalevault.relay.model.SwapOutcome;
import dao.whalevault.relay.model.SwapRequest;
import dao.whalevault.relay.model.TokenProgramType;
import dao.whalevault.relay.solana.PublicKeys;
import dao.whalevault.relay.solana.SolanaConstants;
import dao.whalevault.relay.swap.SwapRouter;
import dao.whalevault.relay.swap.SwapRouterRegistry;
import dao.whalevault.relay.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.core.TransactionInstruction;
import org.p2p.solanaj.programs.SystemProgram;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Unshield-and-swap saga: quote, unshield into the relayer, swap, verify arrival, forward to the recipient.
 *
 * <p>Nothing moves before the quote succeeds. Once the unshield confirms the funds are custodial and the
 * saga always returns a {@link SwapOutcome} carrying the unshield signature; failures after that point
 * are reported through empty outcome fields, never as exceptions. On the two-transaction path a failed
 * swap leg falls back to sending SOL straight to the recipient; a failed direct-routing swap leaves the
 * SOL with the relayer.
 *
 * <p>Two-transaction routers deliver into the relayer's own token account. The swap, the arrival check and
 * the forward run under that account's {@link CustodialAccountGuard}, so the forwarded amount is exactly
 * the balance increase caused by this swap.
 */
@Slf4j
@Service
public class SwapOrchestrator {

    private final ProofJobManager jobManager;
    private final RelayerService relayer;
    private final TokenAccountResolver tokenAccounts;
    private final SwapRouterRegistry routers;
    private final CustodialAccountGuard guard;
    private final SwapProperties props;
    private final Sleeper sleeper;

    public SwapOrchestrator(ProofJobManager jobManager,
                            RelayerService relayer,
                            TokenAccountResolver tokenAccounts,
                            SwapRouterRegistry routers,
                            CustodialAccountGuard guard,
                            SwapProperties props,
                            Sleeper sleeper) {
        this.jobManager = jobManager;
        this.relayer = relayer;
        this.tokenAccounts = tokenAccounts;
        this.routers = routers;
        this.guard = guard;
        this.props = props;
        this.sleeper = sleeper;
    }

    public SwapOutcome execute(SwapRequest request) {
        if (!relayer.isEnabled()) {
            throw new RelayerException(RelayerException.Kind.DISABLED, "Relayer service is currently disabled");
        }
        ProofJob job = jobManager.getStatus(request.getJobId())
                .orElseThrow(() -> new JobNotFoundException(request.getJobId()));
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new JobNotReadyException(job.getId(), job.getStatus());
        }
        ProofResult proof = job.getResult();
        if (proof == null) {
            throw new IllegalStateException("Completed proof job " + job.getId() + " has no result");
        }
        PublicKey recipient = parseAddress(request.getRecipient(), "recipient");
        PublicKey outputMint = parseAddress(request.getOutputMint(), "output mint");
        SwapRouter router = routers.resolve(request.getProvider());

        relayer.ensureFunded();

        long amount = job.getInputs().amount();
        Quote quote = router.getQuote(SolanaConstants.WRAPPED_SOL_MINT, outputMint.toBase58(), amount, props.getSlippageBps());
        log.info("{} quote: {} lamports -> {} of {} (min {})",
                router.providerId(), quote.inAmount(), quote.outAmount(), outputMint, quote.minimumReceived());

        TokenProgramType program = tokenAccounts.detectTokenProgram(outputMint);
        int decimals = tokenAccounts.readDecimals(outputMint);

        PublicKey relayerKey = relayer.getPublicKey();
        RelayResult unshield = relayer.relayUnshield(
                proof.nullifierBytes(), relayerKey.toBase58(), amount, proof.proofBytes(), job.getInputs().denomination());
        log.info("Unshield to relayer complete: {}", unshield.signature());

        SwapContext ctx = new SwapContext(router, quote, unshield, relayerKey, recipient, request.getRecipient(),
                outputMint, program, decimals, amount);
        try {
            return router.supportsDirectRouting() ? swapDirect(ctx) : guard.withAccount(
                    tokenAccounts.deriveAccount(relayerKey, outputMint, program), () -> swapThenForward(ctx));
        } catch (RuntimeException e) {
            log.error("CRITICAL: swap saga aborted after unshield. Funds with relayer. recipient={}, amount={}, mint={}, unshield={}",
                    request.getRecipient(), amount, outputMint, unshield.signature(), e);
            return SwapOutcome.unshieldOnly(unshield, outputMint.toBase58(), request.getRecipient());
        }
    }

    private SwapOutcome swapDirect(SwapContext ctx) {
        PublicKey destination = tokenAccounts.deriveAccount(ctx.recipient(), ctx.outputMint(), ctx.program());
        ensureRecipientAccount(ctx);

        String swapSignature;
        try {
            swapSignature = submitSwap(ctx, destination);
        } catch (RuntimeException e) {
            log.error("CRITICAL: {} direct swap failed after unshield. SOL stays with relayer. recipient={}, amount={}, mint={}, unshield={}",
                    ctx.router().providerId(), ctx.recipientAddress(), ctx.amount(), ctx.outputMint(), ctx.unshield().signature(), e);
            return SwapOutcome.unshieldOnly(ctx.unshield(), ctx.outputMint().toBase58(), ctx.recipientAddress());
        }
        log.info("Swap confirmed, output routed to {}: {}", destination, swapSignature);
        return new SwapOutcome(ctx.unshield().signature(), swapSignature, SwapOutcome.NONE,
                String.valueOf(ctx.quote().outAmount()), ctx.outputMint().toBase58(), ctx.recipientAddress(),
                ctx.unshield().feePaid());
    }

    /**
     * Runs with the relayer's token account guarded.
     */
    private SwapOutcome swapThenForward(SwapContext ctx) {
        PublicKey relayerAccount = tokenAccounts.deriveAccount(ctx.relayerKey(), ctx.outputMint(), ctx.program());
        PublicKey recipientAccount = tokenAccounts.deriveAccount(ctx.recipient(), ctx.outputMint(), ctx.program());
        ensureRecipientAccount(ctx);

        long before;
        try {
            before = tokenAccounts.balanceOrZero(relayerAccount);
        } catch (RuntimeException e) {
            log.error("Cannot read relayer token balance before swap, arrival would be unmeasurable: {}", e.getMessage());
            return fallback(ctx);
        }

        String swapSignature;
        try {
            swapSignature = submitSwap(ctx, null);
        } catch (RuntimeException e) {
            log.error("{} swap failed after unshield, attempting SOL fallback: {}", ctx.router().providerId(), e.getMessage(), e);
            return fallback(ctx);
        }
        log.info("Swap confirmed: {}", swapSignature);

        long arrived = awaitArrival(relayerAccount, before);
        if (arrived <= 0) {
            log.error("Swap {} confirmed but no tokens visible in {}, attempting SOL fallback", swapSignature, relayerAccount);
            return fallback(ctx);
        }
        log.info("Tokens received in relayer account: {} (quote was {})", arrived, ctx.quote().outAmount());

        if (!recipientAccountExists(recipientAccount)) {
            ensureRecipientAccount(ctx);
        }

        TransactionInstruction transfer = tokenAccounts.buildTransferInstruction(relayerAccount, recipientAccount,
                ctx.relayerKey(), arrived, ctx.program(), ctx.outputMint(), ctx.decimals());
        String transferSignature = transferWithRetry(transfer);
        if (transferSignature == null) {
            log.error("CRITICAL: transfer failed after {} attempts. Tokens in relayer account {}. swap={}, recipient={}, amount={}, mint={}",
                    props.getTransferAttempts(), relayerAccount, swapSignature, ctx.recipientAddress(), arrived, ctx.outputMint());
            return new SwapOutcome(ctx.unshield().signature(), swapSignature, SwapOutcome.NONE,
                    String.valueOf(arrived), ctx.outputMint().toBase58(), ctx.recipientAddress(), ctx.unshield().feePaid());
        }
        return new SwapOutcome(ctx.unshield().signature(), swapSignature, transferSignature,
                String.valueOf(arrived), ctx.outputMint().toBase58(), ctx.recipientAddress(), ctx.unshield().feePaid());
    }

    private String submitSwap(SwapContext ctx, PublicKey destination) {
        byte[] unsigned = ctx.router().getSwapTransaction(ctx.quote(), ctx.relayerKey(), destination);
        String signature = relayer.signAndSubmit(unsigned);
        log.info("{} swap submitted: {}", ctx.router().providerId(), signature);
        relayer.confirm(signature);
        return signature;
    }

    /**
     * @return increase of the account balance over {@code before}, 0 if none became visible
     */
    private long awaitArrival(PublicKey account, long before) {
        int attempts = Math.max(1, props.getBalancePollAttempts());
        for (int i = 0; i < attempts; i++) {
            try {
                long delta = tokenAccounts.balanceOrZero(account) - before;
                if (delta > 0) {
                    return delta;
                }
            } catch (RuntimeException e) {
                log.warn("Balance check {}/{} failed: {}", i + 1, attempts, e.getMessage());
            }
            if (i < attempts - 1 && !pause(props.getBalancePollDelayMs())) {
                break;
            }
        }
        return 0L;
    }

    private String transferWithRetry(TransactionInstruction transfer) {
        int attempts = Math.max(1, props.getTransferAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                String signature = relayer.submitAndConfirm(List.of(transfer));
                log.info("Token transfer succeeded on attempt {}: {}", attempt, signature);
                return signature;
            } catch (RuntimeException e) {
                log.warn("Transfer attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
            }
            if (attempt < attempts && !pause(props.getTransferRetryDelayMs())) {
                break;
            }
        }
        return null;
    }

    /**
     * Sends the un-swapped SOL to the recipient, bounded by both the intended amount and what the relayer
     * can spare. Sizing and submission hold the relayer's SOL account guard.
     */
    private SwapOutcome fallback(SwapContext ctx) {
        return guard.withAccount(ctx.relayerKey(), () -> {
            RelayResult unshield = ctx.unshield();
            long intended = ctx.amount() - unshield.feePaid();
            long available;
            try {
                available = relayer.getBalance() - props.getFallbackReserveLamports();
            } catch (RuntimeException e) {
                log.error("CRITICAL: cannot read relayer balance for SOL fallback. SOL stays with relayer. recipient={}, amount={}, unshield={}",
                        ctx.recipientAddress(), intended, unshield.signature(), e);
                return SwapOutcome.unshieldOnly(unshield, ctx.outputMint().toBase58(), ctx.recipientAddress());
            }

            long lamports = Math.min(intended, available);
            if (lamports <= 0) {
                log.error("CRITICAL: insufficient SOL for fallback. available={}, intended={}, reserve={}, recipient={}, unshield={}",
                        available, intended, props.getFallbackReserveLamports(), ctx.recipientAddress(), unshield.signature());
                return SwapOutcome.unshieldOnly(unshield, ctx.outputMint().toBase58(), ctx.recipientAddress());
            }

            try {
                String signature = relayer.submitAndConfirm(List.of(
                        SystemProgram.transfer(ctx.relayerKey(), ctx.recipient(), lamports)));
                log.info("Fallback: sent {} lamports to {}: {}", lamports, ctx.recipientAddress(), signature);
                return new SwapOutcome(unshield.signature(), SwapOutcome.NONE, signature, String.valueOf(lamports),
                        SolanaConstants.WRAPPED_SOL_MINT, ctx.recipientAddress(), unshield.feePaid());
            } catch (RuntimeException e) {
                log.error("CRITICAL: swap and fallback failed. SOL stuck in relayer. recipient={}, amount={}, unshield={}",
                        ctx.recipientAddress(), lamports, unshield.signature(), e);
                return SwapOutcome.unshieldOnly(unshield, ctx.outputMint().toBase58(), ctx.recipientAddress());
            }
        });
    }

    private void ensureRecipientAccount(SwapContext ctx) {
        try {
            if (tokenAccounts.ensureAccountExists(ctx.recipient(), ctx.outputMint(), ctx.program())) {
                log.info("Created token account for recipient {}", ctx.recipientAddress());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to create recipient token account (may already exist): {}", e.getMessage());
        }
    }

    private boolean recipientAccountExists(PublicKey account) {
        try {
            return tokenAccounts.accountExists(account);
        } catch (RuntimeException e) {
            log.warn("Recipient account check failed: {}", e.getMessage());
            return true;
        }
    }

    private boolean pause(long millis) {
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting, continuing without further delay");
            return false;
        }
    }

    private static PublicKey parseAddress(String value, String field) {
        PublicKey key = PublicKeys.tryParse(value);
        if (key == null) {
            throw new ValidationException("Invalid " + field + " address: " + value);
        }
        return key;
    }

    private record SwapContext(SwapRouter router, Quote quote, RelayResult unshield, PublicKey relayerKey,
                               PublicKey recipient, String recipientAddress, PublicKey outputMint,
                               TokenProgramType program, int decimals, long amount) {}
}
