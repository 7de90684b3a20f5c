package dao.whalevault.relay.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dao.whalevault.relay.config.SwapProperties;
import dao.whalevault.relay.exception.AggregatorException;
import dao.whalevault.relay.exception.JobNotFoundException;
import dao.whalevault.relay.exception.JobNotReadyException;
import dao.whalevault.relay.exception.SolanaRpcException;
import dao.whalevault.relay.exception.ValidationException;
import dao.whalevault.relay.model.ProofInputs;
import dao.whalevault.relay.model.ProofJob;
import dao.whalevault.relay.model.Quote;
import dao.whalevault.relay.model.RelayResult;
import dao.whalevault.relay.model.SwapOutcome;
import dao.whalevault.relay.model.SwapRequest;
import dao.whalevault.relay.model.TokenProgramType;
import dao.whalevault.relay.service.proof.PlaceholderProofGenerator;
import dao.whalevault.relay.solana.AccountInfo;
import dao.whalevault.relay.solana.RelayerAccounts;
import dao.whalevault.relay.solana.SolanaConstants;
import dao.whalevault.relay.solana.SolanaRpcClient;
import dao.whalevault.relay.swap.SwapRouter;
import dao.whalevault.relay.swap.SwapRouterRegistry;
import dao.whalevault.relay.util.ByteUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.MockitoAnnotations;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.core.TransactionInstruction;
import org.p2p.solanaj.programs.SystemProgram;
import org.p2p.solanaj.programs.TokenProgram;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SwapOrchestratorTest {

    private static final String JOB_ID = "job-1";
    private static final long AMOUNT = 2_000_000_000L;
    private static final long FEE = 6_000_000L;
    private static final PublicKey RELAYER = RelayerAccounts.fromSeed(RelayerServiceTest.SEED).getPublicKey();
    private static final PublicKey RECIPIENT = new PublicKey("9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM");
    private static final PublicKey MINT = new PublicKey("EPjFWdd5AufqSWzAxZ3t9SpJrN4wxAaCDMx4G6ZQbbzG");

    @Captor
    private ArgumentCaptor<List<TransactionInstruction>> sent;

    private AutoCloseable mocks;
    private ProofJobManager jobs;
    private RelayerService relayer;
    private SolanaRpcClient rpc;
    private TokenAccountResolver tokenAccounts;
    private SwapRouter twoTxRouter;
    private SwapRouter directRouter;
    private SwapProperties props;
    private SwapOrchestrator orchestrator;

    private PublicKey relayerAccount;
    private PublicKey recipientAccount;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        jobs = mock(ProofJobManager.class);
        relayer = mock(RelayerService.class);
        rpc = mock(SolanaRpcClient.class);
        twoTxRouter = router("raydium", false);
        directRouter = router("jupiter", true);
        props = new SwapProperties();
        props.setDefaultProvider("raydium");

        tokenAccounts = new TokenAccountResolver(rpc, relayer);
        relayerAccount = tokenAccounts.deriveAccount(RELAYER, MINT, TokenProgramType.STANDARD);
        recipientAccount = tokenAccounts.deriveAccount(RECIPIENT, MINT, TokenProgramType.STANDARD);

        orchestrator = new SwapOrchestrator(jobs, relayer, tokenAccounts,
                new SwapRouterRegistry(List.of(twoTxRouter, directRouter), props),
                new CustodialAccountGuard(), props, millis -> { });

        when(jobs.getStatus(JOB_ID)).thenReturn(Optional.of(completedJob()));
        when(relayer.isEnabled()).thenReturn(true);
        when(relayer.getPublicKey()).thenReturn(RELAYER);
        when(relayer.relayUnshield(any(byte[].class), anyString(), anyLong(), any(byte[].class), anyLong()))
                .thenReturn(new RelayResult("unshieldSig", FEE, AMOUNT, RELAYER.toBase58()));
        when(relayer.signAndSubmit(any())).thenReturn("swapSig");

        byte[] mintData = new byte[82];
        mintData[44] = 6;
        when(rpc.getAccountInfo(MINT)).thenReturn(Optional.of(new AccountInfo(TokenProgram.PROGRAM_ID, 1L, mintData)));
        AccountInfo tokenAccount = new AccountInfo(TokenProgram.PROGRAM_ID, 2_039_280L, new byte[165]);
        when(rpc.getAccountInfo(recipientAccount)).thenReturn(Optional.of(tokenAccount));
        when(rpc.getAccountInfo(relayerAccount)).thenReturn(Optional.of(tokenAccount));
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void quoteFailureMovesNoFunds() {
        when(twoTxRouter.getQuote(any(), any(), anyLong(), eq(100)))
                .thenThrow(AggregatorException.permanent("ROUTE_NOT_FOUND", 400));

        assertThrows(AggregatorException.class, () -> orchestrator.execute(request(null)));
        verify(relayer, never()).relayUnshield(any(), any(), anyLong(), any(), anyLong());
    }

    @Test
    void jobPreconditionsAreCheckedBeforeQuote() {
        when(jobs.getStatus("missing")).thenReturn(Optional.empty());
        ProofJob pending = new ProofJob("pending", inputs(), Instant.now());
        when(jobs.getStatus("pending")).thenReturn(Optional.of(pending));

        assertThrows(JobNotFoundException.class, () -> orchestrator.execute(
                new SwapRequest("missing", MINT.toBase58(), RECIPIENT.toBase58(), null)));
        JobNotReadyException notReady = assertThrows(JobNotReadyException.class, () -> orchestrator.execute(
                new SwapRequest("pending", MINT.toBase58(), RECIPIENT.toBase58(), null)));
        assertEquals(400, notReady.getStatus());
        assertThrows(ValidationException.class, () -> orchestrator.execute(
                new SwapRequest(JOB_ID, MINT.toBase58(), "bogus", null)));

        verify(twoTxRouter, never()).getQuote(any(), any(), anyLong(), anyInt());
        verify(relayer, never()).relayUnshield(any(), any(), anyLong(), any(), anyLong());
    }

    @Test
    void unshieldsIntoRelayerAccount() {
        quoteSucceeds(twoTxRouter);
        when(rpc.getTokenAccountBalance(relayerAccount)).thenReturn(0L, 150_000_000L);
        when(relayer.submitAndConfirm(any())).thenReturn("transferSig");

        orchestrator.execute(request(null));

        verify(relayer).relayUnshield(any(byte[].class), eq(RELAYER.toBase58()), eq(AMOUNT), any(byte[].class), eq(0L));
    }

    @Test
    void twoTransactionSwapForwardsExactlyWhatArrived() {
        quoteSucceeds(twoTxRouter);
        when(rpc.getTokenAccountBalance(relayerAccount)).thenReturn(1_000L, 1_000L, 151_000L);
        when(relayer.submitAndConfirm(any())).thenReturn("transferSig");

        SwapOutcome outcome = orchestrator.execute(request(null));

        assertEquals("unshieldSig", outcome.unshieldSignature());
        assertEquals("swapSig", outcome.swapSignature());
        assertEquals("transferSig", outcome.transferSignature());
        assertEquals("150000", outcome.outputAmount());
        assertEquals(MINT.toBase58(), outcome.outputMint());
        assertEquals(FEE, outcome.fee());

        verify(relayer).submitAndConfirm(sent.capture());
        TransactionInstruction transfer = sent.getValue().get(0);
        assertEquals(relayerAccount, transfer.getKeys().get(0).getPublicKey());
        assertEquals(recipientAccount, transfer.getKeys().get(1).getPublicKey());
        assertEquals(150_000L, ByteUtil.readU64le(transfer.getData(), 1));
        verify(relayer).confirm("swapSig");
        verify(twoTxRouter).getSwapTransaction(any(), eq(RELAYER), isNull());
    }

    @Test
    @DisplayName("swap build failure falls back to SOL bounded by intended amount")
    void swapFailureFallsBackToSol() {
        quoteSucceeds(twoTxRouter);
        when(twoTxRouter.getSwapTransaction(any(), any(), any())).thenThrow(AggregatorException.permanent("bad tx", 400));
        when(relayer.getBalance()).thenReturn(3_000_000_000L);
        when(relayer.submitAndConfirm(any())).thenReturn("fallbackSig");

        SwapOutcome outcome = orchestrator.execute(request(null));

        assertEquals("unshieldSig", outcome.unshieldSignature());
        assertEquals("", outcome.swapSignature());
        assertEquals("fallbackSig", outcome.transferSignature());
        assertEquals(String.valueOf(AMOUNT - FEE), outcome.outputAmount());
        assertEquals(SolanaConstants.WRAPPED_SOL_MINT, outcome.outputMint());
    }

    @Test
    void fallbackNeverExceedsBalanceMinusReserve() {
        quoteSucceeds(twoTxRouter);
        when(relayer.signAndSubmit(any())).thenThrow(new SolanaRpcException("blockhash not found"));
        when(relayer.getBalance()).thenReturn(1_000_000_000L);
        when(relayer.submitAndConfirm(any())).thenReturn("fallbackSig");

        SwapOutcome outcome = orchestrator.execute(request(null));

        long expected = 1_000_000_000L - props.getFallbackReserveLamports();
        assertEquals(String.valueOf(expected), outcome.outputAmount());
        verify(relayer).submitAndConfirm(sent.capture());
        TransactionInstruction transfer = sent.getValue().get(0);
        assertEquals(SystemProgram.PROGRAM_ID, transfer.getProgramId());
        assertEquals(RECIPIENT, transfer.getKeys().get(1).getPublicKey());
        assertEquals(expected, ByteUtil.readU64le(transfer.getData(), 4));
    }

    @Test
    void noFallbackWhenBalanceCannotCoverReserve() {
        quoteSucceeds(twoTxRouter);
        when(relayer.signAndSubmit(any())).thenThrow(new SolanaRpcException("insufficient funds"));
        when(relayer.getBalance()).thenReturn(4_000L);

        SwapOutcome outcome = orchestrator.execute(request(null));

        assertUnshieldOnly(outcome);
        verify(relayer, never()).submitAndConfirm(any());
    }

    @Test
    void noFallbackWhenBalanceIsUnreadable() {
        quoteSucceeds(twoTxRouter);
        when(relayer.signAndSubmit(any())).thenThrow(new SolanaRpcException("node behind"));
        when(relayer.getBalance()).thenThrow(new SolanaRpcException("node behind"));

        assertUnshieldOnly(orchestrator.execute(request(null)));
        verify(relayer, never()).submitAndConfirm(any());
    }

    @Test
    void failedFallbackTransferLeavesUnshieldOnlyOutcome() {
        quoteSucceeds(twoTxRouter);
        when(relayer.signAndSubmit(any())).thenThrow(new SolanaRpcException("swap rejected"));
        when(relayer.getBalance()).thenReturn(3_000_000_000L);
        when(relayer.submitAndConfirm(any())).thenThrow(new SolanaRpcException("fallback rejected"));

        assertUnshieldOnly(orchestrator.execute(request(null)));
    }

    @Test
    void nothingArrivingAfterConfirmedSwapTriggersFallback() {
        quoteSucceeds(twoTxRouter);
        when(rpc.getTokenAccountBalance(relayerAccount)).thenReturn(0L);
        when(relayer.getBalance()).thenReturn(3_000_000_000L);
        when(relayer.submitAndConfirm(any())).thenReturn("fallbackSig");

        SwapOutcome outcome = orchestrator.execute(request(null));

        assertEquals("", outcome.swapSignature());
        assertEquals("fallbackSig", outcome.transferSignature());
        assertEquals(SolanaConstants.WRAPPED_SOL_MINT, outcome.outputMint());
        verify(rpc, times(1 + props.getBalancePollAttempts())).getTokenAccountBalance(relayerAccount);
    }

    @Test
    void exhaustedTransferReportsObservedBalance() {
        quoteSucceeds(twoTxRouter);
        when(rpc.getTokenAccountBalance(relayerAccount)).thenReturn(0L, 0L, 0L, 123_456_789L);
        when(relayer.submitAndConfirm(any())).thenThrow(new SolanaRpcException("account in use"));

        SwapOutcome outcome = orchestrator.execute(request(null));

        assertEquals("unshieldSig", outcome.unshieldSignature());
        assertEquals("swapSig", outcome.swapSignature());
        assertEquals("", outcome.transferSignature());
        assertEquals("123456789", outcome.outputAmount());
        assertEquals(MINT.toBase58(), outcome.outputMint());
        verify(relayer, times(props.getTransferAttempts())).submitAndConfirm(any());
        verify(relayer, never()).getBalance();
    }

    @Test
    void directRoutingDeliversToRecipientAccount() {
        quoteSucceeds(directRouter);

        SwapOutcome outcome = orchestrator.execute(request("jupiter"));

        assertEquals("swapSig", outcome.swapSignature());
        assertEquals("", outcome.transferSignature());
        assertEquals("150000000", outcome.outputAmount());
        verify(directRouter).getSwapTransaction(any(), eq(RELAYER), eq(recipientAccount));
        verify(rpc, never()).getTokenAccountBalance(any());
        verify(relayer, never()).submitAndConfirm(any());
    }

    @Test
    void missingRecipientAccountIsCreatedBeforeSwap() {
        quoteSucceeds(directRouter);
        when(rpc.getAccountInfo(recipientAccount)).thenReturn(Optional.empty());
        when(relayer.submitAndConfirm(any())).thenReturn("createSig");

        SwapOutcome outcome = orchestrator.execute(request("jupiter"));

        assertTrue(outcome.swapCompleted());
        verify(relayer).submitAndConfirm(any());
    }

    @Test
    @DisplayName("failed direct-routing swap leaves the SOL with the relayer")
    void failedDirectSwapIsUnshieldOnly() {
        quoteSucceeds(directRouter);
        when(relayer.signAndSubmit(any())).thenThrow(new SolanaRpcException("slippage exceeded"));
        when(relayer.getBalance()).thenReturn(3_000_000_000L);

        SwapOutcome outcome = orchestrator.execute(request("jupiter"));

        assertFalse(outcome.swapCompleted());
        assertUnshieldOnly(outcome);
        verify(relayer, never()).submitAndConfirm(any());
        verify(relayer, never()).getBalance();
    }

    private void assertUnshieldOnly(SwapOutcome outcome) {
        assertEquals("unshieldSig", outcome.unshieldSignature());
        assertEquals("", outcome.swapSignature());
        assertEquals("", outcome.transferSignature());
        assertEquals("0", outcome.outputAmount());
        assertEquals(MINT.toBase58(), outcome.outputMint());
    }

    private void quoteSucceeds(SwapRouter router) {
        Quote quote = new Quote(router.providerId(), SolanaConstants.WRAPPED_SOL_MINT, MINT.toBase58(), AMOUNT,
                150_000_000L, 148_500_000L, 100, "0.1", JsonNodeFactory.instance.objectNode());
        when(router.getQuote(SolanaConstants.WRAPPED_SOL_MINT, MINT.toBase58(), AMOUNT, 100)).thenReturn(quote);
        when(router.getSwapTransaction(any(), any(), any())).thenReturn(new byte[]{1});
    }

    private static SwapRouter router(String id, boolean direct) {
        SwapRouter router = mock(SwapRouter.class);
        when(router.providerId()).thenReturn(id);
        when(router.supportsDirectRouting()).thenReturn(direct);
        return router;
    }

    private static SwapRequest request(String provider) {
        return new SwapRequest(JOB_ID, MINT.toBase58(), RECIPIENT.toBase58(), provider);
    }

    private static ProofInputs inputs() {
        return new ProofInputs("ab".repeat(32), "cd".repeat(32), AMOUNT, RECIPIENT.toBase58(), 0L);
    }

    private static ProofJob completedJob() {
        ProofJob job = new ProofJob(JOB_ID, inputs(), Instant.now());
        job.markProcessing();
        job.complete(new PlaceholderProofGenerator().generate(inputs()));
        return job.snapshot();
    }
}
