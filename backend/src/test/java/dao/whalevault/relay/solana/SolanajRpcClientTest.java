package dao.whalevault.relay.solana;

import dao.whalevault.relay.config.SolanaProperties;
import dao.whalevault.relay.exception.SolanaRpcException;
import dao.whalevault.relay.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.programs.TokenProgram;
import org.p2p.solanaj.rpc.RpcApi;
import org.p2p.solanaj.rpc.RpcClient;
import org.p2p.solanaj.rpc.RpcException;
import org.p2p.solanaj.rpc.types.ConfirmedTransaction;
import org.p2p.solanaj.rpc.types.SignatureStatuses;
import org.p2p.solanaj.rpc.types.config.Commitment;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SolanajRpcClientTest {

    private static final String SIGNATURE = "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW";
    private static final PublicKey ACCOUNT = new PublicKey("9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM");

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final List<Long> sleeps = new ArrayList<>();
    private RpcApi api;
    private SolanajRpcClient client;

    @BeforeEach
    void setUp() {
        RpcClient rpcClient = mock(RpcClient.class);
        api = mock(RpcApi.class);
        when(rpcClient.getApi()).thenReturn(api);
        client = new SolanajRpcClient(rpcClient, new SolanaProperties(), clock, millis -> {
            sleeps.add(millis);
            clock.advance(Duration.ofMillis(millis));
        });
    }

    @Test
    void confirmationPollsWithGrowingDelayUntilCommitmentIsReached() throws Exception {
        SignatureStatuses processed = statuses("processed");
        SignatureStatuses confirmed = statuses("confirmed");
        ConfirmedTransaction succeeded = transaction(null);
        when(api.getSignatureStatuses(List.of(SIGNATURE), true)).thenReturn(processed, processed, confirmed);
        when(api.getTransaction(SIGNATURE, Commitment.CONFIRMED)).thenReturn(succeeded);

        client.confirmTransaction(SIGNATURE);

        assertThat(sleeps).containsExactly(250L, 375L);
    }

    @Test
    void confirmationGivesUpAfterTimeoutOnInjectedClock() throws Exception {
        SignatureStatuses unknown = statuses(null);
        when(api.getSignatureStatuses(anyList(), anyBoolean())).thenReturn(unknown);

        assertThatThrownBy(() -> client.confirmTransaction(SIGNATURE))
                .isInstanceOf(SolanaRpcException.class)
                .hasMessageContaining("not confirmed within 60s");

        assertThat(sleeps).startsWith(250L, 375L, 563L);
        assertThat(sleeps).allMatch(ms -> ms <= 2_000L);
        assertThat(sleeps.stream().mapToLong(Long::longValue).sum()).isGreaterThanOrEqualTo(60_000L);
        verify(api, never()).getTransaction(any(), any());
    }

    @Test
    void onChainErrorFailsConfirmation() throws Exception {
        SignatureStatuses confirmed = statuses("confirmed");
        ConfirmedTransaction failed = transaction(Map.of("InstructionError", List.of(0, Map.of("Custom", 6001))));
        when(api.getSignatureStatuses(anyList(), anyBoolean())).thenReturn(confirmed);
        when(api.getTransaction(SIGNATURE, Commitment.CONFIRMED)).thenReturn(failed);

        assertThatThrownBy(() -> client.confirmTransaction(SIGNATURE))
                .isInstanceOf(SolanaRpcException.class)
                .hasMessageContaining("failed on-chain");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void unavailableStatusIsRetried() throws Exception {
        SignatureStatuses finalized = statuses("finalized");
        ConfirmedTransaction succeeded = transaction(null);
        when(api.getSignatureStatuses(anyList(), anyBoolean()))
                .thenThrow(new RpcException("node is behind"))
                .thenReturn(finalized);
        when(api.getTransaction(SIGNATURE, Commitment.CONFIRMED)).thenReturn(succeeded);

        client.confirmTransaction(SIGNATURE);

        assertThat(sleeps).containsExactly(250L);
    }

    @Test
    void missingAccountIsEmptyAndExistingAccountIsDecoded() throws Exception {
        org.p2p.solanaj.rpc.types.AccountInfo missing = mock(org.p2p.solanaj.rpc.types.AccountInfo.class);
        when(api.getAccountInfo(any(PublicKey.class), anyMap())).thenReturn(missing);
        assertThat(client.getAccountInfo(ACCOUNT)).isEmpty();

        org.p2p.solanaj.rpc.types.AccountInfo.Value value = mock(org.p2p.solanaj.rpc.types.AccountInfo.Value.class);
        when(value.getData()).thenReturn(List.of(Base64.getEncoder().encodeToString(new byte[]{1, 2, 3}), "base64"));
        when(value.getLamports()).thenReturn(2_039_280d);
        when(value.getOwner()).thenReturn(TokenProgram.PROGRAM_ID.toBase58());
        org.p2p.solanaj.rpc.types.AccountInfo present = mock(org.p2p.solanaj.rpc.types.AccountInfo.class);
        when(present.getValue()).thenReturn(value);
        when(api.getAccountInfo(any(PublicKey.class), anyMap())).thenReturn(present);

        Optional<AccountInfo> info = client.getAccountInfo(ACCOUNT);

        assertThat(info).isPresent();
        assertThat(info.get().owner()).isEqualTo(TokenProgram.PROGRAM_ID);
        assertThat(info.get().lamports()).isEqualTo(2_039_280L);
        assertThat(info.get().data()).containsExactly(1, 2, 3);
    }

    @Test
    void rpcFailuresSurfaceAsSolanaRpcException() throws Exception {
        when(api.getBalance(ACCOUNT, Commitment.CONFIRMED)).thenThrow(new RpcException("connection refused"));

        assertThatThrownBy(() -> client.getBalance(ACCOUNT))
                .isInstanceOf(SolanaRpcException.class)
                .hasMessageContaining("connection refused");
    }

    private static SignatureStatuses statuses(String confirmationStatus) {
        SignatureStatuses statuses = mock(SignatureStatuses.class);
        if (confirmationStatus == null) {
            when(statuses.getValue()).thenReturn(Arrays.asList((SignatureStatuses.Value) null));
            return statuses;
        }
        SignatureStatuses.Value value = mock(SignatureStatuses.Value.class);
        when(value.getConfirmationStatus()).thenReturn(confirmationStatus);
        when(statuses.getValue()).thenReturn(List.of(value));
        return statuses;
    }

    private static ConfirmedTransaction transaction(Object err) {
        ConfirmedTransaction.Meta meta = mock(ConfirmedTransaction.Meta.class);
        when(meta.getErr()).thenReturn(err);
        ConfirmedTransaction tx = mock(ConfirmedTransaction.class);
        when(tx.getMeta()).thenReturn(meta);
        return tx;
    }
}
