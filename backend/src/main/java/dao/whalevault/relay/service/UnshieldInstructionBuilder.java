package dao.whalevault.relay.service;

import dao.whalevault.relay.config.RelayerProperties;
import dao.whalevault.relay.util.ByteUtil;
import org.p2p.solanaj.core.AccountMeta;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.core.TransactionInstruction;
import org.p2p.solanaj.programs.SystemProgram;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Encodes the pool program's {@code unshield_sol} instruction.
 * Account order MUST match the program's UnshieldSol context:
 * [pool, nullifier_marker, vault, recipient, relayer, system_program].
 */
@Component
public class UnshieldInstructionBuilder {

    static final byte[] DISCRIMINATOR = Arrays.copyOf(
            ByteUtil.sha256("global:unshield_sol".getBytes(StandardCharsets.UTF_8)), 8);

    private static final byte[] POOL_SEED = "pool".getBytes(StandardCharsets.UTF_8);
    private static final byte[] VAULT_SEED = "vault".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULLIFIER_SEED = "nullifier".getBytes(StandardCharsets.UTF_8);

    private final PublicKey programId;

    public UnshieldInstructionBuilder(RelayerProperties props) {
        this.programId = new PublicKey(props.getProgramId());
    }

    public TransactionInstruction build(byte[] proof, byte[] nullifier, long amount,
                             PublicKey recipient, PublicKey relayer, long denomination) {
        PublicKey pool = poolAddress(denomination);
        PublicKey vault = vaultAddress(pool);
        PublicKey nullifierMarker = nullifierMarkerAddress(pool, nullifier);

        // discriminator (8) | nullifier (32) | amount u64 LE | proof as Borsh Vec<u8>
        byte[] data = ByteUtil.concat(
                DISCRIMINATOR,
                nullifier,
                ByteUtil.u64le(amount),
                ByteUtil.u32le(proof.length),
                proof
        );

        return new TransactionInstruction(programId, List.of(
                new AccountMeta(pool, false, true),
                new AccountMeta(nullifierMarker, false, true),
                new AccountMeta(vault, false, true),
                new AccountMeta(recipient, false, true),
                new AccountMeta(relayer, true, true),
                new AccountMeta(SystemProgram.PROGRAM_ID, false, false)
        ), data);
    }

    public PublicKey poolAddress(long denomination) {
        return PublicKey.findProgramAddress(List.of(POOL_SEED, ByteUtil.u64le(denomination)), programId).getAddress();
    }

    public PublicKey vaultAddress(PublicKey pool) {
        return PublicKey.findProgramAddress(List.of(VAULT_SEED, pool.toByteArray()), programId).getAddress();
    }

    public PublicKey nullifierMarkerAddress(PublicKey pool, byte[] nullifier) {
        return PublicKey.findProgramAddress(List.of(NULLIFIER_SEED, pool.toByteArray(), nullifier), programId).getAddress();
    }
}
