package dao.whalevault.relay.solana;

import org.p2p.solanaj.core.PublicKey;

public final class SolanaConstants {
    private SolanaConstants() {}

    /** solanaj's TokenProgram only targets the original token program. */
    public static final PublicKey TOKEN_2022_PROGRAM_ID = new PublicKey("TokenzQdBNbLqP5VEhdkAS6EPFLC1PHnBqCXEpPxuEb");

    /** Wrapped SOL; aggregators quote native SOL under this mint. */
    public static final String WRAPPED_SOL_MINT = "So11111111111111111111111111111111111111112";

    public static final int SIGNATURE_LENGTH = 64;
}
