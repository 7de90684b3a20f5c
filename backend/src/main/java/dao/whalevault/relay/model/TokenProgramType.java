package dao.whalevault.relay.model;

import dao.whalevault.relay.solana.SolanaConstants;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.programs.TokenProgram;

public enum TokenProgramType {
    STANDARD(TokenProgram.PROGRAM_ID),
    /** Token-2022; transfers must use TransferChecked. */
    EXTENDED(SolanaConstants.TOKEN_2022_PROGRAM_ID);

    private final PublicKey programId;

    TokenProgramType(PublicKey programId) {
        this.programId = programId;
    }

    public PublicKey programId() {
        return programId;
    }

    public static TokenProgramType fromOwner(PublicKey owner) {
        return EXTENDED.programId.equals(owner) ? EXTENDED : STANDARD;
    }
}
