package dao.whalevault.relay.service;

import dao.whalevault.relay.model.TokenProgramType;
import dao.whalevault.relay.solana.AccountInfo;
import dao.whalevault.relay.solana.SolanaRpcClient;
import dao.whalevault.relay.util.ByteUtil;
import lombok.extern.slf4j.Slf4j;
import org.p2p.solanaj.core.AccountMeta;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.core.TransactionInstruction;
import org.p2p.solanaj.programs.AssociatedTokenProgram;
import org.p2p.solanaj.programs.SystemProgram;
import org.p2p.solanaj.programs.TokenProgram;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Token-program detection, associated account derivation and creation, and token transfers.
 */
@Slf4j
@Component
public class TokenAccountResolver {

    static final int DEFAULT_DECIMALS = 9;
    private static final int MINT_DECIMALS_OFFSET = 44;

    private static final byte TRANSFER_CHECKED = 12;

    private final SolanaRpcClient rpc;
    private final RelayerService relayer;

    public TokenAccountResolver(SolanaRpcClient rpc, RelayerService relayer) {
        this.rpc = rpc;
        this.relayer = relayer;
    }

    /**
     * Falls back to the standard program when the mint cannot be read.
     */
    public TokenProgramType detectTokenProgram(PublicKey mint) {
        try {
            return rpc.getAccountInfo(mint)
                    .map(info -> TokenProgramType.fromOwner(info.owner()))
                    .orElse(TokenProgramType.STANDARD);
        } catch (RuntimeException e) {
            log.warn("Could not detect token program for mint {}, assuming standard: {}", mint, e.getMessage());
            return TokenProgramType.STANDARD;
        }
    }

    public int readDecimals(PublicKey mint) {
        try {
            Optional<AccountInfo> info = rpc.getAccountInfo(mint);
            if (info.isPresent()) {
                byte[] data = info.get().data();
                if (data.length > MINT_DECIMALS_OFFSET) {
                    return data[MINT_DECIMALS_OFFSET] & 0xff;
                }
            }
            log.warn("Mint {} has no readable decimals, using {}", mint, DEFAULT_DECIMALS);
        } catch (RuntimeException e) {
            log.warn("Could not read decimals for mint {}, using {}: {}", mint, DEFAULT_DECIMALS, e.getMessage());
        }
        return DEFAULT_DECIMALS;
    }

    public PublicKey deriveAccount(PublicKey owner, PublicKey mint, TokenProgramType program) {
        return PublicKey.findProgramAddress(
                List.of(owner.toByteArray(), program.programId().toByteArray(), mint.toByteArray()),
                AssociatedTokenProgram.PROGRAM_ID
        ).getAddress();
    }

    public boolean accountExists(PublicKey account) {
        return rpc.getAccountInfo(account).isPresent();
    }

    /**
     * Creates the owner's associated account, paid by the relayer, when it is missing.
     *
     * @return true if a create transaction was confirmed, false if the account already existed
     */
    public boolean ensureAccountExists(PublicKey owner, PublicKey mint, TokenProgramType program) {
        PublicKey account = deriveAccount(owner, mint, program);
        if (accountExists(account)) {
            return false;
        }
        TransactionInstruction create = buildCreateAccountInstruction(relayer.getPublicKey(), account, owner, mint, program);
        String signature = relayer.submitAndConfirm(List.of(create));
        log.info("Created token account {} for owner {} (mint {}): {}", account, owner, mint, signature);
        return true;
    }

    /**
     * Raw balance of a token account, 0 when the account does not exist yet.
     */
    public long balanceOrZero(PublicKey tokenAccount) {
        if (!accountExists(tokenAccount)) {
            return 0L;
        }
        return rpc.getTokenAccountBalance(tokenAccount);
    }

    public TransactionInstruction buildCreateAccountInstruction(PublicKey payer, PublicKey account, PublicKey owner,
                                                     PublicKey mint, TokenProgramType program) {
        // AssociatedTokenProgram.create only targets the original token program.
        return new TransactionInstruction(AssociatedTokenProgram.PROGRAM_ID, List.of(
                new AccountMeta(payer, true, true),
                new AccountMeta(account, false, true),
                new AccountMeta(owner, false, false),
                new AccountMeta(mint, false, false),
                new AccountMeta(SystemProgram.PROGRAM_ID, false, false),
                new AccountMeta(program.programId(), false, false)
        ), new byte[0]);
    }

    /**
     * Token-2022 mints may carry transfer hooks or fees, so they require TransferChecked with the mint
     * and decimals; the standard program uses plain Transfer.
     */
    public TransactionInstruction buildTransferInstruction(PublicKey source, PublicKey destination, PublicKey authority,
                                                long amount, TokenProgramType program, PublicKey mint, int decimals) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Transfer amount must be positive: " + amount);
        }
        if (program == TokenProgramType.EXTENDED) {
            byte[] data = ByteUtil.concat(new byte[]{TRANSFER_CHECKED}, ByteUtil.u64le(amount), new byte[]{(byte) decimals});
            return new TransactionInstruction(program.programId(), List.of(
                    new AccountMeta(source, false, true),
                    new AccountMeta(mint, false, false),
                    new AccountMeta(destination, false, true),
                    new AccountMeta(authority, true, false)
            ), data);
        }
        return TokenProgram.transfer(source, destination, amount, authority);
    }
}
