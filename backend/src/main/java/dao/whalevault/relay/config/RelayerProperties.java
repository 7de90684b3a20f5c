package dao.whalevault.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "relayer")
@Data
public class RelayerProperties {

    /**
     * Master switch for relayed withdrawals and swaps.
     */
    private boolean enabled = true;

    /**
     * Relayer secret: base58 (32-byte seed or 64-byte keypair) or a solana-keygen JSON array.
     */
    private String privateKey;

    /**
     * Relayer fee in basis points of the withdrawn amount.
     * Default: 30 (0.3%)
     */
    private int feeBps = 30;

    /**
     * Floor for the relayer fee, covers the transaction cost.
     * Default: 5000 lamports
     */
    private long minFeeLamports = 5_000L;

    /**
     * Privacy pool program id (base58)
     * Example: 3qhVPvz8T1WiozCLEfhUuv8WZHDPpEfnAzq2iSatULc7
     */
    private String programId = "3qhVPvz8T1WiozCLEfhUuv8WZHDPpEfnAzq2iSatULc7";

    private DevnetAirdrop devnetAirdrop = new DevnetAirdrop();

    @Data
    public static class DevnetAirdrop {
        /**
         * Top the relayer up from the devnet faucet before a swap.
         */
        private boolean enabled = false;

        private long minBalanceLamports = 2_000_000_000L;

        private long amountLamports = 2_000_000_000L;

        /**
         * Wait after requesting an airdrop so it lands before the swap reads the balance.
         */
        private long settleDelayMs = 2_000L;
    }
}
