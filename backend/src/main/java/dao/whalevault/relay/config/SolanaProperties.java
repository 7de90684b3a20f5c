package dao.whalevault.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "solana")
@Data
public class SolanaProperties {

    /**
     * JSON-RPC endpoint
     * Example: https://api.devnet.solana.com
     */
    private String rpcUrl = "https://api.devnet.solana.com";

    /**
     * Commitment used for reads and for confirming submitted transactions.
     */
    private String commitment = "confirmed";

    private long connectTimeoutMs = 10_000L;

    private long readTimeoutMs = 30_000L;

    private Polling polling = new Polling();

    @Data
    public static class Polling {
        /**
         * Give up waiting for a signature status after this long.
         */
        private long confirmTimeoutSeconds = 60;
        /**
         * Initial poll interval for signature status.
         */
        private long pollInitialMs = 250;
        /**
         * Maximum poll interval (backoff cap).
         */
        private long pollMaxMs = 2_000;
    }
}
