package dao.whalevault.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "swap")
@Data
public class SwapProperties {

    /**
     * Router used when a request does not name one: jupiter or raydium.
     */
    private String defaultProvider = "jupiter";

    private int slippageBps = 100;

    /**
     * Reads of the relayer's token account after the swap confirms (ledger visibility lag).
     */
    private int balancePollAttempts = 5;

    private long balancePollDelayMs = 500;

    private int transferAttempts = 3;

    private long transferRetryDelayMs = 1_000;

    /**
     * Lamports kept back when forwarding SOL after a failed swap, pays for the fallback transaction.
     */
    private long fallbackReserveLamports = 5_000;

    private long tokenListTtlSeconds = 300;

    private long connectTimeoutMs = 10_000;

    private long readTimeoutMs = 30_000;

    private Retry retry = new Retry();
    private Jupiter jupiter = new Jupiter();
    private Raydium raydium = new Raydium();

    @Data
    public static class Retry {
        /**
         * Retries after the first attempt for transient aggregator failures.
         */
        private int maxRetries = 3;
        private long baseDelayMs = 1_000;
        private double multiplier = 2.0;
    }

    @Data
    public static class Jupiter {
        private String apiUrl = "https://api.jup.ag/swap/v1";
        private String tokenListUrl = "https://token.jup.ag/strict";
        private long maxPriorityFeeLamports = 1_000_000;
    }

    @Data
    public static class Raydium {
        private String apiUrl = "https://transaction-v1-devnet.raydium.io";
        private String poolsApiUrl = "https://api-v3-devnet.raydium.io";
        private String computeUnitPriceMicroLamports = "1000";
    }
}
