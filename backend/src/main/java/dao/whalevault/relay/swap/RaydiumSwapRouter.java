package dao.whalevault.relay.swap;

import com.fasterxml.jackson.databind.JsonNode;
import dao.whalevault.relay.config.SwapProperties;
import dao.whalevault.relay.exception.AggregatorException;
import dao.whalevault.relay.model.Quote;
import dao.whalevault.relay.model.TokenInfo;
import dao.whalevault.relay.solana.SolanaConstants;
import lombok.extern.slf4j.Slf4j;
import org.p2p.solanaj.core.PublicKey;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raydium trade API (devnet). The output account must be owned by the signer, so swapped tokens land
 * in the relayer's associated account and are forwarded in a second transaction.
 */
@Slf4j
@Component
public class RaydiumSwapRouter implements SwapRouter {

    public static final String PROVIDER_ID = "raydium";

    private static final String TX_VERSION = "V0";
    private static final int DEFAULT_DECIMALS = 9;

    private final AggregatorHttpClient http;
    private final RetryPolicy retryPolicy;
    private final SwapProperties.Raydium config;
    private final TokenListCache tokenCache;

    public RaydiumSwapRouter(AggregatorHttpClient http, RetryPolicy retryPolicy, SwapProperties props, Clock clock) {
        this.http = http;
        this.retryPolicy = retryPolicy;
        this.config = props.getRaydium();
        this.tokenCache = new TokenListCache(clock, Duration.ofSeconds(props.getTokenListTtlSeconds()), this::fetchTokenList);
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean supportsDirectRouting() {
        return false;
    }

    @Override
    public Quote getQuote(String inputMint, String outputMint, long amount, int slippageBps) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("inputMint", inputMint);
        params.put("outputMint", outputMint);
        params.put("amount", String.valueOf(amount));
        params.put("slippageBps", String.valueOf(slippageBps));
        params.put("txVersion", TX_VERSION);

        JsonNode response = retryPolicy.execute("Raydium quote",
                () -> http.get(config.getApiUrl() + "/compute/swap-base-in", params));
        JsonNode data = requireSuccess(response, "Raydium quote failed - no route found");

        return new Quote(
                PROVIDER_ID,
                data.path("inputMint").asText(inputMint),
                data.path("outputMint").asText(outputMint),
                JupiterSwapRouter.parseAmount(data, "inputAmount"),
                JupiterSwapRouter.parseAmount(data, "outputAmount"),
                JupiterSwapRouter.parseAmount(data, "otherAmountThreshold"),
                data.path("slippageBps").asInt(slippageBps),
                data.path("priceImpactPct").asText("0"),
                response
        );
    }

    /**
     * {@code destination} is ignored: Raydium only pays out to the signer.
     */
    @Override
    public byte[] getSwapTransaction(Quote quote, PublicKey signer, PublicKey destination) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("computeUnitPriceMicroLamports", config.getComputeUnitPriceMicroLamports());
        body.put("swapResponse", quote.payload());
        body.put("wallet", signer.toBase58());
        body.put("txVersion", TX_VERSION);
        body.put("wrapSol", true);
        body.put("unwrapSol", false);

        JsonNode response = http.post(config.getApiUrl() + "/transaction/swap-base-in", body);
        JsonNode data = requireSuccess(response, "Failed to build Raydium swap transaction");
        String encoded = data.path(0).path("transaction").asText("");
        if (encoded.isEmpty()) {
            throw AggregatorException.permanent("Raydium returned no swap transaction", 502);
        }
        return JupiterSwapRouter.decodeTransaction(encoded);
    }

    @Override
    public List<TokenInfo> getTokenList() {
        return tokenCache.get();
    }

    private List<TokenInfo> fetchTokenList() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("mint1", SolanaConstants.WRAPPED_SOL_MINT);
        params.put("poolType", "all");
        params.put("poolSortField", "liquidity");
        params.put("sortType", "desc");
        params.put("pageSize", "100");
        params.put("page", "1");

        JsonNode response = retryPolicy.execute("Raydium pool list",
                () -> http.get(config.getPoolsApiUrl() + "/pools/info/mint", params));

        Set<String> seen = new HashSet<>();
        List<TokenInfo> tokens = new ArrayList<>();
        for (JsonNode pool : response.path("data").path("data")) {
            JsonNode mintA = pool.path("mintA");
            JsonNode mintB = pool.path("mintB");
            JsonNode other = SolanaConstants.WRAPPED_SOL_MINT.equals(mintA.path("address").asText()) ? mintB : mintA;

            String address = other.path("address").asText("");
            String symbol = other.path("symbol").asText("");
            if (address.isEmpty() || symbol.isEmpty()
                    || address.equals(SolanaConstants.WRAPPED_SOL_MINT) || !seen.add(address)) {
                continue;
            }
            tokens.add(new TokenInfo(
                    address,
                    symbol,
                    other.path("name").asText(symbol),
                    other.path("decimals").asInt(DEFAULT_DECIMALS),
                    other.hasNonNull("logoURI") ? other.path("logoURI").asText() : null
            ));
        }
        log.info("Loaded {} SOL-paired tokens from Raydium", tokens.size());
        return tokens;
    }

    private static JsonNode requireSuccess(JsonNode response, String defaultMessage) {
        JsonNode data = response.path("data");
        boolean empty = data.isMissingNode() || data.isNull() || (data.isContainerNode() && data.size() == 0);
        if (!response.path("success").asBoolean(false) || empty) {
            throw AggregatorException.permanent(response.path("msg").asText(defaultMessage), 400);
        }
        return data;
    }
}
