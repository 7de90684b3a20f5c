package dao.whalevault.relay.swap;

import com.fasterxml.jackson.databind.JsonNode;
import dao.whalevault.relay.config.SwapProperties;
import dao.whalevault.relay.exception.AggregatorException;
import dao.whalevault.relay.model.Quote;
import dao.whalevault.relay.model.TokenInfo;
import lombok.extern.slf4j.Slf4j;
import org.p2p.solanaj.core.PublicKey;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jupiter aggregator. Swaps can pay out directly into the recipient's token account.
 */
@Slf4j
@Component
public class JupiterSwapRouter implements SwapRouter {

    public static final String PROVIDER_ID = "jupiter";

    private final AggregatorHttpClient http;
    private final RetryPolicy retryPolicy;
    private final SwapProperties.Jupiter config;
    private final TokenListCache tokenCache;

    public JupiterSwapRouter(AggregatorHttpClient http, RetryPolicy retryPolicy, SwapProperties props, Clock clock) {
        this.http = http;
        this.retryPolicy = retryPolicy;
        this.config = props.getJupiter();
        this.tokenCache = new TokenListCache(clock, Duration.ofSeconds(props.getTokenListTtlSeconds()), this::fetchTokenList);
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean supportsDirectRouting() {
        return true;
    }

    @Override
    public Quote getQuote(String inputMint, String outputMint, long amount, int slippageBps) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("inputMint", inputMint);
        params.put("outputMint", outputMint);
        params.put("amount", String.valueOf(amount));
        params.put("slippageBps", slippageBps);
        params.put("restrictIntermediateTokens", "true");

        JsonNode data = retryPolicy.execute("Jupiter quote", () -> http.get(config.getApiUrl() + "/quote", params));
        if (data.hasNonNull("error")) {
            throw AggregatorException.permanent("Jupiter quote failed: " + data.path("error").asText(), 400);
        }
        return new Quote(
                PROVIDER_ID,
                data.path("inputMint").asText(inputMint),
                data.path("outputMint").asText(outputMint),
                parseAmount(data, "inAmount"),
                parseAmount(data, "outAmount"),
                parseAmount(data, "otherAmountThreshold"),
                data.path("slippageBps").asInt(slippageBps),
                data.path("priceImpactPct").asText("0"),
                data
        );
    }

    @Override
    public byte[] getSwapTransaction(Quote quote, PublicKey signer, PublicKey destination) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("quoteResponse", quote.payload());
        body.put("userPublicKey", signer.toBase58());
        body.put("wrapAndUnwrapSol", true);
        body.put("dynamicComputeUnitLimit", true);
        body.put("dynamicSlippage", true);
        body.put("prioritizationFeeLamports", Map.of(
                "priorityLevelWithMaxLamports", Map.of(
                        "maxLamports", config.getMaxPriorityFeeLamports(),
                        "priorityLevel", "veryHigh"
                )
        ));
        if (destination != null) {
            body.put("destinationTokenAccount", destination.toBase58());
        }

        JsonNode data = http.post(config.getApiUrl() + "/swap", body);
        if (data.hasNonNull("simulationError")) {
            throw AggregatorException.permanent("Swap simulation failed: " + data.path("simulationError"), 502);
        }
        String encoded = data.path("swapTransaction").asText("");
        if (encoded.isEmpty()) {
            throw AggregatorException.permanent("Jupiter returned no swap transaction", 502);
        }
        return decodeTransaction(encoded);
    }

    @Override
    public List<TokenInfo> getTokenList() {
        return tokenCache.get();
    }

    private List<TokenInfo> fetchTokenList() {
        JsonNode data = retryPolicy.execute("Jupiter token list", () -> http.get(config.getTokenListUrl(), Map.of()));
        if (!data.isArray()) {
            throw AggregatorException.permanent("Unexpected Jupiter token list format", 502);
        }
        List<TokenInfo> tokens = new ArrayList<>(data.size());
        for (JsonNode t : data) {
            tokens.add(new TokenInfo(
                    t.path("address").asText(),
                    t.path("symbol").asText(),
                    t.path("name").asText(),
                    t.path("decimals").asInt(),
                    t.hasNonNull("logoURI") ? t.path("logoURI").asText() : null
            ));
        }
        log.info("Loaded {} tokens from Jupiter", tokens.size());
        return tokens;
    }

    static long parseAmount(JsonNode data, String field) {
        String raw = data.path(field).asText("");
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw AggregatorException.permanent("Invalid " + field + " in quote: '" + raw + "'", 502, e);
        }
    }

    static byte[] decodeTransaction(String encoded) {
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw AggregatorException.permanent("Swap transaction is not valid base64", 502, e);
        }
    }
}
