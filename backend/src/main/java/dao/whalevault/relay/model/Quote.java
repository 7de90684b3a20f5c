package dao.whalevault.relay.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalized aggregator quote. {@code payload} is the provider's own response, passed back
 * unchanged when building the swap transaction.
 */
public record Quote(
        String provider,
        String inputMint,
        String outputMint,
        long inAmount,
        long outAmount,
        long minimumReceived,
        int slippageBps,
        String priceImpactPct,
        JsonNode payload
) {}
