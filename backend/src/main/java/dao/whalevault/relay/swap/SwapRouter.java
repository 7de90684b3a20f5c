package dao.whalevault.relay.swap;

import dao.whalevault.relay.model.Quote;
import dao.whalevault.relay.model.TokenInfo;
import org.p2p.solanaj.core.PublicKey;

import java.util.List;

/**
 * A swap aggregator. All failures are {@link dao.whalevault.relay.exception.AggregatorException}s.
 */
public interface SwapRouter {

    String providerId();

    /**
     * True when the built transaction can deliver output straight to a destination account the signer
     * does not own. Otherwise output lands in the signer's own associated account and must be forwarded.
     */
    boolean supportsDirectRouting();

    Quote getQuote(String inputMint, String outputMint, long amount, int slippageBps);

    /**
     * @param destination recipient token account for direct routing, or null to deliver to the signer
     * @return unsigned serialized transaction with the signer as fee payer
     */
    byte[] getSwapTransaction(Quote quote, PublicKey signer, PublicKey destination);

    List<TokenInfo> getTokenList();
}
