package dao.whalevault.relay.controller;

import dao.whalevault.relay.config.SwapProperties;
import dao.whalevault.relay.exception.ValidationException;
import dao.whalevault.relay.model.Quote;
import dao.whalevault.relay.model.SwapOutcome;
import dao.whalevault.relay.model.SwapRequest;
import dao.whalevault.relay.model.TokenInfo;
import dao.whalevault.relay.service.SwapOrchestrator;
import dao.whalevault.relay.solana.SolanaConstants;
import dao.whalevault.relay.swap.SwapRouterRegistry;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/swap")
public class SwapController {

    private final SwapOrchestrator orchestrator;
    private final SwapRouterRegistry routers;
    private final SwapProperties props;

    public SwapController(SwapOrchestrator orchestrator, SwapRouterRegistry routers, SwapProperties props) {
        this.orchestrator = orchestrator;
        this.routers = routers;
        this.props = props;
    }

    /**
     * GET /api/swap/quote
     * Price preview only; nothing is reserved.
     */
    @GetMapping("/quote")
    public ResponseEntity<Map<String, Object>> getQuote(
            @RequestParam(defaultValue = SolanaConstants.WRAPPED_SOL_MINT) String inputMint,
            @RequestParam String outputMint,
            @RequestParam long amount,
            @RequestParam(required = false) Integer slippageBps,
            @RequestParam(required = false) String provider) {
        if (amount <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        int slippage = slippageBps == null ? props.getSlippageBps() : slippageBps;
        if (slippage < 0 || slippage > 10_000) {
            throw new ValidationException("slippageBps must be within [0, 10000]");
        }
        Quote quote = routers.resolve(provider).getQuote(inputMint, outputMint, amount, slippage);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("provider", quote.provider());
        response.put("inputMint", quote.inputMint());
        response.put("outputMint", quote.outputMint());
        response.put("inAmount", String.valueOf(quote.inAmount()));
        response.put("outAmount", String.valueOf(quote.outAmount()));
        response.put("minimumReceived", String.valueOf(quote.minimumReceived()));
        response.put("priceImpactPct", quote.priceImpactPct());
        response.put("slippageBps", quote.slippageBps());
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/swap/execute
     * Runs the unshield-and-swap saga. Partial outcomes are returned with 200; inspect the empty fields.
     */
    @PostMapping("/execute")
    public ResponseEntity<SwapOutcome> execute(@Valid @RequestBody SwapRequest request) {
        SwapOutcome outcome = orchestrator.execute(request);
        if (!outcome.swapCompleted()) {
            log.warn("Swap for job {} did not complete: unshield={}, transfer='{}'",
                    request.getJobId(), outcome.unshieldSignature(), outcome.transferSignature());
        }
        return ResponseEntity.ok(outcome);
    }

    /**
     * GET /api/swap/tokens
     */
    @GetMapping("/tokens")
    public ResponseEntity<List<TokenInfo>> getTokens(@RequestParam(required = false) String provider) {
        return ResponseEntity.ok(routers.resolve(provider).getTokenList());
    }
}
