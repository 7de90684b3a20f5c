package dao.whalevault.relay.controller;

import dao.whalevault.relay.exception.JobNotFoundException;
import dao.whalevault.relay.exception.JobNotReadyException;
import dao.whalevault.relay.exception.RelayerException;
import dao.whalevault.relay.exception.ValidationException;
import dao.whalevault.relay.model.JobStatus;
import dao.whalevault.relay.model.ProofJob;
import dao.whalevault.relay.model.ProofResult;
import dao.whalevault.relay.model.RelayResult;
import dao.whalevault.relay.model.RelayUnshieldRequest;
import dao.whalevault.relay.service.ProofJobManager;
import dao.whalevault.relay.service.RelayerService;
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
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/relayer")
public class RelayerController {

    private final RelayerService relayer;
    private final ProofJobManager jobManager;

    public RelayerController(RelayerService relayer, ProofJobManager jobManager) {
        this.relayer = relayer;
        this.jobManager = jobManager;
    }

    /**
     * GET /api/relayer/info
     * Balance is reported as 0 when it cannot be read.
     */
    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> getInfo() {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean enabled = relayer.isEnabled();
        response.put("enabled", enabled);
        response.put("address", enabled ? relayer.getPublicKey().toBase58() : null);
        response.put("feeBps", relayer.getFeeBps());
        response.put("minFee", relayer.getMinFee());
        response.put("balance", readBalance());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/relayer/fee?amount=...
     */
    @GetMapping("/fee")
    public ResponseEntity<Map<String, Object>> getFee(@RequestParam long amount) {
        if (amount <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        long fee = relayer.calculateFee(amount);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("amount", amount);
        response.put("fee", fee);
        response.put("amountAfterFee", amount - fee);
        response.put("feeBps", relayer.getFeeBps());
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/relayer/unshield
     * Relays the withdrawal of a completed proof job straight to the recipient.
     */
    @PostMapping("/unshield")
    public ResponseEntity<Map<String, Object>> relayUnshield(@Valid @RequestBody RelayUnshieldRequest request) {
        if (!relayer.isEnabled()) {
            throw new RelayerException(RelayerException.Kind.DISABLED, "Relayer service is currently disabled");
        }
        ProofJob job = jobManager.getStatus(request.getJobId())
                .orElseThrow(() -> new JobNotFoundException(request.getJobId()));
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new JobNotReadyException(job.getId(), job.getStatus());
        }
        ProofResult proof = job.getResult();
        if (proof == null) {
            throw new IllegalStateException("Completed proof job " + job.getId() + " has no result");
        }

        RelayResult result = relayer.relayUnshield(proof.nullifierBytes(), request.getRecipient(),
                job.getInputs().amount(), proof.proofBytes(), job.getInputs().denomination());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("signature", result.signature());
        response.put("fee", result.feePaid());
        response.put("amountSent", result.amountSent());
        response.put("recipient", result.recipient());
        return ResponseEntity.ok(response);
    }

    private long readBalance() {
        if (!relayer.isEnabled()) {
            return 0L;
        }
        try {
            return relayer.getBalance();
        } catch (RuntimeException e) {
            log.warn("Could not read relayer balance: {}", e.getMessage());
            return 0L;
        }
    }
}
