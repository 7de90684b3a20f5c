package dao.whalevault.relay.controller;

import dao.whalevault.relay.config.ProofJobProperties;
import dao.whalevault.relay.exception.JobNotFoundException;
import dao.whalevault.relay.model.JobStatus;
import dao.whalevault.relay.model.ProofJob;
import dao.whalevault.relay.model.ProofJobRequest;
import dao.whalevault.relay.model.ProofResult;
import dao.whalevault.relay.service.ProofJobManager;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/unshield")
public class ProofJobController {

    private final ProofJobManager jobManager;
    private final ProofJobProperties props;

    public ProofJobController(ProofJobManager jobManager, ProofJobProperties props) {
        this.jobManager = jobManager;
        this.props = props;
    }

    /**
     * POST /api/unshield/proof
     * Queues proof generation and returns immediately; poll the job id for progress.
     */
    @PostMapping("/proof")
    public ResponseEntity<Map<String, Object>> submitProof(@Valid @RequestBody ProofJobRequest request) {
        ProofJob job = jobManager.submit(request);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jobId", job.getId());
        response.put("status", job.getStatus().name().toLowerCase());
        response.put("estimatedTime", props.getEstimatedSeconds());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    /**
     * GET /api/unshield/proof/{jobId}
     */
    @GetMapping("/proof/{jobId}")
    public ResponseEntity<Map<String, Object>> getProofStatus(@PathVariable String jobId) {
        ProofJob job = jobManager.getStatus(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jobId", job.getId());
        response.put("status", job.getStatus().name().toLowerCase());
        response.put("progress", job.getProgress());
        response.put("stage", job.getStage());
        response.put("createdAt", job.getCreatedAt().toString());
        if (job.getStatus() == JobStatus.COMPLETED) {
            ProofResult result = job.getResult();
            response.put("result", Map.of(
                    "proof", result.proof(),
                    "nullifier", result.nullifier(),
                    "publicInputs", result.publicInputs()
            ));
        }
        if (job.getStatus() == JobStatus.FAILED) {
            response.put("error", job.getError());
        }
        return ResponseEntity.ok(response);
    }
}
