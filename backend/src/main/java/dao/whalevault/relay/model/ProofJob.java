package dao.whalevault.relay.model;

import lombok.Getter;

import java.time.Instant;

/**
 * One proof-generation job. Mutated only by the job manager while it holds the table lock;
 * readers receive {@link #snapshot()} copies.
 */
@Getter
public class ProofJob {

    public static final String STAGE_QUEUED = "queued";

    private final String id;
    private final ProofInputs inputs;
    private final Instant createdAt;

    private JobStatus status = JobStatus.PENDING;
    private int progress;
    private String stage = STAGE_QUEUED;
    private ProofResult result;
    private String error;

    public ProofJob(String id, ProofInputs inputs, Instant createdAt) {
        this.id = id;
        this.inputs = inputs;
        this.createdAt = createdAt;
    }

    private ProofJob(ProofJob other) {
        this.id = other.id;
        this.inputs = other.inputs;
        this.createdAt = other.createdAt;
        this.status = other.status;
        this.progress = other.progress;
        this.stage = other.stage;
        this.result = other.result;
        this.error = other.error;
    }

    public void markProcessing() {
        transition(JobStatus.PROCESSING);
    }

    public void checkpoint(int newProgress, String newStage) {
        if (status != JobStatus.PROCESSING) {
            throw new IllegalStateException("Job " + id + " is not processing (status=" + status + ")");
        }
        if (newProgress < progress || newProgress > 100) {
            throw new IllegalStateException("Progress must stay within [" + progress + ", 100], got " + newProgress);
        }
        this.progress = newProgress;
        if (newStage != null) {
            this.stage = newStage;
        }
    }

    public void complete(ProofResult proofResult) {
        if (proofResult == null) {
            throw new IllegalArgumentException("Completed job needs a result");
        }
        transition(JobStatus.COMPLETED);
        this.result = proofResult;
        this.progress = 100;
    }

    public void fail(String message) {
        transition(JobStatus.FAILED);
        this.error = message;
    }

    public boolean isExpired(Instant cutoff) {
        return status.isTerminal() && createdAt.isBefore(cutoff);
    }

    public ProofJob snapshot() {
        return new ProofJob(this);
    }

    private void transition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    @Override
    public String toString() {
        return "ProofJob[id=" + id + ", status=" + status + ", progress=" + progress + ", stage=" + stage + "]";
    }
}
