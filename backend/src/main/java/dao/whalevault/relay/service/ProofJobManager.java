package dao.whalevault.relay.service;

import dao.whalevault.relay.config.ProofJobProperties;
import dao.whalevault.relay.exception.ProofGenerationException;
import dao.whalevault.relay.exception.ValidationException;
import dao.whalevault.relay.model.JobStatus;
import dao.whalevault.relay.model.ProofInputs;
import dao.whalevault.relay.model.ProofJob;
import dao.whalevault.relay.model.ProofJobRequest;
import dao.whalevault.relay.model.ProofResult;
import dao.whalevault.relay.service.proof.ProofGenerator;
import dao.whalevault.relay.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Runs proof generation in the background so the HTTP caller can poll instead of blocking.
 * All job state lives in one table guarded by {@link #lock}; callers only ever see snapshots.
 */
@Slf4j
@Service
public class ProofJobManager {

    public static final String UNEXPECTED_FAILURE = "Proof generation failed unexpectedly";

    private final ProofGenerator generator;
    private final ProofJobProperties props;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ExecutorService executor;

    private final Object lock = new Object();
    private final Map<String, ProofJob> jobs = new HashMap<>();

    public ProofJobManager(ProofGenerator generator, ProofJobProperties props, Clock clock, Sleeper sleeper) {
        this.generator = generator;
        this.props = props;
        this.clock = clock;
        this.sleeper = sleeper;
        this.executor = Executors.newFixedThreadPool(Math.max(1, props.getWorkerThreads()));
    }

    public ProofJob submit(ProofJobRequest request) {
        ProofJob job = new ProofJob(UUID.randomUUID().toString(), ProofInputs.from(request), clock.instant());
        ProofJob snapshot;
        synchronized (lock) {
            jobs.put(job.getId(), job);
            snapshot = job.snapshot();
        }
        try {
            executor.execute(() -> process(job.getId()));
        } catch (RejectedExecutionException e) {
            log.error("Proof worker pool rejected job {}", job.getId(), e);
            update(job.getId(), j -> j.fail(UNEXPECTED_FAILURE));
            return getStatus(job.getId()).orElse(snapshot);
        }
        log.info("Proof job queued: id={}, {}", job.getId(), job.getInputs());
        return snapshot;
    }

    public Optional<ProofJob> getStatus(String jobId) {
        synchronized (lock) {
            ProofJob job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.snapshot());
        }
    }

    public int getJobCount() {
        synchronized (lock) {
            return jobs.size();
        }
    }

    void process(String jobId) {
        ProofInputs inputs;
        synchronized (lock) {
            ProofJob job = jobs.get(jobId);
            if (job == null || job.getStatus() != JobStatus.PENDING) {
                return;
            }
            job.markProcessing();
            inputs = job.getInputs();
        }

        try {
            checkpoint(jobId, 10, "initializing");
            pause(props.getStageDelayMs());
            checkpoint(jobId, 30, "generating_witnesses");
            pause(props.getStageDelayMs());
            checkpoint(jobId, 60, "computing_proof");

            ProofResult result = generator.generate(inputs);
            if (result == null) {
                throw new IllegalStateException("Generator returned no result");
            }

            checkpoint(jobId, 90, "verifying_proof");
            pause(props.getStageDelayMs() * 2 / 3);
            checkpoint(jobId, 100, "finalizing");

            update(jobId, job -> job.complete(result));
            log.info("Proof job completed: id={}", jobId);
        } catch (ValidationException | ProofGenerationException e) {
            log.warn("Proof job {} failed: {}", jobId, e.getMessage());
            update(jobId, job -> job.fail(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Proof job {} interrupted", jobId);
            update(jobId, job -> job.fail(UNEXPECTED_FAILURE));
        } catch (Exception e) {
            log.error("Proof job {} failed unexpectedly", jobId, e);
            update(jobId, job -> job.fail(UNEXPECTED_FAILURE));
        }
    }

    /**
     * Removes terminal jobs created before the retention window.
     *
     * @return number of jobs removed
     */
    public int sweepExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(props.getRetentionMinutes()));
        int removed = 0;
        synchronized (lock) {
            Iterator<ProofJob> it = jobs.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Swept {} expired proof jobs", removed);
        }
        return removed;
    }

    private void checkpoint(String jobId, int progress, String stage) {
        update(jobId, job -> job.checkpoint(progress, stage));
    }

    private void update(String jobId, Consumer<ProofJob> change) {
        synchronized (lock) {
            ProofJob job = jobs.get(jobId);
            if (job != null && !job.getStatus().isTerminal()) {
                change.accept(job);
            }
        }
    }

    private void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            sleeper.sleep(millis);
        }
    }

    @jakarta.annotation.PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
