package dao.whalevault.relay.scheduler;

import dao.whalevault.relay.service.ProofJobManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class JobSweepScheduler {

    private final ProofJobManager jobManager;

    public JobSweepScheduler(ProofJobManager jobManager) {
        this.jobManager = jobManager;
    }

    @Scheduled(fixedDelayString = "${proof-job.sweep-interval-ms:300000}",
            initialDelayString = "${proof-job.sweep-interval-ms:300000}")
    public void sweep() {
        try {
            int removed = jobManager.sweepExpired();
            log.debug("Proof job sweep done: removed={}, remaining={}", removed, jobManager.getJobCount());
        } catch (RuntimeException e) {
            log.error("Proof job sweep failed", e);
        }
    }
}
