package dao.whalevault.relay.exception;

import dao.whalevault.relay.model.JobStatus;

public class JobNotReadyException extends DomainException {

    public JobNotReadyException(String jobId, JobStatus status) {
        super("Proof job not complete (status: " + status.name().toLowerCase() + ")", 400);
    }
}
