package dao.whalevault.relay.exception;

public class JobNotFoundException extends DomainException {

    public JobNotFoundException(String jobId) {
        super("Proof job not found: " + jobId, 404);
    }
}
