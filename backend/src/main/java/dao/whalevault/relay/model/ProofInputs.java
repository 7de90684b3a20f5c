package dao.whalevault.relay.model;

/**
 * Parameters of a proof job, fixed at submission.
 */
public record ProofInputs(String commitment, String secret, long amount, String recipient, long denomination) {

    public static ProofInputs from(ProofJobRequest request) {
        return new ProofInputs(
                request.getCommitment(),
                request.getSecret(),
                request.getAmount() == null ? 0L : request.getAmount(),
                request.getRecipient(),
                request.getDenomination() == null ? 0L : request.getDenomination()
        );
    }

    @Override
    public String toString() {
        return "ProofInputs[amount=" + amount + ", recipient=" + recipient + ", denomination=" + denomination + "]";
    }
}
