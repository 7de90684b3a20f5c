package dao.whalevault.relay.model;

/**
 * Result of a swap saga. Empty strings mark sub-steps that were not attempted or failed, so the
 * set of empty fields tells the caller where custodial funds ended up:
 * <ul>
 *   <li>swap and transfer empty: SOL still with the relayer</li>
 *   <li>swap empty, transfer set: swap failed, SOL forwarded to the recipient</li>
 *   <li>swap set, transfer empty on a two-transaction router: tokens held in the relayer's token account</li>
 * </ul>
 */
public record SwapOutcome(
        String unshieldSignature,
        String swapSignature,
        String transferSignature,
        String outputAmount,
        String outputMint,
        String recipient,
        long fee
) {

    public static final String NONE = "";

    public SwapOutcome {
        if (unshieldSignature == null || unshieldSignature.isEmpty()) {
            throw new IllegalArgumentException("Outcome requires the unshield signature");
        }
        swapSignature = swapSignature == null ? NONE : swapSignature;
        transferSignature = transferSignature == null ? NONE : transferSignature;
    }

    public static SwapOutcome unshieldOnly(RelayResult unshield, String outputMint, String recipient) {
        return new SwapOutcome(unshield.signature(), NONE, NONE, "0", outputMint, recipient, unshield.feePaid());
    }

    public boolean swapCompleted() {
        return !swapSignature.isEmpty();
    }

    public boolean transferCompleted() {
        return !transferSignature.isEmpty();
    }
}
