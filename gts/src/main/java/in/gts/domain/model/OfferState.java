package in.gts.domain.model;

/**
 * Trade offer lifecycle state.
 */
public enum OfferState {
    PENDING,      // Created, awaiting action
    CANCELLED,    // Withdrawn by sender
    ACCEPTED,     // Settled: both sides swapped
    DECLINED;     // Refused by recipient

    public boolean isTerminal() {
        return this != PENDING;
    }
}
