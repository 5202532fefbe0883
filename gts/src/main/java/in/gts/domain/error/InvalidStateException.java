package in.gts.domain.error;

import in.gts.domain.common.LedgerErrorCode;
import in.gts.domain.model.OfferState;

/**
 * Thrown when a PENDING-only transition is requested on an offer in a terminal state.
 */
public class InvalidStateException extends LedgerException {

    private final long offerId;
    private final OfferState currentState;

    public InvalidStateException(String action, long offerId, OfferState currentState) {
        super(LedgerErrorCode.INVALID_STATE,
            String.format("[%s] Offer %d is %s, expected %s", action, offerId, currentState, OfferState.PENDING));
        this.offerId = offerId;
        this.currentState = currentState;
    }

    public long getOfferId() {
        return offerId;
    }

    public OfferState getCurrentState() {
        return currentState;
    }
}
