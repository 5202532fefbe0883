package in.gts.domain.error;

import in.gts.domain.common.LedgerErrorCode;
import in.gts.domain.model.Principal;

import java.util.List;
import java.util.Optional;

/**
 * Thrown when settlement-time re-validation finds assets not held by the party
 * that claims to hold them. Generally not recoverable by retry: the offer should
 * be cancelled or declined and re-created.
 */
public class OwnershipMismatchException extends LedgerException {

    private final long offerId;
    private final List<Mismatch> mismatches;

    public OwnershipMismatchException(long offerId, List<Mismatch> mismatches) {
        super(LedgerErrorCode.OWNERSHIP_MISMATCH, describe(offerId, mismatches));
        this.offerId = offerId;
        this.mismatches = List.copyOf(mismatches);
    }

    private static String describe(long offerId, List<Mismatch> mismatches) {
        Mismatch first = mismatches.get(0);
        return String.format("[accept] Offer %d: %d asset(s) not held as claimed, first: asset %d (%s) expected %s, found %s",
            offerId, mismatches.size(), first.assetId(), first.side(), first.expectedOwner(),
            first.actualOwner().map(Principal::id).orElse("<absent>"));
    }

    public long getOfferId() {
        return offerId;
    }

    public List<Mismatch> getMismatches() {
        return mismatches;
    }

    /**
     * Which side of the offer the asset was listed on.
     */
    public enum Side {
        OFFERED,     // myAssets, must be held by the sender
        REQUESTED    // theirAssets, must be held by the acceptor
    }

    /**
     * One failed ownership check. actualOwner is empty when the asset does not exist.
     */
    public record Mismatch(
        Side side,
        long assetId,
        Principal expectedOwner,
        Optional<Principal> actualOwner
    ) {}
}
