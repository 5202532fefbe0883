package in.gts.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Trade offer: sender proposes myAssets in exchange for theirAssets.
 *
 * Asset lists are referenced by id only. The offer neither owns nor locks them,
 * so ownership is re-validated at acceptance. Lists are immutable after creation;
 * only state (and updatedAt) moves, once, out of PENDING.
 */
public record TradeOffer(
    long offerId,
    Principal sender,
    Principal recipient,        // Principal.PUBLIC = anyone may act
    List<Long> myAssets,        // offered by sender
    List<Long> theirAssets,     // requested from the accepting party
    OfferState state,
    Instant createdAt,
    Instant updatedAt
) {
    public TradeOffer {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        myAssets = List.copyOf(myAssets);
        theirAssets = List.copyOf(theirAssets);
    }

    public static TradeOffer pending(long offerId, Principal sender, Principal recipient,
                                     List<Long> myAssets, List<Long> theirAssets, Instant now) {
        return new TradeOffer(offerId, sender, recipient, myAssets, theirAssets,
                              OfferState.PENDING, now, now);
    }

    public boolean isPublic() {
        return recipient.isPublic();
    }

    public boolean isPending() {
        return state == OfferState.PENDING;
    }

    /**
     * Whether the given principal may accept or decline this offer.
     */
    public boolean isAddressedTo(Principal principal) {
        return isPublic() || recipient.equals(principal);
    }

    public TradeOffer withState(OfferState newState, Instant ts) {
        return new TradeOffer(offerId, sender, recipient, myAssets, theirAssets, newState, createdAt, ts);
    }
}
