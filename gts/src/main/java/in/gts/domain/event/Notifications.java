package in.gts.domain.event;

import in.gts.domain.model.AssetData;
import in.gts.domain.model.OfferState;
import in.gts.domain.model.Principal;

import java.util.List;

/**
 * Notification payloads, serialized into {@link LedgerEvent#payload()}.
 */
public final class Notifications {

    public record Issuance(long assetId, Principal owner, Principal emitter, AssetData data) {}

    public record Retraction(long assetId) {}

    public record OwnershipMove(long assetId, Principal previousOwner, Principal newOwner) {}

    public record OfferCreated(
        long offerId,
        Principal sender,
        Principal recipient,
        List<Long> myAssets,
        List<Long> theirAssets
    ) {}

    public record OfferStateChanged(long offerId, OfferState newState) {}

    private Notifications() {}
}
