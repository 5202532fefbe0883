package in.gts.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Registry entry for an issued asset.
 *
 * emitter and data are fixed at issuance; only owner ever changes.
 * A retracted asset has no entry at all (lookups return Optional.empty()).
 */
public record Asset(
    long assetId,
    Principal owner,
    Principal emitter,
    AssetData data,
    Instant issuedAt
) {
    public Asset {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(emitter, "emitter");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(issuedAt, "issuedAt");
    }

    public boolean isEmittedBy(Principal principal) {
        return emitter.equals(principal);
    }

    public Asset withOwner(Principal newOwner) {
        return new Asset(assetId, newOwner, emitter, data, issuedAt);
    }
}
