package in.gts.application.port.output;

import in.gts.domain.model.Asset;
import in.gts.domain.model.Principal;

import java.util.Optional;

/**
 * Authoritative asset table.
 *
 * Ids come from {@link #nextId()} and are never handed out twice,
 * including ids of deleted (retracted) assets.
 */
public interface AssetRepository {
    /**
     * Allocate the next asset id (strictly greater than every id allocated before).
     */
    long nextId();

    Optional<Asset> findById(long assetId);

    void insert(Asset asset);

    /**
     * Replace the owner of an existing asset.
     *
     * @return the updated asset
     * @throws IllegalStateException if no such asset exists
     */
    Asset updateOwner(long assetId, Principal newOwner);

    /**
     * Remove the record entirely.
     *
     * @return the removed asset, empty if there was none
     */
    Optional<Asset> delete(long assetId);
}
