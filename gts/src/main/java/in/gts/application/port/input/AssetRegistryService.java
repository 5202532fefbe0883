package in.gts.application.port.input;

import in.gts.domain.model.Asset;
import in.gts.domain.model.AssetData;
import in.gts.domain.model.Principal;

import java.util.Optional;
import java.util.SortedSet;

/**
 * AssetRegistryService - Ownership ledger for emitter-attested assets.
 *
 * RULES:
 * - Any principal may issue; the issuing caller becomes the immutable emitter
 * - Only the emitter may retract (burn), which removes the record entirely
 * - Ownership changes only through trade settlement (no public transfer entry point)
 * - Asset ids strictly increase and are never reused
 */
public interface AssetRegistryService {

        /**
         * Issue a new asset.
         *
         * @param caller Issuing principal, recorded as emitter
         * @param owner Initial owner (need not be the caller)
         * @param data Opaque issuance metadata
         * @return New asset id
         */
        long issue(Principal caller, Principal owner, AssetData data);

        /**
         * Retract (burn) an asset.
         *
         * @param caller Must be the asset's emitter
         * @param assetId Asset to retract
         * @throws in.gts.domain.error.UnauthorizedException if caller is not the emitter,
         *         including when the asset does not exist
         */
        void retract(Principal caller, long assetId);

        /**
         * Look up an asset. Empty for ids never issued and for retracted ids.
         */
        Optional<Asset> get(long assetId);

        /**
         * Ids of all assets currently owned by a principal.
         */
        SortedSet<Long> inventoryOf(Principal principal);

        /**
         * Number of assets currently owned by a principal.
         */
        int countOwnedBy(Principal principal);
}
