package in.gts.application.service;

import in.gts.domain.model.Principal;
import in.gts.domain.model.TradeOffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PrincipalIndex - Derived per-principal views of the asset and offer tables.
 *
 * STRUCTURE:
 * - Map<owner, Set<assetId>> for currently owned assets (count = set size)
 * - Map<sender, List<offerId>> for sent offers, creation order
 * - Map<recipient, List<offerId>> for received offers, creation order;
 *   public offers live under Principal.PUBLIC
 *
 * CONSISTENCY:
 * Updated by the registry and offer services inside the same ledger unit as
 * the authoritative mutation. Never recomputed per query.
 */
public final class PrincipalIndex {
    private static final Logger log = LoggerFactory.getLogger(PrincipalIndex.class);

    // owner → ids of assets currently owned
    private final Map<Principal, Set<Long>> ownedAssets = new ConcurrentHashMap<>();

    // sender → offer ids in creation order
    private final Map<Principal, List<Long>> sentOffers = new ConcurrentHashMap<>();

    // recipient (or PUBLIC) → offer ids in creation order
    private final Map<Principal, List<Long>> receivedOffers = new ConcurrentHashMap<>();

    // ═══════════════════════════════════════════════════════════════
    // ASSETS
    // ═══════════════════════════════════════════════════════════════

    public void addAsset(Principal owner, long assetId) {
        ownedAssets.computeIfAbsent(owner, k -> ConcurrentHashMap.newKeySet()).add(assetId);
        log.debug("Asset indexed: {} → {}", assetId, owner);
    }

    public void removeAsset(Principal owner, long assetId) {
        Set<Long> owned = ownedAssets.get(owner);
        if (owned == null || !owned.remove(assetId)) {
            log.warn("Asset {} was not indexed under {}", assetId, owner);
            return;
        }
        // Clean up empty sets to avoid memory leaks
        if (owned.isEmpty()) {
            ownedAssets.remove(owner);
        }
    }

    public void moveAsset(long assetId, Principal from, Principal to) {
        removeAsset(from, assetId);
        addAsset(to, assetId);
    }

    /**
     * Ids of assets currently owned by a principal, ascending.
     * The returned set is a snapshot (safe to iterate).
     */
    public SortedSet<Long> assetsOwnedBy(Principal owner) {
        Set<Long> owned = ownedAssets.get(owner);
        return owned != null
            ? Collections.unmodifiableSortedSet(new TreeSet<>(owned))
            : Collections.emptySortedSet();
    }

    public int countOwnedBy(Principal owner) {
        Set<Long> owned = ownedAssets.get(owner);
        return owned != null ? owned.size() : 0;
    }

    // ═══════════════════════════════════════════════════════════════
    // OFFERS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Append a newly created offer to its sender's and recipient's lists.
     */
    public void addOffer(TradeOffer offer) {
        sentOffers.computeIfAbsent(offer.sender(), k -> new ArrayList<>()).add(offer.offerId());
        receivedOffers.computeIfAbsent(offer.recipient(), k -> new ArrayList<>()).add(offer.offerId());
        log.debug("Offer indexed: {} ({} → {})", offer.offerId(), offer.sender(), offer.recipient());
    }

    public List<Long> offersSentBy(Principal sender) {
        return snapshot(sentOffers.get(sender));
    }

    public List<Long> offersReceivedBy(Principal recipient) {
        return snapshot(receivedOffers.get(recipient));
    }

    public List<Long> publicOffers() {
        return snapshot(receivedOffers.get(Principal.PUBLIC));
    }

    private static List<Long> snapshot(List<Long> ids) {
        return ids != null ? List.copyOf(ids) : List.of();
    }

    // ═══════════════════════════════════════════════════════════════
    // MONITORING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Get statistics for monitoring/debugging.
     */
    public IndexStats getStats() {
        int indexedAssets = ownedAssets.values().stream().mapToInt(Set::size).sum();
        int maxAssetsPerOwner = ownedAssets.values().stream().mapToInt(Set::size).max().orElse(0);
        int indexedOffers = sentOffers.values().stream().mapToInt(List::size).sum();

        return new IndexStats(ownedAssets.size(), indexedAssets, maxAssetsPerOwner,
                              indexedOffers, publicOffers().size());
    }

    /**
     * Index statistics for monitoring.
     */
    public record IndexStats(
        int owners,
        int indexedAssets,
        int maxAssetsPerOwner,
        int indexedOffers,
        int publicOffers
    ) {}
}
