package in.gts.application.service;

import in.gts.domain.error.OwnershipMismatchException;
import in.gts.domain.error.OwnershipMismatchException.Mismatch;
import in.gts.domain.error.OwnershipMismatchException.Side;
import in.gts.domain.model.Principal;
import in.gts.domain.model.TradeOffer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Settlement-time ownership re-validation for an offer being accepted.
 *
 * Two passes over current ownership, no mutation:
 * 1. every offered id (myAssets) held by the sender
 * 2. every requested id (theirAssets) held by the acceptor
 *
 * All mismatches from both passes are collected; any mismatch rejects the whole
 * settlement. On success the result is the ordered list of moves to apply:
 * offered assets to the acceptor first, then requested assets to the sender.
 */
public final class SettlementValidator {

    private SettlementValidator() {}

    /**
     * Validate an offer against current ownership and plan its moves.
     *
     * @param offer Offer being accepted
     * @param acceptor Accepting principal
     * @param ownerLookup Current owner by asset id, empty when the asset does not exist
     * @return Moves to apply, one per distinct asset id, no-op moves omitted
     * @throws OwnershipMismatchException if any asset is not held as claimed
     */
    public static List<Move> plan(TradeOffer offer, Principal acceptor, LongFunction<Optional<Principal>> ownerLookup) {
        List<Mismatch> mismatches = new ArrayList<>();

        // Pass 1: sender holds everything offered
        check(offer.myAssets(), Side.OFFERED, offer.sender(), ownerLookup, mismatches);

        // Pass 2: acceptor holds everything requested
        check(offer.theirAssets(), Side.REQUESTED, acceptor, ownerLookup, mismatches);

        if (!mismatches.isEmpty()) {
            throw new OwnershipMismatchException(offer.offerId(), mismatches);
        }

        // Repeated ids settle once, at their first listing
        Map<Long, Move> moves = new LinkedHashMap<>();
        for (long assetId : offer.myAssets()) {
            moves.putIfAbsent(assetId, new Move(assetId, offer.sender(), acceptor));
        }
        for (long assetId : offer.theirAssets()) {
            moves.putIfAbsent(assetId, new Move(assetId, acceptor, offer.sender()));
        }

        return moves.values().stream()
            .filter(m -> !m.isNoOp())
            .toList();
    }

    private static void check(List<Long> assetIds, Side side, Principal expectedOwner,
                              LongFunction<Optional<Principal>> ownerLookup, List<Mismatch> mismatches) {
        for (long assetId : assetIds) {
            Optional<Principal> actual = ownerLookup.apply(assetId);
            if (actual.isEmpty() || !actual.get().equals(expectedOwner)) {
                mismatches.add(new Mismatch(side, assetId, expectedOwner, actual));
            }
        }
    }

    /**
     * One planned ownership move.
     */
    public record Move(long assetId, Principal from, Principal to) {
        public boolean isNoOp() {
            return from.equals(to);
        }
    }
}
