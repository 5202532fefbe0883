package in.gts.application.port.input;

import in.gts.domain.model.Principal;
import in.gts.domain.model.TradeOffer;

import java.util.List;
import java.util.Optional;

/**
 * TradeOfferService - Peer-to-peer asset swap offers.
 *
 * STATE MACHINE:
 * PENDING → CANCELLED (sender)
 * PENDING → ACCEPTED  (recipient, re-validated atomic swap)
 * PENDING → DECLINED  (recipient)
 *
 * Public offers (recipient = Principal.PUBLIC) may be accepted or declined by anyone.
 * Terminal states never change. Offer ids strictly increase and are never reused.
 */
public interface TradeOfferService {

        /**
         * Create a PENDING offer.
         *
         * No asset validation happens here: referenced assets may not exist yet or may be
         * held by someone else. Ownership is checked at acceptance.
         *
         * @param caller Sender
         * @param recipient Recipient principal, or Principal.PUBLIC
         * @param myAssets Asset ids the sender offers (duplicates and empty allowed)
         * @param theirAssets Asset ids the sender requests in return
         * @return New offer id
         */
        long sendTradeOffer(Principal caller, Principal recipient, List<Long> myAssets, List<Long> theirAssets);

        /**
         * Cancel a PENDING offer.
         *
         * @throws in.gts.domain.error.UnauthorizedException if caller is not the sender
         * @throws in.gts.domain.error.InvalidStateException if the offer is not PENDING
         */
        void cancel(Principal caller, long offerId);

        /**
         * Decline a PENDING offer.
         *
         * @throws in.gts.domain.error.UnauthorizedException if caller is not the recipient
         * @throws in.gts.domain.error.InvalidStateException if the offer is not PENDING
         */
        void decline(Principal caller, long offerId);

        /**
         * Accept a PENDING offer and settle it atomically.
         *
         * Steps:
         * 1. Every myAssets id must currently be owned by the sender
         * 2. Every theirAssets id must currently be owned by the caller
         * 3. Move myAssets to the caller, then theirAssets to the sender
         * 4. Mark ACCEPTED
         *
         * Steps 1-2 complete before any mutation: either every asset moves or none does.
         *
         * @throws in.gts.domain.error.UnauthorizedException if caller is not the recipient
         * @throws in.gts.domain.error.InvalidStateException if the offer is not PENDING
         * @throws in.gts.domain.error.OwnershipMismatchException if any asset is not held as claimed
         */
        void accept(Principal caller, long offerId);

        Optional<TradeOffer> get(long offerId);

        /**
         * Offer ids sent by a principal, in creation order.
         */
        List<Long> sentBy(Principal principal);

        /**
         * Offer ids addressed to a principal, in creation order (public offers excluded).
         */
        List<Long> receivedBy(Principal principal);

        /**
         * Offer ids addressed to Principal.PUBLIC, in creation order.
         */
        List<Long> publicOffers();
}
