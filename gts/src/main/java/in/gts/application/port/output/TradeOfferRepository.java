package in.gts.application.port.output;

import in.gts.domain.model.OfferState;
import in.gts.domain.model.TradeOffer;

import java.time.Instant;
import java.util.Optional;

/**
 * Authoritative offer table. Offers are never deleted; terminal offers stay queryable.
 */
public interface TradeOfferRepository {
    /**
     * Allocate the next offer id (strictly greater than every id allocated before).
     */
    long nextId();

    Optional<TradeOffer> findById(long offerId);

    void insert(TradeOffer offer);

    /**
     * Set the state of an existing offer.
     *
     * @return the updated offer
     * @throws IllegalStateException if no such offer exists
     */
    TradeOffer updateState(long offerId, OfferState newState, Instant ts);
}
