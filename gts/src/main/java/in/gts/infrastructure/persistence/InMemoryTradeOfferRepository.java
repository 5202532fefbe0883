package in.gts.infrastructure.persistence;

import in.gts.application.port.output.TradeOfferRepository;
import in.gts.domain.model.OfferState;
import in.gts.domain.model.TradeOffer;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory offer table. Lifetime = process lifetime.
 */
public final class InMemoryTradeOfferRepository implements TradeOfferRepository {

    private final Map<Long, TradeOffer> offers = new ConcurrentHashMap<>();
    private final AtomicLong lastId = new AtomicLong(0);

    @Override
    public long nextId() {
        return lastId.incrementAndGet();
    }

    @Override
    public Optional<TradeOffer> findById(long offerId) {
        return Optional.ofNullable(offers.get(offerId));
    }

    @Override
    public void insert(TradeOffer offer) {
        TradeOffer previous = offers.putIfAbsent(offer.offerId(), offer);
        if (previous != null) {
            throw new IllegalStateException("Offer id already in use: " + offer.offerId());
        }
    }

    @Override
    public TradeOffer updateState(long offerId, OfferState newState, Instant ts) {
        TradeOffer updated = offers.computeIfPresent(offerId, (id, current) -> current.withState(newState, ts));
        if (updated == null) {
            throw new IllegalStateException("No offer to update: " + offerId);
        }
        return updated;
    }
}
