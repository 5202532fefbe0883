package in.gts.infrastructure.persistence;

import in.gts.application.port.output.LedgerEventRepository;
import in.gts.domain.event.LedgerEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory event log (default when no database is configured).
 */
public final class InMemoryLedgerEventRepository implements LedgerEventRepository {

    private final List<LedgerEvent> events = new ArrayList<>();

    @Override
    public synchronized List<LedgerEvent> appendAll(List<LedgerEvent> batch) {
        List<LedgerEvent> persisted = new ArrayList<>(batch.size());
        for (LedgerEvent e : batch) {
            persisted.add(e.withSeq(events.size() + persisted.size() + 1L));
        }
        events.addAll(persisted);
        return persisted;
    }

    @Override
    public synchronized List<LedgerEvent> listAfterSeq(long afterSeq, int limit) {
        // seq n lives at index n-1
        int from = (int) Math.max(0, Math.min(afterSeq, events.size()));
        int to = (int) Math.min(events.size(), (long) from + Math.max(0, limit));
        return List.copyOf(events.subList(from, to));
    }

    @Override
    public synchronized List<LedgerEvent> listForAsset(long assetId) {
        return events.stream()
            .filter(e -> e.concernsAsset(assetId))
            .toList();
    }

    @Override
    public synchronized List<LedgerEvent> listForOffer(long offerId) {
        return events.stream()
            .filter(e -> e.concernsOffer(offerId))
            .toList();
    }

    @Override
    public synchronized long latestSeq() {
        return events.size();
    }
}
