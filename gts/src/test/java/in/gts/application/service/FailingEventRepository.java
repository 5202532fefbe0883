package in.gts.application.service;

import in.gts.application.port.output.LedgerEventRepository;
import in.gts.domain.event.LedgerEvent;
import in.gts.infrastructure.persistence.InMemoryLedgerEventRepository;

import java.util.List;

/**
 * In-memory event log that refuses every batch from the given one onward (1-based),
 * the way the PostgreSQL log surfaces a lost connection.
 */
final class FailingEventRepository implements LedgerEventRepository {

    private final InMemoryLedgerEventRepository delegate = new InMemoryLedgerEventRepository();
    private final int failFromBatch;
    private int batches;

    FailingEventRepository(int failFromBatch) {
        this.failFromBatch = failFromBatch;
    }

    @Override
    public synchronized List<LedgerEvent> appendAll(List<LedgerEvent> events) {
        if (++batches >= failFromBatch) {
            throw new IllegalStateException("Failed to append events");
        }
        return delegate.appendAll(events);
    }

    @Override
    public List<LedgerEvent> listAfterSeq(long afterSeq, int limit) {
        return delegate.listAfterSeq(afterSeq, limit);
    }

    @Override
    public List<LedgerEvent> listForAsset(long assetId) {
        return delegate.listForAsset(assetId);
    }

    @Override
    public List<LedgerEvent> listForOffer(long offerId) {
        return delegate.listForOffer(offerId);
    }

    @Override
    public long latestSeq() {
        return delegate.latestSeq();
    }

    List<LedgerEvent> stored() {
        return delegate.listAfterSeq(0, Integer.MAX_VALUE);
    }
}
