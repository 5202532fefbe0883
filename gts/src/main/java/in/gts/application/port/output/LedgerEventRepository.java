package in.gts.application.port.output;

import in.gts.domain.event.LedgerEvent;

import java.util.List;

/**
 * Repository for ledger events (append-only log).
 */
public interface LedgerEventRepository {
    /**
     * Append a batch of events to the log, all or none.
     *
     * @return the events with their assigned sequence numbers, in input order
     * @throws IllegalStateException if the batch could not be stored; nothing is appended then
     */
    List<LedgerEvent> appendAll(List<LedgerEvent> events);

    /**
     * List events after a given sequence number, oldest first.
     */
    List<LedgerEvent> listAfterSeq(long afterSeq, int limit);

    /**
     * All events correlated with an asset, oldest first.
     */
    List<LedgerEvent> listForAsset(long assetId);

    /**
     * All events correlated with an offer, oldest first.
     */
    List<LedgerEvent> listForOffer(long offerId);

    /**
     * Get the latest sequence number (0 when empty).
     */
    long latestSeq();
}
