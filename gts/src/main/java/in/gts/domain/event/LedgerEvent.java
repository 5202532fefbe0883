package in.gts.domain.event;

import com.fasterxml.jackson.databind.JsonNode;
import in.gts.domain.common.EventType;

import java.time.Instant;

/**
 * Ledger event with asset/offer correlation.
 * seq is assigned by the event repository on append (0 before that).
 */
public record LedgerEvent(
    long seq,
    EventType type,

    // Correlation
    Long assetId,            // null for offer-level events
    Long offerId,            // set for offer events and for moves caused by settlement

    // Payload
    JsonNode payload,

    // Metadata
    Instant ts,
    String createdBy         // principal id of the acting caller
) {
    /**
     * Create an asset-scoped event.
     */
    public static LedgerEvent asset(EventType type, long assetId, Long offerId, JsonNode payload, String createdBy) {
        return new LedgerEvent(0, type, assetId, offerId, payload, Instant.now(), createdBy);
    }

    /**
     * Create an offer-scoped event.
     */
    public static LedgerEvent offer(EventType type, long offerId, JsonNode payload, String createdBy) {
        return new LedgerEvent(0, type, null, offerId, payload, Instant.now(), createdBy);
    }

    public LedgerEvent withSeq(long newSeq) {
        return new LedgerEvent(newSeq, type, assetId, offerId, payload, ts, createdBy);
    }

    public boolean concernsAsset(long id) {
        return assetId != null && assetId == id;
    }

    public boolean concernsOffer(long id) {
        return offerId != null && offerId == id;
    }
}
