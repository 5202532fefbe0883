package in.gts.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.gts.application.port.output.LedgerEventRepository;
import in.gts.domain.common.EventType;
import in.gts.domain.event.LedgerEvent;
import in.gts.domain.event.LedgerEventListener;
import in.gts.domain.model.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event Service.
 * Reliability rule: persist a unit's events first (repository, one batch), then
 * apply the state change, then push to listeners.
 *
 * A unit whose events cannot be stored changes nothing. Event queries run as
 * ledger units, so a reader never sees the events of a settlement without its
 * effects or the other way round.
 */
public final class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LedgerEventRepository repo;
    private final LedgerCoordinator coordinator;
    private final List<LedgerEventListener> listeners = new CopyOnWriteArrayList<>();

    public EventService(LedgerEventRepository repo, LedgerCoordinator coordinator) {
        this.repo = repo;
        this.coordinator = coordinator;
    }

    public void subscribe(LedgerEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(LedgerEventListener listener) {
        listeners.remove(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // DRAFT
    // ═══════════════════════════════════════════════════════════════

    /**
     * Draft an asset-scoped event (no sequence yet).
     *
     * @param offerId Settling offer for moves caused by acceptance, else null
     */
    public LedgerEvent assetEvent(EventType type, long assetId, Long offerId, Object payloadPojo, Principal actor) {
        JsonNode payload = MAPPER.valueToTree(payloadPojo);
        return LedgerEvent.asset(type, assetId, offerId, payload, actor.id());
    }

    /**
     * Draft an offer-scoped event (no sequence yet).
     */
    public LedgerEvent offerEvent(EventType type, long offerId, Object payloadPojo, Principal actor) {
        JsonNode payload = MAPPER.valueToTree(payloadPojo);
        return LedgerEvent.offer(type, offerId, payload, actor.id());
    }

    // ═══════════════════════════════════════════════════════════════
    // COMMIT
    // ═══════════════════════════════════════════════════════════════

    /**
     * Persist a unit's drafted events, then apply its state change, then notify listeners.
     *
     * The change must not fail: every check belongs before this call.
     *
     * @param drafts Events describing the change, in order
     * @param change In-memory mutation described by the drafts
     * @return the persisted events
     * @throws IllegalStateException if the events could not be stored (change not applied)
     *         or if called outside a ledger unit
     */
    public List<LedgerEvent> commit(List<LedgerEvent> drafts, Runnable change) {
        if (!coordinator.inUnit()) {
            throw new IllegalStateException("Events must be committed inside a ledger unit");
        }

        // Persist first (source of truth)
        List<LedgerEvent> persisted = repo.appendAll(drafts);

        change.run();

        for (LedgerEvent event : persisted) {
            publish(event);
        }
        return persisted;
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERY
    // ═══════════════════════════════════════════════════════════════

    public List<LedgerEvent> listAfterSeq(long afterSeq, int limit) {
        return coordinator.execute("listEvents", () -> repo.listAfterSeq(afterSeq, limit));
    }

    public List<LedgerEvent> listForAsset(long assetId) {
        return coordinator.execute("assetEvents", () -> repo.listForAsset(assetId));
    }

    public List<LedgerEvent> listForOffer(long offerId) {
        return coordinator.execute("offerEvents", () -> repo.listForOffer(offerId));
    }

    /**
     * Get current latest sequence number.
     */
    public long currentSeq() {
        return coordinator.execute("currentSeq", repo::latestSeq);
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void publish(LedgerEvent persisted) {
        for (LedgerEventListener listener : listeners) {
            try {
                listener.onEvent(persisted);
            } catch (RuntimeException ex) {
                // A failing subscriber must not undo an applied state change
                log.error("Listener failed on event seq={} type={}: {}",
                          persisted.seq(), persisted.type(), ex.getMessage(), ex);
            }
        }

        log.debug("Event emitted: seq={}, type={}, assetId={}, offerId={}",
                  persisted.seq(), persisted.type(), persisted.assetId(), persisted.offerId());
    }
}
