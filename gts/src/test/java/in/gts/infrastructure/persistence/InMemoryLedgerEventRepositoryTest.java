package in.gts.infrastructure.persistence;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import in.gts.domain.common.EventType;
import in.gts.domain.event.LedgerEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-memory event log")
class InMemoryLedgerEventRepositoryTest {

    private InMemoryLedgerEventRepository repo;

    @BeforeEach
    void setUp() {
        repo = new InMemoryLedgerEventRepository();
        repo.appendAll(List.of(
            LedgerEvent.asset(EventType.ASSET_ISSUED, 1L, null, JsonNodeFactory.instance.objectNode(), "alice")));
        repo.appendAll(List.of(
            LedgerEvent.offer(EventType.OFFER_CREATED, 1L, JsonNodeFactory.instance.objectNode(), "alice"),
            LedgerEvent.asset(EventType.OWNERSHIP_MOVED, 1L, 1L, JsonNodeFactory.instance.objectNode(), "bob")));
    }

    @Test
    @DisplayName("Batches get consecutive sequence numbers from 1, in input order")
    void appendAll_assignsSeq() {
        assertEquals(3L, repo.latestSeq());
        assertEquals(List.of(1L, 2L, 3L), repo.listAfterSeq(0, 10).stream().map(LedgerEvent::seq).toList());

        List<LedgerEvent> persisted = repo.appendAll(List.of(
            LedgerEvent.offer(EventType.OFFER_STATE_CHANGED, 1L, JsonNodeFactory.instance.objectNode(), "bob"),
            LedgerEvent.asset(EventType.ASSET_RETRACTED, 1L, null, JsonNodeFactory.instance.objectNode(), "alice")));
        assertEquals(List.of(4L, 5L), persisted.stream().map(LedgerEvent::seq).toList());
        assertEquals(EventType.OFFER_STATE_CHANGED, persisted.get(0).type());
    }

    @Test
    @DisplayName("An empty batch appends nothing")
    void appendAll_empty() {
        assertTrue(repo.appendAll(List.of()).isEmpty());
        assertEquals(3L, repo.latestSeq());
    }

    @Test
    @DisplayName("Pages start after the given sequence and respect the limit")
    void listAfterSeq_pages() {
        assertEquals(List.of(2L), repo.listAfterSeq(1, 1).stream().map(LedgerEvent::seq).toList());
        assertTrue(repo.listAfterSeq(3, 10).isEmpty());
        assertTrue(repo.listAfterSeq(50, 10).isEmpty());
        assertTrue(repo.listAfterSeq(0, 0).isEmpty());
    }

    @Test
    @DisplayName("Correlation lookups include settlement moves")
    void listFor_correlation() {
        assertEquals(List.of(EventType.ASSET_ISSUED, EventType.OWNERSHIP_MOVED),
            repo.listForAsset(1L).stream().map(LedgerEvent::type).toList());
        assertEquals(List.of(EventType.OFFER_CREATED, EventType.OWNERSHIP_MOVED),
            repo.listForOffer(1L).stream().map(LedgerEvent::type).toList());
        assertTrue(repo.listForAsset(2L).isEmpty());
    }
}
