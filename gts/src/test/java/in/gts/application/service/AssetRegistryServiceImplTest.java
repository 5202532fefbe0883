package in.gts.application.service;

import in.gts.domain.common.EventType;
import in.gts.domain.common.LedgerErrorCode;
import in.gts.domain.error.UnauthorizedException;
import in.gts.domain.event.LedgerEvent;
import in.gts.domain.model.Asset;
import in.gts.domain.model.AssetData;
import in.gts.domain.model.Principal;
import in.gts.infrastructure.metrics.LedgerMetrics;
import in.gts.infrastructure.persistence.InMemoryAssetRepository;
import in.gts.infrastructure.persistence.InMemoryLedgerEventRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Asset registry")
class AssetRegistryServiceImplTest {

    private static final Principal A = Principal.of("alice");
    private static final Principal B = Principal.of("bob");
    private static final Principal C = Principal.of("carol");

    @Mock
    private LedgerMetrics metrics;

    private LedgerCoordinator coordinator;
    private PrincipalIndex index;
    private EventService eventService;
    private AssetRegistryServiceImpl registry;

    @BeforeEach
    void setUp() {
        coordinator = new LedgerCoordinator();
        index = new PrincipalIndex();
        eventService = new EventService(new InMemoryLedgerEventRepository(), coordinator);
        registry = new AssetRegistryServiceImpl(new InMemoryAssetRepository(), index, eventService, coordinator, metrics);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    @Test
    @DisplayName("Issued asset records owner, emitter and data")
    void issue_recordsOwnerEmitterAndData() {
        long id = registry.issue(A, B, AssetData.fromHex("0xabcd"));

        Asset asset = registry.get(id).orElseThrow();
        assertEquals(1L, id);
        assertEquals(B, asset.owner());
        assertEquals(A, asset.emitter());
        assertEquals("0xabcd", asset.data().toHex());
        assertEquals(List.of(1L), List.copyOf(registry.inventoryOf(B)));
        assertTrue(registry.inventoryOf(A).isEmpty());
        verify(metrics).recordIssued();
    }

    @Test
    @DisplayName("Issue emits one ASSET_ISSUED event with the issuance payload")
    void issue_emitsIssuanceEvent() {
        long id = registry.issue(A, B, AssetData.fromHex("abcd"));

        List<LedgerEvent> events = eventService.listForAsset(id);
        assertEquals(1, events.size());
        LedgerEvent event = events.get(0);
        assertEquals(EventType.ASSET_ISSUED, event.type());
        assertEquals("alice", event.createdBy());
        assertEquals("bob", event.payload().get("owner").asText());
        assertEquals("alice", event.payload().get("emitter").asText());
        assertEquals("0xabcd", event.payload().get("data").asText());
        assertNull(event.offerId());
    }

    @Test
    @DisplayName("Ids strictly increase and are not reused after retraction")
    void issue_idsNeverReused() {
        long first = registry.issue(A, A, AssetData.EMPTY);
        long second = registry.issue(A, A, AssetData.EMPTY);
        registry.retract(A, second);
        long third = registry.issue(A, A, AssetData.EMPTY);

        assertTrue(first < second && second < third);
        assertEquals(3L, third);
    }

    @Test
    @DisplayName("Public sentinel cannot issue or own assets")
    void issue_rejectsPublicSentinel() {
        assertThrows(IllegalArgumentException.class, () -> registry.issue(Principal.PUBLIC, A, AssetData.EMPTY));
        assertThrows(IllegalArgumentException.class, () -> registry.issue(A, Principal.PUBLIC, AssetData.EMPTY));
        assertTrue(registry.get(1).isEmpty());
    }

    @Test
    @DisplayName("Emitter retracts: asset gone from registry and inventory")
    void retract_byEmitter_removesAsset() {
        long id = registry.issue(A, B, AssetData.EMPTY);

        registry.retract(A, id);

        assertEquals(Optional.empty(), registry.get(id));
        assertFalse(registry.inventoryOf(B).contains(id));
        assertEquals(0, registry.countOwnedBy(B));
        assertEquals(EventType.ASSET_RETRACTED, eventService.listForAsset(id).get(1).type());
        verify(metrics).recordRetracted();
    }

    @Test
    @DisplayName("Non-emitter retraction fails Unauthorized and changes nothing")
    void retract_byNonEmitter_unauthorized() {
        long id = registry.issue(A, B, AssetData.EMPTY);
        long seqBefore = eventService.currentSeq();

        UnauthorizedException e = assertThrows(UnauthorizedException.class, () -> registry.retract(C, id));

        assertEquals(LedgerErrorCode.UNAUTHORIZED, e.getCode());
        assertEquals(C, e.getCaller());
        assertEquals("retract", e.getAction());
        assertEquals(B, registry.get(id).orElseThrow().owner());
        assertTrue(registry.inventoryOf(B).contains(id));
        assertEquals(seqBefore, eventService.currentSeq());
        verify(metrics).recordRejection("retract", LedgerErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("Owner who is not the emitter cannot retract")
    void retract_byOwner_unauthorized() {
        long id = registry.issue(A, B, AssetData.EMPTY);

        assertThrows(UnauthorizedException.class, () -> registry.retract(B, id));
        assertTrue(registry.get(id).isPresent());
    }

    @Test
    @DisplayName("Retracting a missing or already retracted asset fails Unauthorized")
    void retract_missingAsset_unauthorized() {
        assertThrows(UnauthorizedException.class, () -> registry.retract(A, 42));

        long id = registry.issue(A, A, AssetData.EMPTY);
        registry.retract(A, id);
        assertThrows(UnauthorizedException.class, () -> registry.retract(A, id));
    }

    @Test
    @DisplayName("Count and inventory track every owner")
    void countOwnedBy_tracksInventory() {
        registry.issue(A, B, AssetData.EMPTY);
        registry.issue(A, B, AssetData.EMPTY);
        registry.issue(C, A, AssetData.EMPTY);

        assertEquals(2, registry.countOwnedBy(B));
        assertEquals(1, registry.countOwnedBy(A));
        assertEquals(0, registry.countOwnedBy(C));
        assertEquals(List.of(1L, 2L), List.copyOf(registry.inventoryOf(B)));
    }

    @Test
    @DisplayName("Transfer outside a ledger unit is refused")
    void transfer_outsideUnit_refused() {
        long id = registry.issue(A, A, AssetData.EMPTY);

        assertThrows(IllegalStateException.class, () -> registry.transfer(id, B));
        assertEquals(A, registry.get(id).orElseThrow().owner());
    }

    @Test
    @DisplayName("Transfer inside a unit moves owner and index; the move's event belongs to the settlement")
    void transfer_insideUnit_movesOwner() {
        long id = registry.issue(A, A, AssetData.EMPTY);

        Principal previous = coordinator.execute("test", () -> registry.transfer(id, B));

        assertEquals(A, previous);
        assertEquals(B, registry.get(id).orElseThrow().owner());
        assertTrue(registry.inventoryOf(B).contains(id));
        assertFalse(registry.inventoryOf(A).contains(id));
        assertEquals(List.of(EventType.ASSET_ISSUED),
            eventService.listForAsset(id).stream().map(LedgerEvent::type).toList());
    }

    @Test
    @DisplayName("Issue and retract change nothing when the event log refuses the write")
    void eventLogFailure_changesNothing() {
        FailingEventRepository failing = new FailingEventRepository(2);
        EventService events = new EventService(failing, coordinator);
        AssetRegistryServiceImpl guarded =
            new AssetRegistryServiceImpl(new InMemoryAssetRepository(), index, events, coordinator, metrics);

        long id = guarded.issue(A, B, AssetData.EMPTY);
        assertThrows(IllegalStateException.class, () -> guarded.retract(A, id));

        assertEquals(B, guarded.get(id).orElseThrow().owner());
        assertEquals(List.of(id), List.copyOf(guarded.inventoryOf(B)));
        verify(metrics, never()).recordRetracted();

        assertThrows(IllegalStateException.class, () -> guarded.issue(A, C, AssetData.EMPTY));
        assertTrue(guarded.inventoryOf(C).isEmpty());
        assertEquals(1, failing.stored().size());
    }
}
