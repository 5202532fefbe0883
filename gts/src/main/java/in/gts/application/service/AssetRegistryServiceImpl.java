package in.gts.application.service;

import in.gts.application.port.input.AssetRegistryService;
import in.gts.application.port.output.AssetRepository;
import in.gts.domain.common.EventType;
import in.gts.domain.error.LedgerException;
import in.gts.domain.error.UnauthorizedException;
import in.gts.domain.event.LedgerEvent;
import in.gts.domain.event.Notifications;
import in.gts.domain.model.Asset;
import in.gts.domain.model.AssetData;
import in.gts.domain.model.Principal;
import in.gts.infrastructure.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

/**
 * AssetRegistryServiceImpl - Single owner of the asset table.
 *
 * ENFORCEMENT CONTRACT:
 * - ONLY this service inserts, re-owns or deletes asset records
 * - Every operation runs as one LedgerCoordinator unit
 * - The PrincipalIndex is updated in the same unit as the record
 * - A change is applied only after its event is stored
 * - Ownership moves are reachable only from settlement (package-private {@link #transfer})
 */
public final class AssetRegistryServiceImpl implements AssetRegistryService {
    private static final Logger log = LoggerFactory.getLogger(AssetRegistryServiceImpl.class);

    private final AssetRepository assetRepo;
    private final PrincipalIndex index;
    private final EventService eventService;
    private final LedgerCoordinator coordinator;
    private final LedgerMetrics metrics;

    public AssetRegistryServiceImpl(
        AssetRepository assetRepo,
        PrincipalIndex index,
        EventService eventService,
        LedgerCoordinator coordinator,
        LedgerMetrics metrics
    ) {
        this.assetRepo = assetRepo;
        this.index = index;
        this.eventService = eventService;
        this.coordinator = coordinator;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MUTATIONS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public long issue(Principal caller, Principal owner, AssetData data) {
        requireReal(caller, "caller");
        requireReal(owner, "owner");
        Objects.requireNonNull(data, "data");

        return coordinator.execute("issue", () -> {
            long assetId = assetRepo.nextId();
            Asset asset = new Asset(assetId, owner, caller, data, Instant.now());

            LedgerEvent issued = eventService.assetEvent(EventType.ASSET_ISSUED, assetId, null,
                new Notifications.Issuance(assetId, owner, caller, data), caller);
            eventService.commit(List.of(issued), () -> {
                assetRepo.insert(asset);
                index.addAsset(owner, assetId);
            });
            metrics.recordIssued();

            log.info("Asset issued: {} (owner={}, emitter={}, {} bytes)", assetId, owner, caller, data.length());
            return assetId;
        });
    }

    @Override
    public void retract(Principal caller, long assetId) {
        Objects.requireNonNull(caller, "caller");

        coordinator.run("retract", () -> {
            Optional<Asset> existing = assetRepo.findById(assetId);

            // A missing asset has no emitter, so no caller can match it
            if (existing.isEmpty() || !existing.get().isEmittedBy(caller)) {
                throw reject("retract", new UnauthorizedException("retract", caller,
                    existing.isEmpty()
                        ? "asset " + assetId + " does not exist"
                        : "asset " + assetId + " was emitted by " + existing.get().emitter()));
            }

            Asset asset = existing.get();
            LedgerEvent retracted = eventService.assetEvent(EventType.ASSET_RETRACTED, assetId, null,
                new Notifications.Retraction(assetId), caller);
            eventService.commit(List.of(retracted), () -> {
                assetRepo.delete(assetId);
                index.removeAsset(asset.owner(), assetId);
            });
            metrics.recordRetracted();

            log.info("Asset retracted: {} (owner was {}, emitter={})", assetId, asset.owner(), caller);
        });
    }

    /**
     * Move an asset to a new owner. Settlement only.
     *
     * Unconditional: the caller (settlement) has already validated current ownership
     * and stored the move's event. Must run inside the settling unit.
     *
     * @return the previous owner
     */
    Principal transfer(long assetId, Principal newOwner) {
        if (!coordinator.inUnit()) {
            throw new IllegalStateException("transfer must run inside a ledger unit");
        }

        Asset current = assetRepo.findById(assetId)
            .orElseThrow(() -> new IllegalStateException("Validated asset vanished during settlement: " + assetId));
        Principal previousOwner = current.owner();

        assetRepo.updateOwner(assetId, newOwner);
        index.moveAsset(assetId, previousOwner, newOwner);

        log.debug("Ownership moved: asset {} {} → {}", assetId, previousOwner, newOwner);
        return previousOwner;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public Optional<Asset> get(long assetId) {
        return coordinator.execute("getAsset", () -> assetRepo.findById(assetId));
    }

    @Override
    public SortedSet<Long> inventoryOf(Principal principal) {
        Objects.requireNonNull(principal, "principal");
        return coordinator.execute("inventoryOf", () -> index.assetsOwnedBy(principal));
    }

    @Override
    public int countOwnedBy(Principal principal) {
        Objects.requireNonNull(principal, "principal");
        return coordinator.execute("countOwnedBy", () -> index.countOwnedBy(principal));
    }

    /**
     * Current owner of an asset, read inside the calling unit. Settlement only.
     */
    Optional<Principal> currentOwner(long assetId) {
        return assetRepo.findById(assetId).map(Asset::owner);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════════════

    private LedgerException reject(String operation, LedgerException e) {
        metrics.recordRejection(operation, e.getCode());
        log.warn("Rejected {}: {}", operation, e.getMessage());
        return e;
    }

    private static void requireReal(Principal principal, String role) {
        Objects.requireNonNull(principal, role);
        if (principal.isPublic()) {
            throw new IllegalArgumentException("The public sentinel cannot be an asset " + role);
        }
    }
}
