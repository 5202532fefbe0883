package in.gts.application.service;

import in.gts.application.port.input.TradeOfferService;
import in.gts.application.port.output.TradeOfferRepository;
import in.gts.domain.common.EventType;
import in.gts.domain.error.InvalidStateException;
import in.gts.domain.error.LedgerException;
import in.gts.domain.error.UnauthorizedException;
import in.gts.domain.event.LedgerEvent;
import in.gts.domain.event.Notifications;
import in.gts.domain.model.OfferState;
import in.gts.domain.model.Principal;
import in.gts.domain.model.TradeOffer;
import in.gts.infrastructure.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TradeOfferServiceImpl - Single owner of the offer lifecycle.
 *
 * ENFORCEMENT CONTRACT:
 * - ONLY this service creates offers and transitions their state
 * - ONLY settlement (accept) moves asset ownership, via the registry's internal transfer
 * - A settlement's moves and its ACCEPTED transition are stored as one event batch
 *   before any of them is applied
 * - Every operation runs as one LedgerCoordinator unit: validation and mutation
 *   cannot be interleaved by another operation
 *
 * STATE MACHINE:
 * PENDING → CANCELLED | ACCEPTED | DECLINED (terminal)
 */
public final class TradeOfferServiceImpl implements TradeOfferService {
    private static final Logger log = LoggerFactory.getLogger(TradeOfferServiceImpl.class);

    private final TradeOfferRepository offerRepo;
    private final AssetRegistryServiceImpl registry;
    private final PrincipalIndex index;
    private final EventService eventService;
    private final LedgerCoordinator coordinator;
    private final LedgerMetrics metrics;

    public TradeOfferServiceImpl(
        TradeOfferRepository offerRepo,
        AssetRegistryServiceImpl registry,
        PrincipalIndex index,
        EventService eventService,
        LedgerCoordinator coordinator,
        LedgerMetrics metrics
    ) {
        this.offerRepo = offerRepo;
        this.registry = registry;
        this.index = index;
        this.eventService = eventService;
        this.coordinator = coordinator;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CREATE
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public long sendTradeOffer(Principal caller, Principal recipient, List<Long> myAssets, List<Long> theirAssets) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(myAssets, "myAssets");
        Objects.requireNonNull(theirAssets, "theirAssets");

        return coordinator.execute("sendTradeOffer", () -> {
            if (caller.isPublic()) {
                throw reject("sendTradeOffer", new UnauthorizedException("sendTradeOffer", caller,
                    "the public sentinel cannot send offers"));
            }

            long offerId = offerRepo.nextId();
            TradeOffer offer = TradeOffer.pending(offerId, caller, recipient, myAssets, theirAssets, Instant.now());

            LedgerEvent created = eventService.offerEvent(EventType.OFFER_CREATED, offerId,
                new Notifications.OfferCreated(offerId, caller, recipient, offer.myAssets(), offer.theirAssets()),
                caller);
            eventService.commit(List.of(created), () -> {
                offerRepo.insert(offer);
                index.addOffer(offer);
            });
            metrics.recordOfferTransition(OfferState.PENDING);

            log.info("Offer created: {} ({} → {}, offering {}, requesting {})",
                offerId, caller, recipient, offer.myAssets(), offer.theirAssets());
            return offerId;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // TRANSITIONS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void cancel(Principal caller, long offerId) {
        Objects.requireNonNull(caller, "caller");

        coordinator.run("cancel", () -> {
            TradeOffer offer = requireOffer("cancel", caller, offerId);
            if (!offer.sender().equals(caller)) {
                throw reject("cancel", new UnauthorizedException("cancel", caller,
                    "only sender " + offer.sender() + " may cancel offer " + offerId));
            }
            requirePending("cancel", offer);

            transition(offer, OfferState.CANCELLED, caller, List.of());
        });
    }

    @Override
    public void decline(Principal caller, long offerId) {
        Objects.requireNonNull(caller, "caller");

        coordinator.run("decline", () -> {
            TradeOffer offer = requireOffer("decline", caller, offerId);
            requireAddressee("decline", offer, caller);
            requirePending("decline", offer);

            transition(offer, OfferState.DECLINED, caller, List.of());
        });
    }

    @Override
    public void accept(Principal caller, long offerId) {
        Objects.requireNonNull(caller, "caller");

        coordinator.run("accept", () -> {
            long started = System.nanoTime();

            TradeOffer offer = requireOffer("accept", caller, offerId);
            requireAddressee("accept", offer, caller);
            requirePending("accept", offer);

            // Validate everything before touching anything
            List<SettlementValidator.Move> moves;
            try {
                moves = SettlementValidator.plan(offer, caller, registry::currentOwner);
            } catch (LedgerException e) {
                throw reject("accept", e);
            }

            transition(offer, OfferState.ACCEPTED, caller, moves);
            metrics.recordSettlement(moves.size(), Duration.ofNanos(System.nanoTime() - started));

            log.info("Offer settled: {} ({} ⇄ {}, {} ownership move(s))",
                offerId, offer.sender(), caller, moves.size());
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public Optional<TradeOffer> get(long offerId) {
        return coordinator.execute("getOffer", () -> offerRepo.findById(offerId));
    }

    @Override
    public List<Long> sentBy(Principal principal) {
        Objects.requireNonNull(principal, "principal");
        return coordinator.execute("sentBy", () -> index.offersSentBy(principal));
    }

    @Override
    public List<Long> receivedBy(Principal principal) {
        Objects.requireNonNull(principal, "principal");
        if (principal.isPublic()) {
            return List.of();
        }
        return coordinator.execute("receivedBy", () -> index.offersReceivedBy(principal));
    }

    @Override
    public List<Long> publicOffers() {
        return coordinator.execute("publicOffers", index::publicOffers);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * A missing offer has no sender or recipient, so no caller is authorized on it.
     */
    private TradeOffer requireOffer(String operation, Principal caller, long offerId) {
        return offerRepo.findById(offerId)
            .orElseThrow(() -> reject(operation, new UnauthorizedException(operation, caller,
                "offer " + offerId + " does not exist")));
    }

    private void requireAddressee(String operation, TradeOffer offer, Principal caller) {
        if (!offer.isAddressedTo(caller) || caller.isPublic()) {
            throw reject(operation, new UnauthorizedException(operation, caller,
                "offer " + offer.offerId() + " is addressed to " + offer.recipient()));
        }
    }

    private void requirePending(String operation, TradeOffer offer) {
        if (!offer.isPending()) {
            throw reject(operation, new InvalidStateException(operation, offer.offerId(), offer.state()));
        }
    }

    /**
     * Store the events for a transition and its ownership moves as one batch, then
     * apply the moves and the new state. Nothing changes if the batch is not stored.
     */
    private void transition(TradeOffer offer, OfferState newState, Principal caller,
                            List<SettlementValidator.Move> moves) {
        long offerId = offer.offerId();

        List<LedgerEvent> events = new ArrayList<>(moves.size() + 1);
        for (SettlementValidator.Move move : moves) {
            events.add(eventService.assetEvent(EventType.OWNERSHIP_MOVED, move.assetId(), offerId,
                new Notifications.OwnershipMove(move.assetId(), move.from(), move.to()), caller));
        }
        events.add(eventService.offerEvent(EventType.OFFER_STATE_CHANGED, offerId,
            new Notifications.OfferStateChanged(offerId, newState), caller));

        eventService.commit(events, () -> {
            for (SettlementValidator.Move move : moves) {
                registry.transfer(move.assetId(), move.to());
            }
            offerRepo.updateState(offerId, newState, Instant.now());
        });
        metrics.recordOfferTransition(newState);

        log.info("Offer {}: {} → {} by {}", offerId, offer.state(), newState, caller);
    }

    private LedgerException reject(String operation, LedgerException e) {
        metrics.recordRejection(operation, e.getCode());
        log.warn("Rejected {}: {}", operation, e.getMessage());
        return e;
    }
}
