package in.gts.application.service;

import in.gts.domain.error.OwnershipMismatchException;
import in.gts.domain.model.Principal;
import in.gts.domain.model.TradeOffer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongFunction;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Settlement validation")
class SettlementValidatorTest {

    private static final Principal A = Principal.of("alice");
    private static final Principal B = Principal.of("bob");
    private static final Principal C = Principal.of("carol");

    private final Map<Long, Principal> owners = new HashMap<>();
    private final LongFunction<Optional<Principal>> lookup = id -> Optional.ofNullable(owners.get(id));

    private static TradeOffer offer(List<Long> mine, List<Long> theirs) {
        return TradeOffer.pending(9L, A, B, mine, theirs, Instant.now());
    }

    @Test
    @DisplayName("Plans offered moves first, then requested moves")
    void plan_ordersOfferedThenRequested() {
        owners.put(1L, A);
        owners.put(2L, A);
        owners.put(3L, B);

        List<SettlementValidator.Move> moves = SettlementValidator.plan(offer(List.of(2L, 1L), List.of(3L)), B, lookup);

        assertEquals(List.of(
            new SettlementValidator.Move(2L, A, B),
            new SettlementValidator.Move(1L, A, B),
            new SettlementValidator.Move(3L, B, A)), moves);
    }

    @Test
    @DisplayName("Collects every mismatch from both passes")
    void plan_collectsAllMismatches() {
        owners.put(1L, C);
        owners.put(3L, A);

        OwnershipMismatchException e = assertThrows(OwnershipMismatchException.class,
            () -> SettlementValidator.plan(offer(List.of(1L, 2L), List.of(3L)), B, lookup));

        List<OwnershipMismatchException.Mismatch> mismatches = e.getMismatches();
        assertEquals(3, mismatches.size());
        assertEquals(OwnershipMismatchException.Side.OFFERED, mismatches.get(0).side());
        assertEquals(Optional.of(C), mismatches.get(0).actualOwner());
        assertEquals(Optional.empty(), mismatches.get(1).actualOwner());
        assertEquals(OwnershipMismatchException.Side.REQUESTED, mismatches.get(2).side());
        assertEquals(B, mismatches.get(2).expectedOwner());
        assertTrue(e.getMessage().contains("3 asset(s)"));
    }

    @Test
    @DisplayName("Repeated ids produce one move")
    void plan_deduplicates() {
        owners.put(1L, A);

        List<SettlementValidator.Move> moves = SettlementValidator.plan(offer(List.of(1L, 1L, 1L), List.of()), B, lookup);

        assertEquals(1, moves.size());
    }

    @Test
    @DisplayName("Sender accepting their own public offer moves nothing")
    void plan_selfAcceptance_noOps() {
        owners.put(1L, A);
        TradeOffer publicOffer = TradeOffer.pending(3L, A, Principal.PUBLIC, List.of(1L), List.of(), Instant.now());

        assertTrue(SettlementValidator.plan(publicOffer, A, lookup).isEmpty());
    }

    @Test
    @DisplayName("Id on both sides cannot be held by both parties")
    void plan_sameIdBothSides_mismatch() {
        owners.put(1L, A);

        OwnershipMismatchException e = assertThrows(OwnershipMismatchException.class,
            () -> SettlementValidator.plan(offer(List.of(1L), List.of(1L)), B, lookup));

        assertEquals(OwnershipMismatchException.Side.REQUESTED, e.getMismatches().get(0).side());
    }
}
