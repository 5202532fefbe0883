package in.gts.domain.common;

/**
 * Ledger notification types.
 * Each state change emits exactly one event, after the change is recorded.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // ASSET REGISTRY
    // ═══════════════════════════════════════════════════════════════
    ASSET_ISSUED,
    ASSET_RETRACTED,
    OWNERSHIP_MOVED,

    // ═══════════════════════════════════════════════════════════════
    // TRADE OFFERS
    // ═══════════════════════════════════════════════════════════════
    OFFER_CREATED,
    OFFER_STATE_CHANGED
}
