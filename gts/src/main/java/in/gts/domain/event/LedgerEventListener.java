package in.gts.domain.event;

/**
 * Receives ledger events after they are persisted.
 *
 * Called on the ledger writer thread, inside the operation that produced the event.
 */
@FunctionalInterface
public interface LedgerEventListener {
    void onEvent(LedgerEvent event);
}
