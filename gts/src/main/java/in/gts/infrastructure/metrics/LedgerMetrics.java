package in.gts.infrastructure.metrics;

import in.gts.domain.common.LedgerErrorCode;
import in.gts.domain.model.OfferState;

import java.time.Duration;

/**
 * Ledger metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Issuance / retraction counts
 * - Offer transitions by resulting state
 * - Rejected operations by error code
 * - Settlement latency and size
 * - Live table sizes
 */
public interface LedgerMetrics {

    /**
     * Record an issued asset (also raises the live asset gauge).
     */
    void recordIssued();

    /**
     * Record a retracted asset (also lowers the live asset gauge).
     */
    void recordRetracted();

    /**
     * Record an offer entering a state (PENDING on creation, or a terminal state).
     * Entering PENDING raises the pending gauge, entering a terminal state lowers it.
     */
    void recordOfferTransition(OfferState state);

    /**
     * Record a rejected operation.
     *
     * @param operation Operation name (issue, retract, accept, ...)
     * @param code Failure kind
     */
    void recordRejection(String operation, LedgerErrorCode code);

    /**
     * Record a completed settlement.
     *
     * @param assetsMoved Number of ownership moves applied
     * @param latency Time spent validating and applying the swap
     */
    void recordSettlement(int assetsMoved, Duration latency);
}
