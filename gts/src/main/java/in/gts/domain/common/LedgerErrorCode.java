package in.gts.domain.common;

/**
 * Caller-visible failure kinds with their HTTP status. Every failure is terminal for the invocation.
 */
public enum LedgerErrorCode {
    UNAUTHORIZED(403),          // caller is not the principal the action requires
    INVALID_STATE(409),         // offer is not PENDING
    OWNERSHIP_MISMATCH(422);    // an asset is not held by the party claimed to hold it

    private final int httpStatus;

    LedgerErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
