package in.gts.domain.error;

import in.gts.domain.common.LedgerErrorCode;

/**
 * Base exception for rejected ledger operations.
 *
 * A thrown LedgerException means the invocation had no effect: no record changed
 * and no notification was emitted.
 */
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    protected LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public LedgerErrorCode getCode() {
        return code;
    }
}
