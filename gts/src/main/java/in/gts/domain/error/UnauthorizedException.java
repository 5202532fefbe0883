package in.gts.domain.error;

import in.gts.domain.common.LedgerErrorCode;
import in.gts.domain.model.Principal;

/**
 * Thrown when the caller is not the principal an action requires
 * (emitter on retract, sender on cancel, recipient on accept/decline).
 */
public class UnauthorizedException extends LedgerException {

    private final String action;
    private final Principal caller;

    public UnauthorizedException(String action, Principal caller, String reason) {
        super(LedgerErrorCode.UNAUTHORIZED,
            String.format("[%s] %s not permitted: %s", action, caller, reason));
        this.action = action;
        this.caller = caller;
    }

    public String getAction() {
        return action;
    }

    public Principal getCaller() {
        return caller;
    }
}
