package dk.trustworks.leaveledger.exceptions;

public class SelfApprovalForbiddenException extends LeaveLedgerException {

    public SelfApprovalForbiddenException(String message) {
        super(ErrorType.SELF_APPROVAL_FORBIDDEN, message);
    }
}
