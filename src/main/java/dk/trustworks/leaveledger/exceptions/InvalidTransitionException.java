package dk.trustworks.leaveledger.exceptions;

public class InvalidTransitionException extends LeaveLedgerException {

    public InvalidTransitionException(String message) {
        super(ErrorType.INVALID_TRANSITION, message);
    }
}
