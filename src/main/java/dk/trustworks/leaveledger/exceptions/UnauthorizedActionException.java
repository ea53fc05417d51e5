package dk.trustworks.leaveledger.exceptions;

public class UnauthorizedActionException extends LeaveLedgerException {

    public UnauthorizedActionException(String message) {
        super(ErrorType.UNAUTHORIZED, message);
    }
}
