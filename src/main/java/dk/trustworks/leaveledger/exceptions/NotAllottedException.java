package dk.trustworks.leaveledger.exceptions;

public class NotAllottedException extends LeaveLedgerException {

    public NotAllottedException(String message) {
        super(ErrorType.NOT_ALLOTTED, message);
    }
}
