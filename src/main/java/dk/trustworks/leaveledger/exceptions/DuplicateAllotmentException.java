package dk.trustworks.leaveledger.exceptions;

public class DuplicateAllotmentException extends LeaveLedgerException {

    public DuplicateAllotmentException(String message) {
        super(ErrorType.DUPLICATE_ALLOTMENT, message);
    }
}
