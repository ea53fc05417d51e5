package dk.trustworks.leaveledger.exceptions;

public class InvalidCategoryException extends LeaveLedgerException {

    public InvalidCategoryException(String message) {
        super(ErrorType.INVALID_CATEGORY, message);
    }
}
