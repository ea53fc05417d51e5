package dk.trustworks.leaveledger.exceptions;

public class InvalidLeaveAmountException extends LeaveLedgerException {

    public InvalidLeaveAmountException(String message) {
        super(ErrorType.INVALID_AMOUNT, message);
    }
}
