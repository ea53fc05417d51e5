package dk.trustworks.leaveledger.exceptions;

import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import lombok.Getter;

@Getter
public class InsufficientBalanceException extends LeaveLedgerException {

    private final LeaveAmount remaining;
    private final LeaveAmount requested;

    public InsufficientBalanceException(LeaveAmount remaining, LeaveAmount requested) {
        super(ErrorType.INSUFFICIENT_BALANCE,
                "Insufficient leave balance. You have " + remaining.display()
                        + " remaining, but requested " + requested.display() + ".");
        this.remaining = remaining;
        this.requested = requested;
    }
}
