package dk.trustworks.leaveledger.aggregates.leave.dto;

import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;

public record BalanceCheck(boolean sufficient, LeaveAmount remaining, LeaveAmount requested) {
}
