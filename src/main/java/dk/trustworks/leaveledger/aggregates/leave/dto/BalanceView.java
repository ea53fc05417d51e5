package dk.trustworks.leaveledger.aggregates.leave.dto;

import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;

public record BalanceView(String employeeUuid, String categoryUuid, String categoryName,
                          LeaveAmount granted, LeaveAmount used, LeaveAmount remaining) {
}
