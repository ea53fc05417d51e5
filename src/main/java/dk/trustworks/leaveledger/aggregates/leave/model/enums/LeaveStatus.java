package dk.trustworks.leaveledger.aggregates.leave.model.enums;

public enum LeaveStatus {
    PENDING,
    APPROVED,
    REJECTED
}
