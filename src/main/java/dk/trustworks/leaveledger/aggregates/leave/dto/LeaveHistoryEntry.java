package dk.trustworks.leaveledger.aggregates.leave.dto;

import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;

import java.time.LocalDate;

/**
 * One line of the derived balance history of an allotment.
 */
public record LeaveHistoryEntry(EntryType type, String referenceUuid, LocalDate date,
                                LeaveAmount amount, LeaveAmount balanceAfter, String description) {

    public enum EntryType {
        ALLOTTED,
        CONSUMED,
        PENALTY_DEDUCTION
    }
}
