package dk.trustworks.leaveledger.aggregates.leave.model.enums;

public enum RequestOrigin {
    /** Filed by the employee themselves. */
    EMPLOYEE,
    /** Filed by HR or an admin; no allotment or balance check at submission. */
    ADMINISTRATIVE,
    /** Created by the attendance penalty engine, approved on creation. */
    PENALTY_DEDUCTION
}
