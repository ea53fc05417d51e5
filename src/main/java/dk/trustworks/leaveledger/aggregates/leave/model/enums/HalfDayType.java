package dk.trustworks.leaveledger.aggregates.leave.model.enums;

public enum HalfDayType {
    FIRST_HALF,
    SECOND_HALF
}
