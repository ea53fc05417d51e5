package dk.trustworks.leaveledger.aggregates.leave.model.enums;

/**
 * Unit a leave category is measured in. Amounts of different units are never combined.
 */
public enum LeaveUnit {
    /** Whole, half or fractional days, one decimal. */
    DAYS,
    /** Short leave counted in hours and minutes. */
    HOURS_MINUTES
}
