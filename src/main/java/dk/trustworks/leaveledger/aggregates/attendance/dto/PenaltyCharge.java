package dk.trustworks.leaveledger.aggregates.attendance.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Everything needed to write a penalty and its deduction.
 */
public record PenaltyCharge(String employeeUuid, LocalDateTime clockIn, String threshold,
                            int graceCount, int lateArrivalCount, BigDecimal amountDays) {

    public String penaltyReason() {
        return String.format("Late clock-in (%s) after time limit (%s) - Exceeded max late days (%d/%d)",
                clockIn.toLocalTime().withSecond(0).withNano(0), threshold, lateArrivalCount, graceCount);
    }

    public String deductionReason() {
        return String.format("Penalty: Late clock-in exceeded max days (%d/%d)", lateArrivalCount, graceCount);
    }
}
