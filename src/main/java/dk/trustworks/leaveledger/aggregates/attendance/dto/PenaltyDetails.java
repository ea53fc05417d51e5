package dk.trustworks.leaveledger.aggregates.attendance.dto;

import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record PenaltyDetails(String penaltyUuid,
                             LocalDate penaltyDate,
                             LocalDateTime clockInTime,
                             String threshold,
                             BigDecimal penaltyAmount,
                             String reason,
                             int graceCount,
                             int lateArrivalCount,
                             List<LateArrival> lateArrivals,
                             PenaltyBalance balance) {

    /**
     * Balance of the category penalties are charged to; null when the employee holds no allotment of it.
     */
    public record PenaltyBalance(String categoryName, LeaveAmount total, LeaveAmount deducted, LeaveAmount remaining) {
    }
}
