package dk.trustworks.leaveledger.aggregates.attendance.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record AttendanceStats(LocalDate monthStart, int presentDays, LocalDate weekStart, BigDecimal weeklyHours) {
}
