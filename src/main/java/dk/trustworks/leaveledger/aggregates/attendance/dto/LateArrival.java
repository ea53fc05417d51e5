package dk.trustworks.leaveledger.aggregates.attendance.dto;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * First late clock-in of a day.
 */
public record LateArrival(LocalDate date, LocalTime clockIn) {
}
