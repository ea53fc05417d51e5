package dk.trustworks.leaveledger.aggregates.attendance.dto;

import dk.trustworks.leaveledger.aggregates.attendance.model.AttendanceRecord;

/**
 * @param penalty outcome of the penalty assessment, null when the assessment failed
 */
public record ClockInResponse(AttendanceRecord record, PenaltyAssessment penalty) {
}
