package dk.trustworks.leaveledger.aggregates.attendance.services;

import dk.trustworks.leaveledger.aggregates.attendance.dto.LateArrival;
import dk.trustworks.leaveledger.aggregates.attendance.model.AttendanceRecord;
import dk.trustworks.leaveledger.aggregates.attendance.model.ClockInThreshold;
import dk.trustworks.leaveledger.aggregates.attendance.repositories.AttendanceRepository;
import dk.trustworks.leaveledger.aggregates.employees.model.Employee;
import dk.trustworks.leaveledger.config.services.LedgerSettingsService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Threshold resolution and late-day counting shared by the assessor and the penalty read path.
 * Days are calendar days in the server's local time zone.
 */
@JBossLog
@ApplicationScoped
public class LatenessCalculator {

    @Inject
    LedgerSettingsService settingsService;

    @Inject
    AttendanceRepository attendanceRepository;

    /**
     * The employee's own threshold when set, otherwise the global default.
     */
    public Optional<ClockInThreshold> resolveThreshold(Employee employee) {
        String override = employee.getClockInThreshold();
        if (override != null && !override.isBlank()) {
            try {
                return ClockInThreshold.parse(override);
            } catch (IllegalArgumentException e) {
                log.warnf("Employee %s has an invalid clock-in threshold '%s', using the default", employee.getUuid(), override);
            }
        }
        return settingsService.defaultClockInThreshold();
    }

    /**
     * Late days from the first of {@code day}'s month through {@code day}, one entry per day
     * holding its first late clock-in.
     */
    public List<LateArrival> lateArrivals(String employeeUuid, LocalDate day, ClockInThreshold threshold) {
        LocalDateTime from = day.withDayOfMonth(1).atStartOfDay();
        LocalDateTime to = day.plusDays(1).atStartOfDay();
        Map<LocalDate, LateArrival> byDay = new TreeMap<>();
        for (AttendanceRecord record : attendanceRepository.findClockInsBetween(employeeUuid, from, to)) {
            if (threshold.isLate(record.getClockIn().toLocalTime())) {
                LocalDate date = record.getClockIn().toLocalDate();
                byDay.putIfAbsent(date, new LateArrival(date, record.getClockIn().toLocalTime()));
            }
        }
        return new ArrayList<>(byDay.values());
    }
}
