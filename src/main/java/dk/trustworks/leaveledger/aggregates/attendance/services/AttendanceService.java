package dk.trustworks.leaveledger.aggregates.attendance.services;

import dk.trustworks.leaveledger.aggregates.attendance.dto.AttendanceStats;
import dk.trustworks.leaveledger.aggregates.attendance.dto.ClockInResponse;
import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyAssessment;
import dk.trustworks.leaveledger.aggregates.attendance.model.AttendanceRecord;
import dk.trustworks.leaveledger.aggregates.attendance.repositories.AttendanceRepository;
import dk.trustworks.leaveledger.exceptions.RecordNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.HashSet;
import java.util.Set;

@JBossLog
@ApplicationScoped
public class AttendanceService {

    static final LocalTime AUTO_CLOCK_OUT_TIME = LocalTime.of(23, 11);

    @Inject
    AttendanceRepository attendanceRepository;

    @Inject
    AttendancePenaltyAssessor penaltyAssessor;

    Clock clock = Clock.systemDefaultZone();

    /**
     * Records a clock-in and assesses it for lateness. The clock-in is kept even when the
     * assessment fails.
     */
    @Transactional
    public ClockInResponse clockIn(String employeeUuid) {
        AttendanceRecord record = AttendanceRecord.clockIn(employeeUuid, LocalDateTime.now(clock));
        attendanceRepository.persist(record);
        log.infof("Employee %s clocked in at %s", employeeUuid, record.getClockIn());

        PenaltyAssessment assessment = null;
        try {
            assessment = penaltyAssessor.assess(employeeUuid, record.getClockIn());
            if (assessment.isPenaltyCreated()) {
                log.infof("Clock-in of employee %s triggered penalty %s", employeeUuid, assessment.penaltyUuid());
            }
        } catch (RuntimeException e) {
            log.errorf(e, "Penalty assessment failed for employee %s at %s", employeeUuid, record.getClockIn());
        }
        return new ClockInResponse(record, assessment);
    }

    /**
     * Closes the latest open clock-in of today. An automatic clock-out is stamped 23:11.
     */
    @Transactional
    public AttendanceRecord clockOut(String employeeUuid, boolean autoClockOut) {
        LocalDate today = LocalDate.now(clock);
        AttendanceRecord record = attendanceRepository.findLatestOpen(employeeUuid, today)
                .orElseThrow(() -> new RecordNotFoundException("No active clock-in found for today"));

        LocalDateTime clockOut = autoClockOut
                ? record.getClockIn().toLocalDate().atTime(AUTO_CLOCK_OUT_TIME)
                : LocalDateTime.now(clock);
        record.setClockOut(clockOut);
        record.setHoursWorked(hoursBetween(record.getClockIn(), clockOut));
        attendanceRepository.persist(record);
        log.infof("Employee %s clocked out at %s%s", employeeUuid, clockOut, autoClockOut ? " (auto)" : "");
        return record;
    }

    public int monthlyPresence(String employeeUuid) {
        LocalDate today = LocalDate.now(clock);
        Set<LocalDate> days = new HashSet<>();
        for (AttendanceRecord record : attendanceRepository.findByWorkDateBetween(employeeUuid, today.withDayOfMonth(1), today)) {
            if (AttendanceRecord.STATUS_PRESENT.equals(record.getStatus())) days.add(record.getWorkDate());
        }
        return days.size();
    }

    /**
     * Hours worked Monday to Sunday of the current week, one decimal.
     */
    public BigDecimal weeklyHours(String employeeUuid) {
        LocalDate monday = weekStart();
        double hours = 0;
        for (AttendanceRecord record : attendanceRepository.findByWorkDateBetween(employeeUuid, monday, monday.plusDays(6))) {
            hours += record.getHoursWorked();
        }
        return BigDecimal.valueOf(hours).setScale(1, RoundingMode.HALF_UP);
    }

    public AttendanceStats stats(String employeeUuid) {
        return new AttendanceStats(LocalDate.now(clock).withDayOfMonth(1), monthlyPresence(employeeUuid),
                weekStart(), weeklyHours(employeeUuid));
    }

    private LocalDate weekStart() {
        return LocalDate.now(clock).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    static double hoursBetween(LocalDateTime from, LocalDateTime to) {
        long minutes = Math.max(0, Duration.between(from, to).toMinutes());
        return BigDecimal.valueOf(minutes).divide(BigDecimal.valueOf(60), 2, RoundingMode.HALF_UP).doubleValue();
    }
}
