package dk.trustworks.leaveledger.aggregates.attendance.services;

import dk.trustworks.leaveledger.aggregates.attendance.dto.LateArrival;
import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyAssessment;
import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyCharge;
import dk.trustworks.leaveledger.aggregates.attendance.model.ClockInThreshold;
import dk.trustworks.leaveledger.aggregates.attendance.model.Penalty;
import dk.trustworks.leaveledger.aggregates.attendance.repositories.PenaltyRepository;
import dk.trustworks.leaveledger.aggregates.employees.model.Employee;
import dk.trustworks.leaveledger.aggregates.employees.repositories.EmployeeRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;
import dk.trustworks.leaveledger.config.services.LedgerSettingsService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.hibernate.exception.ConstraintViolationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Decides whether a clock-in costs the employee half a day of leave.
 * <p>
 * A clock-in later than the employee's threshold counts the distinct late days of the month
 * so far. Once that count passes the monthly grace count, the first late clock-in of the day
 * is charged: one {@link Penalty} and one deduction. Further clock-ins the same day report
 * {@link PenaltyAssessment.Outcome#ALREADY_PENALIZED}; the unique constraints on the penalty
 * and the deduction key decide races between concurrent clock-ins.
 * </p>
 */
@JBossLog
@ApplicationScoped
public class AttendancePenaltyAssessor {

    @Inject
    EmployeeRepository employeeRepository;

    @Inject
    PenaltyRepository penaltyRepository;

    @Inject
    LeaveRequestRepository leaveRequestRepository;

    @Inject
    LedgerSettingsService settingsService;

    @Inject
    LatenessCalculator latenessCalculator;

    @Inject
    PenaltyWriter penaltyWriter;

    @ConfigProperty(name = "leaveledger.penalty.amount-days", defaultValue = "0.5")
    BigDecimal penaltyAmountDays = new BigDecimal("0.5");

    public PenaltyAssessment assess(String employeeUuid, LocalDateTime clockIn) {
        Optional<Employee> employee = employeeRepository.findByIdOptional(employeeUuid);
        if (employee.isEmpty()) {
            log.warnf("Clock-in of unknown employee %s, no penalty assessed", employeeUuid);
            return PenaltyAssessment.noPenalty("Employee not found");
        }

        Optional<ClockInThreshold> resolved = latenessCalculator.resolveThreshold(employee.get());
        if (resolved.isEmpty()) {
            return PenaltyAssessment.noPenalty("No clock-in threshold configured");
        }
        ClockInThreshold threshold = resolved.get();
        if (threshold.isUnrestricted()) {
            return PenaltyAssessment.noPenalty("No clock-in restriction for this employee");
        }
        if (!threshold.isLate(clockIn.toLocalTime())) {
            return PenaltyAssessment.noPenalty("Clocked in on time");
        }

        LocalDate day = clockIn.toLocalDate();
        int lateArrivalCount = countLateDays(employeeUuid, day, threshold);
        int graceCount = settingsService.maxLateDaysPerMonth();
        if (!Penalty.exceedsGrace(lateArrivalCount, graceCount)) {
            log.debugf("Employee %s late on %s (%d/%d late days), within grace", employeeUuid, day, lateArrivalCount, graceCount);
            return PenaltyAssessment.noPenalty("Late arrival within grace", lateArrivalCount, graceCount);
        }

        if (penaltyRepository.findByEmployeeAndDate(employeeUuid, day).isPresent()
                || leaveRequestRepository.findPenaltyDeduction(employeeUuid, day).isPresent()) {
            return PenaltyAssessment.alreadyPenalized(lateArrivalCount, graceCount);
        }

        PenaltyCharge charge = new PenaltyCharge(employeeUuid, clockIn, threshold.format(),
                graceCount, lateArrivalCount, penaltyAmountDays);
        try {
            Penalty penalty = penaltyWriter.write(charge);
            return PenaltyAssessment.created(penalty.getUuid(), lateArrivalCount, graceCount);
        } catch (RuntimeException e) {
            if (!isConstraintViolation(e)) throw e;
            log.infof("Concurrent penalty for employee %s on %s detected by constraint %s",
                    employeeUuid, day, constraintName(e));
            return PenaltyAssessment.alreadyPenalized(lateArrivalCount, graceCount);
        }
    }

    private int countLateDays(String employeeUuid, LocalDate day, ClockInThreshold threshold) {
        int count = 0;
        boolean todayIncluded = false;
        for (LateArrival lateArrival : latenessCalculator.lateArrivals(employeeUuid, day, threshold)) {
            count++;
            if (lateArrival.date().equals(day)) todayIncluded = true;
        }
        return todayIncluded ? count : count + 1;
    }

    static boolean isConstraintViolation(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) return true;
            if (cause.getCause() == cause) break;
        }
        return false;
    }

    private static String constraintName(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation) return violation.getConstraintName();
            if (cause.getCause() == cause) break;
        }
        return null;
    }
}
