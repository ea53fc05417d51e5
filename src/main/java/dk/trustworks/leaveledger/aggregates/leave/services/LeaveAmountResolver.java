package dk.trustworks.leaveledger.aggregates.leave.services;

import dk.trustworks.leaveledger.aggregates.leave.dto.SubmitLeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveUnit;
import dk.trustworks.leaveledger.exceptions.InvalidLeaveAmountException;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Derives the {@link LeaveAmount} of a submitted request in the unit of its category.
 */
@ApplicationScoped
public class LeaveAmountResolver {

    static final BigDecimal HALF_DAY = new BigDecimal("0.5");
    static final BigDecimal MINIMUM_FRACTION = new BigDecimal("0.1");

    @ConfigProperty(name = "leaveledger.working-day.hours", defaultValue = "8")
    int workingDayHours = 8;

    public LeaveAmount resolve(LeaveCategory category, SubmitLeaveRequest request) {
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new InvalidLeaveAmountException("Start and end date are required");
        }
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new InvalidLeaveAmountException("End date " + request.getEndDate()
                    + " is before start date " + request.getStartDate());
        }

        if (request.getHalfDayType() != null) {
            if (category.getUnit() != LeaveUnit.DAYS) {
                throw new InvalidLeaveAmountException("Half days cannot be requested in " + category.getName());
            }
            return LeaveAmount.ofDays(HALF_DAY);
        }

        if (request.hasShortLeaveRange()) {
            long minutes = Duration.between(request.getShortLeaveFrom(), request.getShortLeaveTo()).toMinutes();
            if (minutes <= 0) {
                throw new InvalidLeaveAmountException("Short leave must end after it starts ("
                        + request.getShortLeaveFrom() + " - " + request.getShortLeaveTo() + ")");
            }
            return category.getUnit() == LeaveUnit.HOURS_MINUTES
                    ? LeaveAmount.ofMinutes(minutes)
                    : LeaveAmount.ofDays(fractionOfWorkingDay(minutes));
        }

        if (category.getUnit() == LeaveUnit.HOURS_MINUTES) {
            throw new InvalidLeaveAmountException(category.getName() + " requires a start and end time");
        }
        long days = ChronoUnit.DAYS.between(request.getStartDate(), request.getEndDate()) + 1;
        return LeaveAmount.ofDays(BigDecimal.valueOf(days));
    }

    BigDecimal fractionOfWorkingDay(long minutes) {
        BigDecimal fraction = BigDecimal.valueOf(minutes)
                .divide(BigDecimal.valueOf((long) workingDayHours * 60), 1, RoundingMode.HALF_UP);
        return fraction.max(MINIMUM_FRACTION);
    }
}
