package dk.trustworks.leaveledger.aggregates.attendance.services;

import dk.trustworks.leaveledger.aggregates.attendance.dto.LateArrival;
import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyDetails;
import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyDetails.PenaltyBalance;
import dk.trustworks.leaveledger.aggregates.attendance.model.ClockInThreshold;
import dk.trustworks.leaveledger.aggregates.attendance.model.Penalty;
import dk.trustworks.leaveledger.aggregates.attendance.repositories.PenaltyRepository;
import dk.trustworks.leaveledger.aggregates.employees.repositories.EmployeeRepository;
import dk.trustworks.leaveledger.aggregates.leave.dto.BalanceView;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;
import dk.trustworks.leaveledger.aggregates.leave.services.BalanceLedger;
import dk.trustworks.leaveledger.aggregates.leave.services.LeaveCategoryRegistry;
import dk.trustworks.leaveledger.config.services.LedgerSettingsService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Penalty read path. A stored penalty is checked against the current grace count on every
 * read and removed when the rules no longer support it.
 */
@JBossLog
@ApplicationScoped
public class PenaltyQueryService {

    @Inject
    PenaltyRepository penaltyRepository;

    @Inject
    EmployeeRepository employeeRepository;

    @Inject
    LeaveRequestRepository leaveRequestRepository;

    @Inject
    LedgerSettingsService settingsService;

    @Inject
    LatenessCalculator latenessCalculator;

    @Inject
    LeaveCategoryRegistry categoryRegistry;

    @Inject
    BalanceLedger balanceLedger;

    @Transactional
    public Optional<PenaltyDetails> penaltyFor(String employeeUuid, LocalDate date) {
        Optional<Penalty> stored = penaltyRepository.findByEmployeeAndDate(employeeUuid, date);
        if (stored.isEmpty()) return Optional.empty();
        Penalty penalty = stored.get();

        int graceCount = settingsService.maxLateDaysPerMonth();
        if (!penalty.isValidFor(graceCount)) {
            // the deduction stays; only the penalty record goes
            log.infof("Removing stale penalty %s of employee %s on %s (%d late days, grace now %d)",
                    penalty.getUuid(), employeeUuid, date, penalty.getLateArrivalCount(), graceCount);
            penaltyRepository.delete(penalty);
            return Optional.empty();
        }

        ClockInThreshold threshold = employeeRepository.findByIdOptional(employeeUuid)
                .flatMap(latenessCalculator::resolveThreshold)
                .filter(resolved -> !resolved.isUnrestricted())
                .orElse(null);
        String thresholdText = threshold != null ? threshold.format() : penalty.getThreshold();
        List<LateArrival> lateArrivals = threshold != null
                ? latenessCalculator.lateArrivals(employeeUuid, date.withDayOfMonth(date.lengthOfMonth()), threshold)
                : List.of();

        return Optional.of(new PenaltyDetails(penalty.getUuid(), penalty.getPenaltyDate(), penalty.getClockInTime(),
                thresholdText, penalty.getPenaltyAmount(), penalty.getReason(), graceCount,
                penalty.getLateArrivalCount(), lateArrivals, penaltyBalance(employeeUuid)));
    }

    private PenaltyBalance penaltyBalance(String employeeUuid) {
        Optional<LeaveCategory> category = categoryRegistry.resolvePenaltyCategory(false);
        if (category.isEmpty() || !balanceLedger.isAllotted(employeeUuid, category.get().getUuid())) {
            return null;
        }
        BalanceView balance = balanceLedger.balanceOf(employeeUuid, category.get().getUuid());
        LeaveAmount deducted = LeaveAmount.zero(balance.granted().getUnit());
        for (LeaveRequest request : leaveRequestRepository.findApprovedConsumption(employeeUuid, category.get().getUuid())) {
            if (request.isPenaltyDeduction() && request.getAmount().getUnit() == deducted.getUnit()) {
                deducted = deducted.plus(request.getAmount());
            }
        }
        return new PenaltyBalance(category.get().getName(), balance.granted(), deducted, balance.remaining());
    }
}
