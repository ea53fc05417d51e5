package dk.trustworks.leaveledger.aggregates.attendance.services;

import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyCharge;
import dk.trustworks.leaveledger.aggregates.attendance.model.Penalty;
import dk.trustworks.leaveledger.aggregates.attendance.repositories.PenaltyRepository;
import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveUnit;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;
import dk.trustworks.leaveledger.aggregates.leave.services.BalanceLedger;
import dk.trustworks.leaveledger.aggregates.leave.services.LeaveCategoryRegistry;
import dk.trustworks.leaveledger.security.Actor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Writes a penalty, its leave deduction and the resulting balance as one unit. Runs in a
 * transaction of its own so a unique-constraint violation from a concurrent clock-in
 * rolls back only this write.
 */
@JBossLog
@ApplicationScoped
public class PenaltyWriter {

    @Inject
    PenaltyRepository penaltyRepository;

    @Inject
    LeaveRequestRepository leaveRequestRepository;

    @Inject
    AllotmentRepository allotmentRepository;

    @Inject
    LeaveCategoryRegistry categoryRegistry;

    @Inject
    BalanceLedger balanceLedger;

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Penalty write(PenaltyCharge charge) {
        LocalDate day = charge.clockIn().toLocalDate();
        LeaveCategory category = categoryRegistry.resolvePenaltyCategory(true).orElseThrow();
        if (category.getUnit() != LeaveUnit.DAYS) {
            throw new IllegalStateException("Penalty category " + category.getName() + " is measured in " + category.getUnit());
        }
        LeaveAmount amount = LeaveAmount.ofDays(charge.amountDays());

        if (allotmentRepository.findByEmployeeAndCategory(charge.employeeUuid(), category.getUuid()).isEmpty()) {
            Allotment empty = Allotment.grant(charge.employeeUuid(), category.getUuid(), LeaveAmount.zero(category.getUnit()),
                    Actor.SYSTEM_UUID, false, "Auto-allotted for penalty deduction");
            allotmentRepository.persist(empty);
            log.infof("Auto-allotted empty %s to employee %s for penalty deduction", category.getName(), charge.employeeUuid());
        }

        LeaveRequest deduction = LeaveRequest.penaltyDeduction(charge.employeeUuid(), category.getUuid(), day,
                amount, charge.deductionReason());
        leaveRequestRepository.persist(deduction);

        Penalty penalty = new Penalty();
        penalty.setUuid(UUID.randomUUID().toString());
        penalty.setEmployeeUuid(charge.employeeUuid());
        penalty.setPenaltyDate(day);
        penalty.setClockInTime(charge.clockIn());
        penalty.setThreshold(charge.threshold());
        penalty.setGraceCount(charge.graceCount());
        penalty.setLateArrivalCount(charge.lateArrivalCount());
        penalty.setPenaltyAmount(charge.amountDays());
        penalty.setReason(charge.penaltyReason());
        penalty.setDeductionRequestUuid(deduction.getUuid());
        penalty.setCreatedAt(LocalDateTime.now());
        penaltyRepository.persist(penalty);
        // constraint violations surface here rather than at commit
        penaltyRepository.flush();

        LeaveAmount remaining = balanceLedger.recompute(charge.employeeUuid(), category.getUuid());
        log.infof("Penalty %s charged to employee %s for %s: %s deducted, %s remaining",
                penalty.getUuid(), charge.employeeUuid(), day, amount, remaining);
        return penalty;
    }
}
