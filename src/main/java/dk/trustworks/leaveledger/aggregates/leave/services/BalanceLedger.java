package dk.trustworks.leaveledger.aggregates.leave.services;

import dk.trustworks.leaveledger.aggregates.leave.dto.BalanceCheck;
import dk.trustworks.leaveledger.aggregates.leave.dto.BalanceView;
import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveCategoryRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;
import dk.trustworks.leaveledger.exceptions.NotAllottedException;
import dk.trustworks.leaveledger.exceptions.RecordNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.util.Optional;

/**
 * Owner of {@link Allotment#getRemaining()}.
 * <p>
 * The remaining balance is never adjusted incrementally. Every write re-derives it as
 * granted minus the sum of the approved requests of the (employee, category) pair, clamped
 * at zero. Approval, reversal, deletion and reconciliation all end in {@link #recompute}.
 * </p>
 */
@JBossLog
@ApplicationScoped
public class BalanceLedger {

    @Inject
    AllotmentRepository allotmentRepository;

    @Inject
    LeaveRequestRepository leaveRequestRepository;

    @Inject
    LeaveCategoryRepository categoryRepository;

    @Transactional
    public LeaveAmount recompute(String employeeUuid, String categoryUuid) {
        return recompute(employeeUuid, categoryUuid, null);
    }

    /**
     * Re-derives and stores the remaining balance of a pair.
     *
     * @param excludedRequestUuid request left out of the used amount, or null
     * @return the remaining balance written to the allotment
     * @throws NotAllottedException when the employee holds no allotment of the category
     */
    @Transactional
    public LeaveAmount recompute(String employeeUuid, String categoryUuid, String excludedRequestUuid) {
        Allotment allotment = requireAllotment(employeeUuid, categoryUuid);
        LeaveAmount remaining = allotment.getGranted().minusClamped(usedAmount(allotment, excludedRequestUuid));
        if (!remaining.equals(allotment.getRemaining())) {
            log.infof("Balance of employee %s in category %s: %s -> %s",
                    employeeUuid, categoryUuid, allotment.getRemaining(), remaining);
        }
        allotment.setRemaining(remaining);
        allotmentRepository.persist(allotment);
        return remaining;
    }

    /**
     * Recomputes a pair and reports whether the stored balance had drifted.
     */
    @Transactional
    public boolean reconcile(String employeeUuid, String categoryUuid) {
        LeaveAmount stored = requireAllotment(employeeUuid, categoryUuid).getRemaining();
        LeaveAmount remaining = recompute(employeeUuid, categoryUuid);
        return !remaining.equals(stored);
    }

    /**
     * Recomputes when the pair is allotted and does nothing otherwise. Requests filed by HR
     * or an admin may exist without an allotment.
     */
    @Transactional
    public Optional<LeaveAmount> recomputeIfAllotted(String employeeUuid, String categoryUuid) {
        if (allotmentRepository.findByEmployeeAndCategory(employeeUuid, categoryUuid).isEmpty()) {
            log.debugf("Employee %s holds no allotment of %s, nothing to recompute", employeeUuid, categoryUuid);
            return Optional.empty();
        }
        return Optional.of(recompute(employeeUuid, categoryUuid));
    }

    /**
     * Checks a request against the balance, leaving the in-flight request itself out of the
     * used amount so a re-check of a stored request does not count it twice. The stored
     * balance is not touched.
     */
    public BalanceCheck checkSufficientBalance(String employeeUuid, String categoryUuid,
                                               LeaveAmount requested, String inFlightRequestUuid) {
        Allotment allotment = requireAllotment(employeeUuid, categoryUuid);
        LeaveAmount remaining = allotment.getGranted().minusClamped(usedAmount(allotment, inFlightRequestUuid));
        return new BalanceCheck(!requested.exceeds(remaining), remaining, requested);
    }

    public BalanceCheck checkSufficientBalance(String employeeUuid, String categoryUuid, LeaveAmount requested) {
        return checkSufficientBalance(employeeUuid, categoryUuid, requested, null);
    }

    @Transactional
    public Optional<LeaveAmount> applyDeduction(String requestUuid) {
        LeaveRequest request = requireRequest(requestUuid);
        return recomputeIfAllotted(request.getEmployeeUuid(), request.getCategoryUuid());
    }

    @Transactional
    public Optional<LeaveAmount> applyRestoration(String requestUuid) {
        LeaveRequest request = requireRequest(requestUuid);
        return recomputeIfAllotted(request.getEmployeeUuid(), request.getCategoryUuid());
    }

    /**
     * Read-only view of a pair, derived from the requests rather than the stored balance.
     */
    public BalanceView balanceOf(String employeeUuid, String categoryUuid) {
        Allotment allotment = requireAllotment(employeeUuid, categoryUuid);
        LeaveAmount used = usedAmount(allotment, null);
        String categoryName = categoryRepository.findByIdOptional(categoryUuid)
                .map(LeaveCategory::getName)
                .orElse(null);
        return new BalanceView(employeeUuid, categoryUuid, categoryName,
                allotment.getGranted(), used, allotment.getGranted().minusClamped(used));
    }

    public boolean isAllotted(String employeeUuid, String categoryUuid) {
        return allotmentRepository.findByEmployeeAndCategory(employeeUuid, categoryUuid).isPresent();
    }

    LeaveAmount usedAmount(Allotment allotment, String excludedRequestUuid) {
        LeaveAmount used = LeaveAmount.zero(allotment.getGranted().getUnit());
        for (LeaveRequest request : leaveRequestRepository.findApprovedConsumption(
                allotment.getEmployeeUuid(), allotment.getCategoryUuid())) {
            if (request.getUuid().equals(excludedRequestUuid)) continue;
            if (request.getAmount() == null || request.getAmount().getUnit() != used.getUnit()) {
                log.warnf("Skipping request %s: amount %s does not match the %s allotment %s",
                        request.getUuid(), request.getAmount(), used.getUnit(), allotment.getUuid());
                continue;
            }
            used = used.plus(request.getAmount());
        }
        return used;
    }

    private Allotment requireAllotment(String employeeUuid, String categoryUuid) {
        return allotmentRepository.findByEmployeeAndCategory(employeeUuid, categoryUuid)
                .orElseThrow(() -> new NotAllottedException(
                        "This leave type is not allotted to employee " + employeeUuid + ". Please contact HR."));
    }

    private LeaveRequest requireRequest(String requestUuid) {
        return leaveRequestRepository.findByIdOptional(requestUuid)
                .orElseThrow(() -> RecordNotFoundException.of("Leave request", requestUuid));
    }
}
