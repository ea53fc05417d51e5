package dk.trustworks.leaveledger.aggregates.leave.services;

import dk.trustworks.leaveledger.aggregates.leave.dto.AllotLeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.dto.AllotmentError;
import dk.trustworks.leaveledger.aggregates.leave.dto.BulkAllotmentRequest;
import dk.trustworks.leaveledger.aggregates.leave.dto.BulkAllotmentResult;
import dk.trustworks.leaveledger.aggregates.leave.dto.EditAllotmentRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveUnit;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.exceptions.DuplicateAllotmentException;
import dk.trustworks.leaveledger.exceptions.InvalidLeaveAmountException;
import dk.trustworks.leaveledger.exceptions.LeaveLedgerException.ErrorType;
import dk.trustworks.leaveledger.exceptions.RecordNotFoundException;
import dk.trustworks.leaveledger.security.Actor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static dk.trustworks.leaveledger.aggregates.leave.services.LeaveRequestWorkflow.requireAdministrative;

/**
 * Administrative grants of leave. The granted amount is set here; the remaining balance is
 * always handed to {@link BalanceLedger} afterwards.
 */
@JBossLog
@ApplicationScoped
public class AllotmentService {

    static final String DEFAULT_REASON = "Allotted by HR";

    @Inject
    AllotmentRepository allotmentRepository;

    @Inject
    LeaveCategoryRegistry categoryRegistry;

    @Inject
    BalanceLedger balanceLedger;

    @Transactional
    public Allotment allot(Actor actor, AllotLeaveRequest request) {
        requireAdministrative(actor, "allot leave");
        LeaveCategory category = categoryRegistry.findActive(request.getCategoryUuid());
        LeaveAmount granted = toAmount(category.getUnit(), request.getDays(), request.getHours(), request.getMinutes(), false);
        if (allotmentRepository.findByEmployeeAndCategory(request.getEmployeeUuid(), category.getUuid()).isPresent()) {
            throw new DuplicateAllotmentException("Employee " + request.getEmployeeUuid()
                    + " already has " + category.getName() + " allotted");
        }
        return grant(actor, request, category, granted);
    }

    /**
     * Applies a batch of allotments. Rows that fail validation are reported back and the rest
     * of the batch is applied.
     */
    @Transactional
    public BulkAllotmentResult bulkAllot(Actor actor, BulkAllotmentRequest batch) {
        requireAdministrative(actor, "allot leave");

        int replaced = 0;
        List<String> replacedUuids = batch.getReplacedAllotmentUuids() == null ? List.of() : batch.getReplacedAllotmentUuids();
        for (String uuid : replacedUuids) {
            Optional<Allotment> existing = allotmentRepository.findByIdOptional(uuid);
            if (existing.isPresent()) {
                allotmentRepository.delete(existing.get());
                replaced++;
            }
        }
        if (replaced > 0) {
            allotmentRepository.flush();
            log.infof("Bulk allotment replaced %d existing allotments", replaced);
        }

        List<Allotment> created = new ArrayList<>();
        List<AllotmentError> errors = new ArrayList<>();
        Set<String> seenPairs = new HashSet<>();
        for (AllotLeaveRequest row : batch.getAllocations()) {
            Optional<AllotmentError> error = validateRow(row, seenPairs);
            if (error.isPresent()) {
                errors.add(error.get());
                continue;
            }
            LeaveCategory category = categoryRegistry.findByUuid(row.getCategoryUuid()).orElseThrow();
            LeaveAmount granted = toAmount(category.getUnit(), row.getDays(), row.getHours(), row.getMinutes(), false);
            created.add(grant(actor, row, category, granted));
        }
        log.infof("Bulk allotment by %s: %d created, %d rejected", actor.uuid(), created.size(), errors.size());
        return new BulkAllotmentResult(created, errors, replaced);
    }

    @Transactional
    public Allotment editAllotment(Actor actor, String allotmentUuid, EditAllotmentRequest edit) {
        requireAdministrative(actor, "edit allotments");
        Allotment allotment = requireAllotment(allotmentUuid);
        LeaveUnit unit = allotment.getGranted().getUnit();

        if (edit.getCategoryUuid() != null && !edit.getCategoryUuid().equals(allotment.getCategoryUuid())) {
            LeaveCategory target = categoryRegistry.findActive(edit.getCategoryUuid());
            boolean taken = allotmentRepository.findByEmployeeAndCategory(allotment.getEmployeeUuid(), target.getUuid())
                    .filter(other -> !other.getUuid().equals(allotment.getUuid()))
                    .isPresent();
            if (taken) {
                throw new DuplicateAllotmentException("Employee " + allotment.getEmployeeUuid()
                        + " already has " + target.getName() + " allotted");
            }
            if (target.getUnit() != unit && !edit.hasAmount()) {
                throw new InvalidLeaveAmountException(target.getName() + " is measured in " + target.getUnit()
                        + ", a new allotted amount is required");
            }
            log.infof("Allotment %s moved from category %s to %s", allotment.getUuid(), allotment.getCategoryUuid(), target.getUuid());
            allotment.setCategoryUuid(target.getUuid());
            unit = target.getUnit();
        }
        if (edit.hasAmount()) {
            allotment.setGranted(toAmount(unit, edit.getDays(), edit.getHours(), edit.getMinutes(), true));
        }
        if (edit.getCarryForward() != null) allotment.setCarryForward(edit.getCarryForward());
        if (edit.getReason() != null) allotment.setReason(edit.getReason());
        allotmentRepository.persist(allotment);

        balanceLedger.recompute(allotment.getEmployeeUuid(), allotment.getCategoryUuid());
        return allotment;
    }

    @Transactional
    public void delete(Actor actor, String allotmentUuid) {
        requireAdministrative(actor, "delete allotments");
        Allotment allotment = requireAllotment(allotmentUuid);
        allotmentRepository.delete(allotment);
        log.infof("Allotment %s of employee %s deleted by %s", allotmentUuid, allotment.getEmployeeUuid(), actor.uuid());
    }

    public List<Allotment> listForEmployee(String employeeUuid) {
        return allotmentRepository.findByEmployee(employeeUuid);
    }

    public List<Allotment> listAll(Actor actor) {
        requireAdministrative(actor, "list all allotments");
        return allotmentRepository.findAllOrdered();
    }

    private Allotment grant(Actor actor, AllotLeaveRequest request, LeaveCategory category, LeaveAmount granted) {
        String reason = request.getReason() == null || request.getReason().isBlank() ? DEFAULT_REASON : request.getReason();
        Allotment allotment = Allotment.grant(request.getEmployeeUuid(), category.getUuid(), granted,
                actor.uuid(), request.isCarryForward(), reason);
        allotmentRepository.persist(allotment);
        log.infof("Allotted %s of %s to employee %s", granted, category.getName(), request.getEmployeeUuid());
        // approved requests may predate the allotment
        balanceLedger.recompute(allotment.getEmployeeUuid(), allotment.getCategoryUuid());
        return allotment;
    }

    private Allotment requireAllotment(String allotmentUuid) {
        return allotmentRepository.findByIdOptional(allotmentUuid)
                .orElseThrow(() -> RecordNotFoundException.of("Allotment", allotmentUuid));
    }

    private Optional<AllotmentError> validateRow(AllotLeaveRequest row, Set<String> seenPairs) {
        if (row.getEmployeeUuid() == null || row.getEmployeeUuid().isBlank()) {
            return Optional.of(rowError(row, ErrorType.NOT_FOUND, "Employee is required"));
        }
        LeaveCategory category = row.getCategoryUuid() == null ? null
                : categoryRegistry.findByUuid(row.getCategoryUuid()).orElse(null);
        if (category == null || !category.isActive()) {
            return Optional.of(rowError(row, ErrorType.INVALID_CATEGORY, "Invalid or inactive leave type"));
        }
        Optional<String> amountProblem = amountProblem(category.getUnit(), row.getDays(), row.getHours(), row.getMinutes(), false);
        if (amountProblem.isPresent()) {
            return Optional.of(rowError(row, ErrorType.INVALID_AMOUNT, amountProblem.get()));
        }
        String pair = row.getEmployeeUuid() + "|" + row.getCategoryUuid();
        if (!seenPairs.add(pair)
                || allotmentRepository.findByEmployeeAndCategory(row.getEmployeeUuid(), row.getCategoryUuid()).isPresent()) {
            return Optional.of(rowError(row, ErrorType.DUPLICATE_ALLOTMENT, category.getName() + " is already allotted"));
        }
        return Optional.empty();
    }

    private static AllotmentError rowError(AllotLeaveRequest row, ErrorType type, String message) {
        return new AllotmentError(row.getEmployeeUuid(), row.getCategoryUuid(), type.name(), message);
    }

    static LeaveAmount toAmount(LeaveUnit unit, BigDecimal days, Integer hours, Integer minutes, boolean allowZero) {
        Optional<String> problem = amountProblem(unit, days, hours, minutes, allowZero);
        if (problem.isPresent()) throw new InvalidLeaveAmountException(problem.get());
        return unit == LeaveUnit.DAYS
                ? LeaveAmount.ofDays(days)
                : LeaveAmount.ofHoursMinutes(hours == null ? 0 : hours, minutes == null ? 0 : minutes);
    }

    private static Optional<String> amountProblem(LeaveUnit unit, BigDecimal days, Integer hours, Integer minutes, boolean allowZero) {
        if (unit == LeaveUnit.DAYS) {
            if (days == null) return Optional.of("Number of days is required");
            if (days.signum() < 0 || (!allowZero && days.signum() == 0)) return Optional.of("Number of days must be positive");
            return Optional.empty();
        }
        if (hours == null && minutes == null) return Optional.of("Hours or minutes are required");
        int h = hours == null ? 0 : hours;
        int m = minutes == null ? 0 : minutes;
        if (h < 0 || m < 0) return Optional.of("Hours and minutes cannot be negative");
        if (!allowZero && h == 0 && m == 0) return Optional.of("Allotted time must be positive");
        return Optional.empty();
    }
}
