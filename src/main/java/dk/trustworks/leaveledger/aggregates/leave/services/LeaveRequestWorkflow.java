package dk.trustworks.leaveledger.aggregates.leave.services;

import dk.trustworks.leaveledger.aggregates.leave.dto.BalanceCheck;
import dk.trustworks.leaveledger.aggregates.leave.dto.SubmitLeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveStatus;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.RequestOrigin;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;
import dk.trustworks.leaveledger.communicationsservice.services.LeaveNotificationService;
import dk.trustworks.leaveledger.exceptions.InsufficientBalanceException;
import dk.trustworks.leaveledger.exceptions.InvalidTransitionException;
import dk.trustworks.leaveledger.exceptions.NotAllottedException;
import dk.trustworks.leaveledger.exceptions.RecordNotFoundException;
import dk.trustworks.leaveledger.exceptions.SelfApprovalForbiddenException;
import dk.trustworks.leaveledger.exceptions.UnauthorizedActionException;
import dk.trustworks.leaveledger.security.Actor;
import dk.trustworks.leaveledger.security.Role;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Submission, decision and deletion of leave requests. Every change that affects a
 * balance is followed by a recompute of the pair in the same transaction.
 */
@JBossLog
@ApplicationScoped
public class LeaveRequestWorkflow {

    @Inject
    LeaveRequestRepository leaveRequestRepository;

    @Inject
    LeaveCategoryRegistry categoryRegistry;

    @Inject
    LeaveAmountResolver amountResolver;

    @Inject
    LeaveRequestStateMachine stateMachine;

    @Inject
    BalanceLedger balanceLedger;

    @Inject
    LeaveNotificationService notificationService;

    @Transactional
    public LeaveRequest submit(Actor actor, SubmitLeaveRequest submission) {
        LeaveCategory category = categoryRegistry.findActive(submission.getCategoryUuid());
        LeaveAmount amount = amountResolver.resolve(category, submission);

        if (actor.isEmployee()) {
            if (!balanceLedger.isAllotted(actor.uuid(), category.getUuid())) {
                throw new NotAllottedException("This leave type is not allotted to you. Please contact HR.");
            }
            BalanceCheck check = balanceLedger.checkSufficientBalance(actor.uuid(), category.getUuid(), amount);
            if (!check.sufficient()) {
                throw new InsufficientBalanceException(check.remaining(), check.requested());
            }
        }

        RequestOrigin origin = actor.isEmployee() ? RequestOrigin.EMPLOYEE : RequestOrigin.ADMINISTRATIVE;
        LeaveRequest request = LeaveRequest.pending(actor.uuid(), category.getUuid(), amount,
                submission.getStartDate(), submission.getEndDate(), origin, actor.uuid());
        request.setReason(submission.getReason());
        request.setHalfDayType(submission.getHalfDayType());
        if (submission.hasShortLeaveRange()) {
            request.setShortLeaveFrom(submission.getShortLeaveFrom());
            request.setShortLeaveTo(submission.getShortLeaveTo());
        }
        request.setMedicalReportUrl(submission.getMedicalReportUrl());
        leaveRequestRepository.persist(request);
        log.infof("Leave request %s submitted by %s: %s of %s", request.getUuid(), actor.uuid(), amount, category.getName());

        if (actor.isEmployee()) {
            notificationService.notifyLeaveSubmitted(request, category);
        }
        return request;
    }

    /**
     * Approves or rejects a request. Approving charges the balance; rejecting a previously
     * approved request gives the amount back.
     */
    @Transactional
    public LeaveRequest decide(Actor actor, String requestUuid, LeaveStatus decision, String rejectionReason) {
        requireAdministrative(actor, "decide leave requests");
        if (decision == null || decision == LeaveStatus.PENDING) {
            throw new InvalidTransitionException("A decision must be APPROVED or REJECTED");
        }
        LeaveRequest request = requireRequest(requestUuid);
        if (actor.role() == Role.HR && (actor.uuid().equals(request.getEmployeeUuid())
                || actor.uuid().equals(request.getSubmittedBy()))) {
            throw new SelfApprovalForbiddenException("HR cannot decide their own leave requests. Please ask an admin.");
        }

        LeaveStatus previousStatus = request.getStatus();
        if (decision == LeaveStatus.APPROVED && previousStatus != LeaveStatus.APPROVED
                && balanceLedger.isAllotted(request.getEmployeeUuid(), request.getCategoryUuid())) {
            BalanceCheck check = balanceLedger.checkSufficientBalance(request.getEmployeeUuid(),
                    request.getCategoryUuid(), request.getAmount(), request.getUuid());
            if (!check.sufficient()) {
                throw new InsufficientBalanceException(check.remaining(), check.requested());
            }
        }

        boolean changed = stateMachine.transition(request, decision);
        if (!changed) {
            return request;
        }
        request.setApproverUuid(actor.uuid());
        request.setDecidedAt(LocalDateTime.now());
        request.setRejectionReason(decision == LeaveStatus.REJECTED ? rejectionReason : null);
        leaveRequestRepository.persist(request);

        if (decision == LeaveStatus.APPROVED) {
            balanceLedger.applyDeduction(request.getUuid());
        } else if (previousStatus == LeaveStatus.APPROVED) {
            balanceLedger.applyRestoration(request.getUuid());
        }

        LeaveCategory category = categoryRegistry.findByUuid(request.getCategoryUuid()).orElse(null);
        notificationService.notifyLeaveDecided(request, category);
        return request;
    }

    @Transactional
    public void delete(Actor actor, String requestUuid) {
        LeaveRequest request = requireRequest(requestUuid);
        if (!actor.isAdministrative()) {
            if (!request.getEmployeeUuid().equals(actor.uuid())) {
                throw new UnauthorizedActionException("You can only delete your own leave requests");
            }
            if (request.getStatus() != LeaveStatus.PENDING) {
                throw new UnauthorizedActionException("Only pending leave requests can be deleted");
            }
        }
        boolean wasApproved = request.isApproved();
        leaveRequestRepository.delete(request);
        log.infof("Leave request %s deleted by %s", requestUuid, actor.uuid());
        if (wasApproved) {
            balanceLedger.recomputeIfAllotted(request.getEmployeeUuid(), request.getCategoryUuid());
        }
    }

    public List<LeaveRequest> listForEmployee(String employeeUuid) {
        return leaveRequestRepository.findVisibleByEmployee(employeeUuid);
    }

    public List<LeaveRequest> listAll(Actor actor) {
        requireAdministrative(actor, "list all leave requests");
        return leaveRequestRepository.findVisible();
    }

    public List<LeaveRequest> pendingForApproval(Actor actor) {
        requireAdministrative(actor, "list pending leave requests");
        return leaveRequestRepository.findPending().stream()
                .filter(request -> actor.role() != Role.HR || !actor.uuid().equals(request.getEmployeeUuid()))
                .toList();
    }

    public Set<String> employeesOnLeave(LocalDate date) {
        Set<String> employees = new TreeSet<>();
        for (LeaveRequest request : leaveRequestRepository.findApprovedCovering(date)) {
            if (request.isPenaltyDeduction()) continue;
            employees.add(request.getEmployeeUuid());
        }
        return employees;
    }

    private LeaveRequest requireRequest(String requestUuid) {
        return leaveRequestRepository.findByIdOptional(requestUuid)
                .orElseThrow(() -> RecordNotFoundException.of("Leave request", requestUuid));
    }

    static void requireAdministrative(Actor actor, String action) {
        if (actor == null || !actor.isAdministrative()) {
            throw new UnauthorizedActionException("Only HR and admins may " + action);
        }
    }
}
