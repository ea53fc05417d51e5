package dk.trustworks.leaveledger.aggregates.leave.services;

import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveStatus;
import dk.trustworks.leaveledger.exceptions.InvalidTransitionException;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

/**
 * Enforces the leave request lifecycle.
 *
 * <pre>
 * PENDING → APPROVED → REJECTED (administrative reversal)
 *    ↘
 *     REJECTED
 * </pre>
 *
 * REJECTED is final. Repeating the current status is a no-op.
 */
@JBossLog
@ApplicationScoped
public class LeaveRequestStateMachine {

    public boolean canTransition(LeaveStatus from, LeaveStatus to) {
        if (from == to) {
            return true;
        }

        return switch (from) {
            case PENDING -> to == LeaveStatus.APPROVED || to == LeaveStatus.REJECTED;
            case APPROVED -> to == LeaveStatus.REJECTED;
            case REJECTED -> false;
        };
    }

    /**
     * Moves the request to {@code newStatus}.
     *
     * @return true when the status changed, false for a repeated decision
     * @throws InvalidTransitionException when the lifecycle does not allow the change
     */
    public boolean transition(LeaveRequest request, LeaveStatus newStatus) {
        LeaveStatus currentStatus = request.getStatus();

        if (currentStatus == newStatus) {
            log.debugf("Leave request %s already %s, no transition needed", request.getUuid(), newStatus);
            return false;
        }

        if (!canTransition(currentStatus, newStatus)) {
            String msg = String.format("Invalid status change %s → %s for leave request %s",
                    currentStatus, newStatus, request.getUuid());
            log.warn(msg);
            throw new InvalidTransitionException(msg);
        }

        request.setStatus(newStatus);
        log.infof("Leave request %s transitioned: %s → %s", request.getUuid(), currentStatus, newStatus);
        return true;
    }
}
