package dk.trustworks.leaveledger.communicationsservice.services;

import dk.trustworks.leaveledger.aggregates.employees.model.Employee;
import dk.trustworks.leaveledger.aggregates.employees.repositories.EmployeeRepository;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.config.FeatureFlags;
import dk.trustworks.leaveledger.security.Role;
import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;

import static org.apache.commons.text.StringEscapeUtils.escapeHtml4;

/**
 * Email and Slack fan-out for leave events. Delivery failures are logged and never reach
 * the caller, the ledger change that triggered them stands. User-entered text is HTML
 * escaped in mail bodies.
 */
@JBossLog
@ApplicationScoped
public class LeaveNotificationService {

    @Inject
    Mailer mailer;

    @Inject
    SlackService slackService;

    @Inject
    EmployeeRepository employeeRepository;

    @Inject
    FeatureFlags featureFlags;

    public void notifyLeaveSubmitted(LeaveRequest request, LeaveCategory category) {
        if (!featureFlags.isNotificationsEnabled()) return;
        try {
            sendSubmitted(request, category);
        } catch (RuntimeException e) {
            log.errorf(e, "Failed to notify approvers of leave request %s", request.getUuid());
        }
    }

    public void notifyLeaveDecided(LeaveRequest request, LeaveCategory category) {
        if (!featureFlags.isNotificationsEnabled()) return;
        try {
            sendDecided(request, category);
        } catch (RuntimeException e) {
            log.errorf(e, "Failed to notify employee %s of decision on leave request %s",
                    request.getEmployeeUuid(), request.getUuid());
        }
    }

    private void sendSubmitted(LeaveRequest request, LeaveCategory category) {
        String employeeName = employeeRepository.findByIdOptional(request.getEmployeeUuid())
                .map(Employee::getName)
                .orElse(request.getEmployeeUuid());
        String subject = "New leave request from " + employeeName;
        String text = employeeName + " requested " + request.getAmount().display() + " of " + category.getName()
                + " (" + request.getStartDate() + " - " + request.getEndDate() + ").";
        String html = "<p><b>" + escapeHtml4(employeeName) + "</b> has requested leave.</p>"
                + "<ul><li>Type: " + escapeHtml4(category.getName()) + "</li>"
                + "<li>Amount: " + request.getAmount().display() + "</li>"
                + "<li>Period: " + request.getStartDate() + " - " + request.getEndDate() + "</li>"
                + "<li>Reason: " + escapeHtml4(request.getReason() == null ? "" : request.getReason()) + "</li></ul>";

        List<Employee> approvers = employeeRepository.findByRoles(List.of(Role.ADMIN, Role.HR));
        for (Employee approver : approvers) {
            deliver(approver, subject, html, text);
        }
    }

    private void sendDecided(LeaveRequest request, LeaveCategory category) {
        Employee employee = employeeRepository.findByIdOptional(request.getEmployeeUuid()).orElse(null);
        if (employee == null) {
            log.warnf("Leave request %s belongs to unknown employee %s, no notification sent",
                    request.getUuid(), request.getEmployeeUuid());
            return;
        }
        String status = request.getStatus().name().toLowerCase();
        String categoryName = category == null ? "leave" : category.getName();
        String subject = "Your " + categoryName + " request was " + status;
        String text = "Your " + categoryName + " request for " + request.getStartDate() + " - " + request.getEndDate()
                + " was " + status + "."
                + (request.getRejectionReason() != null ? " Reason: " + request.getRejectionReason() : "");
        String html = "<p>" + escapeHtml4(text) + "</p>";
        deliver(employee, subject, html, text);
    }

    private void deliver(Employee recipient, String subject, String html, String text) {
        if (recipient.getEmail() != null && !recipient.getEmail().isBlank()) {
            try {
                mailer.send(Mail.withHtml(recipient.getEmail(), subject, html));
            } catch (RuntimeException e) {
                log.errorf(e, "Failed to send leave mail to %s", recipient.getEmail());
            }
        }
        if (featureFlags.isSlackNotificationsEnabled()) {
            try {
                slackService.sendMessage(recipient, text);
            } catch (Exception e) {
                log.errorf(e, "Failed to send Slack message to %s", recipient.getUuid());
            }
        }
    }
}
