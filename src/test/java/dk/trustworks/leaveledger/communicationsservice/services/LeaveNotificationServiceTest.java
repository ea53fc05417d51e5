package dk.trustworks.leaveledger.communicationsservice.services;

import dk.trustworks.leaveledger.aggregates.employees.model.Employee;
import dk.trustworks.leaveledger.aggregates.employees.repositories.EmployeeRepository;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveStatus;
import dk.trustworks.leaveledger.config.FeatureFlags;
import dk.trustworks.leaveledger.security.Role;
import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static dk.trustworks.leaveledger.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeaveNotificationService")
class LeaveNotificationServiceTest {

    private static final String EMPLOYEE = "employee-1";

    @InjectMocks
    private LeaveNotificationService notificationService;

    @Mock
    private Mailer mailer;

    @Mock
    private SlackService slackService;

    @Mock
    private EmployeeRepository employeeRepository;

    @Mock
    private FeatureFlags featureFlags;

    private LeaveCategory casual;
    private LeaveRequest request;
    private Employee owner;

    @BeforeEach
    void setUp() {
        casual = daysCategory(CASUAL_LEAVE);
        request = leaveRequest().employee(EMPLOYEE).category(casual).days(1).on(LocalDate.of(2025, 3, 10)).build();
        owner = employee().uuid(EMPLOYEE).name("Emma Hansen").email("emma@trustworks.dk").slackusername("U123").build();
        lenient().when(featureFlags.isNotificationsEnabled()).thenReturn(true);
        lenient().when(featureFlags.isSlackNotificationsEnabled()).thenReturn(true);
    }

    // ============================================================================
    // delivery failures
    // ============================================================================

    @Nested
    @DisplayName("delivery failures")
    class DeliveryFailures {

        @Test
        @DisplayName("mail and Slack failures on a decision are logged, not thrown")
        void decisionNotificationFailures() throws Exception {
            // Given
            request.setStatus(LeaveStatus.REJECTED);
            request.setRejectionReason("Project deadline");
            when(employeeRepository.findByIdOptional(EMPLOYEE)).thenReturn(Optional.of(owner));
            doThrow(new IllegalStateException("SMTP unavailable")).when(mailer).send(any(Mail.class));
            when(slackService.sendMessage(any(Employee.class), anyString())).thenThrow(new IOException("Slack unavailable"));

            // When / Then
            assertDoesNotThrow(() -> notificationService.notifyLeaveDecided(request, casual));
            verify(mailer).send(any(Mail.class));
            verify(slackService).sendMessage(eq(owner), contains("rejected"));
        }

        @Test
        @DisplayName("a failing employee lookup does not escape")
        void lookupFailure() {
            when(employeeRepository.findByIdOptional(EMPLOYEE)).thenThrow(new IllegalStateException("connection reset"));

            assertDoesNotThrow(() -> notificationService.notifyLeaveSubmitted(request, casual));
            assertDoesNotThrow(() -> notificationService.notifyLeaveDecided(request, casual));
            verifyNoInteractions(mailer);
        }

        @Test
        @DisplayName("one failing approver does not stop the others")
        void continuesAfterFailedApprover() {
            // Given
            Employee hr = employee().uuid("hr-1").role(Role.HR).email("hr@trustworks.dk").build();
            Employee admin = employee().uuid("admin-1").role(Role.ADMIN).email("admin@trustworks.dk").build();
            when(employeeRepository.findByIdOptional(EMPLOYEE)).thenReturn(Optional.of(owner));
            when(employeeRepository.findByRoles(anyList())).thenReturn(List.of(hr, admin));
            doThrow(new IllegalStateException("SMTP unavailable")).doNothing().when(mailer).send(any(Mail.class));

            // When
            notificationService.notifyLeaveSubmitted(request, casual);

            // Then
            verify(mailer, times(2)).send(any(Mail.class));
        }
    }

    // ============================================================================
    // content
    // ============================================================================

    @Test
    @DisplayName("user-entered text is escaped in the approvers' mail")
    void escapesUserInput() {
        // Given
        owner.setName("Emma <b>Hansen</b>");
        request.setReason("<script>alert('x')</script>");
        casual.setName("Casual & Sick");
        Employee hr = employee().uuid("hr-1").role(Role.HR).email("hr@trustworks.dk").build();
        when(employeeRepository.findByIdOptional(EMPLOYEE)).thenReturn(Optional.of(owner));
        when(employeeRepository.findByRoles(anyList())).thenReturn(List.of(hr));

        // When
        notificationService.notifyLeaveSubmitted(request, casual);

        // Then
        ArgumentCaptor<Mail> captor = ArgumentCaptor.forClass(Mail.class);
        verify(mailer).send(captor.capture());
        String html = captor.getValue().getHtml();
        assertFalse(html.contains("<script>"));
        assertFalse(html.contains("<b>Hansen</b>"));
        assertTrue(html.contains("&lt;script&gt;alert('x')&lt;/script&gt;"));
        assertTrue(html.contains("Emma &lt;b&gt;Hansen&lt;/b&gt;"));
        assertTrue(html.contains("Casual &amp; Sick"));
    }

    @Test
    @DisplayName("nothing is sent when notifications are switched off")
    void disabled() {
        when(featureFlags.isNotificationsEnabled()).thenReturn(false);

        notificationService.notifyLeaveDecided(request, casual);

        verifyNoInteractions(mailer, slackService, employeeRepository);
    }
}
