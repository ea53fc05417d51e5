package dk.trustworks.leaveledger.aggregates.leave.services;

import dk.trustworks.leaveledger.aggregates.leave.dto.AllotLeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.dto.AllotmentError;
import dk.trustworks.leaveledger.aggregates.leave.dto.BulkAllotmentRequest;
import dk.trustworks.leaveledger.aggregates.leave.dto.BulkAllotmentResult;
import dk.trustworks.leaveledger.aggregates.leave.dto.EditAllotmentRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.exceptions.DuplicateAllotmentException;
import dk.trustworks.leaveledger.exceptions.InvalidLeaveAmountException;
import dk.trustworks.leaveledger.exceptions.UnauthorizedActionException;
import dk.trustworks.leaveledger.security.Actor;
import dk.trustworks.leaveledger.security.Role;
import dk.trustworks.leaveledger.utils.InMemoryLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static dk.trustworks.leaveledger.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AllotmentService")
class AllotmentServiceTest {

    private static final String EMPLOYEE = "employee-1";

    @InjectMocks
    private AllotmentService allotmentService;

    @Mock
    private AllotmentRepository allotmentRepository;

    @Mock
    private LeaveCategoryRegistry categoryRegistry;

    @Mock
    private BalanceLedger balanceLedger;

    private InMemoryLedger ledger;
    private LeaveCategory casual;
    private LeaveCategory shortLeave;
    private final Actor hr = new Actor("hr-1", Role.HR);

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger().wireAllotments(allotmentRepository);
        casual = daysCategory(CASUAL_LEAVE);
        shortLeave = hoursCategory(SHORT_LEAVE);
        for (LeaveCategory category : List.of(casual, shortLeave)) {
            lenient().when(categoryRegistry.findActive(category.getUuid())).thenReturn(category);
            lenient().when(categoryRegistry.findByUuid(category.getUuid())).thenReturn(Optional.of(category));
        }
    }

    private AllotLeaveRequest days(String employeeUuid, LeaveCategory category, String days) {
        return AllotLeaveRequest.builder().employeeUuid(employeeUuid).categoryUuid(category.getUuid())
                .days(new BigDecimal(days)).build();
    }

    @Nested
    @DisplayName("allot")
    class Allot {

        @Test
        @DisplayName("creates the allotment with a full balance and recomputes it")
        void createsAllotment() {
            // When
            Allotment allotment = allotmentService.allot(hr, days(EMPLOYEE, casual, "12"));

            // Then
            assertEquals(LeaveAmount.ofDays(12), allotment.getGranted());
            assertEquals(LeaveAmount.ofDays(12), allotment.getRemaining());
            assertEquals("hr-1", allotment.getAllottedBy());
            assertEquals("Allotted by HR", allotment.getReason());
            assertTrue(ledger.allotments.contains(allotment));
            verify(balanceLedger).recompute(EMPLOYEE, casual.getUuid());
        }

        @Test
        @DisplayName("hour categories take hours and minutes")
        void hourAllotment() {
            AllotLeaveRequest request = AllotLeaveRequest.builder().employeeUuid(EMPLOYEE)
                    .categoryUuid(shortLeave.getUuid()).hours(1).minutes(75).build();

            Allotment allotment = allotmentService.allot(hr, request);

            assertEquals(LeaveAmount.ofHoursMinutes(2, 15), allotment.getGranted());
        }

        @Test
        @DisplayName("a second allotment of the same category is refused")
        void duplicate() {
            allotmentService.allot(hr, days(EMPLOYEE, casual, "12"));

            assertThrows(DuplicateAllotmentException.class, () -> allotmentService.allot(hr, days(EMPLOYEE, casual, "3")));
            assertEquals(1, ledger.allotments.size());
        }

        @Test
        @DisplayName("zero days is not an allotment")
        void zeroAmount() {
            assertThrows(InvalidLeaveAmountException.class, () -> allotmentService.allot(hr, days(EMPLOYEE, casual, "0")));
        }

        @Test
        @DisplayName("employees cannot allot")
        void employeeRefused() {
            Actor employee = new Actor(EMPLOYEE, Role.EMPLOYEE);

            assertThrows(UnauthorizedActionException.class, () -> allotmentService.allot(employee, days(EMPLOYEE, casual, "1")));
            verifyNoInteractions(balanceLedger);
        }
    }

    @Nested
    @DisplayName("bulkAllot")
    class BulkAllot {

        @Test
        @DisplayName("applies valid rows and reports the others")
        void partialSuccess() {
            // Given
            LeaveCategory inactive = daysCategory("Old Leave");
            inactive.setActive(false);
            when(categoryRegistry.findByUuid(inactive.getUuid())).thenReturn(Optional.of(inactive));
            ledger.allotments.add(allotment("employee-3", casual, LeaveAmount.ofDays(5)));

            BulkAllotmentRequest batch = new BulkAllotmentRequest(List.of(
                    days(EMPLOYEE, casual, "10"),
                    days(EMPLOYEE, casual, "4"),
                    days("employee-2", inactive, "2"),
                    days("employee-2", casual, "-1"),
                    days("employee-3", casual, "5"),
                    days("employee-2", casual, "8")), List.of());

            // When
            BulkAllotmentResult result = allotmentService.bulkAllot(hr, batch);

            // Then
            assertEquals(2, result.created().size());
            assertEquals(List.of("DUPLICATE_ALLOTMENT", "INVALID_CATEGORY", "INVALID_AMOUNT", "DUPLICATE_ALLOTMENT"),
                    result.errors().stream().map(AllotmentError::code).toList());
            assertTrue(result.hasErrors());
            assertEquals(3, ledger.allotments.size());
        }

        @Test
        @DisplayName("replaced allotments are removed before the batch is applied")
        void replacesExisting() {
            // Given
            Allotment existing = allotment(EMPLOYEE, casual, LeaveAmount.ofDays(5));
            ledger.allotments.add(existing);
            BulkAllotmentRequest batch = new BulkAllotmentRequest(List.of(days(EMPLOYEE, casual, "15")),
                    List.of(existing.getUuid(), "unknown-uuid"));

            // When
            BulkAllotmentResult result = allotmentService.bulkAllot(hr, batch);

            // Then
            assertEquals(1, result.replaced());
            assertFalse(result.hasErrors());
            assertEquals(LeaveAmount.ofDays(15), ledger.allotment(EMPLOYEE, casual.getUuid()).getGranted());
            verify(allotmentRepository).flush();
        }
    }

    @Nested
    @DisplayName("editAllotment")
    class EditAllotment {

        @Test
        @DisplayName("changing the granted amount recomputes the balance")
        void changeAmount() {
            Allotment allotment = allotment(EMPLOYEE, casual, LeaveAmount.ofDays(10));
            ledger.allotments.add(allotment);

            allotmentService.editAllotment(hr, allotment.getUuid(),
                    EditAllotmentRequest.builder().days(new BigDecimal("12.5")).carryForward(true).build());

            assertEquals(LeaveAmount.ofDays(12.5), allotment.getGranted());
            assertTrue(allotment.isCarryForward());
            verify(balanceLedger).recompute(EMPLOYEE, casual.getUuid());
        }

        @Test
        @DisplayName("moving to a category the employee already holds is refused")
        void moveToTakenCategory() {
            LeaveCategory sick = daysCategory("Sick Leave");
            when(categoryRegistry.findActive(sick.getUuid())).thenReturn(sick);
            Allotment allotment = allotment(EMPLOYEE, casual, LeaveAmount.ofDays(10));
            ledger.allotments.add(allotment);
            ledger.allotments.add(allotment(EMPLOYEE, sick, LeaveAmount.ofDays(5)));

            assertThrows(DuplicateAllotmentException.class, () -> allotmentService.editAllotment(hr, allotment.getUuid(),
                    EditAllotmentRequest.builder().categoryUuid(sick.getUuid()).build()));
            assertEquals(casual.getUuid(), allotment.getCategoryUuid());
        }

        @Test
        @DisplayName("moving to a category of another unit requires a new amount")
        void moveAcrossUnits() {
            Allotment allotment = allotment(EMPLOYEE, casual, LeaveAmount.ofDays(10));
            ledger.allotments.add(allotment);

            assertThrows(InvalidLeaveAmountException.class, () -> allotmentService.editAllotment(hr, allotment.getUuid(),
                    EditAllotmentRequest.builder().categoryUuid(shortLeave.getUuid()).build()));

            allotmentService.editAllotment(hr, allotment.getUuid(),
                    EditAllotmentRequest.builder().categoryUuid(shortLeave.getUuid()).hours(4).build());

            assertEquals(shortLeave.getUuid(), allotment.getCategoryUuid());
            assertEquals(LeaveAmount.ofHoursMinutes(4, 0), allotment.getGranted());
        }
    }
}
