package dk.trustworks.leaveledger.aggregates.attendance.services;

import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyCharge;
import dk.trustworks.leaveledger.aggregates.attendance.model.Penalty;
import dk.trustworks.leaveledger.aggregates.attendance.repositories.PenaltyRepository;
import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveStatus;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.RequestOrigin;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;
import dk.trustworks.leaveledger.aggregates.leave.services.BalanceLedger;
import dk.trustworks.leaveledger.aggregates.leave.services.LeaveCategoryRegistry;
import dk.trustworks.leaveledger.security.Actor;
import dk.trustworks.leaveledger.utils.InMemoryLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import static dk.trustworks.leaveledger.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PenaltyWriter")
class PenaltyWriterTest {

    private static final String EMPLOYEE = "employee-1";
    private static final LocalDateTime CLOCK_IN = LocalDateTime.of(2025, 3, 5, 9, 42, 17);

    @InjectMocks
    private PenaltyWriter penaltyWriter;

    @Mock
    private PenaltyRepository penaltyRepository;

    @Mock
    private LeaveRequestRepository leaveRequestRepository;

    @Mock
    private AllotmentRepository allotmentRepository;

    @Mock
    private LeaveCategoryRegistry categoryRegistry;

    @Mock
    private BalanceLedger balanceLedger;

    private InMemoryLedger ledger;
    private LeaveCategory casual;
    private final PenaltyCharge charge = new PenaltyCharge(EMPLOYEE, CLOCK_IN, "09:00", 2, 3, new BigDecimal("0.5"));

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger().wireAllotments(allotmentRepository).wireRequests(leaveRequestRepository);
        casual = daysCategory(CASUAL_LEAVE);
        lenient().when(categoryRegistry.resolvePenaltyCategory(true)).thenReturn(Optional.of(casual));
    }

    @Test
    @DisplayName("writes an approved deduction and a penalty pointing at it, then recomputes")
    void writesPenaltyAndDeduction() {
        // Given
        ledger.allotments.add(allotment(EMPLOYEE, casual, LeaveAmount.ofDays(10)));

        // When
        Penalty penalty = penaltyWriter.write(charge);

        // Then
        assertEquals(1, ledger.requests.size());
        LeaveRequest deduction = ledger.requests.get(0);
        assertEquals(LeaveStatus.APPROVED, deduction.getStatus());
        assertEquals(RequestOrigin.PENALTY_DEDUCTION, deduction.getOrigin());
        assertEquals(Actor.SYSTEM_UUID, deduction.getSubmittedBy());
        assertEquals(LeaveAmount.ofDays(0.5), deduction.getAmount());
        assertEquals(LocalDate.of(2025, 3, 5), deduction.getStartDate());
        assertEquals(LeaveRequest.deductionKey(EMPLOYEE, casual.getUuid(), LocalDate.of(2025, 3, 5)), deduction.getDeductionKey());
        assertEquals("Penalty: Late clock-in exceeded max days (3/2)", deduction.getReason());

        assertEquals(deduction.getUuid(), penalty.getDeductionRequestUuid());
        assertEquals(LocalDate.of(2025, 3, 5), penalty.getPenaltyDate());
        assertEquals(3, penalty.getLateArrivalCount());
        assertEquals(2, penalty.getGraceCount());
        assertEquals("Late clock-in (09:42) after time limit (09:00) - Exceeded max late days (3/2)", penalty.getReason());

        InOrder inOrder = inOrder(penaltyRepository, balanceLedger);
        inOrder.verify(penaltyRepository).persist(penalty);
        inOrder.verify(penaltyRepository).flush();
        inOrder.verify(balanceLedger).recompute(EMPLOYEE, casual.getUuid());
    }

    @Test
    @DisplayName("an employee without allotment of the penalty category gets an empty one")
    void autoAllotsEmptyCategory() {
        penaltyWriter.write(charge);

        ArgumentCaptor<Allotment> captor = ArgumentCaptor.forClass(Allotment.class);
        verify(allotmentRepository).persist(captor.capture());
        Allotment allotment = captor.getValue();
        assertEquals(EMPLOYEE, allotment.getEmployeeUuid());
        assertEquals(casual.getUuid(), allotment.getCategoryUuid());
        assertTrue(allotment.getGranted().isZero());
        assertEquals(Actor.SYSTEM_UUID, allotment.getAllottedBy());
    }

    @Test
    @DisplayName("an existing allotment is left alone")
    void keepsExistingAllotment() {
        ledger.allotments.add(allotment(EMPLOYEE, casual, LeaveAmount.ofDays(10)));

        penaltyWriter.write(charge);

        verify(allotmentRepository, never()).persist(any(Allotment.class));
        assertEquals(1, ledger.allotments.size());
    }

    @Test
    @DisplayName("refuses to charge a penalty to an hour category")
    void refusesHourCategory() {
        when(categoryRegistry.resolvePenaltyCategory(true)).thenReturn(Optional.of(hoursCategory(SHORT_LEAVE)));

        assertThrows(IllegalStateException.class, () -> penaltyWriter.write(charge));
        assertTrue(ledger.requests.isEmpty());
        verify(penaltyRepository, never()).persist(any(Penalty.class));
    }
}
