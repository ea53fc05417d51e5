package dk.trustworks.leaveledger.aggregates.attendance.services;

import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyCharge;
import dk.trustworks.leaveledger.aggregates.attendance.model.Penalty;
import dk.trustworks.leaveledger.aggregates.attendance.repositories.PenaltyRepository;
import dk.trustworks.leaveledger.aggregates.leave.dto.BalanceView;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveUnit;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveCategoryRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;
import dk.trustworks.leaveledger.aggregates.leave.services.BalanceLedger;
import dk.trustworks.leaveledger.aggregates.leave.services.LeaveCategoryRegistry;
import dk.trustworks.leaveledger.utils.InMemoryLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

import static dk.trustworks.leaveledger.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Penalty writes against the real category resolution and balance derivation, for a
 * directory where the configured penalty category name belongs to an hour category.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PenaltyWriter with an hour category named Casual Leave")
class PenaltyWriterCategoryTest {

    private static final String EMPLOYEE = "employee-1";
    private static final LocalDateTime CLOCK_IN = LocalDateTime.of(2025, 3, 5, 9, 42, 17);

    @InjectMocks
    private LeaveCategoryRegistry categoryRegistry;

    @InjectMocks
    private BalanceLedger balanceLedger;

    @Mock
    private LeaveCategoryRepository categoryRepository;

    @Mock
    private AllotmentRepository allotmentRepository;

    @Mock
    private LeaveRequestRepository leaveRequestRepository;

    @Mock
    private PenaltyRepository penaltyRepository;

    private PenaltyWriter penaltyWriter;
    private InMemoryLedger ledger;
    private LeaveCategory casualHours;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger().wireAllotments(allotmentRepository).wireRequests(leaveRequestRepository);
        casualHours = hoursCategory(CASUAL_LEAVE);
        ledger.allotments.add(allotment(EMPLOYEE, casualHours, LeaveAmount.ofHoursMinutes(8, 0)));
        when(categoryRepository.findByNameIgnoreCase(CASUAL_LEAVE)).thenReturn(Optional.of(casualHours));

        penaltyWriter = new PenaltyWriter();
        penaltyWriter.penaltyRepository = penaltyRepository;
        penaltyWriter.leaveRequestRepository = leaveRequestRepository;
        penaltyWriter.allotmentRepository = allotmentRepository;
        penaltyWriter.categoryRegistry = categoryRegistry;
        penaltyWriter.balanceLedger = balanceLedger;
    }

    @Test
    @DisplayName("the half day is deducted from a day category, not silently dropped")
    void deductionLandsInDayCategory() {
        // Given
        PenaltyCharge charge = new PenaltyCharge(EMPLOYEE, CLOCK_IN, "09:00", 0, 1, new BigDecimal("0.5"));

        // When
        Penalty penalty = penaltyWriter.write(charge);

        // Then
        ArgumentCaptor<LeaveCategory> captor = ArgumentCaptor.forClass(LeaveCategory.class);
        verify(categoryRepository).persist(captor.capture());
        LeaveCategory penaltyCategory = captor.getValue();
        assertEquals(LeaveUnit.DAYS, penaltyCategory.getUnit());

        assertEquals(1, ledger.requests.size());
        LeaveRequest deduction = ledger.requests.get(0);
        assertEquals(penalty.getDeductionRequestUuid(), deduction.getUuid());
        assertEquals(penaltyCategory.getUuid(), deduction.getCategoryUuid());
        assertEquals(LeaveAmount.ofDays(0.5), deduction.getAmount());

        BalanceView penaltyBalance = balanceLedger.balanceOf(EMPLOYEE, penaltyCategory.getUuid());
        assertEquals(LeaveAmount.ofDays(0.5), penaltyBalance.used());

        assertEquals(LeaveAmount.ofHoursMinutes(8, 0), ledger.allotment(EMPLOYEE, casualHours.getUuid()).getRemaining());
    }

    @Test
    @DisplayName("the hour category is left untouched")
    void hourCategoryUntouched() {
        penaltyWriter.write(new PenaltyCharge(EMPLOYEE, CLOCK_IN, "09:00", 0, 1, new BigDecimal("0.5")));

        assertTrue(ledger.requests.stream().noneMatch(r -> r.getCategoryUuid().equals(casualHours.getUuid())));
        assertFalse(casualHours.isPenaltyCategory());
        verify(penaltyRepository).persist(any(Penalty.class));
    }
}
