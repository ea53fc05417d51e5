package dk.trustworks.leaveledger.aggregates.leave.services;

import dk.trustworks.leaveledger.aggregates.leave.dto.LeaveHistoryEntry;
import dk.trustworks.leaveledger.aggregates.leave.dto.LeaveHistoryEntry.EntryType;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;
import dk.trustworks.leaveledger.exceptions.NotAllottedException;
import dk.trustworks.leaveledger.utils.InMemoryLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static dk.trustworks.leaveledger.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeaveHistoryService")
class LeaveHistoryServiceTest {

    private static final String EMPLOYEE = "employee-1";

    @InjectMocks
    private LeaveHistoryService historyService;

    @Mock
    private AllotmentRepository allotmentRepository;

    @Mock
    private LeaveRequestRepository leaveRequestRepository;

    @Test
    @DisplayName("history starts at the grant and tracks the balance after each approved request")
    void runningBalance() {
        // Given
        InMemoryLedger ledger = new InMemoryLedger().wireAllotments(allotmentRepository).wireRequests(leaveRequestRepository);
        LeaveCategory casual = daysCategory(CASUAL_LEAVE);
        ledger.allotments.add(allotment(EMPLOYEE, casual, LeaveAmount.ofDays(5)));
        ledger.requests.add(leaveRequest().employee(EMPLOYEE).category(casual).days(2).approved().build());
        ledger.requests.add(leaveRequest().employee(EMPLOYEE).category(casual).days(1).build());
        LeaveRequest penalty = LeaveRequest.penaltyDeduction(EMPLOYEE, casual.getUuid(), LocalDate.of(2025, 3, 12),
                LeaveAmount.ofDays(0.5), "Penalty: Late clock-in exceeded max days (3/2)");
        ledger.requests.add(penalty);

        // When
        List<LeaveHistoryEntry> history = historyService.history(EMPLOYEE, casual.getUuid());

        // Then
        assertEquals(List.of(EntryType.ALLOTTED, EntryType.CONSUMED, EntryType.PENALTY_DEDUCTION),
                history.stream().map(LeaveHistoryEntry::type).toList());
        assertEquals(LeaveAmount.ofDays(5), history.get(0).balanceAfter());
        assertEquals(LeaveAmount.ofDays(3), history.get(1).balanceAfter());
        assertEquals(LeaveAmount.ofDays(2.5), history.get(2).balanceAfter());
        assertEquals(penalty.getUuid(), history.get(2).referenceUuid());
    }

    @Test
    @DisplayName("no history without an allotment")
    void notAllotted() {
        assertThrows(NotAllottedException.class, () -> historyService.history(EMPLOYEE, "unknown-category"));
    }
}
