package dk.trustworks.leaveledger.utils;

import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveStatus;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;

/**
 * Backs mocked allotment and leave request repositories with plain lists, so ledger
 * scenarios can run several steps against the same state.
 */
public class InMemoryLedger {

    public final List<Allotment> allotments = new ArrayList<>();
    public final List<LeaveRequest> requests = new ArrayList<>();

    public InMemoryLedger wireAllotments(AllotmentRepository allotmentRepository) {
        lenient().when(allotmentRepository.findByEmployeeAndCategory(anyString(), anyString()))
                .thenAnswer(inv -> allotments.stream()
                        .filter(a -> a.getEmployeeUuid().equals(inv.getArgument(0))
                                && a.getCategoryUuid().equals(inv.getArgument(1)))
                        .findFirst());
        lenient().when(allotmentRepository.findByIdOptional(anyString()))
                .thenAnswer(inv -> allotments.stream().filter(a -> a.getUuid().equals(inv.getArgument(0))).findFirst());
        lenient().when(allotmentRepository.findByEmployee(anyString()))
                .thenAnswer(inv -> allotments.stream().filter(a -> a.getEmployeeUuid().equals(inv.getArgument(0))).toList());
        lenient().when(allotmentRepository.findAllOrdered()).thenAnswer(inv -> List.copyOf(allotments));
        lenient().doAnswer(inv -> {
            Allotment allotment = inv.getArgument(0);
            if (!allotments.contains(allotment)) allotments.add(allotment);
            return null;
        }).when(allotmentRepository).persist(any(Allotment.class));
        lenient().doAnswer(inv -> allotments.remove((Allotment) inv.getArgument(0)))
                .when(allotmentRepository).delete(any(Allotment.class));
        return this;
    }

    public InMemoryLedger wireRequests(LeaveRequestRepository leaveRequestRepository) {
        lenient().when(leaveRequestRepository.findApprovedConsumption(anyString(), anyString()))
                .thenAnswer(inv -> requests.stream()
                        .filter(r -> r.getEmployeeUuid().equals(inv.getArgument(0))
                                && r.getCategoryUuid().equals(inv.getArgument(1))
                                && r.getStatus() == LeaveStatus.APPROVED)
                        .toList());
        lenient().when(leaveRequestRepository.findByIdOptional(anyString()))
                .thenAnswer(inv -> requests.stream().filter(r -> r.getUuid().equals(inv.getArgument(0))).findFirst());
        lenient().when(leaveRequestRepository.findPending())
                .thenAnswer(inv -> requests.stream().filter(r -> r.getStatus() == LeaveStatus.PENDING).toList());
        lenient().when(leaveRequestRepository.findApprovedCovering(any(LocalDate.class)))
                .thenAnswer(inv -> requests.stream()
                        .filter(r -> r.getStatus() == LeaveStatus.APPROVED && r.covers(inv.getArgument(0)))
                        .toList());
        lenient().when(leaveRequestRepository.findPenaltyDeduction(anyString(), any(LocalDate.class)))
                .thenAnswer(inv -> requests.stream()
                        .filter(r -> r.isPenaltyDeduction()
                                && r.getEmployeeUuid().equals(inv.getArgument(0))
                                && Objects.equals(r.getStartDate(), inv.getArgument(1)))
                        .findFirst());
        lenient().doAnswer(inv -> {
            LeaveRequest request = inv.getArgument(0);
            if (!requests.contains(request)) requests.add(request);
            return null;
        }).when(leaveRequestRepository).persist(any(LeaveRequest.class));
        lenient().doAnswer(inv -> requests.remove((LeaveRequest) inv.getArgument(0)))
                .when(leaveRequestRepository).delete(any(LeaveRequest.class));
        return this;
    }

    public Allotment allotment(String employeeUuid, String categoryUuid) {
        return allotments.stream()
                .filter(a -> a.getEmployeeUuid().equals(employeeUuid) && a.getCategoryUuid().equals(categoryUuid))
                .findFirst()
                .orElseThrow();
    }
}
