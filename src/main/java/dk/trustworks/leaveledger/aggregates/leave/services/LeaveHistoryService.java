package dk.trustworks.leaveledger.aggregates.leave.services;

import dk.trustworks.leaveledger.aggregates.leave.dto.LeaveHistoryEntry;
import dk.trustworks.leaveledger.aggregates.leave.dto.LeaveHistoryEntry.EntryType;
import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveAmount;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveRequestRepository;
import dk.trustworks.leaveledger.exceptions.NotAllottedException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;

/**
 * Balance history of an allotment, rebuilt from the allotment and its approved requests.
 * Nothing here is stored.
 */
@ApplicationScoped
public class LeaveHistoryService {

    @Inject
    AllotmentRepository allotmentRepository;

    @Inject
    LeaveRequestRepository leaveRequestRepository;

    public List<LeaveHistoryEntry> history(String employeeUuid, String categoryUuid) {
        Allotment allotment = allotmentRepository.findByEmployeeAndCategory(employeeUuid, categoryUuid)
                .orElseThrow(() -> new NotAllottedException("No allotment of " + categoryUuid + " for employee " + employeeUuid));

        List<LeaveHistoryEntry> entries = new ArrayList<>();
        LeaveAmount balance = allotment.getGranted();
        entries.add(new LeaveHistoryEntry(EntryType.ALLOTTED, allotment.getUuid(),
                allotment.getAllottedAt() == null ? null : allotment.getAllottedAt().toLocalDate(),
                allotment.getGranted(), balance, allotment.getReason()));

        for (LeaveRequest request : leaveRequestRepository.findApprovedConsumption(employeeUuid, categoryUuid)) {
            if (request.getAmount() == null || request.getAmount().getUnit() != balance.getUnit()) continue;
            balance = balance.minusClamped(request.getAmount());
            EntryType type = request.isPenaltyDeduction() ? EntryType.PENALTY_DEDUCTION : EntryType.CONSUMED;
            entries.add(new LeaveHistoryEntry(type, request.getUuid(), request.getStartDate(),
                    request.getAmount(), balance, request.getReason()));
        }
        return entries;
    }
}
