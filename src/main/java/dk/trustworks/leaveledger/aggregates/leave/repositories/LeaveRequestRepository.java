package dk.trustworks.leaveledger.aggregates.leave.repositories;

import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveStatus;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.RequestOrigin;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class LeaveRequestRepository implements PanacheRepositoryBase<LeaveRequest, String> {

    /**
     * Approved requests that consume the balance of an allotment, penalty deductions included.
     */
    public List<LeaveRequest> findApprovedConsumption(String employeeUuid, String categoryUuid) {
        return find("employeeUuid = ?1 and categoryUuid = ?2 and status = ?3 order by startDate, createdAt",
                employeeUuid, categoryUuid, LeaveStatus.APPROVED).list();
    }

    public List<LeaveRequest> findVisibleByEmployee(String employeeUuid) {
        return find("employeeUuid = ?1 and origin <> ?2 order by createdAt desc",
                employeeUuid, RequestOrigin.PENALTY_DEDUCTION).list();
    }

    public List<LeaveRequest> findVisible() {
        return find("origin <> ?1 order by createdAt desc", RequestOrigin.PENALTY_DEDUCTION).list();
    }

    public List<LeaveRequest> findPending() {
        return find("status = ?1 order by createdAt", LeaveStatus.PENDING).list();
    }

    public Optional<LeaveRequest> findPenaltyDeduction(String employeeUuid, LocalDate day) {
        return find("employeeUuid = ?1 and origin = ?2 and startDate = ?3",
                employeeUuid, RequestOrigin.PENALTY_DEDUCTION, day).firstResultOptional();
    }

    public List<LeaveRequest> findApprovedCovering(LocalDate date) {
        return find("status = ?1 and startDate <= ?2 and endDate >= ?2", LeaveStatus.APPROVED, date).list();
    }
}
