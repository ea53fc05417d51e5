package dk.trustworks.leaveledger.aggregates.leave.repositories;

import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;

/**
 * Allotments are unique per (employee, category); the finders rely on that.
 */
@ApplicationScoped
public class AllotmentRepository implements PanacheRepositoryBase<Allotment, String> {

    public Optional<Allotment> findByEmployeeAndCategory(String employeeUuid, String categoryUuid) {
        return find("employeeUuid = ?1 and categoryUuid = ?2", employeeUuid, categoryUuid).firstResultOptional();
    }

    public List<Allotment> findByEmployee(String employeeUuid) {
        return find("employeeUuid = ?1 order by allottedAt", employeeUuid).list();
    }

    public List<Allotment> findAllOrdered() {
        return find("order by employeeUuid, categoryUuid").list();
    }

    public boolean existsForCategory(String categoryUuid) {
        return count("categoryUuid", categoryUuid) > 0;
    }
}
