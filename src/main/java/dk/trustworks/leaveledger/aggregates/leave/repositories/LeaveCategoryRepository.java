package dk.trustworks.leaveledger.aggregates.leave.repositories;

import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class LeaveCategoryRepository implements PanacheRepositoryBase<LeaveCategory, String> {

    public List<LeaveCategory> findActive() {
        return find("active = ?1 order by name", true).list();
    }

    public Optional<LeaveCategory> findByNameIgnoreCase(String name) {
        return find("lower(name) = ?1", name.trim().toLowerCase()).firstResultOptional();
    }

    public Optional<LeaveCategory> findFlaggedPenaltyCategory() {
        return find("penaltyCategory", true).firstResultOptional();
    }

    public List<LeaveCategory> findByUuids(Collection<String> uuids) {
        if (uuids.isEmpty()) return List.of();
        return find("uuid in ?1 order by name", uuids).list();
    }
}
