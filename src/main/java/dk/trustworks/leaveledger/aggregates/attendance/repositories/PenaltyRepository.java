package dk.trustworks.leaveledger.aggregates.attendance.repositories;

import dk.trustworks.leaveledger.aggregates.attendance.model.Penalty;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class PenaltyRepository implements PanacheRepositoryBase<Penalty, String> {

    public Optional<Penalty> findByEmployeeAndDate(String employeeUuid, LocalDate penaltyDate) {
        return find("employeeUuid = ?1 and penaltyDate = ?2", employeeUuid, penaltyDate).firstResultOptional();
    }

    public List<Penalty> findByEmployeeBetween(String employeeUuid, LocalDate from, LocalDate to) {
        return find("employeeUuid = ?1 and penaltyDate >= ?2 and penaltyDate <= ?3 order by penaltyDate",
                employeeUuid, from, to).list();
    }
}
