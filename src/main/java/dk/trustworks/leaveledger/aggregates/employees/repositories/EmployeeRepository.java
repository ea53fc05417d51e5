package dk.trustworks.leaveledger.aggregates.employees.repositories;

import dk.trustworks.leaveledger.aggregates.employees.model.Employee;
import dk.trustworks.leaveledger.security.Role;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collection;
import java.util.List;

@ApplicationScoped
public class EmployeeRepository implements PanacheRepositoryBase<Employee, String> {

    public List<Employee> findByRoles(Collection<Role> roles) {
        return find("role in ?1", roles).list();
    }

    public List<Employee> findNonAdmins() {
        return find("role is null or role <> ?1", Role.ADMIN).list();
    }

    public List<Employee> findByUuids(Collection<String> uuids) {
        if (uuids.isEmpty()) return List.of();
        return find("uuid in ?1 order by name", uuids).list();
    }
}
