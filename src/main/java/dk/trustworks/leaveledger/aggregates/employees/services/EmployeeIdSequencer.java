package dk.trustworks.leaveledger.aggregates.employees.services;

import dk.trustworks.leaveledger.aggregates.employees.dto.EmployeeIdAssignment;
import dk.trustworks.leaveledger.aggregates.employees.model.Employee;
import dk.trustworks.leaveledger.aggregates.employees.repositories.EmployeeRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Numbers employees {@code <joiningYear>EMP-<seq>} with one sequence across all years,
 * ordered by when the joining year was recorded. Admins are not numbered.
 */
@JBossLog
@ApplicationScoped
public class EmployeeIdSequencer {

    static final int MIN_YEAR = 1900;
    static final int MAX_YEAR = 2100;

    private static final Comparator<Employee> SEQUENCE_ORDER = Comparator
            .comparing(Employee::getJoiningYearUpdatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Employee::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Employee::getUuid);

    @Inject
    EmployeeRepository employeeRepository;

    @Transactional
    public EmployeeIdAssignment assign() {
        int cleared = 0;
        List<Employee> numbered = new ArrayList<>();
        for (Employee employee : employeeRepository.findNonAdmins()) {
            if (!hasValidJoiningYear(employee)) {
                if (employee.getEmpId() != null) {
                    employee.setEmpId(null);
                    cleared++;
                }
                continue;
            }
            if (employee.getJoiningYearUpdatedAt() == null) {
                employee.setJoiningYearUpdatedAt(employee.getCreatedAt() != null ? employee.getCreatedAt() : LocalDateTime.now());
            }
            numbered.add(employee);
        }
        numbered.sort(SEQUENCE_ORDER);

        Map<Employee, String> changes = new LinkedHashMap<>();
        int sequence = 0;
        for (Employee employee : numbered) {
            String empId = format(employee.getJoiningYear(), ++sequence);
            if (!Objects.equals(empId, employee.getEmpId())) changes.put(employee, empId);
        }

        // park changed ids first so swapped ids never collide on uk_employee_emp_id
        changes.keySet().forEach(employee -> employee.setEmpId("TMP-" + employee.getUuid()));
        employeeRepository.flush();
        changes.forEach(Employee::setEmpId);

        if (!changes.isEmpty() || cleared > 0) {
            log.infof("Employee ids updated: %d assigned, %d cleared", changes.size(), cleared);
        }
        return new EmployeeIdAssignment(true, changes.size(), cleared);
    }

    static boolean hasValidJoiningYear(Employee employee) {
        Integer year = employee.getJoiningYear();
        return year != null && year >= MIN_YEAR && year <= MAX_YEAR;
    }

    static String format(int joiningYear, int sequence) {
        return String.format("%dEMP-%03d", joiningYear, sequence);
    }
}
