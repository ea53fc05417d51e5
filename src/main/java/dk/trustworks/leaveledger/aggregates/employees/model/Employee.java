package dk.trustworks.leaveledger.aggregates.employees.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dk.trustworks.leaveledger.security.Role;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * The slice of the employee record the ledger reads. Profiles are maintained elsewhere.
 */
@Data
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@NoArgsConstructor
@Entity
@Table(name = "employee",
        uniqueConstraints = @UniqueConstraint(name = "uk_employee_emp_id", columnNames = "emp_id"))
public class Employee extends PanacheEntityBase {

    public static final String UNRESTRICTED_THRESHOLD = "N/R";

    @Id
    @EqualsAndHashCode.Include
    private String uuid;

    private String name;

    private String email;

    private String slackusername;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private Role role;

    /** HH:mm, {@value #UNRESTRICTED_THRESHOLD} or null for the global default. */
    @Column(name = "clock_in_threshold", length = 10)
    private String clockInThreshold;

    @Column(name = "joining_year")
    private Integer joiningYear;

    @JsonIgnore
    @Column(name = "joining_year_updated_at")
    private LocalDateTime joiningYearUpdatedAt;

    @Column(name = "emp_id", length = 40)
    private String empId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @JsonIgnore
    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
