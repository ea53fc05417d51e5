package dk.trustworks.leaveledger.aggregates.leave.model;

import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveUnit;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "leave_category",
        uniqueConstraints = @UniqueConstraint(name = "uk_leave_category_name", columnNames = "name"))
public class LeaveCategory extends PanacheEntityBase {

    @Id
    @EqualsAndHashCode.Include
    private String uuid;

    @Column(nullable = false, length = 100)
    private String name;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LeaveUnit unit;

    private boolean active;

    @Column(name = "penalty_category")
    private boolean penaltyCategory;

    public static LeaveCategory create(String name, String description, LeaveUnit unit) {
        return new LeaveCategory(UUID.randomUUID().toString(), name.trim(), description, unit, true, false);
    }
}
