package dk.trustworks.leaveledger.aggregates.leave.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.leaveledger.model.Auditable;
import dk.trustworks.leaveledger.security.AuditEntityListener;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * The grant of a leave category to one employee. {@code remaining} is derived from the
 * approved requests of the pair and is written by the balance ledger only.
 */
@Data
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@NoArgsConstructor
@Entity
@Table(name = "allotment",
        uniqueConstraints = @UniqueConstraint(name = "uk_allotment_employee_category",
                columnNames = {"employee_uuid", "category_uuid"}))
@EntityListeners(AuditEntityListener.class)
public class Allotment extends PanacheEntityBase implements Auditable {

    @Id
    @EqualsAndHashCode.Include
    private String uuid;

    @Column(name = "employee_uuid", nullable = false, length = 36)
    private String employeeUuid;

    @Column(name = "category_uuid", nullable = false, length = 36)
    private String categoryUuid;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "unit", column = @Column(name = "granted_unit", length = 20)),
            @AttributeOverride(name = "days", column = @Column(name = "granted_days", precision = 7, scale = 1)),
            @AttributeOverride(name = "hours", column = @Column(name = "granted_hours")),
            @AttributeOverride(name = "minutes", column = @Column(name = "granted_minutes"))
    })
    private LeaveAmount granted;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "unit", column = @Column(name = "remaining_unit", length = 20)),
            @AttributeOverride(name = "days", column = @Column(name = "remaining_days", precision = 7, scale = 1)),
            @AttributeOverride(name = "hours", column = @Column(name = "remaining_hours")),
            @AttributeOverride(name = "minutes", column = @Column(name = "remaining_minutes"))
    })
    private LeaveAmount remaining;

    @Column(name = "carry_forward")
    private boolean carryForward;

    private String reason;

    @Column(name = "allotted_by", length = 36)
    private String allottedBy;

    @Column(name = "allotted_at")
    private LocalDateTime allottedAt;

    @Column(name = "created_at", nullable = false)
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private LocalDateTime updatedAt;

    @Column(name = "created_by", nullable = false, length = 255)
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private String createdBy;

    @Column(name = "modified_by", length = 255)
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private String modifiedBy;

    public static Allotment grant(String employeeUuid, String categoryUuid, LeaveAmount granted,
                                  String allottedBy, boolean carryForward, String reason) {
        Allotment allotment = new Allotment();
        allotment.setUuid(UUID.randomUUID().toString());
        allotment.setEmployeeUuid(employeeUuid);
        allotment.setCategoryUuid(categoryUuid);
        allotment.setGranted(granted);
        allotment.setRemaining(granted);
        allotment.setAllottedBy(allottedBy);
        allotment.setCarryForward(carryForward);
        allotment.setReason(reason);
        allotment.setAllottedAt(LocalDateTime.now());
        return allotment;
    }
}
