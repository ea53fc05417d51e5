package dk.trustworks.leaveledger.aggregates.attendance.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A late-arrival penalty. At most one per employee and day; the counts are a snapshot of
 * the rules at the moment the penalty was charged.
 */
@Data
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@NoArgsConstructor
@Entity
@Table(name = "penalty",
        uniqueConstraints = @UniqueConstraint(name = "uk_penalty_employee_date", columnNames = {"employee_uuid", "penalty_date"}))
public class Penalty extends PanacheEntityBase {

    @Id
    @EqualsAndHashCode.Include
    private String uuid;

    @Column(name = "employee_uuid", nullable = false, length = 36)
    private String employeeUuid;

    @Column(name = "penalty_date", nullable = false)
    private LocalDate penaltyDate;

    @Column(name = "clock_in_time", nullable = false)
    private LocalDateTime clockInTime;

    @Column(name = "threshold", length = 10)
    private String threshold;

    @Column(name = "grace_count")
    private int graceCount;

    @Column(name = "late_arrival_count")
    private int lateArrivalCount;

    @Column(name = "penalty_amount", precision = 4, scale = 1)
    private BigDecimal penaltyAmount;

    private String reason;

    @Column(name = "deduction_request_uuid", length = 36)
    private String deductionRequestUuid;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    /**
     * Late days in a month are penalised once they pass the grace count. Without grace
     * every late day counts.
     */
    public static boolean exceedsGrace(int lateArrivalCount, int graceCount) {
        return graceCount == 0 ? lateArrivalCount > 0 : lateArrivalCount > graceCount;
    }

    public boolean isValidFor(int currentGraceCount) {
        return exceedsGrace(lateArrivalCount, currentGraceCount);
    }
}
