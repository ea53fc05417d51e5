package dk.trustworks.leaveledger.aggregates.leave.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.HalfDayType;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveStatus;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.RequestOrigin;
import dk.trustworks.leaveledger.model.Auditable;
import dk.trustworks.leaveledger.security.Actor;
import dk.trustworks.leaveledger.security.AuditEntityListener;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

@Data
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@NoArgsConstructor
@Entity
@Table(name = "leave_request",
        uniqueConstraints = @UniqueConstraint(name = "uk_leave_request_deduction_key", columnNames = "deduction_key"),
        indexes = {
                @Index(name = "idx_leave_request_pair_status", columnList = "employee_uuid, category_uuid, status"),
                @Index(name = "idx_leave_request_dates", columnList = "start_date, end_date")
        })
@EntityListeners(AuditEntityListener.class)
public class LeaveRequest extends PanacheEntityBase implements Auditable {

    @Id
    @EqualsAndHashCode.Include
    private String uuid;

    @Column(name = "employee_uuid", nullable = false, length = 36)
    private String employeeUuid;

    @Column(name = "category_uuid", nullable = false, length = 36)
    private String categoryUuid;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "unit", column = @Column(name = "amount_unit", length = 20)),
            @AttributeOverride(name = "days", column = @Column(name = "amount_days", precision = 7, scale = 1)),
            @AttributeOverride(name = "hours", column = @Column(name = "amount_hours")),
            @AttributeOverride(name = "minutes", column = @Column(name = "amount_minutes"))
    })
    private LeaveAmount amount;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "half_day_type", length = 20)
    private HalfDayType halfDayType;

    @Column(name = "short_leave_from")
    private LocalTime shortLeaveFrom;

    @Column(name = "short_leave_to")
    private LocalTime shortLeaveTo;

    @Column(name = "medical_report_url")
    private String medicalReportUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LeaveStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private RequestOrigin origin;

    @Column(name = "submitted_by", length = 36)
    private String submittedBy;

    @Column(name = "approver_uuid", length = 36)
    private String approverUuid;

    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    /** employee|category|date, set on penalty deductions only. */
    @JsonIgnore
    @Column(name = "deduction_key", length = 120)
    private String deductionKey;

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

    public static LeaveRequest pending(String employeeUuid, String categoryUuid, LeaveAmount amount,
                                       LocalDate startDate, LocalDate endDate, RequestOrigin origin, String submittedBy) {
        LeaveRequest request = new LeaveRequest();
        request.setUuid(UUID.randomUUID().toString());
        request.setEmployeeUuid(employeeUuid);
        request.setCategoryUuid(categoryUuid);
        request.setAmount(amount);
        request.setStartDate(startDate);
        request.setEndDate(endDate);
        request.setStatus(LeaveStatus.PENDING);
        request.setOrigin(origin);
        request.setSubmittedBy(submittedBy);
        return request;
    }

    /**
     * An already approved deduction charged by the attendance penalty engine.
     */
    public static LeaveRequest penaltyDeduction(String employeeUuid, String categoryUuid, LocalDate day,
                                                LeaveAmount amount, String reason) {
        LeaveRequest request = pending(employeeUuid, categoryUuid, amount, day, day,
                RequestOrigin.PENALTY_DEDUCTION, Actor.SYSTEM_UUID);
        request.setStatus(LeaveStatus.APPROVED);
        request.setApproverUuid(Actor.SYSTEM_UUID);
        request.setDecidedAt(LocalDateTime.now());
        request.setReason(reason);
        request.setDeductionKey(deductionKey(employeeUuid, categoryUuid, day));
        return request;
    }

    public static String deductionKey(String employeeUuid, String categoryUuid, LocalDate day) {
        return employeeUuid + "|" + categoryUuid + "|" + day;
    }

    @JsonIgnore
    public boolean isApproved() {
        return status == LeaveStatus.APPROVED;
    }

    @JsonIgnore
    public boolean isPenaltyDeduction() {
        return origin == RequestOrigin.PENALTY_DEDUCTION;
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
