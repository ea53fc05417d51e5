package dk.trustworks.leaveledger.aggregates.attendance.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@NoArgsConstructor
@Entity
@Table(name = "attendance_record",
        indexes = @Index(name = "idx_attendance_employee_date", columnList = "employee_uuid, work_date"))
public class AttendanceRecord extends PanacheEntityBase {

    public static final String STATUS_PRESENT = "PRESENT";

    @Id
    @EqualsAndHashCode.Include
    private String uuid;

    @Column(name = "employee_uuid", nullable = false, length = 36)
    private String employeeUuid;

    @Column(name = "work_date", nullable = false)
    private LocalDate workDate;

    @Column(name = "clock_in", nullable = false)
    private LocalDateTime clockIn;

    @Column(name = "clock_out")
    private LocalDateTime clockOut;

    @Column(name = "hours_worked")
    private double hoursWorked;

    @Column(length = 20)
    private String status;

    public static AttendanceRecord clockIn(String employeeUuid, LocalDateTime clockIn) {
        AttendanceRecord record = new AttendanceRecord();
        record.setUuid(UUID.randomUUID().toString());
        record.setEmployeeUuid(employeeUuid);
        record.setWorkDate(clockIn.toLocalDate());
        record.setClockIn(clockIn);
        record.setStatus(STATUS_PRESENT);
        return record;
    }

    public boolean isOpen() {
        return clockOut == null;
    }
}
