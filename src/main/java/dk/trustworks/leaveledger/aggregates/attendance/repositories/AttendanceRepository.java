package dk.trustworks.leaveledger.aggregates.attendance.repositories;

import dk.trustworks.leaveledger.aggregates.attendance.model.AttendanceRecord;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class AttendanceRepository implements PanacheRepositoryBase<AttendanceRecord, String> {

    /**
     * Clock-ins in {@code [from, to)}, oldest first.
     */
    public List<AttendanceRecord> findClockInsBetween(String employeeUuid, LocalDateTime from, LocalDateTime to) {
        return find("employeeUuid = ?1 and clockIn >= ?2 and clockIn < ?3 order by clockIn",
                employeeUuid, from, to).list();
    }

    public Optional<AttendanceRecord> findLatestOpen(String employeeUuid, LocalDate workDate) {
        return find("employeeUuid = ?1 and workDate = ?2 and clockOut is null order by clockIn desc",
                employeeUuid, workDate).firstResultOptional();
    }

    public List<AttendanceRecord> findByWorkDateBetween(String employeeUuid, LocalDate from, LocalDate to) {
        return find("employeeUuid = ?1 and workDate >= ?2 and workDate <= ?3 order by clockIn",
                employeeUuid, from, to).list();
    }
}
