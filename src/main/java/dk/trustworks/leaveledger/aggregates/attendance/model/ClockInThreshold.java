package dk.trustworks.leaveledger.aggregates.attendance.model;

import dk.trustworks.leaveledger.aggregates.employees.model.Employee;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Latest on-time clock-in of a day, or unrestricted ("N/R"). Lateness is judged on
 * hours and minutes only, so 09:00:59 is on time against 09:00.
 */
public record ClockInThreshold(LocalTime limit) {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("H:mm");

    public static ClockInThreshold unrestricted() {
        return new ClockInThreshold(null);
    }

    public static ClockInThreshold at(LocalTime limit) {
        return new ClockInThreshold(limit.truncatedTo(ChronoUnit.MINUTES));
    }

    /**
     * @return empty for a blank value, otherwise the parsed threshold
     * @throws IllegalArgumentException when the value is neither HH:mm nor N/R
     */
    public static Optional<ClockInThreshold> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String value = raw.trim();
        if (Employee.UNRESTRICTED_THRESHOLD.equalsIgnoreCase(value)) return Optional.of(unrestricted());
        try {
            return Optional.of(at(LocalTime.parse(value, FORMAT)));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Clock-in threshold must be HH:mm or " + Employee.UNRESTRICTED_THRESHOLD + ": " + raw, e);
        }
    }

    public boolean isUnrestricted() {
        return limit == null;
    }

    public boolean isLate(LocalTime clockIn) {
        return !isUnrestricted() && clockIn.truncatedTo(ChronoUnit.MINUTES).isAfter(limit);
    }

    public String format() {
        return isUnrestricted() ? Employee.UNRESTRICTED_THRESHOLD : limit.format(DateTimeFormatter.ofPattern("HH:mm"));
    }
}
