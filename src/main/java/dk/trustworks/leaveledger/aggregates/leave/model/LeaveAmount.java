package dk.trustworks.leaveledger.aggregates.leave.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveUnit;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A quantity of leave in exactly one {@link LeaveUnit}.
 * <p>
 * Day amounts are kept at one decimal (HALF_UP). Hour amounts keep minutes in [0, 59]
 * and carry the overflow into hours. Instances are immutable; arithmetic returns new
 * amounts and refuses to mix units.
 * </p>
 */
@Getter
@Embeddable
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LeaveAmount implements Comparable<LeaveAmount> {

    public static final int DAY_SCALE = 1;

    @Enumerated(EnumType.STRING)
    @Column(name = "unit", length = 20)
    private LeaveUnit unit;

    @Column(name = "days", precision = 7, scale = DAY_SCALE)
    private BigDecimal days;

    @Column(name = "hours")
    private int hours;

    @Column(name = "minutes")
    private int minutes;

    private LeaveAmount(LeaveUnit unit, BigDecimal days, int hours, int minutes) {
        this.unit = unit;
        this.days = days;
        this.hours = hours;
        this.minutes = minutes;
    }

    public static LeaveAmount ofDays(BigDecimal days) {
        Objects.requireNonNull(days, "days");
        if (days.signum() < 0) throw new IllegalArgumentException("Leave days cannot be negative: " + days);
        return new LeaveAmount(LeaveUnit.DAYS, days.setScale(DAY_SCALE, RoundingMode.HALF_UP), 0, 0);
    }

    public static LeaveAmount ofDays(double days) {
        return ofDays(BigDecimal.valueOf(days));
    }

    public static LeaveAmount ofHoursMinutes(int hours, int minutes) {
        if (hours < 0 || minutes < 0) {
            throw new IllegalArgumentException("Leave hours and minutes cannot be negative: " + hours + "h " + minutes + "m");
        }
        return ofMinutes((long) hours * 60 + minutes);
    }

    public static LeaveAmount ofMinutes(long totalMinutes) {
        if (totalMinutes < 0) throw new IllegalArgumentException("Leave minutes cannot be negative: " + totalMinutes);
        return new LeaveAmount(LeaveUnit.HOURS_MINUTES, null, Math.toIntExact(totalMinutes / 60), (int) (totalMinutes % 60));
    }

    public static LeaveAmount zero(LeaveUnit unit) {
        return unit == LeaveUnit.DAYS ? ofDays(BigDecimal.ZERO) : ofMinutes(0);
    }

    @JsonIgnore
    public long getTotalMinutes() {
        requireUnit(LeaveUnit.HOURS_MINUTES);
        return (long) hours * 60 + minutes;
    }

    /**
     * The amount in its own unit: days, or total minutes.
     */
    @JsonIgnore
    public BigDecimal getQuantity() {
        return unit == LeaveUnit.DAYS ? days : BigDecimal.valueOf(getTotalMinutes());
    }

    public LeaveAmount plus(LeaveAmount other) {
        requireSameUnit(other);
        return unit == LeaveUnit.DAYS
                ? ofDays(days.add(other.days))
                : ofMinutes(getTotalMinutes() + other.getTotalMinutes());
    }

    /**
     * Subtracts {@code other}, stopping at zero.
     */
    public LeaveAmount minusClamped(LeaveAmount other) {
        requireSameUnit(other);
        if (compareTo(other) <= 0) return zero(unit);
        return unit == LeaveUnit.DAYS
                ? ofDays(days.subtract(other.days))
                : ofMinutes(getTotalMinutes() - other.getTotalMinutes());
    }

    @JsonIgnore
    public boolean isZero() {
        return getQuantity().signum() == 0;
    }

    public boolean exceeds(LeaveAmount other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(LeaveAmount other) {
        requireSameUnit(other);
        return getQuantity().compareTo(other.getQuantity());
    }

    @JsonProperty("display")
    public String display() {
        if (unit == LeaveUnit.DAYS) {
            return days.stripTrailingZeros().toPlainString() + (days.compareTo(BigDecimal.ONE) == 0 ? " day" : " days");
        }
        return hours + "h " + minutes + "m";
    }

    private void requireSameUnit(LeaveAmount other) {
        Objects.requireNonNull(other, "other");
        if (other.unit != unit) {
            throw new IllegalArgumentException("Cannot combine " + unit + " with " + other.unit);
        }
    }

    private void requireUnit(LeaveUnit expected) {
        if (unit != expected) throw new IllegalStateException("Amount is measured in " + unit + ", not " + expected);
    }

    @Override
    public String toString() {
        return display();
    }
}
