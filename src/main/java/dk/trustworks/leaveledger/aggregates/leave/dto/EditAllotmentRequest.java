package dk.trustworks.leaveledger.aggregates.leave.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial update of an allotment; null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditAllotmentRequest {

    private String categoryUuid;

    @PositiveOrZero
    private BigDecimal days;

    @PositiveOrZero
    private Integer hours;

    @PositiveOrZero
    private Integer minutes;

    private Boolean carryForward;

    private String reason;

    public boolean hasAmount() {
        return days != null || hours != null || minutes != null;
    }
}
