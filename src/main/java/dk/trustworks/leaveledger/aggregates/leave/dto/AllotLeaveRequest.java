package dk.trustworks.leaveledger.aggregates.leave.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Grants a category to an employee. Day categories read {@code days}; hour categories read
 * {@code hours} and {@code minutes}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllotLeaveRequest {

    @NotBlank
    private String employeeUuid;

    @NotBlank
    private String categoryUuid;

    @PositiveOrZero
    private BigDecimal days;

    @PositiveOrZero
    private Integer hours;

    @PositiveOrZero
    private Integer minutes;

    private boolean carryForward;

    private String reason;
}
