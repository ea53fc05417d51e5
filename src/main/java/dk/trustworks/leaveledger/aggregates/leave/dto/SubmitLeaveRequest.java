package dk.trustworks.leaveledger.aggregates.leave.dto;

import dk.trustworks.leaveledger.aggregates.leave.model.enums.HalfDayType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A new leave request. The amount is derived: a half day, a short-leave time range,
 * or the inclusive number of days between the dates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitLeaveRequest {

    @NotBlank
    private String categoryUuid;

    @NotNull
    private LocalDate startDate;

    @NotNull
    private LocalDate endDate;

    private String reason;

    private HalfDayType halfDayType;

    private LocalTime shortLeaveFrom;

    private LocalTime shortLeaveTo;

    private String medicalReportUrl;

    public boolean hasShortLeaveRange() {
        return shortLeaveFrom != null && shortLeaveTo != null;
    }
}
