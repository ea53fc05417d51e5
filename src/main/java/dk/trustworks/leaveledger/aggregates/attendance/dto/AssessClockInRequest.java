package dk.trustworks.leaveledger.aggregates.attendance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssessClockInRequest {

    @NotBlank
    private String employeeUuid;

    @NotNull
    private LocalDateTime clockIn;
}
