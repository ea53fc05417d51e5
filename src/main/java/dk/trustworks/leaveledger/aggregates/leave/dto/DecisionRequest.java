package dk.trustworks.leaveledger.aggregates.leave.dto;

import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRequest {

    @NotNull
    private LeaveStatus status;

    private String rejectionReason;
}
