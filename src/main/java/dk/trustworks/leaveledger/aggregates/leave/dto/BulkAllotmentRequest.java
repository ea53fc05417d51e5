package dk.trustworks.leaveledger.aggregates.leave.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkAllotmentRequest {

    @Valid
    @NotEmpty
    private List<AllotLeaveRequest> allocations = new ArrayList<>();

    /** Allotments removed before the batch is applied, typically the ones being re-granted. */
    private List<String> replacedAllotmentUuids = new ArrayList<>();
}
