package dk.trustworks.leaveledger.aggregates.leave.dto;

import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveUnit;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateCategoryRequest {

    @NotBlank
    private String name;

    private String description;

    @NotNull
    private LeaveUnit unit;
}
