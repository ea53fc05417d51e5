package dk.trustworks.leaveledger.aggregates.leave.dto;

import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;

import java.util.List;

public record BulkAllotmentResult(List<Allotment> created, List<AllotmentError> errors, int replaced) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
