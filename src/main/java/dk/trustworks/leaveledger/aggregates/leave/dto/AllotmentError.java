package dk.trustworks.leaveledger.aggregates.leave.dto;

public record AllotmentError(String employeeUuid, String categoryUuid, String code, String message) {
}
