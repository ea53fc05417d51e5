package dk.trustworks.leaveledger.aggregates.leave.dto;

public record ReconciliationResult(int processed, int changed, int failed) {
}
