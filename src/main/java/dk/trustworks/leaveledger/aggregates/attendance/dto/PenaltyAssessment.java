package dk.trustworks.leaveledger.aggregates.attendance.dto;

/**
 * Result of assessing one clock-in.
 */
public record PenaltyAssessment(Outcome outcome, String message, int lateArrivalCount, int graceCount,
                                String penaltyUuid) {

    public enum Outcome {
        NO_PENALTY,
        ALREADY_PENALIZED,
        PENALTY_CREATED
    }

    public static PenaltyAssessment noPenalty(String message) {
        return new PenaltyAssessment(Outcome.NO_PENALTY, message, 0, 0, null);
    }

    public static PenaltyAssessment noPenalty(String message, int lateArrivalCount, int graceCount) {
        return new PenaltyAssessment(Outcome.NO_PENALTY, message, lateArrivalCount, graceCount, null);
    }

    public static PenaltyAssessment alreadyPenalized(int lateArrivalCount, int graceCount) {
        return new PenaltyAssessment(Outcome.ALREADY_PENALIZED, "Penalty already applied for today",
                lateArrivalCount, graceCount, null);
    }

    public static PenaltyAssessment created(String penaltyUuid, int lateArrivalCount, int graceCount) {
        return new PenaltyAssessment(Outcome.PENALTY_CREATED, "Penalty created", lateArrivalCount, graceCount, penaltyUuid);
    }

    public boolean isPenaltyCreated() {
        return outcome == Outcome.PENALTY_CREATED;
    }
}
