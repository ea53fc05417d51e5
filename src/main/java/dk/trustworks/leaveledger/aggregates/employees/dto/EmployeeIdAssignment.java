package dk.trustworks.leaveledger.aggregates.employees.dto;

/**
 * @param ran false when the call was throttled
 */
public record EmployeeIdAssignment(boolean ran, int assigned, int cleared) {

    public static EmployeeIdAssignment skipped() {
        return new EmployeeIdAssignment(false, 0, 0);
    }
}
