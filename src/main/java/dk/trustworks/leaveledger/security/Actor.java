package dk.trustworks.leaveledger.security;

/**
 * The caller of a ledger operation. Services take it explicitly instead of reading
 * the request context, so jobs and tests can act on behalf of anyone.
 */
public record Actor(String uuid, Role role) {

    public static final String SYSTEM_UUID = "system";

    public static Actor system() {
        return new Actor(SYSTEM_UUID, Role.ADMIN);
    }

    public boolean isAdministrative() {
        return role != null && role.isAdministrative();
    }

    public boolean isEmployee() {
        return role == Role.EMPLOYEE;
    }
}
