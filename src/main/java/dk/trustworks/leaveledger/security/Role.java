package dk.trustworks.leaveledger.security;

public enum Role {
    EMPLOYEE,
    HR,
    ADMIN;

    public boolean isAdministrative() {
        return this == HR || this == ADMIN;
    }
}
