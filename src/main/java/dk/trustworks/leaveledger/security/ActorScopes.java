package dk.trustworks.leaveledger.security;

import dk.trustworks.leaveledger.exceptions.UnauthorizedActionException;

public final class ActorScopes {

    private ActorScopes() {
    }

    /**
     * The employee a read is about: the actor unless HR or an admin asks for someone else.
     */
    public static String employeeInScope(Actor actor, String requestedEmployeeUuid) {
        if (requestedEmployeeUuid == null || requestedEmployeeUuid.isBlank() || requestedEmployeeUuid.equals(actor.uuid())) {
            return actor.uuid();
        }
        if (!actor.isAdministrative()) {
            throw new UnauthorizedActionException("You can only view your own leave and attendance");
        }
        return requestedEmployeeUuid;
    }
}
