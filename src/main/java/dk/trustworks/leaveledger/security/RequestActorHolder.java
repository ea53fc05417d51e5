package dk.trustworks.leaveledger.security;

import dk.trustworks.leaveledger.exceptions.UnauthorizedActionException;
import jakarta.enterprise.context.RequestScoped;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@RequestScoped
public class RequestActorHolder {

    private String uuid;

    private Role role;

    private String auditUsername;

    public Actor current() {
        if (uuid == null || uuid.isBlank() || role == null) {
            throw new UnauthorizedActionException("No authenticated actor on this request");
        }
        return new Actor(uuid, role);
    }
}
