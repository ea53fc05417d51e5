package dk.trustworks.leaveledger.security;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.jwt.JsonWebToken;

import java.io.IOException;
import java.util.Set;

/**
 * Resolves the {@link Actor} of the current request.
 * <p>
 * The uuid is the JWT subject and the role is the highest of the JWT groups ADMIN, HR and
 * EMPLOYEE. Requests without a subject or a recognised group carry no actor and are refused
 * by the services that need one. The {@code X-Requested-By} header only names the audit
 * user written to the audit columns; it never decides who is acting.
 * </p>
 */
@JBossLog
@Provider
public class ActorRequestFilter implements ContainerRequestFilter {

    public static final String REQUESTED_BY_HEADER = "X-Requested-By";

    @Inject
    JsonWebToken jwt;

    @Inject
    RequestActorHolder requestActorHolder;

    @Override
    public void filter(ContainerRequestContext context) throws IOException {
        String subject = jwt.getSubject();
        Role role = resolveRole(jwt.getGroups());
        String requestedBy = context.getHeaders().getFirst(REQUESTED_BY_HEADER);
        String auditUser = (requestedBy == null || requestedBy.isBlank()) ? subject : requestedBy;

        requestActorHolder.setUuid(subject);
        requestActorHolder.setRole(role);
        requestActorHolder.setAuditUsername(auditUser);
        log.debugf("Request actor set to %s (%s), audit user %s", subject, role, auditUser);
    }

    static Role resolveRole(Set<String> groups) {
        if (groups == null || groups.isEmpty()) return null;
        if (groups.contains(Role.ADMIN.name())) return Role.ADMIN;
        if (groups.contains(Role.HR.name())) return Role.HR;
        if (groups.contains(Role.EMPLOYEE.name())) return Role.EMPLOYEE;
        return null;
    }
}
