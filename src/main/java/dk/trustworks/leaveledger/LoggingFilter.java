package dk.trustworks.leaveledger;

import dk.trustworks.leaveledger.security.ActorRequestFilter;
import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.util.Set;

/**
 * Logs every request that can change the ledger.
 */
@JBossLog
@Provider
public class LoggingFilter implements ContainerRequestFilter {

    private static final Set<String> MUTATING_METHODS = Set.of(HttpMethod.POST, HttpMethod.PUT, HttpMethod.PATCH, HttpMethod.DELETE);

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        if (!MUTATING_METHODS.contains(requestContext.getMethod())) {
            return;
        }
        String requestedBy = requestContext.getHeaders().getFirst(ActorRequestFilter.REQUESTED_BY_HEADER);
        log.infof("%s %s (requested by %s)", requestContext.getMethod(),
                requestContext.getUriInfo().getPath(), requestedBy == null ? "token subject" : requestedBy);
        requestContext.getUriInfo().getQueryParameters().forEach((k, v) -> log.debugf("  %s: %s", k, v));
    }
}
