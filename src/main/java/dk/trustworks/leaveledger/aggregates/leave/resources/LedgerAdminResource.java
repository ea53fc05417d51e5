package dk.trustworks.leaveledger.aggregates.leave.resources;

import dk.trustworks.leaveledger.aggregates.leave.dto.ReconciliationResult;
import dk.trustworks.leaveledger.aggregates.leave.jobs.ReconciliationJob;
import dk.trustworks.leaveledger.security.RequestActorHolder;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@JBossLog
@Tag(name = "admin")
@Path("/admin/ledger")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed({"HR", "ADMIN"})
@SecurityRequirement(name = "jwt")
public class LedgerAdminResource {

    @Inject
    ReconciliationJob reconciliationJob;

    @Inject
    RequestActorHolder requestActorHolder;

    @POST
    @Path("/reconcile")
    public ReconciliationResult reconcile() {
        log.infof("Reconciliation requested by %s", requestActorHolder.current().uuid());
        return reconciliationJob.reconcileAll();
    }
}
