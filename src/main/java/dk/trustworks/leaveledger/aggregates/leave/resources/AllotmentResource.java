package dk.trustworks.leaveledger.aggregates.leave.resources;

import dk.trustworks.leaveledger.aggregates.leave.dto.AllotLeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.dto.BalanceView;
import dk.trustworks.leaveledger.aggregates.leave.dto.BulkAllotmentRequest;
import dk.trustworks.leaveledger.aggregates.leave.dto.BulkAllotmentResult;
import dk.trustworks.leaveledger.aggregates.leave.dto.EditAllotmentRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.services.AllotmentService;
import dk.trustworks.leaveledger.aggregates.leave.services.BalanceLedger;
import dk.trustworks.leaveledger.security.Actor;
import dk.trustworks.leaveledger.security.ActorScopes;
import dk.trustworks.leaveledger.security.RequestActorHolder;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;

@JBossLog
@Tag(name = "leave")
@Path("/allotments")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed({"HR", "ADMIN"})
@SecurityRequirement(name = "jwt")
public class AllotmentResource {

    @Inject
    AllotmentService allotmentService;

    @Inject
    BalanceLedger balanceLedger;

    @Inject
    RequestActorHolder requestActorHolder;

    @GET
    @RolesAllowed({"EMPLOYEE", "HR", "ADMIN"})
    public List<Allotment> list(@QueryParam("employeeUuid") String employeeUuid) {
        Actor actor = requestActorHolder.current();
        if ((employeeUuid == null || employeeUuid.isBlank()) && actor.isAdministrative()) {
            return allotmentService.listAll(actor);
        }
        return allotmentService.listForEmployee(ActorScopes.employeeInScope(actor, employeeUuid));
    }

    @GET
    @Path("/balance")
    @RolesAllowed({"EMPLOYEE", "HR", "ADMIN"})
    public BalanceView balance(@QueryParam("employeeUuid") String employeeUuid,
                               @QueryParam("categoryUuid") String categoryUuid) {
        if (categoryUuid == null || categoryUuid.isBlank()) throw new BadRequestException("categoryUuid is required");
        return balanceLedger.balanceOf(ActorScopes.employeeInScope(requestActorHolder.current(), employeeUuid), categoryUuid);
    }

    @POST
    public Response allot(@Valid AllotLeaveRequest request) {
        Allotment allotment = allotmentService.allot(requestActorHolder.current(), request);
        return Response.status(Response.Status.CREATED).entity(allotment).build();
    }

    @POST
    @Path("/bulk")
    public BulkAllotmentResult bulkAllot(@Valid BulkAllotmentRequest request) {
        BulkAllotmentResult result = allotmentService.bulkAllot(requestActorHolder.current(), request);
        if (result.hasErrors()) {
            log.warnf("Bulk allotment finished with %d rejected rows", result.errors().size());
        }
        return result;
    }

    @PATCH
    @Path("/{uuid}")
    public Allotment edit(@PathParam("uuid") String uuid, @Valid EditAllotmentRequest request) {
        return allotmentService.editAllotment(requestActorHolder.current(), uuid, request);
    }

    @DELETE
    @Path("/{uuid}")
    public void delete(@PathParam("uuid") String uuid) {
        allotmentService.delete(requestActorHolder.current(), uuid);
    }
}
