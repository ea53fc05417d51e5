package dk.trustworks.leaveledger.aggregates.leave.resources;

import dk.trustworks.leaveledger.aggregates.leave.dto.DecisionRequest;
import dk.trustworks.leaveledger.aggregates.leave.dto.LeaveHistoryEntry;
import dk.trustworks.leaveledger.aggregates.leave.dto.SubmitLeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveRequest;
import dk.trustworks.leaveledger.aggregates.leave.services.LeaveHistoryService;
import dk.trustworks.leaveledger.aggregates.leave.services.LeaveRequestWorkflow;
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
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@Tag(name = "leave")
@Path("/leave-requests")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed({"EMPLOYEE", "HR", "ADMIN"})
@SecurityRequirement(name = "jwt")
public class LeaveRequestResource {

    @Inject
    LeaveRequestWorkflow workflow;

    @Inject
    LeaveHistoryService historyService;

    @Inject
    RequestActorHolder requestActorHolder;

    @GET
    public List<LeaveRequest> list(@QueryParam("all") @DefaultValue("false") boolean all) {
        Actor actor = requestActorHolder.current();
        return all ? workflow.listAll(actor) : workflow.listForEmployee(actor.uuid());
    }

    @GET
    @Path("/pending")
    @RolesAllowed({"HR", "ADMIN"})
    public List<LeaveRequest> pending() {
        return workflow.pendingForApproval(requestActorHolder.current());
    }

    @POST
    public Response submit(@Valid SubmitLeaveRequest request) {
        LeaveRequest created = workflow.submit(requestActorHolder.current(), request);
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    @PUT
    @Path("/{uuid}/decision")
    @RolesAllowed({"HR", "ADMIN"})
    public LeaveRequest decide(@PathParam("uuid") String uuid, @Valid DecisionRequest decision) {
        return workflow.decide(requestActorHolder.current(), uuid, decision.getStatus(), decision.getRejectionReason());
    }

    @DELETE
    @Path("/{uuid}")
    public void delete(@PathParam("uuid") String uuid) {
        workflow.delete(requestActorHolder.current(), uuid);
    }

    @GET
    @Path("/history")
    public List<LeaveHistoryEntry> history(@QueryParam("employeeUuid") String employeeUuid,
                                           @QueryParam("categoryUuid") String categoryUuid) {
        if (categoryUuid == null || categoryUuid.isBlank()) throw new BadRequestException("categoryUuid is required");
        return historyService.history(ActorScopes.employeeInScope(requestActorHolder.current(), employeeUuid), categoryUuid);
    }

    @GET
    @Path("/on-leave")
    @RolesAllowed({"HR", "ADMIN"})
    public Set<String> onLeave(@QueryParam("date") LocalDate date) {
        return workflow.employeesOnLeave(date == null ? LocalDate.now() : date);
    }
}
