package dk.trustworks.leaveledger.aggregates.leave.resources;

import dk.trustworks.leaveledger.aggregates.leave.dto.CreateCategoryRequest;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.services.LeaveCategoryRegistry;
import dk.trustworks.leaveledger.security.ActorScopes;
import dk.trustworks.leaveledger.security.RequestActorHolder;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;

@Tag(name = "leave")
@Path("/leave-categories")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed({"EMPLOYEE", "HR", "ADMIN"})
@SecurityRequirement(name = "jwt")
public class LeaveCategoryResource {

    @Inject
    LeaveCategoryRegistry categoryRegistry;

    @Inject
    RequestActorHolder requestActorHolder;

    @GET
    public List<LeaveCategory> listActive() {
        return categoryRegistry.listActive();
    }

    @GET
    @Path("/allotted")
    public List<LeaveCategory> allotted(@QueryParam("employeeUuid") String employeeUuid) {
        return categoryRegistry.allottedCategories(ActorScopes.employeeInScope(requestActorHolder.current(), employeeUuid));
    }

    @POST
    @RolesAllowed({"HR", "ADMIN"})
    public LeaveCategory create(@Valid CreateCategoryRequest request) {
        return categoryRegistry.create(request.getName(), request.getDescription(), request.getUnit());
    }

    @PUT
    @Path("/{uuid}")
    @RolesAllowed({"HR", "ADMIN"})
    public LeaveCategory update(@PathParam("uuid") String uuid, CreateCategoryRequest request) {
        return categoryRegistry.update(uuid, request.getName(), request.getDescription(), request.getUnit());
    }

    @POST
    @Path("/{uuid}/deactivate")
    @RolesAllowed({"HR", "ADMIN"})
    public void deactivate(@PathParam("uuid") String uuid) {
        categoryRegistry.deactivate(uuid);
    }

    @POST
    @Path("/{uuid}/penalty-category")
    @RolesAllowed({"ADMIN"})
    public LeaveCategory markPenaltyCategory(@PathParam("uuid") String uuid) {
        return categoryRegistry.markPenaltyCategory(uuid);
    }

    @DELETE
    @Path("/{uuid}")
    @RolesAllowed({"HR", "ADMIN"})
    public void delete(@PathParam("uuid") String uuid) {
        categoryRegistry.delete(uuid);
    }
}
