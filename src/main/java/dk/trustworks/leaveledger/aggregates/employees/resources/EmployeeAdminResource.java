package dk.trustworks.leaveledger.aggregates.employees.resources;

import dk.trustworks.leaveledger.aggregates.employees.dto.EmployeeIdAssignment;
import dk.trustworks.leaveledger.aggregates.employees.services.EmployeeIdAssigner;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Tag(name = "admin")
@Path("/admin/employees")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed({"ADMIN"})
@SecurityRequirement(name = "jwt")
public class EmployeeAdminResource {

    @Inject
    EmployeeIdAssigner employeeIdAssigner;

    @POST
    @Path("/ids")
    public EmployeeIdAssignment assignIds(@QueryParam("force") @DefaultValue("false") boolean force) {
        return employeeIdAssigner.ensureEmployeeIds(force);
    }
}
