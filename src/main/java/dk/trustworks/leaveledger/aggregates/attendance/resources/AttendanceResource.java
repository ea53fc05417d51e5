package dk.trustworks.leaveledger.aggregates.attendance.resources;

import dk.trustworks.leaveledger.aggregates.attendance.dto.AssessClockInRequest;
import dk.trustworks.leaveledger.aggregates.attendance.dto.AttendanceStats;
import dk.trustworks.leaveledger.aggregates.attendance.dto.ClockInResponse;
import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyAssessment;
import dk.trustworks.leaveledger.aggregates.attendance.dto.PenaltyDetails;
import dk.trustworks.leaveledger.aggregates.attendance.model.AttendanceRecord;
import dk.trustworks.leaveledger.aggregates.attendance.services.AttendancePenaltyAssessor;
import dk.trustworks.leaveledger.aggregates.attendance.services.AttendanceService;
import dk.trustworks.leaveledger.aggregates.attendance.services.PenaltyQueryService;
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

@Tag(name = "attendance")
@Path("/attendance")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed({"EMPLOYEE", "HR", "ADMIN"})
@SecurityRequirement(name = "jwt")
public class AttendanceResource {

    @Inject
    AttendanceService attendanceService;

    @Inject
    AttendancePenaltyAssessor penaltyAssessor;

    @Inject
    PenaltyQueryService penaltyQueryService;

    @Inject
    RequestActorHolder requestActorHolder;

    @POST
    @Path("/clock-in")
    public ClockInResponse clockIn() {
        return attendanceService.clockIn(requestActorHolder.current().uuid());
    }

    @POST
    @Path("/clock-out")
    public AttendanceRecord clockOut(@QueryParam("auto") @DefaultValue("false") boolean autoClockOut) {
        return attendanceService.clockOut(requestActorHolder.current().uuid(), autoClockOut);
    }

    @GET
    @Path("/penalty")
    public Response penalty(@QueryParam("employeeUuid") String employeeUuid, @QueryParam("date") LocalDate date) {
        String employee = ActorScopes.employeeInScope(requestActorHolder.current(), employeeUuid);
        return penaltyQueryService.penaltyFor(employee, date == null ? LocalDate.now() : date)
                .map(details -> Response.ok(details).build())
                .orElseGet(() -> Response.noContent().build());
    }

    @POST
    @Path("/penalty/assess")
    @RolesAllowed({"HR", "ADMIN"})
    public PenaltyAssessment assess(@Valid AssessClockInRequest request) {
        return penaltyAssessor.assess(request.getEmployeeUuid(), request.getClockIn());
    }

    @GET
    @Path("/stats")
    public AttendanceStats stats(@QueryParam("employeeUuid") String employeeUuid) {
        return attendanceService.stats(ActorScopes.employeeInScope(requestActorHolder.current(), employeeUuid));
    }
}
