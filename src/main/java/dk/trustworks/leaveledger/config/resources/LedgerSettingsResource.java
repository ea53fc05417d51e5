package dk.trustworks.leaveledger.config.resources;

import dk.trustworks.leaveledger.config.model.LedgerSetting;
import dk.trustworks.leaveledger.config.services.LedgerSettingsService;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Tag(name = "admin")
@Path("/admin/settings")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed({"ADMIN"})
@SecurityRequirement(name = "jwt")
public class LedgerSettingsResource {

    @Inject
    LedgerSettingsService settingsService;

    @GET
    @Path("/{key}")
    @RolesAllowed({"HR", "ADMIN"})
    public LedgerSetting get(@PathParam("key") String key) {
        return settingsService.get(key);
    }

    @PUT
    @Path("/{key}")
    @Consumes(MediaType.TEXT_PLAIN)
    public LedgerSetting update(@PathParam("key") String key, String value) {
        return settingsService.saveOrUpdate(key, value);
    }
}
