package tech.lapse.platform.gateway;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Publishes the gateway's procedure catalog as an OpenAPI document.
 */
@Path("/rest/openapi")
@Tag(name = "REST Gateway")
@Produces(MediaType.APPLICATION_JSON)
public class RestOpenApiResource {

    @Inject
    RestOpenApiDocument document;

    @GET
    @Operation(summary = "OpenAPI document of the REST procedures")
    public Response openApi() {
        return Response.ok(document.build()).build();
    }
}
