package asciimap.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import asciimap.adapter.in.dto.HealthResponse;
import asciimap.adapter.in.problem.ApiProblem;

/**
 * Liveness endpoint for load balancers. Only GET is served.
 */
@Path("/api/healthz")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    @GET
    public HealthResponse health() {
        return HealthResponse.ok();
    }

    @HEAD
    public HealthResponse head() {
        throw ApiProblem.methodNotAllowed();
    }

    @OPTIONS
    public HealthResponse options() {
        throw ApiProblem.methodNotAllowed();
    }
}
