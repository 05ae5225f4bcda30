package asciimap.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.NotAllowedException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Global exception mappers for converting exceptions to {@code {"error": "..."}} responses.
 *
 * <p>These mappers keep every failure in the same shape, including the routing errors JAX-RS
 * raises before a resource method runs.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapApiProblem(ApiProblem problem) {
        LOG.debugv("Request rejected ({0}): {1}", problem.kind(), problem.getMessage());
        return problem.toResponse();
    }

    @ServerExceptionMapper
    public Response mapNotAllowedException(NotAllowedException e) {
        return ApiProblem.methodNotAllowed().toResponse();
    }

    @ServerExceptionMapper
    public Response mapNotFoundException(NotFoundException e) {
        return ApiProblem.notFound().toResponse();
    }
}
