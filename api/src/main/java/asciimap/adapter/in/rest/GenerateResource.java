package asciimap.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import asciimap.adapter.in.dto.GenerateResponse;
import asciimap.adapter.in.problem.ApiProblem;
import asciimap.core.model.common.ValidationResult;
import asciimap.core.model.generate.GenerateOutcome;
import asciimap.core.port.in.GenerateUseCase;
import asciimap.core.service.generate.GenerateRequestValidator;

/**
 * REST resource for map generation.
 *
 * <p>This adapter handles HTTP-specific concerns (body decoding, status codes) and
 * delegates validation to {@link GenerateRequestValidator} and rendering to
 * {@link GenerateUseCase}. Requests are rate limited per client before the body is decoded.
 */
@Path("/api/generate")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class GenerateResource {

    private static final Logger LOG = Logger.getLogger(GenerateResource.class);

    private final GeneratePayloadDecoder decoder;
    private final GenerateRequestValidator validator;
    private final GenerateUseCase generateUseCase;

    @Inject
    public GenerateResource(
            GeneratePayloadDecoder decoder, GenerateRequestValidator validator, GenerateUseCase generateUseCase) {
        this.decoder = decoder;
        this.validator = validator;
        this.generateUseCase = generateUseCase;
    }

    @POST
    @RateLimited
    @Consumes(MediaType.WILDCARD)
    public Uni<Response> generate(byte[] body) {
        final var request = decoder.decode(body);

        final var validation = validator.validate(request);
        if (validation instanceof ValidationResult.Invalid invalid) {
            LOG.debugv("Generate request rejected: {0}", invalid.reason());
            throw ApiProblem.validationFailed(invalid.reason());
        }
        final var config = ((ValidationResult.Valid) validation).config();

        return generateUseCase.generate(config).map(GenerateResource::toResponse);
    }

    @OPTIONS
    public Response options() {
        throw ApiProblem.methodNotAllowed();
    }

    private static Response toResponse(GenerateOutcome outcome) {
        if (outcome instanceof GenerateOutcome.RenderFailed failed) {
            throw ApiProblem.renderFailed(failed.describe());
        }
        final var generated = (GenerateOutcome.Generated) outcome;
        return Response.ok(GenerateResponse.from(generated.result())).build();
    }
}
