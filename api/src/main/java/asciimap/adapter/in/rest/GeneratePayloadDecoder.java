package asciimap.adapter.in.rest;

import java.io.IOException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import asciimap.adapter.in.dto.GenerateRequestDto;
import asciimap.adapter.in.problem.ApiProblem;
import asciimap.config.ApiConfig;
import asciimap.core.model.generate.GenerateRequest;

/**
 * Decodes a raw generate payload over the request defaults.
 *
 * <p>Exactly one JSON value is accepted. Oversized bodies are rejected before any parsing.
 */
@ApplicationScoped
public class GeneratePayloadDecoder {

    private final ObjectMapper objectMapper;
    private final long maxBodyBytes;

    @Inject
    public GeneratePayloadDecoder(ObjectMapper objectMapper, ApiConfig config) {
        this(objectMapper, config.maxBodyBytes());
    }

    GeneratePayloadDecoder(ObjectMapper objectMapper, long maxBodyBytes) {
        this.objectMapper = objectMapper;
        this.maxBodyBytes = maxBodyBytes;
    }

    /**
     * Decode the body.
     *
     * @throws ApiProblem with kind {@code MALFORMED_PAYLOAD} if the body is too large, empty,
     *     structurally invalid, or followed by trailing content
     */
    public GenerateRequest decode(byte[] body) {
        final var payload = body == null ? new byte[0] : body;
        if (payload.length > maxBodyBytes) {
            throw ApiProblem.malformedPayload("request body too large");
        }

        final var dto = GenerateRequestDto.defaults();
        try (var parser = objectMapper.getFactory().createParser(payload)) {
            if (parser.nextToken() == null) {
                throw ApiProblem.malformedPayload("request body is empty");
            }
            objectMapper.readerForUpdating(dto).readValue(parser);
            if (hasTrailingData(parser)) {
                throw ApiProblem.malformedPayload("trailing data");
            }
        } catch (JsonProcessingException e) {
            throw ApiProblem.malformedPayload(e.getOriginalMessage());
        } catch (IOException e) {
            throw ApiProblem.malformedPayload(e.getMessage());
        }
        return dto.toModel();
    }

    private static boolean hasTrailingData(JsonParser parser) throws IOException {
        try {
            return parser.nextToken() != null;
        } catch (JsonParseException e) {
            return true;
        }
    }
}
