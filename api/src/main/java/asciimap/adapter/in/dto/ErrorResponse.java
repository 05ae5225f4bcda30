package asciimap.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every error response.
 */
public record ErrorResponse(@JsonProperty("error") String error) {}
