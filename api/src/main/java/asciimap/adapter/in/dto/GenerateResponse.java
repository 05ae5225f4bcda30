package asciimap.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import asciimap.core.model.generate.GenerateMeta;
import asciimap.core.model.generate.GenerateResult;

/**
 * Response body for a successful generate request.
 */
public record GenerateResponse(
        @JsonProperty("plain") String plain,
        @JsonProperty("ansi") String ansi,
        @JsonProperty("meta") MetaDto meta) {

    public static GenerateResponse from(GenerateResult result) {
        return new GenerateResponse(result.plain(), result.ansi(), MetaDto.from(result.meta()));
    }

    public record MetaDto(
            @JsonProperty("width") int width,
            @JsonProperty("height") int height,
            @JsonProperty("supersample") int supersample,
            @JsonProperty("char_aspect") double charAspect,
            @JsonProperty("duration_ms") long durationMs,
            @JsonProperty("bytes") int bytes) {

        public static MetaDto from(GenerateMeta meta) {
            return new MetaDto(
                    meta.width(),
                    meta.height(),
                    meta.supersample(),
                    meta.charAspect(),
                    meta.durationMs(),
                    meta.bytes());
        }
    }
}
