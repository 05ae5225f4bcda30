package asciimap.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;

import asciimap.core.model.generate.GenerateRequest;

/**
 * Wire form of a generate request.
 *
 * <p>Instances start out holding the defaults and the payload is decoded over them, so absent
 * fields, including fields of the nested objects, keep their default values.
 */
public class GenerateRequestDto {

    @JsonProperty("width")
    public int width;

    @JsonProperty("supersample")
    public int supersample;

    @JsonProperty("char_aspect")
    public double charAspect;

    @JsonProperty("margin")
    public int margin;

    @JsonProperty("frame")
    public boolean frame;

    @JsonMerge
    @JsonProperty("marker")
    public MarkerDto marker = new MarkerDto();

    @JsonMerge
    @JsonProperty("color")
    public ColorDto color = new ColorDto();

    public static GenerateRequestDto defaults() {
        final var defaults = GenerateRequest.defaults();
        final var dto = new GenerateRequestDto();
        dto.width = defaults.width();
        dto.supersample = defaults.supersample();
        dto.charAspect = defaults.charAspect();
        dto.margin = defaults.margin();
        dto.frame = defaults.frame();

        final var marker = defaults.marker();
        dto.marker.enabled = marker.enabled();
        dto.marker.lon = marker.lon();
        dto.marker.lat = marker.lat();
        dto.marker.center = marker.center();
        dto.marker.horizontal = marker.horizontal();
        dto.marker.vertical = marker.vertical();
        dto.marker.armX = marker.armX();
        dto.marker.armY = marker.armY();

        final var color = defaults.color();
        dto.color.mode = color.mode();
        dto.color.mapColor = color.mapColor();
        dto.color.frameColor = color.frameColor();
        dto.color.markerColor = color.markerColor();
        return dto;
    }

    public GenerateRequest toModel() {
        return new GenerateRequest(
                width,
                supersample,
                charAspect,
                margin,
                frame,
                new GenerateRequest.MarkerRequest(
                        marker.enabled,
                        marker.lon,
                        marker.lat,
                        marker.center,
                        marker.horizontal,
                        marker.vertical,
                        marker.armX,
                        marker.armY),
                new GenerateRequest.ColorRequest(color.mode, color.mapColor, color.frameColor, color.markerColor));
    }

    public static class MarkerDto {

        @JsonProperty("enabled")
        public boolean enabled;

        @JsonProperty("lon")
        public double lon;

        @JsonProperty("lat")
        public double lat;

        @JsonProperty("center")
        public String center;

        @JsonProperty("horizontal")
        public String horizontal;

        @JsonProperty("vertical")
        public String vertical;

        @JsonProperty("arm_x")
        public int armX;

        @JsonProperty("arm_y")
        public int armY;
    }

    public static class ColorDto {

        @JsonProperty("mode")
        public String mode;

        @JsonProperty("map_color")
        public String mapColor;

        @JsonProperty("frame_color")
        public String frameColor;

        @JsonProperty("marker_color")
        public String markerColor;
    }
}
