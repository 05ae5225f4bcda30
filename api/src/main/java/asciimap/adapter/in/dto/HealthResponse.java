package asciimap.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(@JsonProperty("status") String status) {

    public static HealthResponse ok() {
        return new HealthResponse("ok");
    }
}
