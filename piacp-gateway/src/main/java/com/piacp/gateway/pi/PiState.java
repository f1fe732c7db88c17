package com.piacp.gateway.pi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot returned by pi's {@code get_state} command. Only the fields the
 * bridge reads are mapped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PiState {
    private String sessionId;
    private String sessionFile;
    private String sessionName;
    private String steeringMode; // "all" | "one-at-a-time"
    private String followUpMode;
    private String thinkingLevel;
    @JsonProperty("isStreaming")
    private Boolean streaming;
    /** {@code {provider, id, name, ...}} of the active model, when any. */
    private JsonNode model;

    public String modelId() {
        if (model == null || model.isNull()) {
            return null;
        }
        String id = model.path("id").asText(null);
        String provider = model.path("provider").asText(null);
        if (id == null) {
            return null;
        }
        return provider != null ? provider + "/" + id : id;
    }
}
