package com.piacp.gateway.pi;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Image attachment in pi's prompt format: base64 bytes without a data-url
 * prefix.
 */
public record PiImage(
        @JsonProperty("type") String type,
        @JsonProperty("mimeType") String mimeType,
        @JsonProperty("data") String data) {

    public static PiImage of(String mimeType, String data) {
        return new PiImage("image", mimeType, data);
    }
}
