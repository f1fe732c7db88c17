package com.piacp.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 message types exchanged with ACP clients.
 *
 * <p>
 * Request and response ids are kept as raw {@link JsonNode}s: clients may use
 * numbers or strings, and a response must echo the id back unchanged.
 */
public class JsonRpcMessage {

    public static final String VERSION = "2.0";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Request {
        private String jsonrpc;
        private JsonNode id;
        private String method;
        private Object params;

        public static Request create(JsonNode id, String method, Object params) {
            return Request.builder()
                    .jsonrpc(VERSION)
                    .id(id)
                    .method(method)
                    .params(params)
                    .build();
        }

        /** A request without an id is a notification and must not be answered. */
        @JsonIgnore
        public boolean isNotification() {
            return id == null || id.isMissingNode();
        }
    }

    /**
     * Response envelope. A successful response always carries {@code result}
     * (a JSON null when the handler returned nothing); a failed one carries
     * only {@code error}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Response {
        private String jsonrpc;
        private JsonNode id;
        private Object result;
        private RpcError error;

        public static Response success(JsonNode id, Object result) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .id(id != null ? id : NullNode.getInstance())
                    .result(result != null ? result : NullNode.getInstance())
                    .build();
        }

        public static Response failure(JsonNode id, RpcError error) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .id(id != null ? id : NullNode.getInstance())
                    .error(error)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Notification {
        private String jsonrpc;
        private String method;
        private Object params;

        public static Notification create(String method, Object params) {
            return Notification.builder()
                    .jsonrpc(VERSION)
                    .method(method)
                    .params(params)
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RpcError {
        private int code;
        private String message;
        private Object data;
    }
}
