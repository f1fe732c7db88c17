package com.piacp.common.error;

import com.piacp.common.model.JsonRpcMessage.RpcError;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Unchecked exception carrying one {@link AcpErrorCode} plus a message and
 * optional structured data. Every failure raised while handling an ACP call is
 * converted to one of these before it is serialized as a JSON-RPC error.
 *
 * <p>
 * Identity checks compare {@link #getCode()} rather than the Java type.
 */
@Getter
public class AcpException extends RuntimeException {

    /** Number of stack frames kept in the diagnostic hint of internal errors. */
    private static final int STACK_HINT_FRAMES = 8;

    private final AcpErrorCode code;
    private final Map<String, Object> data;

    public AcpException(AcpErrorCode code, String message, Map<String, Object> data) {
        super(message != null ? message : code.defaultMessage());
        this.code = code;
        this.data = data;
    }

    public AcpException(AcpErrorCode code, String message, Map<String, Object> data, Throwable cause) {
        super(message != null ? message : code.defaultMessage(), cause);
        this.code = code;
        this.data = data;
    }

    public AcpException(AcpErrorCode code, String message) {
        this(code, message, null);
    }

    public AcpException(AcpErrorCode code) {
        this(code, null, null);
    }

    public int getNumericCode() {
        return code.code();
    }

    public boolean is(AcpErrorCode other) {
        return code == other;
    }

    /**
     * JSON-RPC error object: {@code {code, message, data?}}.
     */
    public RpcError toRpcError() {
        return new RpcError(code.code(), getMessage(), data);
    }

    /**
     * Re-create an exception from a JSON-RPC error object.
     */
    @SuppressWarnings("unchecked")
    public static AcpException fromRpcError(RpcError error) {
        Map<String, Object> data = error.getData() instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
        return new AcpException(AcpErrorCode.fromCode(error.getCode()), error.getMessage(), data);
    }

    /**
     * Convert any failure to an {@link AcpException}. Async wrappers are
     * unwrapped; foreign exceptions become {@link AcpErrorCode#INTERNAL_ERROR}.
     */
    public static AcpException from(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof AcpException acp) {
            return acp;
        }
        return internalFromCause(cause);
    }

    // ── Standard JSON-RPC kinds ─────────────────────────────────

    public static AcpException parseError(String detail) {
        return new AcpException(AcpErrorCode.PARSE_ERROR,
                detail != null ? "Parse error: " + detail : null, null);
    }

    public static AcpException invalidRequest(String message) {
        return new AcpException(AcpErrorCode.INVALID_REQUEST, message);
    }

    public static AcpException methodNotFound(String method) {
        return new AcpException(AcpErrorCode.METHOD_NOT_FOUND,
                "Method not found: " + method, mapOf("method", method));
    }

    public static AcpException invalidParams(String message) {
        return new AcpException(AcpErrorCode.INVALID_PARAMS, message);
    }

    public static AcpException invalidParamsMissing(String param) {
        return new AcpException(AcpErrorCode.INVALID_PARAMS,
                "Missing required parameter: " + param,
                mapOf("param", param, "reason", "missing"));
    }

    public static AcpException invalidParamsFor(String param, String reason, Object received) {
        return new AcpException(AcpErrorCode.INVALID_PARAMS,
                "Invalid parameter '" + param + "': " + reason,
                mapOf("param", param, "reason", reason, "received", received));
    }

    public static AcpException invalidParamsTypeMismatch(String param, String expected, Object received) {
        return new AcpException(AcpErrorCode.INVALID_PARAMS,
                "Parameter '" + param + "' must be of type " + expected,
                mapOf("param", param, "expected", expected, "received", received, "reason", "type_mismatch"));
    }

    public static AcpException internal(String message) {
        return new AcpException(AcpErrorCode.INTERNAL_ERROR, message);
    }

    /**
     * Wrap an unexpected exception. The original message is kept as the error
     * message and, with a short stack hint, in {@code data}.
     */
    public static AcpException internalFromCause(Throwable cause) {
        if (cause == null) {
            return internal(null);
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new AcpException(AcpErrorCode.INTERNAL_ERROR, message,
                mapOf("cause", message, "stack", stackHint(cause)), cause);
    }

    public static AcpException internalUnexpected(String context, Map<String, Object> details) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("context", context);
        if (details != null) {
            data.putAll(details);
        }
        return new AcpException(AcpErrorCode.INTERNAL_ERROR, "Unexpected error in " + context, data);
    }

    public static AcpException serverError(String message) {
        return new AcpException(AcpErrorCode.SERVER_ERROR, message);
    }

    // ── ACP kinds ───────────────────────────────────────────────

    public static AcpException authRequired() {
        return new AcpException(AcpErrorCode.AUTH_REQUIRED, null, mapOf("authMethods", List.of()));
    }

    public static AcpException authRequiredWithMethods(List<?> authMethods) {
        String names = authMethods.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return new AcpException(AcpErrorCode.AUTH_REQUIRED,
                "Authentication required. Available methods: " + names,
                mapOf("authMethods", authMethods));
    }

    public static AcpException authMethodFailed(String method, String reason) {
        return new AcpException(AcpErrorCode.AUTH_REQUIRED,
                "Authentication failed for method '" + method + "': " + reason,
                mapOf("authMethods", List.of(method)));
    }

    public static AcpException sessionNotFound(String sessionId) {
        return new AcpException(AcpErrorCode.SESSION_NOT_FOUND,
                "Session not found: " + sessionId, mapOf("sessionId", sessionId));
    }

    public static AcpException sessionAlreadyExists(String sessionId) {
        return new AcpException(AcpErrorCode.SESSION_ALREADY_EXISTS,
                "Session already exists: " + sessionId, mapOf("sessionId", sessionId));
    }

    public static AcpException sessionExpired(String sessionId) {
        return new AcpException(AcpErrorCode.SESSION_EXPIRED,
                "Session expired: " + sessionId, mapOf("sessionId", sessionId));
    }

    public static AcpException notInitialized() {
        return new AcpException(AcpErrorCode.NOT_INITIALIZED,
                "Connection not initialized: call initialize first");
    }

    public static AcpException alreadyInitialized() {
        return new AcpException(AcpErrorCode.ALREADY_INITIALIZED, "Connection already initialized");
    }

    public static AcpException unauthorized(String operation) {
        return new AcpException(AcpErrorCode.UNAUTHORIZED,
                "Operation not allowed: " + operation, mapOf("operation", operation));
    }

    public static AcpException toolNotFound(String toolCallId) {
        return new AcpException(AcpErrorCode.TOOL_NOT_FOUND,
                "No pending request for tool call: " + toolCallId, mapOf("toolCallId", toolCallId));
    }

    public static AcpException approvalDenied(String toolCallId) {
        return new AcpException(AcpErrorCode.APPROVAL_DENIED,
                "Tool call was not approved: " + toolCallId, mapOf("toolCallId", toolCallId));
    }

    public static AcpException userInputTimeout(String toolCallId, long timeoutMs) {
        return new AcpException(AcpErrorCode.USER_INPUT_TIMEOUT,
                "User input request timed out after " + timeoutMs + "ms: " + toolCallId,
                mapOf("toolCallId", toolCallId, "timeoutMs", timeoutMs));
    }

    public static AcpException genUiActionFailed(String actionId, Throwable cause) {
        String reason = cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown failure";
        return new AcpException(AcpErrorCode.GENUI_ACTION_FAILED,
                "GenUI action '" + actionId + "' failed: " + reason,
                mapOf("actionId", actionId, "reason", reason), cause);
    }

    // ── Helpers ─────────────────────────────────────────────────

    private static String stackHint(Throwable cause) {
        StackTraceElement[] trace = cause.getStackTrace();
        if (trace == null || trace.length == 0) {
            return cause.toString();
        }
        return cause + Arrays.stream(trace)
                .limit(STACK_HINT_FRAMES)
                .map(frame -> "\n    at " + frame)
                .collect(Collectors.joining());
    }

    /** Insertion-ordered map that tolerates null values (unlike Map.of). */
    private static Map<String, Object> mapOf(Object... kv) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            map.put((String) kv[i], kv[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
