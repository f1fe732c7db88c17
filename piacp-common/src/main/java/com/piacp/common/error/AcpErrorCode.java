package com.piacp.common.error;

/**
 * Closed set of JSON-RPC compatible error kinds raised by the bridge.
 *
 * <p>
 * Standard JSON-RPC 2.0 codes occupy -32700..-32600; ACP specific codes live in
 * the server-error range (-32000..-32099). {@link #AUTH_REQUIRED} uses -32011 so
 * that it no longer shares -32001 with {@link #SESSION_NOT_FOUND}.
 */
public enum AcpErrorCode {

    PARSE_ERROR(-32700, "Parse error"),
    INVALID_REQUEST(-32600, "Invalid request"),
    METHOD_NOT_FOUND(-32601, "Method not found"),
    INVALID_PARAMS(-32602, "Invalid params"),
    INTERNAL_ERROR(-32603, "Internal error"),
    SERVER_ERROR(-32000, "Server error"),

    SESSION_NOT_FOUND(-32001, "Session not found"),
    SESSION_ALREADY_EXISTS(-32002, "Session already exists"),
    SESSION_EXPIRED(-32003, "Session expired"),
    NOT_INITIALIZED(-32004, "Not initialized"),
    ALREADY_INITIALIZED(-32005, "Already initialized"),
    UNAUTHORIZED(-32006, "Unauthorized"),
    TOOL_NOT_FOUND(-32007, "Tool not found"),
    APPROVAL_DENIED(-32008, "Approval denied"),
    USER_INPUT_TIMEOUT(-32009, "User input timeout"),
    GENUI_ACTION_FAILED(-32010, "GenUI action failed"),
    AUTH_REQUIRED(-32011, "Authentication required");

    public static final int SERVER_ERROR_MIN = -32099;
    public static final int SERVER_ERROR_MAX = -32000;

    private final int code;
    private final String defaultMessage;

    AcpErrorCode(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int code() {
        return code;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /**
     * Look up the kind for a numeric code, e.g. when re-hydrating an error
     * object received over the wire.
     *
     * @return the matching kind, or {@link #SERVER_ERROR} for codes in the
     *         server range and {@link #INTERNAL_ERROR} for anything else
     */
    public static AcpErrorCode fromCode(int code) {
        for (AcpErrorCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        if (code >= SERVER_ERROR_MIN && code <= SERVER_ERROR_MAX) {
            return SERVER_ERROR;
        }
        return INTERNAL_ERROR;
    }
}
