package com.piacp.gateway.pi;

/**
 * Failure reported by, or while talking to, the pi process.
 */
public class PiRpcException extends RuntimeException {

    private final String command;

    public PiRpcException(String command, String message) {
        super(message);
        this.command = command;
    }

    public PiRpcException(String command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
