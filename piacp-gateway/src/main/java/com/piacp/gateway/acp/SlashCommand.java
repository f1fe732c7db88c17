package com.piacp.gateway.acp;

/**
 * A command advertised through {@code available_commands_update}.
 *
 * @param template body of a prompt-template command, null for built-ins
 */
public record SlashCommand(String name, String description, String inputHint, String template) {

    public static SlashCommand builtin(String name, String description, String inputHint) {
        return new SlashCommand(name, description, inputHint, null);
    }

    public boolean isBuiltin() {
        return template == null;
    }
}
