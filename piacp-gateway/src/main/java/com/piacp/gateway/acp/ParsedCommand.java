package com.piacp.gateway.acp;

import java.util.Optional;

/**
 * A leading {@code /name args} in prompt text.
 */
record ParsedCommand(String name, String args) {

    static Optional<ParsedCommand> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.strip();
        if (!trimmed.startsWith("/") || trimmed.length() < 2) {
            return Optional.empty();
        }
        int space = indexOfWhitespace(trimmed);
        String name = space < 0 ? trimmed.substring(1) : trimmed.substring(1, space);
        String args = space < 0 ? "" : trimmed.substring(space + 1).strip();
        if (name.isEmpty() || name.contains("/")) {
            return Optional.empty();
        }
        return Optional.of(new ParsedCommand(name, args));
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
