package com.piacp.gateway.pi;

import java.nio.file.Path;
import java.util.Map;

/**
 * Locations of pi's on-disk state.
 *
 * <p>
 * pi honours {@code PI_CODING_AGENT_DIR}; without it the agent directory is
 * {@code ~/.pi/agent}. Session logs live in {@code <agentDir>/sessions} and
 * prompt templates in {@code <agentDir>/prompts}.
 */
public final class PiPaths {

    public static final String AGENT_DIR_ENV = "PI_CODING_AGENT_DIR";

    private PiPaths() {
    }

    public static Path agentDir() {
        return agentDir(System.getenv(), System.getProperty("user.home"));
    }

    static Path agentDir(Map<String, String> env, String userHome) {
        String override = env.get(AGENT_DIR_ENV);
        if (override != null && !override.isBlank()) {
            return Path.of(expandHome(override.trim(), userHome));
        }
        return Path.of(userHome, ".pi", "agent");
    }

    public static Path sessionsDir() {
        return agentDir().resolve("sessions");
    }

    public static Path promptsDir() {
        return agentDir().resolve("prompts");
    }

    /** A configured path, with a leading {@code ~} expanded. */
    public static Path expand(String path) {
        return Path.of(expandHome(path.trim(), System.getProperty("user.home")));
    }

    static String expandHome(String path, String userHome) {
        if (path.equals("~")) {
            return userHome;
        }
        if (path.startsWith("~/")) {
            return userHome + path.substring(1);
        }
        return path;
    }
}
