package com.piacp.gateway.acp;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prompt-template commands: every {@code *.md} file in pi's global prompts
 * directory and in {@code <cwd>/.pi/prompts} becomes {@code /<file-name>}.
 * Project templates shadow global ones of the same name.
 */
@Slf4j
public final class FileCommands {

    static final int DESCRIPTION_MAX_CHARS = 80;

    private FileCommands() {
    }

    public static List<SlashCommand> load(Path globalDir, String cwd) {
        Map<String, SlashCommand> byName = new LinkedHashMap<>();
        loadInto(byName, globalDir);
        if (cwd != null && !cwd.isBlank()) {
            loadInto(byName, Path.of(cwd, ".pi", "prompts"));
        }
        return new ArrayList<>(byName.values());
    }

    private static void loadInto(Map<String, SlashCommand> byName, Path dir) {
        if (dir == null || !Files.isDirectory(dir)) {
            return;
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.md")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.debug("acp:commands cannot list {}: {}", dir, e.getMessage());
            return;
        }
        files.sort(null);
        for (Path file : files) {
            try {
                String text = Files.readString(file, StandardCharsets.UTF_8);
                String fileName = file.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - ".md".length());
                byName.put(name, parse(name, text));
            } catch (IOException e) {
                log.debug("acp:commands skipping {}: {}", file, e.getMessage());
            }
        }
    }

    static SlashCommand parse(String name, String text) {
        String body = text.replace("\r\n", "\n");
        String description = null;
        if (body.startsWith("---\n")) {
            int end = body.indexOf("\n---", 4);
            if (end > 0) {
                for (String line : body.substring(4, end).split("\n")) {
                    int colon = line.indexOf(':');
                    if (colon > 0 && line.substring(0, colon).trim().equals("description")) {
                        description = unquote(line.substring(colon + 1).trim());
                    }
                }
                int bodyStart = body.indexOf('\n', end + 1);
                body = bodyStart < 0 ? "" : body.substring(bodyStart + 1);
            }
        }
        if (description == null || description.isEmpty()) {
            description = firstNonEmptyLine(body).orElse(name);
        }
        if (description.length() > DESCRIPTION_MAX_CHARS) {
            description = description.substring(0, DESCRIPTION_MAX_CHARS - 3) + "...";
        }
        return new SlashCommand(name, description, "arguments", body);
    }

    /**
     * Expand {@code /<template> args} against the known templates.
     *
     * @return the expanded prompt text, or empty when the text does not start
     *         with a template command
     */
    public static Optional<String> expand(String text, List<SlashCommand> commands) {
        Optional<ParsedCommand> parsed = ParsedCommand.parse(text);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        for (SlashCommand command : commands) {
            if (!command.isBuiltin() && command.name().equals(parsed.get().name())) {
                return Optional.of(substitute(command.template(), parsed.get().args()));
            }
        }
        return Optional.empty();
    }

    static String substitute(String template, String args) {
        if (template.contains("$ARGUMENTS") || template.contains("$@")) {
            return template.replace("$ARGUMENTS", args).replace("$@", args);
        }
        if (args.isEmpty()) {
            return template;
        }
        return template.stripTrailing() + "\n\n" + args;
    }

    private static Optional<String> firstNonEmptyLine(String body) {
        for (String line : body.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                return Optional.of(trimmed.replaceFirst("^#+\\s*", ""));
            }
        }
        return Optional.empty();
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\""))
                        || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
