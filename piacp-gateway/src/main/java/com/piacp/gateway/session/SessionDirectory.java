package com.piacp.gateway.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Discovers pi session logs under a root directory and derives their listing
 * metadata without loading whole files.
 *
 * <p>
 * Per file:
 * <ol>
 * <li>the header is parsed from the first {@value #HEAD_BYTES} bytes; files
 * without one are not sessions;</li>
 * <li>the last {@value #TAIL_BYTES} bytes are scanned backwards for the latest
 * {@code session_info.name} and the latest {@code message} timestamp;</li>
 * <li>a name older than the tail window is found by a sequential scan of the
 * whole file;</li>
 * <li>without any name the first user message (cut to {@value #TITLE_MAX_CHARS}
 * chars, first {@value #TITLE_SCAN_MAX_LINES} lines only) becomes the title;</li>
 * <li>without any timestamp the file modification time is used.</li>
 * </ol>
 * Nothing is cached: each call re-scans the file system.
 */
@Slf4j
public class SessionDirectory {

    static final int HEAD_BYTES = 64 * 1024;
    static final int TAIL_BYTES = 256 * 1024;
    static final int TITLE_MAX_CHARS = 80;
    static final int TITLE_SCAN_MAX_LINES = 2000;

    private static final Comparator<SessionListing> MOST_RECENT_FIRST = Comparator.comparing(
            (SessionListing s) -> s.updatedAt() != null ? s.updatedAt() : "").reversed();

    private final Path root;
    private final ObjectMapper mapper;

    public SessionDirectory(Path root, ObjectMapper mapper) {
        this.root = root;
        this.mapper = mapper;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * All sessions, most recently active first. Entries without
     * {@code updatedAt} sort last.
     */
    public List<SessionListing> list() {
        List<Path> files = new ArrayList<>();
        walkJsonlFiles(root, files);

        List<SessionListing> items = new ArrayList<>();
        for (Path file : files) {
            try {
                describe(file).ifPresent(items::add);
            } catch (RuntimeException e) {
                log.debug("session scan failed file={}: {}", file, e.getMessage());
            }
        }
        items.sort(MOST_RECENT_FIRST);
        return items;
    }

    /**
     * Sessions whose header cwd equals {@code cwd}; all sessions when null.
     */
    public List<SessionListing> list(String cwd) {
        List<SessionListing> all = list();
        if (cwd == null) {
            return all;
        }
        return all.stream().filter(s -> cwd.equals(s.cwd())).toList();
    }

    /**
     * Log file of the first listed session with the given id.
     */
    public Optional<Path> findFile(String sessionId) {
        return find(sessionId).map(SessionListing::sessionFile);
    }

    public Optional<SessionListing> find(String sessionId) {
        return list().stream()
                .filter(s -> Objects.equals(s.sessionId(), sessionId))
                .findFirst();
    }

    /**
     * Build the listing entry of a single file, or empty when the file is not
     * a session log.
     */
    Optional<SessionListing> describe(Path file) {
        Optional<SessionRecord.Header> header = readFirstLine(file)
                .map(line -> SessionRecord.parse(mapper, line))
                .filter(SessionRecord.Header.class::isInstance)
                .map(SessionRecord.Header.class::cast);
        if (header.isEmpty()) {
            return Optional.empty();
        }

        String title = null;
        String updatedAt = null;
        try {
            List<SessionRecord> tail = parseLines(readTail(file));
            title = pickTitle(tail).orElse(null);
            updatedAt = pickUpdatedAt(tail).orElse(null);
        } catch (IOException e) {
            log.debug("tail read failed file={}: {}", file, e.getMessage());
        }

        if (title == null) {
            title = scanLastSessionName(file).orElse(null);
        }
        if (updatedAt == null) {
            updatedAt = modifiedTime(file).orElse(null);
        }
        if (title == null) {
            title = firstUserMessageTitle(file).orElse(null);
        }

        return Optional.of(new SessionListing(header.get().id(), header.get().cwd(), title, updatedAt, file));
    }

    // ── File walking ────────────────────────────────────────────

    private void walkJsonlFiles(Path dir, List<Path> out) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (Files.isDirectory(entry)) {
                    walkJsonlFiles(entry, out);
                } else if (Files.isRegularFile(entry) && entry.getFileName().toString().endsWith(".jsonl")) {
                    out.add(entry);
                }
            }
        } catch (IOException | SecurityException e) {
            log.debug("skipping unreadable dir={}: {}", dir, e.getMessage());
        }
    }

    // ── Bounded reads ───────────────────────────────────────────

    private Optional<String> readFirstLine(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] head = in.readNBytes(HEAD_BYTES);
            if (head.length == 0) {
                return Optional.empty();
            }
            String text = new String(head, StandardCharsets.UTF_8);
            int newline = text.indexOf('\n');
            return Optional.of((newline == -1 ? text : text.substring(0, newline)).trim());
        } catch (IOException e) {
            log.debug("head read failed file={}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Last {@value #TAIL_BYTES} bytes of the file. When the window starts
     * mid-file the leading partial line is dropped.
     */
    private String readTail(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            long start = Math.max(0, size - TAIL_BYTES);
            ByteBuffer buffer = ByteBuffer.allocate((int) (size - start));
            while (buffer.hasRemaining()) {
                if (channel.read(buffer, start + buffer.position()) < 0) {
                    break;
                }
            }
            String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
            if (start > 0) {
                int newline = text.indexOf('\n');
                text = newline == -1 ? "" : text.substring(newline + 1);
            }
            return text;
        }
    }

    private List<SessionRecord> parseLines(String text) {
        List<SessionRecord> records = new ArrayList<>();
        for (String line : text.split("\r?\n")) {
            records.add(SessionRecord.parse(mapper, line));
        }
        return records;
    }

    // ── Tail pickers ────────────────────────────────────────────

    static Optional<String> pickTitle(List<SessionRecord> records) {
        for (int i = records.size() - 1; i >= 0; i--) {
            if (records.get(i) instanceof SessionRecord.SessionInfo info) {
                Optional<String> name = info.displayName();
                if (name.isPresent()) {
                    return name;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Timestamp of the latest message record; failing that, the latest
     * record with any timestamp.
     */
    static Optional<String> pickUpdatedAt(List<SessionRecord> records) {
        for (int i = records.size() - 1; i >= 0; i--) {
            if (records.get(i) instanceof SessionRecord.Message message && message.timestamp().isPresent()) {
                return message.timestamp();
            }
        }
        for (int i = records.size() - 1; i >= 0; i--) {
            Optional<String> timestamp = records.get(i).timestamp();
            if (timestamp.isPresent()) {
                return timestamp;
            }
        }
        return Optional.empty();
    }

    // ── Full-file fallbacks ─────────────────────────────────────

    /**
     * Sequential scan for the last session name in the file, used when the
     * rename is older than the tail window.
     */
    private Optional<String> scanLastSessionName(Path file) {
        String lastName = null;
        try (BufferedReader reader = openLenient(file)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.contains("session_info")) {
                    continue;
                }
                if (SessionRecord.parse(mapper, line) instanceof SessionRecord.SessionInfo info) {
                    String name = info.displayName().orElse(null);
                    if (name != null) {
                        lastName = name;
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            log.debug("name scan failed file={}: {}", file, e.getMessage());
        }
        return Optional.ofNullable(lastName);
    }

    private Optional<String> firstUserMessageTitle(Path file) {
        try (BufferedReader reader = openLenient(file)) {
            String line;
            int lines = 0;
            while ((line = reader.readLine()) != null && lines++ < TITLE_SCAN_MAX_LINES) {
                if (SessionRecord.parse(mapper, line) instanceof SessionRecord.Message message
                        && "user".equals(message.role())) {
                    Optional<String> text = message.firstText();
                    if (text.isPresent() && !text.get().isEmpty()) {
                        return Optional.of(truncate(text.get(), TITLE_MAX_CHARS));
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            log.debug("title scan failed file={}: {}", file, e.getMessage());
        }
        return Optional.empty();
    }

    /** Line reader that decodes invalid UTF-8 as U+FFFD, like the tail read. */
    private static BufferedReader openLenient(Path file) throws IOException {
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8));
    }

    private Optional<String> modifiedTime(Path file) {
        try {
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            return Optional.of(SessionRecord.formatInstant(modified));
        } catch (IOException e) {
            log.debug("stat failed file={}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
