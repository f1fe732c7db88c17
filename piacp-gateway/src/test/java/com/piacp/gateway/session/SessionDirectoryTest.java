package com.piacp.gateway.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionDirectoryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path root;

    private SessionDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new SessionDirectory(root, mapper);
    }

    // --- Helpers ---

    private String header(String id, String cwd) throws IOException {
        Map<String, Object> h = new LinkedHashMap<>();
        h.put("type", "session");
        h.put("version", 3);
        h.put("id", id);
        h.put("timestamp", "2026-01-01T00:00:00.000Z");
        h.put("cwd", cwd);
        return mapper.writeValueAsString(h);
    }

    private String message(String ts, String role, Object content) throws IOException {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "message");
        m.put("id", "m-" + ts);
        m.put("parentId", null);
        m.put("timestamp", ts);
        m.put("message", Map.of("role", role, "content", content));
        return mapper.writeValueAsString(m);
    }

    private String sessionInfo(String ts, String name) throws IOException {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "session_info");
        m.put("id", "i-" + ts);
        m.put("parentId", null);
        m.put("timestamp", ts);
        m.put("name", name);
        return mapper.writeValueAsString(m);
    }

    private Path write(String relative, String... lines) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return file;
    }

    // --- Tests ---

    @Nested
    class Headers {

        @Test
        void listsValidSessionWithMetadata() throws Exception {
            Path file = write("sessions/--tmp--project--/0000_a.jsonl",
                    header("sess-1", "/tmp/project"),
                    message("2026-02-11T00:00:01.000Z", "user", "Hello"),
                    message("2026-02-11T00:00:02.000Z", "assistant", List.of(Map.of("type", "text", "text", "Hi"))),
                    sessionInfo("2026-02-11T00:00:03.000Z", "My Named Session"));

            List<SessionListing> listed = directory.list();

            assertEquals(1, listed.size());
            SessionListing s = listed.get(0);
            assertEquals("sess-1", s.sessionId());
            assertEquals("/tmp/project", s.cwd());
            assertEquals("My Named Session", s.title());
            assertEquals("2026-02-11T00:00:02.000Z", s.updatedAt());
            assertEquals(file, s.sessionFile());
        }

        @Test
        void excludesFilesWithoutSessionHeader() throws Exception {
            write("a/not-a-session.jsonl", message("2026-01-01T00:00:01.000Z", "user", "hi"));
            write("a/garbage.jsonl", "{not json", header("x", "/x"));
            write("a/header-without-cwd.jsonl", "{\"type\":\"session\",\"id\":\"no-cwd\"}");
            write("a/empty.jsonl", "");
            write("a/ok.jsonl", header("ok", "/cwd"));

            List<SessionListing> listed = directory.list();

            assertEquals(1, listed.size());
            assertEquals("ok", listed.get(0).sessionId());
        }

        @Test
        void ignoresNonJsonlFiles() throws Exception {
            write("a/notes.txt", header("txt", "/cwd"));
            assertTrue(directory.list().isEmpty());
        }

        @Test
        void missingRoot_listsNothing() {
            var missing = new SessionDirectory(root.resolve("does-not-exist"), mapper);
            assertTrue(missing.list().isEmpty());
        }
    }

    @Nested
    class UpdatedAt {

        @Test
        void prefersLastMessageOverLaterNonMessageRecord() throws Exception {
            write("p/s.jsonl",
                    header("sess-1", "/tmp/project"),
                    message("2026-01-01T00:00:02.000Z", "user", "hi"),
                    sessionInfo("2026-01-01T00:00:10.000Z", "named"));

            assertEquals("2026-01-01T00:00:02.000Z", directory.list().get(0).updatedAt());
        }

        @Test
        void withoutMessages_usesAnyRecordTimestamp() throws Exception {
            write("p/s.jsonl",
                    header("sess-1", "/tmp/project"),
                    sessionInfo("2026-01-01T00:00:05.000Z", "named"));

            assertEquals("2026-01-01T00:00:05.000Z", directory.list().get(0).updatedAt());
        }

        @Test
        void normalizesTimestampPrecision() throws Exception {
            write("p/s.jsonl",
                    header("sess-1", "/tmp/project"),
                    message("2026-01-01T00:00:02Z", "user", "hi"));

            assertEquals("2026-01-01T00:00:02.000Z", directory.list().get(0).updatedAt());
        }

        @Test
        void withoutAnyTimestamp_fallsBackToModificationTime() throws Exception {
            Path file = write("p/s.jsonl", "{\"type\":\"session\",\"id\":\"s\",\"cwd\":\"/c\"}");
            Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2025-06-01T12:00:00Z")));

            assertEquals("2025-06-01T12:00:00.000Z", directory.list().get(0).updatedAt());
        }

        @Test
        void sortedMostRecentFirst() throws Exception {
            write("a/1.jsonl", header("old", "/c"), message("2026-01-01T00:00:01.000Z", "user", "a"));
            write("b/2.jsonl", header("new", "/c"), message("2026-03-01T00:00:01.000Z", "user", "b"));
            write("c/3.jsonl", header("mid", "/c"), message("2026-02-01T00:00:01.000Z", "user", "c"));

            List<String> order = new ArrayList<>();
            List<SessionListing> listed = directory.list();
            listed.forEach(s -> order.add(s.sessionId()));
            assertEquals(List.of("new", "mid", "old"), order);

            for (int i = 1; i < listed.size(); i++) {
                assertTrue(listed.get(i - 1).updatedAt().compareTo(listed.get(i).updatedAt()) >= 0);
            }
        }
    }

    @Nested
    class Titles {

        @Test
        void latestRenameWins() throws Exception {
            write("p/s.jsonl",
                    header("sess-1", "/c"),
                    sessionInfo("2026-01-01T00:00:01.000Z", "First"),
                    message("2026-01-01T00:00:02.000Z", "user", "hi"),
                    sessionInfo("2026-01-01T00:00:03.000Z", "  Second  "));

            assertEquals("Second", directory.list().get(0).title());
        }

        @Test
        void findsNameOutsideTailWindowViaFullScan() throws Exception {
            String filler = message("2026-01-01T00:00:02.000Z", "user", "x".repeat(2000));
            List<String> lines = new ArrayList<>();
            lines.add(header("sess-1", "/tmp/project"));
            lines.add(sessionInfo("2026-01-01T00:00:01.000Z", "Named Early"));
            for (int i = 0; i < 400; i++) {
                lines.add(filler);
            }
            Path file = write("p/s.jsonl", lines.toArray(new String[0]));
            assertTrue(Files.size(file) > SessionDirectory.TAIL_BYTES + 1024);

            Optional<SessionListing> s = directory.find("sess-1");
            assertTrue(s.isPresent());
            assertEquals("Named Early", s.get().title());
        }

        @Test
        void invalidUtf8ByteDoesNotBreakTheNameScan() throws Exception {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            bytes.write((header("sess-1", "/tmp/project") + "\n").getBytes(StandardCharsets.UTF_8));
            bytes.write((sessionInfo("2026-01-01T00:00:01.000Z", "Named Early") + "\n").getBytes(StandardCharsets.UTF_8));
            bytes.write("{\"type\":\"custom\",\"data\":\"".getBytes(StandardCharsets.UTF_8));
            bytes.write(0xFF);
            bytes.write("\"}\n".getBytes(StandardCharsets.UTF_8));
            String filler = message("2026-01-01T00:00:02.000Z", "user", "x".repeat(2000)) + "\n";
            for (int i = 0; i < 400; i++) {
                bytes.write(filler.getBytes(StandardCharsets.UTF_8));
            }
            Path file = root.resolve("p/s.jsonl");
            Files.createDirectories(file.getParent());
            Files.write(file, bytes.toByteArray());
            assertTrue(Files.size(file) > SessionDirectory.TAIL_BYTES + 1024);

            assertEquals("Named Early", directory.find("sess-1").orElseThrow().title());
        }

        @Test
        void invalidUtf8ByteDoesNotBreakTheUserMessageTitle() throws Exception {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            bytes.write((header("sess-1", "/c") + "\n").getBytes(StandardCharsets.UTF_8));
            bytes.write("{\"type\":\"custom\",\"data\":\"".getBytes(StandardCharsets.UTF_8));
            bytes.write(0xFF);
            bytes.write("\"}\n".getBytes(StandardCharsets.UTF_8));
            bytes.write((message("2026-01-01T00:00:02.000Z", "user", "Fix the build") + "\n")
                    .getBytes(StandardCharsets.UTF_8));
            Path file = root.resolve("p/s.jsonl");
            Files.createDirectories(file.getParent());
            Files.write(file, bytes.toByteArray());

            assertEquals("Fix the build", directory.list().get(0).title());
        }

        @Test
        void withoutName_usesFirstUserMessageTruncated() throws Exception {
            String longText = "y".repeat(200);
            write("p/s.jsonl",
                    header("sess-1", "/c"),
                    message("2026-01-01T00:00:01.000Z", "assistant", List.of(Map.of("type", "text", "text", "ignored"))),
                    message("2026-01-01T00:00:02.000Z", "user", longText));

            String title = directory.list().get(0).title();
            assertEquals(80, title.length());
            assertEquals("y".repeat(80), title);
        }

        @Test
        void withoutName_readsTextBlockOfArrayContent() throws Exception {
            write("p/s.jsonl",
                    header("sess-1", "/c"),
                    message("2026-01-01T00:00:01.000Z", "user",
                            List.of(Map.of("type", "image", "data", "AAA"), Map.of("type", "text", "text", "Fix the bug"))));

            assertEquals("Fix the bug", directory.list().get(0).title());
        }

        @Test
        void blankNamesIgnored() throws Exception {
            write("p/s.jsonl",
                    header("sess-1", "/c"),
                    message("2026-01-01T00:00:01.000Z", "user", "question"),
                    sessionInfo("2026-01-01T00:00:02.000Z", "   "));

            assertEquals("question", directory.list().get(0).title());
        }

        @Test
        void noTitleAtAll_isNull() throws Exception {
            write("p/s.jsonl", header("sess-1", "/c"));
            assertNull(directory.list().get(0).title());
        }
    }

    @Nested
    class Lookup {

        @Test
        void listByCwd_filtersExactly() throws Exception {
            write("sessions/--a--/1.jsonl", header("sess-a", "/cwd/a"), sessionInfo("2026-01-01T00:00:01.000Z", "A"));
            write("sessions/--b--/2.jsonl", header("sess-b", "/cwd/b"), sessionInfo("2026-01-01T00:00:01.000Z", "B"));

            List<SessionListing> listed = directory.list("/cwd/a");
            assertEquals(1, listed.size());
            assertEquals("sess-a", listed.get(0).sessionId());
            assertEquals(2, directory.list(null).size());
        }

        @Test
        void findFile_returnsPathOrEmpty() throws Exception {
            Path file = write("x/s.jsonl", header("sess-1", "/c"));

            assertEquals(Optional.of(file), directory.findFile("sess-1"));
            assertTrue(directory.findFile("nope").isEmpty());
        }
    }
}
