package com.piacp.gateway.acp;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FileCommands} and {@link ParsedCommand}.
 */
class FileCommandsTest {

    @TempDir
    Path temp;

    @Nested
    class Loading {

        @Test
        void globalAndProjectTemplatesAreLoaded() throws IOException {
            Path global = Files.createDirectories(temp.resolve("global"));
            Path cwd = temp.resolve("project");
            Path project = Files.createDirectories(cwd.resolve(".pi").resolve("prompts"));
            Files.writeString(global.resolve("review.md"), "Review the code");
            Files.writeString(global.resolve("notes.txt"), "not a template");
            Files.writeString(project.resolve("test.md"), "Write tests");

            List<SlashCommand> commands = FileCommands.load(global, cwd.toString());

            assertEquals(List.of("review", "test"), commands.stream().map(SlashCommand::name).toList());
            assertFalse(commands.get(0).isBuiltin());
        }

        @Test
        void projectTemplatesShadowGlobalOnes() throws IOException {
            Path global = Files.createDirectories(temp.resolve("global"));
            Path cwd = temp.resolve("project");
            Path project = Files.createDirectories(cwd.resolve(".pi").resolve("prompts"));
            Files.writeString(global.resolve("review.md"), "global review");
            Files.writeString(project.resolve("review.md"), "project review");

            List<SlashCommand> commands = FileCommands.load(global, cwd.toString());

            assertEquals(1, commands.size());
            assertEquals("project review", commands.get(0).template());
        }

        @Test
        void missingDirectoriesYieldNothing() {
            assertTrue(FileCommands.load(temp.resolve("absent"), temp.resolve("nowhere").toString()).isEmpty());
            assertTrue(FileCommands.load(null, null).isEmpty());
        }
    }

    @Nested
    class Descriptions {

        @Test
        void frontmatterDescriptionWins() {
            SlashCommand command = FileCommands.parse("fix",
                    "---\ndescription: \"Fix failing tests\"\n---\nRun the tests and fix $ARGUMENTS\n");

            assertEquals("Fix failing tests", command.description());
            assertEquals("Run the tests and fix $ARGUMENTS\n", command.template());
        }

        @Test
        void firstLineIsTheFallback() {
            SlashCommand command = FileCommands.parse("doc", "\n# Document the module\n\nMore text");
            assertEquals("Document the module", command.description());
        }

        @Test
        void longDescriptionsAreCut() {
            SlashCommand command = FileCommands.parse("long", "x".repeat(200));
            assertEquals(FileCommands.DESCRIPTION_MAX_CHARS, command.description().length());
            assertTrue(command.description().endsWith("..."));
        }

        @Test
        void emptyTemplateIsDescribedByItsName() {
            assertEquals("blank", FileCommands.parse("blank", "").description());
        }
    }

    @Nested
    class Expansion {

        private final List<SlashCommand> commands = List.of(
                SlashCommand.builtin("name", "rename", null),
                new SlashCommand("review", "Review", "arguments", "Review $ARGUMENTS now"),
                new SlashCommand("plain", "Plain", "arguments", "Explain this\n"));

        @Test
        void argumentsAreSubstituted() {
            assertEquals(Optional.of("Review src/App.java now"),
                    FileCommands.expand("/review src/App.java", commands));
        }

        @Test
        void argumentsAreAppendedWithoutAPlaceholder() {
            assertEquals(Optional.of("Explain this\n\nthe parser"), FileCommands.expand("/plain the parser", commands));
            assertEquals(Optional.of("Explain this\n"), FileCommands.expand("/plain", commands));
        }

        @Test
        void builtinsAndUnknownNamesAreNotExpanded() {
            assertTrue(FileCommands.expand("/name x", commands).isEmpty());
            assertTrue(FileCommands.expand("/other", commands).isEmpty());
            assertTrue(FileCommands.expand("review", commands).isEmpty());
        }
    }

    @Nested
    class Parsing {

        @Test
        void nameAndArguments() {
            ParsedCommand command = ParsedCommand.parse("  /name   My Session ").orElseThrow();
            assertEquals("name", command.name());
            assertEquals("My Session", command.args());
        }

        @Test
        void notACommand() {
            assertTrue(ParsedCommand.parse("hello").isEmpty());
            assertTrue(ParsedCommand.parse("/").isEmpty());
            assertTrue(ParsedCommand.parse("/usr/bin/env").isEmpty());
            assertTrue(ParsedCommand.parse(null).isEmpty());
        }
    }
}
