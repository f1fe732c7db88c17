package com.piacp.gateway.acp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.piacp.gateway.acp.PromptTranslator.PiPrompt;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link PromptTranslator}.
 */
class PromptTranslatorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private PiPrompt translate(Object... blocks) {
        JsonNode node = mapper.valueToTree(List.of(blocks));
        return PromptTranslator.translate(node);
    }

    @Test
    void textBlocksAreConcatenated() {
        PiPrompt prompt = translate(
                Map.of("type", "text", "text", "Fix the bug"),
                Map.of("type", "text", "text", " in main"));
        assertEquals("Fix the bug in main", prompt.message());
        assertTrue(prompt.images().isEmpty());
    }

    @Test
    void resourceLinkBecomesAContextMarker() {
        PiPrompt prompt = translate(
                Map.of("type", "text", "text", "see"),
                Map.of("type", "resource_link", "uri", "file:///a.txt", "name", "a.txt"));
        assertEquals("see\n[Context] file:///a.txt", prompt.message());
    }

    @Test
    void embeddedTextResourceIsInlined() {
        PiPrompt prompt = translate(Map.of("type", "resource", "resource",
                Map.of("uri", "file:///b.md", "mimeType", "text/markdown", "text", "# Title")));
        assertEquals("\n[Embedded Context] file:///b.md (text/markdown)\n# Title", prompt.message());
    }

    @Test
    void embeddedTextWithoutMimeDefaultsToPlainText() {
        PiPrompt prompt = translate(Map.of("type", "resource", "resource",
                Map.of("uri", "file:///c.txt", "text", "body")));
        assertEquals("\n[Embedded Context] file:///c.txt (text/plain)\nbody", prompt.message());
    }

    @Test
    void embeddedBlobIsSummarizedBySize() {
        PiPrompt prompt = translate(Map.of("type", "resource", "resource",
                Map.of("uri", "file:///d.bin", "mimeType", "application/zip", "blob", "AAECAw==")));
        assertEquals("\n[Embedded Context] file:///d.bin (application/zip, 4 bytes)", prompt.message());
    }

    @Test
    void imagesAreCollectedSeparately() {
        PiPrompt prompt = translate(
                Map.of("type", "text", "text", "what is this"),
                Map.of("type", "image", "mimeType", "image/png", "data", "iVBORw0KGgo="));
        assertEquals("what is this", prompt.message());
        assertEquals(1, prompt.images().size());
        assertEquals("image", prompt.images().get(0).type());
        assertEquals("image/png", prompt.images().get(0).mimeType());
        assertEquals("iVBORw0KGgo=", prompt.images().get(0).data());
    }

    @Test
    void audioIsReportedAsUnsupported() {
        PiPrompt prompt = translate(Map.of("type", "audio", "mimeType", "audio/wav", "data", "AAAA"));
        assertEquals("\n[Audio] (audio/wav, 3 bytes) not supported by pi-acp", prompt.message());
    }

    @Test
    void unknownBlocksAreDropped() {
        PiPrompt prompt = translate(Map.of("type", "hologram", "text", "ignored"));
        assertEquals("", prompt.message());
    }

    @Test
    void base64LengthAccountsForPadding() {
        assertEquals(0, PromptTranslator.base64ByteLength(""));
        assertEquals(1, PromptTranslator.base64ByteLength("AA=="));
        assertEquals(2, PromptTranslator.base64ByteLength("AAA="));
        assertEquals(3, PromptTranslator.base64ByteLength("AAAA"));
    }
}
