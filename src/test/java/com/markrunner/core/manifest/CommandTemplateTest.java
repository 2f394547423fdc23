package com.markrunner.core.manifest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CommandTemplateTest {

    @Nested
    @DisplayName("parsing")
    class ParsingTests {

        @Test
        @DisplayName("collects named placeholders and the payload token")
        void collectsPlaceholders() {
            var t = CommandTemplate.of("review {key} {item} --in {}");
            assertEquals(Set.of("key", "item", ""), t.placeholders());
            assertTrue(t.usesPayload());
        }

        @Test
        @DisplayName("leaves shell parameter expansions alone")
        void ignoresShellExpansion() {
            var t = CommandTemplate.of("cd ${HOME} && run {key}");
            assertEquals(Set.of("key"), t.placeholders());
            assertEquals("cd ${HOME} && run 'a'", t.renderCommand(Map.of("key", "a")));
        }

        @Test
        @DisplayName("rejects blank and multi-line templates")
        void rejectsBadTemplates() {
            assertThrows(IllegalArgumentException.class, () -> CommandTemplate.of(" "));
            assertThrows(IllegalArgumentException.class, () -> CommandTemplate.of("echo a\necho b"));
        }
    }

    @Nested
    @DisplayName("rendering")
    class RenderingTests {

        @Test
        @DisplayName("quotes substituted values for the shell")
        void quotesValues() {
            var t = CommandTemplate.of("echo {}");
            assertEquals("echo 'it'\\''s $HOME; rm -rf /'", t.renderPayload("it's $HOME; rm -rf /"));
        }

        @Test
        @DisplayName("renders paths verbatim")
        void rendersPathsVerbatim() {
            var t = CommandTemplate.of("out/{key}/{item}.md");
            assertEquals("out/alice/q1.md", t.renderPath(Map.of("key", "alice", "item", "q1")));
        }

        @Test
        @DisplayName("does not expand placeholders found inside substituted text")
        void singlePass() {
            var t = CommandTemplate.of("echo {} {key}");
            String out = t.renderCommand(Map.of("", "{key}", "key", "k"));
            assertEquals("echo '{key}' 'k'", out);
        }

        @Test
        @DisplayName("fails on an unknown placeholder")
        void unknownPlaceholder() {
            var t = CommandTemplate.of("run {missing}");
            var e = assertThrows(IllegalArgumentException.class, () -> t.renderCommand(Map.of()));
            assertTrue(e.getMessage().contains("{missing}"));
        }

        @Test
        @DisplayName("refuses values containing line breaks")
        void refusesLineBreaks() {
            var t = CommandTemplate.of("echo {}");
            assertThrows(IllegalArgumentException.class, () -> t.renderPayload("a\nb"));
        }

        @Test
        @DisplayName("empty payload becomes an empty quoted word")
        void emptyPayload() {
            assertEquals("echo ''", CommandTemplate.of("echo {}").renderPayload(""));
        }
    }
}
