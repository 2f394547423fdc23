package com.markrunner.engine;

import com.markrunner.core.model.BackendType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BackendSelectorTest {

    @TempDir
    Path bin;

    private void fakeExecutable(String name) throws Exception {
        Path p = bin.resolve(name);
        Files.writeString(p, "#!/bin/sh\nexit 0\n");
        assertTrue(p.toFile().setExecutable(true));
    }

    private BackendSelector selector() {
        return new BackendSelector(new ExecutableLocator(Map.of("PATH", bin.toString())), new EngineProperties());
    }

    @Nested
    @DisplayName("decide")
    class DecideTests {

        @ParameterizedTest(name = "coordinator={0}, dispatcher={1}, preference={2} -> {3}")
        @CsvSource({
                "true,  true,  AUTO,        COORDINATOR",
                "false, true,  AUTO,        INDIRECT_DISPATCH",
                "false, false, AUTO,        SEQUENTIAL",
                "true,  true,  INDIRECT,    INDIRECT_DISPATCH",
                "true,  false, INDIRECT,    SEQUENTIAL",
                "true,  true,  SEQUENTIAL,  SEQUENTIAL",
                "false, true,  COORDINATOR, INDIRECT_DISPATCH"
        })
        void selection(boolean coordinator, boolean dispatcher, BackendPreference preference, BackendType expected) {
            assertEquals(expected, BackendSelector.decide(coordinator, dispatcher, preference));
        }
    }

    @Nested
    @DisplayName("environment probing")
    class ProbingTests {

        @Test
        @DisplayName("falls back to sequential when PATH has neither tool")
        void emptyPath() {
            assertEquals(BackendType.SEQUENTIAL, selector().select(BackendPreference.AUTO).type());
        }

        @Test
        @DisplayName("picks indirect dispatch when only xargs is present")
        void onlyXargs() throws Exception {
            fakeExecutable("xargs");
            assertEquals(BackendType.INDIRECT_DISPATCH, selector().select(BackendPreference.AUTO).type());
        }

        @Test
        @DisplayName("prefers the coordinator when present, unless dispatch is forced")
        void coordinatorPresent() throws Exception {
            fakeExecutable("parallel");
            fakeExecutable("xargs");
            assertEquals(BackendType.COORDINATOR, selector().select(BackendPreference.AUTO).type());
            assertEquals(BackendType.INDIRECT_DISPATCH, selector().select(BackendPreference.INDIRECT).type());
        }

        @Test
        @DisplayName("ignores non-executable files")
        void ignoresNonExecutable() throws Exception {
            Files.writeString(bin.resolve("parallel"), "not a program");
            assertFalse(new ExecutableLocator(Map.of("PATH", bin.toString())).isAvailable("parallel"));
        }

        @Test
        @DisplayName("configured backend applies when the request says auto")
        void configuredDefault() throws Exception {
            fakeExecutable("parallel");
            var props = new EngineProperties();
            props.setBackend("sequential");
            var s = new BackendSelector(new ExecutableLocator(Map.of("PATH", bin.toString())), props);
            assertEquals(BackendType.SEQUENTIAL, s.select(BackendPreference.AUTO).type());
        }
    }

    @Test
    @DisplayName("parses backend names and aliases")
    void parsesPreference() {
        assertEquals(BackendPreference.INDIRECT, BackendPreference.parse("xargs"));
        assertEquals(BackendPreference.COORDINATOR, BackendPreference.parse("parallel"));
        assertEquals(BackendPreference.AUTO, BackendPreference.parse(null));
        assertThrows(IllegalArgumentException.class, () -> BackendPreference.parse("gpu"));
    }
}
