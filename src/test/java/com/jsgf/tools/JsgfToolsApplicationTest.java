package com.jsgf.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Smoke tests for the command line entry point.
 */
class JsgfToolsApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void testExitCodes() throws IOException {
        Path grammar = tempDir.resolve("g.jsgf");
        Files.writeString(grammar, "public <s> = hello;\n");

        assertThat(JsgfToolsApplication.execute("info", grammar.toString())).isZero();
        assertThat(JsgfToolsApplication.execute("--version")).isZero();
        assertThat(JsgfToolsApplication.execute("bogus-subcommand")).isNotZero();
    }
}
