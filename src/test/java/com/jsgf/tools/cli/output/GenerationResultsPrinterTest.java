package com.jsgf.tools.cli.output;

import static org.assertj.core.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for GenerationResultsPrinter.
 */
class GenerationResultsPrinterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteToStdout() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        GenerationResultsPrinter printer =
                new GenerationResultsPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        int count = printer.writeStrings(Stream.of("hello world", "", "café"), null);

        assertThat(count).isEqualTo(3);
        assertThat(buffer.toString(StandardCharsets.UTF_8).lines()).containsExactly("hello world", "", "café");
    }

    @Test
    void testWriteToFileReplacesContent() throws IOException {
        Path out = tempDir.resolve("out.txt");
        Files.writeString(out, "old content\nmore\nlines\n");
        GenerationResultsPrinter printer = new GenerationResultsPrinter();

        int count = printer.writeStrings(Stream.of("a", "b"), out);

        assertThat(count).isEqualTo(2);
        assertThat(Files.readAllLines(out, StandardCharsets.UTF_8)).containsExactly("a", "b");
    }

    @Test
    void testWritePullsOnlyWhatIsNeeded() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        GenerationResultsPrinter printer = new GenerationResultsPrinter(new PrintStream(buffer));

        int count = printer.writeStrings(Stream.generate(() -> "again").limit(4), null);

        assertThat(count).isEqualTo(4);
    }
}
