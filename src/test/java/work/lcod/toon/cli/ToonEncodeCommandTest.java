package work.lcod.toon.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ToonEncodeCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void encodesInlineJson() {
        int exit = run("", "-i", "{\"user\":{\"name\":\"Ada\"},\"tags\":[\"a\",\"b\"]}");
        assertEquals(0, exit);
        assertEquals("user:\n  name: Ada\ntags[2]: a,b", stdout());
    }

    @Test
    void readsStdinByDefault() {
        assertEquals(0, run("[{\"a\":1,\"b\":2},{\"a\":3,\"b\":4}]"));
        assertEquals("[2]{a,b}:\n  1,2\n  3,4", stdout());
    }

    @Test
    void appliesEncodingFlags() {
        assertEquals(0, run("", "-i", "[\"a,b\",\"c\"]", "-d", "pipe"));
        assertEquals("[2|]: a,b|c", stdout());
    }

    @Test
    void appliesKeyCollapsing() {
        assertEquals(0, run("", "-i", "{\"a\":{\"b\":{\"c\":1}}}", "--key-collapsing", "safe", "--flatten-depth", "2"));
        assertEquals("a.b:\n  c: 1", stdout());
    }

    @Test
    void writesOutputFile(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("out/result.toon");
        assertEquals(0, run("", "-i", "{\"a\":1}", "-o", target.toString()));
        assertEquals("a: 1", Files.readString(target, StandardCharsets.UTF_8));
        assertEquals("", stdout());
    }

    @Test
    void readsInputFile(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("in.json");
        Files.writeString(input, "{\"n\":[1,2,3]}");
        assertEquals(0, run("", "-i", input.toString()));
        assertEquals("n[3]: 1,2,3", stdout());
    }

    @Test
    void configFileProvidesDefaultsAndFlagsOverride(@TempDir Path dir) throws Exception {
        Path config = dir.resolve("toon.toml");
        Files.writeString(config, "[encode]\ndelimiter = \"pipe\"\nindent = 4\n");

        assertEquals(0, run("", "-i", "{\"a\":{\"b\":[1,2]}}", "--config", config.toString()));
        assertEquals("a:\n    b[2|]: 1|2", stdout());

        out.getBuffer().setLength(0);
        assertEquals(0, run("", "-i", "{\"a\":{\"b\":[1,2]}}", "--config", config.toString(), "-d", "comma"));
        assertEquals("a:\n    b[2]: 1,2", stdout());
    }

    @Test
    void invalidJsonIsAUsageError() {
        int exit = run("", "-i", "{\"a\":");
        assertNotEquals(0, exit);
        assertTrue(err.toString().contains("Invalid JSON input"));
    }

    @Test
    void invalidOptionIsAUsageError() {
        int exit = run("", "-i", "[1]", "-d", "semicolon");
        assertNotEquals(0, exit);
        assertTrue(err.toString().contains("Unsupported delimiter: semicolon"));
    }

    @Test
    void zeroIndentIsRejected() {
        int exit = run("", "-i", "{\"a\":{\"b\":1}}", "--indent", "0");
        assertNotEquals(0, exit);
        assertTrue(err.toString().contains("indent must be >= 1"));
    }

    @Test
    void versionNamesTheTool() {
        assertEquals(0, run("", "--version"));
        String[] lines = stdout().split("\n");
        assertTrue(lines[0].startsWith("toon-encode "));
        assertEquals(VersionProvider.DESCRIPTION, lines[1]);
    }

    @Test
    void depthFailureReportsCode() {
        int exit = run("", "-i", "[[1]]", "--max-depth", "1");
        assertEquals(1, exit);
        assertTrue(err.toString().contains("[max_depth_exceeded]"));
    }

    private int run(String stdin, String... args) {
        var command = new ToonEncodeCommand(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
        var commandLine = new CommandLine(command).setExecutionExceptionHandler(new ShortErrorHandler());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private String stdout() {
        return out.toString().replace(System.lineSeparator(), "\n").stripTrailing();
    }
}
