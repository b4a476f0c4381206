package com.jcomp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class JCompTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        JComp command = new JComp(new PrintStream(out, true, StandardCharsets.UTF_8),
                                  new PrintStream(err, true, StandardCharsets.UTF_8));
        return new CommandLine(command).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    public void testSequenceCompact() {
        int exitCode = run("-c", "x * x for x in 1..=5 if x % 2 == 1");

        assertEquals(0, exitCode);
        assertEquals("[1,9,25]", stdout());
    }

    @Test
    public void testMappingSortedPretty() {
        int exitCode = run("-S", "x: x * x for x in 1..=3");

        assertEquals(0, exitCode);
        assertEquals("{\n  1: 1,\n  2: 4,\n  3: 9\n}", stdout());
    }

    @Test
    public void testStatementPrintsVariables() {
        int exitCode = run("-c", "-D", "n=1", "-D", "s=\"\"", "n *= x; s += str(x); for x in 1..=5");

        assertEquals(0, exitCode);
        assertEquals("{\"n\":120,\"s\":\"12345\"}", stdout());
    }

    @Test
    public void testVariablesFromJsonFile(@TempDir Path dir) throws IOException {
        Path vars = dir.resolve("vars.json");
        Files.writeString(vars, "{\"words\": [\"a\", \"bb\", \"ccc\"]}");

        int exitCode = run("-c", "-S", "w: len(w) for w in words if len(w) > 1", vars.toString());

        assertEquals(0, exitCode);
        assertEquals("{\"bb\":2,\"ccc\":3}", stdout());
    }

    @Test
    public void testTranslationErrorExitsWithOne() {
        int exitCode = run("x if x > 1");

        assertEquals(1, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("MISSING_LOOP_CLAUSE"));
        assertEquals("", stdout());
    }

    @Test
    public void testEvaluationErrorExitsWithOne() {
        int exitCode = run("a for (a, b) in [1, 2]");

        assertEquals(1, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Error: Cannot bind 1"));
    }
}
