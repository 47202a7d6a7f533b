package dev.blanke.ilpatcher;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.intellij.lang.annotations.Language;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import dev.blanke.ilpatcher.util.SampleModule;

import static org.junit.jupiter.api.Assertions.*;

final class ILPatcherTest {

    @TempDir
    Path directory;

    private Path input;

    private StringWriter out;

    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        input = SampleModule.builder().write(directory.resolve("Sample.dll"));
        out   = new StringWriter();
        err   = new StringWriter();
    }

    private int execute(final String... args) {
        final var commandLine = new CommandLine(new ILPatcher());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void testMissingSubcommand() {
        assertEquals(CommandLine.ExitCode.USAGE, execute());
        assertTrue(err.toString().contains("Missing required subcommand"));
    }

    @Nested
    final class Patch {

        @Test
        void testPatchToOutputFile() throws IOException {
            final var output = directory.resolve("Patched.dll");
            final var original = Files.readAllBytes(input);

            assertEquals(0, execute("patch", input.toString(), "-o", output.toString(), "-t", SampleModule.SAMPLE,
                "-m", "Compute"));

            assertTrue(out.toString().startsWith("Patched Demo.Sample::Compute (compact header at offset 0x"));
            assertTrue(out.toString().contains("3 of 8 bytes rewritten) to return the default INT32 value."));
            assertEquals("", err.toString());
            assertArrayEquals(original, Files.readAllBytes(input));
            assertEquals(original.length, Files.size(output));
        }

        @Test
        void testPatchInPlace() throws IOException {
            final var original = Files.readAllBytes(input);

            assertEquals(0, execute("patch", input.toString(), "--type", SampleModule.SAMPLE, "--method", "Average"));

            assertTrue(out.toString().contains("extended header"));
            assertTrue(out.toString().contains("4 of 22 bytes rewritten"));
            assertFalse(Arrays.equals(original, Files.readAllBytes(input)));
        }

        @Test
        void testFailureIsReported() throws IOException {
            final var output = directory.resolve("Patched.dll");

            assertEquals(1, execute("patch", input.toString(), "-o", output.toString(), "-t", SampleModule.SAMPLE,
                "-m", "Guarded"));

            assertEquals("", out.toString());
            assertTrue(err.toString().startsWith("Cannot patch Demo.Sample::Guarded (HAS_EXCEPTION_HANDLERS): "));
            assertFalse(Files.exists(output));
        }

        @Test
        void testTypeNotFound() {
            assertEquals(1, execute("patch", input.toString(), "-t", "Sample", "-m", "Compute"));
            assertTrue(err.toString().contains("(TYPE_NOT_FOUND)"));
        }

        @Test
        void testMissingMethodOption() {
            assertEquals(CommandLine.ExitCode.USAGE, execute("patch", input.toString(), "-t", SampleModule.SAMPLE));
            assertTrue(err.toString().contains("--method"));
        }

        @Test
        void testMalformedModule() throws IOException {
            final var corrupt = Files.write(directory.resolve("Corrupt.dll"), new byte[] { 'M', 'Z', 0, 0 });

            assertEquals(CommandLine.ExitCode.SOFTWARE, execute("patch", corrupt.toString(), "-t",
                SampleModule.SAMPLE, "-m", "Compute"));
        }
    }

    @Nested
    final class Inspect {

        @Test
        void testDefaultTemplate() {
            assertEquals(0, execute("inspect", input.toString()));

            final var listing = out.toString();
            assertTrue(listing.startsWith("Module Sample.dll"));
            assertTrue(listing.contains("\nDemo.Sample\n"));
            assertTrue(listing.contains("  Compute/2 : INT32 @ 0x"));
            assertTrue(listing.contains("[compact header, 7 code bytes]"));
            assertTrue(listing.contains("  static Average/0 : FLOAT64 @ 0x"));
            assertTrue(listing.contains("[extended header, 10 code bytes]"));
            assertTrue(listing.contains("[extended header, 3 code bytes, exception handlers]"));
            assertTrue(listing.contains("  static Origin/0 : unsupported VALUETYPE (0x11) @ 0x"));
            assertTrue(listing.contains("  Draw/0 : VOID @ 0x00000000 [NO_BODY]"));
            assertTrue(listing.contains("  static Detached/0 : VOID @ 0x00009000 [OFFSET_MAPPING]"));
            assertTrue(listing.contains("\nDemo.Empty\n  (no methods)"));
        }

        @Test
        void testCustomTemplate() throws IOException {
            @Language("FTL")
            final var template = "<#list dataModel.types() as type>"
                + "<#if type.methods()?has_content>${type.name()}=${type.methods()?size};</#if>"
                + "</#list>";
            final var templatePath = Files.writeString(directory.resolve("count.ftl"), template);

            assertEquals(0, execute("inspect", input.toString(), "--template", templatePath.toString()));

            assertEquals("Demo.Sample=14;Globals=1;", out.toString());
        }

        @Test
        void testMissingModule() {
            final var missing = directory.resolve("Missing.dll");

            assertEquals(CommandLine.ExitCode.SOFTWARE, execute("inspect", missing.toString()));
            assertTrue(err.toString().contains("Missing.dll"));
        }
    }
}
