package dev.blanke.ilpatcher.patch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.blanke.ilpatcher.cil.ReturnCategory;
import dev.blanke.ilpatcher.module.EcmaModuleReader;
import dev.blanke.ilpatcher.util.CilEvaluator;
import dev.blanke.ilpatcher.util.SampleModule;

import static org.junit.jupiter.api.Assertions.*;

final class MethodPatcherTest {

    @TempDir
    Path directory;

    private MethodPatcher patcher;

    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        patcher = new MethodPatcher();
        input   = SampleModule.builder().write(directory.resolve("Sample.dll"));
    }

    private int fileOffset(final Path module, final String typeName, final String methodName)
            throws IOException, PatchException {
        final var image  = new EcmaModuleReader().open(module);
        final var type   = image.findType(typeName).orElseThrow();
        final var method = image.findMethod(type, methodName).orElseThrow();
        return new MethodBodyLocator().locate(image, method).fileOffset();
    }

    private Optional<Object> evaluate(final Path module, final String methodName, final Object... arguments)
            throws Exception {
        return CilEvaluator.evaluate(Files.readAllBytes(module), fileOffset(module, SampleModule.SAMPLE, methodName),
            arguments);
    }

    @Nested
    final class Success {

        @Test
        void testComputeReturnsZeroAfterPatching() throws Exception {
            final var output = directory.resolve("Patched.dll");
            assertEquals(Optional.of(52), evaluate(input, "Compute", null, 6, 7));

            final var result = patcher.patch(input, output, SampleModule.SAMPLE, "Compute");

            assertEquals(ReturnCategory.INT32, result.returnCategory());
            assertEquals(3, result.bodyLength());
            assertEquals(2, result.method().parameterCount());
            assertEquals(Optional.of(0), evaluate(output, "Compute", null, 6, 7));
        }

        @Test
        void testOnlyMethodBodyChanges() throws Exception {
            final var output = directory.resolve("Patched.dll");
            final var original = Files.readAllBytes(input);

            final var result = patcher.patch(input, output, SampleModule.SAMPLE, "Compute");
            final var patched = Files.readAllBytes(output);

            assertEquals(original.length, patched.length);
            final int start = result.location().fileOffset();
            final int end   = start + (int) result.location().header().span();
            assertArrayEquals(Arrays.copyOfRange(original, 0, start), Arrays.copyOfRange(patched, 0, start));
            assertArrayEquals(Arrays.copyOfRange(original, end, original.length),
                Arrays.copyOfRange(patched, end, patched.length));
            assertFalse(Arrays.equals(Arrays.copyOfRange(original, start, end),
                Arrays.copyOfRange(patched, start, end)));

            // The remainder of the original span is zero-filled.
            for (int index = start + result.bodyLength(); index < end; index++)
                assertEquals(0, patched[index]);
        }

        @Test
        void testPatchInPlace() throws Exception {
            final var length = Files.size(input);

            patcher.patch(input, input, SampleModule.SAMPLE, "Compute");

            assertEquals(length, Files.size(input));
            assertEquals(Optional.of(0), evaluate(input, "Compute", null, 6, 7));
            try (final var files = Files.list(directory)) {
                assertEquals(1, files.count());
            }
        }

        @Test
        void testPatchingIsIdempotent() throws Exception {
            patcher.patch(input, input, SampleModule.SAMPLE, "Compute");
            final var once = Files.readAllBytes(input);

            patcher.patch(input, input, SampleModule.SAMPLE, "Compute");
            assertArrayEquals(once, Files.readAllBytes(input));
        }

        @Test
        void testOutputDirectoryIsCreated() throws Exception {
            final var output = directory.resolve("out").resolve("nested").resolve("Sample.dll");

            patcher.patch(input, output, SampleModule.SAMPLE, "Reset");

            assertTrue(Files.isRegularFile(output));
            assertEquals(Optional.empty(), evaluate(output, "Reset"));
        }

        @Test
        void testExtendedBodyIsReplacedByCompactBody() throws Exception {
            final var output = directory.resolve("Patched.dll");
            assertEquals(Optional.of(2.5), evaluate(input, "Average"));

            final var result = patcher.patch(input, output, SampleModule.SAMPLE, "Average");

            assertEquals(BodyHeader.Encoding.EXTENDED, result.location().header().encoding());
            assertEquals(Optional.of(0.0), evaluate(output, "Average"));
            final var patched = Files.readAllBytes(output);
            final int start = result.location().fileOffset();
            for (int index = start + result.bodyLength(); index < start + 22; index++)
                assertEquals(0, patched[index]);
        }

        @Test
        void testEveryReturnCategory() throws Exception {
            final var output = directory.resolve("Patched.dll");
            Files.copy(input, output);
            for (final var methodName : new String[] { "Reset", "Total", "Ratio", "Handle", "Name" })
                patcher.patch(output, output, SampleModule.SAMPLE, methodName);
            patcher.patch(output, output, SampleModule.GLOBALS, "Get");

            assertEquals(Optional.empty(), evaluate(output, "Reset"));
            assertEquals(Optional.of(0L), evaluate(output, "Total"));
            assertEquals(Optional.of(0.0f), evaluate(output, "Ratio"));
            assertEquals(Optional.of(0L), evaluate(output, "Handle"));
            assertEquals(Optional.of(CilEvaluator.NULL), evaluate(output, "Name", (Object) null));
            assertEquals(Optional.of(CilEvaluator.NULL), CilEvaluator.evaluate(Files.readAllBytes(output),
                fileOffset(output, SampleModule.GLOBALS, "Get")));
        }

        @Test
        void testPatchThroughMethodPointerTable() throws Exception {
            SampleModule.builder().methodPointers().write(input);
            assertEquals(Optional.of(52), evaluate(input, "Compute", null, 6, 7));

            final var result = patcher.patch(input, input, SampleModule.SAMPLE, "Compute");

            assertEquals(2, result.method().parameterCount());
            assertEquals(Optional.of(0), evaluate(input, "Compute", null, 6, 7));
            assertEquals(Optional.of(1.5f), evaluate(input, "Ratio"));
        }

        @Test
        void testOtherMethodsAreUntouched() throws Exception {
            final var output = directory.resolve("Patched.dll");

            patcher.patch(input, output, SampleModule.SAMPLE, "Total");

            assertEquals(Optional.of(52), evaluate(output, "Compute", null, 6, 7));
            assertEquals(Optional.of(1.5f), evaluate(output, "Ratio"));
        }
    }

    @Nested
    final class Failure {

        private Path output;

        @BeforeEach
        void setUp() {
            output = directory.resolve("Patched.dll");
        }

        private void assertFailure(final PatchFailure expected, final String typeName, final String methodName)
                throws IOException {
            final var original = Files.readAllBytes(input);

            final var exception = assertThrows(PatchException.class,
                () -> patcher.patch(input, output, typeName, methodName));

            assertEquals(expected, exception.getFailure());
            assertFalse(Files.exists(output));
            assertArrayEquals(original, Files.readAllBytes(input));
        }

        @Test
        void testTypeNotFound() throws IOException {
            assertFailure(PatchFailure.TYPE_NOT_FOUND, "Demo.Missing", "Compute");
        }

        @Test
        void testMethodNotFound() throws IOException {
            assertFailure(PatchFailure.METHOD_NOT_FOUND, SampleModule.SAMPLE, "Missing");
        }

        @Test
        void testMethodOfAnotherType() throws IOException {
            assertFailure(PatchFailure.METHOD_NOT_FOUND, SampleModule.EMPTY, "Compute");
        }

        @Test
        void testAbstractMethod() throws IOException {
            assertFailure(PatchFailure.NO_BODY, SampleModule.SAMPLE, "Draw");
        }

        @Test
        void testUnmappableRva() throws IOException {
            assertFailure(PatchFailure.OFFSET_MAPPING, SampleModule.SAMPLE, "Detached");
        }

        @Test
        void testExceptionHandlers() throws IOException {
            assertFailure(PatchFailure.HAS_EXCEPTION_HANDLERS, SampleModule.SAMPLE, "Guarded");
        }

        @Test
        void testValueTypeReturn() throws IOException {
            assertFailure(PatchFailure.UNSUPPORTED_RETURN, SampleModule.SAMPLE, "Origin");
        }

        @Test
        void testGenericParameterReturn() throws IOException {
            assertFailure(PatchFailure.UNSUPPORTED_RETURN, SampleModule.SAMPLE, "Identity");
        }

        @Test
        void testBodyTooLarge() throws IOException {
            assertFailure(PatchFailure.BODY_TOO_LARGE, SampleModule.SAMPLE, "Answer");
        }

        @Test
        void testInPlaceFailureLeavesModuleUnchanged() throws IOException {
            final var original = Files.readAllBytes(input);

            assertThrows(PatchException.class, () -> patcher.patch(input, input, SampleModule.SAMPLE, "Guarded"));

            assertArrayEquals(original, Files.readAllBytes(input));
        }
    }
}
