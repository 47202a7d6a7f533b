package dev.blanke.ilpatcher.patch;

import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Objects;

import dev.blanke.ilpatcher.module.EcmaModuleReader;
import dev.blanke.ilpatcher.module.MethodDescriptor;
import dev.blanke.ilpatcher.module.ModuleImage;
import dev.blanke.ilpatcher.module.ModuleReader;

/**
 * Replaces the body of a single method inside a module with a body returning the default value of the method's
 * return type.
 * <p>
 * The replacement is written over the original body in place: the body keeps its RVA, and neither metadata nor
 * section layout change. This requires the replacement, a compact header followed by at most three instructions, to
 * be no larger than the span of the original body, which holds for every body except one-byte {@code ret} bodies of
 * non-void methods. Bytes of the span not covered by the replacement are zeroed.
 * <p>
 * Patching is all-or-nothing: every check is performed on the in-memory copy of the input before the output file is
 * written, and the output only ever appears at its final location in complete form.
 *
 * @see MethodBodyLocator
 * @see MethodBodyEncoder
 */
public final class MethodPatcher {

    private static final Logger LOGGER = System.getLogger(MethodPatcher.class.getName());

    private final ModuleReader moduleReader;

    private final MethodBodyLocator locator = new MethodBodyLocator();

    private final MethodBodyEncoder encoder = new MethodBodyEncoder();

    public MethodPatcher() {
        this(new EcmaModuleReader());
    }

    public MethodPatcher(final ModuleReader moduleReader) {
        this.moduleReader = Objects.requireNonNull(moduleReader);
    }

    /**
     * Patches the method {@code typeName::methodName} of the module at {@code modulePath}, writing the resulting
     * module to {@code outputPath}.
     *
     * @param modulePath The module to read. It is fully read and closed before any output is written.
     *
     * @param outputPath The file to write the patched module to, replaced if it exists. May equal
     *                   {@code modulePath} for patching in place.
     *
     * @param typeName The qualified name of the declaring type, e.g. {@code Demo.Sample}.
     *
     * @param methodName The simple name of the method. If the type declares overloads, the first one is patched.
     *
     * @return A description of the applied patch.
     *
     * @throws PatchException If the method cannot be found or patched. No output is written in that case.
     *
     * @throws IOException If the module cannot be read or parsed, or the output cannot be written.
     */
    public PatchResult patch(final Path modulePath, final Path outputPath, final String typeName,
                             final String methodName) throws PatchException, IOException {
        Objects.requireNonNull(typeName);
        Objects.requireNonNull(methodName);

        final var module = moduleReader.open(modulePath);
        final var type = module.findType(typeName).orElseThrow(() ->
            new PatchException(PatchFailure.TYPE_NOT_FOUND, "Type %s not found in %s".formatted(typeName,
                modulePath)));
        final var method = module.findMethod(type, methodName).orElseThrow(() ->
            new PatchException(PatchFailure.METHOD_NOT_FOUND, "Method %s not found in type %s".formatted(methodName,
                typeName)));
        return patch(module, method, outputPath);
    }

    /**
     * Patches a method already resolved from the provided module.
     *
     * @see #patch(Path, Path, String, String)
     */
    public PatchResult patch(final ModuleImage module, final MethodDescriptor method, final Path outputPath)
            throws PatchException, IOException {
        Objects.requireNonNull(outputPath);

        final var location = locator.locate(module, method);
        final var header   = location.header();
        if (header.hasExtraSections())
            throw new PatchException(PatchFailure.HAS_EXCEPTION_HANDLERS,
                "Method %s has exception handling clauses".formatted(method));

        if (method.returnCategory() == null)
            throw new PatchException(PatchFailure.UNSUPPORTED_RETURN,
                "Method %s has an unsupported return type (element type 0x%02X)"
                    .formatted(method, method.returnElementType()));
        final byte[] body = encoder.encode(method.returnCategory());

        if (body.length > header.span())
            throw new PatchException(PatchFailure.BODY_TOO_LARGE,
                "Replacement body of %d bytes does not fit the %d bytes of method %s"
                    .formatted(body.length, header.span(), method));

        final byte[] contents = module.bytes();
        final int start = location.fileOffset();
        final int end   = Math.toIntExact(start + header.span());
        System.arraycopy(body, 0, contents, start, body.length);
        Arrays.fill(contents, start + body.length, end, (byte) 0);

        write(contents, outputPath);
        LOGGER.log(Level.INFO, "Patched {0} to return the default {1} value, written to {2}.", method,
            method.returnCategory(), outputPath);
        return new PatchResult(method, location, body.length, method.returnCategory());
    }

    /**
     * Writes the provided bytes to a temporary file next to {@code outputPath} and moves it into place afterwards.
     */
    private static void write(final byte[] contents, final Path outputPath) throws IOException {
        final var directory = outputPath.toAbsolutePath().getParent();
        Files.createDirectories(directory);

        final var temporary = Files.createTempFile(directory, outputPath.getFileName().toString(), ".tmp");
        try {
            Files.write(temporary, contents);
            try {
                Files.move(temporary, outputPath, StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException exception) {
                LOGGER.log(Level.DEBUG, "Atomic move not supported, replacing {0} non-atomically.", outputPath);
                Files.move(temporary, outputPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temporary);
        }
    }
}
