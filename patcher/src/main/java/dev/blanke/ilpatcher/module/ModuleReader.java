package dev.blanke.ilpatcher.module;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A {@code ModuleReader} opens binary modules and exposes their section table and type and method definitions as a
 * {@link ModuleImage}.
 */
public interface ModuleReader {

    /**
     * Reads the module located at the provided {@code path} completely into memory.
     * <p>
     * The file is closed before this method returns, so the returned {@link ModuleImage} holds no file handle.
     *
     * @param path The path of the module to open.
     *
     * @return The parsed module.
     *
     * @throws java.nio.file.NoSuchFileException If no file exists at {@code path}.
     *
     * @throws ModuleFormatException If the file is not a well-formed CLI module.
     *
     * @throws IOException If reading the file fails for any other reason.
     */
    ModuleImage open(Path path) throws IOException;
}
