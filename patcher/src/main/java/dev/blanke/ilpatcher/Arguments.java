package dev.blanke.ilpatcher;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;

import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Encapsulates the command-line arguments that can be passed to the {@code patch} command.
 */
public final class Arguments {

    //region Input/output
    @Parameters(
        index       = "0",
        description = "The .dll or .exe module containing the method to be patched.")
    private Path input;

    public @NotNull Path getInput() {
        return input;
    }

    @Option(
        names       = { "-o", "--output" },
        description = "Write the patched module to file instead of manipulating input in place.")
    private Path output;

    /**
     * Returns the {@link Path} to which the patched module should be written.
     *
     * @return {@link #output} if the option was given on the command line, otherwise {@link #input} for in-place
     *         patching.
     */
    public @NotNull Path getOutput() {
        return (output != null) ? output : input;
    }
    //endregion

    //region Target method
    @Option(
        names       = { "-t", "--type" },
        description = """
            Qualified name of the type declaring the method, e.g. 'Demo.Sample'.
            Nested types are addressed by their simple name.""",
        paramLabel  = "<type>",
        required    = true)
    private String typeName;

    public @NotNull String getTypeName() {
        return typeName;
    }

    @Option(
        names       = { "-m", "--method" },
        description = """
            Simple name of the method whose body should be replaced, e.g. 'Compute'.
            If the type declares several overloads, the first one is patched.""",
        paramLabel  = "<method>",
        required    = true)
    private String methodName;

    public @NotNull String getMethodName() {
        return methodName;
    }
    //endregion
}
