package dev.blanke.ilpatcher;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * The {@code ILPatcher} class serves as the entry point to the command-line tool via {@link #main(String...)}.
 * <p>
 * The actual work is done by its subcommands: {@link PatchCommand} replaces the body of a method inside a module with
 * a body returning a default value, while {@link InspectCommand} lists the types and methods of a module along with
 * whether their bodies could be patched.
 */
@Command(
    name                     = "ilpatcher",
    mixinStandardHelpOptions = true,
    description              = "Patches method bodies of CLI modules in place.",
    subcommands              = { PatchCommand.class, InspectCommand.class })
public final class ILPatcher implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    /**
     * Launches the tool by delegating command-line argument parsing to Picocli, running the selected subcommand, and
     * exiting with the returned exit code.
     *
     * @param args The command-line arguments.
     */
    public static void main(final String... args) {
        final int exitCode = new CommandLine(new ILPatcher()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
