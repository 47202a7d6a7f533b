package dev.blanke.ilpatcher;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import dev.blanke.ilpatcher.patch.MethodPatcher;
import dev.blanke.ilpatcher.patch.PatchException;

/**
 * Replaces the body of a single method with one returning the default value of its return type.
 * <p>
 * A summary of the applied patch is printed to standard output. If the method cannot be patched, the reason is
 * printed to standard error and the command exits with code {@code 1}, leaving the output untouched.
 */
@Command(
    name                     = "patch",
    mixinStandardHelpOptions = true,
    description              = "Replaces a method body with one returning the default value of its return type.")
public final class PatchCommand implements Callable<Integer> {

    /**
     * The parsed command-line arguments.
     *
     * @implNote The {@code @Mixin} annotation allows this class to define {@link #call()} while keeping the fields
     *           representing options and parameters in the {@link Arguments} class.
     */
    @Mixin
    private Arguments arguments = new Arguments();

    @Spec
    private CommandSpec spec;

    private final MethodPatcher patcher = new MethodPatcher();

    @Override
    public Integer call() throws Exception {
        try {
            final var result = patcher.patch(arguments.getInput(), arguments.getOutput(), arguments.getTypeName(),
                arguments.getMethodName());

            final var location = result.location();
            spec.commandLine().getOut().printf("""
                Patched %s (%s header at offset 0x%X, %d of %d bytes rewritten) to return the default %s value.
                """, result.method(), location.header().encoding().name().toLowerCase(), location.fileOffset(),
                result.bodyLength(), location.header().span(), result.returnCategory());
            spec.commandLine().getOut().flush();
            return 0;
        } catch (final PatchException exception) {
            spec.commandLine().getErr().printf("Cannot patch %s::%s (%s): %s%n", arguments.getTypeName(),
                arguments.getMethodName(), exception.getFailure(), exception.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }
}
