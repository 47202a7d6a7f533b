package dev.blanke.ilpatcher;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import dev.blanke.ilpatcher.module.EcmaModuleReader;
import dev.blanke.ilpatcher.module.ModuleReader;
import dev.blanke.ilpatcher.patch.MethodBodyLocator;
import dev.blanke.ilpatcher.template.DataModel;
import dev.blanke.ilpatcher.template.FreeMarkerTemplateEngine;
import dev.blanke.ilpatcher.template.TemplateEngine;

/**
 * Lists the types and methods of a module by rendering a {@link DataModel} through a template.
 */
@Command(
    name                     = "inspect",
    mixinStandardHelpOptions = true,
    description              = "Lists the types and methods of a module along with their body headers.")
public final class InspectCommand implements Callable<Integer> {

    @Parameters(
        index       = "0",
        description = "The .dll or .exe module to list.")
    private Path input;

    @Option(
        names       = "--template",
        description = """
            Apache FreeMarker template file used to render the listing.
            The module's types and methods are passed to the template as 'dataModel'.
            Defaults to the standard template packaged with the JAR if unspecified.
            """,
        paramLabel  = "<file>")
    private Path template;

    @Spec
    private CommandSpec spec;

    private final ModuleReader moduleReader = new EcmaModuleReader();

    private final TemplateEngine templateEngine = new FreeMarkerTemplateEngine();

    @Override
    public Integer call() throws Exception {
        final var module = moduleReader.open(input);
        templateEngine.process(getTemplateReader(), DataModel.of(module, new MethodBodyLocator()),
            spec.commandLine().getOut());
        return 0;
    }

    private Reader getTemplateReader() throws IOException {
        if (template != null)
            return Files.newBufferedReader(template);

        final var templateStream = Objects.requireNonNull(getClass().getResourceAsStream("/module-listing.ftl"));
        return new BufferedReader(new InputStreamReader(templateStream, StandardCharsets.UTF_8));
    }
}
