package dev.blanke.ilpatcher.template;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Map;
import java.util.Objects;

import freemarker.core.PlainTextOutputFormat;
import freemarker.template.Configuration;
import freemarker.template.DefaultObjectWrapperBuilder;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import static freemarker.template.Configuration.VERSION_2_3_32;

/**
 * Renders module listings with Apache FreeMarker.
 * <p>
 * Listings are plain text, so no output escaping is applied. Errors inside a template are rethrown instead of being
 * written into the listing, and booleans are rendered as {@code true} and {@code false}.
 *
 * @see <a href="https://freemarker.apache.org/">FreeMarker Java Template Engine</a>
 */
public final class FreeMarkerTemplateEngine implements TemplateEngine {

    /**
     * The name under which templates appear in FreeMarker error messages.
     */
    static final String TEMPLATE_NAME = "module-listing";

    private static final Configuration LISTING_CONFIGURATION = createListingConfiguration();

    private final Configuration configuration;

    public FreeMarkerTemplateEngine() {
        this(LISTING_CONFIGURATION);
    }

    public FreeMarkerTemplateEngine(final Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration);
    }

    private static Configuration createListingConfiguration() {
        final var configuration = new Configuration(VERSION_2_3_32);

        // Records are exposed through their accessor methods, type and method lists as sequences.
        final var objectWrapperBuilder = new DefaultObjectWrapperBuilder(configuration.getIncompatibleImprovements());
        objectWrapperBuilder.setIterableSupport(true);
        configuration.setObjectWrapper(objectWrapperBuilder.build());

        configuration.setOutputFormat(PlainTextOutputFormat.INSTANCE);
        configuration.setWhitespaceStripping(true);
        configuration.setNumberFormat("computer");
        configuration.setBooleanFormat("true,false");

        configuration.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        configuration.setLogTemplateExceptions(false);
        configuration.setWrapUncheckedExceptions(true);
        return configuration;
    }

    @Override
    public void process(final Reader templateReader, final DataModel dataModel, final Writer outputWriter)
            throws IOException, TemplateException {
        try (templateReader) {
            final var template = new Template(TEMPLATE_NAME, templateReader, configuration);
            template.process(Map.of("dataModel", dataModel), outputWriter);
        }
        outputWriter.flush();
    }
}
