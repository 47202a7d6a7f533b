package dev.blanke.ilpatcher.template;

import java.io.Reader;
import java.io.Writer;

/**
 * A {@code TemplateEngine} allows the combination of a template file with a {@link DataModel} in order to produce a
 * textual listing of a module.
 */
public interface TemplateEngine {

    /**
     * Combines the provided template and {@code dataModel}, writing the processed output to the
     * {@code outputWriter}.
     *
     * @param templateReader The template to populate. Its syntax is implementation-dependent.
     *
     * @param dataModel Encapsulation of fields which can be accessed within the template.
     *
     * @param outputWriter A writer to which the processed output should be written.
     *
     * @throws Exception if an exception occurs reading or populating the template.
     */
    void process(Reader templateReader, DataModel dataModel, Writer outputWriter) throws Exception;
}
