package dev.blanke.ilpatcher.patch;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import dev.blanke.ilpatcher.module.MethodDescriptor;
import dev.blanke.ilpatcher.module.ModuleImage;
import dev.blanke.ilpatcher.module.SectionHeader;

/**
 * Finds the body of a method inside the file of its module and decodes the body's header.
 */
public final class MethodBodyLocator {

    private static final Logger LOGGER = System.getLogger(MethodBodyLocator.class.getName());

    /**
     * Maps the RVA of the provided method to a file offset using the section table of its module, then parses the
     * body header found there.
     *
     * @param module The module declaring the {@code method}.
     *
     * @param method The method whose body is to be located.
     *
     * @return The file offset and the header of the method body.
     *
     * @throws PatchException With {@link PatchFailure#NO_BODY} if the method has no RVA,
     *                        {@link PatchFailure#OFFSET_MAPPING} if the RVA lies outside of every section, or
     *                        {@link PatchFailure#UNSUPPORTED_BODY} if the header cannot be decoded.
     */
    public BodyLocation locate(final ModuleImage module, final MethodDescriptor method) throws PatchException {
        if (method.rva() == 0)
            throw new PatchException(PatchFailure.NO_BODY, "Method %s has no body".formatted(method));

        final var section = SectionHeader.find(module.sections(), method.rva()).orElseThrow(() ->
            new PatchException(PatchFailure.OFFSET_MAPPING,
                "RVA 0x%X of method %s lies outside of every section".formatted(method.rva(), method)));

        final long fileOffset = section.toFileOffset(method.rva());
        if (fileOffset >= module.length())
            throw new PatchException(PatchFailure.OFFSET_MAPPING,
                "RVA 0x%X of method %s maps past the end of the file".formatted(method.rva(), method));

        final var header = BodyHeader.read(module.contents(), (int) fileOffset);
        LOGGER.log(Level.DEBUG, "Located {0} body of {1} at offset 0x{2} ({3} code bytes).",
            header.encoding(), method, Long.toHexString(fileOffset), header.codeSize());
        return new BodyLocation((int) fileOffset, header);
    }
}
