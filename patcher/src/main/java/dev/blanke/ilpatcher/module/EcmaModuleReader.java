package dev.blanke.ilpatcher.module;

import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads CLI modules stored in a PE32 or PE32+ container as laid out by ECMA-335, Partition II.
 * <p>
 * Parsing proceeds from the outside in: the DOS header leads to the PE signature and the COFF file header, whose
 * optional header holds the data directory pointing to the CLI header. The CLI header in turn locates the metadata
 * root, whose stream headers locate the table stream and the heaps. From the tables, only {@code TypeDef} and
 * {@code MethodDef} rows are materialized.
 * <p>
 * Nested types are listed under their simple name with an empty namespace, as the {@code NestedClass} table is not
 * consulted.
 */
public final class EcmaModuleReader implements ModuleReader {

    private static final Logger LOGGER = System.getLogger(EcmaModuleReader.class.getName());

    // region PE constants
    private static final int DOS_SIGNATURE      = 0x5A4D;     // "MZ"
    private static final int PE_SIGNATURE       = 0x00004550; // "PE\0\0"
    private static final int PE_OFFSET_POSITION = 0x3C;

    private static final int COFF_HEADER_SIZE = 20;

    private static final int PE32_MAGIC      = 0x10B;
    private static final int PE32_PLUS_MAGIC = 0x20B;

    private static final int CLI_HEADER_DIRECTORY = 14;

    private static final int SECTION_HEADER_SIZE = 40;
    // endregion

    private static final int METADATA_SIGNATURE = 0x424A5342; // "BSJB"

    @Override
    public ModuleImage open(final Path path) throws IOException {
        final byte[] bytes = Files.readAllBytes(path);
        try {
            return parse(path, bytes);
        } catch (final IndexOutOfBoundsException exception) {
            throw new ModuleFormatException("Unexpected end of module " + path, exception);
        }
    }

    private static ModuleImage parse(final Path path, final byte[] bytes) throws ModuleFormatException {
        final var buffer = ByteBuffer.wrap(bytes).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);

        if ((bytes.length < PE_OFFSET_POSITION + 4) || (unsignedShort(buffer, 0) != DOS_SIGNATURE))
            throw new ModuleFormatException("Missing DOS header in " + path);

        final int peOffset = buffer.getInt(PE_OFFSET_POSITION);
        if ((peOffset < 0) || (buffer.getInt(peOffset) != PE_SIGNATURE))
            throw new ModuleFormatException("Missing PE signature in " + path);

        final int coffOffset           = peOffset + 4;
        final int numberOfSections     = unsignedShort(buffer, coffOffset + 2);
        final int sizeOfOptionalHeader = unsignedShort(buffer, coffOffset + 16);
        final int optionalOffset       = coffOffset + COFF_HEADER_SIZE;

        final int magic = unsignedShort(buffer, optionalOffset);
        final int numberOfRvaAndSizesOffset;
        final int dataDirectoriesOffset;
        switch (magic) {
            case PE32_MAGIC -> {
                numberOfRvaAndSizesOffset = 92;
                dataDirectoriesOffset     = 96;
            }
            case PE32_PLUS_MAGIC -> {
                numberOfRvaAndSizesOffset = 108;
                dataDirectoriesOffset     = 112;
            }
            default -> throw new ModuleFormatException(
                "Unknown optional header magic 0x%X in %s".formatted(magic, path));
        }
        final int numberOfRvaAndSizes = buffer.getInt(optionalOffset + numberOfRvaAndSizesOffset);
        if (numberOfRvaAndSizes <= CLI_HEADER_DIRECTORY)
            throw new ModuleFormatException("Not a CLI module (no CLI header directory): " + path);

        final int cliHeaderRva = buffer.getInt(optionalOffset + dataDirectoriesOffset + CLI_HEADER_DIRECTORY * 8);
        if (cliHeaderRva == 0)
            throw new ModuleFormatException("Not a CLI module (empty CLI header directory): " + path);

        final var sections = readSections(buffer, optionalOffset + sizeOfOptionalHeader, numberOfSections);
        LOGGER.log(Level.DEBUG, "Read {0} section headers from {1}.", sections.size(), path);

        final int cliHeaderOffset = toFileOffset(sections, cliHeaderRva, "CLI header");
        final int metadataOffset  = toFileOffset(sections, buffer.getInt(cliHeaderOffset + 8), "metadata root");

        if (buffer.getInt(metadataOffset) != METADATA_SIGNATURE)
            throw new ModuleFormatException("Invalid metadata signature in " + path);

        final var streams = readStreamHeaders(buffer, metadataOffset);
        final var tableStream = streams.containsKey("#~") ? streams.get("#~") : streams.get("#-");
        final var stringHeap  = streams.get("#Strings");
        final var blobHeap    = streams.get("#Blob");
        if ((tableStream == null) || (stringHeap == null) || (blobHeap == null))
            throw new ModuleFormatException("Missing metadata streams in %s (found %s)".formatted(path,
                streams.keySet()));

        final var tables = new MetadataTables(buffer, metadataOffset + tableStream.offset(), tableStream.size(),
            metadataOffset + stringHeap.offset(), stringHeap.size(),
            metadataOffset + blobHeap.offset(), blobHeap.size());

        final var types   = new ArrayList<TypeEntry>();
        final var methods = new ArrayList<MethodDescriptor>();
        readDefinitions(tables, types, methods);

        LOGGER.log(Level.DEBUG, "Read {0} types and {1} methods from {2}.", types.size(), methods.size(), path);
        return new ModuleImage(path, bytes, sections, types, methods);
    }

    private static List<SectionHeader> readSections(final ByteBuffer buffer, final int offset,
                                                    final int numberOfSections) {
        final var sections = new ArrayList<SectionHeader>(numberOfSections);
        for (int index = 0; index < numberOfSections; index++) {
            final int position = offset + index * SECTION_HEADER_SIZE;

            final var nameBytes = new byte[8];
            buffer.get(position, nameBytes);
            int nameLength = 0;
            while ((nameLength < nameBytes.length) && (nameBytes[nameLength] != 0))
                nameLength++;

            sections.add(new SectionHeader(
                new String(nameBytes, 0, nameLength, StandardCharsets.US_ASCII),
                buffer.getInt(position + 12),
                buffer.getInt(position + 8),
                buffer.getInt(position + 16),
                buffer.getInt(position + 20)));
        }
        return sections;
    }

    private static int toFileOffset(final List<SectionHeader> sections, final int rva, final String structure)
            throws ModuleFormatException {
        final var section = SectionHeader.find(sections, rva).orElseThrow(() ->
            new ModuleFormatException("RVA 0x%X of the %s lies outside of every section".formatted(rva, structure)));
        final long offset = section.toFileOffset(rva);
        if (offset > Integer.MAX_VALUE)
            throw new ModuleFormatException("File offset of the %s is out of range".formatted(structure));
        return (int) offset;
    }

    private record StreamHeader(int offset, int size) {}

    /**
     * Reads the stream headers following the variable-length version string of the metadata root.
     *
     * @return The stream headers by name, with offsets relative to the metadata root.
     */
    private static Map<String, StreamHeader> readStreamHeaders(final ByteBuffer buffer, final int metadataOffset) {
        final int versionLength = buffer.getInt(metadataOffset + 12);

        // Skip the version string and the flags, which are reserved.
        int position = metadataOffset + 16 + versionLength + 2;
        final int streamCount = unsignedShort(buffer, position);
        position += 2;

        final var streams = new HashMap<String, StreamHeader>();
        for (int index = 0; index < streamCount; index++) {
            final int offset = buffer.getInt(position);
            final int size   = buffer.getInt(position + 4);
            position += 8;

            final var name = new StringBuilder();
            byte character;
            while ((character = buffer.get(position + name.length())) != 0)
                name.append((char) character);

            // The name is NUL-terminated and padded to the next 4-byte boundary.
            position += (name.length() + 4) & ~3;
            streams.putIfAbsent(name.toString(), new StreamHeader(offset, size));
        }
        return streams;
    }

    private static void readDefinitions(final MetadataTables tables, final List<TypeEntry> types,
                                        final List<MethodDescriptor> methods) throws ModuleFormatException {
        final int typeCount = tables.rowCount(MetadataTables.TYPE_DEF);
        final int methodListEnd = tables.methodListLength() + 1;

        final var typeDefs = new ArrayList<MetadataTables.TypeDefRow>(typeCount);
        for (int row = 1; row <= typeCount; row++)
            typeDefs.add(tables.typeDef(row));

        for (int row = 1; row <= typeCount; row++) {
            final var typeDef = typeDefs.get(row - 1);

            // A type owns the methods up to the start of the next type's list, the last one up to the table end.
            final int start = Math.max(1, typeDef.methodList());
            final int end   = (row < typeCount)
                ? Math.min(typeDefs.get(row).methodList(), methodListEnd)
                : methodListEnd;

            final var typeName    = qualify(typeDef.namespace(), typeDef.name());
            final int firstMethod = methods.size();
            for (int index = start; index < end; index++) {
                final int methodRow = tables.methodDefRow(index);
                methods.add(toDescriptor(typeName, methodRow, tables.methodDef(methodRow)));
            }
            types.add(new TypeEntry(row, typeDef.flags(), typeDef.namespace(), typeDef.name(), firstMethod,
                methods.size() - firstMethod));
        }
    }

    private static MethodDescriptor toDescriptor(final String typeName, final int row,
                                                 final MetadataTables.MethodDefRow methodDef)
            throws ModuleFormatException {
        final SignatureReader.MethodSignature signature;
        try {
            signature = new SignatureReader(methodDef.signature()).readMethodSignature();
        } catch (final ModuleFormatException exception) {
            throw new ModuleFormatException(
                "Malformed signature of %s::%s".formatted(typeName, methodDef.name()), exception);
        }
        return new MethodDescriptor(typeName, methodDef.name(), row, methodDef.rva(), methodDef.flags(),
            methodDef.implFlags(), signature.genericParameterCount(), signature.parameterCount(),
            signature.returnElementType(), signature.returnCategory());
    }

    private static String qualify(final String namespace, final String name) {
        return namespace.isEmpty() ? name : namespace + '.' + name;
    }

    private static int unsignedShort(final ByteBuffer buffer, final int offset) {
        return Short.toUnsignedInt(buffer.getShort(offset));
    }
}
