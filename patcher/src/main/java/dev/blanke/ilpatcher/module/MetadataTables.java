package dev.blanke.ilpatcher.module;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Provides row-level access to the {@code #~} (or uncompressed {@code #-}) table stream of a module along with the
 * string and blob heaps its rows index into.
 * <p>
 * Only the tables required to enumerate type and method definitions are decoded. Row sizes of all tables stored
 * before {@code MethodDef} are nevertheless computed, as they determine where each table starts.
 */
final class MetadataTables {

    // region Table numbers (ECMA-335, II.22)
    static final int MODULE       = 0x00;
    static final int TYPE_REF     = 0x01;
    static final int TYPE_DEF     = 0x02;
    static final int FIELD_PTR    = 0x03;
    static final int FIELD        = 0x04;
    static final int METHOD_PTR   = 0x05;
    static final int METHOD_DEF   = 0x06;
    static final int PARAM_PTR    = 0x07;
    static final int PARAM        = 0x08;
    static final int MODULE_REF   = 0x1A;
    static final int TYPE_SPEC    = 0x1B;
    static final int ASSEMBLY_REF = 0x23;

    private static final int TABLE_COUNT = 64;
    // endregion

    // region HeapSizes flags
    private static final int WIDE_STRING_INDEXES = 0x01;
    private static final int WIDE_GUID_INDEXES   = 0x02;
    private static final int WIDE_BLOB_INDEXES   = 0x04;
    private static final int EXTRA_DATA          = 0x40;
    // endregion

    /**
     * The raw values of a {@code TypeDef} row, with heap indexes already resolved.
     *
     * @param methodList The 1-based index of the first method, into {@code MethodPtr} if present, otherwise into
     *                   {@code MethodDef}.
     */
    record TypeDefRow(int flags, String name, String namespace, int methodList) {}

    record MethodDefRow(int rva, int implFlags, int flags, String name, byte[] signature) {}

    private final ByteBuffer buffer;

    private final int stringHeapOffset;
    private final int stringHeapSize;

    private final int blobHeapOffset;
    private final int blobHeapSize;

    private final int[] rowCounts = new int[TABLE_COUNT];

    private final int stringIndexSize;
    private final int guidIndexSize;
    private final int blobIndexSize;

    private final int typeDefOffset;
    private final int typeDefRowSize;

    private final int methodPtrOffset;
    private final int methodPtrRowSize;

    private final int methodDefOffset;
    private final int methodDefRowSize;

    /**
     * @param buffer A little-endian buffer over the complete module.
     *
     * @param tablesOffset The file offset of the table stream.
     *
     * @param tablesSize The size of the table stream as declared by its stream header.
     *
     * @param stringHeapOffset The file offset of the {@code #Strings} heap.
     *
     * @param blobHeapOffset The file offset of the {@code #Blob} heap.
     *
     * @throws ModuleFormatException If a row count is negative or the tables extend past the end of the stream.
     */
    MetadataTables(final ByteBuffer buffer, final int tablesOffset, final int tablesSize, final int stringHeapOffset,
                   final int stringHeapSize, final int blobHeapOffset, final int blobHeapSize)
            throws ModuleFormatException {
        this.buffer           = buffer;
        this.stringHeapOffset = stringHeapOffset;
        this.stringHeapSize   = stringHeapSize;
        this.blobHeapOffset   = blobHeapOffset;
        this.blobHeapSize     = blobHeapSize;

        /*
         * Table stream header: reserved (4), major version (1), minor version (1), heap sizes (1), reserved (1),
         * valid mask (8), sorted mask (8), followed by one row count per present table.
         */
        final int heapSizes = Byte.toUnsignedInt(buffer.get(tablesOffset + 6));
        final long valid    = buffer.getLong(tablesOffset + 8);

        int position = tablesOffset + 24;
        for (int table = 0; table < TABLE_COUNT; table++) {
            if (((valid >>> table) & 1) != 0) {
                rowCounts[table] = buffer.getInt(position);
                if (rowCounts[table] < 0)
                    throw new ModuleFormatException("Negative row count %d of table 0x%02X".formatted(
                        rowCounts[table], table));
                position += 4;
            }
        }
        if ((heapSizes & EXTRA_DATA) != 0)
            position += 4;

        stringIndexSize = ((heapSizes & WIDE_STRING_INDEXES) != 0) ? 4 : 2;
        guidIndexSize   = ((heapSizes & WIDE_GUID_INDEXES)   != 0) ? 4 : 2;
        blobIndexSize   = ((heapSizes & WIDE_BLOB_INDEXES)   != 0) ? 4 : 2;

        final int resolutionScopeSize = codedIndexSize(2, MODULE, MODULE_REF, ASSEMBLY_REF, TYPE_REF);
        final int typeDefOrRefSize    = codedIndexSize(2, TYPE_DEF, TYPE_REF, TYPE_SPEC);
        final int fieldListSize       = listIndexSize(FIELD_PTR, FIELD);
        final int methodListSize      = listIndexSize(METHOD_PTR, METHOD_DEF);
        final int paramListSize       = listIndexSize(PARAM_PTR, PARAM);

        final int[] rowSizes = new int[METHOD_DEF + 1];
        rowSizes[MODULE]     = 2 + stringIndexSize + 3 * guidIndexSize;
        rowSizes[TYPE_REF]   = resolutionScopeSize + 2 * stringIndexSize;
        rowSizes[TYPE_DEF]   = 4 + 2 * stringIndexSize + typeDefOrRefSize + fieldListSize + methodListSize;
        rowSizes[FIELD_PTR]  = simpleIndexSize(FIELD);
        rowSizes[FIELD]      = 2 + stringIndexSize + blobIndexSize;
        rowSizes[METHOD_PTR] = simpleIndexSize(METHOD_DEF);
        rowSizes[METHOD_DEF] = 4 + 2 + 2 + stringIndexSize + blobIndexSize + paramListSize;

        // Tables are stored back to back in table number order.
        final long tablesEnd = Integer.toUnsignedLong(tablesOffset) + Integer.toUnsignedLong(tablesSize);
        final int[] tableOffsets = new int[METHOD_DEF + 1];
        long tableOffset = position;
        for (int table = 0; table <= METHOD_DEF; table++) {
            tableOffsets[table] = (int) tableOffset;
            tableOffset += (long) rowSizes[table] * rowCounts[table];
            if (tableOffset > tablesEnd)
                throw new ModuleFormatException("Table 0x%02X with %d rows extends past the table stream".formatted(
                    table, rowCounts[table]));
        }
        typeDefOffset    = tableOffsets[TYPE_DEF];
        typeDefRowSize   = rowSizes[TYPE_DEF];
        methodPtrOffset  = tableOffsets[METHOD_PTR];
        methodPtrRowSize = rowSizes[METHOD_PTR];
        methodDefOffset  = tableOffsets[METHOD_DEF];
        methodDefRowSize = rowSizes[METHOD_DEF];
    }

    int rowCount(final int table) {
        return rowCounts[table];
    }

    boolean hasMethodPtrTable() {
        return rowCounts[METHOD_PTR] > 0;
    }

    /**
     * Returns the number of entries addressable by {@link TypeDefRow#methodList()}.
     */
    int methodListLength() {
        return hasMethodPtrTable() ? rowCounts[METHOD_PTR] : rowCounts[METHOD_DEF];
    }

    TypeDefRow typeDef(final int row) throws ModuleFormatException {
        final var cursor = new Cursor(rowOffset(TYPE_DEF, typeDefOffset, typeDefRowSize, row));
        final int flags        = cursor.next(4);
        final var name         = string(cursor.next(stringIndexSize));
        final var namespace    = string(cursor.next(stringIndexSize));
        cursor.skip(codedIndexSize(2, TYPE_DEF, TYPE_REF, TYPE_SPEC)); // Extends
        cursor.skip(listIndexSize(FIELD_PTR, FIELD));                   // FieldList
        final int methodList   = cursor.next(listIndexSize(METHOD_PTR, METHOD_DEF));
        return new TypeDefRow(flags, name, namespace, methodList);
    }

    /**
     * Resolves a position of a type's method list to a {@code MethodDef} row, following the {@code MethodPtr}
     * indirection of uncompressed table streams.
     */
    int methodDefRow(final int methodListIndex) throws ModuleFormatException {
        if (!hasMethodPtrTable())
            return methodListIndex;
        return new Cursor(rowOffset(METHOD_PTR, methodPtrOffset, methodPtrRowSize, methodListIndex))
            .next(simpleIndexSize(METHOD_DEF));
    }

    MethodDefRow methodDef(final int row) throws ModuleFormatException {
        final var cursor = new Cursor(rowOffset(METHOD_DEF, methodDefOffset, methodDefRowSize, row));
        final int rva       = cursor.next(4);
        final int implFlags = cursor.next(2);
        final int flags     = cursor.next(2);
        final var name      = string(cursor.next(stringIndexSize));
        final var signature = blob(cursor.next(blobIndexSize));
        return new MethodDefRow(rva, implFlags, flags, name, signature);
    }

    private int rowOffset(final int table, final int tableOffset, final int rowSize, final int row)
            throws ModuleFormatException {
        if ((row < 1) || (row > rowCounts[table]))
            throw new ModuleFormatException("Row %d of table 0x%02X does not exist".formatted(row, table));
        return tableOffset + (row - 1) * rowSize;
    }

    // region Heaps
    /**
     * Reads the {@code NUL}-terminated UTF-8 string starting at the provided offset into the {@code #Strings} heap.
     */
    String string(final int index) throws ModuleFormatException {
        if ((index < 0) || (index >= stringHeapSize))
            throw new ModuleFormatException("String heap index 0x%X out of range".formatted(index));
        final int start = stringHeapOffset + index;
        final int limit = stringHeapOffset + stringHeapSize;

        int end = start;
        while ((end < limit) && (buffer.get(end) != 0))
            end++;

        final var bytes = new byte[end - start];
        buffer.get(start, bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Reads the blob starting at the provided offset into the {@code #Blob} heap, decoding its compressed length
     * prefix.
     */
    byte[] blob(final int index) throws ModuleFormatException {
        if ((index < 0) || (index >= blobHeapSize))
            throw new ModuleFormatException("Blob heap index 0x%X out of range".formatted(index));
        int position = blobHeapOffset + index;

        final int first = Byte.toUnsignedInt(buffer.get(position));
        final int length;
        if ((first & 0x80) == 0) {
            length = first;
            position += 1;
        } else if ((first & 0xC0) == 0x80) {
            length = ((first & 0x3F) << 8) | Byte.toUnsignedInt(buffer.get(position + 1));
            position += 2;
        } else if ((first & 0xE0) == 0xC0) {
            length = ((first & 0x1F) << 24)
                | (Byte.toUnsignedInt(buffer.get(position + 1)) << 16)
                | (Byte.toUnsignedInt(buffer.get(position + 2)) << 8)
                |  Byte.toUnsignedInt(buffer.get(position + 3));
            position += 4;
        } else {
            throw new ModuleFormatException("Invalid blob length prefix 0x%02X".formatted(first));
        }
        if (position + length > blobHeapOffset + blobHeapSize)
            throw new ModuleFormatException("Blob at heap index 0x%X exceeds the heap".formatted(index));

        final var bytes = new byte[length];
        buffer.get(position, bytes);
        return bytes;
    }
    // endregion

    // region Index sizes (ECMA-335, II.24.2.6)
    private int simpleIndexSize(final int table) {
        return (rowCounts[table] < 0x10000) ? 2 : 4;
    }

    /**
     * Returns the size of an index into a member list ({@code FieldList}, {@code MethodList}, {@code ParamList}),
     * which points into the pointer table instead of the target table whenever the former is present.
     */
    private int listIndexSize(final int pointerTable, final int table) {
        return simpleIndexSize((rowCounts[pointerTable] > 0) ? pointerTable : table);
    }

    private int codedIndexSize(final int tagBits, final int... tables) {
        final int maxRowCount = Arrays.stream(tables).map(table -> rowCounts[table]).max().orElse(0);
        return (maxRowCount < (1 << (16 - tagBits))) ? 2 : 4;
    }
    // endregion

    /**
     * Reads the columns of a single row one after the other.
     */
    private final class Cursor {

        private int position;

        private Cursor(final int position) {
            this.position = position;
        }

        private int next(final int size) {
            final int value = switch (size) {
                case 2  -> Short.toUnsignedInt(buffer.getShort(position));
                case 4  -> buffer.getInt(position);
                default -> throw new IllegalArgumentException("Unsupported column size %d".formatted(size));
            };
            position += size;
            return value;
        }

        private void skip(final int size) {
            position += size;
        }
    }
}
