package dev.blanke.ilpatcher.patch;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * The header preceding the instruction stream of a method body (ECMA-335, II.25.4).
 *
 * @param encoding Whether the header is the one-byte compact (tiny) form or the twelve-byte extended (fat) form.
 *
 * @param headerSize The size of the header in bytes.
 *
 * @param codeSize The size of the instruction stream following the header in bytes.
 *
 * @param flags The header flags, only meaningful for the {@link Encoding#EXTENDED} encoding.
 */
public record BodyHeader(Encoding encoding, int headerSize, int codeSize, int flags) {

    public enum Encoding {
        COMPACT,
        EXTENDED
    }

    static final int COMPACT_TAG  = 0x2;
    static final int EXTENDED_TAG = 0x3;

    private static final int TAG_MASK = 0x3;

    /**
     * {@code CorILMethod_MoreSects}: data sections, i.e. exception handling clauses, follow the instruction stream.
     */
    static final int MORE_SECTS = 0x08;

    /**
     * The largest instruction stream a compact header can describe, as its size is stored in six bits.
     */
    public static final int COMPACT_MAX_CODE_SIZE = 0x3F;

    private static final int EXTENDED_MIN_HEADER_SIZE = 12;

    public BodyHeader {
        Objects.requireNonNull(encoding);
    }

    public boolean hasExtraSections() {
        return (encoding == Encoding.EXTENDED) && ((flags & MORE_SECTS) != 0);
    }

    /**
     * Returns the number of bytes reserved for the method body that can be overwritten in place.
     * <p>
     * Data sections following the instruction stream are not part of the span.
     *
     * @return {@code headerSize + codeSize}.
     */
    public long span() {
        return (long) headerSize + Integer.toUnsignedLong(codeSize);
    }

    /**
     * Parses the body header found at the provided file offset.
     *
     * @param contents A little-endian buffer over the complete module.
     *
     * @param offset The file offset of the first byte of the method body.
     *
     * @return The decoded header.
     *
     * @throws PatchException With {@link PatchFailure#UNSUPPORTED_BODY} if the header tag is unknown, an extended
     *                        header is malformed, or the body extends past the end of the module.
     */
    static BodyHeader read(final ByteBuffer contents, final int offset) throws PatchException {
        if ((offset < 0) || (offset >= contents.limit()))
            throw new PatchException(PatchFailure.UNSUPPORTED_BODY, "Method body offset 0x%X lies outside of the module"
                .formatted(offset));

        final int first = Byte.toUnsignedInt(contents.get(offset));
        final BodyHeader header = switch (first & TAG_MASK) {
            case COMPACT_TAG -> new BodyHeader(Encoding.COMPACT, 1, first >>> 2, 0);
            case EXTENDED_TAG -> readExtended(contents, offset);
            default -> throw new PatchException(PatchFailure.UNSUPPORTED_BODY,
                "Unknown method body header tag 0x%X at offset 0x%X".formatted(first & TAG_MASK, offset));
        };
        if (offset + header.span() > contents.limit())
            throw new PatchException(PatchFailure.UNSUPPORTED_BODY,
                "Method body at offset 0x%X extends past the end of the module".formatted(offset));
        return header;
    }

    private static BodyHeader readExtended(final ByteBuffer contents, final int offset) throws PatchException {
        if (offset + EXTENDED_MIN_HEADER_SIZE > contents.limit())
            throw new PatchException(PatchFailure.UNSUPPORTED_BODY,
                "Truncated extended method body header at offset 0x%X".formatted(offset));

        // Flags occupy the low 12 bits of the first 16-bit word, the header size in dwords the high 4 bits.
        final int word       = Short.toUnsignedInt(contents.getShort(offset));
        final int flags      = word & 0x0FFF;
        final int headerSize = (word >>> 12) * 4;
        if (headerSize < EXTENDED_MIN_HEADER_SIZE)
            throw new PatchException(PatchFailure.UNSUPPORTED_BODY,
                "Invalid extended method body header size %d at offset 0x%X".formatted(headerSize, offset));

        final int codeSize = contents.getInt(offset + 4);
        if (codeSize < 0)
            throw new PatchException(PatchFailure.UNSUPPORTED_BODY,
                "Invalid code size at offset 0x%X".formatted(offset));
        return new BodyHeader(Encoding.EXTENDED, headerSize, codeSize, flags);
    }
}
