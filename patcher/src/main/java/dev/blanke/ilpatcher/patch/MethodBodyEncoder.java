package dev.blanke.ilpatcher.patch;

import org.jetbrains.annotations.Nullable;

import dev.blanke.ilpatcher.cil.InstructionEncoder;
import dev.blanke.ilpatcher.cil.ReturnCategory;

/**
 * Synthesizes method bodies which do nothing but return the default value of their return type.
 */
public final class MethodBodyEncoder {

    /**
     * Encodes a complete method body, header included, returning the default value of the provided category.
     *
     * @param returnCategory The category of the method's return type, {@code null} if it has none.
     *
     * @return The compact header followed by the instruction stream.
     *
     * @throws PatchException With {@link PatchFailure#UNSUPPORTED_RETURN} if {@code returnCategory} is {@code null},
     *                        or {@link PatchFailure#BODY_TOO_LARGE} if the instructions do not fit a compact header.
     */
    public byte[] encode(final @Nullable ReturnCategory returnCategory) throws PatchException {
        if (returnCategory == null)
            throw new PatchException(PatchFailure.UNSUPPORTED_RETURN,
                "No default-returning body can be synthesized for this return type");

        final var encoder = new InstructionEncoder();
        returnCategory.emitDefaultReturn(encoder);
        return compact(encoder);
    }

    /**
     * Prepends a compact header, {@code (length << 2) | 0x2}, to the provided instruction stream.
     *
     * @throws PatchException With {@link PatchFailure#BODY_TOO_LARGE} if the encoded stream is longer than
     *                        {@link BodyHeader#COMPACT_MAX_CODE_SIZE} bytes.
     */
    static byte[] compact(final InstructionEncoder encoder) throws PatchException {
        if (encoder.size() > BodyHeader.COMPACT_MAX_CODE_SIZE)
            throw new PatchException(PatchFailure.BODY_TOO_LARGE,
                "Instruction stream of %d bytes exceeds the compact header limit of %d bytes"
                    .formatted(encoder.size(), BodyHeader.COMPACT_MAX_CODE_SIZE));

        final byte[] code = encoder.toByteArray();
        final var body = new byte[code.length + 1];
        body[0] = (byte) ((code.length << 2) | BodyHeader.COMPACT_TAG);
        System.arraycopy(code, 0, body, 1, code.length);
        return body;
    }
}
