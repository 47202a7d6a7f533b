package dev.blanke.ilpatcher.module;

import org.jetbrains.annotations.Nullable;

import dev.blanke.ilpatcher.cil.ReturnCategory;

import static dev.blanke.ilpatcher.cil.ElementType.*;

/**
 * Decodes method signature blobs (ECMA-335, II.23.2.1) far enough to learn the generic arity, the parameter count,
 * and the category of the return type.
 */
final class SignatureReader {

    private static final int GENERIC = 0x10;

    private static final int CALLING_CONVENTION_MASK = 0x0F;

    /**
     * The highest calling convention kind denoting a method signature ({@code VARARG}). Higher kinds are used by
     * field, local variable, property, and generic instantiation signatures.
     */
    private static final int MAX_METHOD_CALLING_CONVENTION = 0x05;

    private final byte[] blob;

    private int position;

    SignatureReader(final byte[] blob) {
        this.blob = blob;
    }

    /**
     * The decoded part of a method signature.
     *
     * @param header The leading calling convention byte, including the {@code HASTHIS} and {@code GENERIC} bits.
     *
     * @param returnCategory {@code null} if the return type has no {@link ReturnCategory}.
     */
    record MethodSignature(int header, int genericParameterCount, int parameterCount, int returnElementType,
                           @Nullable ReturnCategory returnCategory) {}

    MethodSignature readMethodSignature() throws ModuleFormatException {
        final int header = readByte();
        if ((header & CALLING_CONVENTION_MASK) > MAX_METHOD_CALLING_CONVENTION)
            throw new ModuleFormatException("Not a method signature (calling convention 0x%02X)".formatted(header));

        final int genericParameterCount = ((header & GENERIC) != 0) ? readCompressedUnsigned() : 0;
        final int parameterCount = readCompressedUnsigned();

        int elementType = readByte();
        // Custom modifiers (e.g. modreq(IsVolatile)) are followed by a TypeDefOrRefOrSpecEncoded token.
        while ((elementType == CMOD_REQD) || (elementType == CMOD_OPT)) {
            readCompressedUnsigned();
            elementType = readByte();
        }
        return new MethodSignature(header, genericParameterCount, parameterCount, elementType,
            readReturnCategory(elementType));
    }

    private @Nullable ReturnCategory readReturnCategory(final int elementType) throws ModuleFormatException {
        return switch (elementType) {
            case VOID -> ReturnCategory.VOID;
            case BOOLEAN, CHAR, I1, U1, I2, U2, I4, U4 -> ReturnCategory.INT32;
            case I8, U8 -> ReturnCategory.INT64;
            case I, U, PTR, FNPTR -> ReturnCategory.NATIVE_INT;
            case R4 -> ReturnCategory.FLOAT32;
            case R8 -> ReturnCategory.FLOAT64;
            case STRING, CLASS, OBJECT, SZARRAY, ARRAY -> ReturnCategory.REFERENCE;
            // GENERICINST is followed by CLASS or VALUETYPE, only the former is returned as a reference.
            case GENERICINST -> (readByte() == CLASS) ? ReturnCategory.REFERENCE : null;
            // VALUETYPE, VAR, MVAR, BYREF, TYPEDBYREF and anything unknown.
            default -> null;
        };
    }

    /**
     * Reads an unsigned integer in the compressed encoding of ECMA-335, II.23.2 (one, two, or four bytes,
     * big-endian, with the length encoded in the high bits of the first byte).
     */
    int readCompressedUnsigned() throws ModuleFormatException {
        final int first = readByte();
        if ((first & 0x80) == 0)
            return first;
        if ((first & 0xC0) == 0x80)
            return ((first & 0x3F) << 8) | readByte();
        if ((first & 0xE0) == 0xC0)
            return ((first & 0x1F) << 24) | (readByte() << 16) | (readByte() << 8) | readByte();
        throw new ModuleFormatException("Invalid compressed integer lead byte 0x%02X".formatted(first));
    }

    int readByte() throws ModuleFormatException {
        if (position >= blob.length)
            throw new ModuleFormatException("Truncated signature blob");
        return blob[position++] & 0xFF;
    }
}
