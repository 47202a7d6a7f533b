package dev.blanke.ilpatcher.util;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static dev.blanke.ilpatcher.cil.ElementType.*;
import static dev.blanke.ilpatcher.cil.OpCodes.*;
import static dev.blanke.ilpatcher.util.ModuleImageBuilder.*;

/**
 * The module most tests operate on, covering every return category and the body shapes the patcher distinguishes.
 */
public final class SampleModule {

    public static final String SAMPLE = "Demo.Sample";

    public static final String GLOBALS = "Globals";

    public static final String EMPTY = "Demo.Empty";

    /**
     * Computes {@code a * b + 10} for its two arguments.
     */
    public static final byte[] COMPUTE_BODY = tinyBody(LDARG_1, LDARG_2, MUL, LDC_I4_S, 10, ADD, RET);

    private SampleModule() {
        // Prevent instantiation of utility class.
    }

    public static ModuleImageBuilder builder() {
        return new ModuleImageBuilder()
            .type("Demo", "Sample")
            .method("Compute", PUBLIC_METHOD_FLAGS, signature(true, I4, I4, I4), COMPUTE_BODY)
            .method("Compute", PUBLIC_METHOD_FLAGS, signature(true, I4, I4), tinyBody(LDARG_1, RET))
            .method("Reset", PUBLIC_STATIC_METHOD_FLAGS, signature(false, VOID), tinyBody(NOP, RET))
            .method("Total", PUBLIC_STATIC_METHOD_FLAGS, signature(false, I8),
                tinyBody(concat(new int[] { LDC_I8 }, littleEndian(Long.BYTES, 1234567890123L), new int[] { RET })))
            .method("Ratio", PUBLIC_STATIC_METHOD_FLAGS, signature(false, R4),
                tinyBody(concat(new int[] { LDC_R4 }, littleEndian(Float.BYTES, Float.floatToIntBits(1.5f)),
                    new int[] { RET })))
            .method("Average", PUBLIC_STATIC_METHOD_FLAGS, signature(false, R8),
                fatBody(bytes(concat(new int[] { LDC_R8 }, littleEndian(Double.BYTES,
                    Double.doubleToLongBits(2.5)), new int[] { RET })), false))
            .method("Handle", PUBLIC_STATIC_METHOD_FLAGS, signature(false, I), tinyBody(LDC_I4_S, 7, CONV_I, RET))
            .method("Name", PUBLIC_METHOD_FLAGS, signature(true, STRING), tinyBody(LDNULL, NOP, RET))
            .method("Guarded", PUBLIC_STATIC_METHOD_FLAGS, signature(false, I4),
                fatBody(bytes(NOP, LDC_I4_0 + 3, RET), true))
            .method("Origin", PUBLIC_STATIC_METHOD_FLAGS, bytes(0x00, 0, VALUETYPE, 0x08), tinyBody(LDNULL, RET))
            .method("Answer", PUBLIC_STATIC_METHOD_FLAGS, signature(false, I4), tinyBody(RET))
            .method("Draw", PUBLIC_METHOD_FLAGS | 0x0040 | 0x0400, signature(true, VOID), 0) // Virtual | Abstract
            .method("Detached", PUBLIC_STATIC_METHOD_FLAGS, signature(false, VOID), 0x9000)
            .method("Identity", PUBLIC_STATIC_METHOD_FLAGS, bytes(0x10, 1, 1, MVAR, 0, MVAR, 0),
                tinyBody(LDARG_0, RET))
            .type("", "Globals")
            .method("Get", PUBLIC_STATIC_METHOD_FLAGS, signature(false, OBJECT), tinyBody(LDNULL, RET))
            .type("Demo", "Empty");
    }

    private static int[] littleEndian(final int size, final long value) {
        final var buffer = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(value);
        final var values = new int[size];
        for (int index = 0; index < size; index++)
            values[index] = Byte.toUnsignedInt(buffer.get(index));
        return values;
    }

    private static int[] concat(final int[]... parts) {
        int length = 0;
        for (final var part : parts)
            length += part.length;

        final var values = new int[length];
        int position = 0;
        for (final var part : parts) {
            System.arraycopy(part, 0, values, position, part.length);
            position += part.length;
        }
        return values;
    }
}
