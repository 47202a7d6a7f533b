package dev.blanke.ilpatcher.cil;

import java.io.ByteArrayOutputStream;

/**
 * Accumulates the raw bytes of a CIL instruction stream.
 * <p>
 * Only what is needed to synthesize short literal-return bodies is supported: plain single-byte opcodes and
 * 32-bit integer constants, the latter using the shortest available encoding.
 */
public final class InstructionEncoder {

    private final ByteArrayOutputStream code = new ByteArrayOutputStream();

    public InstructionEncoder opCode(final int opCode) {
        if ((opCode < 0) || (opCode > 0xFF))
            throw new IllegalArgumentException("Not a single-byte opcode: %d".formatted(opCode));
        code.write(opCode);
        return this;
    }

    /**
     * Emits an instruction pushing the provided 32-bit integer onto the evaluation stack.
     * <p>
     * Values from {@code -1} to {@code 8} use the dedicated {@code ldc.i4.<n>} forms, other values fitting into a
     * signed byte use {@code ldc.i4.s}, and everything else falls back to {@code ldc.i4}.
     *
     * @param value The constant to push.
     *
     * @return This encoder.
     */
    public InstructionEncoder loadConstantI4(final int value) {
        if ((value >= -1) && (value <= 8)) {
            return opCode(OpCodes.LDC_I4_0 + value);
        }
        if ((value >= Byte.MIN_VALUE) && (value <= Byte.MAX_VALUE)) {
            opCode(OpCodes.LDC_I4_S);
            code.write(value);
            return this;
        }
        opCode(OpCodes.LDC_I4);
        code.write(value);
        code.write(value >>> 8);
        code.write(value >>> 16);
        code.write(value >>> 24);
        return this;
    }

    public int size() {
        return code.size();
    }

    public byte[] toByteArray() {
        return code.toByteArray();
    }
}
