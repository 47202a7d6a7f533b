package dev.blanke.ilpatcher.cil;

import static dev.blanke.ilpatcher.cil.OpCodes.*;

/**
 * The closed set of return-type categories for which a method body returning the default value can be synthesized.
 * <p>
 * Each category emits its own literal-return instruction sequence via {@link #emitDefaultReturn(InstructionEncoder)}.
 * Return types outside of this set (value types returned by value, unbound generic parameters, managed references)
 * have no category at all and cannot be patched.
 */
public enum ReturnCategory {

    /**
     * {@code void}.
     */
    VOID {
        @Override
        public void emitDefaultReturn(final InstructionEncoder encoder) {
            encoder.opCode(RET);
        }
    },

    /**
     * {@code bool}, {@code char}, and all 8, 16, and 32-bit integral types, which share the 32-bit stack slot.
     */
    INT32 {
        @Override
        public void emitDefaultReturn(final InstructionEncoder encoder) {
            encoder.loadConstantI4(0).opCode(RET);
        }
    },

    INT64 {
        @Override
        public void emitDefaultReturn(final InstructionEncoder encoder) {
            encoder.loadConstantI4(0).opCode(CONV_I8).opCode(RET);
        }
    },

    /**
     * Native-width integers along with unmanaged pointers, for which the default value is the null pointer.
     */
    NATIVE_INT {
        @Override
        public void emitDefaultReturn(final InstructionEncoder encoder) {
            encoder.loadConstantI4(0).opCode(CONV_I).opCode(RET);
        }
    },

    FLOAT32 {
        @Override
        public void emitDefaultReturn(final InstructionEncoder encoder) {
            encoder.loadConstantI4(0).opCode(CONV_R4).opCode(RET);
        }
    },

    FLOAT64 {
        @Override
        public void emitDefaultReturn(final InstructionEncoder encoder) {
            encoder.loadConstantI4(0).opCode(CONV_R8).opCode(RET);
        }
    },

    /**
     * Strings, classes, interfaces, arrays, and generic instantiations of classes, all of which return {@code null}.
     */
    REFERENCE {
        @Override
        public void emitDefaultReturn(final InstructionEncoder encoder) {
            encoder.opCode(LDNULL).opCode(RET);
        }
    };

    /**
     * Emits the instructions returning the default value of this category, ending with {@code ret}.
     *
     * @param encoder The encoder to which the instructions are appended.
     */
    public abstract void emitDefaultReturn(InstructionEncoder encoder);
}
