package dev.blanke.ilpatcher.cil;

/**
 * Single-byte CIL opcodes (ECMA-335, Partition III) used when synthesizing or inspecting method bodies.
 * <p>
 * Two-byte opcodes (prefixed with {@code 0xFE}) are never emitted and are therefore not listed.
 */
public final class OpCodes {

    // Prevent instantiation of constants class.
    private OpCodes() {
    }

    public static final int NOP = 0x00;

    public static final int LDARG_0 = 0x02;
    public static final int LDARG_1 = 0x03;
    public static final int LDARG_2 = 0x04;
    public static final int LDARG_3 = 0x05;
    public static final int LDARG_S = 0x0E;

    public static final int LDNULL = 0x14;

    public static final int LDC_I4_M1 = 0x15;
    public static final int LDC_I4_0  = 0x16;
    public static final int LDC_I4_8  = 0x1E;
    public static final int LDC_I4_S  = 0x1F;
    public static final int LDC_I4    = 0x20;
    public static final int LDC_I8    = 0x21;
    public static final int LDC_R4    = 0x22;
    public static final int LDC_R8    = 0x23;

    public static final int DUP = 0x25;
    public static final int POP = 0x26;
    public static final int RET = 0x2A;

    public static final int ADD = 0x58;
    public static final int SUB = 0x59;
    public static final int MUL = 0x5A;

    public static final int CONV_I4 = 0x69;
    public static final int CONV_I8 = 0x6A;
    public static final int CONV_R4 = 0x6B;
    public static final int CONV_R8 = 0x6C;
    public static final int CONV_I  = 0xD3;
}
