package dev.blanke.ilpatcher.cil;

/**
 * Element type constants which make up the type encodings inside metadata signature blobs (ECMA-335, II.23.1.16).
 */
public final class ElementType {

    // Prevent instantiation of constants class.
    private ElementType() {
    }

    public static final int VOID        = 0x01;
    public static final int BOOLEAN     = 0x02;
    public static final int CHAR        = 0x03;
    public static final int I1          = 0x04;
    public static final int U1          = 0x05;
    public static final int I2          = 0x06;
    public static final int U2          = 0x07;
    public static final int I4          = 0x08;
    public static final int U4          = 0x09;
    public static final int I8          = 0x0A;
    public static final int U8          = 0x0B;
    public static final int R4          = 0x0C;
    public static final int R8          = 0x0D;
    public static final int STRING      = 0x0E;
    public static final int PTR         = 0x0F;
    public static final int BYREF       = 0x10;
    public static final int VALUETYPE   = 0x11;
    public static final int CLASS       = 0x12;
    public static final int VAR         = 0x13;
    public static final int ARRAY       = 0x14;
    public static final int GENERICINST = 0x15;
    public static final int TYPEDBYREF  = 0x16;
    public static final int I           = 0x18;
    public static final int U           = 0x19;
    public static final int FNPTR       = 0x1B;
    public static final int OBJECT      = 0x1C;
    public static final int SZARRAY     = 0x1D;
    public static final int MVAR        = 0x1E;
    public static final int CMOD_REQD   = 0x1F;
    public static final int CMOD_OPT    = 0x20;

    /**
     * Returns a readable name for the provided element type, e.g. {@code "I4 (0x08)"}, for use in diagnostics.
     *
     * @param elementType The element type constant.
     *
     * @return The readable name of the element type.
     */
    public static String describe(final int elementType) {
        final String name = switch (elementType) {
            case VOID        -> "VOID";
            case BOOLEAN     -> "BOOLEAN";
            case CHAR        -> "CHAR";
            case I1          -> "I1";
            case U1          -> "U1";
            case I2          -> "I2";
            case U2          -> "U2";
            case I4          -> "I4";
            case U4          -> "U4";
            case I8          -> "I8";
            case U8          -> "U8";
            case R4          -> "R4";
            case R8          -> "R8";
            case STRING      -> "STRING";
            case PTR         -> "PTR";
            case BYREF       -> "BYREF";
            case VALUETYPE   -> "VALUETYPE";
            case CLASS       -> "CLASS";
            case VAR         -> "VAR";
            case ARRAY       -> "ARRAY";
            case GENERICINST -> "GENERICINST";
            case TYPEDBYREF  -> "TYPEDBYREF";
            case I           -> "I";
            case U           -> "U";
            case FNPTR       -> "FNPTR";
            case OBJECT      -> "OBJECT";
            case SZARRAY     -> "SZARRAY";
            case MVAR        -> "MVAR";
            default          -> "UNKNOWN";
        };
        return "%s (0x%02X)".formatted(name, elementType);
    }
}
