package org.zmachine3.runtime.isa;

/**
 * Encoding of a single operand, as given by the 2-bit type fields.
 */
public enum OperandType {
    /** Two-byte constant. */
    LARGE_CONSTANT,
    /** One-byte constant. */
    SMALL_CONSTANT,
    /** One byte naming a variable whose value is the operand. */
    VARIABLE,
    /** No operand; ends the operand list. */
    OMITTED;

    /**
     * Maps a 2-bit type field to its operand type.
     * @param bits The field value 0..3.
     * @return The operand type.
     */
    public static OperandType fromBits(int bits) {
        return switch (bits & 0x03) {
            case 0 -> LARGE_CONSTANT;
            case 1 -> SMALL_CONSTANT;
            case 2 -> VARIABLE;
            default -> OMITTED;
        };
    }
}
