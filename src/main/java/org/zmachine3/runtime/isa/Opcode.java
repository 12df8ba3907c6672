package org.zmachine3.runtime.isa;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The closed set of version 3 opcodes.
 * <p>
 * Each constant records its operand count class, its number within that class, whether it is followed
 * by a store byte, a branch field or inline text, whether its first operand names a variable, and the
 * instruction family that executes it.
 */
public enum Opcode {
    // 2OP
    JE(OperandCount.OP2, 1, Family.CONDITIONAL, Flags.BRANCH),
    JL(OperandCount.OP2, 2, Family.CONDITIONAL, Flags.BRANCH),
    JG(OperandCount.OP2, 3, Family.CONDITIONAL, Flags.BRANCH),
    DEC_CHK(OperandCount.OP2, 4, Family.DATA, Flags.BRANCH | Flags.INDIRECT),
    INC_CHK(OperandCount.OP2, 5, Family.DATA, Flags.BRANCH | Flags.INDIRECT),
    JIN(OperandCount.OP2, 6, Family.OBJECT, Flags.BRANCH),
    TEST(OperandCount.OP2, 7, Family.BITWISE, Flags.BRANCH),
    OR(OperandCount.OP2, 8, Family.BITWISE, Flags.STORE),
    AND(OperandCount.OP2, 9, Family.BITWISE, Flags.STORE),
    TEST_ATTR(OperandCount.OP2, 10, Family.OBJECT, Flags.BRANCH),
    SET_ATTR(OperandCount.OP2, 11, Family.OBJECT, 0),
    CLEAR_ATTR(OperandCount.OP2, 12, Family.OBJECT, 0),
    STORE(OperandCount.OP2, 13, Family.DATA, Flags.INDIRECT),
    INSERT_OBJ(OperandCount.OP2, 14, Family.OBJECT, 0),
    LOADW(OperandCount.OP2, 15, Family.DATA, Flags.STORE),
    LOADB(OperandCount.OP2, 16, Family.DATA, Flags.STORE),
    GET_PROP(OperandCount.OP2, 17, Family.OBJECT, Flags.STORE),
    GET_PROP_ADDR(OperandCount.OP2, 18, Family.OBJECT, Flags.STORE),
    GET_NEXT_PROP(OperandCount.OP2, 19, Family.OBJECT, Flags.STORE),
    ADD(OperandCount.OP2, 20, Family.ARITHMETIC, Flags.STORE),
    SUB(OperandCount.OP2, 21, Family.ARITHMETIC, Flags.STORE),
    MUL(OperandCount.OP2, 22, Family.ARITHMETIC, Flags.STORE),
    DIV(OperandCount.OP2, 23, Family.ARITHMETIC, Flags.STORE),
    MOD(OperandCount.OP2, 24, Family.ARITHMETIC, Flags.STORE),

    // 1OP
    JZ(OperandCount.OP1, 0, Family.CONDITIONAL, Flags.BRANCH),
    GET_SIBLING(OperandCount.OP1, 1, Family.OBJECT, Flags.STORE | Flags.BRANCH),
    GET_CHILD(OperandCount.OP1, 2, Family.OBJECT, Flags.STORE | Flags.BRANCH),
    GET_PARENT(OperandCount.OP1, 3, Family.OBJECT, Flags.STORE),
    GET_PROP_LEN(OperandCount.OP1, 4, Family.OBJECT, Flags.STORE),
    INC(OperandCount.OP1, 5, Family.DATA, Flags.INDIRECT),
    DEC(OperandCount.OP1, 6, Family.DATA, Flags.INDIRECT),
    PRINT_ADDR(OperandCount.OP1, 7, Family.TEXT, 0),
    REMOVE_OBJ(OperandCount.OP1, 9, Family.OBJECT, 0),
    PRINT_OBJ(OperandCount.OP1, 10, Family.TEXT, 0),
    RET(OperandCount.OP1, 11, Family.CONTROL_FLOW, 0),
    JUMP(OperandCount.OP1, 12, Family.CONTROL_FLOW, 0),
    PRINT_PADDR(OperandCount.OP1, 13, Family.TEXT, 0),
    LOAD(OperandCount.OP1, 14, Family.DATA, Flags.STORE | Flags.INDIRECT),
    NOT(OperandCount.OP1, 15, Family.BITWISE, Flags.STORE),

    // 0OP
    RTRUE(OperandCount.OP0, 0, Family.CONTROL_FLOW, 0),
    RFALSE(OperandCount.OP0, 1, Family.CONTROL_FLOW, 0),
    PRINT(OperandCount.OP0, 2, Family.TEXT, Flags.TEXT),
    PRINT_RET(OperandCount.OP0, 3, Family.TEXT, Flags.TEXT),
    NOP(OperandCount.OP0, 4, Family.MACHINE_STATE, 0),
    SAVE(OperandCount.OP0, 5, Family.MACHINE_STATE, Flags.BRANCH),
    RESTORE(OperandCount.OP0, 6, Family.MACHINE_STATE, Flags.BRANCH),
    RESTART(OperandCount.OP0, 7, Family.MACHINE_STATE, 0),
    RET_POPPED(OperandCount.OP0, 8, Family.CONTROL_FLOW, 0),
    POP(OperandCount.OP0, 9, Family.DATA, 0),
    QUIT(OperandCount.OP0, 10, Family.MACHINE_STATE, 0),
    NEW_LINE(OperandCount.OP0, 11, Family.TEXT, 0),
    SHOW_STATUS(OperandCount.OP0, 12, Family.MACHINE_STATE, 0),
    VERIFY(OperandCount.OP0, 13, Family.MACHINE_STATE, Flags.BRANCH),

    // VAR
    CALL(OperandCount.VAR, 0, Family.CONTROL_FLOW, Flags.STORE),
    STOREW(OperandCount.VAR, 1, Family.DATA, 0),
    STOREB(OperandCount.VAR, 2, Family.DATA, 0),
    PUT_PROP(OperandCount.VAR, 3, Family.OBJECT, 0),
    SREAD(OperandCount.VAR, 4, Family.INPUT, 0),
    PRINT_CHAR(OperandCount.VAR, 5, Family.TEXT, 0),
    PRINT_NUM(OperandCount.VAR, 6, Family.TEXT, 0),
    RANDOM(OperandCount.VAR, 7, Family.MACHINE_STATE, Flags.STORE),
    PUSH(OperandCount.VAR, 8, Family.DATA, 0),
    PULL(OperandCount.VAR, 9, Family.DATA, Flags.INDIRECT),
    SPLIT_WINDOW(OperandCount.VAR, 10, Family.MACHINE_STATE, 0),
    SET_WINDOW(OperandCount.VAR, 11, Family.MACHINE_STATE, 0),
    OUTPUT_STREAM(OperandCount.VAR, 19, Family.MACHINE_STATE, 0),
    INPUT_STREAM(OperandCount.VAR, 20, Family.MACHINE_STATE, 0),
    SOUND_EFFECT(OperandCount.VAR, 21, Family.MACHINE_STATE, 0);

    /**
     * The instruction family class that executes an opcode.
     */
    public enum Family {
        ARITHMETIC,
        BITWISE,
        CONDITIONAL,
        CONTROL_FLOW,
        DATA,
        OBJECT,
        TEXT,
        INPUT,
        MACHINE_STATE
    }

    private static final class Flags {
        static final int STORE = 1;
        static final int BRANCH = 2;
        static final int TEXT = 4;
        static final int INDIRECT = 8;
    }

    private static final Map<OperandCount, Map<Integer, Opcode>> BY_NUMBER = new EnumMap<>(OperandCount.class);

    static {
        for (OperandCount count : OperandCount.values()) {
            BY_NUMBER.put(count, new HashMap<>());
        }
        for (Opcode opcode : values()) {
            BY_NUMBER.get(opcode.count).put(opcode.number, opcode);
        }
    }

    private final OperandCount count;
    private final int number;
    private final Family family;
    private final int flags;

    Opcode(OperandCount count, int number, Family family, int flags) {
        this.count = count;
        this.number = number;
        this.family = family;
        this.flags = flags;
    }

    /**
     * Finds the opcode for a decoded operand count class and number.
     * @param count The operand count class.
     * @param number The opcode number within the class.
     * @return The opcode, or null if the number is not a version 3 opcode.
     */
    public static Opcode lookup(OperandCount count, int number) {
        return BY_NUMBER.get(count).get(number);
    }

    public OperandCount operandCount() {
        return count;
    }

    public int number() {
        return number;
    }

    public Family family() {
        return family;
    }

    public boolean stores() {
        return (flags & Flags.STORE) != 0;
    }

    public boolean branches() {
        return (flags & Flags.BRANCH) != 0;
    }

    public boolean hasInlineText() {
        return (flags & Flags.TEXT) != 0;
    }

    /**
     * Returns whether the first operand is a variable number rather than a value.
     * @return true for load, store, pull, inc, dec, inc_chk and dec_chk.
     */
    public boolean isIndirect() {
        return (flags & Flags.INDIRECT) != 0;
    }

    /**
     * Returns the assembler name.
     * @return The lower case mnemonic, e.g. {@code get_prop_addr}.
     */
    public String mnemonic() {
        return name().toLowerCase(Locale.ROOT);
    }
}
