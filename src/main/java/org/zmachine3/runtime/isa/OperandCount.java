package org.zmachine3.runtime.isa;

/**
 * The operand count class an opcode number belongs to.
 */
public enum OperandCount {
    OP0("0OP"),
    OP1("1OP"),
    OP2("2OP"),
    VAR("VAR");

    private final String label;

    OperandCount(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
