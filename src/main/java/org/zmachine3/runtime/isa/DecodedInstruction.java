package org.zmachine3.runtime.isa;

import java.util.List;

/**
 * A fully decoded instruction. Decoding has no side effects, so this is a pure function of the memory contents.
 *
 * @param address The address of the opcode byte.
 * @param opcode The opcode.
 * @param operands The operands in order.
 * @param storeVariable The variable receiving the result, or -1 if the opcode does not store.
 * @param branch The branch field, or null if the opcode does not branch.
 * @param textAddress The address of inline text, or -1 if there is none.
 * @param length The total length of the instruction in bytes.
 */
public record DecodedInstruction(
        int address,
        Opcode opcode,
        List<Operand> operands,
        int storeVariable,
        Branch branch,
        int textAddress,
        int length) {

    /**
     * Returns the address directly after this instruction.
     * @return The address of the next instruction in sequence.
     */
    public int nextAddress() {
        return address + length;
    }

    public boolean hasStore() {
        return storeVariable >= 0;
    }

    public boolean hasBranch() {
        return branch != null;
    }
}
