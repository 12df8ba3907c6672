package org.zmachine3.runtime.isa;

/**
 * The branch field of a branching instruction.
 * @param onTrue The condition result that triggers the branch.
 * @param offset The signed offset; 0 and 1 mean return false and return true.
 */
public record Branch(boolean onTrue, int offset) {

    /** Offset that returns false instead of jumping. */
    public static final int RETURN_FALSE = 0;
    /** Offset that returns true instead of jumping. */
    public static final int RETURN_TRUE = 1;

    /**
     * Computes the jump target for an ordinary offset.
     * @param instructionEnd The address right after the instruction.
     * @return The address execution continues at.
     */
    public int target(int instructionEnd) {
        return instructionEnd + offset - 2;
    }
}
