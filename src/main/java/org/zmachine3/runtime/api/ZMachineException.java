package org.zmachine3.runtime.api;

/**
 * Base class for all fatal interpreter errors.
 * <p>
 * A compiled story file is assumed to be well-formed, so every condition reported through this
 * hierarchy halts the machine. The program counter of the failing instruction is attached by the
 * machine when the error escapes an instruction.
 */
public class ZMachineException extends RuntimeException {

    private int pc = -1;

    /**
     * Constructs a new ZMachineException.
     * @param message The detail message.
     */
    public ZMachineException(String message) {
        super(message);
    }

    /**
     * Records the address of the instruction that failed. Only the first call has an effect.
     * @param pc The byte address of the failing instruction.
     * @return This exception, for chaining.
     */
    public ZMachineException atPc(int pc) {
        if (this.pc < 0) {
            this.pc = pc;
        }
        return this;
    }

    /**
     * Returns the address of the failing instruction.
     * @return The program counter, or -1 if unknown.
     */
    public int getPc() {
        return pc;
    }

    @Override
    public String getMessage() {
        if (pc < 0) {
            return super.getMessage();
        }
        return String.format("%s (pc=0x%05X)", super.getMessage(), pc);
    }
}
