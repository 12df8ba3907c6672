package org.zmachine3.runtime.api;

/**
 * Thrown when the running program writes into static or high memory.
 */
public class ReadOnlyViolationException extends ZMachineException {

    private final int address;

    /**
     * Constructs a new ReadOnlyViolationException.
     * @param address The offending byte address.
     * @param staticBase The first address of static memory.
     */
    public ReadOnlyViolationException(int address, int staticBase) {
        super(String.format("Write to read-only address 0x%X (static memory starts at 0x%X)", address, staticBase));
        this.address = address;
    }

    public int getAddress() {
        return address;
    }
}
