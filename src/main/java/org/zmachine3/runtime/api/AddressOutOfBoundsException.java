package org.zmachine3.runtime.api;

/**
 * Thrown when a read or write falls outside the story image.
 */
public class AddressOutOfBoundsException extends ZMachineException {

    private final int address;

    /**
     * Constructs a new AddressOutOfBoundsException.
     * @param address The offending byte address.
     * @param size The size of the address space.
     */
    public AddressOutOfBoundsException(int address, int size) {
        super(String.format("Address 0x%X outside of story image (size 0x%X)", address, size));
        this.address = address;
    }

    public int getAddress() {
        return address;
    }
}
