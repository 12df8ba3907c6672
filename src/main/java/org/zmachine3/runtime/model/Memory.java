package org.zmachine3.runtime.model;

import org.zmachine3.runtime.Config;
import org.zmachine3.runtime.api.AddressOutOfBoundsException;
import org.zmachine3.runtime.api.ReadOnlyViolationException;

import java.util.Arrays;

/**
 * The byte-addressed memory of a loaded story.
 * <p>
 * Everything below the static base is dynamic and writable; everything from the static base on is
 * read-only. Words are stored big-endian. The memory owns a private copy of the image it was created from.
 */
public class Memory {

    private final byte[] data;
    private final int staticBase;

    /**
     * Creates a memory over a copy of the given image.
     * @param image The raw story bytes.
     * @param staticBase The first read-only address.
     */
    public Memory(byte[] image, int staticBase) {
        this.data = Arrays.copyOf(image, image.length);
        this.staticBase = staticBase;
    }

    public int size() {
        return data.length;
    }

    public int getStaticBase() {
        return staticBase;
    }

    public int readByte(int address) {
        checkBounds(address, 1);
        return data[address] & 0xFF;
    }

    public int readWord(int address) {
        checkBounds(address, 2);
        return ((data[address] & 0xFF) << 8) | (data[address + 1] & 0xFF);
    }

    /**
     * Writes a byte into dynamic memory.
     * @param address The target address.
     * @param value The value; only the low 8 bits are stored.
     * @throws ReadOnlyViolationException if the address is at or above the static base.
     */
    public void writeByte(int address, int value) {
        checkBounds(address, 1);
        checkWritable(address, 1);
        data[address] = (byte) value;
    }

    /**
     * Writes a big-endian word into dynamic memory.
     * @param address The target address.
     * @param value The value; only the low 16 bits are stored.
     * @throws ReadOnlyViolationException if any byte of the word is at or above the static base.
     */
    public void writeWord(int address, int value) {
        checkBounds(address, 2);
        checkWritable(address, 2);
        data[address] = (byte) (value >> 8);
        data[address + 1] = (byte) value;
    }

    /**
     * Unpacks a routine address.
     * @param packed The packed address as found in an operand.
     * @return The byte address.
     */
    public int routineAddress(int packed) {
        return packed * Config.PACKED_ADDRESS_FACTOR;
    }

    /**
     * Unpacks a string address.
     * @param packed The packed address as found in an operand.
     * @return The byte address.
     */
    public int stringAddress(int packed) {
        return packed * Config.PACKED_ADDRESS_FACTOR;
    }

    private void checkBounds(int address, int width) {
        if (address < 0 || address + width > data.length) {
            throw new AddressOutOfBoundsException(address, data.length);
        }
    }

    private void checkWritable(int address, int width) {
        if (address + width > staticBase) {
            throw new ReadOnlyViolationException(address, staticBase);
        }
    }
}
