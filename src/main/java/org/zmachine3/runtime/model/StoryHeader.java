package org.zmachine3.runtime.model;

import org.zmachine3.runtime.Config;
import org.zmachine3.runtime.api.StoryFormatException;

/**
 * The immutable view of the 64-byte story header as read at load time.
 *
 * @param version The story file version (always 3).
 * @param flags1 The initial Flags 1 byte.
 * @param highBase The base of high memory.
 * @param initialPc The address of the first instruction to execute.
 * @param dictionaryAddress The address of the dictionary.
 * @param objectTableAddress The address of the object table.
 * @param globalsAddress The address of the global variable table.
 * @param staticBase The base of static memory.
 * @param abbreviationsAddress The address of the abbreviation table.
 * @param fileLength The declared file length in bytes, or 0 if not recorded.
 * @param checksum The checksum recorded in the header.
 * @param computedChecksum The checksum computed over the image at load time.
 */
public record StoryHeader(
        int version,
        int flags1,
        int highBase,
        int initialPc,
        int dictionaryAddress,
        int objectTableAddress,
        int globalsAddress,
        int staticBase,
        int abbreviationsAddress,
        int fileLength,
        int checksum,
        int computedChecksum) {

    /**
     * Parses and validates the header of a raw story image.
     * @param image The story bytes.
     * @return The parsed header.
     * @throws StoryFormatException if the image is too short, is not version 3 or has inconsistent tables.
     */
    public static StoryHeader parse(byte[] image) {
        if (image == null || image.length < Config.HEADER_SIZE) {
            throw new StoryFormatException("Story image is shorter than the " + Config.HEADER_SIZE + "-byte header");
        }
        int version = image[Config.HEADER_VERSION] & 0xFF;
        if (version != Config.SUPPORTED_VERSION) {
            throw new StoryFormatException("Unsupported story version " + version + ", only version "
                    + Config.SUPPORTED_VERSION + " is supported");
        }
        int staticBase = word(image, Config.HEADER_STATIC_BASE);
        if (staticBase < Config.HEADER_SIZE || staticBase > image.length) {
            throw new StoryFormatException(String.format("Static memory base 0x%X is outside the image", staticBase));
        }
        int globals = word(image, Config.HEADER_GLOBALS);
        requireInside(image, "global variable table", globals, Config.GLOBAL_COUNT * 2);
        int objects = word(image, Config.HEADER_OBJECT_TABLE);
        requireInside(image, "object table", objects, Config.PROPERTY_DEFAULTS_COUNT * 2);
        int dictionary = word(image, Config.HEADER_DICTIONARY);
        requireInside(image, "dictionary", dictionary, 1);
        int initialPc = word(image, Config.HEADER_INITIAL_PC);
        requireInside(image, "initial program counter", initialPc, 1);

        int fileLength = word(image, Config.HEADER_FILE_LENGTH) * Config.FILE_LENGTH_DIVISOR;
        int checksumLength = fileLength == 0 ? image.length : fileLength;
        int sum = 0;
        for (int i = Config.HEADER_SIZE; i < Math.min(checksumLength, image.length); i++) {
            sum += image[i] & 0xFF;
        }

        return new StoryHeader(
                version,
                image[Config.HEADER_FLAGS1] & 0xFF,
                word(image, Config.HEADER_HIGH_BASE),
                initialPc,
                dictionary,
                objects,
                globals,
                staticBase,
                word(image, Config.HEADER_ABBREVIATIONS),
                fileLength,
                word(image, Config.HEADER_CHECKSUM),
                sum & 0xFFFF);
    }

    /**
     * Returns whether the recorded checksum matches the image.
     * @return true if the checksums agree.
     */
    public boolean checksumValid() {
        return checksum == computedChecksum;
    }

    /**
     * Returns whether the status line shows a time instead of score and turns.
     * @return true for "time games".
     */
    public boolean isTimeGame() {
        return (flags1 & Config.FLAGS1_TIME_GAME) != 0;
    }

    private static int word(byte[] image, int offset) {
        return ((image[offset] & 0xFF) << 8) | (image[offset + 1] & 0xFF);
    }

    private static void requireInside(byte[] image, String what, int address, int width) {
        if (address < Config.HEADER_SIZE || address + width > image.length) {
            throw new StoryFormatException(String.format("%s address 0x%X is outside the image", what, address));
        }
    }
}
