package org.zmachine3.runtime;

/**
 * Fixed constants of the version 3 Z-machine format.
 */
public final class Config {

    private Config() {}

    /** The only story file version this interpreter accepts. */
    public static final int SUPPORTED_VERSION = 3;

    /** Size of the story file header in bytes. */
    public static final int HEADER_SIZE = 64;

    /** Header offset of the version byte. */
    public static final int HEADER_VERSION = 0x00;
    /** Header offset of Flags 1. */
    public static final int HEADER_FLAGS1 = 0x01;
    /** Header offset of the base of high memory. */
    public static final int HEADER_HIGH_BASE = 0x04;
    /** Header offset of the initial program counter. */
    public static final int HEADER_INITIAL_PC = 0x06;
    /** Header offset of the dictionary address. */
    public static final int HEADER_DICTIONARY = 0x08;
    /** Header offset of the object table address. */
    public static final int HEADER_OBJECT_TABLE = 0x0A;
    /** Header offset of the global variable table address. */
    public static final int HEADER_GLOBALS = 0x0C;
    /** Header offset of the base of static memory. */
    public static final int HEADER_STATIC_BASE = 0x0E;
    /** Header offset of Flags 2. */
    public static final int HEADER_FLAGS2 = 0x10;
    /** Header offset of the abbreviation table address. */
    public static final int HEADER_ABBREVIATIONS = 0x18;
    /** Header offset of the file length, stored divided by {@link #FILE_LENGTH_DIVISOR}. */
    public static final int HEADER_FILE_LENGTH = 0x1A;
    /** Header offset of the checksum. */
    public static final int HEADER_CHECKSUM = 0x1C;

    /** Multiplier applied to the stored file length in version 3. */
    public static final int FILE_LENGTH_DIVISOR = 2;
    /** Multiplier applied to packed routine and string addresses in version 3. */
    public static final int PACKED_ADDRESS_FACTOR = 2;

    /** Flags 1: status line shows hours:minutes instead of score/turns. */
    public static final int FLAGS1_TIME_GAME = 0x02;
    /** Flags 1: status line not available. */
    public static final int FLAGS1_STATUS_UNAVAILABLE = 0x10;
    /** Flags 1: screen splitting available. */
    public static final int FLAGS1_SPLIT_AVAILABLE = 0x20;
    /** Flags 2: transcripting is on. */
    public static final int FLAGS2_TRANSCRIPT = 0x01;

    /** Highest local variable number a routine may declare. */
    public static final int MAX_LOCALS = 15;
    /** First variable number that names a global. */
    public static final int FIRST_GLOBAL = 0x10;
    /** Number of global variables. */
    public static final int GLOBAL_COUNT = 240;

    /** Number of attributes per object. */
    public static final int ATTRIBUTE_COUNT = 32;
    /** Number of entries in the property defaults table. */
    public static final int PROPERTY_DEFAULTS_COUNT = 31;
    /** Size of one object entry in bytes. */
    public static final int OBJECT_ENTRY_SIZE = 9;
    /** Highest possible object number. */
    public static final int MAX_OBJECTS = 255;

    /** Encoded size of a dictionary word in bytes. */
    public static final int DICTIONARY_WORD_BYTES = 4;
    /** Number of Z-characters in a dictionary word. */
    public static final int DICTIONARY_WORD_ZCHARS = 6;

    /** Maximum nesting of memory output streams. */
    public static final int MAX_MEMORY_STREAM_DEPTH = 16;

    /** Positive seeds below this produce the predictable 1..n counting sequence. */
    public static final int PREDICTABLE_SEED_LIMIT = 1000;

    /**
     * Reinterprets a 16-bit word as a signed value.
     * @param word The unsigned word.
     * @return The value in the range -32768..32767.
     */
    public static int toSigned(int word) {
        return (short) word;
    }

    /**
     * Truncates a value to an unsigned 16-bit word.
     * @param value Any int value.
     * @return The value in the range 0..65535.
     */
    public static int toWord(int value) {
        return value & 0xFFFF;
    }
}
