package org.zmachine3.runtime.text;

import org.zmachine3.runtime.Config;
import org.zmachine3.runtime.api.DecodeException;
import org.zmachine3.runtime.model.Memory;

import java.util.Arrays;

/**
 * Encodes and decodes the packed 5-bit Z-character text format.
 * <p>
 * Text is a run of 16-bit words, each holding three Z-characters; the high bit of a word marks the
 * last word. Shift characters 4 and 5 select A1 and A2 for the next character only. Z-characters 1..3
 * expand an abbreviation, which may not itself contain an abbreviation.
 */
public class ZText {

    private static final String[] ALPHABETS = {
            "abcdefghijklmnopqrstuvwxyz",
            "ABCDEFGHIJKLMNOPQRSTUVWXYZ",
            " \n0123456789.,!?_#'\"/\\-:()"
    };

    /** Z-character in A2 that starts a 10-bit ZSCII escape. */
    private static final int ESCAPE = 6;
    private static final int PAD = 5;

    private final Memory memory;
    private final int abbreviationsAddress;

    /**
     * Result of decoding a string in memory.
     * @param text The decoded text.
     * @param byteLength The number of bytes the encoded text occupies.
     */
    public record DecodedText(String text, int byteLength) {}

    public ZText(Memory memory, int abbreviationsAddress) {
        this.memory = memory;
        this.abbreviationsAddress = abbreviationsAddress;
    }

    /**
     * Decodes the string that starts at the given byte address.
     * @param address The byte address of the first word.
     * @return The text and the number of bytes consumed.
     */
    public DecodedText decode(int address) {
        StringBuilder out = new StringBuilder();
        int length = decodeInto(address, out, false);
        return new DecodedText(out.toString(), length);
    }

    /**
     * Decodes the string at a packed address.
     * @param packedAddress The packed string address.
     * @return The decoded text.
     */
    public String decodePacked(int packedAddress) {
        return decode(memory.stringAddress(packedAddress)).text();
    }

    private int decodeInto(int address, StringBuilder out, boolean inAbbreviation) {
        int cursor = address;
        int alphabet = 0;
        int abbreviationBank = 0;
        int escapeStage = 0;
        int escapeHigh = 0;
        boolean end = false;
        while (!end) {
            int word = memory.readWord(cursor);
            cursor += 2;
            end = (word & 0x8000) != 0;
            for (int shift = 10; shift >= 0; shift -= 5) {
                int z = (word >> shift) & 0x1F;
                if (abbreviationBank != 0) {
                    expandAbbreviation(32 * (abbreviationBank - 1) + z, out);
                    abbreviationBank = 0;
                } else if (escapeStage == 1) {
                    escapeHigh = z;
                    escapeStage = 2;
                } else if (escapeStage == 2) {
                    out.append(ZsciiMapper.toUnicode((escapeHigh << 5) | z));
                    escapeStage = 0;
                } else if (z == 0) {
                    out.append(' ');
                    alphabet = 0;
                } else if (z <= 3) {
                    if (inAbbreviation) {
                        throw new DecodeException(String.format("Nested abbreviation in text at 0x%X", address));
                    }
                    abbreviationBank = z;
                    alphabet = 0;
                } else if (z == 4) {
                    alphabet = 1;
                } else if (z == 5) {
                    alphabet = 2;
                } else if (alphabet == 2 && z == ESCAPE) {
                    escapeStage = 1;
                    alphabet = 0;
                } else {
                    out.append(ALPHABETS[alphabet].charAt(z - 6));
                    alphabet = 0;
                }
            }
        }
        return cursor - address;
    }

    private void expandAbbreviation(int index, StringBuilder out) {
        int wordAddress = memory.readWord(abbreviationsAddress + 2 * index);
        decodeInto(wordAddress * 2, out, true);
    }

    /**
     * Encodes a word for dictionary lookup: 6 Z-characters, padded with 5s, truncated if longer,
     * packed into 4 bytes with the end bit set on the second word.
     * @param word The word, expected in lower case.
     * @return The 4 encoded bytes.
     */
    public byte[] encode(String word) {
        int[] zchars = new int[Config.DICTIONARY_WORD_ZCHARS];
        Arrays.fill(zchars, PAD);
        int n = 0;
        for (int i = 0; i < word.length() && n < zchars.length; i++) {
            char c = word.charAt(i);
            int a0 = ALPHABETS[0].indexOf(c);
            if (a0 >= 0) {
                zchars[n++] = a0 + 6;
                continue;
            }
            int a2 = ALPHABETS[2].indexOf(c, 1);
            if (a2 >= 1) {
                zchars[n++] = 5;
                if (n < zchars.length) {
                    zchars[n++] = a2 + 6;
                }
                continue;
            }
            int zscii = ZsciiMapper.fromUnicode(c);
            if (zscii < 0) {
                continue;
            }
            int[] escape = {5, ESCAPE, (zscii >> 5) & 0x1F, zscii & 0x1F};
            for (int e : escape) {
                if (n < zchars.length) {
                    zchars[n++] = e;
                }
            }
        }
        int first = (zchars[0] << 10) | (zchars[1] << 5) | zchars[2];
        int second = 0x8000 | (zchars[3] << 10) | (zchars[4] << 5) | zchars[5];
        return new byte[] {
                (byte) (first >> 8), (byte) first,
                (byte) (second >> 8), (byte) second
        };
    }
}
