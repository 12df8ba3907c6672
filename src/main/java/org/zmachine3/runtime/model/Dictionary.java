package org.zmachine3.runtime.model;

import org.zmachine3.runtime.Config;
import org.zmachine3.runtime.text.ZText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Read-only view of the story dictionary and the tokenizer that resolves input words against it.
 */
public class Dictionary {

    private final Memory memory;
    private final ZText text;
    private final String separators;
    private final int entryLength;
    private final int entryCount;
    private final boolean sorted;
    private final int entriesAddress;

    /**
     * A word found in an input line.
     * @param text The word as typed, lower case.
     * @param position The 0-based offset of the word in the line.
     * @param dictionaryAddress The address of the matching entry, or 0 if the word is unknown.
     */
    public record Token(String text, int position, int dictionaryAddress) {}

    public Dictionary(Memory memory, int address, ZText text) {
        this.memory = memory;
        this.text = text;
        int cursor = address;
        int separatorCount = memory.readByte(cursor++);
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < separatorCount; i++) {
            builder.append((char) memory.readByte(cursor++));
        }
        this.separators = builder.toString();
        this.entryLength = memory.readByte(cursor++);
        int count = Config.toSigned(memory.readWord(cursor));
        cursor += 2;
        this.sorted = count > 0;
        this.entryCount = Math.abs(count);
        this.entriesAddress = cursor;
    }

    public String getSeparators() {
        return separators;
    }

    public int getEntryCount() {
        return entryCount;
    }

    public int getEntryLength() {
        return entryLength;
    }

    /**
     * Looks a word up in the dictionary.
     * @param word The word; matched case-insensitively on its first 6 Z-characters.
     * @return The address of the entry, or 0 if not present.
     */
    public int lookup(String word) {
        byte[] key = text.encode(word.toLowerCase(Locale.ROOT));
        if (!sorted) {
            for (int i = 0; i < entryCount; i++) {
                if (compare(key, entryAddress(i)) == 0) {
                    return entryAddress(i);
                }
            }
            return 0;
        }
        int low = 0;
        int high = entryCount - 1;
        while (low <= high) {
            int middle = (low + high) >>> 1;
            int cmp = compare(key, entryAddress(middle));
            if (cmp == 0) {
                return entryAddress(middle);
            } else if (cmp > 0) {
                low = middle + 1;
            } else {
                high = middle - 1;
            }
        }
        return 0;
    }

    /**
     * Splits an input line into words. Whitespace delimits words; every separator character forms a word of its own.
     * @param line The input line.
     * @return The tokens in input order.
     */
    public List<Token> tokenize(String line) {
        String input = line.toLowerCase(Locale.ROOT);
        List<Token> tokens = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= input.length(); i++) {
            char c = i < input.length() ? input.charAt(i) : ' ';
            boolean blank = Character.isWhitespace(c);
            boolean separator = !blank && separators.indexOf(c) >= 0;
            if (blank || separator) {
                if (start >= 0) {
                    tokens.add(token(input.substring(start, i), start));
                    start = -1;
                }
                if (separator && i < input.length()) {
                    tokens.add(token(String.valueOf(c), i));
                }
            } else if (start < 0) {
                start = i;
            }
        }
        return Collections.unmodifiableList(tokens);
    }

    private Token token(String word, int position) {
        return new Token(word, position, lookup(word));
    }

    private int entryAddress(int index) {
        return entriesAddress + index * entryLength;
    }

    private int compare(byte[] key, int address) {
        for (int i = 0; i < Config.DICTIONARY_WORD_BYTES; i++) {
            int diff = (key[i] & 0xFF) - memory.readByte(address + i);
            if (diff != 0) {
                return diff;
            }
        }
        return 0;
    }
}
