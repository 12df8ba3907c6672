package org.zmachine3.runtime.text;

/**
 * Maps between ZSCII codes and Unicode characters.
 * <p>
 * Version 3 has no Unicode translation table in the header, so codes 155..223 always use the default table.
 */
public final class ZsciiMapper {

    /** ZSCII code for a newline. */
    public static final int NEWLINE = 13;

    private static final int EXTRA_FIRST = 155;
    private static final String DEFAULT_EXTRA =
            "äöüÄÖÜß»«ëïÿËÏ"
            + "áéíóúýÁÉÍÓÚÝ"
            + "àèìòùÀÈÌÒÙ"
            + "âêîôûÂÊÎÔÛ"
            + "åÅøØãñõÃÑÕ"
            + "æÆçÇþðÞÐ£œŒ¡¿";

    private ZsciiMapper() {}

    /**
     * Number of entries in the default extra character table.
     * @return The table size.
     */
    public static int extraCharacterCount() {
        return DEFAULT_EXTRA.length();
    }

    /**
     * Converts one output ZSCII code to text.
     * @param zscii The ZSCII code.
     * @return The text for the code; empty for codes with no defined output.
     */
    public static String toUnicode(int zscii) {
        if (zscii == 0) {
            return "";
        }
        if (zscii == NEWLINE) {
            return "\n";
        }
        if (zscii >= 32 && zscii <= 126) {
            return String.valueOf((char) zscii);
        }
        if (zscii >= EXTRA_FIRST && zscii < EXTRA_FIRST + DEFAULT_EXTRA.length()) {
            return String.valueOf(DEFAULT_EXTRA.charAt(zscii - EXTRA_FIRST));
        }
        return "";
    }

    /**
     * Converts a Unicode character to its ZSCII code.
     * @param c The character.
     * @return The ZSCII code, or -1 if the character cannot be represented.
     */
    public static int fromUnicode(char c) {
        if (c == '\n') {
            return NEWLINE;
        }
        if (c >= 32 && c <= 126) {
            return c;
        }
        int index = DEFAULT_EXTRA.indexOf(c);
        return index < 0 ? -1 : EXTRA_FIRST + index;
    }
}
