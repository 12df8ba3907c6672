package org.zmachine3.runtime.text;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ZsciiMapperTest {

    @Test
    @Tag("unit")
    void testPrintableAscii() {
        assertThat(ZsciiMapper.toUnicode('A')).isEqualTo("A");
        assertThat(ZsciiMapper.fromUnicode('~')).isEqualTo(126);
    }

    @Test
    @Tag("unit")
    void testNewline() {
        assertThat(ZsciiMapper.toUnicode(ZsciiMapper.NEWLINE)).isEqualTo("\n");
        assertThat(ZsciiMapper.fromUnicode('\n')).isEqualTo(13);
    }

    @Test
    @Tag("unit")
    void testExtraCharacters() {
        assertThat(ZsciiMapper.extraCharacterCount()).isEqualTo(69);
        assertThat(ZsciiMapper.toUnicode(155)).isEqualTo("ä");
        assertThat(ZsciiMapper.toUnicode(223)).isEqualTo("¿");
        assertThat(ZsciiMapper.fromUnicode('ß')).isEqualTo(161);
    }

    @Test
    @Tag("unit")
    void testUndefinedCodes() {
        assertThat(ZsciiMapper.toUnicode(0)).isEmpty();
        assertThat(ZsciiMapper.toUnicode(127)).isEmpty();
        assertThat(ZsciiMapper.toUnicode(224)).isEmpty();
        assertThat(ZsciiMapper.fromUnicode('€')).isEqualTo(-1);
    }
}
