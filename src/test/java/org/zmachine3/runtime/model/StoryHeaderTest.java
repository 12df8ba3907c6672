package org.zmachine3.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.zmachine3.junit.extensions.logging.LogWatchExtension;
import org.zmachine3.runtime.api.StoryFormatException;
import org.zmachine3.testutils.StoryImageBuilder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for header parsing in {@link StoryHeader}.
 */
@ExtendWith(LogWatchExtension.class)
public class StoryHeaderTest {

    /**
     * Verifies that all table addresses are read from their header offsets.
     */
    @Test
    @Tag("unit")
    void testParsesTableAddresses() {
        byte[] image = new StoryImageBuilder().flags1(0x02).emit(0xBA).build();

        StoryHeader header = StoryHeader.parse(image);

        assertThat(header.version()).isEqualTo(3);
        assertThat(header.initialPc()).isEqualTo(StoryImageBuilder.CODE);
        assertThat(header.highBase()).isEqualTo(StoryImageBuilder.CODE);
        assertThat(header.dictionaryAddress()).isEqualTo(StoryImageBuilder.DICTIONARY);
        assertThat(header.objectTableAddress()).isEqualTo(StoryImageBuilder.OBJECT_TABLE);
        assertThat(header.globalsAddress()).isEqualTo(StoryImageBuilder.GLOBALS);
        assertThat(header.staticBase()).isEqualTo(StoryImageBuilder.STATIC_BASE);
        assertThat(header.abbreviationsAddress()).isEqualTo(StoryImageBuilder.ABBREVIATIONS);
        assertThat(header.fileLength()).isEqualTo(image.length);
        assertThat(header.checksumValid()).isTrue();
        assertThat(header.isTimeGame()).isTrue();
    }

    /**
     * Verifies that a wrong checksum is detected but does not prevent parsing.
     */
    @Test
    @Tag("unit")
    void testDetectsChecksumMismatch() {
        byte[] image = new StoryImageBuilder().checksum(0x1234).emit(0xBA).build();
        StoryHeader header = StoryHeader.parse(image);
        assertThat(header.checksum()).isEqualTo(0x1234);
        assertThat(header.checksumValid()).isFalse();
    }

    /**
     * Verifies that the checksum skips the header, stops at the recorded file length and wraps at 16 bits.
     */
    @Test
    @Tag("unit")
    void testChecksumCoversFileLength() {
        byte[] image = new StoryImageBuilder().emit(0xBA).build();
        for (int i = 0x40; i < image.length; i++) {
            image[i] = (byte) 0xFF;
        }

        image[0x1A] = 0x00;
        image[0x1B] = 0x21;
        assertThat(StoryHeader.parse(image).computedChecksum()).isEqualTo(0x1FE);

        image[0x1B] = 0x00;
        assertThat(StoryHeader.parse(image).computedChecksum()).isEqualTo(((image.length - 0x40) * 0xFF) & 0xFFFF);
    }

    /**
     * Verifies that stories of other versions are rejected.
     */
    @Test
    @Tag("unit")
    void testRejectsOtherVersions() {
        byte[] image = new StoryImageBuilder().version(5).emit(0xBA).build();
        assertThatThrownBy(() -> StoryHeader.parse(image))
                .isInstanceOf(StoryFormatException.class)
                .hasMessageContaining("version 5");
    }

    /**
     * Verifies that an image shorter than the header is rejected.
     */
    @Test
    @Tag("unit")
    void testRejectsTruncatedImage() {
        assertThatThrownBy(() -> StoryHeader.parse(new byte[10])).isInstanceOf(StoryFormatException.class);
    }

    /**
     * Verifies that a static base past the end of the image is rejected.
     */
    @Test
    @Tag("unit")
    void testRejectsStaticBaseOutsideImage() {
        byte[] image = new StoryImageBuilder().emit(0xBA).build();
        image[0x0E] = (byte) 0xFF;
        assertThatThrownBy(() -> StoryHeader.parse(image))
                .isInstanceOf(StoryFormatException.class)
                .hasMessageContaining("Static memory base");
    }
}
