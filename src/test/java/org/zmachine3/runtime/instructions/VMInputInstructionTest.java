package org.zmachine3.runtime.instructions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.zmachine3.config.InterpreterOptions;
import org.zmachine3.junit.extensions.logging.LogWatchExtension;
import org.zmachine3.runtime.Machine;
import org.zmachine3.runtime.MachineState;
import org.zmachine3.runtime.api.StatusLine;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.runtime.spi.IStoryIO;
import org.zmachine3.testutils.StoryImageBuilder;

import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests {@code sread}: status line, text buffer, parse buffer and pausing for input.
 */
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
public class VMInputInstructionTest {

    @Mock
    private IStoryIO io;

    private StoryImageBuilder story;
    private int textBuffer;
    private int parseBuffer;
    private Machine machine;

    @BeforeEach
    void setUp() {
        story = new StoryImageBuilder().words("take", "brass", "lantern");
        story.addObject("Living Room", 0, 0, 0);
        story.global(0x10, 1).global(0x11, 10).global(0x12, 3);
        textBuffer = story.scratch(21);
        parseBuffer = story.scratch(2 + 4 * 4);
        story.poke(textBuffer, 20).poke(parseBuffer, 4);
    }

    private void emitSread() {
        // sread text parse; quit
        story.emit(0xE4, 0x0F, textBuffer >> 8, textBuffer & 0xFF, parseBuffer >> 8, parseBuffer & 0xFF)
                .emit(0xBA);
    }

    private Machine load() {
        machine = new Machine(story.build(), io, InterpreterOptions.defaults());
        return machine;
    }

    private String textBufferContents() {
        Memory memory = machine.getMemory();
        StringBuilder sb = new StringBuilder();
        for (int i = textBuffer + 1; memory.readByte(i) != 0; i++) {
            sb.append((char) memory.readByte(i));
        }
        return sb.toString();
    }

    @Test
    @Tag("unit")
    void testReadsAndTokenizes() {
        when(io.readLine(19)).thenReturn("Take Brass Lantern.");
        emitSread();
        load().run();

        Memory memory = machine.getMemory();
        assertThat(textBufferContents()).isEqualTo("take brass lantern.");
        assertThat(memory.readByte(parseBuffer + 1)).isEqualTo(4);
        int lantern = machine.getDictionary().lookup("lantern");
        assertThat(lantern).isNotZero();
        // third entry: lantern, length 7, position 12
        assertThat(memory.readWord(parseBuffer + 2 + 8)).isEqualTo(lantern);
        assertThat(memory.readByte(parseBuffer + 2 + 8 + 2)).isEqualTo(7);
        assertThat(memory.readByte(parseBuffer + 2 + 8 + 3)).isEqualTo(12);
        // fourth entry: the unknown separator word
        assertThat(memory.readWord(parseBuffer + 2 + 12)).isZero();
        assertThat(memory.readByte(parseBuffer + 2 + 12 + 2)).isEqualTo(1);
        assertThat(memory.readByte(parseBuffer + 2 + 12 + 3)).isEqualTo(19);
    }

    /**
     * The status line is refreshed before the player is asked for input.
     */
    @Test
    @Tag("unit")
    void testShowsStatusBeforeReading() {
        when(io.readLine(anyInt())).thenReturn("take");
        emitSread();
        load().run();

        InOrder order = inOrder(io);
        order.verify(io).showStatus(new StatusLine("Living Room", 10, 3, false));
        order.verify(io).readLine(19);
    }

    @Test
    @Tag("unit")
    void testInputIsTruncatedToBuffer() {
        story.poke(textBuffer, 6);
        when(io.readLine(5)).thenReturn("lantern");
        emitSread();
        load().run();

        assertThat(textBufferContents()).isEqualTo("lante");
    }

    @Test
    @Tag("unit")
    void testParseBufferLimitsTokens() {
        story.poke(parseBuffer, 2);
        when(io.readLine(anyInt())).thenReturn("take brass lantern");
        emitSread();
        load().run();

        assertThat(machine.getMemory().readByte(parseBuffer + 1)).isEqualTo(2);
    }

    /**
     * Without input the machine pauses on the sread and retries it with the same operands,
     * so stack operands are not popped twice.
     */
    @Test
    @Tag("unit")
    void testPausesWithoutInput() {
        when(io.readLine(19)).thenReturn(null, "take");
        // push parse; push text; sread (SP)+ (SP)+; quit
        story.emit(0xE8, 0x3F, parseBuffer >> 8, parseBuffer & 0xFF)
                .emit(0xE8, 0x3F, textBuffer >> 8, textBuffer & 0xFF);
        int sread = story.here();
        story.emit(0xE4, 0xAF, 0x00, 0x00).emit(0xBA);
        load();

        assertThat(machine.run()).isEqualTo(MachineState.AWAITING_INPUT);
        assertThat(machine.getProcessor().getPc()).isEqualTo(sread);
        assertThat(machine.getProcessor().getStackDepth()).isZero();

        assertThat(machine.run()).isEqualTo(MachineState.HALTED);
        assertThat(textBufferContents()).isEqualTo("take");
        assertThat(machine.getMemory().readByte(parseBuffer + 1)).isEqualTo(1);
        verify(io, times(2)).readLine(19);
        verify(io, times(2)).showStatus(any());
    }

    @Test
    @Tag("unit")
    void testInputIsEchoedToTranscript() {
        when(io.readLine(anyInt())).thenReturn("Take Lantern");
        StringWriter transcript = new StringWriter();
        // output_stream #02
        story.emit(0xF3, 0x7F, 0x02);
        emitSread();
        machine = new Machine(story.build(), io, InterpreterOptions.defaults(), transcript);
        machine.run();

        assertThat(transcript.toString()).isEqualTo("Take Lantern\n");
    }
}
