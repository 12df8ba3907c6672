package org.zmachine3.runtime.instructions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.zmachine3.config.InterpreterOptions;
import org.zmachine3.junit.extensions.logging.ExpectLog;
import org.zmachine3.junit.extensions.logging.LogLevel;
import org.zmachine3.junit.extensions.logging.LogWatchExtension;
import org.zmachine3.runtime.Machine;
import org.zmachine3.runtime.api.ReadOnlyViolationException;
import org.zmachine3.runtime.model.Processor;
import org.zmachine3.testutils.RecordingStoryIO;
import org.zmachine3.testutils.StoryImageBuilder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(LogWatchExtension.class)
public class VMDataInstructionTest {

    private StoryImageBuilder story;
    private Machine machine;

    @BeforeEach
    void setUp() {
        story = new StoryImageBuilder();
    }

    private Machine load() {
        machine = new Machine(story.build(), new RecordingStoryIO(), InterpreterOptions.defaults());
        return machine;
    }

    private void run() {
        story.emit(0xBA);
        load().run();
    }

    private int global(int index) {
        return machine.getMemory().readWord(StoryImageBuilder.GLOBALS + 2 * index);
    }

    // --- LOAD / STORE / PULL on the stack ---

    /**
     * store and load name the stack indirectly and work on its top in place.
     */
    @Test
    @Tag("unit")
    void testIndirectStackAccessKeepsDepth() {
        // push #05; push #06; store [sp] #09; load [sp] -> G00
        story.emit(0xE8, 0x7F, 0x05)
                .emit(0xE8, 0x7F, 0x06)
                .emit(0x0D, 0x00, 0x09)
                .emit(0x9E, 0x00, 0x10)
                .emit(0xB4);
        load();
        for (int i = 0; i < 4; i++) {
            machine.step();
        }

        Processor processor = machine.getProcessor();
        assertThat(global(0)).isEqualTo(9);
        assertThat(processor.getStackDepth()).isEqualTo(2);
        assertThat(processor.pop()).isEqualTo(9);
        assertThat(processor.pop()).isEqualTo(5);
    }

    @Test
    @Tag("unit")
    void testPullIntoStackReplacesTop() {
        // push #01; push #02; pull [sp]
        story.emit(0xE8, 0x7F, 0x01)
                .emit(0xE8, 0x7F, 0x02)
                .emit(0xE9, 0x7F, 0x00)
                .emit(0xB4);
        load();
        for (int i = 0; i < 3; i++) {
            machine.step();
        }

        assertThat(machine.getProcessor().getStackDepth()).isEqualTo(1);
        assertThat(machine.getProcessor().peek()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testLoadAndStoreGlobals() {
        story.global(0x20, 0x4242);
        // load [G10] -> G00; store [G01] #07
        story.emit(0x9E, 0x20, 0x10).emit(0x0D, 0x11, 0x07);
        run();
        assertThat(global(0)).isEqualTo(0x4242);
        assertThat(global(1)).isEqualTo(7);
    }

    @Test
    @Tag("unit")
    void testPushPop() {
        // push #01; push #02; pop; pull G00
        story.emit(0xE8, 0x7F, 0x01)
                .emit(0xE8, 0x7F, 0x02)
                .emit(0xB9)
                .emit(0xE9, 0x7F, 0x10);
        run();
        assertThat(global(0)).isEqualTo(1);
        assertThat(machine.getProcessor().getStackDepth()).isZero();
    }

    // --- INC / DEC ---
    @Test
    @Tag("unit")
    void testIncDecWrap() {
        story.global(0x10, 0xFFFF);
        // inc [G00]; dec [G01]
        story.emit(0x95, 0x10).emit(0x96, 0x11);
        run();
        assertThat(global(0)).isZero();
        assertThat(global(1)).isEqualTo(0xFFFF);
    }

    @Test
    @Tag("unit")
    void testIncOnStack() {
        // push #05; inc [sp]
        story.emit(0xE8, 0x7F, 0x05).emit(0x95, 0x00).emit(0xB4);
        load();
        machine.step();
        machine.step();

        assertThat(machine.getProcessor().getStackDepth()).isEqualTo(1);
        assertThat(machine.getProcessor().peek()).isEqualTo(6);
    }

    /**
     * inc_chk loops until the incremented value exceeds the limit.
     */
    @Test
    @Tag("unit")
    void testIncChkLoop() {
        // loop: inc_chk [G00] #03 [FALSE] loop
        story.emit(0x05, 0x10, 0x03, 0x3F, 0xFD);
        run();
        assertThat(global(0)).isEqualTo(4);
    }

    @Test
    @Tag("unit")
    void testDecChkIsSigned() {
        // dec_chk [G00] #00 [TRUE] +6; store G01 #01; quit; store G01 #02
        story.emit(0x04, 0x10, 0x00, 0xC6)
                .emit(0x0D, 0x11, 0x01, 0xBA)
                .emit(0x0D, 0x11, 0x02);
        run();
        assertThat(global(0)).isEqualTo(0xFFFF);
        assertThat(global(1)).isEqualTo(2);
    }

    // --- LOADW / STOREW / LOADB / STOREB ---
    @Test
    @Tag("unit")
    void testWordArrays() {
        int table = story.scratch(8);
        // storew table #01 #beef; loadw table #01 -> G00
        story.emit(0xE1, 0x13, table >> 8, table & 0xFF, 0x01, 0xBE, 0xEF)
                .emit(0xCF, 0x1F, table >> 8, table & 0xFF, 0x01, 0x10);
        run();
        assertThat(global(0)).isEqualTo(0xBEEF);
        assertThat(machine.getMemory().readWord(table + 2)).isEqualTo(0xBEEF);
    }

    @Test
    @Tag("unit")
    void testByteArrays() {
        int table = story.scratch(8);
        // storeb table #03 #7a; loadb table #03 -> G00
        story.emit(0xE2, 0x17, table >> 8, table & 0xFF, 0x03, 0x7A)
                .emit(0xD0, 0x1F, table >> 8, table & 0xFF, 0x03, 0x10);
        run();
        assertThat(global(0)).isEqualTo(0x7A);
    }

    @Test
    @Tag("unit")
    void testLoadbReadsStaticMemory() {
        story.words("zork");
        // loadb #0a00 #00 -> G00
        story.emit(0xD0, 0x1F, StoryImageBuilder.DICTIONARY >> 8, 0x00, 0x00, 0x10);
        run();
        assertThat(global(0)).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Fatal interpreter error: .*static memory.*")
    void testStorebIntoStaticMemoryFails() {
        // storeb #0a00 #00 #01
        story.emit(0xE2, 0x17, StoryImageBuilder.STATIC_BASE >> 8, 0x00, 0x00, 0x01);
        load();
        assertThatThrownBy(() -> machine.step()).isInstanceOf(ReadOnlyViolationException.class);
    }
}
