package org.zmachine3.runtime.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.zmachine3.junit.extensions.logging.LogWatchExtension;
import org.zmachine3.runtime.api.DecodeException;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.testutils.StoryImageBuilder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link InstructionDecoder}: instruction forms, operand types,
 * store bytes, branch fields and inline text.
 */
@ExtendWith(LogWatchExtension.class)
public class InstructionDecoderTest {

    private static final int AT = StoryImageBuilder.CODE;

    private final InstructionDecoder decoder = new InstructionDecoder();

    private DecodedInstruction decode(int... bytes) {
        byte[] image = new StoryImageBuilder().emit(bytes).emit(0, 0, 0, 0).build();
        return decoder.decode(new Memory(image, StoryImageBuilder.STATIC_BASE), AT);
    }

    /**
     * Verifies long form: the two type bits pick small constant or variable.
     */
    @Test
    @Tag("unit")
    void testLongForm() {
        // add L00 #05 -> sp
        DecodedInstruction add = decode(0x54, 0x01, 0x05, 0x00);

        assertThat(add.opcode()).isEqualTo(Opcode.ADD);
        assertThat(add.operands()).containsExactly(
                new Operand(OperandType.VARIABLE, 0x01),
                new Operand(OperandType.SMALL_CONSTANT, 0x05));
        assertThat(add.storeVariable()).isZero();
        assertThat(add.hasBranch()).isFalse();
        assertThat(add.length()).isEqualTo(4);
        assertThat(add.nextAddress()).isEqualTo(AT + 4);
    }

    /**
     * Verifies short form with a large constant, and a 0OP instruction.
     */
    @Test
    @Tag("unit")
    void testShortForm() {
        DecodedInstruction jump = decode(0x8C, 0xFF, 0xFE);
        assertThat(jump.opcode()).isEqualTo(Opcode.JUMP);
        assertThat(jump.operands()).containsExactly(new Operand(OperandType.LARGE_CONSTANT, 0xFFFE));
        assertThat(jump.length()).isEqualTo(3);

        DecodedInstruction quit = decode(0xBA);
        assertThat(quit.opcode()).isEqualTo(Opcode.QUIT);
        assertThat(quit.operands()).isEmpty();
        assertThat(quit.length()).isEqualTo(1);
    }

    /**
     * Verifies variable form: operand types stop at the first omitted pair.
     */
    @Test
    @Tag("unit")
    void testVariableForm() {
        // call #1234 #05 G00 -> L01
        DecodedInstruction call = decode(0xE0, 0x1B, 0x12, 0x34, 0x05, 0x10, 0x02);

        assertThat(call.opcode()).isEqualTo(Opcode.CALL);
        assertThat(call.operands()).extracting(Operand::type).containsExactly(
                OperandType.LARGE_CONSTANT, OperandType.SMALL_CONSTANT, OperandType.VARIABLE);
        assertThat(call.operands()).extracting(Operand::raw).containsExactly(0x1234, 0x05, 0x10);
        assertThat(call.storeVariable()).isEqualTo(0x02);
        assertThat(call.length()).isEqualTo(7);
    }

    /**
     * Verifies that a 2OP opcode in variable form may carry more than two operands.
     */
    @Test
    @Tag("unit")
    void testVariableFormTwoOp() {
        // je #01 #02 #03 [TRUE] +5
        DecodedInstruction je = decode(0xC1, 0x57, 0x01, 0x02, 0x03, 0xC5);

        assertThat(je.opcode()).isEqualTo(Opcode.JE);
        assertThat(je.operands()).hasSize(3);
        assertThat(je.branch()).isEqualTo(new Branch(true, 5));
        assertThat(je.branch().target(je.nextAddress())).isEqualTo(AT + 6 + 3);
    }

    @Test
    @Tag("unit")
    void testShortBranchOnFalse() {
        // jz L00 [FALSE] RTRUE
        DecodedInstruction jz = decode(0xA0, 0x01, 0x41);
        assertThat(jz.branch()).isEqualTo(new Branch(false, Branch.RETURN_TRUE));
    }

    /**
     * Verifies the 14-bit signed branch offset.
     */
    @Test
    @Tag("unit")
    void testLongBranchOffsets() {
        // jz #00 [TRUE] -3
        DecodedInstruction back = decode(0x90, 0x00, 0xBF, 0xFD);
        assertThat(back.branch()).isEqualTo(new Branch(true, -3));
        assertThat(back.length()).isEqualTo(4);
        assertThat(back.branch().target(back.nextAddress())).isEqualTo(AT - 1);

        // jz #00 [FALSE] +0x1234
        DecodedInstruction forward = decode(0x90, 0x00, 0x12, 0x34);
        assertThat(forward.branch()).isEqualTo(new Branch(false, 0x1234));
    }

    /**
     * Verifies that a store comes before the branch field.
     */
    @Test
    @Tag("unit")
    void testStoreAndBranch() {
        // get_child #02 -> G01 [TRUE] +2
        DecodedInstruction getChild = decode(0x92, 0x02, 0x11, 0xC2);

        assertThat(getChild.storeVariable()).isEqualTo(0x11);
        assertThat(getChild.branch()).isEqualTo(new Branch(true, 2));
        assertThat(getChild.length()).isEqualTo(4);
    }

    /**
     * Verifies that inline text is included in the instruction length.
     */
    @Test
    @Tag("unit")
    void testInlineText() {
        byte[] image = new StoryImageBuilder().emit(0xB2).emitText("Hello there").emit(0xBA).build();
        DecodedInstruction print = decoder.decode(new Memory(image, StoryImageBuilder.STATIC_BASE), AT);

        assertThat(print.opcode()).isEqualTo(Opcode.PRINT);
        assertThat(print.textAddress()).isEqualTo(AT + 1);
        assertThat(print.length()).isEqualTo(1 + StoryImageBuilder.encode("Hello there").length);
    }

    @Test
    @Tag("unit")
    void testUnknownOpcodes() {
        // 0OP 15 does not exist in version 3
        assertThatThrownBy(() -> decode(0xBF))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("0OP");
        // VAR 12 (set_cursor) is a version 4 opcode
        assertThatThrownBy(() -> decode(0xEC, 0xFF)).isInstanceOf(DecodeException.class);
        // 2OP 0 is unassigned
        assertThatThrownBy(() -> decode(0x00, 0x01, 0x02)).isInstanceOf(DecodeException.class);
    }

    /**
     * Verifies that a 2OP opcode other than je needs two operands.
     */
    @Test
    @Tag("unit")
    void testTwoOpNeedsTwoOperands() {
        assertThatThrownBy(() -> decode(0xD4, 0x7F, 0x01, 0x00))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("add");
    }

    @Test
    @Tag("unit")
    void testIndirectOpcodes() {
        assertThat(Opcode.LOAD.isIndirect()).isTrue();
        assertThat(Opcode.PULL.isIndirect()).isTrue();
        assertThat(Opcode.INC_CHK.isIndirect()).isTrue();
        assertThat(Opcode.PUSH.isIndirect()).isFalse();
        assertThat(Opcode.GET_PROP_ADDR.mnemonic()).isEqualTo("get_prop_addr");
        assertThat(Opcode.lookup(OperandCount.VAR, 0x13)).isEqualTo(Opcode.OUTPUT_STREAM);
    }
}
