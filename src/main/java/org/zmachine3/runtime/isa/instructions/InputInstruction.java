package org.zmachine3.runtime.isa.instructions;

import org.zmachine3.runtime.MachineState;
import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;
import org.zmachine3.runtime.isa.Opcode;
import org.zmachine3.runtime.model.Dictionary;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.runtime.text.ZsciiMapper;

import java.util.List;
import java.util.Locale;

/**
 * Handles {@code sread}: shows the status line, reads a line of input, stores it in the text buffer
 * and writes the tokenized words to the parse buffer.
 * <p>
 * When the host has no line yet the machine pauses and the instruction runs again on resume with the
 * same operand values.
 */
public class InputInstruction extends Instruction {

    private static final int PARSE_ENTRY_SIZE = 4;

    public InputInstruction(DecodedInstruction decoded) {
        super(decoded);
    }

    @Override
    public void execute(ExecutionContext context) {
        if (decoded.opcode() != Opcode.SREAD) {
            throw unexpectedOpcode();
        }
        int[] operands = resolveOperands(context, 2);
        int textBuffer = operands[0];
        int parseBuffer = operands[1];
        Memory memory = context.getMemory();

        context.getMachine().showStatus();
        int maxLength = Math.max(0, memory.readByte(textBuffer) - 1);
        String line = context.getMachine().getIo().readLine(maxLength);
        if (line == null) {
            context.getProcessor().suspendOperands(decoded.address(), operands);
            context.getProcessor().setSkipPcAdvance(true);
            context.getMachine().setState(MachineState.AWAITING_INPUT);
            return;
        }
        context.getOutput().echoInput(line);

        String input = storeText(memory, textBuffer, line.toLowerCase(Locale.ROOT), maxLength);
        storeTokens(memory, parseBuffer, context.getMachine().getDictionary().tokenize(input));
    }

    private String storeText(Memory memory, int textBuffer, String line, int maxLength) {
        StringBuilder stored = new StringBuilder();
        for (int i = 0; i < line.length() && stored.length() < maxLength; i++) {
            char c = line.charAt(i);
            int zscii = ZsciiMapper.fromUnicode(c);
            if (zscii < 0 || zscii == ZsciiMapper.NEWLINE) {
                continue;
            }
            memory.writeByte(textBuffer + 1 + stored.length(), zscii);
            stored.append(c);
        }
        memory.writeByte(textBuffer + 1 + stored.length(), 0);
        return stored.toString();
    }

    private void storeTokens(Memory memory, int parseBuffer, List<Dictionary.Token> tokens) {
        int count = Math.min(memory.readByte(parseBuffer), tokens.size());
        memory.writeByte(parseBuffer + 1, count);
        for (int i = 0; i < count; i++) {
            Dictionary.Token token = tokens.get(i);
            int entry = parseBuffer + 2 + PARSE_ENTRY_SIZE * i;
            memory.writeWord(entry, token.dictionaryAddress());
            memory.writeByte(entry + 2, token.text().length());
            memory.writeByte(entry + 3, token.position() + 1);
        }
    }
}
