package org.zmachine3.runtime.services;

import org.zmachine3.runtime.isa.Branch;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.InstructionDecoder;
import org.zmachine3.runtime.isa.Operand;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.runtime.text.ZText;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders decoded instructions as one line of text, e.g.
 * {@code [00004F05] JE\tL00,#05 [TRUE] 00004F0C}.
 * <p>
 * Constants print as {@code #xx} or {@code #xxxx}, variables as {@code (SP)+}, {@code Lxx} or {@code Gxx},
 * and the variable named by an indirect operand in brackets.
 */
public class Disassembler {

    private final InstructionDecoder decoder = new InstructionDecoder();
    private final ZText text;

    /**
     * Creates a disassembler.
     * @param text The codec used to show inline text, or null to omit it.
     */
    public Disassembler(ZText text) {
        this.text = text;
    }

    /**
     * Decodes and renders consecutive instructions.
     * @param memory The story memory.
     * @param from The address of the first instruction.
     * @param count The number of instructions.
     * @return One line per instruction.
     */
    public List<String> disassemble(Memory memory, int from, int count) {
        List<String> lines = new ArrayList<>(count);
        int address = from;
        for (int i = 0; i < count && address < memory.size(); i++) {
            DecodedInstruction instruction = decoder.decode(memory, address);
            lines.add(format(instruction));
            address = instruction.nextAddress();
        }
        return lines;
    }

    /**
     * Renders a decoded instruction.
     * @param instruction The instruction.
     * @return The rendered line.
     */
    public String format(DecodedInstruction instruction) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[%08X] %s\t", instruction.address(), instruction.opcode().name()));
        List<Operand> operands = instruction.operands();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            Operand operand = operands.get(i);
            boolean indirect = i == 0 && instruction.opcode().isIndirect();
            sb.append(formatOperand(operand, indirect));
        }
        if (instruction.hasStore()) {
            sb.append(" -> ").append(instruction.storeVariable() == 0 ? "-(SP)" : variableName(instruction.storeVariable()));
        }
        if (instruction.textAddress() >= 0 && text != null) {
            sb.append(" \"").append(text.decode(instruction.textAddress()).text().replace("\n", "^")).append('"');
        }
        if (instruction.hasBranch()) {
            Branch branch = instruction.branch();
            sb.append(branch.onTrue() ? " [TRUE] " : " [FALSE] ");
            sb.append(switch (branch.offset()) {
                case Branch.RETURN_FALSE -> "RFALSE";
                case Branch.RETURN_TRUE -> "RTRUE";
                default -> String.format("%08X", branch.target(instruction.nextAddress()));
            });
        }
        return sb.toString();
    }

    private static String formatOperand(Operand operand, boolean indirect) {
        return switch (operand.type()) {
            case LARGE_CONSTANT -> String.format("#%04x", operand.raw());
            case SMALL_CONSTANT -> indirect
                    ? "[" + (operand.raw() == 0 ? "(SP)" : variableName(operand.raw())) + "]"
                    : String.format("#%02x", operand.raw());
            case VARIABLE -> operand.raw() == 0 ? "(SP)+" : variableName(operand.raw());
            case OMITTED -> "";
        };
    }

    private static String variableName(int variable) {
        if (variable < 0x10) {
            return String.format(Locale.ROOT, "L%02x", variable - 1);
        }
        return String.format(Locale.ROOT, "G%02x", variable - 0x10);
    }
}
