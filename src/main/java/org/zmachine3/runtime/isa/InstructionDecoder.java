package org.zmachine3.runtime.isa;

import org.zmachine3.runtime.api.DecodeException;
import org.zmachine3.runtime.model.Memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decodes one instruction from memory without changing any machine state.
 */
public final class InstructionDecoder {

    private static final int MAX_VAR_OPERANDS = 4;

    /**
     * Decodes the instruction at the given address.
     * @param memory The story memory.
     * @param address The address of the opcode byte.
     * @return The decoded instruction.
     * @throws DecodeException if the opcode is not a version 3 opcode or the operands do not fit it.
     */
    public DecodedInstruction decode(Memory memory, int address) {
        int cursor = address;
        int opcodeByte = memory.readByte(cursor++);
        OperandCount count;
        int number;
        List<OperandType> types = new ArrayList<>(MAX_VAR_OPERANDS);

        switch ((opcodeByte & 0xC0) >> 6) {
            case 3 -> {
                // variable form
                count = (opcodeByte & 0x20) == 0 ? OperandCount.OP2 : OperandCount.VAR;
                number = opcodeByte & 0x1F;
                int typeByte = memory.readByte(cursor++);
                for (int shift = 6; shift >= 0; shift -= 2) {
                    OperandType type = OperandType.fromBits(typeByte >> shift);
                    if (type == OperandType.OMITTED) {
                        break;
                    }
                    types.add(type);
                }
            }
            case 2 -> {
                // short form
                OperandType type = OperandType.fromBits(opcodeByte >> 4);
                number = opcodeByte & 0x0F;
                if (type == OperandType.OMITTED) {
                    count = OperandCount.OP0;
                } else {
                    count = OperandCount.OP1;
                    types.add(type);
                }
            }
            default -> {
                // long form
                count = OperandCount.OP2;
                number = opcodeByte & 0x1F;
                types.add((opcodeByte & 0x40) != 0 ? OperandType.VARIABLE : OperandType.SMALL_CONSTANT);
                types.add((opcodeByte & 0x20) != 0 ? OperandType.VARIABLE : OperandType.SMALL_CONSTANT);
            }
        }

        Opcode opcode = Opcode.lookup(count, number);
        if (opcode == null) {
            throw new DecodeException(String.format("Unknown %s opcode %d (byte 0x%02X) at 0x%05X",
                    count.label(), number, opcodeByte, address));
        }
        if (count == OperandCount.OP2 && types.size() < 2 && opcode != Opcode.JE) {
            throw new DecodeException(String.format("%s at 0x%05X needs 2 operands, found %d",
                    opcode.mnemonic(), address, types.size()));
        }

        List<Operand> operands = new ArrayList<>(types.size());
        for (OperandType type : types) {
            if (type == OperandType.LARGE_CONSTANT) {
                operands.add(new Operand(type, memory.readWord(cursor)));
                cursor += 2;
            } else {
                operands.add(new Operand(type, memory.readByte(cursor)));
                cursor += 1;
            }
        }

        int storeVariable = -1;
        if (opcode.stores()) {
            storeVariable = memory.readByte(cursor++);
        }

        Branch branch = null;
        if (opcode.branches()) {
            int first = memory.readByte(cursor++);
            boolean onTrue = (first & 0x80) != 0;
            int offset;
            if ((first & 0x40) != 0) {
                offset = first & 0x3F;
            } else {
                offset = ((first & 0x3F) << 8) | memory.readByte(cursor++);
                if ((offset & 0x2000) != 0) {
                    offset -= 0x4000;
                }
            }
            branch = new Branch(onTrue, offset);
        }

        int textAddress = -1;
        if (opcode.hasInlineText()) {
            textAddress = cursor;
            int word;
            do {
                word = memory.readWord(cursor);
                cursor += 2;
            } while ((word & 0x8000) == 0);
        }

        return new DecodedInstruction(address, opcode, Collections.unmodifiableList(operands),
                storeVariable, branch, textAddress, cursor - address);
    }
}
