package org.zmachine3.runtime.isa.instructions;

import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.runtime.model.Processor;

import static org.zmachine3.runtime.Config.toSigned;
import static org.zmachine3.runtime.Config.toWord;

/**
 * Handles variable, stack and table access.
 * <p>
 * {@code load}, {@code store} and {@code pull} treat variable 0 as the top of the stack in place.
 * {@code inc}, {@code dec}, {@code inc_chk} and {@code dec_chk} pop and push it like any other access.
 */
public class DataInstruction extends Instruction {

    public DataInstruction(DecodedInstruction decoded) {
        super(decoded);
    }

    @Override
    public void execute(ExecutionContext context) {
        Processor processor = context.getProcessor();
        Memory memory = context.getMemory();
        switch (decoded.opcode()) {
            case LOAD -> {
                int variable = resolveOperands(context, 1)[0];
                store(context, processor.readVariableInPlace(variable));
            }
            case STORE -> {
                int[] operands = resolveOperands(context, 2);
                processor.writeVariableInPlace(operands[0], operands[1]);
            }
            case PULL -> {
                int variable = resolveOperands(context, 1)[0];
                int value = processor.pop();
                processor.writeVariableInPlace(variable, value);
            }
            case PUSH -> processor.push(resolveOperands(context, 1)[0]);
            case POP -> processor.pop();
            case INC -> {
                int variable = resolveOperands(context, 1)[0];
                processor.writeVariable(variable, processor.readVariable(variable) + 1);
            }
            case DEC -> {
                int variable = resolveOperands(context, 1)[0];
                processor.writeVariable(variable, processor.readVariable(variable) - 1);
            }
            case INC_CHK -> {
                int[] operands = resolveOperands(context, 2);
                int value = toSigned(toWord(processor.readVariable(operands[0]) + 1));
                processor.writeVariable(operands[0], value);
                branch(context, value > toSigned(operands[1]));
            }
            case DEC_CHK -> {
                int[] operands = resolveOperands(context, 2);
                int value = toSigned(toWord(processor.readVariable(operands[0]) - 1));
                processor.writeVariable(operands[0], value);
                branch(context, value < toSigned(operands[1]));
            }
            case LOADW -> {
                int[] operands = resolveOperands(context, 2);
                store(context, memory.readWord(toWord(operands[0] + 2 * operands[1])));
            }
            case LOADB -> {
                int[] operands = resolveOperands(context, 2);
                store(context, memory.readByte(toWord(operands[0] + operands[1])));
            }
            case STOREW -> {
                int[] operands = resolveOperands(context, 3);
                memory.writeWord(toWord(operands[0] + 2 * operands[1]), operands[2]);
            }
            case STOREB -> {
                int[] operands = resolveOperands(context, 3);
                memory.writeByte(toWord(operands[0] + operands[1]), operands[2]);
            }
            default -> throw unexpectedOpcode();
        }
    }
}
