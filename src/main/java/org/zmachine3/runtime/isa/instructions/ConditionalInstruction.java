package org.zmachine3.runtime.isa.instructions;

import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;

import static org.zmachine3.runtime.Config.toSigned;

/**
 * Handles the comparison branches je, jl, jg and jz.
 * <p>
 * {@code je} compares its first operand against each of the remaining ones and branches if any is equal.
 * {@code jl} and {@code jg} compare signed values.
 */
public class ConditionalInstruction extends Instruction {

    public ConditionalInstruction(DecodedInstruction decoded) {
        super(decoded);
    }

    @Override
    public void execute(ExecutionContext context) {
        boolean condition = switch (decoded.opcode()) {
            case JE -> {
                int[] operands = resolveOperands(context, 1);
                boolean equal = false;
                for (int i = 1; i < operands.length; i++) {
                    equal |= operands[0] == operands[i];
                }
                yield equal;
            }
            case JL -> {
                int[] operands = resolveOperands(context, 2);
                yield toSigned(operands[0]) < toSigned(operands[1]);
            }
            case JG -> {
                int[] operands = resolveOperands(context, 2);
                yield toSigned(operands[0]) > toSigned(operands[1]);
            }
            case JZ -> resolveOperands(context, 1)[0] == 0;
            default -> throw unexpectedOpcode();
        };
        branch(context, condition);
    }
}
