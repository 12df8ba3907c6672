package org.zmachine3.runtime.isa.instructions;

import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;

/**
 * Handles or, and, not and the bitmap test.
 */
public class BitwiseInstruction extends Instruction {

    public BitwiseInstruction(DecodedInstruction decoded) {
        super(decoded);
    }

    @Override
    public void execute(ExecutionContext context) {
        switch (decoded.opcode()) {
            case OR -> {
                int[] operands = resolveOperands(context, 2);
                store(context, operands[0] | operands[1]);
            }
            case AND -> {
                int[] operands = resolveOperands(context, 2);
                store(context, operands[0] & operands[1]);
            }
            case NOT -> {
                int[] operands = resolveOperands(context, 1);
                store(context, ~operands[0]);
            }
            case TEST -> {
                int[] operands = resolveOperands(context, 2);
                branch(context, (operands[0] & operands[1]) == operands[1]);
            }
            default -> throw unexpectedOpcode();
        }
    }
}
