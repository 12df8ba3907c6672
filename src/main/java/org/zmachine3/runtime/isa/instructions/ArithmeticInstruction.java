package org.zmachine3.runtime.isa.instructions;

import org.zmachine3.runtime.api.ZMachineException;
import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;

import static org.zmachine3.runtime.Config.toSigned;

/**
 * Handles the signed 16-bit arithmetic instructions add, sub, mul, div and mod.
 * Results wrap modulo 0x10000; division truncates toward zero.
 */
public class ArithmeticInstruction extends Instruction {

    /**
     * Constructs a new ArithmeticInstruction.
     * @param decoded The decoded instruction.
     */
    public ArithmeticInstruction(DecodedInstruction decoded) {
        super(decoded);
    }

    @Override
    public void execute(ExecutionContext context) {
        int[] operands = resolveOperands(context, 2);
        int a = toSigned(operands[0]);
        int b = toSigned(operands[1]);
        int result = switch (decoded.opcode()) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> {
                requireNonZero(b);
                yield a / b;
            }
            case MOD -> {
                requireNonZero(b);
                yield a % b;
            }
            default -> throw unexpectedOpcode();
        };
        store(context, result);
    }

    private void requireNonZero(int divisor) {
        if (divisor == 0) {
            throw new ZMachineException("Division by zero in " + decoded.opcode().mnemonic());
        }
    }
}
