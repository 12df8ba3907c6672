package org.zmachine3.runtime.isa.instructions;

import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.internal.services.RoutineCallHandler;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;
import org.zmachine3.runtime.model.CallFrame;

import java.util.Arrays;

import static org.zmachine3.runtime.Config.toSigned;

/**
 * Handles call, the return family and the unconditional jump.
 */
public class ControlFlowInstruction extends Instruction {

    public ControlFlowInstruction(DecodedInstruction decoded) {
        super(decoded);
    }

    @Override
    public void execute(ExecutionContext context) {
        RoutineCallHandler callHandler = new RoutineCallHandler(context);
        switch (decoded.opcode()) {
            case CALL -> {
                int[] operands = resolveOperands(context, 1);
                int[] arguments = Arrays.copyOfRange(operands, 1, operands.length);
                int storeVariable = decoded.hasStore() ? decoded.storeVariable() : CallFrame.DISCARD_RESULT;
                callHandler.executeCall(operands[0], arguments, storeVariable, decoded.nextAddress());
            }
            case RET -> callHandler.executeReturn(resolveOperands(context, 1)[0]);
            case RTRUE -> callHandler.executeReturn(1);
            case RFALSE -> callHandler.executeReturn(0);
            case RET_POPPED -> callHandler.executeReturn(context.getProcessor().pop());
            case JUMP -> {
                int offset = toSigned(resolveOperands(context, 1)[0]);
                jump(context, decoded.nextAddress() + offset - 2);
            }
            default -> throw unexpectedOpcode();
        }
    }
}
