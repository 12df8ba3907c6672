package org.zmachine3.runtime.internal.services;

import org.zmachine3.runtime.Config;
import org.zmachine3.runtime.api.DecodeException;
import org.zmachine3.runtime.model.CallFrame;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.runtime.model.Processor;

/**
 * Handles the logic for routine calls and returns.
 * This class manages the call stack, local variable initialization and program counter restoration.
 */
public class RoutineCallHandler {

    private final ExecutionContext context;

    /**
     * Constructs a new RoutineCallHandler.
     * @param context The execution context for the current instruction.
     */
    public RoutineCallHandler(ExecutionContext context) {
        this.context = context;
    }

    /**
     * Calls a routine. A packed address of 0 stores false and does not enter any routine.
     * @param packedAddress The packed routine address.
     * @param arguments The argument values, copied into the first locals.
     * @param storeVariable The variable receiving the result, or {@link CallFrame#DISCARD_RESULT}.
     * @param returnPc The address to continue at after the routine returns.
     */
    public void executeCall(int packedAddress, int[] arguments, int storeVariable, int returnPc) {
        Processor processor = context.getProcessor();
        if (packedAddress == 0) {
            if (storeVariable != CallFrame.DISCARD_RESULT) {
                processor.writeVariable(storeVariable, 0);
            }
            return;
        }
        Memory memory = context.getMemory();
        int routine = memory.routineAddress(packedAddress);
        int localCount = memory.readByte(routine);
        if (localCount > Config.MAX_LOCALS) {
            throw new DecodeException(String.format("Routine at 0x%05X declares %d locals", routine, localCount));
        }
        int[] locals = new int[localCount];
        for (int i = 0; i < localCount; i++) {
            locals[i] = memory.readWord(routine + 1 + 2 * i);
        }
        for (int i = 0; i < Math.min(arguments.length, localCount); i++) {
            locals[i] = arguments[i];
        }
        processor.pushFrame(returnPc, storeVariable, locals);
        processor.setPc(routine + 1 + 2 * localCount);
        processor.setSkipPcAdvance(true);
    }

    /**
     * Returns from the current routine, storing the value in the caller's store variable.
     * @param value The return value.
     */
    public void executeReturn(int value) {
        Processor processor = context.getProcessor();
        CallFrame frame = processor.popFrame();
        processor.setPc(frame.returnPc);
        processor.setSkipPcAdvance(true);
        if (frame.storeVariable != CallFrame.DISCARD_RESULT) {
            processor.writeVariable(frame.storeVariable, value);
        }
    }
}
