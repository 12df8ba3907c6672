package org.zmachine3.runtime.model;

import org.zmachine3.runtime.Config;
import org.zmachine3.runtime.api.InvalidVariableException;
import org.zmachine3.runtime.api.ZMachineException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The execution state of the machine: program counter, evaluation stack, call frames and
 * the variable addressing that ties them to the global table.
 * <p>
 * The evaluation stack is one contiguous array; every frame sees only the slice above its own base.
 * All values are held as unsigned 16-bit words.
 */
public class Processor {

    private final Memory memory;
    private final int globalsAddress;
    private final int[] stack;
    private final int maxCallDepth;
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private int stackPointer;
    private int pc;
    private boolean skipPcAdvance = false;
    private int suspendedAt = -1;
    private int[] suspendedOperands;

    /**
     * Creates a processor positioned at the main routine with an empty stack.
     * @param memory The story memory.
     * @param globalsAddress The address of the global variable table.
     * @param initialPc The first instruction of the main routine.
     * @param maxStackDepth The evaluation stack capacity in words.
     * @param maxCallDepth The maximum number of nested routine calls.
     */
    public Processor(Memory memory, int globalsAddress, int initialPc, int maxStackDepth, int maxCallDepth) {
        this.memory = memory;
        this.globalsAddress = globalsAddress;
        this.stack = new int[maxStackDepth];
        this.maxCallDepth = maxCallDepth;
        this.pc = initialPc;
        callStack.push(new CallFrame(-1, CallFrame.DISCARD_RESULT, 0, new int[0]));
    }

    public int getPc() {
        return pc;
    }

    public void setPc(int pc) {
        this.pc = pc;
    }

    /**
     * Marks that the current instruction set the program counter itself.
     * @param skip true to suppress the automatic advance past the instruction.
     */
    public void setSkipPcAdvance(boolean skip) {
        this.skipPcAdvance = skip;
    }

    public boolean shouldSkipPcAdvance() {
        return skipPcAdvance;
    }

    /**
     * Reads a variable. Variable 0 pops the stack.
     * @param variable The variable number 0..255.
     * @return The value.
     */
    public int readVariable(int variable) {
        if (variable == 0) {
            return pop();
        }
        return readNonStack(variable);
    }

    /**
     * Writes a variable. Variable 0 pushes onto the stack.
     * @param variable The variable number 0..255.
     * @param value The value, truncated to 16 bits.
     */
    public void writeVariable(int variable, int value) {
        if (variable == 0) {
            push(value);
            return;
        }
        writeNonStack(variable, value);
    }

    /**
     * Reads a variable named indirectly. Variable 0 peeks at the top of the stack without popping.
     * @param variable The variable number.
     * @return The value.
     */
    public int readVariableInPlace(int variable) {
        if (variable == 0) {
            return peek();
        }
        return readNonStack(variable);
    }

    /**
     * Writes a variable named indirectly. Variable 0 replaces the top of the stack without pushing.
     * @param variable The variable number.
     * @param value The value, truncated to 16 bits.
     */
    public void writeVariableInPlace(int variable, int value) {
        if (variable == 0) {
            requireStackValue();
            stack[stackPointer - 1] = Config.toWord(value);
            return;
        }
        writeNonStack(variable, value);
    }

    private int readNonStack(int variable) {
        if (variable < Config.FIRST_GLOBAL) {
            return currentFrame().getLocal(localIndex(variable));
        }
        return memory.readWord(globalAddress(variable));
    }

    private void writeNonStack(int variable, int value) {
        if (variable < Config.FIRST_GLOBAL) {
            currentFrame().setLocal(localIndex(variable), Config.toWord(value));
            return;
        }
        memory.writeWord(globalAddress(variable), value);
    }

    private int localIndex(int variable) {
        if (variable < 1) {
            throw new InvalidVariableException(variable, "Invalid variable number " + variable);
        }
        CallFrame frame = currentFrame();
        if (variable > frame.getLocalCount()) {
            throw new InvalidVariableException(variable, "Local variable " + variable
                    + " not declared by the current routine (" + frame.getLocalCount() + " locals)");
        }
        return variable - 1;
    }

    private int globalAddress(int variable) {
        if (variable > 0xFF) {
            throw new InvalidVariableException(variable, "Invalid variable number " + variable);
        }
        return globalsAddress + 2 * (variable - Config.FIRST_GLOBAL);
    }

    public void push(int value) {
        if (stackPointer >= stack.length) {
            throw new ZMachineException("Evaluation stack overflow (capacity " + stack.length + ")");
        }
        stack[stackPointer++] = Config.toWord(value);
    }

    public int pop() {
        requireStackValue();
        return stack[--stackPointer];
    }

    public int peek() {
        requireStackValue();
        return stack[stackPointer - 1];
    }

    private void requireStackValue() {
        if (stackPointer <= currentFrame().stackBase) {
            throw new ZMachineException("Evaluation stack underflow in current routine");
        }
    }

    /**
     * Returns the number of values the current routine has on the stack.
     * @return The depth of the current frame's stack slice.
     */
    public int getStackDepth() {
        return stackPointer - currentFrame().stackBase;
    }

    public CallFrame currentFrame() {
        return callStack.peek();
    }

    public int getCallDepth() {
        return callStack.size();
    }

    /**
     * Enters a routine. The new frame's stack slice starts at the current stack height.
     * @param returnPc The address to resume at on return.
     * @param storeVariable The variable receiving the result, or {@link CallFrame#DISCARD_RESULT}.
     * @param locals The initialized local variables.
     */
    public void pushFrame(int returnPc, int storeVariable, int[] locals) {
        if (callStack.size() >= maxCallDepth) {
            throw new ZMachineException("Call stack overflow (maximum depth " + maxCallDepth + ")");
        }
        callStack.push(new CallFrame(returnPc, storeVariable, stackPointer, locals));
    }

    /**
     * Leaves the current routine, discarding whatever it left on the stack.
     * @return The frame that was left.
     */
    public CallFrame popFrame() {
        if (callStack.size() <= 1) {
            throw new ZMachineException("Return from the main routine");
        }
        CallFrame frame = callStack.pop();
        stackPointer = frame.stackBase;
        return frame;
    }

    /**
     * Keeps the resolved operands of an instruction that has to run again, so stack operands are not popped twice.
     * @param address The address of the suspended instruction.
     * @param operands The resolved operand values.
     */
    public void suspendOperands(int address, int[] operands) {
        this.suspendedAt = address;
        this.suspendedOperands = operands.clone();
    }

    /**
     * Returns and clears the operands kept for the instruction at {@code address}.
     * @param address The address of the instruction about to execute.
     * @return The kept operands, or null if none were kept for that address.
     */
    public int[] takeSuspendedOperands(int address) {
        if (suspendedAt != address || suspendedOperands == null) {
            return null;
        }
        int[] operands = suspendedOperands;
        suspendedAt = -1;
        suspendedOperands = null;
        return operands;
    }
}
