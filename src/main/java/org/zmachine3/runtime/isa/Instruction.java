package org.zmachine3.runtime.isa;

import org.zmachine3.runtime.api.DecodeException;
import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.internal.services.RoutineCallHandler;
import org.zmachine3.runtime.isa.instructions.ArithmeticInstruction;
import org.zmachine3.runtime.isa.instructions.BitwiseInstruction;
import org.zmachine3.runtime.isa.instructions.ConditionalInstruction;
import org.zmachine3.runtime.isa.instructions.ControlFlowInstruction;
import org.zmachine3.runtime.isa.instructions.DataInstruction;
import org.zmachine3.runtime.isa.instructions.InputInstruction;
import org.zmachine3.runtime.isa.instructions.MachineStateInstruction;
import org.zmachine3.runtime.isa.instructions.ObjectInstruction;
import org.zmachine3.runtime.isa.instructions.TextInstruction;
import org.zmachine3.runtime.model.Processor;

/**
 * The abstract base class for all instruction families.
 * <p>
 * An instance wraps one decoded instruction. Subclasses switch over the {@link Opcode}s of their family;
 * the helpers here implement the parts every family shares: operand resolution, storing the result and
 * taking a branch.
 */
public abstract class Instruction {

    protected final DecodedInstruction decoded;

    /**
     * Constructs a new instruction.
     * @param decoded The decoded instruction to execute.
     */
    protected Instruction(DecodedInstruction decoded) {
        this.decoded = decoded;
    }

    /**
     * Creates the family instruction that executes a decoded instruction.
     * @param decoded The decoded instruction.
     * @return The executable instruction.
     */
    public static Instruction plan(DecodedInstruction decoded) {
        return switch (decoded.opcode().family()) {
            case ARITHMETIC -> new ArithmeticInstruction(decoded);
            case BITWISE -> new BitwiseInstruction(decoded);
            case CONDITIONAL -> new ConditionalInstruction(decoded);
            case CONTROL_FLOW -> new ControlFlowInstruction(decoded);
            case DATA -> new DataInstruction(decoded);
            case OBJECT -> new ObjectInstruction(decoded);
            case TEXT -> new TextInstruction(decoded);
            case INPUT -> new InputInstruction(decoded);
            case MACHINE_STATE -> new MachineStateInstruction(decoded);
        };
    }

    /**
     * Executes the instruction.
     * @param context The execution context.
     */
    public abstract void execute(ExecutionContext context);

    public DecodedInstruction getDecoded() {
        return decoded;
    }

    /**
     * Resolves operand values left to right. Variable operands are read through the variable model,
     * so a stack operand pops. Operands kept by a suspended instruction are returned unchanged.
     * @param context The execution context.
     * @param minimum The number of operands the opcode requires.
     * @return The unsigned 16-bit operand values.
     */
    protected int[] resolveOperands(ExecutionContext context, int minimum) {
        Processor processor = context.getProcessor();
        int[] kept = processor.takeSuspendedOperands(decoded.address());
        if (kept != null) {
            return kept;
        }
        if (decoded.operands().size() < minimum) {
            throw new DecodeException(String.format("%s needs %d operands, found %d",
                    decoded.opcode().mnemonic(), minimum, decoded.operands().size()));
        }
        int[] values = new int[decoded.operands().size()];
        for (int i = 0; i < values.length; i++) {
            Operand operand = decoded.operands().get(i);
            values[i] = operand.type() == OperandType.VARIABLE
                    ? processor.readVariable(operand.raw())
                    : operand.raw();
        }
        return values;
    }

    /**
     * Writes a result to the instruction's store variable.
     * @param context The execution context.
     * @param value The result.
     */
    protected void store(ExecutionContext context, int value) {
        if (decoded.hasStore()) {
            context.getProcessor().writeVariable(decoded.storeVariable(), value);
        }
    }

    /**
     * Takes the branch if {@code condition} matches the branch polarity.
     * @param context The execution context.
     * @param condition The result of the test.
     */
    protected void branch(ExecutionContext context, boolean condition) {
        Branch branch = decoded.branch();
        if (branch == null || condition != branch.onTrue()) {
            return;
        }
        switch (branch.offset()) {
            case Branch.RETURN_FALSE -> new RoutineCallHandler(context).executeReturn(0);
            case Branch.RETURN_TRUE -> new RoutineCallHandler(context).executeReturn(1);
            default -> jump(context, branch.target(decoded.nextAddress()));
        }
    }

    /**
     * Continues execution at an absolute address.
     * @param context The execution context.
     * @param address The target address.
     */
    protected void jump(ExecutionContext context, int address) {
        Processor processor = context.getProcessor();
        processor.setPc(address);
        processor.setSkipPcAdvance(true);
    }

    /**
     * Signals a family that received an opcode it does not implement.
     * @return The exception to throw.
     */
    protected IllegalStateException unexpectedOpcode() {
        return new IllegalStateException("Opcode " + decoded.opcode() + " routed to " + getClass().getSimpleName());
    }
}
