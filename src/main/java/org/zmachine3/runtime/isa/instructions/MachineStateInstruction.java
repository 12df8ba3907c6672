package org.zmachine3.runtime.isa.instructions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zmachine3.runtime.Machine;
import org.zmachine3.runtime.MachineState;
import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;

import static org.zmachine3.runtime.Config.toSigned;

/**
 * Handles the instructions that act on the machine and its host rather than on story data:
 * random, quit, restart, save, restore, verify, the status line, windows, streams and sound.
 */
public class MachineStateInstruction extends Instruction {

    private static final Logger LOG = LoggerFactory.getLogger(MachineStateInstruction.class);

    public MachineStateInstruction(DecodedInstruction decoded) {
        super(decoded);
    }

    @Override
    public void execute(ExecutionContext context) {
        Machine machine = context.getMachine();
        switch (decoded.opcode()) {
            case NOP -> {
            }
            case RANDOM -> store(context, machine.getRandom().random(toSigned(resolveOperands(context, 1)[0])));
            case QUIT -> machine.setState(MachineState.HALTED);
            case RESTART -> {
                LOG.warn("restart is not supported, stopping the story");
                machine.setState(MachineState.HALTED);
            }
            case SAVE, RESTORE -> {
                LOG.warn("{} is not supported", decoded.opcode().mnemonic());
                branch(context, false);
            }
            case VERIFY -> branch(context, machine.getHeader().checksumValid());
            case SHOW_STATUS -> machine.showStatus();
            case SPLIT_WINDOW -> machine.getIo().splitWindow(resolveOperands(context, 1)[0]);
            case SET_WINDOW -> machine.getIo().setWindow(resolveOperands(context, 1)[0]);
            case OUTPUT_STREAM -> {
                int[] operands = resolveOperands(context, 1);
                context.getOutput().select(toSigned(operands[0]), operands.length > 1 ? operands[1] : 0);
            }
            case INPUT_STREAM -> LOG.debug("Ignoring input_stream {}", resolveOperands(context, 1)[0]);
            case SOUND_EFFECT -> {
                int[] operands = resolveOperands(context, 0);
                machine.getIo().soundEffect(
                        operands.length > 0 ? operands[0] : 1,
                        operands.length > 1 ? operands[1] : 0,
                        operands.length > 2 ? operands[2] : 0);
            }
            default -> throw unexpectedOpcode();
        }
    }
}
