package org.zmachine3.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;
import org.zmachine3.runtime.isa.InstructionDecoder;
import org.zmachine3.runtime.model.Processor;
import org.zmachine3.runtime.services.Disassembler;

/**
 * The fetch-decode-execute core.
 * Planning decodes the instruction at the program counter without side effects; execution runs it and
 * advances the program counter unless the instruction moved it itself.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final Machine machine;
    private final InstructionDecoder decoder = new InstructionDecoder();
    private final Disassembler disassembler;

    /**
     * Creates a new VM bound to a machine.
     *
     * @param machine The machine whose state the VM executes on.
     */
    public VirtualMachine(Machine machine) {
        this.machine = machine;
        this.disassembler = new Disassembler(machine.getText());
    }

    /**
     * Phase 1: Decodes the instruction at the program counter.
     *
     * @return The planned, but not yet executed, instruction.
     */
    public Instruction plan() {
        DecodedInstruction decoded = decoder.decode(machine.getMemory(), machine.getProcessor().getPc());
        if (LOG.isTraceEnabled()) {
            LOG.trace(disassembler.format(decoded));
        }
        return Instruction.plan(decoded);
    }

    /**
     * Phase 2: Executes a previously planned instruction.
     *
     * @param instruction The planned instruction to be executed.
     */
    public void execute(Instruction instruction) {
        Processor processor = machine.getProcessor();
        processor.setSkipPcAdvance(false);
        instruction.execute(new ExecutionContext(machine));
        if (!processor.shouldSkipPcAdvance()) {
            processor.setPc(instruction.getDecoded().nextAddress());
        }
    }
}
