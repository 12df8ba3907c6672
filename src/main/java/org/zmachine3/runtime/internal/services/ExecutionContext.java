package org.zmachine3.runtime.internal.services;

import org.zmachine3.runtime.Machine;
import org.zmachine3.runtime.io.OutputStreams;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.runtime.model.ObjectTable;
import org.zmachine3.runtime.model.Processor;
import org.zmachine3.runtime.text.ZText;

/**
 * Encapsulates all the information and dependencies required at the runtime of an instruction.
 * This object is created by the VirtualMachine and passed to the executing
 * units to avoid global access.
 */
public class ExecutionContext {

    private final Machine machine;

    /**
     * Constructs a new ExecutionContext.
     * @param machine The machine executing the instruction.
     */
    public ExecutionContext(Machine machine) {
        this.machine = machine;
    }

    public Machine getMachine() {
        return machine;
    }

    public Processor getProcessor() {
        return machine.getProcessor();
    }

    public Memory getMemory() {
        return machine.getMemory();
    }

    public ObjectTable getObjects() {
        return machine.getObjects();
    }

    public ZText getText() {
        return machine.getText();
    }

    public OutputStreams getOutput() {
        return machine.getOutput();
    }
}
