package org.zmachine3.runtime.api;

/**
 * Thrown when a variable number does not name an existing variable, e.g. a local beyond the
 * count declared by the current routine.
 */
public class InvalidVariableException extends ZMachineException {

    private final int variable;

    /**
     * Constructs a new InvalidVariableException.
     * @param variable The offending variable number.
     * @param message The detail message.
     */
    public InvalidVariableException(int variable, String message) {
        super(message);
        this.variable = variable;
    }

    public int getVariable() {
        return variable;
    }
}
