package org.zmachine3.runtime;

/**
 * The run state of a {@link Machine}.
 */
public enum MachineState {
    /** Instructions can be executed. */
    RUNNING,
    /** Paused in {@code sread} until the host has a line of input. */
    AWAITING_INPUT,
    /** Stopped by {@code quit}, {@code restart} or a fatal error. */
    HALTED
}
