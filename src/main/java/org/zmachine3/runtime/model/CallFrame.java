package org.zmachine3.runtime.model;

/**
 * One routine activation on the call stack.
 */
public final class CallFrame {

    /** Store variable value meaning "discard the result". */
    public static final int DISCARD_RESULT = -1;

    public final int returnPc;
    public final int storeVariable;
    public final int stackBase;
    private final int[] locals;

    /**
     * Constructs a new CallFrame.
     * @param returnPc The address execution resumes at after the routine returns, or -1 for the main routine.
     * @param storeVariable The variable receiving the return value, or {@link #DISCARD_RESULT}.
     * @param stackBase The evaluation stack height when the routine was entered.
     * @param locals The local variable values; the array length is the declared local count.
     */
    public CallFrame(int returnPc, int storeVariable, int stackBase, int[] locals) {
        this.returnPc = returnPc;
        this.storeVariable = storeVariable;
        this.stackBase = stackBase;
        this.locals = locals;
    }

    public int getLocalCount() {
        return locals.length;
    }

    int getLocal(int index) {
        return locals[index];
    }

    void setLocal(int index, int value) {
        locals[index] = value;
    }
}
