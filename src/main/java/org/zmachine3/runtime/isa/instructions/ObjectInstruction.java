package org.zmachine3.runtime.isa.instructions;

import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;
import org.zmachine3.runtime.model.ObjectTable;

/**
 * Handles the object tree, attribute and property instructions.
 */
public class ObjectInstruction extends Instruction {

    public ObjectInstruction(DecodedInstruction decoded) {
        super(decoded);
    }

    @Override
    public void execute(ExecutionContext context) {
        ObjectTable objects = context.getObjects();
        switch (decoded.opcode()) {
            case GET_PARENT -> store(context, objects.getParent(resolveOperands(context, 1)[0]));
            case GET_CHILD -> {
                int child = objects.getChild(resolveOperands(context, 1)[0]);
                store(context, child);
                branch(context, child != 0);
            }
            case GET_SIBLING -> {
                int sibling = objects.getSibling(resolveOperands(context, 1)[0]);
                store(context, sibling);
                branch(context, sibling != 0);
            }
            case JIN -> {
                int[] operands = resolveOperands(context, 2);
                branch(context, objects.getParent(operands[0]) == operands[1]);
            }
            case INSERT_OBJ -> {
                int[] operands = resolveOperands(context, 2);
                objects.insertObject(operands[0], operands[1]);
            }
            case REMOVE_OBJ -> objects.removeObject(resolveOperands(context, 1)[0]);
            case TEST_ATTR -> {
                int[] operands = resolveOperands(context, 2);
                branch(context, objects.getAttribute(operands[0], operands[1]));
            }
            case SET_ATTR -> {
                int[] operands = resolveOperands(context, 2);
                objects.setAttribute(operands[0], operands[1], true);
            }
            case CLEAR_ATTR -> {
                int[] operands = resolveOperands(context, 2);
                objects.setAttribute(operands[0], operands[1], false);
            }
            case GET_PROP -> {
                int[] operands = resolveOperands(context, 2);
                store(context, objects.getProperty(operands[0], operands[1]));
            }
            case GET_PROP_ADDR -> {
                int[] operands = resolveOperands(context, 2);
                store(context, objects.getPropertyAddress(operands[0], operands[1]));
            }
            case GET_NEXT_PROP -> {
                int[] operands = resolveOperands(context, 2);
                store(context, objects.getNextProperty(operands[0], operands[1]));
            }
            case GET_PROP_LEN -> store(context, objects.getPropertyLength(resolveOperands(context, 1)[0]));
            case PUT_PROP -> {
                int[] operands = resolveOperands(context, 3);
                objects.putProperty(operands[0], operands[1], operands[2]);
            }
            default -> throw unexpectedOpcode();
        }
    }
}
