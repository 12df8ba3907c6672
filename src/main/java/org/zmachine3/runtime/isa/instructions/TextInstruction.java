package org.zmachine3.runtime.isa.instructions;

import org.zmachine3.runtime.internal.services.ExecutionContext;
import org.zmachine3.runtime.internal.services.RoutineCallHandler;
import org.zmachine3.runtime.io.OutputStreams;
import org.zmachine3.runtime.isa.DecodedInstruction;
import org.zmachine3.runtime.isa.Instruction;
import org.zmachine3.runtime.text.ZsciiMapper;

import static org.zmachine3.runtime.Config.toSigned;

/**
 * Handles the print instructions.
 */
public class TextInstruction extends Instruction {

    public TextInstruction(DecodedInstruction decoded) {
        super(decoded);
    }

    @Override
    public void execute(ExecutionContext context) {
        OutputStreams output = context.getOutput();
        switch (decoded.opcode()) {
            case PRINT -> output.print(context.getText().decode(decoded.textAddress()).text());
            case PRINT_RET -> {
                output.print(context.getText().decode(decoded.textAddress()).text());
                output.print("\n");
                new RoutineCallHandler(context).executeReturn(1);
            }
            case NEW_LINE -> output.print("\n");
            case PRINT_ADDR -> output.print(context.getText().decode(resolveOperands(context, 1)[0]).text());
            case PRINT_PADDR -> output.print(context.getText().decodePacked(resolveOperands(context, 1)[0]));
            case PRINT_OBJ -> output.print(context.getObjects().getShortName(resolveOperands(context, 1)[0]));
            case PRINT_CHAR -> output.print(ZsciiMapper.toUnicode(resolveOperands(context, 1)[0]));
            case PRINT_NUM -> output.print(Integer.toString(toSigned(resolveOperands(context, 1)[0])));
            default -> throw unexpectedOpcode();
        }
    }
}
