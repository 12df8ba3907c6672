package org.zmachine3.runtime.isa;

/**
 * An undecoded operand: a constant, or the number of the variable that holds the value.
 * @param type The operand encoding.
 * @param raw The constant value or variable number as stored in the instruction.
 */
public record Operand(OperandType type, int raw) {}
