package org.zmachine3.runtime.api;

/**
 * Thrown for malformed instruction or text encodings: unknown opcodes, bad operand type
 * combinations, illegal routine headers or nested abbreviations.
 */
public class DecodeException extends ZMachineException {

    public DecodeException(String message) {
        super(message);
    }
}
