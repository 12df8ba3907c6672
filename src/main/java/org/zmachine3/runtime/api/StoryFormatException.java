package org.zmachine3.runtime.api;

/**
 * Thrown when a story image cannot be loaded: bad header, unsupported version or checksum mismatch.
 */
public class StoryFormatException extends ZMachineException {

    public StoryFormatException(String message) {
        super(message);
    }
}
