package org.zmachine3.runtime.spi;

import org.zmachine3.runtime.api.StatusLine;

/**
 * The host side of the machine: the screen and the keyboard.
 * <p>
 * Text arrives already decoded; newlines are {@code '\n'}. The windowing calls default to no-ops for
 * hosts that only offer a single scrolling stream.
 */
public interface IStoryIO {

    /**
     * Writes text to the screen.
     * @param text the decoded text
     */
    void print(String text);

    /**
     * Reads one line of player input.
     * @param maxLength the maximum number of characters the story accepts
     * @return the line without terminator, or null if no line is available yet
     */
    String readLine(int maxLength);

    /**
     * Displays the status line.
     * @param status the current status line contents
     */
    void showStatus(StatusLine status);

    /**
     * Splits the screen so the upper window has the given number of lines.
     * @param lines the height of the upper window, 0 to unsplit
     */
    default void splitWindow(int lines) {
    }

    /**
     * Selects the window that receives output.
     * @param window 0 for the lower window, 1 for the upper window
     */
    default void setWindow(int window) {
    }

    /**
     * Plays a sound effect; version 3 stories only use the built-in beeps.
     * @param number the effect number
     * @param effect the effect action
     * @param volume the volume
     */
    default void soundEffect(int number, int effect, int volume) {
    }
}
