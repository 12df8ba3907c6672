package org.zmachine3.runtime.api;

/**
 * The contents of the version 3 status line.
 *
 * @param location The short name of the current location object.
 * @param first The score, or the hour in a time game.
 * @param second The number of moves, or the minutes in a time game.
 * @param timeGame Whether the values are a time of day.
 */
public record StatusLine(String location, int first, int second, boolean timeGame) {

    /**
     * Renders the right-hand side of the status line.
     * @return e.g. {@code Score: 10  Moves: 4} or {@code Time: 9:05}.
     */
    public String scoreText() {
        if (timeGame) {
            return String.format("Time: %d:%02d", first, second);
        }
        return String.format("Score: %d  Moves: %d", first, second);
    }

    /**
     * Renders the status line padded to a screen width.
     * @param width The number of columns available.
     * @return The line, exactly {@code width} characters long when the width allows it.
     */
    public String render(int width) {
        String left = " " + location;
        String right = scoreText() + " ";
        int gap = Math.max(1, width - left.length() - right.length());
        return left + " ".repeat(gap) + right;
    }
}
