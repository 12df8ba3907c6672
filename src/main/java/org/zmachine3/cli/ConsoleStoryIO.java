package org.zmachine3.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zmachine3.runtime.api.StatusLine;
import org.zmachine3.runtime.spi.IStoryIO;

import java.io.PrintWriter;

/**
 * Story host on a JLine terminal.
 * <p>
 * The unfinished last output line is held back and handed to the line reader as its prompt, so the
 * story's {@code >} stays on the input line. The status line is printed in inverse video whenever it changes.
 */
public class ConsoleStoryIO implements IStoryIO {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleStoryIO.class);
    private static final int DEFAULT_WIDTH = 80;

    private final Terminal terminal;
    private final LineReader reader;
    private final PrintWriter writer;
    private final StringBuilder pending = new StringBuilder();
    private StatusLine lastStatus;
    private boolean closed = false;

    public ConsoleStoryIO(Terminal terminal, LineReader reader) {
        this.terminal = terminal;
        this.reader = reader;
        this.writer = terminal.writer();
    }

    @Override
    public void print(String text) {
        pending.append(text);
        int newline = pending.lastIndexOf("\n");
        if (newline >= 0) {
            writer.print(pending.substring(0, newline + 1));
            pending.delete(0, newline + 1);
            writer.flush();
        }
    }

    @Override
    public String readLine(int maxLength) {
        if (closed) {
            return null;
        }
        String prompt = pending.toString();
        pending.setLength(0);
        try {
            String line = reader.readLine(prompt);
            return line.length() > maxLength ? line.substring(0, maxLength) : line;
        } catch (EndOfFileException | UserInterruptException e) {
            LOG.debug("Input closed: {}", e.getClass().getSimpleName());
            closed = true;
            return null;
        }
    }

    @Override
    public void showStatus(StatusLine status) {
        if (status.equals(lastStatus)) {
            return;
        }
        lastStatus = status;
        int width = terminal.getWidth() > 0 ? terminal.getWidth() : DEFAULT_WIDTH;
        writer.println(new AttributedString(status.render(width), AttributedStyle.INVERSE).toAnsi(terminal));
        writer.flush();
    }

    /**
     * Returns whether the player closed the input (end of file or interrupt).
     * @return true once no more input can be read.
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Writes any held-back partial line.
     */
    public void flush() {
        if (pending.length() > 0) {
            writer.println(pending);
            pending.setLength(0);
        }
        writer.flush();
    }
}
