package org.zmachine3.runtime.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zmachine3.runtime.Config;
import org.zmachine3.runtime.api.ZMachineException;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.runtime.spi.IStoryIO;
import org.zmachine3.runtime.text.ZsciiMapper;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Routes printed text to the selected output streams.
 * <p>
 * Stream 1 is the screen, stream 2 the transcript and stream 3 a table in dynamic memory. While a
 * memory stream is open, text goes to that table only. The transcript state lives in bit 0 of Flags 2,
 * so the story may toggle it by writing the header directly.
 */
public class OutputStreams {

    private static final Logger LOG = LoggerFactory.getLogger(OutputStreams.class);

    private final Memory memory;
    private final IStoryIO io;
    private Writer transcript;
    private boolean screenSelected = true;
    private final Deque<MemoryStream> memoryStreams = new ArrayDeque<>();

    private static final class MemoryStream {
        final int tableAddress;
        int length;

        MemoryStream(int tableAddress) {
            this.tableAddress = tableAddress;
        }
    }

    /**
     * Creates the stream router.
     * @param memory The story memory.
     * @param io The host receiving screen output.
     * @param transcript The writer receiving transcript output, or null if transcripts are not kept.
     */
    public OutputStreams(Memory memory, IStoryIO io, Writer transcript) {
        this.memory = memory;
        this.io = io;
        this.transcript = transcript;
    }

    /**
     * Prints text to every active stream.
     * @param text The decoded text.
     */
    public void print(String text) {
        if (text.isEmpty()) {
            return;
        }
        MemoryStream table = memoryStreams.peek();
        if (table != null) {
            for (int i = 0; i < text.length(); i++) {
                int zscii = ZsciiMapper.fromUnicode(text.charAt(i));
                if (zscii < 0) {
                    continue;
                }
                memory.writeByte(table.tableAddress + 2 + table.length, zscii);
                table.length++;
            }
            return;
        }
        if (screenSelected) {
            io.print(text);
        }
        writeTranscript(text);
    }

    /**
     * Copies a line the player typed to the transcript; the screen already shows it.
     * @param line The input line.
     */
    public void echoInput(String line) {
        if (memoryStreams.isEmpty()) {
            writeTranscript(line + "\n");
        }
    }

    private void writeTranscript(String text) {
        if (!isTranscriptOn() || transcript == null) {
            return;
        }
        try {
            transcript.write(text);
            transcript.flush();
        } catch (IOException e) {
            LOG.warn("Transcript write failed, transcript disabled: {}", e.getMessage());
            transcript = null;
        }
    }

    /**
     * Executes {@code output_stream}.
     * @param stream The signed stream number; positive selects, negative deselects.
     * @param tableAddress The table for stream 3.
     */
    public void select(int stream, int tableAddress) {
        switch (stream) {
            case 1 -> screenSelected = true;
            case -1 -> screenSelected = false;
            case 2 -> setTranscript(true);
            case -2 -> setTranscript(false);
            case 3 -> openMemoryStream(tableAddress);
            case -3 -> closeMemoryStream();
            case 4, -4, 0 -> LOG.debug("Ignoring output stream {}", stream);
            default -> throw new ZMachineException("Invalid output stream " + stream);
        }
    }

    public boolean isScreenSelected() {
        return screenSelected;
    }

    public boolean isTranscriptOn() {
        return (memory.readByte(Config.HEADER_FLAGS2) & Config.FLAGS2_TRANSCRIPT) != 0;
    }

    public int getMemoryStreamDepth() {
        return memoryStreams.size();
    }

    private void setTranscript(boolean on) {
        int flags2 = memory.readByte(Config.HEADER_FLAGS2);
        memory.writeByte(Config.HEADER_FLAGS2, on ? flags2 | Config.FLAGS2_TRANSCRIPT : flags2 & ~Config.FLAGS2_TRANSCRIPT);
    }

    private void openMemoryStream(int tableAddress) {
        if (memoryStreams.size() >= Config.MAX_MEMORY_STREAM_DEPTH) {
            throw new ZMachineException("Memory output streams nested deeper than " + Config.MAX_MEMORY_STREAM_DEPTH);
        }
        memory.writeWord(tableAddress, 0);
        memoryStreams.push(new MemoryStream(tableAddress));
    }

    private void closeMemoryStream() {
        MemoryStream table = memoryStreams.poll();
        if (table == null) {
            LOG.debug("output_stream -3 without an open memory stream");
            return;
        }
        memory.writeWord(table.tableAddress, table.length);
    }
}
