package org.zmachine3.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zmachine3.config.InterpreterOptions;
import org.zmachine3.runtime.api.StatusLine;
import org.zmachine3.runtime.api.StoryFormatException;
import org.zmachine3.runtime.api.ZMachineException;
import org.zmachine3.runtime.internal.services.SeededRandomProvider;
import org.zmachine3.runtime.io.OutputStreams;
import org.zmachine3.runtime.model.Dictionary;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.runtime.model.ObjectTable;
import org.zmachine3.runtime.model.Processor;
import org.zmachine3.runtime.model.RandomSource;
import org.zmachine3.runtime.model.StoryHeader;
import org.zmachine3.runtime.spi.IRandomProvider;
import org.zmachine3.runtime.spi.IStoryIO;
import org.zmachine3.runtime.text.ZText;

import java.io.Writer;

/**
 * One loaded story and all of its mutable state.
 * <p>
 * A machine owns its memory, call stack and random source exclusively, so independent instances can
 * run side by side. It is not thread-safe.
 */
public class Machine {

    private static final Logger LOG = LoggerFactory.getLogger(Machine.class);

    private final StoryHeader header;
    private final Memory memory;
    private final ZText text;
    private final ObjectTable objects;
    private final Dictionary dictionary;
    private final Processor processor;
    private final RandomSource random;
    private final OutputStreams output;
    private final IStoryIO io;
    private final VirtualMachine vm;
    private MachineState state = MachineState.RUNNING;

    /**
     * Loads a story with the default random provider and no transcript.
     * @param image The story file contents.
     * @param io The host.
     * @param options The interpreter options.
     */
    public Machine(byte[] image, IStoryIO io, InterpreterOptions options) {
        this(image, io, options, null);
    }

    /**
     * Loads a story with the default random provider.
     * @param image The story file contents.
     * @param io The host.
     * @param options The interpreter options.
     * @param transcript The writer receiving the transcript stream, or null.
     */
    public Machine(byte[] image, IStoryIO io, InterpreterOptions options, Writer transcript) {
        this(image, io, options, transcript, createRandomProvider(options.randomSeed()));
    }

    /**
     * Loads a story.
     * @param image The story file contents.
     * @param io The host.
     * @param options The interpreter options.
     * @param transcript The writer receiving the transcript stream, or null.
     * @param randomProvider The generator behind the {@code random} opcode.
     * @throws StoryFormatException if the image is not a loadable version 3 story.
     */
    public Machine(byte[] image, IStoryIO io, InterpreterOptions options, Writer transcript, IRandomProvider randomProvider) {
        this.header = StoryHeader.parse(image);
        checkChecksum(header, options.checksumPolicy());
        this.memory = new Memory(image, header.staticBase());
        this.io = io;

        int flags1 = memory.readByte(Config.HEADER_FLAGS1) & ~Config.FLAGS1_STATUS_UNAVAILABLE;
        flags1 = options.splitScreenAvailable() ? flags1 | Config.FLAGS1_SPLIT_AVAILABLE : flags1 & ~Config.FLAGS1_SPLIT_AVAILABLE;
        memory.writeByte(Config.HEADER_FLAGS1, flags1);

        this.text = new ZText(memory, header.abbreviationsAddress());
        this.objects = new ObjectTable(memory, header.objectTableAddress(), text);
        this.dictionary = new Dictionary(memory, header.dictionaryAddress(), text);
        this.processor = new Processor(memory, header.globalsAddress(), header.initialPc(),
                options.maxStackDepth(), options.maxCallDepth());
        this.random = new RandomSource(randomProvider);
        if (options.randomSeed() != 0) {
            random.seed(options.randomSeed());
        }
        this.output = new OutputStreams(memory, io, transcript);
        this.vm = new VirtualMachine(this);

        LOG.info("Loaded story: {} bytes, {} objects, {} dictionary words, start at 0x{}",
                memory.size(), objects.getObjectCount(), dictionary.getEntryCount(),
                Integer.toHexString(header.initialPc()));
    }

    private static IRandomProvider createRandomProvider(long seed) {
        return seed == 0 ? new SeededRandomProvider() : new SeededRandomProvider(seed);
    }

    private static void checkChecksum(StoryHeader header, InterpreterOptions.ChecksumPolicy policy) {
        if (header.checksumValid()) {
            return;
        }
        String message = String.format("Checksum mismatch: header 0x%04X, computed 0x%04X",
                header.checksum(), header.computedChecksum());
        switch (policy) {
            case STRICT -> throw new StoryFormatException(message);
            case WARN -> LOG.warn(message);
            case IGNORE -> LOG.debug(message);
        }
    }

    /**
     * Executes one instruction. A machine waiting for input retries its {@code sread}.
     * @return The state after the instruction.
     * @throws ZMachineException on any fatal error; the machine is halted afterwards.
     */
    public MachineState step() {
        if (state == MachineState.HALTED) {
            return state;
        }
        state = MachineState.RUNNING;
        int pc = processor.getPc();
        try {
            vm.execute(vm.plan());
        } catch (ZMachineException e) {
            e.atPc(pc);
            state = MachineState.HALTED;
            LOG.error("Fatal interpreter error: {}", e.getMessage());
            throw e;
        }
        return state;
    }

    /**
     * Executes instructions until the story quits, halts or waits for input.
     * @return {@link MachineState#HALTED} or {@link MachineState#AWAITING_INPUT}.
     */
    public MachineState run() {
        do {
            step();
        } while (state == MachineState.RUNNING);
        return state;
    }

    /**
     * Builds the status line from the location object and globals 17 and 18.
     * @return The current status line.
     */
    public StatusLine getStatusLine() {
        int globals = header.globalsAddress();
        int location = memory.readWord(globals);
        String name = location >= 1 && location <= objects.getObjectCount() ? objects.getShortName(location) : "";
        int first = memory.readWord(globals + 2);
        int second = memory.readWord(globals + 4);
        boolean timeGame = header.isTimeGame();
        return new StatusLine(name, timeGame ? first : Config.toSigned(first), second, timeGame);
    }

    /**
     * Sends the current status line to the host.
     */
    public void showStatus() {
        io.showStatus(getStatusLine());
    }

    public MachineState getState() {
        return state;
    }

    public void setState(MachineState state) {
        this.state = state;
    }

    public StoryHeader getHeader() {
        return header;
    }

    public Memory getMemory() {
        return memory;
    }

    public ZText getText() {
        return text;
    }

    public ObjectTable getObjects() {
        return objects;
    }

    public Dictionary getDictionary() {
        return dictionary;
    }

    public Processor getProcessor() {
        return processor;
    }

    public RandomSource getRandom() {
        return random;
    }

    public OutputStreams getOutput() {
        return output;
    }

    public IStoryIO getIo() {
        return io;
    }
}
