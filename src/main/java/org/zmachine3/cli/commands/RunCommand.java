package org.zmachine3.cli.commands;

import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zmachine3.cli.CommandLineInterface;
import org.zmachine3.cli.ConsoleStoryIO;
import org.zmachine3.config.InterpreterOptions;
import org.zmachine3.config.LoggingConfigurator;
import org.zmachine3.runtime.Machine;
import org.zmachine3.runtime.MachineState;
import org.zmachine3.runtime.VirtualMachine;
import org.zmachine3.runtime.api.StoryFormatException;
import org.zmachine3.runtime.api.ZMachineException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Run a story file interactively"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "STORY", description = "The version 3 story file (.z3, .dat)")
    private File story;

    @Option(names = "--seed", description = "Seed for the random opcode (overrides zmachine.random-seed)")
    private Long seed;

    @Option(names = "--trace", description = "Log every executed instruction at TRACE level")
    private boolean trace;

    @Option(names = "--transcript", paramLabel = "FILE", description = "Write the transcript stream to FILE")
    private File transcript;

    @Override
    public Integer call() {
        InterpreterOptions options = InterpreterOptions.fromConfig(parent.getConfig());
        if (seed != null) {
            options = options.withRandomSeed(seed);
        }
        if (trace) {
            options = options.withTrace(true);
        }
        if (options.trace()) {
            LoggingConfigurator.setLevel(VirtualMachine.class.getName(), "TRACE");
        }

        final byte[] image;
        try {
            image = Files.readAllBytes(story.toPath());
        } catch (IOException e) {
            LOG.error("Cannot read story file {}: {}", story, e.getMessage());
            return 1;
        }

        try (Terminal terminal = createTerminal();
             Writer transcriptWriter = transcript != null
                     ? Files.newBufferedWriter(transcript.toPath(), StandardCharsets.UTF_8)
                     : null) {
            LineReader lineReader = LineReaderBuilder.builder().terminal(terminal).build();
            ConsoleStoryIO io = new ConsoleStoryIO(terminal, lineReader);
            Machine machine = new Machine(image, io, options, transcriptWriter);
            MachineState state = machine.run();
            while (state == MachineState.AWAITING_INPUT && !io.isClosed()) {
                state = machine.run();
            }
            io.flush();
            return 0;
        } catch (StoryFormatException e) {
            LOG.error("Cannot load {}: {}", story, e.getMessage());
            return 1;
        } catch (ZMachineException e) {
            // already logged by the machine
            return 2;
        } catch (IOException e) {
            LOG.error("Terminal or transcript failure: {}", e.getMessage());
            return 1;
        }
    }

    private Terminal createTerminal() throws IOException {
        try {
            return TerminalBuilder.builder()
                    .system(true)
                    .build();
        } catch (IOException e) {
            // Fallback to dumb terminal if system terminal is not available (e.g., in an IDE)
            LOG.debug("System terminal unavailable, using dumb terminal: {}", e.getMessage());
            return TerminalBuilder.builder()
                    .dumb(true)
                    .build();
        }
    }
}
