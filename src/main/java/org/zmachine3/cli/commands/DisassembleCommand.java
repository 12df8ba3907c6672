package org.zmachine3.cli.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zmachine3.runtime.api.ZMachineException;
import org.zmachine3.runtime.model.Memory;
import org.zmachine3.runtime.model.StoryHeader;
import org.zmachine3.runtime.services.Disassembler;
import org.zmachine3.runtime.text.ZText;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(
    name = "disassemble",
    description = "Print the instructions of a story file"
)
public class DisassembleCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(DisassembleCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "STORY", description = "The version 3 story file")
    private File story;

    @Option(names = "--from", paramLabel = "ADDR", description = "Start address, e.g. 0x4f05 (default: initial program counter)")
    private String from;

    @Option(names = "--count", paramLabel = "N", defaultValue = "20", description = "Number of instructions (default: ${DEFAULT-VALUE})")
    private int count;

    @Override
    public Integer call() {
        final byte[] image;
        try {
            image = Files.readAllBytes(story.toPath());
        } catch (IOException e) {
            LOG.error("Cannot read story file {}: {}", story, e.getMessage());
            return 1;
        }
        PrintWriter out = spec.commandLine().getOut();
        try {
            StoryHeader header = StoryHeader.parse(image);
            Memory memory = new Memory(image, header.staticBase());
            Disassembler disassembler = new Disassembler(new ZText(memory, header.abbreviationsAddress()));
            int start = from != null ? Integer.decode(from) : header.initialPc();
            disassembler.disassemble(memory, start, count).forEach(out::println);
            out.flush();
            return 0;
        } catch (NumberFormatException e) {
            LOG.error("Invalid start address '{}'", from);
            return 1;
        } catch (ZMachineException e) {
            LOG.error("Disassembly stopped: {}", e.getMessage());
            return 2;
        }
    }
}
