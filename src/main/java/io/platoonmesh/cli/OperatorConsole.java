package io.platoonmesh.cli;

import io.platoonmesh.session.OperatorCommand;
import io.platoonmesh.session.SessionSnapshot;
import io.platoonmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Line-oriented operator console. Reads commands until end of input or a {@code leave}, queueing
 * session commands and answering {@code status} and {@code help} directly.
 */
final class OperatorConsole implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(OperatorConsole.class);

    private final BufferedReader in;
    private final PrintStream out;
    private final Consumer<OperatorCommand> sink;
    private final Supplier<SessionSnapshot> snapshots;

    OperatorConsole(BufferedReader in, PrintStream out, Consumer<OperatorCommand> sink, Supplier<SessionSnapshot> snapshots) {
        this.in = in;
        this.out = out;
        this.sink = sink;
        this.snapshots = snapshots;
    }

    @Override
    public void run() {
        out.println(OperatorCommandParser.USAGE);
        try {
            String line;
            while ((line = in.readLine()) != null) {
                if (!handle(line)) {
                    return;
                }
            }
            log.debug("operator console reached end of input");
        } catch (IOException e) {
            log.warn("operator console stopped: {}", e.getMessage());
        }
    }

    /**
     * Handles one console line. Returns false once the console should stop reading.
     */
    boolean handle(String line) {
        List<String> tokens = OperatorCommandParser.parseTokens(line);
        if (tokens.isEmpty()) {
            return true;
        }
        String op = OperatorCommandParser.normalizeOp(tokens.get(0));
        if (OperatorCommandParser.isLocalCommand(op)) {
            if ("status".equals(op)) {
                out.println(Jsons.toJson(snapshots.get()));
            } else {
                out.println(OperatorCommandParser.USAGE);
            }
            return true;
        }
        OperatorCommand command;
        try {
            command = OperatorCommandParser.parse(tokens);
        } catch (IllegalArgumentException e) {
            out.println("error: " + e.getMessage());
            return true;
        }
        sink.accept(command);
        return command.kind() != OperatorCommand.Kind.LEAVE;
    }
}
