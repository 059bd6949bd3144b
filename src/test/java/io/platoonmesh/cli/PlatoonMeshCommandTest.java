package io.platoonmesh.cli;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class PlatoonMeshCommandTest {

    @Test
    void helpListsSubcommands() {
        CommandLine commandLine = new CommandLine(new PlatoonMeshCommand());
        String usage = commandLine.getUsageMessage();
        Assertions.assertTrue(usage.contains("relay"), usage);
        Assertions.assertTrue(usage.contains("vehicle"), usage);
        Assertions.assertEquals(0, commandLine.execute("--help"));
    }

    @Test
    void vehicleExitsNonZeroWhenRelayIsUnreachable() throws Exception {
        int port;
        try (ServerSocket free = new ServerSocket(0)) {
            port = free.getLocalPort();
        }
        Path root = Files.createTempDirectory("platoonmesh-cli-");
        try {
            Path settings = root.resolve("platoonmesh-settings.json");
            Files.writeString(settings, """
                    {
                      "maxReconnectAttempts": 0,
                      "handshakeTimeoutMs": 300
                    }
                    """, StandardCharsets.UTF_8);

            int code = new CommandLine(new PlatoonMeshCommand()).execute(
                    "--settings", settings.toString(),
                    "vehicle",
                    "--relay-host", "127.0.0.1",
                    "--relay-port", String.valueOf(port),
                    "--slot", "1"
            );

            Assertions.assertEquals(PlatoonMeshCommand.EXIT_CONNECT_FAILED, code);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidVehicleOptionsAreUsageErrors() {
        StringWriter err = new StringWriter();
        CommandLine commandLine = new CommandLine(new PlatoonMeshCommand());
        commandLine.setErr(new PrintWriter(err));

        Assertions.assertEquals(CommandLine.ExitCode.USAGE, commandLine.execute("vehicle", "--world-step-ms", "0"));
        Assertions.assertEquals(CommandLine.ExitCode.USAGE, commandLine.execute("vehicle", "--world-step-ms", "-10"));
        Assertions.assertEquals(CommandLine.ExitCode.USAGE, commandLine.execute("vehicle", "--slot", "-1"));
        String output = err.toString();
        Assertions.assertTrue(output.contains("--world-step-ms must be > 0"), output);
        Assertions.assertTrue(output.contains("--slot must be >= 0"), output);
        Assertions.assertFalse(output.contains("at io.platoonmesh"), output);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
