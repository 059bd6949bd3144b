package io.platoonmesh.cli;

import io.platoonmesh.client.ConnectionException;
import io.platoonmesh.config.PlatoonMeshConfig;
import io.platoonmesh.config.PlatoonSettings;
import io.platoonmesh.model.PeerId;
import io.platoonmesh.observability.EventJournal;
import io.platoonmesh.relay.MessageRelay;
import io.platoonmesh.session.OperatorCommand;
import io.platoonmesh.session.SessionOutcome;
import io.platoonmesh.session.VehicleHandle;
import io.platoonmesh.session.VehicleSession;
import io.platoonmesh.sim.KinematicWorld;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ScopeType;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
        name = "platoonmesh",
        mixinStandardHelpOptions = true,
        description = "Vehicle platoon coordination over a broadcast relay",
        subcommands = {
                PlatoonMeshCommand.RelayCommand.class,
                PlatoonMeshCommand.VehicleCommand.class
        }
)
public final class PlatoonMeshCommand implements Runnable {
    static final int EXIT_CONNECT_FAILED = 1;

    @Option(names = {"--settings"}, scope = ScopeType.INHERIT, description = "Settings JSON file",
            defaultValue = PlatoonMeshConfig.DEFAULT_SETTINGS_FILE)
    Path settingsFile;

    @Override
    public void run() {
        System.out.println("Use subcommands: relay | vehicle");
    }

    PlatoonSettings settings() {
        return PlatoonSettings.load(settingsFile);
    }

    @Command(name = "relay", description = "Run the message relay until interrupted")
    static final class RelayCommand implements Callable<Integer> {
        @ParentCommand
        PlatoonMeshCommand parent;

        @Option(names = {"--bind"}, defaultValue = "0.0.0.0", description = "Bind address")
        String bind;

        @Option(names = {"--port"}, description = "Listen port; defaults to the settings relay port")
        Integer port;

        @Override
        public Integer call() throws Exception {
            PlatoonSettings settings = parent.settings();
            int effectivePort = port == null ? settings.relayPort() : port;
            MessageRelay relay = new MessageRelay(bind, effectivePort,
                    settings.maxFrameBytes(), settings.outboundQueueCapacity());
            relay.start();
            Runtime.getRuntime().addShutdownHook(new Thread(relay::close, "platoonmesh-relay-shutdown"));
            System.out.println("Relay listening on " + bind + ":" + relay.localPort());
            relay.awaitTermination();
            return 0;
        }
    }

    @Command(name = "vehicle", description = "Spawn a vehicle in the kinematic world and run its session")
    static final class VehicleCommand implements Callable<Integer> {
        @ParentCommand
        PlatoonMeshCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--relay-host"}, description = "Relay host; defaults to the settings relay host")
        String relayHost;

        @Option(names = {"--relay-port"}, description = "Relay port; defaults to the settings relay port")
        Integer relayPort;

        @Option(names = {"--slot"}, defaultValue = "0", description = "Formation slot used for the spawn location")
        int slot;

        @Option(names = {"--blueprint"}, defaultValue = PlatoonMeshConfig.DEFAULT_BLUEPRINT,
                description = "Vehicle blueprint id")
        String blueprint;

        @Option(names = {"--peer-id"}, description = "Vehicle id; generated when omitted")
        String peerId;

        @Option(names = {"--journal"}, description = "Optional JSONL event journal path")
        Path journal;

        @Option(names = {"--auto-join"}, defaultValue = "false", description = "Join the platoon right after connecting")
        boolean autoJoin;

        @Option(names = {"--world-step-ms"}, defaultValue = "10", description = "Kinematic world step period in ms")
        long worldStepMs;

        @Override
        public Integer call() throws Exception {
            if (slot < 0) {
                throw new ParameterException(spec.commandLine(), "--slot must be >= 0, got " + slot);
            }
            if (worldStepMs <= 0L) {
                throw new ParameterException(spec.commandLine(), "--world-step-ms must be > 0, got " + worldStepMs);
            }
            PlatoonSettings base = parent.settings();
            PlatoonSettings settings = base.withRelay(
                    relayHost == null ? base.relayHost() : relayHost,
                    relayPort == null ? base.relayPort() : relayPort
            );
            PeerId id = peerId == null ? PeerId.generate() : PeerId.of(peerId);
            EventJournal events = journal == null ? EventJournal.disabled() : EventJournal.open(journal, id);

            try (KinematicWorld world = new KinematicWorld()) {
                world.start(worldStepMs);
                VehicleHandle vehicle = world.spawn(blueprint, KinematicWorld.formationSlot(slot));
                VehicleSession session = new VehicleSession(id, vehicle, settings, events);
                InetSocketAddress relay = new InetSocketAddress(settings.relayHost(), settings.relayPort());
                try {
                    session.start(relay);
                } catch (ConnectionException e) {
                    System.err.println("Could not reach relay " + relay + ": " + e.getMessage());
                    return EXIT_CONNECT_FAILED;
                }
                System.out.println("Vehicle " + id + " (" + blueprint + ") connected to " + relay);

                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    try {
                        session.interrupt(settings.handshakeTimeoutMs());
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                }, "platoonmesh-vehicle-shutdown"));

                if (autoJoin) {
                    session.submit(OperatorCommand.join());
                }
                Thread console = new Thread(new OperatorConsole(
                        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                        System.out,
                        session::submit,
                        session::snapshot
                ), "platoonmesh-console");
                console.setDaemon(true);
                console.start();

                SessionOutcome outcome = session.awaitOutcome();
                System.out.println("Session finished: " + outcome);
                return outcome.exitCode();
            }
        }
    }
}
