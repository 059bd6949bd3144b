package io.platoonmesh.session;

import io.platoonmesh.client.ConnectionException;
import io.platoonmesh.client.InboundStream;
import io.platoonmesh.client.PeerClient;
import io.platoonmesh.client.PeerClientListener;
import io.platoonmesh.client.ReceivedMessage;
import io.platoonmesh.client.ReconnectPolicy;
import io.platoonmesh.config.PlatoonSettings;
import io.platoonmesh.control.ControlMode;
import io.platoonmesh.control.ControllerSettings;
import io.platoonmesh.control.GapKeepingController;
import io.platoonmesh.model.ControlCommand;
import io.platoonmesh.model.JoinRequest;
import io.platoonmesh.model.LeaveNotice;
import io.platoonmesh.model.PeerId;
import io.platoonmesh.model.PlatoonMessage;
import io.platoonmesh.model.VehicleState;
import io.platoonmesh.observability.EventJournal;
import io.platoonmesh.protocol.PlatoonProtocolEngine;
import io.platoonmesh.protocol.PredecessorStatus;
import io.platoonmesh.protocol.ProtocolUpdate;
import io.platoonmesh.protocol.Role;
import io.platoonmesh.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Drives one vehicle in the platoon. A single scheduled thread runs the control tick: it applies
 * queued operator commands, publishes the vehicle's state, feeds received messages to the protocol
 * engine, and applies the controller's command. Protocol and controller state are only touched
 * from the tick, so they need no locking; other threads communicate through queues and flags.
 */
public final class VehicleSession implements PeerClientListener {
    private static final Logger log = LoggerFactory.getLogger(VehicleSession.class);

    private final PeerId peerId;
    private final VehicleHandle vehicle;
    private final PlatoonProtocolEngine engine;
    private final GapKeepingController controller;
    private final PeerClient client;
    private final EventJournal journal;
    private final long tickIntervalMs;
    private final LongSupplier clock;
    private final ConcurrentLinkedQueue<OperatorCommand> commands = new ConcurrentLinkedQueue<>();
    private final CompletableFuture<SessionOutcome> outcome = new CompletableFuture<>();
    private final AtomicBoolean reconnected = new AtomicBoolean(false);
    private final List<ReceivedMessage> inboundBatch = new ArrayList<>();
    private final ScheduledExecutorService ticker;
    private volatile SessionOutcome leaveOutcome = SessionOutcome.LEFT;
    private volatile String connectionLostReason;
    private volatile SessionSnapshot snapshot;
    private InboundStream inbound;
    private long sequence;
    private long tickCount;
    private Role lastRole = Role.detached();
    private ControlMode lastMode = ControlMode.IDLE;
    private PredecessorStatus lastStatus = PredecessorStatus.NOT_APPLICABLE;
    private ControlCommand lastCommand = ControlCommand.COAST;
    private LeadScript activeScript;
    private long scriptStartedAtMs;

    public VehicleSession(PeerId peerId, VehicleHandle vehicle, PlatoonSettings settings, EventJournal journal) {
        this(peerId, vehicle, settings, journal, System::currentTimeMillis);
    }

    VehicleSession(
            PeerId peerId,
            VehicleHandle vehicle,
            PlatoonSettings settings,
            EventJournal journal,
            LongSupplier clock
    ) {
        this.peerId = peerId;
        this.vehicle = vehicle;
        this.journal = journal == null ? EventJournal.disabled() : journal;
        this.clock = clock;
        this.tickIntervalMs = settings.tickIntervalMs();
        this.engine = new PlatoonProtocolEngine(peerId, settings.staleTimeoutMs());
        this.controller = new GapKeepingController(
                ControllerSettings.from(settings),
                settings.targetGapMeters(),
                settings.targetSpeedMps()
        );
        this.client = new PeerClient(
                peerId,
                settings.handshakeTimeoutMs(),
                settings.maxFrameBytes(),
                settings.outboundQueueCapacity(),
                new ReconnectPolicy(
                        settings.reconnectBaseBackoffMs(),
                        settings.reconnectMaxBackoffMs(),
                        settings.maxReconnectAttempts()
                ),
                this,
                clock
        );
        this.ticker = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("session-tick-" + peerId, true));
        this.snapshot = SessionSnapshot.initial(peerId, settings.targetGapMeters(), settings.targetSpeedMps());
    }

    public PeerId peerId() {
        return peerId;
    }

    /**
     * Connects to the relay, retrying with backoff, without starting the periodic tick;
     * {@link #tick()} must then be driven by the caller.
     */
    public void connect(InetSocketAddress relayAddress) throws ConnectionException, InterruptedException {
        client.connectWithRetry(relayAddress);
        inbound = client.receive();
        journal.record("connection.open", Map.of("relay", relayAddress.toString()));
    }

    /**
     * Connects and starts ticking at the configured period. Ticks never overlap; an overlong tick
     * delays the next one.
     */
    public void start(InetSocketAddress relayAddress) throws ConnectionException, InterruptedException {
        connect(relayAddress);
        ticker.scheduleAtFixedRate(this::safeTick, 0L, tickIntervalMs, TimeUnit.MILLISECONDS);
        log.info("{} control loop started at {} ms period", peerId, tickIntervalMs);
    }

    /**
     * Queues an operator command; it takes effect on the next tick.
     */
    public void submit(OperatorCommand command) {
        if (outcome.isDone()) {
            log.warn("{} session already finished, ignoring {}", peerId, command.kind());
            return;
        }
        commands.add(command);
    }

    public SessionSnapshot snapshot() {
        return snapshot;
    }

    public boolean isFinished() {
        return outcome.isDone();
    }

    public SessionOutcome awaitOutcome() throws InterruptedException {
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Session failed", e.getCause());
        }
    }

    public Optional<SessionOutcome> awaitOutcome(long timeoutMs) throws InterruptedException {
        try {
            return Optional.of(outcome.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Session failed", e.getCause());
        }
    }

    /**
     * Leaves the platoon: the leave notice is broadcast after pending sends, then the connection
     * closes. Runs on the tick thread when the loop is active, otherwise inline.
     */
    public SessionOutcome shutdown(long timeoutMs) throws InterruptedException {
        if (outcome.isDone()) {
            return outcome.getNow(SessionOutcome.LEFT);
        }
        submit(OperatorCommand.leave());
        Optional<SessionOutcome> finished = awaitOutcome(timeoutMs);
        if (finished.isPresent()) {
            return finished.get();
        }
        ticker.shutdownNow();
        ticker.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
        synchronized (this) {
            if (!outcome.isDone()) {
                leave(clock.getAsLong());
            }
        }
        return awaitOutcome();
    }

    /**
     * Shutdown triggered by a process signal: the same leave sequence as {@link #shutdown(long)},
     * finishing with {@link SessionOutcome#INTERRUPTED}.
     */
    public SessionOutcome interrupt(long timeoutMs) throws InterruptedException {
        leaveOutcome = SessionOutcome.INTERRUPTED;
        return shutdown(timeoutMs);
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("{} tick failed", peerId, e);
        }
    }

    /**
     * One control cycle.
     */
    public synchronized void tick() {
        if (outcome.isDone()) {
            return;
        }
        long now = clock.getAsLong();
        tickCount++;
        try {
            applyCommands(now);
            if (outcome.isDone()) {
                return;
            }
            if (connectionLostReason != null) {
                applyControl(ControlCommand.brake(1.0, 0.0));
                journal.record("connection.lost", Map.of("reason", connectionLostReason));
                finish(SessionOutcome.CONNECTION_LOST);
                return;
            }
            if (reconnected.getAndSet(false)) {
                inbound = client.receive();
            }

            VehicleState own = readOwnState();
            Optional<LeadScript.Step> scripted = scriptStep(now);
            if (scripted.map(LeadScript.Step::broadcast).orElse(true)) {
                client.send(own);
            }

            boolean predecessorChanged = drainInbound();
            Role role = engine.currentRole();
            if (predecessorChanged || !role.equals(lastRole)) {
                controller.reset();
            }
            if (!role.equals(lastRole)) {
                log.info("{} role {} -> {}", peerId, lastRole, role);
                journal.record("role.change", Map.of("from", lastRole.toString(), "to", role.toString()));
                lastRole = role;
            }
            if (scripted.isPresent() && !role.isLeader()) {
                stopScript("no longer leading");
                scripted = Optional.empty();
            }

            PredecessorStatus status = engine.predecessorStatus(now);
            reportPredecessorStatus(role, status);
            boolean failSafe = !client.isConnected()
                    || status == PredecessorStatus.STALE
                    || status == PredecessorStatus.AWAITING;
            ControlCommand command = controller.compute(role, engine.predecessorTrack().orElse(null), own, failSafe);
            ControlMode mode = controller.mode();
            if (scripted.isPresent() && !failSafe) {
                command = scripted.get().command();
                mode = ControlMode.SCRIPTED;
            }
            reportMode(mode);
            applyControl(command);
            publishSnapshot(role, status, mode);
        } catch (VehicleHandleException e) {
            log.error("{} vehicle handle failed, terminating session", peerId, e);
            journal.record("vehicle.failure", Map.of("error", String.valueOf(e.getMessage())));
            engine.leaveLocally(now);
            if (client.isConnected()) {
                client.send(new LeaveNotice(peerId));
            }
            client.close();
            finish(SessionOutcome.VEHICLE_FAILURE);
        }
    }

    private void applyCommands(long now) {
        OperatorCommand command;
        while ((command = commands.poll()) != null) {
            switch (command.kind()) {
                case JOIN -> join(now);
                case LEAVE -> {
                    leave(now);
                    return;
                }
                case SET_GAP, SET_SPEED -> applyTarget(command);
                case RUN_SCRIPT -> startScript((int) command.value(), now);
                case STOP_SCRIPT -> stopScript("stopped by operator");
            }
        }
    }

    private void applyTarget(OperatorCommand command) {
        try {
            if (command.kind() == OperatorCommand.Kind.SET_GAP) {
                controller.setTargetGap(command.value());
                log.info("{} target gap set to {} m", peerId, command.value());
                journal.record("target.gap", Map.of("meters", command.value()));
            } else {
                controller.setTargetSpeed(command.value());
                log.info("{} target speed set to {} m/s", peerId, command.value());
                journal.record("target.speed", Map.of("mps", command.value()));
            }
        } catch (IllegalArgumentException e) {
            log.warn("{} rejected {}: {}", peerId, command.kind(), e.getMessage());
        }
    }

    private void startScript(int number, long now) {
        if (!engine.currentRole().isLeader()) {
            log.warn("{} lead script {} ignored, only the leader runs scripts (role {})",
                    peerId, number, engine.currentRole());
            return;
        }
        LeadScript script;
        try {
            script = LeadScript.builtIn(number);
        } catch (IllegalArgumentException e) {
            log.warn("{} rejected {}: {}", peerId, OperatorCommand.Kind.RUN_SCRIPT, e.getMessage());
            return;
        }
        activeScript = script;
        scriptStartedAtMs = now;
        log.info("{} running lead script {} ({}) for {} ms",
                peerId, script.number(), script.description(), script.totalDurationMs());
        journal.record("script.start", Map.of("script", script.number(), "durationMs", script.totalDurationMs()));
    }

    private Optional<LeadScript.Step> scriptStep(long now) {
        if (activeScript == null) {
            return Optional.empty();
        }
        Optional<LeadScript.Step> step = activeScript.stepAt(now - scriptStartedAtMs);
        if (step.isEmpty()) {
            log.info("{} lead script {} finished", peerId, activeScript.number());
            journal.record("script.end", Map.of("script", activeScript.number(), "reason", "finished"));
            activeScript = null;
        }
        return step;
    }

    private void stopScript(String reason) {
        if (activeScript == null) {
            return;
        }
        log.info("{} lead script {} stopped: {}", peerId, activeScript.number(), reason);
        journal.record("script.end", Map.of("script", activeScript.number(), "reason", reason));
        activeScript = null;
    }

    private void join(long now) {
        if (!client.isConnected()) {
            log.warn("{} cannot join while not connected ({})", peerId, client.state());
            return;
        }
        ProtocolUpdate update = engine.joinLocally(now);
        if (update.predecessorChanged()) {
            controller.reset();
        }
        client.send(new JoinRequest(peerId, now));
        journal.record("membership.join", Map.of("members", membersAsStrings()));
    }

    private void leave(long now) {
        engine.leaveLocally(now);
        if (client.isConnected()) {
            client.send(new LeaveNotice(peerId));
        }
        client.close();
        journal.record("membership.leave", Map.of());
        try {
            applyControl(ControlCommand.brake(1.0, 0.0));
        } catch (VehicleHandleException e) {
            log.warn("{} could not brake after leaving: {}", peerId, e.getMessage());
        }
        finish(leaveOutcome);
    }

    private boolean drainInbound() {
        if (inbound == null) {
            return false;
        }
        inboundBatch.clear();
        inbound.drainReceivedTo(inboundBatch);
        boolean predecessorChanged = false;
        for (ReceivedMessage received : inboundBatch) {
            PlatoonMessage message = received.message();
            ProtocolUpdate update = engine.handleInbound(message, received.receivedAtMs());
            predecessorChanged |= update.predecessorChanged();
            if (update.membershipChanged()) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("event", message.kind().name());
                details.put("peer", message.sender().value());
                details.put("members", membersAsStrings());
                journal.record("membership.change", details);
            }
            update.rosterToBroadcast().ifPresent(client::send);
        }
        inboundBatch.clear();
        return predecessorChanged;
    }

    private void reportPredecessorStatus(Role role, PredecessorStatus status) {
        if (status == lastStatus) {
            return;
        }
        if (status == PredecessorStatus.STALE) {
            log.warn("{} predecessor {} is stale, entering fail-safe", peerId, role.predecessor());
            journal.record("predecessor.stale", Map.of("predecessor", String.valueOf(role.predecessor())));
        } else if (status == PredecessorStatus.FRESH && lastStatus == PredecessorStatus.STALE) {
            log.info("{} predecessor {} reporting again", peerId, role.predecessor());
            journal.record("predecessor.fresh", Map.of("predecessor", String.valueOf(role.predecessor())));
        }
        lastStatus = status;
    }

    private void reportMode(ControlMode mode) {
        if (mode == lastMode) {
            return;
        }
        log.info("{} control mode {} -> {}", peerId, lastMode, mode);
        journal.record("mode.change", Map.of("from", lastMode.name(), "to", mode.name()));
        lastMode = mode;
    }

    private VehicleState readOwnState() {
        VehicleReading reading = vehicle.getState();
        return new VehicleState(
                peerId,
                reading.position(),
                reading.velocity(),
                reading.heading(),
                ++sequence,
                reading.timestampMs()
        );
    }

    private void applyControl(ControlCommand command) {
        vehicle.applyControl(command.throttle(), command.brake(), command.steer());
        lastCommand = command;
    }

    private void publishSnapshot(Role role, PredecessorStatus status, ControlMode mode) {
        snapshot = new SessionSnapshot(
                peerId,
                tickCount,
                client.state(),
                role.toString(),
                engine.members(),
                mode,
                status,
                controller.targetGapMeters(),
                controller.targetSpeedMps(),
                lastCommand
        );
    }

    private List<String> membersAsStrings() {
        return engine.members().stream().map(PeerId::value).toList();
    }

    private void finish(SessionOutcome result) {
        if (outcome.complete(result)) {
            log.info("{} session finished: {}", peerId, result);
            ticker.shutdown();
        }
    }

    @Override
    public void onReconnected() {
        reconnected.set(true);
        journal.record("connection.reconnected", Map.of());
    }

    @Override
    public void onDisconnected(String reason) {
        connectionLostReason = reason == null ? "disconnected" : reason;
    }
}
