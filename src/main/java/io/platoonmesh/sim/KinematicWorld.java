package io.platoonmesh.sim;

import io.platoonmesh.config.PlatoonMeshConfig;
import io.platoonmesh.model.Vector3;
import io.platoonmesh.session.VehicleSpawner;
import io.platoonmesh.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * In-process stand-in for the simulator: spawns {@link KinematicVehicle}s and advances them on a
 * fixed physics step.
 */
public final class KinematicWorld implements VehicleSpawner, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KinematicWorld.class);
    private static final double MIN_SPAWN_CLEARANCE = 2.0;

    private final List<KinematicVehicle> vehicles = new CopyOnWriteArrayList<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final LongSupplier clock;
    private ScheduledExecutorService stepper;

    public KinematicWorld() {
        this(System::currentTimeMillis);
    }

    public KinematicWorld(LongSupplier clock) {
        this.clock = clock;
    }

    /**
     * Spawn location of a formation slot: slot 0 is the lead position, each further slot is one
     * spacing further back along -x.
     */
    public static Vector3 formationSlot(int slot) {
        if (slot < 0) {
            throw new IllegalArgumentException("slot must not be negative: " + slot);
        }
        return new Vector3(
                PlatoonMeshConfig.DEFAULT_SPAWN_X - PlatoonMeshConfig.DEFAULT_SPAWN_SPACING * slot,
                PlatoonMeshConfig.DEFAULT_SPAWN_Y,
                PlatoonMeshConfig.DEFAULT_SPAWN_Z
        );
    }

    @Override
    public KinematicVehicle spawn(String blueprint, Vector3 location) {
        for (KinematicVehicle existing : vehicles) {
            if (!existing.isDestroyed() && existing.position().minus(location).length() < MIN_SPAWN_CLEARANCE) {
                throw new IllegalStateException("spawn location occupied by " + existing.id() + ": " + location);
            }
        }
        KinematicVehicle vehicle = new KinematicVehicle("kv-" + ids.incrementAndGet(), blueprint, location, 0.0, clock);
        vehicles.add(vehicle);
        log.info("Spawned {} ({}) at {}", vehicle.id(), blueprint, location);
        return vehicle;
    }

    public void step(double dtSeconds) {
        for (KinematicVehicle vehicle : vehicles) {
            vehicle.step(dtSeconds);
        }
    }

    public synchronized void start(long stepMs) {
        if (stepMs <= 0L) {
            throw new IllegalArgumentException("step period must be positive: " + stepMs);
        }
        if (stepper != null) {
            return;
        }
        stepper = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("kinematic-world", true));
        double dt = stepMs / 1000.0;
        stepper.scheduleAtFixedRate(() -> step(dt), stepMs, stepMs, TimeUnit.MILLISECONDS);
    }

    public List<KinematicVehicle> vehicles() {
        return List.copyOf(vehicles);
    }

    @Override
    public synchronized void close() {
        if (stepper != null) {
            stepper.shutdownNow();
            stepper = null;
        }
    }
}
