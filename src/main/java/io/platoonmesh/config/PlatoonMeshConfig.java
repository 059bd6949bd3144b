package io.platoonmesh.config;

public final class PlatoonMeshConfig {
    public static final String DEFAULT_RELAY_HOST = "127.0.0.1";
    public static final int DEFAULT_RELAY_PORT = 52384;
    public static final String DEFAULT_SETTINGS_FILE = "platoonmesh-settings.json";
    public static final String DEFAULT_BLUEPRINT = "vehicle.toyota.prius";

    public static final long DEFAULT_TICK_INTERVAL_MS = 50L;
    public static final int DEFAULT_STALE_MISSED_PERIODS = 3;
    public static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 2_000L;
    public static final long DEFAULT_RECONNECT_BASE_BACKOFF_MS = 500L;
    public static final long DEFAULT_RECONNECT_MAX_BACKOFF_MS = 8_000L;
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 6;
    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024;
    public static final int DEFAULT_OUTBOUND_QUEUE_CAPACITY = 1_024;

    public static final double DEFAULT_TARGET_GAP_METERS = 10.0;
    public static final double DEFAULT_TARGET_SPEED_MPS = 8.0;
    public static final double DEFAULT_KP = 0.45;
    public static final double DEFAULT_KD = 0.6;
    public static final double DEFAULT_MAX_ACCELERATION = 3.0;
    public static final double DEFAULT_MAX_DECELERATION = 6.0;
    public static final double DEFAULT_HEADING_GAIN = 1.0 / 30.0;
    public static final double DEFAULT_LATERAL_GAIN = 0.1;
    public static final double DEFAULT_FAIL_SAFE_BRAKE = 0.6;
    public static final double DEFAULT_RELATIVE_SPEED_SMOOTHING = 0.5;

    // Spawn layout of the bundled kinematic world: the lead slot and the spacing behind it.
    public static final double DEFAULT_SPAWN_X = -20.0;
    public static final double DEFAULT_SPAWN_Y = -15.0;
    public static final double DEFAULT_SPAWN_Z = 0.1;
    public static final double DEFAULT_SPAWN_SPACING = 7.0;

    private PlatoonMeshConfig() {
    }
}
