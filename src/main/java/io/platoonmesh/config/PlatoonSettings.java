package io.platoonmesh.config;

import io.platoonmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Effective runtime settings. Every field is sanitized: values missing from the settings file, or
 * outside their valid range, fall back to the {@link PlatoonMeshConfig} defaults.
 */
public record PlatoonSettings(
        String relayHost,
        int relayPort,
        long tickIntervalMs,
        long staleTimeoutMs,
        long handshakeTimeoutMs,
        long reconnectBaseBackoffMs,
        long reconnectMaxBackoffMs,
        int maxReconnectAttempts,
        int maxFrameBytes,
        int outboundQueueCapacity,
        double targetGapMeters,
        double targetSpeedMps,
        double kp,
        double kd,
        double maxAcceleration,
        double maxDeceleration,
        double headingGain,
        double lateralGain,
        double failSafeBrake,
        double relativeSpeedSmoothing
) {
    public static PlatoonSettings defaults() {
        return new PlatoonSettings(
                PlatoonMeshConfig.DEFAULT_RELAY_HOST,
                PlatoonMeshConfig.DEFAULT_RELAY_PORT,
                PlatoonMeshConfig.DEFAULT_TICK_INTERVAL_MS,
                PlatoonMeshConfig.DEFAULT_TICK_INTERVAL_MS * PlatoonMeshConfig.DEFAULT_STALE_MISSED_PERIODS,
                PlatoonMeshConfig.DEFAULT_HANDSHAKE_TIMEOUT_MS,
                PlatoonMeshConfig.DEFAULT_RECONNECT_BASE_BACKOFF_MS,
                PlatoonMeshConfig.DEFAULT_RECONNECT_MAX_BACKOFF_MS,
                PlatoonMeshConfig.DEFAULT_MAX_RECONNECT_ATTEMPTS,
                PlatoonMeshConfig.DEFAULT_MAX_FRAME_BYTES,
                PlatoonMeshConfig.DEFAULT_OUTBOUND_QUEUE_CAPACITY,
                PlatoonMeshConfig.DEFAULT_TARGET_GAP_METERS,
                PlatoonMeshConfig.DEFAULT_TARGET_SPEED_MPS,
                PlatoonMeshConfig.DEFAULT_KP,
                PlatoonMeshConfig.DEFAULT_KD,
                PlatoonMeshConfig.DEFAULT_MAX_ACCELERATION,
                PlatoonMeshConfig.DEFAULT_MAX_DECELERATION,
                PlatoonMeshConfig.DEFAULT_HEADING_GAIN,
                PlatoonMeshConfig.DEFAULT_LATERAL_GAIN,
                PlatoonMeshConfig.DEFAULT_FAIL_SAFE_BRAKE,
                PlatoonMeshConfig.DEFAULT_RELATIVE_SPEED_SMOOTHING
        );
    }

    /**
     * Loads settings from a JSON file. A missing file yields the defaults; a malformed one fails.
     */
    public static PlatoonSettings load(Path file) {
        PlatoonSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            PlatoonSettingsFile raw = Jsons.mapper().readValue(file.toFile(), PlatoonSettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings file: " + file, e);
        }
    }

    static PlatoonSettings fromFile(PlatoonSettingsFile file, PlatoonSettings defaults) {
        if (file == null) {
            return defaults;
        }
        String host = file.relayHost() == null || file.relayHost().isBlank()
                ? defaults.relayHost()
                : file.relayHost().trim();
        int port = sanitizeInt(file.relayPort(), defaults.relayPort(), 1);
        if (port > 65_535) {
            port = defaults.relayPort();
        }
        long tick = sanitizeLong(file.tickIntervalMs(), defaults.tickIntervalMs(), 5L);
        long staleDefault = tick * PlatoonMeshConfig.DEFAULT_STALE_MISSED_PERIODS;
        long stale = sanitizeLong(file.staleTimeoutMs(), staleDefault, tick);
        if (stale < tick) {
            stale = tick;
        }
        long handshake = sanitizeLong(file.handshakeTimeoutMs(), defaults.handshakeTimeoutMs(), 100L);
        long baseBackoff = sanitizeLong(file.reconnectBaseBackoffMs(), defaults.reconnectBaseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.reconnectMaxBackoffMs(), defaults.reconnectMaxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        int maxAttempts = sanitizeInt(file.maxReconnectAttempts(), defaults.maxReconnectAttempts(), 0);
        int maxFrame = sanitizeInt(file.maxFrameBytes(), defaults.maxFrameBytes(), 1_024);
        int queueCapacity = sanitizeInt(file.outboundQueueCapacity(), defaults.outboundQueueCapacity(), 16);
        double failSafeBrake = sanitizeDouble(file.failSafeBrake(), defaults.failSafeBrake(), 0.05);
        if (failSafeBrake > 1.0) {
            failSafeBrake = 1.0;
        }
        double smoothing = sanitizeDouble(file.relativeSpeedSmoothing(), defaults.relativeSpeedSmoothing(), 0.01);
        if (smoothing > 1.0) {
            smoothing = 1.0;
        }
        return new PlatoonSettings(
                host,
                port,
                tick,
                stale,
                handshake,
                baseBackoff,
                maxBackoff,
                maxAttempts,
                maxFrame,
                queueCapacity,
                sanitizeDouble(file.targetGapMeters(), defaults.targetGapMeters(), 0.5),
                sanitizeDouble(file.targetSpeedMps(), defaults.targetSpeedMps(), 0.0),
                sanitizeDouble(file.kp(), defaults.kp(), 0.0),
                sanitizeDouble(file.kd(), defaults.kd(), 0.0),
                sanitizeDouble(file.maxAcceleration(), defaults.maxAcceleration(), 0.1),
                sanitizeDouble(file.maxDeceleration(), defaults.maxDeceleration(), 0.1),
                sanitizeDouble(file.headingGain(), defaults.headingGain(), 0.0),
                sanitizeDouble(file.lateralGain(), defaults.lateralGain(), 0.0),
                failSafeBrake,
                smoothing
        );
    }

    public PlatoonSettings withRelay(String host, int port) {
        return new PlatoonSettings(
                host == null || host.isBlank() ? relayHost : host.trim(),
                port > 0 ? port : relayPort,
                tickIntervalMs,
                staleTimeoutMs,
                handshakeTimeoutMs,
                reconnectBaseBackoffMs,
                reconnectMaxBackoffMs,
                maxReconnectAttempts,
                maxFrameBytes,
                outboundQueueCapacity,
                targetGapMeters,
                targetSpeedMps,
                kp,
                kd,
                maxAcceleration,
                maxDeceleration,
                headingGain,
                lateralGain,
                failSafeBrake,
                relativeSpeedSmoothing
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static double sanitizeDouble(Double value, double fallback, double min) {
        if (value == null || value.isNaN() || value.isInfinite() || value < min) {
            return fallback;
        }
        return value;
    }

    record PlatoonSettingsFile(
            String relayHost,
            Integer relayPort,
            Long tickIntervalMs,
            Long staleTimeoutMs,
            Long handshakeTimeoutMs,
            Long reconnectBaseBackoffMs,
            Long reconnectMaxBackoffMs,
            Integer maxReconnectAttempts,
            Integer maxFrameBytes,
            Integer outboundQueueCapacity,
            Double targetGapMeters,
            Double targetSpeedMps,
            Double kp,
            Double kd,
            Double maxAcceleration,
            Double maxDeceleration,
            Double headingGain,
            Double lateralGain,
            Double failSafeBrake,
            Double relativeSpeedSmoothing
    ) {
    }
}
