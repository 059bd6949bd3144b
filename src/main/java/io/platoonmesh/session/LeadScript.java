package io.platoonmesh.session;

import io.platoonmesh.model.ControlCommand;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A timed sequence of fixed actuations the leader drives instead of cruising. Steps marked as not
 * broadcast suppress the leader's STATE messages while they run, which lets an operator reproduce
 * message loss on a running platoon.
 */
public record LeadScript(int number, String description, List<Step> steps) {
    public static final int FIRST = 1;
    public static final int LAST = 9;

    public LeadScript {
        Objects.requireNonNull(description, "description");
        steps = List.copyOf(steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("script " + number + " has no steps");
        }
    }

    public record Step(ControlCommand command, long durationMs, boolean broadcast) {
        public Step {
            Objects.requireNonNull(command, "command");
            if (durationMs <= 0L) {
                throw new IllegalArgumentException("step duration must be positive: " + durationMs);
            }
        }
    }

    public long totalDurationMs() {
        long total = 0L;
        for (Step step : steps) {
            total += step.durationMs();
        }
        return total;
    }

    /**
     * The step active {@code elapsedMs} after the script started, empty once it has run out.
     */
    public Optional<Step> stepAt(long elapsedMs) {
        if (elapsedMs < 0L) {
            return Optional.of(steps.get(0));
        }
        long end = 0L;
        for (Step step : steps) {
            end += step.durationMs();
            if (elapsedMs < end) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    public static LeadScript builtIn(int number) {
        return switch (number) {
            case 1 -> new LeadScript(1, "accelerate, coast, gentle brake",
                    List.of(throttle(1.0, 10_000L), coast(6_000L), brake(0.3, 6_000L)));
            case 2 -> new LeadScript(2, "accelerate, gentle brake",
                    List.of(throttle(1.0, 10_000L), brake(0.3, 8_000L)));
            case 3 -> new LeadScript(3, "accelerate, coast, full brake",
                    List.of(throttle(1.0, 10_000L), coast(6_000L), brake(1.0, 6_000L)));
            case 4 -> new LeadScript(4, "accelerate, full brake",
                    List.of(throttle(1.0, 10_000L), brake(1.0, 8_000L)));
            case 5 -> new LeadScript(5, "accelerate, silent coast, full brake",
                    List.of(throttle(1.0, 10_000L), silent(coast(6_000L)), brake(1.0, 6_000L)));
            case 6 -> new LeadScript(6, "accelerate, coast, silent full brake",
                    List.of(throttle(1.0, 10_000L), coast(6_000L), silent(brake(1.0, 6_000L))));
            case 7 -> new LeadScript(7, "accelerate, silent full brake",
                    List.of(throttle(1.0, 10_000L), silent(brake(1.0, 8_000L))));
            case 8 -> new LeadScript(8, "ramped acceleration, full brake", rampThenBrake());
            case 9 -> new LeadScript(9, "accelerate, repeated brake taps, full brake", repeatedBraking());
            default -> throw new IllegalArgumentException(
                    "unknown lead script " + number + ", expected " + FIRST + ".." + LAST);
        };
    }

    private static List<Step> rampThenBrake() {
        List<Step> steps = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            steps.add(throttle(0.05 * i, 200L));
        }
        steps.add(throttle(1.0, 6_000L));
        steps.add(brake(1.0, 6_000L));
        return steps;
    }

    private static List<Step> repeatedBraking() {
        List<Step> steps = new ArrayList<>();
        steps.add(throttle(1.0, 6_000L));
        for (int i = 0; i < 5; i++) {
            steps.add(brake(1.0, 300L));
            steps.add(throttle(1.0, 1_000L));
        }
        steps.add(brake(1.0, 6_000L));
        return steps;
    }

    private static Step throttle(double value, long durationMs) {
        return new Step(ControlCommand.throttle(Math.min(1.0, value), 0.0), durationMs, true);
    }

    private static Step brake(double value, long durationMs) {
        return new Step(ControlCommand.brake(value, 0.0), durationMs, true);
    }

    private static Step coast(long durationMs) {
        return new Step(ControlCommand.COAST, durationMs, true);
    }

    private static Step silent(Step step) {
        return new Step(step.command(), step.durationMs(), false);
    }
}
