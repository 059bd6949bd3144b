package io.platoonmesh.control;

import io.platoonmesh.config.PlatoonSettings;
import io.platoonmesh.model.ControlCommand;
import io.platoonmesh.model.PeerId;
import io.platoonmesh.model.Vector3;
import io.platoonmesh.model.VehicleState;
import io.platoonmesh.protocol.PredecessorTrack;
import io.platoonmesh.protocol.Role;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Random;

final class GapKeepingControllerTest {
    private static final PeerId SELF = PeerId.of("veh-self");
    private static final PeerId AHEAD = PeerId.of("veh-ahead");
    private static final Role FOLLOWER = Role.follower(AHEAD);

    @Test
    void closingOnAFarPredecessorStillThrottles() {
        GapKeepingController controller = controller();
        VehicleState own = own(Vector3.ZERO, 10.0, 0.0);
        PredecessorTrack track = track(new Vector3(15.0, 0.0, 0.0), 8.0, 0.0);

        ControlCommand command = controller.compute(FOLLOWER, track, own, false);

        // a = 0.45 * (15 - 10) + 0.6 * (8 - 10) = 1.05 m/s^2, over a 3 m/s^2 limit
        Assertions.assertEquals(0.35, command.throttle(), 1e-9);
        Assertions.assertEquals(0.0, command.brake());
        Assertions.assertEquals(0.0, command.steer(), 1e-9);
        Assertions.assertEquals(ControlMode.GAP_KEEPING, controller.mode());
    }

    @Test
    void overlapIsTreatedAsZeroGap() {
        GapKeepingController controller = controller();
        VehicleState own = own(Vector3.ZERO, 5.0, 0.0);
        PredecessorTrack behind = track(new Vector3(-5.0, 0.0, 0.0), 5.0, 0.0);

        ControlCommand command = controller.compute(FOLLOWER, behind, own, false);

        Assertions.assertEquals(0.0, command.throttle());
        Assertions.assertEquals(0.75, command.brake(), 1e-9);
    }

    @Test
    void relativeSpeedIsSmoothedUntilReset() {
        GapKeepingController controller = controller();
        VehicleState own = own(Vector3.ZERO, 10.0, 0.0);
        controller.compute(FOLLOWER, track(new Vector3(15.0, 0.0, 0.0), 8.0, 0.0), own, false);

        ControlCommand smoothed = controller.compute(FOLLOWER, track(new Vector3(15.0, 0.0, 0.0), 10.0, 0.0), own, false);
        Assertions.assertEquals((2.25 - 0.6) / 3.0, smoothed.throttle(), 1e-9);

        controller.reset();
        ControlCommand fresh = controller.compute(FOLLOWER, track(new Vector3(15.0, 0.0, 0.0), 10.0, 0.0), own, false);
        Assertions.assertEquals(2.25 / 3.0, fresh.throttle(), 1e-9);
    }

    @Test
    void steersTowardsPredecessorLineAndHeading() {
        GapKeepingController controller = controller();
        VehicleState own = own(Vector3.ZERO, 8.0, 0.0);
        PredecessorTrack track = track(new Vector3(15.0, 2.0, 0.0), 8.0, 15.0);

        ControlCommand command = controller.compute(FOLLOWER, track, own, false);

        Assertions.assertEquals(15.0 / 30.0 + 0.1 * 2.0, command.steer(), 1e-9);

        PredecessorTrack farOff = track(new Vector3(15.0, -40.0, 0.0), 8.0, -90.0);
        Assertions.assertEquals(-1.0, controller.compute(FOLLOWER, farOff, own, false).steer(), 1e-9);
    }

    @Test
    void failSafeIgnoresPriorState() {
        GapKeepingController controller = controller();
        VehicleState own = own(Vector3.ZERO, 10.0, 0.0);
        controller.compute(FOLLOWER, track(new Vector3(30.0, 3.0, 0.0), 15.0, 20.0), own, false);

        ControlCommand command = controller.compute(FOLLOWER, track(new Vector3(30.0, 3.0, 0.0), 15.0, 20.0), own, true);

        Assertions.assertEquals(new ControlCommand(0.0, 0.6, 0.0), command);
        Assertions.assertEquals(ControlMode.FAIL_SAFE, controller.mode());
        Assertions.assertEquals(command, controller.compute(Role.leader(), null, own, true));
    }

    @Test
    void followerWithoutTrackFallsBackToFailSafe() {
        GapKeepingController controller = controller();
        ControlCommand command = controller.compute(FOLLOWER, null, own(Vector3.ZERO, 3.0, 0.0), false);
        Assertions.assertEquals(0.6, command.brake());
        Assertions.assertEquals(ControlMode.FAIL_SAFE, controller.mode());
    }

    @Test
    void leaderCruisesToTargetSpeed() {
        GapKeepingController controller = controller();

        ControlCommand slow = controller.compute(Role.leader(), null, own(Vector3.ZERO, 4.0, 0.0), false);
        Assertions.assertEquals(0.6 * 4.0 / 3.0, slow.throttle(), 1e-9);
        Assertions.assertEquals(ControlMode.CRUISE, controller.mode());

        ControlCommand atSpeed = controller.compute(Role.leader(), null, own(Vector3.ZERO, 8.0, 0.0), false);
        Assertions.assertEquals(new ControlCommand(0.0, 0.0, 0.0), atSpeed);

        controller.setTargetSpeed(0.0);
        ControlCommand stopping = controller.compute(Role.leader(), null, own(Vector3.ZERO, 8.0, 0.0), false);
        Assertions.assertEquals(0.8, stopping.brake(), 1e-9);
    }

    @Test
    void detachedVehicleCoasts() {
        GapKeepingController controller = controller();
        Assertions.assertEquals(ControlCommand.COAST,
                controller.compute(Role.detached(), null, own(Vector3.ZERO, 8.0, 0.0), false));
        Assertions.assertEquals(ControlMode.IDLE, controller.mode());
    }

    @Test
    void throttleAndBrakeNeverOverlap() {
        GapKeepingController controller = controller();
        Random random = new Random(42L);
        for (int i = 0; i < 2_000; i++) {
            VehicleState own = own(new Vector3(random.nextDouble() * 50.0, random.nextDouble() * 10.0, 0.0),
                    random.nextDouble() * 30.0, random.nextDouble() * 360.0);
            PredecessorTrack track = track(new Vector3(random.nextDouble() * 100.0 - 25.0, random.nextDouble() * 20.0 - 10.0, 0.0),
                    random.nextDouble() * 30.0, random.nextDouble() * 360.0);
            ControlCommand command = controller.compute(FOLLOWER, track, own, random.nextInt(10) == 0);
            Assertions.assertFalse(command.throttle() > 0.0 && command.brake() > 0.0);
            Assertions.assertTrue(command.throttle() <= 1.0 && command.brake() <= 1.0);
            Assertions.assertTrue(Math.abs(command.steer()) <= 1.0);
        }
    }

    @Test
    void rejectsInvalidTargets() {
        GapKeepingController controller = controller();
        Assertions.assertThrows(IllegalArgumentException.class, () -> controller.setTargetGap(0.0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> controller.setTargetGap(Double.NaN));
        Assertions.assertThrows(IllegalArgumentException.class, () -> controller.setTargetSpeed(-1.0));
        controller.setTargetGap(12.0);
        Assertions.assertEquals(12.0, controller.targetGapMeters());
    }

    @Test
    void normalizesHeadingDifferences() {
        Assertions.assertEquals(-170.0, GapKeepingController.normalizeDegrees(190.0), 1e-9);
        Assertions.assertEquals(170.0, GapKeepingController.normalizeDegrees(-190.0), 1e-9);
        Assertions.assertEquals(180.0, GapKeepingController.normalizeDegrees(-180.0), 1e-9);
        Assertions.assertEquals(180.0, GapKeepingController.normalizeDegrees(540.0), 1e-9);
        Assertions.assertEquals(10.0, GapKeepingController.normalizeDegrees(370.0), 1e-9);
    }

    private static GapKeepingController controller() {
        PlatoonSettings settings = PlatoonSettings.defaults();
        return new GapKeepingController(ControllerSettings.from(settings), settings.targetGapMeters(), settings.targetSpeedMps());
    }

    private static VehicleState own(Vector3 position, double speed, double heading) {
        return new VehicleState(SELF, position, Vector3.headingUnit(heading).scale(speed), heading, 1L, 0L);
    }

    private static PredecessorTrack track(Vector3 position, double speed, double heading) {
        return new PredecessorTrack(
                new VehicleState(AHEAD, position, Vector3.headingUnit(heading).scale(speed), heading, 1L, 0L),
                0L
        );
    }
}
