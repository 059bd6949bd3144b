package io.platoonmesh.session;

import io.platoonmesh.client.ConnectionState;
import io.platoonmesh.control.ControlMode;
import io.platoonmesh.model.ControlCommand;
import io.platoonmesh.model.PeerId;
import io.platoonmesh.protocol.PredecessorStatus;
import io.platoonmesh.protocol.Role;

import java.util.List;

public record SessionSnapshot(
        PeerId peerId,
        long tick,
        ConnectionState connection,
        String role,
        List<PeerId> members,
        ControlMode mode,
        PredecessorStatus predecessor,
        double targetGapMeters,
        double targetSpeedMps,
        ControlCommand lastCommand
) {
    static SessionSnapshot initial(PeerId peerId, double targetGapMeters, double targetSpeedMps) {
        return new SessionSnapshot(
                peerId,
                0L,
                ConnectionState.IDLE,
                Role.detached().toString(),
                List.of(),
                ControlMode.IDLE,
                PredecessorStatus.NOT_APPLICABLE,
                targetGapMeters,
                targetSpeedMps,
                ControlCommand.COAST
        );
    }
}
