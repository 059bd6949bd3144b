package io.platoonmesh.protocol;

import io.platoonmesh.model.JoinRequest;
import io.platoonmesh.model.LeaveNotice;
import io.platoonmesh.model.PeerId;
import io.platoonmesh.model.PlatoonMessage;
import io.platoonmesh.model.Roster;
import io.platoonmesh.model.VehicleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Interprets platoon messages for one vehicle. Membership is this vehicle's local view, built
 * from join/leave events in the order it observes them; there is no central sequencer, so two
 * engines agree exactly when they applied the same events in the same order.
 *
 * <p>Not thread-safe: the owning session is the single writer.
 */
public final class PlatoonProtocolEngine {
    private static final Logger log = LoggerFactory.getLogger(PlatoonProtocolEngine.class);

    private final PeerId self;
    private final long staleTimeoutMs;
    private final PlatoonMembership membership = new PlatoonMembership();
    private PeerId trackedPredecessor;
    private PredecessorTrack track;
    private long trackingSinceMs;
    private boolean awaitingRoster;

    public PlatoonProtocolEngine(PeerId self, long staleTimeoutMs) {
        this.self = Objects.requireNonNull(self, "self");
        if (staleTimeoutMs <= 0L) {
            throw new IllegalArgumentException("staleTimeoutMs must be positive: " + staleTimeoutMs);
        }
        this.staleTimeoutMs = staleTimeoutMs;
    }

    public PeerId self() {
        return self;
    }

    /**
     * Applies this vehicle's own join. The relay does not echo a sender's messages back, so the
     * local view has to be updated here.
     */
    public ProtocolUpdate joinLocally(long nowMs) {
        boolean added = membership.append(self);
        if (added) {
            awaitingRoster = true;
            log.info("{} joined platoon, local view {}", self, membership);
        }
        return new ProtocolUpdate(added, relink(nowMs), null);
    }

    public ProtocolUpdate leaveLocally(long nowMs) {
        boolean removed = membership.remove(self);
        awaitingRoster = false;
        if (removed) {
            log.info("{} left platoon, local view {}", self, membership);
        }
        return new ProtocolUpdate(removed, relink(nowMs), null);
    }

    public ProtocolUpdate handleInbound(PlatoonMessage message, long receivedAtMs) {
        if (self.equals(message.sender())) {
            return ProtocolUpdate.NONE;
        }
        return switch (message.kind()) {
            case STATE -> onState((VehicleState) message, receivedAtMs);
            case JOIN -> onJoin((JoinRequest) message, receivedAtMs);
            case LEAVE -> onLeave((LeaveNotice) message, receivedAtMs);
            case ROSTER -> onRoster((Roster) message, receivedAtMs);
        };
    }

    private ProtocolUpdate onState(VehicleState state, long receivedAtMs) {
        if (trackedPredecessor == null || !trackedPredecessor.equals(state.peerId())) {
            return ProtocolUpdate.NONE;
        }
        if (track != null && state.sequence() <= track.state().sequence()) {
            return ProtocolUpdate.NONE;
        }
        track = new PredecessorTrack(state, receivedAtMs);
        return ProtocolUpdate.NONE;
    }

    private ProtocolUpdate onJoin(JoinRequest request, long nowMs) {
        boolean added = membership.append(request.requestingPeerId());
        if (added) {
            log.info("{} accepted join of {}, local view {}", self, request.requestingPeerId(), membership);
        } else {
            log.debug("{} ignored duplicate join of {}", self, request.requestingPeerId());
        }
        boolean predecessorChanged = relink(nowMs);
        // Re-sent on duplicates too: a repeated join usually means the joiner missed the roster.
        Roster roster = membership.indexOf(self) == 0 ? new Roster(self, membership.members()) : null;
        return new ProtocolUpdate(added, predecessorChanged, roster);
    }

    private ProtocolUpdate onLeave(LeaveNotice notice, long nowMs) {
        boolean removed = membership.remove(notice.peerId());
        if (removed) {
            log.info("{} applied leave of {}, local view {}", self, notice.peerId(), membership);
        } else {
            log.debug("{} ignored leave of non-member {}", self, notice.peerId());
        }
        return new ProtocolUpdate(removed, relink(nowMs), null);
    }

    private ProtocolUpdate onRoster(Roster roster, long nowMs) {
        if (!awaitingRoster || !roster.members().contains(self)) {
            return ProtocolUpdate.NONE;
        }
        awaitingRoster = false;
        boolean changed = membership.replaceWith(roster.members());
        log.info("{} adopted roster from {}: {}", self, roster.senderPeerId(), membership);
        return new ProtocolUpdate(changed, relink(nowMs), null);
    }

    // The predecessor is an index lookup, recomputed after every membership change.
    private boolean relink(long nowMs) {
        PeerId next = membership.predecessorOf(self).orElse(null);
        if (Objects.equals(next, trackedPredecessor)) {
            return false;
        }
        trackedPredecessor = next;
        track = null;
        trackingSinceMs = nowMs;
        return true;
    }

    public Role currentRole() {
        int index = membership.indexOf(self);
        if (index < 0) {
            return Role.detached();
        }
        if (index == 0) {
            return Role.leader();
        }
        return Role.follower(trackedPredecessor);
    }

    public Optional<PredecessorTrack> predecessorTrack() {
        return Optional.ofNullable(track);
    }

    public PredecessorStatus predecessorStatus(long nowMs) {
        if (trackedPredecessor == null) {
            return PredecessorStatus.NOT_APPLICABLE;
        }
        long since = track == null ? trackingSinceMs : track.receivedAtMs();
        if (nowMs - since > staleTimeoutMs) {
            return PredecessorStatus.STALE;
        }
        return track == null ? PredecessorStatus.AWAITING : PredecessorStatus.FRESH;
    }

    public boolean isAwaitingRoster() {
        return awaitingRoster;
    }

    public boolean isMember() {
        return membership.contains(self);
    }

    public List<PeerId> members() {
        return membership.members();
    }
}
