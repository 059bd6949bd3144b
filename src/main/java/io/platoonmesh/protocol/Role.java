package io.platoonmesh.protocol;

import io.platoonmesh.model.PeerId;

import java.util.Objects;

public record Role(Kind kind, PeerId predecessor) {
    private static final Role DETACHED = new Role(Kind.DETACHED, null);
    private static final Role LEADER = new Role(Kind.LEADER, null);

    public enum Kind {
        DETACHED,
        LEADER,
        FOLLOWER
    }

    public Role {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.FOLLOWER) != (predecessor != null)) {
            throw new IllegalArgumentException("a follower, and only a follower, has a predecessor");
        }
    }

    public static Role detached() {
        return DETACHED;
    }

    public static Role leader() {
        return LEADER;
    }

    public static Role follower(PeerId predecessor) {
        return new Role(Kind.FOLLOWER, Objects.requireNonNull(predecessor, "predecessor"));
    }

    public boolean isLeader() {
        return kind == Kind.LEADER;
    }

    public boolean isFollower() {
        return kind == Kind.FOLLOWER;
    }

    @Override
    public String toString() {
        return kind == Kind.FOLLOWER ? "FOLLOWER(" + predecessor + ")" : kind.name();
    }
}
