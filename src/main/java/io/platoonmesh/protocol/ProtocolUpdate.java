package io.platoonmesh.protocol;

import io.platoonmesh.model.Roster;

import java.util.Optional;

/**
 * What applying one event changed. A roster is present when this engine, as leader, should
 * broadcast its membership.
 */
public record ProtocolUpdate(boolean membershipChanged, boolean predecessorChanged, Roster roster) {
    static final ProtocolUpdate NONE = new ProtocolUpdate(false, false, null);

    public Optional<Roster> rosterToBroadcast() {
        return Optional.ofNullable(roster);
    }

    public boolean changed() {
        return membershipChanged || predecessorChanged || roster != null;
    }
}
