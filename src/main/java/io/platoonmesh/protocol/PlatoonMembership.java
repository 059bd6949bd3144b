package io.platoonmesh.protocol;

import io.platoonmesh.model.PeerId;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Ordered platoon membership; index 0 is the leader. Entries are unique, and a member's
 * predecessor is always the entry directly before it.
 */
public final class PlatoonMembership {
    private final List<PeerId> members = new ArrayList<>();

    /**
     * Appends the peer to the tail. Returns false when it is already a member.
     */
    public boolean append(PeerId peerId) {
        if (members.contains(peerId)) {
            return false;
        }
        members.add(peerId);
        return true;
    }

    /**
     * Removes the peer; its follower now follows the removed peer's predecessor. Returns false when
     * the peer was not a member.
     */
    public boolean remove(PeerId peerId) {
        return members.remove(peerId);
    }

    /**
     * Replaces the whole view with a snapshot, dropping duplicate entries after their first occurrence.
     */
    public boolean replaceWith(List<PeerId> snapshot) {
        List<PeerId> next = new ArrayList<>(new LinkedHashSet<>(snapshot));
        if (next.equals(members)) {
            return false;
        }
        members.clear();
        members.addAll(next);
        return true;
    }

    public boolean contains(PeerId peerId) {
        return members.contains(peerId);
    }

    public int indexOf(PeerId peerId) {
        return members.indexOf(peerId);
    }

    public Optional<PeerId> leader() {
        return members.isEmpty() ? Optional.empty() : Optional.of(members.get(0));
    }

    public Optional<PeerId> predecessorOf(PeerId peerId) {
        int index = members.indexOf(peerId);
        if (index <= 0) {
            return Optional.empty();
        }
        return Optional.of(members.get(index - 1));
    }

    public int size() {
        return members.size();
    }

    public List<PeerId> members() {
        return List.copyOf(members);
    }

    @Override
    public String toString() {
        return members.toString();
    }
}
