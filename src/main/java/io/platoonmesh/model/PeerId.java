package io.platoonmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.UUID;

public record PeerId(String value) {
    public PeerId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("peer id must not be blank");
        }
        value = value.trim();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PeerId of(String value) {
        return new PeerId(value);
    }

    public static PeerId generate() {
        return new PeerId("veh-" + UUID.randomUUID().toString().substring(0, 8));
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
