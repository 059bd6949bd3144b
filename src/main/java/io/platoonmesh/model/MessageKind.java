package io.platoonmesh.model;

public enum MessageKind {
    STATE(VehicleState.class),
    JOIN(JoinRequest.class),
    LEAVE(LeaveNotice.class),
    ROSTER(Roster.class);

    private final Class<? extends PlatoonMessage> type;

    MessageKind(Class<? extends PlatoonMessage> type) {
        this.type = type;
    }

    public Class<? extends PlatoonMessage> type() {
        return type;
    }

    public static MessageKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing message kind");
        }
        for (MessageKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message kind: " + raw);
    }
}
