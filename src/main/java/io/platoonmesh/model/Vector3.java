package io.platoonmesh.model;

public record Vector3(double x, double y, double z) {
    public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);

    public Vector3 plus(Vector3 other) {
        return new Vector3(x + other.x, y + other.y, z + other.z);
    }

    public Vector3 minus(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    public Vector3 scale(double factor) {
        return new Vector3(x * factor, y * factor, z * factor);
    }

    public double dot(Vector3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public double length() {
        return Math.sqrt(dot(this));
    }

    public double horizontalLength() {
        return Math.hypot(x, y);
    }

    /**
     * Unit vector on the ground plane for a yaw angle in degrees, measured from +x towards +y.
     */
    public static Vector3 headingUnit(double headingDegrees) {
        double rad = Math.toRadians(headingDegrees);
        return new Vector3(Math.cos(rad), Math.sin(rad), 0.0);
    }
}
