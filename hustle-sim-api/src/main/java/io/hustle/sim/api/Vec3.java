package io.hustle.sim.api;

/**
 * Immutable world-space vector. Positions, facings and waypoints all use this type.
 *
 * Units are metres. The simulation is Y-up; facing vectors are expected to be
 * unit length and are normalised wherever an angle is computed.
 */
public final class Vec3 {

    public static final Vec3 ZERO = new Vec3(0f, 0f, 0f);

    /** +Z. Default facing for observers that were registered without one. */
    public static final Vec3 FORWARD = new Vec3(0f, 0f, 1f);

    public final float x;
    public final float y;
    public final float z;

    public Vec3(float x, float y, float z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static Vec3 of(float x, float y, float z) {
        return new Vec3(x, y, z);
    }

    public Vec3 minus(Vec3 other) {
        return new Vec3(x - other.x, y - other.y, z - other.z);
    }

    public Vec3 plus(Vec3 other) {
        return new Vec3(x + other.x, y + other.y, z + other.z);
    }

    public float dot(Vec3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public float length() {
        return (float) Math.sqrt(x * x + y * y + z * z);
    }

    public float distanceTo(Vec3 other) {
        float dx = other.x - x;
        float dy = other.y - y;
        float dz = other.z - z;
        return (float) Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /** True if every component is within 1e-6 of zero. */
    public boolean isZero() {
        return Math.abs(x) < 1e-6f && Math.abs(y) < 1e-6f && Math.abs(z) < 1e-6f;
    }

    /**
     * Returns a unit-length copy, or ZERO if this vector has no length.
     */
    public Vec3 normalized() {
        float len = length();
        if (len < 1e-6f) {
            return ZERO;
        }
        return new Vec3(x / len, y / len, z / len);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vec3)) return false;
        Vec3 v = (Vec3) o;
        return Float.compare(x, v.x) == 0
            && Float.compare(y, v.y) == 0
            && Float.compare(z, v.z) == 0;
    }

    @Override
    public int hashCode() {
        int h = Float.hashCode(x);
        h = 31 * h + Float.hashCode(y);
        return 31 * h + Float.hashCode(z);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
