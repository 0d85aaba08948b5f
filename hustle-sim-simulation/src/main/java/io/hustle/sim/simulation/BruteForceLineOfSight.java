package io.hustle.sim.simulation;

import io.hustle.sim.api.LineOfSightQuery;
import io.hustle.sim.api.Vec3;

/**
 * Brute-force line-of-sight backend over occluder triangles.
 *
 * Tests the observer-to-actor segment against every triangle with a
 * Moller-Trumbore intersection. Fine for rooms with a few hundred triangles;
 * scenes larger than that should plug in the engine's physics raycast instead.
 *
 * A hit within TARGET_EPSILON of the actor does not block, so the actor standing
 * against a wall is still visible from the open side.
 */
public final class BruteForceLineOfSight implements LineOfSightQuery {

    private static final float EPSILON = 1.0e-6f;

    /** Hits closer than this to the target are treated as the target's own surface. */
    private static final float TARGET_EPSILON = 1.0e-3f;

    private final OccluderWorld world;

    public BruteForceLineOfSight(OccluderWorld world) {
        if (world == null) {
            throw new IllegalArgumentException("world must not be null");
        }
        this.world = world;
    }

    @Override
    public boolean raycastBlocked(Vec3 from, Vec3 to) {
        float dx = to.x - from.x;
        float dy = to.y - from.y;
        float dz = to.z - from.z;
        float distance = (float) Math.sqrt(dx * dx + dy * dy + dz * dz);
        if (distance < EPSILON) {
            return false;
        }
        float inv = 1.0f / distance;
        dx *= inv;
        dy *= inv;
        dz *= inv;

        float limit = distance - TARGET_EPSILON;
        for (int i = 0; i < world.triangleCount(); i++) {
            float t = intersect(from.x, from.y, from.z, dx, dy, dz, world.triangle(i));
            if (t >= 0f && t < limit) {
                return true;
            }
        }
        return false;
    }

    /** @return distance along the unit ray to the hit, or -1 on a miss */
    private static float intersect(float ox, float oy, float oz,
                                   float dx, float dy, float dz,
                                   OccluderTriangle tri) {
        float edge1x = tri.bx - tri.ax;
        float edge1y = tri.by - tri.ay;
        float edge1z = tri.bz - tri.az;

        float edge2x = tri.cx - tri.ax;
        float edge2y = tri.cy - tri.ay;
        float edge2z = tri.cz - tri.az;

        float px = dy * edge2z - dz * edge2y;
        float py = dz * edge2x - dx * edge2z;
        float pz = dx * edge2y - dy * edge2x;

        float det = edge1x * px + edge1y * py + edge1z * pz;
        if (det > -EPSILON && det < EPSILON) {
            return -1f;
        }
        float invDet = 1.0f / det;

        float tx = ox - tri.ax;
        float ty = oy - tri.ay;
        float tz = oz - tri.az;

        float u = (tx * px + ty * py + tz * pz) * invDet;
        if (u < 0.0f || u > 1.0f) {
            return -1f;
        }

        float qx = ty * edge1z - tz * edge1y;
        float qy = tz * edge1x - tx * edge1z;
        float qz = tx * edge1y - ty * edge1x;

        float v = (dx * qx + dy * qy + dz * qz) * invDet;
        if (v < 0.0f || u + v > 1.0f) {
            return -1f;
        }

        float t = (edge2x * qx + edge2y * qy + edge2z * qz) * invDet;
        return t > EPSILON ? t : -1f;
    }
}
