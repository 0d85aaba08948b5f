package io.hustle.sim.simulation;

import io.hustle.sim.api.Vec3;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable set of sight-blocking geometry for one scene.
 */
public final class OccluderWorld {

    /** World with no occluders. Every line of sight is open. */
    public static final OccluderWorld EMPTY = new OccluderWorld(new OccluderTriangle[0]);

    private final OccluderTriangle[] triangles;

    private OccluderWorld(OccluderTriangle[] triangles) {
        this.triangles = triangles;
    }

    public int triangleCount() {
        return triangles.length;
    }

    public OccluderTriangle triangle(int index) {
        return triangles[index];
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<OccluderTriangle> triangles = new ArrayList<>();

        private Builder() {}

        public Builder addTriangle(OccluderTriangle triangle) {
            if (triangle == null) {
                throw new IllegalArgumentException("triangle must not be null");
            }
            triangles.add(triangle);
            return this;
        }

        public Builder addTriangle(Vec3 a, Vec3 b, Vec3 c) {
            return addTriangle(new OccluderTriangle(a.x, a.y, a.z, b.x, b.y, b.z, c.x, c.y, c.z));
        }

        /**
         * Axis-aligned quad spanning two opposite corners. The corners must share one
         * coordinate; that axis is the wall's normal.
         */
        public Builder addWall(Vec3 min, Vec3 max) {
            Vec3 a;
            Vec3 b;
            Vec3 c;
            Vec3 d;
            if (min.x == max.x) {
                a = Vec3.of(min.x, min.y, min.z);
                b = Vec3.of(min.x, max.y, min.z);
                c = Vec3.of(min.x, max.y, max.z);
                d = Vec3.of(min.x, min.y, max.z);
            } else if (min.y == max.y) {
                a = Vec3.of(min.x, min.y, min.z);
                b = Vec3.of(max.x, min.y, min.z);
                c = Vec3.of(max.x, min.y, max.z);
                d = Vec3.of(min.x, min.y, max.z);
            } else if (min.z == max.z) {
                a = Vec3.of(min.x, min.y, min.z);
                b = Vec3.of(max.x, min.y, min.z);
                c = Vec3.of(max.x, max.y, min.z);
                d = Vec3.of(min.x, max.y, min.z);
            } else {
                throw new IllegalArgumentException("wall corners must share one axis: " + min + " / " + max);
            }
            addTriangle(a, b, c);
            return addTriangle(a, c, d);
        }

        /** Axis-aligned box as twelve triangles. */
        public Builder addBox(Vec3 min, Vec3 max) {
            addWall(Vec3.of(min.x, min.y, min.z), Vec3.of(min.x, max.y, max.z));
            addWall(Vec3.of(max.x, min.y, min.z), Vec3.of(max.x, max.y, max.z));
            addWall(Vec3.of(min.x, min.y, min.z), Vec3.of(max.x, min.y, max.z));
            addWall(Vec3.of(min.x, max.y, min.z), Vec3.of(max.x, max.y, max.z));
            addWall(Vec3.of(min.x, min.y, min.z), Vec3.of(max.x, max.y, min.z));
            return addWall(Vec3.of(min.x, min.y, max.z), Vec3.of(max.x, max.y, max.z));
        }

        public OccluderWorld build() {
            return new OccluderWorld(triangles.toArray(new OccluderTriangle[0]));
        }
    }
}
