package io.hustle.sim.simulation;

import io.hustle.sim.api.HustleConstants;
import io.hustle.sim.api.ObserverRole;
import io.hustle.sim.api.Vec3;

/**
 * Immutable registration data for an observer.
 *
 * Built once by level scripts and handed to DetectionEngine.registerObserver().
 * The engine copies it into a mutable {@link Observer} whose pose and patrol
 * progress change at runtime.
 *
 * Validation happens in build(): a non-positive vision range or a cone outside
 * (0..360] is a data error and throws IllegalArgumentException.
 */
public final class ObserverDef {

    private final ObserverRole role;
    private final Vec3 position;
    private final Vec3 facing;
    private final float visionRange;
    private final float visionConeDegrees;
    private final float audioSensitivity;
    private final boolean caresAboutLegality;
    private final boolean caresAboutJobPerformance;
    private final String locationId;

    private ObserverDef(Builder b) {
        this.role = b.role;
        this.position = b.position;
        this.facing = b.facing;
        this.visionRange = b.visionRange;
        this.visionConeDegrees = b.visionConeDegrees;
        this.audioSensitivity = b.audioSensitivity;
        this.caresAboutLegality = b.caresAboutLegality;
        this.caresAboutJobPerformance = b.caresAboutJobPerformance;
        this.locationId = b.locationId;
    }

    public ObserverRole role() { return role; }
    public Vec3 position() { return position; }

    /** Unit facing vector. */
    public Vec3 facing() { return facing; }

    public float visionRange() { return visionRange; }
    public float visionConeDegrees() { return visionConeDegrees; }

    /** Reserved for audio detection. [0..1] */
    public float audioSensitivity() { return audioSensitivity; }

    public boolean caresAboutLegality() { return caresAboutLegality; }
    public boolean caresAboutJobPerformance() { return caresAboutJobPerformance; }
    public String locationId() { return locationId; }

    public static Builder builder(ObserverRole role) {
        return new Builder(role);
    }

    /**
     * Defaults: origin, facing +Z, range 10, 90 degree cone, audio 0.5,
     * cares about nothing, located at "default_location".
     */
    public static final class Builder {

        private final ObserverRole role;
        private Vec3 position = Vec3.ZERO;
        private Vec3 facing = Vec3.FORWARD;
        private float visionRange = 10f;
        private float visionConeDegrees = 90f;
        private float audioSensitivity = 0.5f;
        private boolean caresAboutLegality = false;
        private boolean caresAboutJobPerformance = false;
        private String locationId = HustleConstants.DEFAULT_LOCATION_ID;

        private Builder(ObserverRole role) {
            if (role == null) {
                throw new IllegalArgumentException("role must not be null");
            }
            this.role = role;
        }

        public Builder position(Vec3 position) {
            if (position == null) {
                throw new IllegalArgumentException("position must not be null");
            }
            this.position = position;
            return this;
        }

        public Builder position(float x, float y, float z) {
            return position(Vec3.of(x, y, z));
        }

        /** Normalized on build. A zero vector is rejected. */
        public Builder facing(Vec3 facing) {
            if (facing == null) {
                throw new IllegalArgumentException("facing must not be null");
            }
            this.facing = facing;
            return this;
        }

        public Builder facing(float x, float y, float z) {
            return facing(Vec3.of(x, y, z));
        }

        public Builder visionRange(float metres) {
            this.visionRange = metres;
            return this;
        }

        public Builder visionCone(float degrees) {
            this.visionConeDegrees = degrees;
            return this;
        }

        public Builder audioSensitivity(float sensitivity) {
            this.audioSensitivity = Math.max(0f, Math.min(1f, sensitivity));
            return this;
        }

        public Builder caresAboutLegality(boolean cares) {
            this.caresAboutLegality = cares;
            return this;
        }

        public Builder caresAboutJobPerformance(boolean cares) {
            this.caresAboutJobPerformance = cares;
            return this;
        }

        public Builder location(String locationId) {
            if (locationId == null || locationId.isBlank()) {
                throw new IllegalArgumentException("locationId must not be blank");
            }
            this.locationId = locationId;
            return this;
        }

        public ObserverDef build() {
            if (!(visionRange > 0f) || Float.isInfinite(visionRange)) {
                throw new IllegalArgumentException("visionRange must be > 0 and finite; got " + visionRange);
            }
            if (!(visionConeDegrees > 0f) || visionConeDegrees > 360f) {
                throw new IllegalArgumentException(
                    "visionConeDegrees must be in (0, 360]; got " + visionConeDegrees);
            }
            Vec3 unit = facing.normalized();
            if (unit.isZero()) {
                throw new IllegalArgumentException("facing must not be a zero vector");
            }
            this.facing = unit;
            return new ObserverDef(this);
        }
    }
}
