package io.hustle.sim.runtime;

import io.hustle.sim.api.HustleConstants;

/**
 * Runtime knobs for a simulation instance.
 *
 * Tuning that must stay consistent across saves lives in HustleConstants; this
 * holds what a game or a test legitimately varies per run.
 *
 * IMMUTABLE.
 */
public final class SimulationConfig {

    /** Default time scale: one real second is one game minute. */
    public static final double DEFAULT_GAME_MINUTES_PER_SECOND = 1.0;

    /** Default heat added for a detection of severity 1.0. */
    public static final float DEFAULT_HEAT_PER_SEVERITY = 10f;

    private final String actorId;
    private final double gameMinutesPerSecond;
    private final float heatPerSeverity;
    private final Long seed;

    private SimulationConfig(Builder b) {
        this.actorId = b.actorId;
        this.gameMinutesPerSecond = b.gameMinutesPerSecond;
        this.heatPerSeverity = b.heatPerSeverity;
        this.seed = b.seed;
    }

    /** Actor whose activities are simulated and whose heat is tracked. */
    public String actorId() { return actorId; }

    /** In-game minutes that pass per real second of step(). */
    public double gameMinutesPerSecond() { return gameMinutesPerSecond; }

    /** Heat added per unit of detection severity. */
    public float heatPerSeverity() { return heatPerSeverity; }

    /** RNG seed for patrol jitter, or null for an unseeded generator. */
    public Long seed() { return seed; }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "SimulationConfig{actor='" + actorId + "', minutesPerSecond=" + gameMinutesPerSecond +
            ", heatPerSeverity=" + heatPerSeverity + ", seed=" + seed + "}";
    }

    public static final class Builder {

        private String actorId = HustleConstants.DEFAULT_ACTOR_ID;
        private double gameMinutesPerSecond = DEFAULT_GAME_MINUTES_PER_SECOND;
        private float heatPerSeverity = DEFAULT_HEAT_PER_SEVERITY;
        private Long seed = null;

        private Builder() {}

        public Builder actorId(String actorId) {
            if (actorId == null || actorId.isBlank()) {
                throw new IllegalArgumentException("actorId must not be blank");
            }
            this.actorId = actorId;
            return this;
        }

        public Builder gameMinutesPerSecond(double minutes) {
            if (!(minutes > 0.0) || Double.isInfinite(minutes)) {
                throw new IllegalArgumentException("gameMinutesPerSecond must be > 0 and finite; got " + minutes);
            }
            this.gameMinutesPerSecond = minutes;
            return this;
        }

        public Builder heatPerSeverity(float heat) {
            if (!(heat >= 0f) || Float.isInfinite(heat)) {
                throw new IllegalArgumentException("heatPerSeverity must be >= 0 and finite; got " + heat);
            }
            this.heatPerSeverity = heat;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(this);
        }
    }
}
