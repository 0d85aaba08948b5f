package io.hustle.sim.core;

import io.hustle.sim.api.ActivityKind;
import io.hustle.sim.api.ActivityPhase;
import io.hustle.sim.api.HustleConstants;
import io.hustle.sim.api.MultitaskingLevel;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable definition of an activity to start.
 *
 * Game code usually calls ActivityEngine.create(kind, riskTag, duration) and lets
 * the defaults apply. The builder exists for activities that need a different
 * owner, explicit attention, a multitasking level or timed phases.
 *
 * DEFAULTS:
 *   owner         "player"
 *   multitasking  PARTIAL
 *   attention     derived from the risk tag (see attentionFor)
 *   risk-bearing  tag contains "work"
 */
public final class ActivityDef {

    private final String ownerId;
    private final ActivityKind kind;
    private final String riskTag;
    private final float durationSeconds;
    private final MultitaskingLevel multitaskingLevel;
    private final float requiredAttention;
    private final boolean riskBearing;
    private final List<ActivityPhase> phases;

    private ActivityDef(Builder builder) {
        this.ownerId = builder.ownerId;
        this.kind = builder.kind;
        this.riskTag = builder.riskTag;
        this.durationSeconds = builder.durationSeconds;
        this.multitaskingLevel = builder.multitaskingLevel;
        this.requiredAttention = builder.requiredAttention != null
            ? builder.requiredAttention
            : attentionFor(builder.riskTag);
        this.riskBearing = builder.riskBearing != null
            ? builder.riskBearing
            : isRiskBearingTag(builder.riskTag);
        this.phases = List.copyOf(builder.phases);
    }

    public String ownerId() { return ownerId; }
    public ActivityKind kind() { return kind; }

    /** Risk tag; empty string when untagged, never null. */
    public String riskTag() { return riskTag; }

    /** Duration in seconds. 0 means the activity completes on its first tick. */
    public float durationSeconds() { return durationSeconds; }

    public MultitaskingLevel multitaskingLevel() { return multitaskingLevel; }
    public float requiredAttention() { return requiredAttention; }
    public boolean riskBearing() { return riskBearing; }

    /** Timed phases, in order. Empty for unphased activities. Unmodifiable. */
    public List<ActivityPhase> phases() { return phases; }

    // -- Tag conventions ------------------------------------------------------

    /**
     * Attention an activity demands, from its risk tag.
     *   untagged                 0.4
     *   contains "stream"        0.8
     *   contains "work"          0.6
     *   anything else            0.5
     */
    public static float attentionFor(String riskTag) {
        if (riskTag == null || riskTag.isEmpty()) {
            return HustleConstants.ATTENTION_UNTAGGED;
        }
        if (riskTag.contains("stream")) {
            return HustleConstants.ATTENTION_STREAM;
        }
        if (riskTag.contains("work")) {
            return HustleConstants.ATTENTION_WORK;
        }
        return HustleConstants.ATTENTION_DEFAULT;
    }

    /** Whether activities with this tag are polled for detection by default. */
    public static boolean isRiskBearingTag(String riskTag) {
        return riskTag != null && riskTag.contains(HustleConstants.RISK_BEARING_MARKER);
    }

    @Override
    public String toString() {
        return "ActivityDef{owner='" + ownerId + "', kind=" + kind + ", tag='" + riskTag +
            "', duration=" + durationSeconds + "s, phases=" + phases.size() + "}";
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder(ActivityKind kind, String riskTag, float durationSeconds) {
        return new Builder(kind, riskTag, durationSeconds);
    }

    public static final class Builder {

        private String ownerId = HustleConstants.DEFAULT_ACTOR_ID;
        private final ActivityKind kind;
        private final String riskTag;
        private final float durationSeconds;
        private MultitaskingLevel multitaskingLevel = MultitaskingLevel.PARTIAL;
        private Float requiredAttention;
        private Boolean riskBearing;
        private final List<ActivityPhase> phases = new ArrayList<>();

        private Builder(ActivityKind kind, String riskTag, float durationSeconds) {
            if (kind == null) {
                throw new IllegalArgumentException("activity kind must not be null");
            }
            this.kind = kind;
            this.riskTag = riskTag == null ? "" : riskTag;
            // Negative or NaN durations collapse to 0; the activity completes on its first tick.
            this.durationSeconds = durationSeconds > 0f ? durationSeconds : 0f;
        }

        public Builder owner(String ownerId) {
            if (ownerId != null && !ownerId.isBlank()) this.ownerId = ownerId;
            return this;
        }

        public Builder multitasking(MultitaskingLevel level) {
            if (level != null) this.multitaskingLevel = level;
            return this;
        }

        /** Overrides the tag-derived attention. Clamped to [0..1]. */
        public Builder attention(float attention) {
            this.requiredAttention = Math.max(0f, Math.min(1f, attention));
            return this;
        }

        /** Overrides the tag-derived risk-bearing flag. */
        public Builder riskBearing(boolean riskBearing) {
            this.riskBearing = riskBearing;
            return this;
        }

        public Builder phase(ActivityPhase phase) {
            if (phase != null) this.phases.add(phase);
            return this;
        }

        public Builder phases(List<ActivityPhase> phases) {
            if (phases != null) {
                for (ActivityPhase p : phases) phase(p);
            }
            return this;
        }

        public ActivityDef build() {
            return new ActivityDef(this);
        }
    }
}
