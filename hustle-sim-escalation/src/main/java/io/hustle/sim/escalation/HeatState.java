package io.hustle.sim.escalation;

import io.hustle.sim.api.GameTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one actor's heat, for save games and debug overlays.
 *
 * Produced by HeatEngine.getState() and consumed by HeatEngine.restore().
 * IMMUTABLE: collections are copied in and exposed read-only. Source buckets must
 * have non-null names and finite, non-negative amounts.
 */
public final class HeatState {

    private final float level;
    private final Map<String, Float> sources;
    private final GameTime lastIncrease;
    private final List<HeatModifier> activeModifiers;
    private final boolean auditActive;
    private final float auditFrozenAmount;
    private final GameTime auditDeadline;
    private final boolean warrantActive;

    public HeatState(float level,
                     Map<String, Float> sources,
                     GameTime lastIncrease,
                     List<HeatModifier> activeModifiers,
                     boolean auditActive,
                     float auditFrozenAmount,
                     GameTime auditDeadline,
                     boolean warrantActive) {
        if (lastIncrease == null) {
            throw new IllegalArgumentException("lastIncrease must not be null");
        }
        if (auditActive && auditDeadline == null) {
            throw new IllegalArgumentException("an active audit needs a deadline");
        }
        Map<String, Float> copy = new LinkedHashMap<>();
        if (sources != null) {
            for (Map.Entry<String, Float> entry : sources.entrySet()) {
                Float amount = entry.getValue();
                if (entry.getKey() == null || amount == null
                        || amount.isNaN() || amount.isInfinite() || amount < 0f) {
                    throw new IllegalArgumentException("invalid heat source " +
                        entry.getKey() + "=" + amount);
                }
                copy.put(entry.getKey(), amount);
            }
        }
        this.level = level;
        this.sources = Collections.unmodifiableMap(copy);
        this.lastIncrease = lastIncrease;
        this.activeModifiers = activeModifiers == null ? List.of() : List.copyOf(activeModifiers);
        this.auditActive = auditActive;
        this.auditFrozenAmount = auditFrozenAmount;
        this.auditDeadline = auditDeadline;
        this.warrantActive = warrantActive;
    }

    /** Heat level [0..100]. */
    public float level() { return level; }

    /** Accumulated heat per cause, in first-seen order. */
    public Map<String, Float> sources() { return sources; }

    public GameTime lastIncrease() { return lastIncrease; }
    public List<HeatModifier> activeModifiers() { return activeModifiers; }
    public boolean auditActive() { return auditActive; }
    public float auditFrozenAmount() { return auditFrozenAmount; }

    /** Null when no audit is running. */
    public GameTime auditDeadline() { return auditDeadline; }

    public boolean warrantActive() { return warrantActive; }

    @Override
    public String toString() {
        return "HeatState{level=" + level + ", sources=" + sources + ", lastIncrease=" + lastIncrease +
            ", modifiers=" + activeModifiers.size() + ", audit=" + auditActive +
            ", warrant=" + warrantActive + "}";
    }
}
