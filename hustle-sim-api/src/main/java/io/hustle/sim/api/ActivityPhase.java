package io.hustle.sim.api;

/**
 * One timed phase of a phased activity - e.g. a shift that alternates focused
 * work with breaks.
 *
 * When the phase becomes current the activity adopts its attention and
 * multitasking parameters (BREAKS if multitasking is allowed, NONE otherwise).
 *
 * IMMUTABLE.
 */
public final class ActivityPhase {

    private final String name;
    private final float durationSeconds;
    private final boolean multitaskingAllowed;
    private final float attention;

    /**
     * @param name                phase label shown to the player
     * @param durationSeconds     phase length; must be > 0
     * @param multitaskingAllowed whether other activities may run during this phase
     * @param attention           attention the phase demands; clamped to [0..1]
     */
    public ActivityPhase(String name, float durationSeconds,
                         boolean multitaskingAllowed, float attention) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("phase name must not be blank");
        }
        if (!(durationSeconds > 0f)) {
            throw new IllegalArgumentException(
                "phase duration must be > 0; got " + durationSeconds);
        }
        this.name = name;
        this.durationSeconds = durationSeconds;
        this.multitaskingAllowed = multitaskingAllowed;
        this.attention = Math.max(0f, Math.min(1f, attention));
    }

    public String name() { return name; }
    public float durationSeconds() { return durationSeconds; }
    public boolean multitaskingAllowed() { return multitaskingAllowed; }
    public float attention() { return attention; }

    /** Multitasking level an activity takes on while in this phase. */
    public MultitaskingLevel multitaskingLevel() {
        return multitaskingAllowed ? MultitaskingLevel.BREAKS : MultitaskingLevel.NONE;
    }

    @Override
    public String toString() {
        return "ActivityPhase{name='" + name + "', duration=" + durationSeconds +
            "s, multitask=" + multitaskingAllowed + ", attention=" + attention + "}";
    }
}
