package io.hustle.sim.api;

/**
 * Global tuning constants for the hustle simulation loop.
 *
 * These values are locked. The activity, detection and heat engines are balanced
 * against each other through them - changing one shifts how quickly suspicion
 * builds, fades and escalates. Do not modify without replaying the escalation tests.
 *
 * Units: activity and patrol timers are in real seconds, heat timers are in
 * in-game hours/days. Heat and performance are on a 0..100 scale.
 */
public final class HustleConstants {

    private HustleConstants() {}

    // -- Actors ---------------------------------------------------------------

    /** Owner id used when an activity or heat tracker is not given one. */
    public static final String DEFAULT_ACTOR_ID = "player";

    /** Location reported for an actor that has never been placed. */
    public static final String DEFAULT_LOCATION_ID = "default_location";

    // -- Activity lifecycle ---------------------------------------------------

    /** Performance score a fresh activity starts with. */
    public static final float INITIAL_PERFORMANCE = 50f;

    /** Performance sample assumed when no minigame sample was submitted. */
    public static final float DEFAULT_PERFORMANCE_SAMPLE = 50f;

    /**
     * Weight of the newest performance sample in the moving average.
     * score = score * (1 - W) + sample * W
     */
    public static final float PERFORMANCE_SAMPLE_WEIGHT = 0.1f;

    /** Flat deduction applied to performance when an activity is caught. Not a percentage. */
    public static final float DETECTION_PERFORMANCE_PENALTY = 0.2f;

    /** Upper bound of the performance scale. */
    public static final float MAX_PERFORMANCE = 100f;

    /** Combined attention above this value makes two activities incompatible. */
    public static final float MAX_COMBINED_ATTENTION = 1.0f;

    /** Attention required by an activity with no risk tag. */
    public static final float ATTENTION_UNTAGGED = 0.4f;

    /** Attention required by streaming activities (tag contains "stream"). */
    public static final float ATTENTION_STREAM = 0.8f;

    /** Attention required by work activities (tag contains "work"). */
    public static final float ATTENTION_WORK = 0.6f;

    /** Attention required by any other tagged activity. */
    public static final float ATTENTION_DEFAULT = 0.5f;

    /** Risk tags containing this marker are polled for detection each tick. */
    public static final String RISK_BEARING_MARKER = "work";

    // -- Detection ------------------------------------------------------------

    /** Lower bound for distance in the awareness ratio - avoids division by zero. */
    public static final float MIN_DETECTION_DISTANCE = 0.001f;

    /** Visual profile used for risk tags with no registered profile. */
    public static final float DEFAULT_VISUAL_PROFILE = 0.5f;

    /** Severity of any positive detection before role and legality adjustments. */
    public static final float SEVERITY_BASE = 0.5f;

    /** Added to severity when the detected activity is illegal. */
    public static final float SEVERITY_ILLEGAL_BONUS = 0.3f;

    /** Added when law enforcement witnesses an illegal act. */
    public static final float SEVERITY_LAW_ENFORCEMENT_BONUS = 0.2f;

    /** Added when an authority figure who cares about job performance notices. */
    public static final float SEVERITY_AUTHORITY_BONUS = 0.2f;

    /** Dial multipliers never drop below this floor. */
    public static final float MIN_DIAL_MULTIPLIER = 0.01f;

    /** Patrol timer jitter as a fraction of the scaled interval (+/-). */
    public static final float PATROL_JITTER_FRACTION = 0.1f;

    // -- Heat -----------------------------------------------------------------

    /** Maximum heat level. */
    public static final float MAX_HEAT = 100f;

    /**
     * Heat thresholds checked on every increase, ascending.
     * Defensive copy not made - callers must not mutate.
     */
    public static final float[] HEAT_THRESHOLDS = { 30f, 50f, 70f, 90f };

    public static final float THRESHOLD_PATROL = 30f;
    public static final float THRESHOLD_SURVEILLANCE = 50f;
    public static final float THRESHOLD_AUDIT = 70f;
    public static final float THRESHOLD_RAID = 90f;

    /** Base decay in heat points per in-game hour (one point per day). */
    public static final float BASE_DECAY_PER_HOUR = 1f / 24f;

    /** Decay multiplier while the last increase is under one day old. */
    public static final float DECAY_FRESH = 0.5f;

    /** Decay multiplier when the last increase is more than a week old. */
    public static final float DECAY_STALE = 2f;

    /** Decay multiplier when the last increase is more than a month old. */
    public static final float DECAY_COLD = 3f;

    public static final float FRESH_HEAT_DAYS = 1f;
    public static final float STALE_HEAT_DAYS = 7f;
    public static final float COLD_HEAT_DAYS = 30f;

    /** Patrol frequency multiplier applied when heat crosses 30. */
    public static final float PATROL_BOOST_AT_30 = 1.2f;

    /** Surveillance: patrol frequency multiplier. */
    public static final float SURVEILLANCE_PATROL = 1.5f;

    /** Surveillance: detection sensitivity multiplier. */
    public static final float SURVEILLANCE_SENSITIVITY = 1.3f;

    /** Legitimate-income ratio below which crossing 70 opens an audit. */
    public static final float AUDIT_LEGITIMACY_TRIGGER = 0.6f;

    /** Legitimate-income ratio above which an audit resolves clean. */
    public static final float AUDIT_LEGITIMACY_CLEAR = 0.7f;

    /** Fraction of the balance frozen while an audit runs. */
    public static final float AUDIT_FREEZE_FRACTION = 0.3f;

    /** Fraction of the balance taken as a fine when an audit finds problems. */
    public static final float AUDIT_FINE_FRACTION = 0.2f;

    /** Length of an audit in in-game days. */
    public static final float AUDIT_WINDOW_DAYS = 30f;

    /** Heat is multiplied by this after a raid. */
    public static final float RAID_HEAT_FACTOR = 0.5f;

    /** Patrol frequency multiplier while an arrest warrant is out. */
    public static final float WARRANT_PATROL = 2f;

    // -- Suspicious economy signals -------------------------------------------

    /** Transactions above this amount raise cash-deposit heat. */
    public static final float SUSPICIOUS_TRANSACTION_FLOOR = 5_000f;

    /** Heat per 10,000 of a suspicious deposit. */
    public static final float DEPOSIT_HEAT_PER_10K = 5f;

    /** Heat for income booked from an illicit source. */
    public static final float ILLICIT_INCOME_HEAT = 2f;

    /** Purchases with a vanity value above this raise heat. */
    public static final float FLASHY_VANITY_FLOOR = 70f;

    /** Heat for a purchase with vanity 100. Scales linearly. */
    public static final float FLASHY_HEAT_AT_MAX_VANITY = 10f;

    // -- Validation -----------------------------------------------------------

    /**
     * Verifies internal consistency of the constants.
     * Throws IllegalStateException if any invariant is violated.
     */
    public static void validate() {
        for (int i = 1; i < HEAT_THRESHOLDS.length; i++) {
            if (HEAT_THRESHOLDS[i] <= HEAT_THRESHOLDS[i - 1]) {
                throw new IllegalStateException("HEAT_THRESHOLDS must be strictly ascending");
            }
        }
        if (HEAT_THRESHOLDS[HEAT_THRESHOLDS.length - 1] > MAX_HEAT) {
            throw new IllegalStateException("highest heat threshold exceeds MAX_HEAT");
        }
        if (!(FRESH_HEAT_DAYS < STALE_HEAT_DAYS && STALE_HEAT_DAYS < COLD_HEAT_DAYS)) {
            throw new IllegalStateException("decay day bands must be ascending");
        }
        if (AUDIT_LEGITIMACY_CLEAR < AUDIT_LEGITIMACY_TRIGGER) {
            throw new IllegalStateException(
                "AUDIT_LEGITIMACY_CLEAR must not be below AUDIT_LEGITIMACY_TRIGGER");
        }
        if (PERFORMANCE_SAMPLE_WEIGHT <= 0f || PERFORMANCE_SAMPLE_WEIGHT > 1f) {
            throw new IllegalStateException("PERFORMANCE_SAMPLE_WEIGHT must be in (0..1]");
        }
    }

    static {
        validate();
    }
}
