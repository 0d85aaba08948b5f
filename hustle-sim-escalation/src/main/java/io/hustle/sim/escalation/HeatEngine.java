package io.hustle.sim.escalation;

import io.hustle.sim.api.DetectionControl;
import io.hustle.sim.api.EconomyLedger;
import io.hustle.sim.api.EvidenceSource;
import io.hustle.sim.api.GameClock;
import io.hustle.sim.api.GameTime;
import io.hustle.sim.api.HustleConstants;
import io.hustle.sim.api.InvestigationType;
import io.hustle.sim.api.SimulationEvent;
import io.hustle.sim.api.SimulationEventBus;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks one actor's heat: law-enforcement and institutional suspicion that builds
 * from suspicious events, decays over in-game time and escalates into investigations.
 *
 * THRESHOLDS (upward crossings only, old < t <= new):
 *   30  patrol frequency x1.2
 *   50  Surveillance: patrol x1.5, sensitivity x1.3
 *   70  Audit, if the actor's legitimacy ratio is below 0.6
 *   90  Raid if there is evidence (heat halved), otherwise Arrest Warrant (patrol x2)
 * Each threshold applies its own effect only. A single large increase that crosses
 * several thresholds applies each of them once, lowest first.
 *
 * DECAY:
 *   (1/24) * m per game hour, where m depends on days since the last increase:
 *     < 1 day   0.5
 *     1 - 7     1
 *     > 7       2
 *     > 30      3
 *   Decay lowers the level only. Per-cause attribution is left as recorded.
 *   Every tick that decays posts HeatDecreased, plus HeatCleared on reaching 0.
 *
 * AUDIT:
 *   Freezes 30% of the balance for 30 in-game days. Resolved on the first tick at
 *   or after the deadline: legitimacy > 0.7 clears it, otherwise 20% of the balance
 *   is fined. The freeze is released either way.
 *
 * THREAD SAFETY:
 *   Not thread-safe. Single simulation thread.
 */
public final class HeatEngine {

    private static final Logger log = LogManager.getLogger(HeatEngine.class);

    private final String actorId;
    private final GameClock clock;
    private final DetectionControl detection;
    private final EconomyLedger ledger;
    private final EvidenceSource evidence;
    private final SimulationEventBus bus;

    // -- Heat state -----------------------------------------------------------

    private float level = 0f;
    private final Map<String, Float> sources = new LinkedHashMap<>();
    private GameTime lastIncrease;
    private final List<HeatModifier> modifiers = new ArrayList<>();

    // -- Investigation flags --------------------------------------------------

    private boolean auditActive = false;
    private float auditFrozenAmount = 0f;
    private GameTime auditDeadline = null;
    private boolean warrantActive = false;

    /** Test hook overriding the evidence source. Null = ask the source. */
    private Boolean evidenceOverride = null;

    // -- Construction ---------------------------------------------------------

    /**
     * @param actorId   actor whose heat this engine tracks
     * @param clock     in-game clock; drives decay bands and audit deadlines
     * @param detection dial sink for patrol/sensitivity escalation
     * @param ledger    economy seam for audits
     * @param evidence  decides Raid versus Arrest Warrant at the top threshold
     * @param bus       event bus shared with the other engines
     */
    public HeatEngine(String actorId, GameClock clock, DetectionControl detection,
                      EconomyLedger ledger, EvidenceSource evidence, SimulationEventBus bus) {
        if (actorId == null) throw new NullPointerException("actorId");
        if (clock == null) throw new NullPointerException("clock");
        if (detection == null) throw new NullPointerException("detection");
        if (ledger == null) throw new NullPointerException("ledger");
        if (evidence == null) throw new NullPointerException("evidence");
        if (bus == null) throw new NullPointerException("bus");
        this.actorId = actorId;
        this.clock = clock;
        this.detection = detection;
        this.ledger = ledger;
        this.evidence = evidence;
        this.bus = bus;
        this.lastIncrease = clock.now();
    }

    // -- Queries --------------------------------------------------------------

    public String actorId() { return actorId; }

    /** Heat level [0..100]. */
    public float getLevel() { return level; }

    /** Copy of accumulated heat per cause, in first-seen order. */
    public Map<String, Float> getSources() {
        return new LinkedHashMap<>(sources);
    }

    public GameTime getLastIncrease() { return lastIncrease; }

    /** Copy of the active modifiers. */
    public List<HeatModifier> getModifiers() {
        return List.copyOf(modifiers);
    }

    public boolean isAuditActive() { return auditActive; }
    public float getAuditFrozenAmount() { return auditFrozenAmount; }

    /** Null when no audit is running. */
    public GameTime getAuditDeadline() { return auditDeadline; }

    public boolean isWarrantActive() { return warrantActive; }

    // -- Persistence ----------------------------------------------------------

    public HeatState getState() {
        return new HeatState(level, sources, lastIncrease, modifiers,
            auditActive, auditFrozenAmount, auditDeadline, warrantActive);
    }

    /**
     * Replaces the heat state from a save. Dials and the ledger are not touched;
     * they are persisted by their owners.
     */
    public void restore(HeatState state) {
        if (state == null) {
            throw new NullPointerException("state");
        }
        level = clampLevel(state.level());
        sources.clear();
        sources.putAll(state.sources());
        lastIncrease = state.lastIncrease();
        modifiers.clear();
        modifiers.addAll(state.activeModifiers());
        auditActive = state.auditActive();
        auditFrozenAmount = state.auditFrozenAmount();
        auditDeadline = state.auditDeadline();
        warrantActive = state.warrantActive();
        log.debug("Restored heat for {}: {}", actorId, state);
    }

    // -- Heat changes ---------------------------------------------------------

    /**
     * Adds heat attributed to {@code cause}. Non-positive or non-finite amounts are
     * ignored. Threshold effects fire for every threshold crossed upward.
     */
    public void addHeat(float amount, String cause) {
        if (!isValidAmount(amount)) {
            log.warn("addHeat: ignoring amount {} for {}", amount, actorId);
            return;
        }
        addHeatInternal(amount, cause);
        bus.flush();
    }

    /**
     * Removes heat. Drains the named cause if it is recorded, otherwise the largest
     * one; on a tie the first-recorded cause is drained.
     */
    public void reduceHeat(float amount, String cause) {
        if (!isValidAmount(amount)) {
            log.warn("reduceHeat: ignoring amount {} for {}", amount, actorId);
            return;
        }
        reduceHeatInternal(amount, cause);
        bus.flush();
    }

    /** Reduces heat without attributing the reduction to a cause. */
    public void reduceHeat(float amount) {
        reduceHeat(amount, null);
    }

    /** @return the level increase before any threshold effect, less than amount when clamped */
    private float addHeatInternal(float amount, String cause) {
        String key = cause == null || cause.isBlank() ? HeatSources.UNKNOWN : cause;
        float oldLevel = level;
        level = clampLevel(level + amount);
        float applied = level - oldLevel;
        sources.merge(key, amount, Float::sum);
        lastIncrease = clock.now();
        bus.post(new SimulationEvent.HeatIncreased(actorId, amount, key, level));

        List<Float> crossed = new ArrayList<>();
        for (float threshold : HustleConstants.HEAT_THRESHOLDS) {
            if (oldLevel < threshold && threshold <= level) {
                crossed.add(threshold);
                bus.post(new SimulationEvent.HeatThresholdCrossed(actorId, threshold));
            }
        }
        for (float threshold : crossed) {
            applyThresholdEffect(threshold);
        }
        return applied;
    }

    private void reduceHeatInternal(float amount, String cause) {
        float oldLevel = level;
        level = clampLevel(level - amount);
        drainSource(amount, cause);

        if (level != oldLevel) {
            bus.post(new SimulationEvent.HeatDecreased(actorId, amount, level));
        }
        if (level <= 0f && oldLevel > 0f) {
            bus.post(new SimulationEvent.HeatCleared(actorId));
        }
    }

    private void drainSource(float amount, String cause) {
        if (sources.isEmpty()) {
            return;
        }
        String key = cause != null && sources.containsKey(cause) ? cause : largestSource();
        if (key != null) {
            sources.put(key, Math.max(0f, sources.get(key) - amount));
        }
    }

    /** Largest positive bucket; strict comparison keeps the first-seen cause on ties. */
    private String largestSource() {
        String largestKey = null;
        float largestValue = 0f;
        for (Map.Entry<String, Float> entry : sources.entrySet()) {
            if (entry.getValue() > largestValue) {
                largestValue = entry.getValue();
                largestKey = entry.getKey();
            }
        }
        return largestKey;
    }

    // -- Thresholds and investigations ----------------------------------------

    private void applyThresholdEffect(float threshold) {
        if (threshold == HustleConstants.THRESHOLD_PATROL) {
            detection.setPatrolFrequency(HustleConstants.PATROL_BOOST_AT_30);
        } else if (threshold == HustleConstants.THRESHOLD_SURVEILLANCE) {
            triggerInvestigationInternal(InvestigationType.SURVEILLANCE);
        } else if (threshold == HustleConstants.THRESHOLD_AUDIT) {
            float legitimacy = ledger.legitimacyRatio(actorId);
            if (legitimacy < HustleConstants.AUDIT_LEGITIMACY_TRIGGER) {
                triggerInvestigationInternal(InvestigationType.AUDIT);
            } else {
                log.debug("{} crossed {} heat but legitimacy {} avoids an audit",
                    actorId, threshold, legitimacy);
            }
        } else if (threshold == HustleConstants.THRESHOLD_RAID) {
            triggerInvestigationInternal(hasEvidence()
                ? InvestigationType.RAID
                : InvestigationType.ARREST_WARRANT);
        }
    }

    /** Starts an investigation directly, outside the threshold ladder. */
    public void triggerInvestigation(InvestigationType type) {
        if (type == null) {
            log.warn("triggerInvestigation: null type ignored");
            return;
        }
        triggerInvestigationInternal(type);
        bus.flush();
    }

    private void triggerInvestigationInternal(InvestigationType type) {
        bus.post(new SimulationEvent.InvestigationTriggered(actorId, type));
        log.info("{} investigation opened against {} at heat {}", type, actorId, level);

        switch (type) {
            case SURVEILLANCE:
                detection.setPatrolFrequency(HustleConstants.SURVEILLANCE_PATROL);
                detection.setDetectionSensitivity(HustleConstants.SURVEILLANCE_SENSITIVITY);
                break;
            case AUDIT:
                startAudit();
                break;
            case RAID:
                float halved = level * HustleConstants.RAID_HEAT_FACTOR;
                float drop = level - halved;
                level = halved;
                if (drop > 0f) {
                    bus.post(new SimulationEvent.HeatDecreased(actorId, drop, level));
                }
                break;
            case ARREST_WARRANT:
                warrantActive = true;
                detection.setPatrolFrequency(HustleConstants.WARRANT_PATROL);
                break;
            default:
                throw new IllegalStateException("Unhandled investigation type: " + type);
        }
    }

    private void startAudit() {
        if (auditActive) {
            log.info("Audit already running for {} until {}", actorId, auditDeadline);
            return;
        }
        float balance = ledger.balance(actorId);
        auditFrozenAmount = Math.max(0f, balance * HustleConstants.AUDIT_FREEZE_FRACTION);
        auditDeadline = clock.now().plusDays(HustleConstants.AUDIT_WINDOW_DAYS);
        auditActive = true;
        ledger.freeze(actorId, auditFrozenAmount);
    }

    /** Resolves a running audit now, regardless of its deadline. No-op when none is running. */
    public void resolveAudit() {
        resolveAuditInternal();
        bus.flush();
    }

    private void resolveAuditInternal() {
        if (!auditActive) {
            return;
        }
        float legitimacy = ledger.legitimacyRatio(actorId);
        boolean clean = legitimacy > HustleConstants.AUDIT_LEGITIMACY_CLEAR;
        float fine = 0f;
        if (!clean) {
            fine = Math.max(0f, ledger.balance(actorId) * HustleConstants.AUDIT_FINE_FRACTION);
            ledger.fine(actorId, fine);
        }
        ledger.unfreeze(actorId, auditFrozenAmount);

        auditActive = false;
        auditFrozenAmount = 0f;
        auditDeadline = null;
        bus.post(new SimulationEvent.AuditResolved(actorId, clean, fine));
        log.info("Audit of {} resolved: {} (legitimacy {}, fine {})",
            actorId, clean ? "clean" : "fined", legitimacy, fine);
    }

    /** Lifts an active arrest warrant. The patrol boost it applied stays in the dials. */
    public void clearWarrant() {
        if (!warrantActive) {
            return;
        }
        warrantActive = false;
        bus.post(new SimulationEvent.WarrantCleared(actorId));
        log.info("Warrant against {} cleared", actorId);
        bus.flush();
    }

    // -- Suspicious-event signals ---------------------------------------------

    /**
     * Large cash movements and income from illicit sources draw attention.
     *   amount > 5000                   amount / 10000 * 5 heat to cash_deposit
     *   source DrugSale or SexWork      2 heat to suspicious_income
     */
    public void onSuspiciousTransaction(float amount, String source) {
        if (amount > HustleConstants.SUSPICIOUS_TRANSACTION_FLOOR && !Float.isInfinite(amount)) {
            addHeatInternal(amount / 10_000f * HustleConstants.DEPOSIT_HEAT_PER_10K,
                HeatSources.CASH_DEPOSIT);
        }
        if ("DrugSale".equalsIgnoreCase(source) || "SexWork".equalsIgnoreCase(source)) {
            addHeatInternal(HustleConstants.ILLICIT_INCOME_HEAT, HeatSources.SUSPICIOUS_INCOME);
        }
        bus.flush();
    }

    /** Purchases with vanity above 70 add vanity / 100 * 10 heat to flashy_purchase. */
    public void onFlashyPurchase(float vanity) {
        if (vanity > HustleConstants.FLASHY_VANITY_FLOOR) {
            addHeatInternal(vanity / 100f * HustleConstants.FLASHY_HEAT_AT_MAX_VANITY,
                HeatSources.FLASHY_PURCHASE);
            bus.flush();
        }
    }

    // -- Modifiers ------------------------------------------------------------

    /**
     * Adds {@code amount} heat attributed to {@code source} for {@code durationHours}
     * in-game hours. On expiry the heat it actually added is drained from the same
     * source.
     */
    public void applyModifier(String source, float amount, double durationHours) {
        if (!isValidAmount(amount) || !(durationHours > 0.0) || Double.isInfinite(durationHours)) {
            log.warn("applyModifier: ignoring {} heat for {}h from '{}'", amount, durationHours, source);
            return;
        }
        if (source == null || source.isBlank()) {
            log.warn("applyModifier: blank source ignored");
            return;
        }
        GameTime expiresAt = clock.now().plusHours(durationHours);
        float applied = addHeatInternal(amount, source);
        modifiers.add(HeatModifier.timed(source, amount, applied, expiresAt));
        bus.flush();
    }

    /** Adds heat attributed to {@code source} that never expires. */
    public void applyPermanentModifier(String source, float amount) {
        if (!isValidAmount(amount)) {
            log.warn("applyPermanentModifier: ignoring {} heat from '{}'", amount, source);
            return;
        }
        if (source == null || source.isBlank()) {
            log.warn("applyPermanentModifier: blank source ignored");
            return;
        }
        float applied = addHeatInternal(amount, source);
        modifiers.add(HeatModifier.permanent(source, amount, applied));
        bus.flush();
    }

    // -- Tick -----------------------------------------------------------------

    /**
     * Advances heat by {@code deltaGameHours}: decay, modifier expiry, then a due
     * audit. Non-positive or non-finite deltas skip decay but still expire
     * modifiers and resolve audits against the clock.
     */
    public void tick(double deltaGameHours) {
        GameTime now = clock.now();
        if (deltaGameHours > 0.0 && !Double.isInfinite(deltaGameHours)) {
            decay(deltaGameHours, now);
        }

        Iterator<HeatModifier> it = modifiers.iterator();
        List<HeatModifier> expired = new ArrayList<>();
        while (it.hasNext()) {
            HeatModifier modifier = it.next();
            if (modifier.isExpired(now)) {
                it.remove();
                expired.add(modifier);
            }
        }
        for (HeatModifier modifier : expired) {
            if (modifier.applied() > 0f) {
                reduceHeatInternal(modifier.applied(), modifier.source());
            }
        }

        if (auditActive && now.isAtOrAfter(auditDeadline)) {
            resolveAuditInternal();
        }
        bus.flush();
    }

    private void decay(double hours, GameTime now) {
        if (level <= 0f) {
            return;
        }
        float amount = (float) (HustleConstants.BASE_DECAY_PER_HOUR
            * decayMultiplier(now.daysSince(lastIncrease)) * hours);
        float oldLevel = level;
        level = Math.max(0f, level - amount);
        if (level < oldLevel) {
            bus.post(new SimulationEvent.HeatDecreased(actorId, oldLevel - level, level));
        }
        if (level <= 0f && oldLevel > 0f) {
            bus.post(new SimulationEvent.HeatCleared(actorId));
        }
    }

    /** Decay multiplier for heat last fed {@code daysSinceIncrease} days ago. */
    public static float decayMultiplier(double daysSinceIncrease) {
        if (daysSinceIncrease < HustleConstants.FRESH_HEAT_DAYS) {
            return HustleConstants.DECAY_FRESH;
        }
        if (daysSinceIncrease > HustleConstants.COLD_HEAT_DAYS) {
            return HustleConstants.DECAY_COLD;
        }
        if (daysSinceIncrease > HustleConstants.STALE_HEAT_DAYS) {
            return HustleConstants.DECAY_STALE;
        }
        return 1f;
    }

    // -- Test hooks -----------------------------------------------------------

    /** Forces the evidence check at the top threshold. Null restores the evidence source. */
    public void setEvidenceOverride(Boolean hasEvidence) {
        this.evidenceOverride = hasEvidence;
    }

    /** Sets the level directly. No events, no thresholds. */
    public void setLevelForTesting(float level) {
        this.level = clampLevel(level);
    }

    public void setLastIncreaseForTesting(GameTime lastIncrease) {
        if (lastIncrease == null) {
            throw new NullPointerException("lastIncrease");
        }
        this.lastIncrease = lastIncrease;
    }

    // -- Internal -------------------------------------------------------------

    private boolean hasEvidence() {
        Boolean override = evidenceOverride;
        return override != null ? override : evidence.hasIncriminatingEvidence(actorId);
    }

    private static boolean isValidAmount(float amount) {
        return amount > 0f && !Float.isInfinite(amount);
    }

    private static float clampLevel(float value) {
        if (Float.isNaN(value)) {
            return 0f;
        }
        return Math.max(0f, Math.min(HustleConstants.MAX_HEAT, value));
    }
}
