package io.hustle.sim.api;

/**
 * How an activity looks to observers: whether it is legal, and how conspicuous it is.
 *
 * Profiles are keyed by risk tag ("work.slacking", "drug_dealing", ...).
 * Legal activities only draw the attention of observers who care about job
 * performance; illegal ones only of observers who care about legality.
 *
 * IMMUTABLE.
 */
public final class RiskProfile {

    private final String riskTag;
    private final boolean legal;
    private final float visualProfile;

    /**
     * @param riskTag       tag this profile describes; must not be blank
     * @param legal         whether the activity is legal
     * @param visualProfile conspicuousness [0..1]; clamped. 0 = cannot be seen at all.
     */
    public RiskProfile(String riskTag, boolean legal, float visualProfile) {
        if (riskTag == null || riskTag.isBlank()) {
            throw new IllegalArgumentException("riskTag must not be blank");
        }
        this.riskTag = riskTag;
        this.legal = legal;
        this.visualProfile = Math.max(0f, Math.min(1f, visualProfile));
    }

    /** Profile assumed for any tag nobody registered: legal, moderately visible. */
    public static RiskProfile defaultFor(String riskTag) {
        String tag = (riskTag == null || riskTag.isBlank()) ? "untagged" : riskTag;
        return new RiskProfile(tag, true, HustleConstants.DEFAULT_VISUAL_PROFILE);
    }

    public String riskTag() { return riskTag; }
    public boolean legal() { return legal; }
    public float visualProfile() { return visualProfile; }

    @Override
    public String toString() {
        return "RiskProfile{tag='" + riskTag + "', legal=" + legal +
            ", visualProfile=" + visualProfile + "}";
    }
}
