package io.hustle.sim.api;

/**
 * Read side of the detection engine, as seen by the activity lifecycle.
 */
@FunctionalInterface
public interface DetectionQuery {

    /**
     * Checks whether any observer currently perceives the actor doing the tagged activity.
     *
     * @param actorId actor whose pose is tested
     * @param riskTag risk tag of the activity being performed
     * @return a fresh result; never null
     */
    DetectionResult checkDetection(String actorId, String riskTag);
}
