package io.hustle.sim.core;

import io.hustle.sim.api.ActivityKind;
import io.hustle.sim.api.HustleConstants;
import io.hustle.sim.api.MultitaskingLevel;

/**
 * Pairwise multitasking compatibility.
 *
 * Two activities may run together unless any of these hold:
 *   both PHYSICAL         one body
 *   both SCREEN           one screen
 *   attention sum > 1.0   not enough focus to go round
 *   either level NONE     the activity demands exclusive focus
 *
 * The predicate is symmetric. Stateless - all methods are static.
 */
public final class MultitaskingRules {

    private MultitaskingRules() {}

    public static boolean compatible(Activity a, Activity b) {
        return compatible(a.kind(), a.multitaskingLevel(), a.requiredAttention(),
                          b.kind(), b.multitaskingLevel(), b.requiredAttention());
    }

    public static boolean compatible(ActivityKind kindA, MultitaskingLevel levelA, float attentionA,
                                     ActivityKind kindB, MultitaskingLevel levelB, float attentionB) {
        if (kindA == ActivityKind.PHYSICAL && kindB == ActivityKind.PHYSICAL) {
            return false;
        }
        if (kindA == ActivityKind.SCREEN && kindB == ActivityKind.SCREEN) {
            return false;
        }
        if (attentionA + attentionB > HustleConstants.MAX_COMBINED_ATTENTION) {
            return false;
        }
        return levelA != MultitaskingLevel.NONE && levelB != MultitaskingLevel.NONE;
    }
}
