package com.cdnarchiver.core.policy;

import java.util.List;

/**
 * Outcome of a policy check. Allowed exactly when there are no reasons.
 */
public record PolicyDecision(boolean allowed, List<String> reasons) {

    public PolicyDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static PolicyDecision allow() {
        return new PolicyDecision(true, List.of());
    }

    public static PolicyDecision fromReasons(List<String> reasons) {
        return new PolicyDecision(reasons == null || reasons.isEmpty(), reasons);
    }
}
