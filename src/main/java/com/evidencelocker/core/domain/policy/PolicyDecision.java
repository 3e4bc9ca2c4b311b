package com.evidencelocker.core.domain.policy;

/**
 * Outcome of a single policy evaluation. The reason is for server-side logs only and is never
 * sent to clients.
 */
public record PolicyDecision(boolean allowed, String reason) {

    private static final PolicyDecision ALLOW = new PolicyDecision(true, "allowed");

    public static PolicyDecision allow() {
        return ALLOW;
    }

    public static PolicyDecision deny(String reason) {
        return new PolicyDecision(false, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
