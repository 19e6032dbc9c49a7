package com.selfheal.core.model;

import lombok.Value;

/**
 * Next state of a resource, computed from a single fresh read.
 * <p>
 * Exactly one of {@code newMemoryMebibytes} and {@code newReplicas} is meaningful,
 * selected by {@code action}. Previous and new values are kept in their display form
 * for audit messages.
 * </p>
 */
@Value
public class RemediationDecision {
    RemediationAction action;
    String previousValue;
    String newValue;
    long newMemoryMebibytes;
    int newReplicas;

    public static RemediationDecision memory(String previousLimit, long newMebibytes, String newLimit) {
        return new RemediationDecision(RemediationAction.INCREMENT_MEMORY, previousLimit, newLimit, newMebibytes, 0);
    }

    public static RemediationDecision replicas(int previousReplicas, int newReplicas) {
        return new RemediationDecision(RemediationAction.SCALE_OUT,
            String.valueOf(previousReplicas), String.valueOf(newReplicas), 0L, newReplicas);
    }
}
