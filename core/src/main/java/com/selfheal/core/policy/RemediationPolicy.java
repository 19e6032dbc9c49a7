package com.selfheal.core.policy;

import com.selfheal.core.model.RemediationAction;
import com.selfheal.core.model.RemediationDecision;
import com.selfheal.core.model.WorkloadSnapshot;
import com.selfheal.core.quantity.MemoryQuantity;

import java.util.Optional;

/**
 * Decides the next state of a workload from its current state.
 * <p>
 * Decisions depend only on the snapshot passed in, so a retry that re-reads the same
 * state computes the same decision.
 * </p>
 * <p>
 * <b>Vertical:</b> {@code new = max(floor(current * 1.25), current + 1)} MiB, with an unset
 * limit counted as 256 MiB. The {@code current + 1} floor keeps very small limits growing.
 * There is no upper bound.
 * </p>
 * <p>
 * <b>Horizontal:</b> 0 or 1 replicas jump straight to 2; from 2 upward add one. An unset
 * replica count is counted as 1.
 * </p>
 */
public class RemediationPolicy {

    public static final int HIGH_AVAILABILITY_REPLICAS = 2;
    public static final int DEFAULT_REPLICAS = 1;

    public RemediationDecision decide(RemediationAction action, WorkloadSnapshot snapshot) {
        switch (action) {
            case INCREMENT_MEMORY:
                return incrementMemory(snapshot.getMemoryLimit());
            case SCALE_OUT:
                return scaleOut(snapshot.getReplicas().orElse(null));
            default:
                throw new IllegalArgumentException("Unsupported action: " + action);
        }
    }

    /**
     * @param currentLimit memory limit as written in the manifest, empty if unset
     * @return decision carrying the previous limit as read (or the default) and the new limit in MiB
     */
    public RemediationDecision incrementMemory(Optional<String> currentLimit) {
        String previous = currentLimit.orElse(MemoryQuantity.format(MemoryQuantity.FALLBACK_MEBIBYTES));
        long current = MemoryQuantity.parseMebibytes(previous);
        long next = nextMemoryMebibytes(current);
        return RemediationDecision.memory(previous, next, MemoryQuantity.format(next));
    }

    public RemediationDecision scaleOut(Integer currentReplicas) {
        int current = currentReplicas != null ? currentReplicas : DEFAULT_REPLICAS;
        return RemediationDecision.replicas(current, nextReplicas(current));
    }

    static long nextMemoryMebibytes(long currentMebibytes) {
        if (currentMebibytes >= Long.MAX_VALUE / 5) {
            return Long.MAX_VALUE;
        }
        long grown = currentMebibytes * 5 / 4;
        return Math.max(grown, currentMebibytes + 1);
    }

    static int nextReplicas(int currentReplicas) {
        if (currentReplicas < HIGH_AVAILABILITY_REPLICAS) {
            return HIGH_AVAILABILITY_REPLICAS;
        }
        return currentReplicas == Integer.MAX_VALUE ? Integer.MAX_VALUE : currentReplicas + 1;
    }
}
