package com.selfheal.remediator.k8s;

import com.selfheal.core.model.OwnerRef;
import lombok.Value;

import java.util.List;

/**
 * Result of walking the ownership chain of a remediation target.
 * <p>
 * {@code canonicalName} is always usable: when the chain cannot be walked it is the name
 * the caller sent. {@code outcome} says why, for logs and metrics only.
 * </p>
 */
@Value
public class Resolution {

    public enum Outcome {
        /**
         * Pod -> ReplicaSet -> Deployment walked to the end.
         */
        RESOLVED,

        /**
         * No pod with that name; the target is taken to be a Deployment already.
         */
        NOT_AN_INSTANCE,

        /**
         * The pod has no owner references.
         */
        NO_OWNERS,

        /**
         * An expected hop is missing: no ReplicaSet owner, ReplicaSet gone, or no Deployment owner.
         */
        BROKEN_CHAIN,

        /**
         * A read failed (permissions, connectivity); nothing is known about the chain.
         */
        UNREADABLE
    }

    String requestedName;
    String canonicalName;

    /**
     * Owners walked, pod first. Empty unless at least one hop was read.
     */
    List<OwnerRef> chain;
    Outcome outcome;

    static Resolution resolved(String requestedName, List<OwnerRef> chain) {
        return new Resolution(requestedName, chain.get(chain.size() - 1).getName(), List.copyOf(chain), Outcome.RESOLVED);
    }

    static Resolution fallback(String requestedName, List<OwnerRef> chain, Outcome outcome) {
        return new Resolution(requestedName, requestedName, List.copyOf(chain), outcome);
    }

    public boolean isResolved() {
        return outcome == Outcome.RESOLVED;
    }
}
