package com.selfheal.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A validated remediation request: what to do, and to which workload.
 * <p>
 * {@code target} may name a pod or a Deployment; the remediator resolves it to the
 * owning Deployment before acting.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class RemediationRequest {
    @NonNull
    RemediationAction action;

    @NonNull
    String target;

    @NonNull
    String namespace;
}
