package com.selfheal.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Terminal result of one remediation request, returned to the caller and never persisted.
 */
@Value
@Builder(toBuilder = true)
public class RemediationOutcome {
    Status status;
    RemediationAction action;
    String resourceName;
    String namespace;
    String previousValue;
    String newValue;
    int attempts;

    /**
     * Null on success.
     */
    FailureKind failureKind;

    /**
     * Null on success.
     */
    String errorDetail;

    public enum Status {
        SUCCESS,
        FAILURE
    }

    public static RemediationOutcome success(String resourceName, String namespace,
                                             RemediationDecision decision, int attempts) {
        return RemediationOutcome.builder()
            .status(Status.SUCCESS)
            .action(decision.getAction())
            .resourceName(resourceName)
            .namespace(namespace)
            .previousValue(decision.getPreviousValue())
            .newValue(decision.getNewValue())
            .attempts(attempts)
            .build();
    }

    public static RemediationOutcome failure(RemediationAction action, String resourceName, String namespace,
                                             FailureKind kind, String detail, int attempts) {
        return RemediationOutcome.builder()
            .status(Status.FAILURE)
            .action(action)
            .resourceName(resourceName)
            .namespace(namespace)
            .failureKind(kind)
            .errorDetail(detail)
            .attempts(attempts)
            .build();
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
