package com.selfheal.remediator.k8s;

import lombok.Value;

/**
 * Classified answer of the API server to a conditional write.
 */
@Value
public class PatchResult {

    public enum Status {
        /**
         * Write accepted.
         */
        APPLIED,

        /**
         * resourceVersion precondition failed (HTTP 409).
         */
        CONFLICT,

        /**
         * Target does not exist (HTTP 404).
         */
        NOT_FOUND,

        /**
         * Timeout, transport error, 408, 429 or 5xx.
         */
        TRANSIENT,

        /**
         * Any other refusal, e.g. 403 or 422.
         */
        REJECTED
    }

    Status status;
    String detail;

    public static PatchResult applied() {
        return new PatchResult(Status.APPLIED, null);
    }

    public static PatchResult of(Status status, String detail) {
        return new PatchResult(status, detail);
    }

    public boolean isRetryable() {
        return status == Status.CONFLICT || status == Status.TRANSIENT;
    }
}
