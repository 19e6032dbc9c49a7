package com.selfheal.core.model;

/**
 * Why a remediation did not reach a terminal success.
 */
public enum FailureKind {
    /**
     * Every attempt lost an optimistic-concurrency race.
     */
    CONFLICT_RETRY_EXHAUSTED,

    /**
     * The target disappeared; retrying cannot help.
     */
    RESOURCE_NOT_FOUND,

    /**
     * Timeouts or transport errors on every attempt.
     */
    TRANSIENT_RETRY_EXHAUSTED,

    /**
     * The API server refused the write (forbidden, invalid).
     */
    REJECTED,

    /**
     * The resource cannot take this mutation, e.g. a pod template without containers.
     */
    INVALID_RESOURCE
}
