package com.selfheal.remediator.k8s;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of a single read against the orchestration store.
 * <p>
 * A missing object and an unreadable one are different answers: the first is a fact about
 * the cluster, the second says nothing about it. Callers branch on {@link #getStatus()}
 * rather than catching exceptions.
 * </p>
 *
 * @param <T> type of the object read
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Lookup<T> {

    public enum Status {
        FOUND,
        ABSENT,
        UNREADABLE
    }

    Status status;
    T value;

    /**
     * Set only for {@link Status#UNREADABLE}.
     */
    String failureDetail;

    /**
     * Whether an {@link Status#UNREADABLE} read may succeed if repeated (timeouts, 5xx).
     */
    boolean transientFailure;

    public static <T> Lookup<T> found(T value) {
        return new Lookup<>(Status.FOUND, value, null, false);
    }

    public static <T> Lookup<T> absent() {
        return new Lookup<>(Status.ABSENT, null, null, false);
    }

    public static <T> Lookup<T> unreadable(String failureDetail, boolean transientFailure) {
        return new Lookup<>(Status.UNREADABLE, null, failureDetail, transientFailure);
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }
}
