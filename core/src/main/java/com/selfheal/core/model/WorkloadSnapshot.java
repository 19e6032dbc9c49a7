package com.selfheal.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Point-in-time read of a scalable resource (a Deployment).
 * <p>
 * Taken fresh for every attempt and never reused across requests. The
 * {@code resourceVersion} gates the write that follows the read: a write carrying
 * a stale version is rejected by the API server as a conflict.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class WorkloadSnapshot {
    String namespace;
    String name;
    String resourceVersion;

    /**
     * Name of the first container in the pod template, null if the template has none.
     */
    String containerName;

    /**
     * Memory limit of the first container as written in the manifest, null if unset.
     */
    String memoryLimit;

    /**
     * Desired replica count, null if unset.
     */
    Integer replicas;

    public Optional<String> getContainerName() {
        return Optional.ofNullable(containerName);
    }

    public Optional<String> getMemoryLimit() {
        return Optional.ofNullable(memoryLimit);
    }

    public Optional<Integer> getReplicas() {
        return Optional.ofNullable(replicas);
    }
}
