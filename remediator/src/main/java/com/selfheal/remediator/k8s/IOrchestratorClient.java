package com.selfheal.remediator.k8s;

import com.selfheal.core.model.WorkloadSnapshot;
import reactor.core.publisher.Mono;

/**
 * Narrow view of the Kubernetes API used by the remediator.
 * <p>
 * Every method completes with a value; failures are reported as {@link Lookup} or
 * {@link PatchResult} statuses, never as error signals. Implementations must bound each
 * call with a timeout and report it as transient.
 * </p>
 */
public interface IOrchestratorClient {

    /**
     * Reads a pod and its owner references.
     */
    Mono<Lookup<OwnedObject>> readInstance(String name, String namespace);

    /**
     * Reads a ReplicaSet and its owner references.
     */
    Mono<Lookup<OwnedObject>> readReplicaGroup(String name, String namespace);

    /**
     * Reads the current spec of a Deployment together with its resourceVersion.
     */
    Mono<Lookup<WorkloadSnapshot>> readScalableResource(String name, String namespace);

    /**
     * Sets the memory limit of one container, conditional on the snapshot's resourceVersion.
     * Nothing else in the Deployment is touched.
     */
    Mono<PatchResult> patchMemoryLimit(WorkloadSnapshot target, String containerName, String memoryLimit);

    /**
     * Sets the desired replica count through the scale subresource, conditional on the
     * snapshot's resourceVersion.
     */
    Mono<PatchResult> patchReplicas(WorkloadSnapshot target, int replicas);

    /**
     * Releases the underlying connection.
     */
    void close();
}
