package com.selfheal.remediator.k8s;

import com.selfheal.core.model.OwnerRef;
import com.selfheal.core.model.WorkloadSnapshot;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * In-memory stand-in for the Kubernetes API with resourceVersion preconditions.
 * <p>
 * Every successful write bumps the resourceVersion; a write carrying an older one is
 * answered with {@link PatchResult.Status#CONFLICT}, as the API server does. Tests can
 * make reads fail, force patch results, and interleave a concurrent writer just before
 * the next patch.
 * </p>
 */
public class InMemoryOrchestratorClient implements IOrchestratorClient {

    private final Map<String, OwnedObject> pods = new HashMap<>();
    private final Map<String, OwnedObject> replicaSets = new HashMap<>();
    private final Map<String, WorkloadSnapshot> deployments = new HashMap<>();

    private final Map<String, Boolean> unreadable = new HashMap<>();
    private final Set<String> vanishOnPatch = new HashSet<>();
    private final Deque<PatchResult.Status> forcedPatchResults = new ArrayDeque<>();
    private final Deque<Runnable> beforePatch = new ArrayDeque<>();
    private final Deque<Runnable> afterPatch = new ArrayDeque<>();
    private int lostResponses;

    private final List<String> calls = new ArrayList<>();
    private long nextResourceVersion = 100;

    // ========== Fixtures ==========

    public InMemoryOrchestratorClient pod(String namespace, String name, OwnerRef... owners) {
        pods.put(key(namespace, name), OwnedObject.of("Pod", name, Arrays.asList(owners)));
        return this;
    }

    public InMemoryOrchestratorClient podWithoutOwnerList(String namespace, String name) {
        pods.put(key(namespace, name), OwnedObject.of("Pod", name, null));
        return this;
    }

    public InMemoryOrchestratorClient replicaSet(String namespace, String name, OwnerRef... owners) {
        replicaSets.put(key(namespace, name), OwnedObject.of("ReplicaSet", name, Arrays.asList(owners)));
        return this;
    }

    public InMemoryOrchestratorClient deployment(String namespace, String name, String memoryLimit, Integer replicas) {
        deployments.put(key(namespace, name), WorkloadSnapshot.builder()
            .namespace(namespace)
            .name(name)
            .resourceVersion(String.valueOf(nextResourceVersion++))
            .containerName(name)
            .memoryLimit(memoryLimit)
            .replicas(replicas)
            .build());
        return this;
    }

    public InMemoryOrchestratorClient deployment(WorkloadSnapshot snapshot) {
        deployments.put(key(snapshot.getNamespace(), snapshot.getName()),
            snapshot.toBuilder().resourceVersion(String.valueOf(nextResourceVersion++)).build());
        return this;
    }

    // ========== Failure injection ==========

    /**
     * Makes reads of {@code kind namespace/name} fail.
     */
    public InMemoryOrchestratorClient unreadable(String kind, String namespace, String name, boolean transientFailure) {
        unreadable.put(kind + ":" + key(namespace, name), transientFailure);
        return this;
    }

    /**
     * Answers the next patches with the given statuses without touching state.
     */
    public InMemoryOrchestratorClient forcePatchResults(PatchResult.Status... statuses) {
        forcedPatchResults.addAll(Arrays.asList(statuses));
        return this;
    }

    /**
     * Applies the next {@code count} patches but answers them with
     * {@link PatchResult.Status#TRANSIENT}, as when the response times out after the
     * API server has committed the write.
     */
    public InMemoryOrchestratorClient loseNextPatchResponses(int count) {
        lostResponses += count;
        return this;
    }

    /**
     * Runs {@code writer} right before the next patch is evaluated, simulating another
     * client that wrote between our read and our write.
     */
    public InMemoryOrchestratorClient beforeNextPatch(Runnable writer) {
        beforePatch.add(writer);
        return this;
    }

    /**
     * Runs {@code writer} right after the next patch is evaluated, before its result is
     * returned.
     */
    public InMemoryOrchestratorClient afterNextPatch(Runnable writer) {
        afterPatch.add(writer);
        return this;
    }

    /**
     * Deletes the Deployment right before the next patch reaches it.
     */
    public InMemoryOrchestratorClient deleteOnPatch(String namespace, String name) {
        vanishOnPatch.add(key(namespace, name));
        return this;
    }

    /**
     * Concurrent writer: changes the Deployment and bumps its resourceVersion.
     */
    public void update(String namespace, String name, UnaryOperator<WorkloadSnapshot> change) {
        String key = key(namespace, name);
        WorkloadSnapshot changed = change.apply(deployments.get(key));
        deployments.put(key, changed.toBuilder().resourceVersion(String.valueOf(nextResourceVersion++)).build());
    }

    // ========== Inspection ==========

    public WorkloadSnapshot current(String namespace, String name) {
        return deployments.get(key(namespace, name));
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public long count(String callPrefix) {
        return calls.stream().filter(call -> call.startsWith(callPrefix)).count();
    }

    // ========== IOrchestratorClient ==========

    @Override
    public Mono<Lookup<OwnedObject>> readInstance(String name, String namespace) {
        return Mono.fromSupplier(() -> lookup("Pod", namespace, name, pods));
    }

    @Override
    public Mono<Lookup<OwnedObject>> readReplicaGroup(String name, String namespace) {
        return Mono.fromSupplier(() -> lookup("ReplicaSet", namespace, name, replicaSets));
    }

    @Override
    public Mono<Lookup<WorkloadSnapshot>> readScalableResource(String name, String namespace) {
        return Mono.fromSupplier(() -> lookup("Deployment", namespace, name, deployments));
    }

    @Override
    public Mono<PatchResult> patchMemoryLimit(WorkloadSnapshot target, String containerName, String memoryLimit) {
        return Mono.fromSupplier(() -> patch("patchMemory", target, current -> current.toBuilder()
            .memoryLimit(memoryLimit)
            .build()));
    }

    @Override
    public Mono<PatchResult> patchReplicas(WorkloadSnapshot target, int replicas) {
        return Mono.fromSupplier(() -> patch("patchReplicas", target, current -> current.toBuilder()
            .replicas(replicas)
            .build()));
    }

    @Override
    public void close() {
        calls.add("close");
    }

    private synchronized <T> Lookup<T> lookup(String kind, String namespace, String name, Map<String, T> store) {
        String key = key(namespace, name);
        calls.add("read" + kind + " " + key);

        Boolean transientFailure = unreadable.get(kind + ":" + key);
        if (transientFailure != null) {
            return Lookup.unreadable(kind + " " + key + (transientFailure ? " timed out" : " forbidden"), transientFailure);
        }
        T value = store.get(key);
        return value == null ? Lookup.absent() : Lookup.found(value);
    }

    private synchronized PatchResult patch(String operation, WorkloadSnapshot target, UnaryOperator<WorkloadSnapshot> change) {
        String key = key(target.getNamespace(), target.getName());
        calls.add(operation + " " + key + "@" + target.getResourceVersion());

        Runnable writer = beforePatch.poll();
        if (writer != null) {
            writer.run();
        }
        if (vanishOnPatch.remove(key)) {
            deployments.remove(key);
        }

        PatchResult.Status forced = forcedPatchResults.poll();
        if (forced != null) {
            return PatchResult.of(forced, operation + " " + key + " forced " + forced);
        }

        WorkloadSnapshot current = deployments.get(key);
        if (current == null) {
            return PatchResult.of(PatchResult.Status.NOT_FOUND, "Deployment " + key + " not found");
        }
        if (!current.getResourceVersion().equals(target.getResourceVersion())) {
            return PatchResult.of(PatchResult.Status.CONFLICT, String.format(
                "Operation cannot be fulfilled on deployments \"%s\": the object has been modified (have %s, sent %s)",
                target.getName(), current.getResourceVersion(), target.getResourceVersion()));
        }

        deployments.put(key, change.apply(current).toBuilder()
            .resourceVersion(String.valueOf(nextResourceVersion++))
            .build());
        Runnable after = afterPatch.poll();
        if (after != null) {
            after.run();
        }
        if (lostResponses > 0) {
            lostResponses--;
            return PatchResult.of(PatchResult.Status.TRANSIENT, operation + " " + key + " timed out");
        }
        return PatchResult.applied();
    }

    private static String key(String namespace, String name) {
        return namespace + "/" + name;
    }
}
