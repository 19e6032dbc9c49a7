package com.selfheal.remediator.k8s;

import com.selfheal.core.metrics.MetricsNames;
import com.selfheal.core.metrics.MetricsTags;
import com.selfheal.core.model.OwnerRef;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a pod name to the Deployment that owns it.
 * <p>
 * Alerts usually name the pod that misbehaved, but only the Deployment can be mutated
 * durably. The walk is exactly Pod -> ReplicaSet -> Deployment; pods owned by anything
 * else (StatefulSets, Jobs, bare ReplicaSets) and deeper chains are not followed.
 * </p>
 * <p>
 * Resolution never fails a request. Whenever a hop is missing or unreadable the name the
 * caller sent is returned unchanged and the remediation is attempted against it. Missing
 * hops are logged at DEBUG; unreadable ones at WARN, since they can hide RBAC or network
 * problems.
 * </p>
 * <p>
 * Nothing is cached: owners can change between requests.
 * </p>
 */
public class OwnershipResolver {
    private static final Logger log = LoggerFactory.getLogger(OwnershipResolver.class);

    private final IOrchestratorClient client;
    private final MeterRegistry meterRegistry;

    public OwnershipResolver(IOrchestratorClient client, MeterRegistry meterRegistry) {
        this.client = client;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Walks the ownership chain of {@code instanceName}.
     *
     * @param instanceName pod (or Deployment) name from the request
     * @param namespace    namespace of the target
     * @return resolution, never an error signal
     */
    public Mono<Resolution> resolve(String instanceName, String namespace) {
        return client.readInstance(instanceName, namespace)
            .flatMap(lookup -> {
                switch (lookup.getStatus()) {
                    case ABSENT:
                        return Mono.just(Resolution.fallback(instanceName, List.of(), Resolution.Outcome.NOT_AN_INSTANCE));
                    case UNREADABLE:
                        return Mono.just(unreadable(instanceName, List.of(), lookup.getFailureDetail()));
                    default:
                        return fromInstance(instanceName, namespace, lookup.getValue().orElseThrow());
                }
            })
            .doOnNext(resolution -> record(resolution, namespace));
    }

    private Mono<Resolution> fromInstance(String instanceName, String namespace, OwnedObject pod) {
        if (!pod.hasOwners()) {
            return Mono.just(Resolution.fallback(instanceName, List.of(), Resolution.Outcome.NO_OWNERS));
        }

        Optional<OwnerRef> replicaSet = pod.findOwner(OwnerRef.KIND_REPLICA_SET);
        if (replicaSet.isEmpty()) {
            return Mono.just(Resolution.fallback(instanceName, List.of(), Resolution.Outcome.BROKEN_CHAIN));
        }

        List<OwnerRef> chain = new ArrayList<>();
        chain.add(replicaSet.get());

        return client.readReplicaGroup(replicaSet.get().getName(), namespace)
            .map(lookup -> {
                switch (lookup.getStatus()) {
                    case ABSENT:
                        return Resolution.fallback(instanceName, chain, Resolution.Outcome.BROKEN_CHAIN);
                    case UNREADABLE:
                        return unreadable(instanceName, chain, lookup.getFailureDetail());
                    default:
                        Optional<OwnerRef> deployment = lookup.getValue().orElseThrow()
                            .findOwner(OwnerRef.KIND_DEPLOYMENT);
                        if (deployment.isEmpty()) {
                            return Resolution.fallback(instanceName, chain, Resolution.Outcome.BROKEN_CHAIN);
                        }
                        chain.add(deployment.get());
                        return Resolution.resolved(instanceName, chain);
                }
            });
    }

    private Resolution unreadable(String instanceName, List<OwnerRef> chain, String detail) {
        log.warn("Ownership of {} could not be read, acting on it directly: {}", instanceName, detail);
        return Resolution.fallback(instanceName, chain, Resolution.Outcome.UNREADABLE);
    }

    private void record(Resolution resolution, String namespace) {
        meterRegistry.counter(MetricsNames.RESOLUTION_TOTAL,
            MetricsTags.OUTCOME, resolution.getOutcome().name().toLowerCase(Locale.ROOT)).increment();

        if (resolution.isResolved()) {
            log.info("Resolved {}/{} -> Deployment {} via {}", namespace, resolution.getRequestedName(),
                resolution.getCanonicalName(), resolution.getChain());
        } else if (resolution.getOutcome() != Resolution.Outcome.UNREADABLE) {
            log.debug("Using {}/{} as-is ({})", namespace, resolution.getRequestedName(), resolution.getOutcome());
        }
    }
}
