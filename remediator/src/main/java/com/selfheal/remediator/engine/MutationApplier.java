package com.selfheal.remediator.engine;

import com.selfheal.core.metrics.MetricsNames;
import com.selfheal.core.metrics.MetricsTags;
import com.selfheal.core.model.FailureKind;
import com.selfheal.core.model.RemediationAction;
import com.selfheal.core.model.RemediationDecision;
import com.selfheal.core.model.RemediationOutcome;
import com.selfheal.core.model.WorkloadSnapshot;
import com.selfheal.core.policy.RemediationPolicy;
import com.selfheal.core.quantity.MemoryQuantity;
import com.selfheal.core.util.JitterBackoff;
import com.selfheal.remediator.config.RemediatorConfig;
import com.selfheal.remediator.k8s.IOrchestratorClient;
import com.selfheal.remediator.k8s.PatchResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies one remediation to a Deployment under optimistic concurrency.
 * <p>
 * Each attempt reads the Deployment, asks the {@link RemediationPolicy} for the next state,
 * and writes only the changed field, conditional on the resourceVersion it read. If another
 * writer got there first the write is refused with a conflict; the next attempt starts from
 * a fresh read, so the value finally written is derived from the latest state and never
 * from the stale one.
 * </p>
 * <p>
 * Conflicts and transient failures are retried with jittered backoff, up to
 * {@code maxAttempts} attempts in total. A missing Deployment or a refused write ends the
 * request at once.
 * </p>
 * <p>
 * A transient write failure leaves the outcome of that write unknown. If the next read
 * shows a newer resourceVersion holding exactly the value that write carried, the write is
 * taken as applied and not repeated.
 * </p>
 */
public class MutationApplier {
    private static final Logger log = LoggerFactory.getLogger(MutationApplier.class);

    private final IOrchestratorClient client;
    private final RemediationPolicy policy;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;
    private final Duration retryBase;
    private final Duration retryMax;
    private final Duration retryJitter;

    public MutationApplier(IOrchestratorClient client, RemediationPolicy policy,
                           RemediatorConfig config, MeterRegistry meterRegistry) {
        this.client = client;
        this.policy = policy;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = Math.max(1, config.getMaxAttempts());
        this.retryBase = config.getRetryBase();
        this.retryMax = config.getRetryMax();
        this.retryJitter = config.getRetryJitter();
    }

    /**
     * Remediates {@code namespace/resourceName}.
     *
     * @param resourceName Deployment name (already resolved)
     * @param namespace    namespace of the Deployment
     * @param action       what to change
     * @return terminal outcome; failures are values, not error signals
     */
    public Mono<RemediationOutcome> apply(String resourceName, String namespace, RemediationAction action) {
        return attempt(new Target(resourceName, namespace, action), 1, null);
    }

    /**
     * @param unconfirmed write of the previous attempt whose response was lost, or null
     */
    private Mono<RemediationOutcome> attempt(Target target, int attempt, UnconfirmedWrite unconfirmed) {
        return client.readScalableResource(target.name, target.namespace)
            .flatMap(lookup -> {
                switch (lookup.getStatus()) {
                    case ABSENT:
                        return Mono.just(target.failure(FailureKind.RESOURCE_NOT_FOUND,
                            "Deployment " + target + " not found", attempt));
                    case UNREADABLE:
                        if (lookup.isTransientFailure()) {
                            return retryOrGiveUp(target, attempt, PatchResult.Status.TRANSIENT,
                                lookup.getFailureDetail(), unconfirmed);
                        }
                        return Mono.just(target.failure(FailureKind.REJECTED, lookup.getFailureDetail(), attempt));
                    default:
                        WorkloadSnapshot snapshot = lookup.getValue().orElseThrow();
                        if (unconfirmed != null && unconfirmed.landedIn(snapshot)) {
                            log.info("Deployment {} already holds {} from attempt {} (resourceVersion {} -> {}), not writing again",
                                target, unconfirmed.decision.getNewValue(), attempt - 1,
                                unconfirmed.resourceVersion, snapshot.getResourceVersion());
                            return Mono.just(RemediationOutcome.success(target.name, target.namespace,
                                unconfirmed.decision, attempt));
                        }
                        return mutate(target, snapshot, attempt);
                }
            });
    }

    private Mono<RemediationOutcome> mutate(Target target, WorkloadSnapshot snapshot, int attempt) {
        RemediationDecision decision = policy.decide(target.action, snapshot);

        Mono<PatchResult> write;
        if (target.action == RemediationAction.INCREMENT_MEMORY) {
            Optional<String> container = snapshot.getContainerName();
            if (container.isEmpty()) {
                return Mono.just(target.failure(FailureKind.INVALID_RESOURCE,
                    "Deployment " + target + " has no containers in its pod template", attempt));
            }
            write = client.patchMemoryLimit(snapshot, container.get(), decision.getNewValue());
        } else {
            write = client.patchReplicas(snapshot, decision.getNewReplicas());
        }

        log.info("Attempt {}/{}: {} on Deployment {} at resourceVersion {}: {} -> {}",
            attempt, maxAttempts, target.action.wireName(), target, snapshot.getResourceVersion(),
            decision.getPreviousValue(), decision.getNewValue());

        return write.flatMap(result -> {
            if (result.getStatus() == PatchResult.Status.APPLIED) {
                log.info("Deployment {} {} applied: {} -> {}", target, target.action.wireName(),
                    decision.getPreviousValue(), decision.getNewValue());
                return Mono.just(RemediationOutcome.success(target.name, target.namespace, decision, attempt));
            }
            if (result.isRetryable()) {
                // a timed-out write may still have been applied
                UnconfirmedWrite unconfirmed = result.getStatus() == PatchResult.Status.TRANSIENT
                    ? new UnconfirmedWrite(decision, snapshot.getResourceVersion())
                    : null;
                return retryOrGiveUp(target, attempt, result.getStatus(), result.getDetail(), unconfirmed);
            }
            FailureKind kind = result.getStatus() == PatchResult.Status.NOT_FOUND
                ? FailureKind.RESOURCE_NOT_FOUND
                : FailureKind.REJECTED;
            return Mono.just(target.failure(kind, result.getDetail(), attempt));
        });
    }

    private Mono<RemediationOutcome> retryOrGiveUp(Target target, int attempt, PatchResult.Status reason,
                                                   String detail, UnconfirmedWrite unconfirmed) {
        if (attempt >= maxAttempts) {
            FailureKind kind = reason == PatchResult.Status.CONFLICT
                ? FailureKind.CONFLICT_RETRY_EXHAUSTED
                : FailureKind.TRANSIENT_RETRY_EXHAUSTED;
            log.error("Giving up on Deployment {} after {} attempts: {}", target, attempt, detail);
            return Mono.just(target.failure(kind, detail + " (gave up after " + attempt + " attempts)", attempt));
        }

        meterRegistry.counter(MetricsNames.REMEDIATION_RETRIES_TOTAL,
            MetricsTags.ACTION, target.action.wireName(),
            MetricsTags.REASON, reason == PatchResult.Status.CONFLICT ? "conflict" : "transient").increment();

        Duration delay = JitterBackoff.next(attempt - 1, retryBase, retryMax, retryJitter);
        log.warn("Attempt {}/{} on Deployment {} hit {}, re-reading in {} ms: {}",
            attempt, maxAttempts, target, reason, delay.toMillis(), detail);

        return Mono.delay(delay).then(Mono.defer(() -> attempt(target, attempt + 1, unconfirmed)));
    }

    /**
     * A write whose outcome is unknown, with the resourceVersion it was conditioned on.
     */
    private record UnconfirmedWrite(RemediationDecision decision, String resourceVersion) {

        /**
         * True when {@code snapshot} moved past the conditioned version and holds exactly the
         * value this write carried.
         */
        private boolean landedIn(WorkloadSnapshot snapshot) {
            if (Objects.equals(resourceVersion, snapshot.getResourceVersion())) {
                return false;
            }
            if (decision.getAction() == RemediationAction.INCREMENT_MEMORY) {
                return snapshot.getMemoryLimit()
                    .map(MemoryQuantity::parseMebibytes)
                    .filter(mebibytes -> mebibytes == decision.getNewMemoryMebibytes())
                    .isPresent();
            }
            return snapshot.getReplicas()
                .filter(replicas -> replicas == decision.getNewReplicas())
                .isPresent();
        }
    }

    private record Target(String name, String namespace, RemediationAction action) {

        private RemediationOutcome failure(FailureKind kind, String detail, int attempts) {
            return RemediationOutcome.failure(action, name, namespace, kind, detail, attempts);
        }

        @Override
        public String toString() {
            return namespace + "/" + name;
        }
    }
}
