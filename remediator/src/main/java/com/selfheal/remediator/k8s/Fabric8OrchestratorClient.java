package com.selfheal.remediator.k8s;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.selfheal.core.model.OwnerRef;
import com.selfheal.core.model.WorkloadSnapshot;
import com.selfheal.core.util.JsonUtils;
import com.selfheal.remediator.config.RemediatorConfig;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentSpec;
import io.fabric8.kubernetes.api.model.autoscaling.v1.Scale;
import io.fabric8.kubernetes.api.model.autoscaling.v1.ScaleBuilder;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link IOrchestratorClient} backed by the fabric8 Kubernetes client.
 * <p>
 * fabric8 calls block, so each one runs on {@link Schedulers#boundedElastic()}. Errors are
 * classified here, at the boundary, from the HTTP status carried by
 * {@link KubernetesClientException}:
 * <ul>
 *   <li>409 - conflict (stale resourceVersion)</li>
 *   <li>404 - not found</li>
 *   <li>0 (no response), 408, 429, 5xx, I/O errors and timeouts - transient</li>
 *   <li>anything else - rejected</li>
 * </ul>
 * </p>
 */
public class Fabric8OrchestratorClient implements IOrchestratorClient {
    private static final Logger log = LoggerFactory.getLogger(Fabric8OrchestratorClient.class);

    private final KubernetesClient client;
    private final Duration callTimeout;

    public Fabric8OrchestratorClient(KubernetesClient client, Duration callTimeout) {
        this.client = client;
        this.callTimeout = callTimeout;
    }

    /**
     * Builds a client from kubeconfig or the in-cluster service account, with the configured
     * request and connect timeouts applied.
     */
    public static Fabric8OrchestratorClient fromConfig(RemediatorConfig config) {
        Config k8sConfig = new ConfigBuilder(Config.autoConfigure(null))
            .withRequestTimeout((int) config.getKubernetesRequestTimeout().toMillis())
            .withConnectionTimeout((int) config.getKubernetesConnectTimeout().toMillis())
            .build();

        KubernetesClient client = new KubernetesClientBuilder().withConfig(k8sConfig).build();
        log.info("Kubernetes client initialized: master={}, requestTimeout={}, connectTimeout={}",
            k8sConfig.getMasterUrl(), config.getKubernetesRequestTimeout(), config.getKubernetesConnectTimeout());

        return new Fabric8OrchestratorClient(client,
            config.getKubernetesRequestTimeout().plus(config.getKubernetesConnectTimeout()));
    }

    @Override
    public Mono<Lookup<OwnedObject>> readInstance(String name, String namespace) {
        return read("Pod", name, namespace,
            () -> client.pods().inNamespace(namespace).withName(name).get(),
            pod -> toOwnedObject("Pod", pod));
    }

    @Override
    public Mono<Lookup<OwnedObject>> readReplicaGroup(String name, String namespace) {
        return read("ReplicaSet", name, namespace,
            () -> client.apps().replicaSets().inNamespace(namespace).withName(name).get(),
            replicaSet -> toOwnedObject("ReplicaSet", replicaSet));
    }

    @Override
    public Mono<Lookup<WorkloadSnapshot>> readScalableResource(String name, String namespace) {
        return read("Deployment", name, namespace,
            () -> client.apps().deployments().inNamespace(namespace).withName(name).get(),
            Fabric8OrchestratorClient::toSnapshot);
    }

    @Override
    public Mono<PatchResult> patchMemoryLimit(WorkloadSnapshot target, String containerName, String memoryLimit) {
        String patch = memoryLimitPatch(target.getResourceVersion(), containerName, memoryLimit);
        return write("memory patch", target, () -> client.apps().deployments()
            .inNamespace(target.getNamespace())
            .withName(target.getName())
            .patch(PatchContext.of(PatchType.STRATEGIC_MERGE), patch));
    }

    @Override
    public Mono<PatchResult> patchReplicas(WorkloadSnapshot target, int replicas) {
        Scale scale = new ScaleBuilder()
            .withNewMetadata()
                .withName(target.getName())
                .withNamespace(target.getNamespace())
                .withResourceVersion(target.getResourceVersion())
            .endMetadata()
            .withNewSpec()
                .withReplicas(replicas)
            .endSpec()
            .build();

        return write("scale", target, () -> client.apps().deployments()
            .inNamespace(target.getNamespace())
            .withName(target.getName())
            .scale(scale));
    }

    @Override
    public void close() {
        client.close();
        log.info("Kubernetes client closed");
    }

    <R, T> Mono<Lookup<T>> read(String kind, String name, String namespace,
                                        Callable<R> call, Function<R, T> mapper) {
        return Mono.fromCallable(call)
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(callTimeout)
            .map(object -> Lookup.found(mapper.apply(object)))
            .defaultIfEmpty(Lookup.<T>absent())
            .onErrorResume(err -> {
                PatchResult.Status status = classify(err);
                if (status == PatchResult.Status.NOT_FOUND) {
                    return Mono.just(Lookup.<T>absent());
                }
                String detail = String.format("read of %s %s/%s failed: %s", kind, namespace, name, describe(err));
                log.debug("{}", detail, err);
                return Mono.just(Lookup.<T>unreadable(detail, status == PatchResult.Status.TRANSIENT));
            });
    }

    Mono<PatchResult> write(String operation, WorkloadSnapshot target, Callable<?> call) {
        return Mono.fromCallable(call)
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(callTimeout)
            .map(ignored -> PatchResult.applied())
            .defaultIfEmpty(PatchResult.applied())
            .onErrorResume(err -> {
                String detail = String.format("%s of Deployment %s/%s at resourceVersion %s failed: %s",
                    operation, target.getNamespace(), target.getName(), target.getResourceVersion(), describe(err));
                log.debug("{}", detail, err);
                return Mono.just(PatchResult.of(classify(err), detail));
            });
    }

    static PatchResult.Status classify(Throwable err) {
        if (err instanceof TimeoutException) {
            return PatchResult.Status.TRANSIENT;
        }
        if (err instanceof KubernetesClientException) {
            int code = ((KubernetesClientException) err).getCode();
            if (code <= 0) {
                // no HTTP response at all
                return PatchResult.Status.TRANSIENT;
            }
            if (code == 409) {
                return PatchResult.Status.CONFLICT;
            }
            if (code == 404) {
                return PatchResult.Status.NOT_FOUND;
            }
            if (code == 408 || code == 429 || code >= 500) {
                return PatchResult.Status.TRANSIENT;
            }
            return PatchResult.Status.REJECTED;
        }
        for (Throwable cause = err.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException || cause instanceof TimeoutException) {
                return PatchResult.Status.TRANSIENT;
            }
        }
        return PatchResult.Status.REJECTED;
    }

    static String memoryLimitPatch(String resourceVersion, String containerName, String memoryLimit) {
        ObjectNode patch = JsonUtils.mapper().createObjectNode();
        patch.putObject("metadata").put("resourceVersion", resourceVersion);
        ObjectNode container = patch.putObject("spec")
            .putObject("template")
            .putObject("spec")
            .putArray("containers")
            .addObject();
        container.put("name", containerName);
        container.putObject("resources").putObject("limits").put("memory", memoryLimit);
        return JsonUtils.writeValueAsString(patch);
    }

    static OwnedObject toOwnedObject(String kind, HasMetadata object) {
        ObjectMeta metadata = object.getMetadata();
        List<OwnerRef> owners = metadata.getOwnerReferences() == null
            ? null
            : metadata.getOwnerReferences().stream()
                .map(owner -> new OwnerRef(owner.getKind(), owner.getName()))
                .collect(Collectors.toList());
        return OwnedObject.of(kind, metadata.getName(), owners);
    }

    static WorkloadSnapshot toSnapshot(Deployment deployment) {
        WorkloadSnapshot.WorkloadSnapshotBuilder snapshot = WorkloadSnapshot.builder()
            .namespace(deployment.getMetadata().getNamespace())
            .name(deployment.getMetadata().getName())
            .resourceVersion(deployment.getMetadata().getResourceVersion());

        DeploymentSpec spec = deployment.getSpec();
        if (spec == null) {
            return snapshot.build();
        }
        snapshot.replicas(spec.getReplicas());

        if (spec.getTemplate() == null || spec.getTemplate().getSpec() == null
            || spec.getTemplate().getSpec().getContainers() == null
            || spec.getTemplate().getSpec().getContainers().isEmpty()) {
            return snapshot.build();
        }

        Container first = spec.getTemplate().getSpec().getContainers().get(0);
        snapshot.containerName(first.getName());

        ResourceRequirements resources = first.getResources();
        Map<String, Quantity> limits = resources != null ? resources.getLimits() : null;
        Quantity memory = limits != null ? limits.get("memory") : null;
        if (memory != null) {
            snapshot.memoryLimit(toQuantityString(memory));
        }
        return snapshot.build();
    }

    private static String toQuantityString(Quantity quantity) {
        String amount = quantity.getAmount() != null ? quantity.getAmount() : "";
        String format = quantity.getFormat() != null ? quantity.getFormat() : "";
        return amount + format;
    }

    private static String describe(Throwable err) {
        if (err instanceof KubernetesClientException && ((KubernetesClientException) err).getCode() > 0) {
            KubernetesClientException kce = (KubernetesClientException) err;
            return "HTTP " + kce.getCode() + " " + kce.getMessage();
        }
        if (err instanceof TimeoutException) {
            return "timed out";
        }
        return err.getClass().getSimpleName() + ": " + err.getMessage();
    }
}
