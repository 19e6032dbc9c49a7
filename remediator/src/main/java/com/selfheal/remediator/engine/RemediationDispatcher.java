package com.selfheal.remediator.engine;

import com.selfheal.core.metrics.MetricsNames;
import com.selfheal.core.metrics.MetricsTags;
import com.selfheal.core.model.RemediationAction;
import com.selfheal.core.model.RemediationOutcome;
import com.selfheal.core.model.RemediationRequest;
import com.selfheal.core.util.JsonUtils;
import com.selfheal.remediator.api.ManageRequest;
import com.selfheal.remediator.k8s.OwnershipResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Entry point for one remediation request: authenticate, validate, resolve, apply, respond.
 * <p>
 * Authentication happens before anything else; an unauthenticated request never reaches
 * the Kubernetes API. Every response is either a success naming the Deployment with its
 * before and after values, or an error carrying resource, namespace and cause.
 * </p>
 */
public class RemediationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RemediationDispatcher.class);

    private static final String EXPECTED_ACTIONS = Arrays.stream(RemediationAction.values())
        .map(RemediationAction::wireName)
        .collect(Collectors.joining(", "));

    private final BearerTokenAuthenticator authenticator;
    private final OwnershipResolver resolver;
    private final MutationApplier applier;
    private final String defaultNamespace;
    private final MeterRegistry meterRegistry;

    public RemediationDispatcher(BearerTokenAuthenticator authenticator, OwnershipResolver resolver,
                                 MutationApplier applier, String defaultNamespace, MeterRegistry meterRegistry) {
        this.authenticator = authenticator;
        this.resolver = resolver;
        this.applier = applier;
        this.defaultNamespace = defaultNamespace;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Handles a raw {@code /manage} call.
     *
     * @param authorization value of the Authorization header, may be null
     * @param body          request body, may be null or empty
     * @return response to send; never an error signal
     */
    public Mono<DispatchResponse> handle(String authorization, String body) {
        if (!authenticator.authenticate(authorization)) {
            log.warn("Rejected remediation request with invalid credentials");
            count("none", "unauthorized");
            return Mono.just(DispatchResponse.error(401, "Unauthorized"));
        }

        RemediationRequest request;
        try {
            request = parse(body);
        } catch (InvalidRequestException e) {
            log.warn("Rejected remediation request: {}", e.getMessage());
            count("none", "invalid");
            return Mono.just(DispatchResponse.error(400, e.getMessage()));
        }

        return remediate(request);
    }

    /**
     * Runs an already authenticated and validated request.
     */
    public Mono<DispatchResponse> remediate(RemediationRequest request) {
        String action = request.getAction().wireName();
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Remediation requested: {} on {}/{}", action, request.getNamespace(), request.getTarget());

        return resolver.resolve(request.getTarget(), request.getNamespace())
            .flatMap(resolution -> applier.apply(resolution.getCanonicalName(), request.getNamespace(), request.getAction()))
            .map(this::toResponse)
            .onErrorResume(err -> {
                log.error("Remediation {} on {}/{} failed unexpectedly", action, request.getNamespace(), request.getTarget(), err);
                return Mono.just(DispatchResponse.error(500, String.format("Remediation '%s' of %s in namespace %s failed: %s",
                    action, request.getTarget(), request.getNamespace(), err.getMessage())));
            })
            .doOnNext(response -> {
                sample.stop(meterRegistry.timer(MetricsNames.REMEDIATION_LATENCY, MetricsTags.ACTION, action));
                count(action, response.getHttpStatus() == 200 ? "success" : "failure");
            });
    }

    RemediationRequest parse(String body) throws InvalidRequestException {
        if (body == null || body.isBlank()) {
            throw new InvalidRequestException("Request body is required");
        }

        ManageRequest raw;
        try {
            raw = JsonUtils.readValue(body, ManageRequest.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Request body is not valid JSON", e);
        }
        if (raw == null) {
            throw new InvalidRequestException("Request body is required");
        }

        String requestedAction = raw.getAction();
        RemediationAction action = RemediationAction.fromWire(requestedAction)
            .orElseThrow(() -> new InvalidRequestException(
                String.format("Unsupported action '%s', expected one of: %s", requestedAction, EXPECTED_ACTIONS)));

        if (raw.getTarget() == null || raw.getTarget().isBlank()) {
            throw new InvalidRequestException("Field 'target' is required");
        }

        String namespace = raw.getNamespace() == null || raw.getNamespace().isBlank()
            ? defaultNamespace
            : raw.getNamespace().trim();

        return RemediationRequest.builder()
            .action(action)
            .target(raw.getTarget().trim())
            .namespace(namespace)
            .build();
    }

    private DispatchResponse toResponse(RemediationOutcome outcome) {
        if (!outcome.isSuccess()) {
            return DispatchResponse.error(500, String.format("Remediation '%s' of Deployment %s/%s failed [%s]: %s",
                outcome.getAction().wireName(), outcome.getNamespace(), outcome.getResourceName(),
                outcome.getFailureKind(), outcome.getErrorDetail()));
        }

        if (outcome.getAction() == RemediationAction.INCREMENT_MEMORY) {
            return DispatchResponse.ok(String.format("Vertical scaling: %s memory limit %s → %s (namespace %s).",
                outcome.getResourceName(), outcome.getPreviousValue(), outcome.getNewValue(), outcome.getNamespace()));
        }
        return DispatchResponse.ok(String.format("Horizontal scaling: %s scaled from %s → %s replicas (namespace %s).",
            outcome.getResourceName(), outcome.getPreviousValue(), outcome.getNewValue(), outcome.getNamespace()));
    }

    private void count(String action, String status) {
        meterRegistry.counter(MetricsNames.REMEDIATION_REQUESTS_TOTAL,
            MetricsTags.ACTION, action, MetricsTags.STATUS, status).increment();
    }
}
