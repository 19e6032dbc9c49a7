package com.selfheal.remediator.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the remediator, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class RemediatorConfig {

    String nodeId;
    int httpPort;

    // Shared secret expected as "Authorization: Bearer <apiToken>"
    String apiToken;
    String defaultNamespace;

    // Retry parameters for conflicting or failed writes
    int maxAttempts;
    Duration retryBase;
    Duration retryMax;
    Duration retryJitter;

    // Kubernetes API client bounds
    Duration kubernetesRequestTimeout;
    Duration kubernetesConnectTimeout;

    public static RemediatorConfig fromEnv() {
        return RemediatorConfig.builder()
            .nodeId(getEnv("NODE_ID", "remediator-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8000")))
            .apiToken(getEnv("API_TOKEN", "TOKEN"))
            .defaultNamespace(getEnv("DEFAULT_NAMESPACE", "default"))
            .maxAttempts(Integer.parseInt(getEnv("MAX_ATTEMPTS", "3")))
            .retryBase(Duration.ofMillis(Long.parseLong(getEnv("RETRY_BASE_MS", "200"))))
            .retryMax(Duration.ofMillis(Long.parseLong(getEnv("RETRY_MAX_MS", "2000"))))
            .retryJitter(Duration.ofMillis(Long.parseLong(getEnv("RETRY_JITTER_MS", "100"))))
            .kubernetesRequestTimeout(Duration.ofMillis(Long.parseLong(getEnv("K8S_REQUEST_TIMEOUT_MS", "10000"))))
            .kubernetesConnectTimeout(Duration.ofMillis(Long.parseLong(getEnv("K8S_CONNECT_TIMEOUT_MS", "5000"))))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
