package com.selfheal.remediator;

import com.selfheal.core.policy.RemediationPolicy;
import com.selfheal.remediator.config.RemediatorConfig;
import com.selfheal.remediator.engine.BearerTokenAuthenticator;
import com.selfheal.remediator.engine.MutationApplier;
import com.selfheal.remediator.engine.RemediationDispatcher;
import com.selfheal.remediator.http.HttpServer;
import com.selfheal.remediator.k8s.Fabric8OrchestratorClient;
import com.selfheal.remediator.k8s.IOrchestratorClient;
import com.selfheal.remediator.k8s.OwnershipResolver;
import com.selfheal.remediator.metrics.PrometheusMetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

public class RemediatorApp {
    private static final Logger log = LoggerFactory.getLogger(RemediatorApp.class);

    public static void main(String[] args) {
        RemediatorConfig config = RemediatorConfig.fromEnv();

        log.info("Starting Remediator");
        log.info("  HTTP port: {}", config.getHttpPort());
        log.info("  Default namespace: {}", config.getDefaultNamespace());
        log.info("  Max attempts: {}", config.getMaxAttempts());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MeterRegistry registry = metricsExporter.getRegistry();

        IOrchestratorClient orchestratorClient = Fabric8OrchestratorClient.fromConfig(config);

        RemediationDispatcher dispatcher = new RemediationDispatcher(
            new BearerTokenAuthenticator(config.getApiToken()),
            new OwnershipResolver(orchestratorClient, registry),
            new MutationApplier(orchestratorClient, new RemediationPolicy(), config, registry),
            config.getDefaultNamespace(),
            registry
        );

        HttpServer httpServer = new HttpServer(config, dispatcher, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        log.info("Remediator is ready");

        handleShutDown(httpServer, orchestratorClient);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(HttpServer httpServer, IOrchestratorClient orchestratorClient) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            httpServer.stop();

            orchestratorClient.close();

            log.info("Shutdown complete");
        }));
    }
}
