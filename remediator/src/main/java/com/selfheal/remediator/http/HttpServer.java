package com.selfheal.remediator.http;

import com.selfheal.remediator.config.RemediatorConfig;
import com.selfheal.remediator.engine.DispatchResponse;
import com.selfheal.remediator.engine.RemediationDispatcher;
import com.selfheal.remediator.metrics.PrometheusMetricsExporter;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for the remediation endpoint, health check and metrics.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final RemediatorConfig config;
    private final RemediationDispatcher dispatcher;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(RemediatorConfig config, RemediationDispatcher dispatcher,
                      PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .metrics(true, Function.identity())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Liveness
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Prometheus scrape
            .get("/metrics", (req, res) ->
                res.header(HttpHeaderNames.CONTENT_TYPE, PrometheusMetricsExporter.CONTENT_TYPE)
                    .sendString(Mono.just(metricsExporter.scrape()))
            )
            // Remediation
            .post("/manage", this::manage);
    }

    private Mono<Void> manage(HttpServerRequest req, HttpServerResponse res) {
        String authorization = req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION);

        return req.receive().aggregate().asString()
            .defaultIfEmpty("")
            .flatMap(body -> dispatcher.handle(authorization, body))
            .onErrorResume(err -> {
                log.error("Failed to handle /manage request", err);
                return Mono.just(DispatchResponse.error(500, "Internal error: " + err.getMessage()));
            })
            .flatMap(response -> send(res, response));
    }

    private static Mono<Void> send(HttpServerResponse res, DispatchResponse response) {
        return res.status(HttpResponseStatus.valueOf(response.getHttpStatus()))
            .header(HttpHeaderNames.CONTENT_TYPE, "application/json")
            .sendString(Mono.just(response.toJson()))
            .then();
    }
}
