package com.selfheal.remediator.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Body of {@code POST /manage} as sent by the alerting pipeline.
 * <p>
 * Values are kept as received; {@code action} is validated against the known actions by
 * the dispatcher so that an unknown one can be reported by name.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ManageRequest {
    /**
     * {@code increment_memory} or {@code scale}.
     */
    @JsonProperty("action")
    String action;

    /**
     * Pod or Deployment name.
     */
    @JsonProperty("target")
    String target;

    /**
     * Optional; the configured default namespace applies when absent or blank.
     */
    @JsonProperty("namespace")
    String namespace;

    @JsonCreator
    public ManageRequest(
        @JsonProperty("action") String action,
        @JsonProperty("target") String target,
        @JsonProperty("namespace") String namespace
    ) {
        this.action = action;
        this.target = target;
        this.namespace = namespace;
    }
}
