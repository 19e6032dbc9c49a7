package com.selfheal.remediator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Response body of {@code /manage}. Successful calls carry {@code message}; failed ones carry
 * {@code detail}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ManageResponse {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    @JsonProperty("status")
    String status;

    @JsonProperty("message")
    String message;

    @JsonProperty("detail")
    String detail;

    public static ManageResponse success(String message) {
        return new ManageResponse(STATUS_SUCCESS, message, null);
    }

    public static ManageResponse error(String detail) {
        return new ManageResponse(STATUS_ERROR, null, detail);
    }
}
