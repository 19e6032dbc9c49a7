package com.selfheal.remediator.engine;

import com.selfheal.core.util.JsonUtils;
import com.selfheal.remediator.api.ManageResponse;
import lombok.Value;

/**
 * HTTP status and body produced for one request, independent of the server that sends it.
 */
@Value
public class DispatchResponse {
    int httpStatus;
    ManageResponse body;

    public static DispatchResponse ok(String message) {
        return new DispatchResponse(200, ManageResponse.success(message));
    }

    public static DispatchResponse error(int httpStatus, String detail) {
        return new DispatchResponse(httpStatus, ManageResponse.error(detail));
    }

    public String toJson() {
        return JsonUtils.writeValueAsString(body);
    }
}
