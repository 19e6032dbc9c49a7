package com.selfheal.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of corrective actions a caller may request.
 * <p>
 * The caller supplies only the intent; the target values are always computed from
 * the current state of the resource.
 * </p>
 */
public enum RemediationAction {
    /**
     * Vertical remediation: raise the memory limit of the first container.
     */
    INCREMENT_MEMORY("increment_memory"),

    /**
     * Horizontal remediation: add replicas for availability.
     */
    SCALE_OUT("scale");

    private final String wireName;

    RemediationAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Looks up an action by the name used in inbound requests.
     *
     * @param wireName e.g. {@code increment_memory}
     * @return matching action, or empty for unknown or null names
     */
    public static Optional<RemediationAction> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(action -> action.wireName.equals(wireName))
            .findFirst();
    }
}
