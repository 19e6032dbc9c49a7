package com.selfheal.core.model;

import lombok.Value;

/**
 * One hop of an ownership chain: the kind and name of an owning object.
 */
@Value
public class OwnerRef {
    public static final String KIND_REPLICA_SET = "ReplicaSet";
    public static final String KIND_DEPLOYMENT = "Deployment";

    String kind;
    String name;

    public boolean isKind(String expected) {
        return expected.equals(kind);
    }

    @Override
    public String toString() {
        return kind + "/" + name;
    }
}
