package com.selfheal.remediator.k8s;

import com.selfheal.core.model.OwnerRef;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * A pod or ReplicaSet as seen by the ownership resolver: its identity and owners.
 * <p>
 * An object may carry no owner list at all or an empty one. Both mean "not owned".
 * </p>
 */
@Value
public class OwnedObject {
    String kind;
    String name;
    Optional<List<OwnerRef>> ownerReferences;

    public static OwnedObject of(String kind, String name, List<OwnerRef> ownerReferences) {
        return new OwnedObject(kind, name,
            Optional.ofNullable(ownerReferences).map(List::copyOf));
    }

    /**
     * First owner of the given kind, in the order the API server lists them.
     */
    public Optional<OwnerRef> findOwner(String kind) {
        return ownerReferences.stream()
            .flatMap(List::stream)
            .filter(owner -> owner.isKind(kind))
            .findFirst();
    }

    public boolean hasOwners() {
        return ownerReferences.map(owners -> !owners.isEmpty()).orElse(false);
    }
}
