package com.turdes.backend.modules.policy.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable set of permissions held by one principal over aid requests.
 */
public final class Ability {

    private final List<Permission> permissions;

    private Ability(List<Permission> permissions) {
        this.permissions = List.copyOf(permissions);
    }

    public static Ability of(Permission... permissions) {
        return new Ability(List.of(permissions));
    }

    public boolean can(Action action, Long ownerId) {
        return permissions.stream().anyMatch(permission -> permission.grants(action, ownerId));
    }

    /**
     * @param action  granted action; {@link Action#MANAGE} grants all of them
     * @param ownerId owner the permission is limited to, or {@code null} for any owner
     */
    public record Permission(Action action, Long ownerId) {

        public Permission {
            Objects.requireNonNull(action, "action");
        }

        public static Permission anyOwner(Action action) {
            return new Permission(action, null);
        }

        public static Permission ownedBy(Action action, Long ownerId) {
            return new Permission(action, Objects.requireNonNull(ownerId, "ownerId"));
        }

        boolean grants(Action requested, Long requestedOwnerId) {
            boolean actionMatches = action == Action.MANAGE || action == requested;
            boolean ownerMatches = ownerId == null || ownerId.equals(requestedOwnerId);
            return actionMatches && ownerMatches;
        }
    }
}
