package com.guildhub.core.permission;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes effective channel permissions from a member's roles and the channel's overrides.
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 *   <li>Base = OR of the permission masks of every role the member holds in the server.</li>
 *   <li>If base carries {@link Permissions#ADMINISTRATOR}, the result is {@link Permissions#ALL};
 *       overrides are never consulted.</li>
 *   <li>Overrides for the member's roles are folded in ascending role position
 *       ({@code perm = (perm & ~deny) | allow}), so the most senior role's override wins on a
 *       contested bit. Roles sharing a position are ordered by role id.</li>
 *   <li>Only {@link Permissions#CHANNEL_OVERRIDABLE} bits take part in the fold; server-wide bits
 *       pass through from base.</li>
 * </ol>
 * </p>
 * <p>
 * Stateless and side-effect free. Results are never cached: callers resolve from source data on
 * every check.
 * </p>
 */
public final class PermissionResolver {
    private PermissionResolver() {
    }

    private static final Comparator<Map.Entry<Role, ChannelOverride>> FOLD_ORDER =
        Comparator.<Map.Entry<Role, ChannelOverride>>comparingInt(e -> e.getKey().getPosition())
            .thenComparing(e -> e.getKey().getId());

    /**
     * Resolves the effective permissions of one member on one channel.
     *
     * @param roles     roles the member holds in the channel's server
     * @param overrides overrides defined on the channel (any role; foreign roles are ignored)
     * @return effective permission mask
     */
    public static long resolve(Collection<Role> roles, Collection<ChannelOverride> overrides) {
        long base = basePermissions(roles);
        if ((base & Permissions.ADMINISTRATOR) != 0) {
            return Permissions.ALL;
        }
        return applyOverrides(base, roles, overrides);
    }

    /**
     * OR of all role masks.
     */
    public static long basePermissions(Collection<Role> roles) {
        long base = 0L;
        for (Role role : roles) {
            base |= role.getPermissions();
        }
        return base;
    }

    /**
     * Builds the sidebar visibility filter for a member in one server.
     *
     * @param roles     roles the member holds in the server
     * @param overrides overrides of the member's roles across every channel of the server
     * @return visibility filter
     */
    public static ChannelVisibilityFilter visibility(Collection<Role> roles,
                                                     Collection<ChannelOverride> overrides) {
        long base = basePermissions(roles);
        if ((base & Permissions.ADMINISTRATOR) != 0) {
            return ChannelVisibilityFilter.builder()
                .admin(true)
                .baseView(true)
                .hiddenChannels(Set.of())
                .grantedChannels(Set.of())
                .build();
        }

        boolean baseView = (base & Permissions.VIEW_CHANNEL) != 0;
        Map<String, List<ChannelOverride>> byChannel = overrides.stream()
            .collect(Collectors.groupingBy(ChannelOverride::getChannelId, LinkedHashMap::new, Collectors.toList()));

        Set<String> hidden = new HashSet<>();
        Set<String> granted = new HashSet<>();
        byChannel.forEach((channelId, channelOverrides) -> {
            boolean view = (applyOverrides(base, roles, channelOverrides) & Permissions.VIEW_CHANNEL) != 0;
            if (baseView && !view) {
                hidden.add(channelId);
            } else if (!baseView && view) {
                granted.add(channelId);
            }
        });

        return ChannelVisibilityFilter.builder()
            .admin(false)
            .baseView(baseView)
            .hiddenChannels(Set.copyOf(hidden))
            .grantedChannels(Set.copyOf(granted))
            .build();
    }

    private static long applyOverrides(long base, Collection<Role> roles, Collection<ChannelOverride> overrides) {
        if (overrides.isEmpty()) {
            return base;
        }

        Map<String, Role> rolesById = new HashMap<>();
        for (Role role : roles) {
            rolesById.put(role.getId(), role);
        }

        List<Map.Entry<Role, ChannelOverride>> applicable = overrides.stream()
            .filter(o -> rolesById.containsKey(o.getRoleId()))
            .map(o -> Map.entry(rolesById.get(o.getRoleId()), o))
            .sorted(FOLD_ORDER)
            .collect(Collectors.toList());

        long channelBits = base & Permissions.CHANNEL_OVERRIDABLE;
        for (Map.Entry<Role, ChannelOverride> entry : applicable) {
            ChannelOverride override = entry.getValue();
            channelBits = (channelBits & ~override.getDeny()) | override.getAllow();
        }

        return (base & ~Permissions.CHANNEL_OVERRIDABLE) | (channelBits & Permissions.CHANNEL_OVERRIDABLE);
    }
}
