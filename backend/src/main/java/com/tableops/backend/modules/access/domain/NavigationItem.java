package com.tableops.backend.modules.access.domain;

import java.util.Set;

/**
 * Entry of the dashboard navigation. Shown only to roles that are both in {@code roles}
 * and hold {@code capability}.
 */
public record NavigationItem(String name, String href, String icon, Capability capability, Set<StaffRole> roles) {

    public NavigationItem {
        roles = Set.copyOf(roles);
    }
}
