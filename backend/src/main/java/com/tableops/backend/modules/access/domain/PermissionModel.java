package com.tableops.backend.modules.access.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Role based access rules of the restaurant staff.
 *
 * <p>{@link #ROLE_CAPABILITIES} is the only role to capability table. Endpoint authorization,
 * feature gating and navigation filtering are all derived from it. Every table here is built
 * once at class initialization and never mutated.
 *
 * <p>A {@code null} role, capability or collection is rejected with {@link IllegalArgumentException};
 * unknown feature names are not an error and simply yield {@code false}.
 */
public final class PermissionModel {

    private static final Map<StaffRole, Set<Capability>> ROLE_CAPABILITIES;
    private static final Map<StaffRole, Set<StaffRole>> MANAGEABLE_ROLES;
    private static final List<NavigationItem> NAVIGATION;

    static {
        EnumMap<StaffRole, Set<Capability>> capabilities = new EnumMap<>(StaffRole.class);
        capabilities.put(StaffRole.OWNER, immutable(EnumSet.allOf(Capability.class)));
        capabilities.put(StaffRole.MANAGER, immutable(EnumSet.of(
                Capability.VIEW_ORDERS,
                Capability.UPDATE_ORDER_STATUS,
                Capability.VIEW_REPORTS,
                Capability.PROCESS_PAYMENTS,
                Capability.VIEW_CUSTOMER_DATA
        )));
        capabilities.put(StaffRole.CHEF, immutable(EnumSet.of(
                Capability.VIEW_ORDERS,
                Capability.UPDATE_ORDER_STATUS
        )));
        capabilities.put(StaffRole.WAITER, immutable(EnumSet.of(
                Capability.VIEW_ORDERS,
                Capability.UPDATE_ORDER_STATUS,
                Capability.VIEW_CUSTOMER_DATA
        )));
        ROLE_CAPABILITIES = Collections.unmodifiableMap(capabilities);

        EnumMap<StaffRole, Set<StaffRole>> hierarchy = new EnumMap<>(StaffRole.class);
        hierarchy.put(StaffRole.OWNER, immutable(EnumSet.allOf(StaffRole.class)));
        hierarchy.put(StaffRole.MANAGER, immutable(EnumSet.of(StaffRole.CHEF, StaffRole.WAITER)));
        hierarchy.put(StaffRole.CHEF, immutable(EnumSet.noneOf(StaffRole.class)));
        hierarchy.put(StaffRole.WAITER, immutable(EnumSet.noneOf(StaffRole.class)));
        MANAGEABLE_ROLES = Collections.unmodifiableMap(hierarchy);

        NAVIGATION = List.of(
                new NavigationItem("Dashboard", "/dashboard", "📊", Capability.VIEW_ORDERS,
                        EnumSet.allOf(StaffRole.class)),
                new NavigationItem("Kitchen", "/kitchen", "👨‍🍳", Capability.UPDATE_ORDER_STATUS,
                        EnumSet.of(StaffRole.CHEF, StaffRole.WAITER, StaffRole.MANAGER)),
                new NavigationItem("Orders", "/orders", "📋", Capability.VIEW_ORDERS,
                        EnumSet.allOf(StaffRole.class)),
                new NavigationItem("Menu", "/menu", "🍽️", Capability.MANAGE_MENU,
                        EnumSet.of(StaffRole.OWNER, StaffRole.MANAGER)),
                new NavigationItem("Staff", "/staff", "👥", Capability.MANAGE_STAFF,
                        EnumSet.of(StaffRole.OWNER)),
                new NavigationItem("Reports", "/reports", "📈", Capability.VIEW_REPORTS,
                        EnumSet.of(StaffRole.OWNER, StaffRole.MANAGER)),
                new NavigationItem("Payments", "/payments", "💰", Capability.PROCESS_PAYMENTS,
                        EnumSet.of(StaffRole.OWNER, StaffRole.MANAGER))
        );
    }

    private PermissionModel() {
    }

    public static Set<Capability> capabilitiesOf(StaffRole role) {
        requireRole(role);
        return ROLE_CAPABILITIES.get(role);
    }

    public static boolean hasCapability(StaffRole role, Capability capability) {
        if (capability == null) {
            throw new IllegalArgumentException("capability must not be null");
        }
        return capabilitiesOf(role).contains(capability);
    }

    /**
     * @return {@code false} for an empty collection
     */
    public static boolean hasAnyCapability(StaffRole role, Collection<Capability> capabilities) {
        Set<Capability> held = capabilitiesOf(role);
        for (Capability capability : requireCapabilities(capabilities)) {
            if (held.contains(capability)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} for an empty collection
     */
    public static boolean hasAllCapabilities(StaffRole role, Collection<Capability> capabilities) {
        Set<Capability> held = capabilitiesOf(role);
        for (Capability capability : requireCapabilities(capabilities)) {
            if (!held.contains(capability)) {
                return false;
            }
        }
        return true;
    }

    public static boolean canAccessFeature(StaffRole role, String featureName) {
        requireRole(role);
        return Feature.fromCode(featureName)
                .map(feature -> canAccessFeature(role, feature))
                .orElse(false);
    }

    public static boolean canAccessFeature(StaffRole role, Feature feature) {
        return hasAnyCapability(role, feature.getRequiredCapabilities());
    }

    public static List<Feature> availableFeatures(StaffRole role) {
        requireRole(role);
        return Arrays.stream(Feature.values())
                .filter(feature -> canAccessFeature(role, feature))
                .toList();
    }

    public static List<NavigationItem> navigationItemsFor(StaffRole role) {
        requireRole(role);
        return NAVIGATION.stream()
                .filter(item -> item.roles().contains(role) && hasCapability(role, item.capability()))
                .toList();
    }

    public static boolean canAccessRoute(StaffRole role, String route) {
        if (route == null) {
            return false;
        }
        return navigationItemsFor(role).stream().anyMatch(item -> route.startsWith(item.href()));
    }

    public static String defaultRoute(StaffRole role) {
        requireRole(role);
        return switch (role) {
            case CHEF, WAITER -> "/kitchen";
            case OWNER, MANAGER -> "/dashboard";
        };
    }

    public static boolean canManage(StaffRole actingRole, StaffRole targetRole) {
        requireRole(actingRole);
        requireRole(targetRole);
        return MANAGEABLE_ROLES.get(actingRole).contains(targetRole);
    }

    public static <T> List<T> filterByCapability(List<T> items, StaffRole role, Capability capability) {
        return hasCapability(role, capability) ? items : List.of();
    }

    private static void requireRole(StaffRole role) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    private static Collection<Capability> requireCapabilities(Collection<Capability> capabilities) {
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities must not be null");
        }
        return capabilities;
    }

    private static <E extends Enum<E>> Set<E> immutable(EnumSet<E> set) {
        return Collections.unmodifiableSet(set);
    }
}
