package com.tableops.backend.modules.access.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named functional area. A role may use a feature when it holds any one of the listed capabilities.
 */
public enum Feature {
    DASHBOARD("dashboard", Capability.VIEW_ORDERS, Capability.VIEW_REPORTS),
    ORDERS("orders", Capability.VIEW_ORDERS),
    ORDER_MANAGEMENT("orderManagement", Capability.UPDATE_ORDER_STATUS),
    MENU("menu", Capability.VIEW_ORDERS),
    MENU_MANAGEMENT("menuManagement", Capability.MANAGE_MENU),
    STAFF("staff", Capability.MANAGE_STAFF),
    REPORTS("reports", Capability.VIEW_REPORTS),
    PAYMENTS("payments", Capability.PROCESS_PAYMENTS),
    CUSTOMERS("customers", Capability.VIEW_CUSTOMER_DATA);

    private final String code;
    private final Set<Capability> requiredCapabilities;

    Feature(String code, Capability first, Capability... rest) {
        this.code = code;
        this.requiredCapabilities = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Set<Capability> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public static Optional<Feature> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (Feature feature : values()) {
            if (feature.code.equals(code)) {
                return Optional.of(feature);
            }
        }
        return Optional.empty();
    }
}
