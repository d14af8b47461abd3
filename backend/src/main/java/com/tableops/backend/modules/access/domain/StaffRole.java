package com.tableops.backend.modules.access.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Job function of a staff account. Fixed for the lifetime of an access token.
 */
public enum StaffRole {
    OWNER("owner"),
    MANAGER("manager"),
    CHEF("chef"),
    WAITER("waiter");

    private final String code;

    StaffRole(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static StaffRole fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StaffRole role : values()) {
            if (role.code.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
