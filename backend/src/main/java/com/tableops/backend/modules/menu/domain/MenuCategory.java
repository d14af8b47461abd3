package com.tableops.backend.modules.menu.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MenuCategory {
    APPETIZER("appetizer"),
    MAIN_COURSE("main_course"),
    DESSERT("dessert"),
    BEVERAGE("beverage"),
    SPECIAL("special");

    private final String code;

    MenuCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static MenuCategory fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("category must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MenuCategory category : values()) {
            if (category.code.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown menu category: " + value);
    }
}
