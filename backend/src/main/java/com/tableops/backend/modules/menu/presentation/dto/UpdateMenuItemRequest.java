package com.tableops.backend.modules.menu.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import com.tableops.backend.modules.menu.domain.MenuCategory;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateMenuItemRequest(
        @Size(min = 1, max = 100, message = "name must be 1 to 100 characters")
        String name,

        @Size(min = 1, max = 500, message = "description must be 1 to 500 characters")
        String description,

        @DecimalMin(value = "0.00", message = "price must not be negative")
        @Digits(integer = 8, fraction = 2, message = "price must have at most 2 decimal places")
        BigDecimal price,

        MenuCategory category,

        Boolean available,

        @Min(value = 1, message = "prepTime must be at least 1 minute")
        Integer prepTime,

        List<@Size(min = 1, max = 50) String> allergens,

        @Pattern(regexp = "^https?://\\S+$", message = "imageUrl must be an http(s) URL")
        String imageUrl
) {
}
