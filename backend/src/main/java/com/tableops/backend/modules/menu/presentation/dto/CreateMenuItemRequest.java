package com.tableops.backend.modules.menu.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import com.tableops.backend.modules.menu.domain.MenuCategory;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateMenuItemRequest(
        @NotBlank(message = "name is required")
        @Size(max = 100, message = "name must be at most 100 characters")
        String name,

        @NotBlank(message = "description is required")
        @Size(max = 500, message = "description must be at most 500 characters")
        String description,

        @NotNull(message = "price is required")
        @DecimalMin(value = "0.00", message = "price must not be negative")
        @Digits(integer = 8, fraction = 2, message = "price must have at most 2 decimal places")
        BigDecimal price,

        @NotNull(message = "category is required")
        MenuCategory category,

        Boolean available,

        @NotNull(message = "prepTime is required")
        @Min(value = 1, message = "prepTime must be at least 1 minute")
        Integer prepTime,

        List<@NotBlank @Size(max = 50) String> allergens,

        @Pattern(regexp = "^https?://\\S+$", message = "imageUrl must be an http(s) URL")
        String imageUrl
) {
}
