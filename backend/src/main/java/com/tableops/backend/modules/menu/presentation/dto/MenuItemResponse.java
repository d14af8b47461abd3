package com.tableops.backend.modules.menu.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.tableops.backend.modules.menu.domain.MenuCategory;
import com.tableops.backend.modules.menu.domain.MenuItem;

public record MenuItemResponse(
        UUID id,
        String name,
        String description,
        BigDecimal price,
        MenuCategory category,
        boolean available,
        int prepTime,
        List<String> allergens,
        String imageUrl,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static MenuItemResponse from(MenuItem item) {
        return new MenuItemResponse(
                item.getId(),
                item.getName(),
                item.getDescription(),
                item.getPrice(),
                item.getCategory(),
                item.isAvailable(),
                item.getPreparationMinutes(),
                List.copyOf(item.getAllergens()),
                item.getImageUrl(),
                item.getCreatedAt(),
                item.getUpdatedAt()
        );
    }
}
