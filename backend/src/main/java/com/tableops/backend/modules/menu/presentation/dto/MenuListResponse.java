package com.tableops.backend.modules.menu.presentation.dto;

import java.util.List;

public record MenuListResponse(List<MenuItemResponse> items, int count) {

    public static MenuListResponse of(List<MenuItemResponse> items) {
        return new MenuListResponse(items, items.size());
    }
}
