package com.tableops.backend.modules.access.presentation.dto;

import com.tableops.backend.modules.access.domain.NavigationItem;

public record NavigationItemResponse(String name, String href, String icon) {

    public static NavigationItemResponse from(NavigationItem item) {
        return new NavigationItemResponse(item.name(), item.href(), item.icon());
    }
}
