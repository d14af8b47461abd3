package com.tableops.backend.modules.menu.infrastructure.persistence;

import java.util.Locale;

import com.tableops.backend.modules.menu.domain.MenuCategory;
import com.tableops.backend.modules.menu.domain.MenuItem;

import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

public final class MenuItemSpecifications {

    private MenuItemSpecifications() {
    }

    public static Specification<MenuItem> matching(MenuCategory category, Boolean available, String search) {
        Specification<MenuItem> spec = Specification.where(null);
        if (category != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("category"), category));
        }
        if (available != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("available"), available));
        }
        if (StringUtils.hasText(search)) {
            String pattern = "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";
            spec = spec.and((root, query, cb) -> cb.like(cb.lower(root.get("name")), pattern, '\\'));
        }
        return spec;
    }

    private static String escapeLike(String raw) {
        return raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
