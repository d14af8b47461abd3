package com.tableops.backend.modules.order.infrastructure.persistence;

import com.tableops.backend.modules.order.domain.OrderStatus;
import com.tableops.backend.modules.order.domain.TableOrder;

import org.springframework.data.jpa.domain.Specification;

public final class TableOrderSpecifications {

    private TableOrderSpecifications() {
    }

    public static Specification<TableOrder> matching(OrderStatus status, Integer tableNumber) {
        Specification<TableOrder> spec = Specification.where(null);
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        if (tableNumber != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("tableNumber"), tableNumber));
        }
        return spec;
    }
}
