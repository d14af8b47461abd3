package com.tableops.backend.modules.auth.infrastructure.persistence;

import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.auth.domain.StaffAccount;

import org.springframework.data.jpa.domain.Specification;

public final class StaffAccountSpecifications {

    private StaffAccountSpecifications() {
    }

    public static Specification<StaffAccount> matching(StaffRole role, Boolean active) {
        Specification<StaffAccount> spec = Specification.where(null);
        if (role != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("role"), role));
        }
        if (active != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("active"), active));
        }
        return spec;
    }
}
