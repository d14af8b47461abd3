package com.tableops.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.tableops.backend.modules.access.domain.Capability;
import com.tableops.backend.modules.access.domain.PermissionModel;
import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.auth.domain.StaffAccount;

public record UserProfileResponse(
        UUID userId,
        String name,
        String email,
        StaffRole role,
        Set<Capability> capabilities,
        boolean active,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(StaffAccount account) {
        return new UserProfileResponse(
                account.getId(),
                account.getName(),
                account.getEmail(),
                account.getRole(),
                PermissionModel.capabilitiesOf(account.getRole()),
                account.isActive(),
                account.getLastLoginAt(),
                account.getCreatedAt(),
                account.getUpdatedAt()
        );
    }
}
