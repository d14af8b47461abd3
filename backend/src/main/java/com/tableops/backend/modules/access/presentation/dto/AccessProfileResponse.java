package com.tableops.backend.modules.access.presentation.dto;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.tableops.backend.modules.access.domain.Capability;
import com.tableops.backend.modules.access.domain.Feature;
import com.tableops.backend.modules.access.domain.StaffRole;

public record AccessProfileResponse(
        UUID userId,
        StaffRole role,
        Set<Capability> capabilities,
        List<Feature> features,
        List<NavigationItemResponse> navigation,
        String defaultRoute
) {
}
