package com.tableops.backend.modules.access.presentation.dto;

import java.util.List;

import com.tableops.backend.modules.access.domain.AccessDecision;
import com.tableops.backend.modules.access.domain.Capability;
import com.tableops.backend.modules.access.domain.StaffRole;

public record AccessCheckResponse(StaffRole role, List<Capability> capabilities, AccessDecision decision) {
}
