package com.tableops.backend.modules.staff.presentation.dto;

import com.tableops.backend.modules.access.domain.StaffRole;

import jakarta.validation.constraints.NotNull;

public record ChangeStaffRoleRequest(@NotNull(message = "role is required") StaffRole role) {
}
