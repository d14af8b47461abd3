package com.tableops.backend.modules.staff.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateStaffStatusRequest(@NotNull(message = "active is required") Boolean active) {
}
