package com.tableops.backend.modules.access.presentation.dto;

import java.util.List;

import com.tableops.backend.modules.access.domain.Capability;

import jakarta.validation.constraints.NotNull;

public record AccessCheckRequest(
        @NotNull(message = "capabilities is required") List<@NotNull Capability> capabilities
) {
}
