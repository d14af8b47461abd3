package com.tableops.backend.global.security;

import java.util.UUID;

import com.tableops.backend.modules.access.domain.StaffRole;

public record JwtAuthenticationPrincipal(UUID userId, String email, StaffRole role) {
}
