package com.tableops.backend.modules.staff.presentation.dto;

import java.util.List;

import com.tableops.backend.modules.auth.presentation.dto.UserProfileResponse;

public record StaffListResponse(
        List<UserProfileResponse> items,
        int page,
        int limit,
        long totalElements,
        int totalPages
) {
}
