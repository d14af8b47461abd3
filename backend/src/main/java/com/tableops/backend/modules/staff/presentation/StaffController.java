package com.tableops.backend.modules.staff.presentation;

import java.util.UUID;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.tableops.backend.modules.staff.application.StaffService;
import com.tableops.backend.modules.staff.presentation.dto.ChangeStaffRoleRequest;
import com.tableops.backend.modules.staff.presentation.dto.CreateStaffRequest;
import com.tableops.backend.modules.staff.presentation.dto.StaffListResponse;
import com.tableops.backend.modules.staff.presentation.dto.UpdateStaffStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/staff")
public class StaffController {

    private final StaffService staffService;

    public StaffController(StaffService staffService) {
        this.staffService = staffService;
    }

    @Operation(summary = "List staff accounts", description = "Requires MANAGE_STAFF.")
    @GetMapping
    public ResponseEntity<StaffListResponse> listStaff(
            @RequestParam(name = "role", required = false) String role,
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "20") int limit
    ) {
        return ResponseEntity.ok(staffService.listStaff(parseRole(role), active, page, limit));
    }

    @GetMapping("/{staffId}")
    public ResponseEntity<UserProfileResponse> getStaff(@PathVariable("staffId") UUID staffId) {
        return ResponseEntity.ok(staffService.getStaff(staffId));
    }

    @Operation(summary = "Create a staff account", description = "The caller must be able to manage the new role.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "403", description = "MANAGE_STAFF required or role out of reach"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PostMapping
    public ResponseEntity<UserProfileResponse> createStaff(@Valid @RequestBody CreateStaffRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(staffService.createStaff(request));
    }

    @Operation(summary = "Activate or deactivate a staff account")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "403", description = "Target role out of reach"),
            @ApiResponse(responseCode = "404", description = "No such account"),
            @ApiResponse(responseCode = "409", description = "Cannot deactivate yourself")
    })
    @PatchMapping("/{staffId}/status")
    public ResponseEntity<UserProfileResponse> updateStatus(
            @PathVariable("staffId") UUID staffId,
            @Valid @RequestBody UpdateStaffStatusRequest request
    ) {
        return ResponseEntity.ok(staffService.updateStatus(staffId, request.active()));
    }

    @Operation(summary = "Change a staff member's role")
    @PatchMapping("/{staffId}/role")
    public ResponseEntity<UserProfileResponse> changeRole(
            @PathVariable("staffId") UUID staffId,
            @Valid @RequestBody ChangeStaffRoleRequest request
    ) {
        return ResponseEntity.ok(staffService.changeRole(staffId, request.role()));
    }

    private StaffRole parseRole(String role) {
        if (role == null || role.isBlank()) {
            return null;
        }
        try {
            return StaffRole.fromCode(role);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "staff.invalid_role", ex.getMessage());
        }
    }
}
