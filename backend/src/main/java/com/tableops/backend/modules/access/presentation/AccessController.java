package com.tableops.backend.modules.access.presentation;

import java.util.List;

import com.tableops.backend.global.security.JwtAuthenticationPrincipal;
import com.tableops.backend.modules.access.application.AccessControlService;
import com.tableops.backend.modules.access.domain.AccessDecision;
import com.tableops.backend.modules.access.domain.PermissionModel;
import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.access.presentation.dto.AccessCheckRequest;
import com.tableops.backend.modules.access.presentation.dto.AccessCheckResponse;
import com.tableops.backend.modules.access.presentation.dto.AccessProfileResponse;
import com.tableops.backend.modules.access.presentation.dto.NavigationItemResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/access")
public class AccessController {

    private final AccessControlService accessControlService;

    public AccessController(AccessControlService accessControlService) {
        this.accessControlService = accessControlService;
    }

    @Operation(summary = "Capabilities, features and navigation of the caller's role")
    @GetMapping("/me")
    public ResponseEntity<AccessProfileResponse> me(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        StaffRole role = principal.role();
        List<NavigationItemResponse> navigation = PermissionModel.navigationItemsFor(role).stream()
                .map(NavigationItemResponse::from)
                .toList();
        return ResponseEntity.ok(new AccessProfileResponse(
                principal.userId(),
                role,
                PermissionModel.capabilitiesOf(role),
                PermissionModel.availableFeatures(role),
                navigation,
                PermissionModel.defaultRoute(role)
        ));
    }

    @Operation(summary = "Would the caller be allowed an action needing all of these capabilities")
    @PostMapping("/check")
    public ResponseEntity<AccessCheckResponse> check(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody AccessCheckRequest request
    ) {
        AccessDecision decision = accessControlService.checkAccess(principal.role(), request.capabilities());
        return ResponseEntity.ok(new AccessCheckResponse(principal.role(), request.capabilities(), decision));
    }
}
