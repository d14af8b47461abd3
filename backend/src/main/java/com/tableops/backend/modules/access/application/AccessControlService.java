package com.tableops.backend.modules.access.application;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.global.security.JwtAuthenticationPrincipal;
import com.tableops.backend.global.security.SecurityUtils;
import com.tableops.backend.modules.access.domain.AccessDecision;
import com.tableops.backend.modules.access.domain.Capability;
import com.tableops.backend.modules.access.domain.PermissionModel;
import com.tableops.backend.modules.access.domain.StaffRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Gate every endpoint passes through before doing any work.
 */
@Service
public class AccessControlService {

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    public AccessDecision checkAccess(StaffRole role, Collection<Capability> requiredCapabilities) {
        if (role == null || requiredCapabilities == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.invalid_argument",
                    "role and required capabilities must be provided");
        }
        return PermissionModel.hasAllCapabilities(role, requiredCapabilities)
                ? AccessDecision.ALLOW
                : AccessDecision.DENY;
    }

    public void requireCapabilities(StaffRole role, Capability... requiredCapabilities) {
        List<Capability> required = List.of(requiredCapabilities);
        if (checkAccess(role, required) == AccessDecision.DENY) {
            EnumSet<Capability> missing = EnumSet.noneOf(Capability.class);
            missing.addAll(required);
            missing.removeAll(PermissionModel.capabilitiesOf(role));
            log.info("access denied: role={} missing={}", role.getCode(), missing);
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden",
                    "Role " + role.getCode() + " lacks " + missing);
        }
    }

    /**
     * Checks the caller of the current request and returns its principal.
     */
    public JwtAuthenticationPrincipal requireCurrent(Capability... requiredCapabilities) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        requireCapabilities(principal.role(), requiredCapabilities);
        return principal;
    }
}
