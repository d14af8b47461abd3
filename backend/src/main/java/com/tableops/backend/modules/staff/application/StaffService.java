package com.tableops.backend.modules.staff.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.global.security.JwtAuthenticationPrincipal;
import com.tableops.backend.modules.access.application.AccessControlService;
import com.tableops.backend.modules.access.domain.Capability;
import com.tableops.backend.modules.access.domain.PermissionModel;
import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.auth.application.AuthService;
import com.tableops.backend.modules.auth.domain.StaffAccount;
import com.tableops.backend.modules.auth.infrastructure.persistence.StaffAccountRepository;
import com.tableops.backend.modules.auth.infrastructure.persistence.StaffAccountSpecifications;
import com.tableops.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.tableops.backend.modules.staff.presentation.dto.CreateStaffRequest;
import com.tableops.backend.modules.staff.presentation.dto.StaffListResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Staff administration. Every mutation needs {@code MANAGE_STAFF} and, on top of that, the role
 * hierarchy must let the caller manage the roles involved.
 */
@Service
@Transactional
public class StaffService {

    private static final Logger log = LoggerFactory.getLogger(StaffService.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final StaffAccountRepository staffAccountRepository;
    private final AccessControlService accessControlService;
    private final AuthService authService;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public StaffService(
            StaffAccountRepository staffAccountRepository,
            AccessControlService accessControlService,
            AuthService authService,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.staffAccountRepository = staffAccountRepository;
        this.accessControlService = accessControlService;
        this.authService = authService;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public StaffListResponse listStaff(StaffRole role, Boolean active, int page, int limit) {
        accessControlService.requireCurrent(Capability.MANAGE_STAFF);
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);

        Page<StaffAccount> result = staffAccountRepository.findAll(
                StaffAccountSpecifications.matching(role, active),
                PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt"))
        );
        List<UserProfileResponse> items = result.getContent().stream()
                .map(UserProfileResponse::from)
                .toList();
        return new StaffListResponse(items, safePage, safeLimit, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public UserProfileResponse getStaff(UUID staffId) {
        accessControlService.requireCurrent(Capability.MANAGE_STAFF);
        return UserProfileResponse.from(loadAccount(staffId));
    }

    public UserProfileResponse createStaff(CreateStaffRequest request) {
        JwtAuthenticationPrincipal actor = accessControlService.requireCurrent(Capability.MANAGE_STAFF);
        ensureCanManage(actor.role(), request.role());

        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (staffAccountRepository.existsByEmailIgnoreCase(email)) {
            throw AuthService.emailTaken();
        }

        StaffAccount account = new StaffAccount();
        account.setName(request.name().trim());
        account.setEmail(email);
        account.setPasswordHash(passwordEncoder.encode(request.password()));
        account.setRole(request.role());
        StaffAccount saved = authService.insertAccount(account);
        log.info("staff created: id={} role={} by={}", saved.getId(), saved.getRole().getCode(), actor.userId());
        return UserProfileResponse.from(saved);
    }

    /**
     * Deactivation also revokes every refresh session, so the account cannot mint new access tokens.
     */
    public UserProfileResponse updateStatus(UUID staffId, boolean active) {
        JwtAuthenticationPrincipal actor = accessControlService.requireCurrent(Capability.MANAGE_STAFF);
        StaffAccount account = loadAccount(staffId);
        ensureCanManage(actor.role(), account.getRole());
        if (!active && account.getId().equals(actor.userId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "staff.self_deactivation", "You cannot deactivate your own account");
        }

        if (active && !account.isActive()) {
            account.activate();
            log.info("staff activated: id={} by={}", account.getId(), actor.userId());
        } else if (!active && account.isActive()) {
            account.deactivate(OffsetDateTime.now(clock));
            int revoked = authService.revokeAllSessions(account.getId(), AuthService.REASON_USER_INACTIVE);
            log.info("staff deactivated: id={} by={} sessionsRevoked={}", account.getId(), actor.userId(), revoked);
        }
        return UserProfileResponse.from(staffAccountRepository.save(account));
    }

    public UserProfileResponse changeRole(UUID staffId, StaffRole newRole) {
        JwtAuthenticationPrincipal actor = accessControlService.requireCurrent(Capability.MANAGE_STAFF);
        StaffAccount account = loadAccount(staffId);
        if (account.getId().equals(actor.userId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "staff.self_role_change", "You cannot change your own role");
        }
        ensureCanManage(actor.role(), account.getRole());
        ensureCanManage(actor.role(), newRole);

        StaffRole previous = account.getRole();
        if (previous == newRole) {
            return UserProfileResponse.from(account);
        }
        account.setRole(newRole);
        StaffAccount saved = staffAccountRepository.save(account);
        authService.revokeAllSessions(saved.getId(), AuthService.REASON_ROLE_CHANGED);
        log.info("staff role changed: id={} {} -> {} by={}",
                saved.getId(), previous.getCode(), newRole.getCode(), actor.userId());
        return UserProfileResponse.from(saved);
    }

    private void ensureCanManage(StaffRole actingRole, StaffRole targetRole) {
        if (!PermissionModel.canManage(actingRole, targetRole)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "staff.cannot_manage",
                    "Role " + actingRole.getCode() + " cannot manage " + targetRole.getCode() + " accounts");
        }
    }

    private StaffAccount loadAccount(UUID staffId) {
        return staffAccountRepository.findById(staffId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "staff.not_found",
                        "Staff account " + staffId + " does not exist"));
    }
}
