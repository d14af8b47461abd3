package com.tableops.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.modules.auth.domain.StaffAccount;
import com.tableops.backend.modules.auth.domain.StaffSession;
import com.tableops.backend.modules.auth.infrastructure.persistence.StaffAccountConstraints;
import com.tableops.backend.modules.auth.infrastructure.persistence.StaffAccountRepository;
import com.tableops.backend.modules.auth.infrastructure.persistence.StaffSessionRepository;
import com.tableops.backend.modules.auth.presentation.dto.LoginRequest;
import com.tableops.backend.modules.auth.presentation.dto.LoginResponse;
import com.tableops.backend.modules.auth.presentation.dto.LogoutRequest;
import com.tableops.backend.modules.auth.presentation.dto.RefreshRequest;
import com.tableops.backend.modules.auth.presentation.dto.RegisterRequest;
import com.tableops.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.tableops.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String REASON_EXPIRED = "EXPIRED";
    public static final String REASON_ROTATED = "ROTATED";
    public static final String REASON_LOGOUT = "LOGOUT";
    public static final String REASON_DEVICE_MISMATCH = "DEVICE_MISMATCH";
    public static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    public static final String REASON_ROLE_CHANGED = "ROLE_CHANGED";
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final StaffAccountRepository staffAccountRepository;
    private final StaffSessionRepository staffSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            StaffAccountRepository staffAccountRepository,
            StaffSessionRepository staffSessionRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.staffAccountRepository = staffAccountRepository;
        this.staffSessionRepository = staffSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public LoginResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (staffAccountRepository.existsByEmailIgnoreCase(email)) {
            throw emailTaken();
        }

        StaffAccount account = new StaffAccount();
        account.setName(request.name().trim());
        account.setEmail(email);
        account.setPasswordHash(passwordEncoder.encode(request.password()));
        account.setRole(request.role());
        account.setLastLoginAt(OffsetDateTime.now(clock));
        StaffAccount saved = insertAccount(account);
        log.info("staff registered: id={} role={}", saved.getId(), saved.getRole().getCode());

        return openSession(saved, normalizeDeviceId(request.deviceId()));
    }

    /**
     * Inserts a new account. A concurrent registration of the same email that slipped past the
     * existence check surfaces here as {@code auth.email_taken}.
     */
    public StaffAccount insertAccount(StaffAccount account) {
        try {
            return staffAccountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            if (StaffAccountConstraints.isDuplicateEmail(ex)) {
                throw emailTaken();
            }
            throw ex;
        }
    }

    public static ProblemException emailTaken() {
        return new ProblemException(HttpStatus.CONFLICT, "auth.email_taken", "An account with this email already exists");
    }

    public LoginResponse login(LoginRequest request) {
        StaffAccount account = staffAccountRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(this::invalidCredentials);

        if (!passwordEncoder.matches(request.password(), account.getPasswordHash())) {
            throw invalidCredentials();
        }
        if (!account.isActive()) {
            log.info("login refused for inactive account: id={}", account.getId());
            throw accountInactive();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        account.setLastLoginAt(now);
        staffAccountRepository.save(account);
        staffSessionRepository.revokeExpiredSessions(account.getId(), now, REASON_EXPIRED);

        log.info("staff logged in: id={} role={}", account.getId(), account.getRole().getCode());
        return openSession(account, normalizeDeviceId(request.deviceId()));
    }

    /**
     * Rotates the refresh token. The presented token is revoked whether or not a new one is issued,
     * so a replayed token never works twice.
     */
    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        StaffSession session = staffSessionRepository.findByRefreshTokenHash(hashRefreshToken(request.refreshToken()))
                .orElseThrow(this::invalidRefreshToken);

        if (session.getRevokedAt() != null) {
            throw invalidRefreshToken();
        }
        if (!session.getExpiresAt().isAfter(now)) {
            revokeSession(session, REASON_EXPIRED, now);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.refresh_token_expired", "Refresh token expired");
        }

        String requestDeviceId = normalizeDeviceId(request.deviceId());
        String sessionDeviceId = normalizeDeviceId(session.getDeviceId());
        if (sessionDeviceId != null && requestDeviceId != null && !Objects.equals(sessionDeviceId, requestDeviceId)) {
            revokeSession(session, REASON_DEVICE_MISMATCH, now);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.refresh_token_device_mismatch",
                    "Refresh token was issued to another device");
        }

        StaffAccount account = session.getStaffAccount();
        if (!account.isActive()) {
            revokeSession(session, REASON_USER_INACTIVE, now);
            throw accountInactive();
        }

        revokeSession(session, REASON_ROTATED, now);
        staffSessionRepository.revokeExpiredSessions(account.getId(), now, REASON_EXPIRED);

        String deviceId = requestDeviceId != null ? requestDeviceId : sessionDeviceId;
        return openSession(account, deviceId);
    }

    /**
     * Unknown or already revoked tokens get the same answer as live ones.
     */
    public void logout(LogoutRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int revoked = staffSessionRepository.revokeByRefreshTokenHash(
                hashRefreshToken(request.refreshToken()), now, REASON_LOGOUT);
        log.info("logout: sessions revoked={}", revoked);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID staffAccountId) {
        StaffAccount account = staffAccountRepository.findById(staffAccountId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "staff.not_found",
                        "Staff account " + staffAccountId + " does not exist"));
        return UserProfileResponse.from(account);
    }

    public int revokeAllSessions(UUID staffAccountId, String reason) {
        return staffSessionRepository.revokeAllForAccount(staffAccountId, OffsetDateTime.now(clock), reason);
    }

    private LoginResponse openSession(StaffAccount account, String deviceId) {
        String refreshToken = UUID.randomUUID().toString();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(
                account.getId(), account.getEmail(), account.getRole(), refreshToken);

        StaffSession session = new StaffSession();
        session.setStaffAccount(account);
        session.setRefreshTokenHash(hashRefreshToken(refreshToken));
        session.setIssuedAt(tokens.issuedAt());
        session.setExpiresAt(tokens.issuedAt().plusSeconds(tokens.refreshExpiresIn()));
        session.setDeviceId(deviceId);
        staffSessionRepository.save(session);

        return new LoginResponse(tokens, UserProfileResponse.from(account));
    }

    private void revokeSession(StaffSession session, String reason, OffsetDateTime now) {
        session.revoke(now, reason);
        staffSessionRepository.save(session);
    }

    static String hashRefreshToken(String refreshToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(refreshToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    private String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > DEVICE_ID_MAX_LENGTH ? trimmed.substring(0, DEVICE_ID_MAX_LENGTH) : trimmed;
    }

    private ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials", "Email or password is incorrect");
    }

    private ProblemException invalidRefreshToken() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_refresh_token", "Refresh token is not valid");
    }

    private ProblemException accountInactive() {
        return new ProblemException(HttpStatus.FORBIDDEN, "auth.account_inactive", "This account has been deactivated");
    }
}
