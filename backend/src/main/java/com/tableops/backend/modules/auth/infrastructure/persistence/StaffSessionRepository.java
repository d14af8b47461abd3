package com.tableops.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.tableops.backend.modules.auth.domain.StaffSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffSessionRepository extends JpaRepository<StaffSession, UUID> {

    Optional<StaffSession> findByRefreshTokenHash(String refreshTokenHash);

    @Modifying
    @Query("""
            update StaffSession s
               set s.revokedAt = :revokedAt,
                   s.revokedReason = :reason
             where s.refreshTokenHash = :refreshTokenHash
               and s.revokedAt is null
            """)
    int revokeByRefreshTokenHash(@Param("refreshTokenHash") String refreshTokenHash,
                                 @Param("revokedAt") OffsetDateTime revokedAt,
                                 @Param("reason") String reason);

    @Modifying
    @Query("""
            update StaffSession s
               set s.revokedAt = :now,
                   s.revokedReason = :reason
             where s.staffAccount.id = :staffAccountId
               and s.revokedAt is null
               and s.expiresAt <= :now
            """)
    int revokeExpiredSessions(@Param("staffAccountId") UUID staffAccountId,
                              @Param("now") OffsetDateTime now,
                              @Param("reason") String reason);

    @Modifying
    @Query("""
            update StaffSession s
               set s.revokedAt = :now,
                   s.revokedReason = :reason
             where s.staffAccount.id = :staffAccountId
               and s.revokedAt is null
            """)
    int revokeAllForAccount(@Param("staffAccountId") UUID staffAccountId,
                            @Param("now") OffsetDateTime now,
                            @Param("reason") String reason);
}
