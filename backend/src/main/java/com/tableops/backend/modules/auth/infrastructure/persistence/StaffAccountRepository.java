package com.tableops.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.tableops.backend.modules.auth.domain.StaffAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface StaffAccountRepository extends JpaRepository<StaffAccount, UUID>, JpaSpecificationExecutor<StaffAccount> {

    Optional<StaffAccount> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);
}
