package com.authcore.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.authcore.backend.modules.auth.domain.MfaBackupCode;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface MfaBackupCodeRepository extends Repository<MfaBackupCode, UUID> {

    MfaBackupCode save(MfaBackupCode code);

    @Query("select c from MfaBackupCode c where c.account.id = :accountId and c.usedAt is null")
    List<MfaBackupCode> findUnusedByAccountId(@Param("accountId") UUID accountId);

    @Modifying
    @Query("delete from MfaBackupCode c where c.account.id = :accountId")
    int deleteByAccountId(@Param("accountId") UUID accountId);
}
