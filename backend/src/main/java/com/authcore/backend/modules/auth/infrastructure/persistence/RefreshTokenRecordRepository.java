package com.authcore.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.modules.auth.domain.RefreshTokenRecord;
import com.authcore.backend.modules.auth.domain.RevocationReason;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRecordRepository extends Repository<RefreshTokenRecord, UUID> {

    RefreshTokenRecord save(RefreshTokenRecord record);

    Optional<RefreshTokenRecord> findById(UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from RefreshTokenRecord r join fetch r.account where r.tokenValue = :tokenValue")
    Optional<RefreshTokenRecord> findByTokenValueForUpdate(@Param("tokenValue") String tokenValue);

    @Query("""
            select r
              from RefreshTokenRecord r
             where r.account.id = :accountId
               and r.revokedAt is null
               and r.usedAt is null
               and r.expiresAt > :now
             order by r.sessionStartedAt desc
            """)
    List<RefreshTokenRecord> findActiveByAccountId(@Param("accountId") UUID accountId,
                                                   @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshTokenRecord r
               set r.revokedAt = :revokedAt,
                   r.revokedReason = :reason
             where r.account.id = :accountId
               and r.revokedAt is null
            """)
    int revokeAllByAccountId(@Param("accountId") UUID accountId,
                             @Param("revokedAt") OffsetDateTime revokedAt,
                             @Param("reason") RevocationReason reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshTokenRecord r
               set r.revokedAt = :revokedAt,
                   r.revokedReason = :reason
             where r.account.id = :accountId
               and r.familyId = :familyId
               and r.revokedAt is null
            """)
    int revokeFamily(@Param("accountId") UUID accountId,
                     @Param("familyId") UUID familyId,
                     @Param("revokedAt") OffsetDateTime revokedAt,
                     @Param("reason") RevocationReason reason);

    @Modifying
    @Query("""
            delete from RefreshTokenRecord r
             where r.expiresAt < :now
                or r.revokedAt < :revokedBefore
            """)
    int deleteStale(@Param("now") OffsetDateTime now,
                    @Param("revokedBefore") OffsetDateTime revokedBefore);
}
