package com.authcore.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.modules.auth.domain.Account;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends Repository<Account, UUID> {

    Account save(Account account);

    Optional<Account> findById(UUID id);

    /**
     * Row lock that serialises token rotation against password changes and account-wide revocation.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Account a where a.id = :id")
    Optional<Account> findByIdForUpdate(@Param("id") UUID id);

    @Query("select a from Account a where lower(a.email) = lower(:email)")
    Optional<Account> findByEmailIgnoreCase(@Param("email") String email);

    boolean existsByEmailIgnoreCase(String email);

    /**
     * Records a successful login only if the password digest is still the one that was verified. A return value of
     * zero means the credentials changed while the login was in flight.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update Account a
               set a.lastLoginAt = :loginAt,
                   a.lastLoginIp = :clientIp,
                   a.loginCount = a.loginCount + 1
             where a.id = :accountId
               and a.passwordHash = :verifiedHash
            """)
    int recordSuccessfulLogin(@Param("accountId") UUID accountId,
                              @Param("verifiedHash") String verifiedHash,
                              @Param("loginAt") OffsetDateTime loginAt,
                              @Param("clientIp") String clientIp);
}
