package com.authcore.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.global.error.ProblemException;
import com.authcore.backend.modules.audit.application.AuditLogService;
import com.authcore.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.authcore.backend.modules.auth.application.JwtTokenService.RefreshCredential;
import com.authcore.backend.modules.auth.domain.Account;
import com.authcore.backend.modules.auth.domain.RefreshTokenRecord;
import com.authcore.backend.modules.auth.domain.RevocationReason;
import com.authcore.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.authcore.backend.modules.auth.infrastructure.persistence.RefreshTokenRecordRepository;
import com.authcore.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistent refresh token chain with single-use rotation. A credential presented again after its grace window is
 * treated as stolen and tears down every session of the account.
 *
 * <p>Rotation and account-wide revocation both lock the account row first. A bulk revoke therefore runs either
 * before a rotation starts or after it commits, and always sees the successor it created.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class RefreshTokenLedger {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenLedger.class);

    private static final int TOKEN_VALUE_BYTES = 32;
    private static final int USER_AGENT_MAX_LENGTH = 512;

    private final RefreshTokenRecordRepository refreshTokenRecordRepository;
    private final AccountRepository accountRepository;
    private final JwtTokenService jwtTokenService;
    private final AuditLogService auditLogService;
    private final Duration reuseGraceWindow;
    private final Duration retention;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public RefreshTokenLedger(
            RefreshTokenRecordRepository refreshTokenRecordRepository,
            AccountRepository accountRepository,
            JwtTokenService jwtTokenService,
            AuditLogService auditLogService,
            AuthProperties properties,
            Clock clock
    ) {
        this.refreshTokenRecordRepository = refreshTokenRecordRepository;
        this.accountRepository = accountRepository;
        this.jwtTokenService = jwtTokenService;
        this.auditLogService = auditLogService;
        this.reuseGraceWindow = properties.refresh().reuseGraceWindow();
        this.retention = properties.session().retention();
        this.clock = clock;
    }

    /**
     * Starts a new session family for the account, remembering the device that signed in.
     */
    public IssuedRefreshToken issue(Account account, String clientIp, String userAgent) {
        OffsetDateTime now = now();
        RefreshTokenRecord record = newRecord(account, UUID.randomUUID(), now, now);
        record.setClientIp(clientIp);
        record.setUserAgent(truncate(userAgent));
        refreshTokenRecordRepository.save(record);
        log.debug("Issued refresh token: account={}, family={}", account.getId(), record.getFamilyId());
        return new IssuedRefreshToken(record, toPair(account, record));
    }

    public TokenPairResponse rotate(String presentedCredential) {
        RefreshCredential credential;
        try {
            credential = jwtTokenService.parseRefreshCredential(presentedCredential);
        } catch (InvalidTokenException ex) {
            throw new RefreshTokenException(RefreshTokenException.Reason.NOT_FOUND);
        }

        if (accountRepository.findByIdForUpdate(credential.accountId()).isEmpty()) {
            throw new RefreshTokenException(RefreshTokenException.Reason.NOT_FOUND);
        }
        RefreshTokenRecord record = refreshTokenRecordRepository.findByTokenValueForUpdate(credential.tokenValue())
                .filter(found -> found.getAccount().getId().equals(credential.accountId()))
                .orElseThrow(() -> new RefreshTokenException(RefreshTokenException.Reason.NOT_FOUND));

        OffsetDateTime now = now();
        Account account = record.getAccount();

        if (record.getRevokedAt() != null) {
            if (record.getRevokedReason() == RevocationReason.REUSE_DETECTED) {
                throw new RefreshTokenException(RefreshTokenException.Reason.REUSE_DETECTED);
            }
            throw new RefreshTokenException(RefreshTokenException.Reason.REVOKED);
        }

        if (record.getUsedAt() != null) {
            if (now.isAfter(record.getUsedAt().plus(reuseGraceWindow))) {
                handleReuse(record, now);
                throw new RefreshTokenException(RefreshTokenException.Reason.REUSE_DETECTED);
            }
            return replay(account, record, now);
        }

        if (!record.getExpiresAt().isAfter(now)) {
            throw new RefreshTokenException(RefreshTokenException.Reason.EXPIRED);
        }

        requireActive(account, record, now);

        RefreshTokenRecord successor = newRecord(account, record.getFamilyId(), record.getSessionStartedAt(), now);
        successor.setClientIp(record.getClientIp());
        successor.setUserAgent(record.getUserAgent());
        refreshTokenRecordRepository.save(successor);

        record.setUsedAt(now);
        record.setReplacedById(successor.getId());
        refreshTokenRecordRepository.save(record);

        log.debug("Rotated refresh token: account={}, family={}", account.getId(), record.getFamilyId());
        return toPair(account, successor);
    }

    /**
     * Revokes the presented credential together with the rest of its session family. Unknown or malformed
     * credentials are ignored so logout never reveals whether a token was valid.
     *
     * @return the owning account when something was revoked
     */
    public Optional<UUID> revoke(String presentedCredential) {
        if (presentedCredential == null || presentedCredential.isBlank()) {
            return Optional.empty();
        }
        RefreshCredential credential;
        try {
            credential = jwtTokenService.parseRefreshCredential(presentedCredential);
        } catch (InvalidTokenException ex) {
            return Optional.empty();
        }
        Optional<RefreshTokenRecord> record = refreshTokenRecordRepository
                .findByTokenValueForUpdate(credential.tokenValue())
                .filter(found -> found.getAccount().getId().equals(credential.accountId()));
        if (record.isEmpty()) {
            return Optional.empty();
        }
        UUID accountId = credential.accountId();
        int revoked = refreshTokenRecordRepository.revokeFamily(accountId, record.get().getFamilyId(), now(),
                RevocationReason.LOGOUT);
        return revoked > 0 ? Optional.of(accountId) : Optional.empty();
    }

    public int revokeAll(UUID accountId, RevocationReason reason) {
        accountRepository.findByIdForUpdate(accountId);
        int revoked = refreshTokenRecordRepository.revokeAllByAccountId(accountId, now(), reason);
        if (revoked > 0) {
            log.info("Revoked {} refresh tokens: account={}, reason={}", revoked, accountId, reason);
        }
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<RefreshTokenRecord> activeSessions(UUID accountId) {
        return refreshTokenRecordRepository.findActiveByAccountId(accountId, now());
    }

    public void revokeSession(UUID accountId, UUID sessionId) {
        accountRepository.findByIdForUpdate(accountId);
        OffsetDateTime now = now();
        boolean owned = refreshTokenRecordRepository.findActiveByAccountId(accountId, now).stream()
                .anyMatch(record -> record.getFamilyId().equals(sessionId));
        if (!owned) {
            throw AuthErrorCode.SESSION_NOT_FOUND.exception();
        }
        refreshTokenRecordRepository.revokeFamily(accountId, sessionId, now, RevocationReason.SESSION_REVOKED);
    }

    /**
     * Deletes expired rows and rows revoked longer ago than the retention period. Used rows that have not expired
     * stay so that a late replay is still recognised as reuse.
     */
    public int purgeStale() {
        OffsetDateTime now = now();
        return refreshTokenRecordRepository.deleteStale(now, now.minus(retention));
    }

    private void handleReuse(RefreshTokenRecord record, OffsetDateTime now) {
        UUID accountId = record.getAccount().getId();
        UUID familyId = record.getFamilyId();

        record.setRevokedAt(now);
        record.setRevokedReason(RevocationReason.REUSE_DETECTED);
        refreshTokenRecordRepository.save(record);

        int cascaded = refreshTokenRecordRepository.revokeAllByAccountId(accountId, now,
                RevocationReason.REUSE_CASCADE);
        log.warn("Refresh token reuse detected: account={}, family={}, usedAt={}, revoked={}", accountId, familyId,
                record.getUsedAt(), cascaded);
        auditLogService.recordAccountEvent(AuthAuditActions.REFRESH_REUSE_DETECTED, accountId, Map.of(
                "familyId", familyId.toString(),
                "revokedSessions", cascaded
        ));
    }

    private TokenPairResponse replay(Account account, RefreshTokenRecord record, OffsetDateTime now) {
        requireActive(account, record, now);
        if (record.getReplacedById() == null) {
            throw new RefreshTokenException(RefreshTokenException.Reason.NOT_FOUND);
        }
        RefreshTokenRecord successor = refreshTokenRecordRepository.findById(record.getReplacedById())
                .orElseThrow(() -> new RefreshTokenException(RefreshTokenException.Reason.NOT_FOUND));
        if (successor.getRevokedAt() != null) {
            throw new RefreshTokenException(RefreshTokenException.Reason.REVOKED);
        }
        log.info("Replaying rotated refresh token inside grace window: account={}, family={}", account.getId(),
                record.getFamilyId());
        return toPair(account, successor);
    }

    private void requireActive(Account account, RefreshTokenRecord record, OffsetDateTime now) {
        if (account.isActive()) {
            return;
        }
        refreshTokenRecordRepository.revokeFamily(account.getId(), record.getFamilyId(), now,
                RevocationReason.ACCOUNT_INACTIVE);
        throw AuthErrorCode.ACCOUNT_NOT_ACTIVE.exception();
    }

    private RefreshTokenRecord newRecord(Account account, UUID familyId, OffsetDateTime sessionStartedAt,
                                         OffsetDateTime issuedAt) {
        RefreshTokenRecord record = new RefreshTokenRecord();
        record.setAccount(account);
        record.setTokenValue(newTokenValue());
        record.setFamilyId(familyId);
        record.setSessionStartedAt(sessionStartedAt);
        record.setIssuedAt(issuedAt);
        record.setExpiresAt(issuedAt.plus(Duration.ofMillis(jwtTokenService.getRefreshTokenTtlMillis())));
        return record;
    }

    // Derived only from the row, so a replay signs byte-identical tokens.
    private TokenPairResponse toPair(Account account, RefreshTokenRecord record) {
        String accessToken = jwtTokenService.issueAccessToken(account.getId(), account.getRole(),
                record.getIssuedAt().toInstant());
        String refreshToken = jwtTokenService.issueRefreshCredential(account.getId(), record.getTokenValue(),
                record.getIssuedAt().toInstant(), record.getExpiresAt().toInstant());
        return new TokenPairResponse(
                accessToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                jwtTokenService.getAccessTokenTtlMillis() / 1000,
                refreshToken,
                Duration.between(record.getIssuedAt(), record.getExpiresAt()).getSeconds(),
                record.getIssuedAt()
        );
    }

    private static String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= USER_AGENT_MAX_LENGTH) {
            return userAgent;
        }
        return userAgent.substring(0, USER_AGENT_MAX_LENGTH);
    }

    private String newTokenValue() {
        byte[] bytes = new byte[TOKEN_VALUE_BYTES];
        secureRandom.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }

    // Second precision: JWT timestamps carry no fractions, and replayed pairs must match the first response.
    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }

    public record IssuedRefreshToken(RefreshTokenRecord record, TokenPairResponse tokens) {
    }
}
