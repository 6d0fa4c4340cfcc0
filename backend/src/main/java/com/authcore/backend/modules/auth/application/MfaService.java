package com.authcore.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.UUID;

import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.global.error.ProblemException;
import com.authcore.backend.modules.audit.application.AuditLogService;
import com.authcore.backend.modules.auth.domain.Account;
import com.authcore.backend.modules.auth.domain.MfaBackupCode;
import com.authcore.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.authcore.backend.modules.auth.infrastructure.persistence.MfaBackupCodeRepository;
import com.authcore.backend.modules.auth.infrastructure.redis.FastStore;
import com.authcore.backend.modules.auth.presentation.dto.MfaEnrollmentResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriUtils;

/**
 * TOTP enrollment and verification with single-use backup codes as the fallback factor.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class MfaService {

    private static final Logger log = LoggerFactory.getLogger(MfaService.class);

    static final String LAST_STEP_KEY_PREFIX = "auth:mfa:last-step:";

    private static final int BACKUP_CODE_LENGTH = 8;
    private static final char[] BACKUP_CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();

    private final AccountRepository accountRepository;
    private final MfaBackupCodeRepository mfaBackupCodeRepository;
    private final TotpCodeGenerator totpCodeGenerator;
    private final PasswordEncoder passwordEncoder;
    private final FastStore fastStore;
    private final AuditLogService auditLogService;
    private final AuthProperties.Mfa policy;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public MfaService(
            AccountRepository accountRepository,
            MfaBackupCodeRepository mfaBackupCodeRepository,
            TotpCodeGenerator totpCodeGenerator,
            PasswordEncoder passwordEncoder,
            FastStore fastStore,
            AuditLogService auditLogService,
            AuthProperties properties,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.mfaBackupCodeRepository = mfaBackupCodeRepository;
        this.totpCodeGenerator = totpCodeGenerator;
        this.passwordEncoder = passwordEncoder;
        this.fastStore = fastStore;
        this.auditLogService = auditLogService;
        this.policy = properties.mfa();
        this.clock = clock;
    }

    /**
     * Generates a new secret and backup codes. MFA stays off until {@link #confirm(UUID, String)} succeeds, so an
     * abandoned enrollment never locks the user out.
     */
    public MfaEnrollmentResponse enable(UUID accountId) {
        Account account = loadAccount(accountId);
        if (account.isMfaEnabled()) {
            throw AuthErrorCode.MFA_ALREADY_ENABLED.exception();
        }
        String secret = totpCodeGenerator.newSecret();
        account.setMfaSecret(secret);
        accountRepository.save(account);
        List<String> backupCodes = replaceBackupCodes(account);

        auditLogService.recordAccountEvent(AuthAuditActions.MFA_ENROLLMENT_STARTED, accountId, Map.of());
        return new MfaEnrollmentResponse(secret, otpauthUri(account.getEmail(), secret), backupCodes);
    }

    public void confirm(UUID accountId, String code) {
        Account account = loadAccount(accountId);
        if (account.isMfaEnabled()) {
            throw AuthErrorCode.MFA_ALREADY_ENABLED.exception();
        }
        if (account.getMfaSecret() == null) {
            throw AuthErrorCode.MFA_NOT_ENROLLED.exception();
        }
        if (!acceptTotp(account, code)) {
            throw AuthErrorCode.INVALID_MFA_CODE.exception();
        }
        account.setMfaEnabled(true);
        accountRepository.save(account);
        log.info("MFA enabled: account={}", accountId);
        auditLogService.recordAccountEvent(AuthAuditActions.MFA_ENABLED, accountId, Map.of());
    }

    /**
     * Accepts a current TOTP code, or else an unused backup code which is consumed.
     */
    public boolean verify(UUID accountId, String code) {
        Account account = loadAccount(accountId);
        if (!account.isMfaEnabled() || account.getMfaSecret() == null || code == null) {
            return false;
        }
        if (acceptTotp(account, code)) {
            return true;
        }
        return consumeBackupCode(account, code);
    }

    public void disable(UUID accountId) {
        Account account = loadAccount(accountId);
        if (!account.isMfaEnabled()) {
            throw AuthErrorCode.MFA_NOT_ENABLED.exception();
        }
        account.setMfaEnabled(false);
        account.setMfaSecret(null);
        accountRepository.save(account);
        mfaBackupCodeRepository.deleteByAccountId(accountId);
        fastStore.delete(lastStepKey(accountId));
        log.info("MFA disabled: account={}", accountId);
        auditLogService.recordAccountEvent(AuthAuditActions.MFA_DISABLED, accountId, Map.of());
    }

    public List<String> regenerateBackupCodes(UUID accountId) {
        Account account = loadAccount(accountId);
        if (!account.isMfaEnabled()) {
            throw AuthErrorCode.MFA_NOT_ENABLED.exception();
        }
        List<String> codes = replaceBackupCodes(account);
        auditLogService.recordAccountEvent(AuthAuditActions.MFA_BACKUP_CODES_REGENERATED, accountId, Map.of());
        return codes;
    }

    private boolean acceptTotp(Account account, String code) {
        OptionalLong step = totpCodeGenerator.matchingStep(account.getMfaSecret(), code.trim(), clock.instant(),
                policy.allowedSkewSteps());
        if (step.isEmpty()) {
            return false;
        }
        Duration ttl = Duration.ofSeconds((long) TotpCodeGenerator.STEP_SECONDS * (2L * policy.allowedSkewSteps() + 2));
        // compare-and-set so two requests carrying the same code cannot both pass
        if (!fastStore.setIfGreater(lastStepKey(account.getId()), step.getAsLong(), ttl)) {
            log.warn("Rejected replayed TOTP code: account={}", account.getId());
            return false;
        }
        return true;
    }

    private boolean consumeBackupCode(Account account, String code) {
        String normalized = normalizeBackupCode(code);
        if (normalized.length() != BACKUP_CODE_LENGTH) {
            return false;
        }
        for (MfaBackupCode backupCode : mfaBackupCodeRepository.findUnusedByAccountId(account.getId())) {
            if (passwordEncoder.matches(normalized, backupCode.getCodeHash())) {
                backupCode.setUsedAt(OffsetDateTime.now(clock));
                mfaBackupCodeRepository.save(backupCode);
                log.info("Backup code used: account={}", account.getId());
                auditLogService.recordAccountEvent(AuthAuditActions.MFA_BACKUP_CODE_USED, account.getId(), Map.of());
                return true;
            }
        }
        return false;
    }

    private List<String> replaceBackupCodes(Account account) {
        mfaBackupCodeRepository.deleteByAccountId(account.getId());
        List<String> codes = new ArrayList<>(policy.backupCodeCount());
        for (int i = 0; i < policy.backupCodeCount(); i++) {
            String code = newBackupCode();
            MfaBackupCode entity = new MfaBackupCode();
            entity.setAccount(account);
            entity.setCodeHash(passwordEncoder.encode(code));
            mfaBackupCodeRepository.save(entity);
            codes.add(code);
        }
        return List.copyOf(codes);
    }

    private String newBackupCode() {
        char[] chars = new char[BACKUP_CODE_LENGTH];
        for (int i = 0; i < chars.length; i++) {
            chars[i] = BACKUP_CODE_ALPHABET[secureRandom.nextInt(BACKUP_CODE_ALPHABET.length)];
        }
        return new String(chars);
    }

    private String otpauthUri(String email, String secret) {
        String issuer = policy.issuer();
        return "otpauth://totp/" + UriUtils.encode(issuer + ":" + email, StandardCharsets.UTF_8)
                + "?secret=" + secret
                + "&issuer=" + UriUtils.encode(issuer, StandardCharsets.UTF_8)
                + "&algorithm=SHA1&digits=" + TotpCodeGenerator.DIGITS
                + "&period=" + TotpCodeGenerator.STEP_SECONDS;
    }

    private Account loadAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(AuthErrorCode.ACCOUNT_NOT_FOUND::exception);
    }

    private static String normalizeBackupCode(String code) {
        return code.replace("-", "").replace(" ", "").trim().toUpperCase(Locale.ROOT);
    }

    private static String lastStepKey(UUID accountId) {
        return LAST_STEP_KEY_PREFIX + accountId;
    }
}
