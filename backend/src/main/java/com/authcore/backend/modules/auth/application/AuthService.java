package com.authcore.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.global.common.EmailMasker;
import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.global.error.ProblemException;
import com.authcore.backend.modules.audit.application.AuditLogService;
import com.authcore.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.authcore.backend.modules.auth.application.JwtTokenService.IssuedPurposeToken;
import com.authcore.backend.modules.auth.application.JwtTokenService.VerifiedPurposeToken;
import com.authcore.backend.modules.auth.application.PendingTokenStore.PendingToken;
import com.authcore.backend.modules.auth.application.RefreshTokenLedger.IssuedRefreshToken;
import com.authcore.backend.modules.auth.domain.Account;
import com.authcore.backend.modules.auth.domain.AccountStatus;
import com.authcore.backend.modules.auth.domain.PurposeClaims.EmailVerification;
import com.authcore.backend.modules.auth.domain.PurposeClaims.MfaChallenge;
import com.authcore.backend.modules.auth.domain.PurposeClaims.PasswordReset;
import com.authcore.backend.modules.auth.domain.RevocationReason;
import com.authcore.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.authcore.backend.modules.auth.presentation.dto.AccountProfileResponse;
import com.authcore.backend.modules.auth.presentation.dto.AccountSummaryResponse;
import com.authcore.backend.modules.auth.presentation.dto.LoginRequest;
import com.authcore.backend.modules.auth.presentation.dto.LoginResponse;
import com.authcore.backend.modules.auth.presentation.dto.LogoutAllResponse;
import com.authcore.backend.modules.auth.presentation.dto.MfaCompleteRequest;
import com.authcore.backend.modules.auth.presentation.dto.PasswordChangeRequest;
import com.authcore.backend.modules.auth.presentation.dto.PasswordResetCompleteRequest;
import com.authcore.backend.modules.auth.presentation.dto.RegisterRequest;
import com.authcore.backend.modules.auth.presentation.dto.RegisterResponse;
import com.authcore.backend.modules.auth.presentation.dto.SessionResponse;
import com.authcore.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session orchestrator. Each public operation is one transaction; revocations made before a domain error is thrown
 * still commit.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AccountRepository accountRepository;
    private final RefreshTokenLedger refreshTokenLedger;
    private final JwtTokenService jwtTokenService;
    private final MfaService mfaService;
    private final LoginAttemptLimiter loginAttemptLimiter;
    private final AuthRateLimiter authRateLimiter;
    private final PendingTokenStore pendingTokenStore;
    private final PasswordPolicy passwordPolicy;
    private final PasswordEncoder passwordEncoder;
    private final AuthNotifier authNotifier;
    private final AuditLogService auditLogService;
    private final AuthProperties properties;
    private final Clock clock;
    private final String dummyPasswordHash;

    public AuthService(
            AccountRepository accountRepository,
            RefreshTokenLedger refreshTokenLedger,
            JwtTokenService jwtTokenService,
            MfaService mfaService,
            LoginAttemptLimiter loginAttemptLimiter,
            AuthRateLimiter authRateLimiter,
            PendingTokenStore pendingTokenStore,
            PasswordPolicy passwordPolicy,
            PasswordEncoder passwordEncoder,
            AuthNotifier authNotifier,
            AuditLogService auditLogService,
            AuthProperties properties,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.refreshTokenLedger = refreshTokenLedger;
        this.jwtTokenService = jwtTokenService;
        this.mfaService = mfaService;
        this.loginAttemptLimiter = loginAttemptLimiter;
        this.authRateLimiter = authRateLimiter;
        this.pendingTokenStore = pendingTokenStore;
        this.passwordPolicy = passwordPolicy;
        this.passwordEncoder = passwordEncoder;
        this.authNotifier = authNotifier;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
        // compared against for unknown emails so the response time does not reveal whether an account exists
        this.dummyPasswordHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public RegisterResponse register(RegisterRequest request, String clientIp) {
        authRateLimiter.checkClient(clientIp);
        String email = normalizeEmail(request.email());
        passwordPolicy.requireValidEmail(email);
        passwordPolicy.requireStrong(request.password());
        if (accountRepository.existsByEmailIgnoreCase(email)) {
            throw AuthErrorCode.EMAIL_ALREADY_REGISTERED.exception();
        }

        Account account = new Account();
        account.setEmail(email);
        account.setPasswordHash(passwordEncoder.encode(request.password()));
        account.setFirstName(request.firstName().trim());
        account.setLastName(request.lastName().trim());
        account.setStatus(AccountStatus.PENDING);
        accountRepository.save(account);

        sendVerification(account);
        log.info("Account registered: account={}, email={}", account.getId(), EmailMasker.mask(email));
        auditLogService.recordAccountEvent(AuthAuditActions.ACCOUNT_REGISTERED, account.getId(), Map.of(
                "email", EmailMasker.mask(email)
        ));
        return new RegisterResponse(account.getId(), account.getEmail());
    }

    public void verifyEmail(String token) {
        VerifiedPurposeToken verified = parsePurposeToken(token);
        if (!(verified.claims() instanceof EmailVerification claims)) {
            throw AuthErrorCode.INVALID_OR_EXPIRED_TOKEN.exception();
        }
        consumePending(verified);
        Account account = accountRepository.findById(claims.accountId())
                .orElseThrow(AuthErrorCode.INVALID_OR_EXPIRED_TOKEN::exception);
        if (!account.getEmail().equalsIgnoreCase(claims.email())) {
            throw AuthErrorCode.INVALID_OR_EXPIRED_TOKEN.exception();
        }
        if (account.getStatus() != AccountStatus.PENDING) {
            return;
        }
        account.setStatus(AccountStatus.ACTIVE);
        account.setEmailVerifiedAt(OffsetDateTime.now(clock));
        accountRepository.save(account);
        log.info("Email verified: account={}", account.getId());
        auditLogService.recordAccountEvent(AuthAuditActions.EMAIL_VERIFIED, account.getId(), Map.of());
    }

    /**
     * Re-sends the verification link to a pending account. Succeeds silently for any other address.
     */
    public void resendVerification(String rawEmail, String clientIp) {
        authRateLimiter.checkClient(clientIp);
        String email = normalizeEmail(rawEmail);
        if (!passwordPolicy.isValidEmail(email)) {
            return;
        }
        authRateLimiter.checkEmail(email);
        accountRepository.findByEmailIgnoreCase(email)
                .filter(account -> account.getStatus() == AccountStatus.PENDING)
                .ifPresent(this::sendVerification);
    }

    public LoginResponse login(LoginRequest request, String clientIp, String userAgent) {
        authRateLimiter.checkClient(clientIp);
        String email = normalizeEmail(request.email());

        Optional<Account> found = accountRepository.findByEmailIgnoreCase(email);
        if (found.isEmpty()) {
            passwordEncoder.matches(request.password(), dummyPasswordHash);
            log.info("Login failed for unknown email={}, ip={}", EmailMasker.mask(email), clientIp);
            auditLogService.recordAccountEvent(AuthAuditActions.LOGIN_FAILED, null, Map.of(
                    "reason", "UNKNOWN_EMAIL",
                    "email", EmailMasker.mask(email),
                    "ip", clientIp
            ));
            throw AuthErrorCode.INVALID_CREDENTIALS.exception();
        }
        Account account = found.get();

        if (loginAttemptLimiter.isLocked(account.getId())) {
            throw loginAttemptLimiter.lockedException(account.getId());
        }
        requireLoginStatus(account);

        String verifiedHash = account.getPasswordHash();
        if (!passwordEncoder.matches(request.password(), verifiedHash)) {
            recordFailedAttempt(account, clientIp, "BAD_PASSWORD");
            throw AuthErrorCode.INVALID_CREDENTIALS.exception();
        }

        if (account.isMfaEnabled()) {
            IssuedPurposeToken challenge = jwtTokenService.issuePurposeToken(
                    new MfaChallenge(account.getId()), properties.mfa().challengeTtl());
            auditLogService.recordAccountEvent(AuthAuditActions.MFA_CHALLENGE_ISSUED, account.getId(), Map.of(
                    "ip", clientIp
            ));
            return LoginResponse.mfaRequired(challenge.token());
        }
        return completeLogin(account, verifiedHash, clientIp, userAgent);
    }

    public LoginResponse completeMfa(MfaCompleteRequest request, String clientIp, String userAgent) {
        authRateLimiter.checkClient(clientIp);
        MfaChallenge challenge;
        try {
            challenge = jwtTokenService.parsePurposeToken(request.mfaToken(), MfaChallenge.class);
        } catch (InvalidTokenException ex) {
            throw AuthErrorCode.INVALID_MFA_TOKEN.exception();
        }
        Account account = accountRepository.findById(challenge.accountId())
                .orElseThrow(AuthErrorCode.INVALID_MFA_TOKEN::exception);

        if (loginAttemptLimiter.isLocked(account.getId())) {
            throw loginAttemptLimiter.lockedException(account.getId());
        }
        if (!account.isActive()) {
            throw AuthErrorCode.ACCOUNT_NOT_ACTIVE.exception();
        }
        if (!account.isMfaEnabled()) {
            throw AuthErrorCode.INVALID_MFA_TOKEN.exception();
        }
        if (!mfaService.verify(account.getId(), request.code())) {
            recordFailedAttempt(account, clientIp, "BAD_MFA_CODE");
            throw AuthErrorCode.INVALID_MFA_CODE.exception();
        }
        return completeLogin(account, account.getPasswordHash(), clientIp, userAgent);
    }

    /**
     * Not rate limited per client address; a shared NAT exit would otherwise lock every user behind it out of
     * their sessions.
     */
    public TokenPairResponse refresh(String refreshCredential) {
        if (refreshCredential == null || refreshCredential.isBlank()) {
            throw new RefreshTokenException(RefreshTokenException.Reason.NOT_FOUND);
        }
        return refreshTokenLedger.rotate(refreshCredential);
    }

    public void logout(String refreshCredential) {
        refreshTokenLedger.revoke(refreshCredential).ifPresent(accountId ->
                auditLogService.recordAccountEvent(AuthAuditActions.LOGOUT, accountId, Map.of()));
    }

    public LogoutAllResponse logoutAllDevices(UUID accountId) {
        int revoked = refreshTokenLedger.revokeAll(accountId, RevocationReason.LOGOUT_ALL);
        auditLogService.recordAccountEvent(AuthAuditActions.LOGOUT_ALL, accountId, Map.of(
                "revokedSessions", revoked
        ));
        return new LogoutAllResponse(revoked);
    }

    @Transactional(readOnly = true)
    public List<SessionResponse> listSessions(UUID accountId) {
        return refreshTokenLedger.activeSessions(accountId).stream()
                .map(record -> new SessionResponse(
                        record.getFamilyId(),
                        record.getSessionStartedAt(),
                        record.getIssuedAt(),
                        record.getExpiresAt(),
                        record.getClientIp(),
                        record.getUserAgent()
                ))
                .toList();
    }

    public void revokeSession(UUID accountId, UUID sessionId) {
        refreshTokenLedger.revokeSession(accountId, sessionId);
        auditLogService.recordAccountEvent(AuthAuditActions.SESSION_REVOKED, accountId, Map.of(
                "sessionId", sessionId.toString()
        ));
    }

    public void changePassword(UUID accountId, PasswordChangeRequest request) {
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(AuthErrorCode.ACCOUNT_NOT_FOUND::exception);
        if (!passwordEncoder.matches(request.current(), account.getPasswordHash())) {
            throw AuthErrorCode.INVALID_CURRENT_PASSWORD.exception();
        }
        passwordPolicy.requireStrong(request.newPassword());
        if (passwordEncoder.matches(request.newPassword(), account.getPasswordHash())) {
            throw AuthErrorCode.PASSWORD_UNCHANGED.exception();
        }

        updatePassword(account, request.newPassword());
        int revoked = refreshTokenLedger.revokeAll(accountId, RevocationReason.PASSWORD_CHANGED);
        log.info("Password changed: account={}, revokedSessions={}", accountId, revoked);
        auditLogService.recordAccountEvent(AuthAuditActions.PASSWORD_CHANGED, accountId, Map.of(
                "revokedSessions", revoked
        ));
    }

    /**
     * Always completes normally so the response does not reveal whether the email is registered.
     */
    public void requestPasswordReset(String rawEmail, String clientIp) {
        authRateLimiter.checkClient(clientIp);
        String email = normalizeEmail(rawEmail);
        if (!passwordPolicy.isValidEmail(email)) {
            return;
        }
        authRateLimiter.checkEmail(email);

        Optional<Account> found = accountRepository.findByEmailIgnoreCase(email)
                .filter(account -> account.getStatus() != AccountStatus.BANNED);
        if (found.isEmpty()) {
            log.debug("Password reset requested for unknown or banned email={}", EmailMasker.mask(email));
            return;
        }
        Account account = found.get();
        IssuedPurposeToken token = jwtTokenService.issuePurposeToken(
                new PasswordReset(account.getId()), properties.purposeTokens().passwordResetTtl());
        pendingTokenStore.remember(PasswordReset.PURPOSE, token, account.getId(), account.getEmail());
        authNotifier.sendReset(account.getEmail(), token.token());
        auditLogService.recordAccountEvent(AuthAuditActions.PASSWORD_RESET_REQUESTED, account.getId(), Map.of(
                "ip", clientIp
        ));
    }

    public void resetPassword(PasswordResetCompleteRequest request) {
        passwordPolicy.requireStrong(request.newPassword());
        VerifiedPurposeToken verified = parsePurposeToken(request.token());
        if (!(verified.claims() instanceof PasswordReset claims)) {
            throw AuthErrorCode.INVALID_OR_EXPIRED_TOKEN.exception();
        }
        consumePending(verified);
        Account account = accountRepository.findByIdForUpdate(claims.accountId())
                .filter(found -> found.getStatus() != AccountStatus.BANNED)
                .orElseThrow(AuthErrorCode.INVALID_OR_EXPIRED_TOKEN::exception);

        updatePassword(account, request.newPassword());
        int revoked = refreshTokenLedger.revokeAll(account.getId(), RevocationReason.PASSWORD_RESET);
        loginAttemptLimiter.clear(account.getId());
        log.info("Password reset: account={}, revokedSessions={}", account.getId(), revoked);
        auditLogService.recordAccountEvent(AuthAuditActions.PASSWORD_RESET, account.getId(), Map.of(
                "revokedSessions", revoked
        ));
    }

    public void disableMfa(UUID accountId, String password) {
        Account account = loadAccount(accountId);
        if (!passwordEncoder.matches(password, account.getPasswordHash())) {
            throw AuthErrorCode.INVALID_CURRENT_PASSWORD.exception();
        }
        mfaService.disable(accountId);
    }

    @Transactional(readOnly = true)
    public AccountProfileResponse loadProfile(UUID accountId) {
        Account account = loadAccount(accountId);
        return new AccountProfileResponse(
                account.getId(),
                account.getEmail(),
                account.getFirstName(),
                account.getLastName(),
                account.getRole().name(),
                account.getStatus().name(),
                account.isMfaEnabled(),
                account.getEmailVerifiedAt(),
                account.getLastLoginAt(),
                account.getCreatedAt()
        );
    }

    private LoginResponse completeLogin(Account account, String verifiedHash, String clientIp, String userAgent) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        // zero rows means the password changed after it was checked
        if (accountRepository.recordSuccessfulLogin(account.getId(), verifiedHash, now, clientIp) == 0) {
            throw AuthErrorCode.INVALID_CREDENTIALS.exception();
        }
        loginAttemptLimiter.clear(account.getId());

        IssuedRefreshToken issued = refreshTokenLedger.issue(account, clientIp, userAgent);
        log.info("Login succeeded: account={}, ip={}", account.getId(), clientIp);
        auditLogService.recordAccountEvent(AuthAuditActions.LOGIN_SUCCEEDED, account.getId(), Map.of(
                "ip", clientIp,
                "sessionId", issued.record().getFamilyId().toString()
        ));
        return LoginResponse.authenticated(issued.tokens(), toSummary(account));
    }

    private void requireLoginStatus(Account account) {
        switch (account.getStatus()) {
            case ACTIVE -> {
            }
            case PENDING -> throw AuthErrorCode.EMAIL_NOT_VERIFIED.exception();
            case SUSPENDED, BANNED -> throw AuthErrorCode.ACCOUNT_NOT_ACTIVE.exception();
        }
    }

    private void recordFailedAttempt(Account account, String clientIp, String reason) {
        long attempts = loginAttemptLimiter.recordFailure(account.getId(), clientIp);
        Map<String, Object> detail = new HashMap<>();
        detail.put("reason", reason);
        detail.put("ip", clientIp);
        detail.put("attempt", attempts);
        auditLogService.recordAccountEvent(AuthAuditActions.LOGIN_FAILED, account.getId(), detail);
    }

    private void sendVerification(Account account) {
        IssuedPurposeToken token = jwtTokenService.issuePurposeToken(
                new EmailVerification(account.getId(), account.getEmail()),
                properties.purposeTokens().emailVerificationTtl());
        pendingTokenStore.remember(EmailVerification.PURPOSE, token, account.getId(), account.getEmail());
        authNotifier.sendVerification(account.getEmail(), token.token());
    }

    private VerifiedPurposeToken parsePurposeToken(String token) {
        try {
            return jwtTokenService.parsePurposeToken(token);
        } catch (InvalidTokenException ex) {
            throw AuthErrorCode.INVALID_OR_EXPIRED_TOKEN.exception();
        }
    }

    private PendingToken consumePending(VerifiedPurposeToken verified) {
        return pendingTokenStore.consume(verified)
                .filter(pending -> pending.accountId().equals(verified.claims().accountId()))
                .orElseThrow(AuthErrorCode.INVALID_OR_EXPIRED_TOKEN::exception);
    }

    private void updatePassword(Account account, String newPassword) {
        account.setPasswordHash(passwordEncoder.encode(newPassword));
        account.setPasswordChangedAt(OffsetDateTime.now(clock));
        accountRepository.save(account);
    }

    private Account loadAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(AuthErrorCode.ACCOUNT_NOT_FOUND::exception);
    }

    private static AccountSummaryResponse toSummary(Account account) {
        return new AccountSummaryResponse(
                account.getId(),
                account.getEmail(),
                account.getFirstName(),
                account.getLastName(),
                account.getRole().name()
        );
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
