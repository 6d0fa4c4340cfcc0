package com.authcore.backend.modules.auth.presentation;

import java.util.Map;

import com.authcore.backend.global.web.ClientIpResolver;
import com.authcore.backend.modules.auth.application.AuthService;
import com.authcore.backend.modules.auth.presentation.dto.EmailVerificationRequest;
import com.authcore.backend.modules.auth.presentation.dto.LoginRequest;
import com.authcore.backend.modules.auth.presentation.dto.LoginResponse;
import com.authcore.backend.modules.auth.presentation.dto.MfaCompleteRequest;
import com.authcore.backend.modules.auth.presentation.dto.RefreshRequest;
import com.authcore.backend.modules.auth.presentation.dto.RegisterRequest;
import com.authcore.backend.modules.auth.presentation.dto.RegisterResponse;
import com.authcore.backend.modules.auth.presentation.dto.ResendVerificationRequest;
import com.authcore.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth", description = "Registration, login and token lifecycle")
public class AuthController {

    private final AuthService authService;
    private final RefreshTokenCookies refreshTokenCookies;

    public AuthController(AuthService authService, RefreshTokenCookies refreshTokenCookies) {
        this.authService = authService;
        this.refreshTokenCookies = refreshTokenCookies;
    }

    @PostMapping("/auth/register")
    @Operation(summary = "회원가입", description = "PENDING 상태로 계정을 만들고 이메일 인증 링크를 보낸다.")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request,
                                                     HttpServletRequest httpRequest) {
        RegisterResponse response = authService.register(request, ClientIpResolver.resolve(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/auth/email/verify")
    public ResponseEntity<Map<String, Object>> verifyEmail(@Valid @RequestBody EmailVerificationRequest request) {
        authService.verifyEmail(request.token());
        return ResponseEntity.ok(Map.of());
    }

    @PostMapping("/auth/email/resend")
    public ResponseEntity<Map<String, Object>> resendVerification(@Valid @RequestBody ResendVerificationRequest request,
                                                                  HttpServletRequest httpRequest) {
        authService.resendVerification(request.email(), ClientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(Map.of());
    }

    @PostMapping("/auth/login")
    @Operation(summary = "로그인", description = "MFA가 켜진 계정은 토큰 대신 mfaToken을 받는다.")
    public ResponseEntity<LoginResponse> login(
            @Valid @RequestBody LoginRequest request,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            HttpServletRequest httpRequest
    ) {
        return withRefreshCookie(authService.login(request, ClientIpResolver.resolve(httpRequest), userAgent));
    }

    @PostMapping("/auth/mfa/complete")
    public ResponseEntity<LoginResponse> completeMfa(
            @Valid @RequestBody MfaCompleteRequest request,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            HttpServletRequest httpRequest
    ) {
        return withRefreshCookie(authService.completeMfa(request, ClientIpResolver.resolve(httpRequest), userAgent));
    }

    @PostMapping("/auth/refresh")
    @Operation(summary = "토큰 재발급", description = "리프레시 토큰을 1회용으로 회전한다. 재사용이 감지되면 모든 세션이 폐기된다.")
    public ResponseEntity<TokenPairResponse> refresh(
            @RequestBody(required = false) RefreshRequest request,
            @CookieValue(name = "${app.auth.cookie.name:refresh_token}", required = false) String cookieToken
    ) {
        String credential = refreshTokenCookies.resolve(request != null ? request.refreshToken() : null, cookieToken);
        TokenPairResponse tokens = authService.refresh(credential);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE,
                        refreshTokenCookies.issue(tokens.refreshToken(), tokens.refreshExpiresIn()).toString())
                .body(tokens);
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Map<String, Object>> logout(
            @RequestBody(required = false) RefreshRequest request,
            @CookieValue(name = "${app.auth.cookie.name:refresh_token}", required = false) String cookieToken
    ) {
        authService.logout(refreshTokenCookies.resolve(request != null ? request.refreshToken() : null, cookieToken));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, refreshTokenCookies.clear().toString())
                .body(Map.of());
    }

    private ResponseEntity<LoginResponse> withRefreshCookie(LoginResponse response) {
        if (response.requiresMFA()) {
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE,
                        refreshTokenCookies.issue(response.refreshToken(), response.refreshExpiresIn()).toString())
                .body(response);
    }
}
