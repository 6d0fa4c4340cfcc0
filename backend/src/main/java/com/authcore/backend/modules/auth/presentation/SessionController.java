package com.authcore.backend.modules.auth.presentation;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.authcore.backend.global.security.SecurityUtils;
import com.authcore.backend.modules.auth.application.AuthService;
import com.authcore.backend.modules.auth.presentation.dto.LogoutAllResponse;
import com.authcore.backend.modules.auth.presentation.dto.SessionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Sessions", description = "Device sessions of the signed-in account")
public class SessionController {

    private final AuthService authService;
    private final RefreshTokenCookies refreshTokenCookies;

    public SessionController(AuthService authService, RefreshTokenCookies refreshTokenCookies) {
        this.authService = authService;
        this.refreshTokenCookies = refreshTokenCookies;
    }

    @GetMapping("/auth/sessions")
    @Operation(summary = "활성 세션 목록", description = "최근에 시작된 세션이 먼저 온다.")
    public ResponseEntity<List<SessionResponse>> listSessions() {
        return ResponseEntity.ok(authService.listSessions(SecurityUtils.getCurrentAccountId()));
    }

    @DeleteMapping("/auth/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> revokeSession(@PathVariable UUID sessionId) {
        authService.revokeSession(SecurityUtils.getCurrentAccountId(), sessionId);
        return ResponseEntity.ok(Map.of());
    }

    @PostMapping("/auth/logout-all")
    @Operation(summary = "모든 기기에서 로그아웃")
    public ResponseEntity<LogoutAllResponse> logoutAll() {
        LogoutAllResponse response = authService.logoutAllDevices(SecurityUtils.getCurrentAccountId());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, refreshTokenCookies.clear().toString())
                .body(response);
    }
}
