package com.authcore.backend.modules.auth.presentation;

import java.util.Map;

import com.authcore.backend.global.security.SecurityUtils;
import com.authcore.backend.global.web.ClientIpResolver;
import com.authcore.backend.modules.auth.application.AuthService;
import com.authcore.backend.modules.auth.presentation.dto.PasswordChangeRequest;
import com.authcore.backend.modules.auth.presentation.dto.PasswordResetCompleteRequest;
import com.authcore.backend.modules.auth.presentation.dto.PasswordResetRequest;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PasswordController {

    private final AuthService authService;

    public PasswordController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/password/change")
    @Operation(summary = "비밀번호 변경", description = "변경 후 모든 리프레시 토큰이 폐기된다.")
    public ResponseEntity<Map<String, Object>> changePassword(@Valid @RequestBody PasswordChangeRequest request) {
        authService.changePassword(SecurityUtils.getCurrentAccountId(), request);
        return ResponseEntity.ok(Map.of());
    }

    @PostMapping("/auth/password/reset-request")
    @Operation(summary = "비밀번호 재설정 요청", description = "계정 존재 여부와 관계없이 항상 200을 반환한다.")
    public ResponseEntity<Map<String, Object>> requestReset(@Valid @RequestBody PasswordResetRequest request,
                                                            HttpServletRequest httpRequest) {
        authService.requestPasswordReset(request.email(), ClientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(Map.of());
    }

    @PostMapping("/auth/password/reset")
    public ResponseEntity<Map<String, Object>> resetPassword(@Valid @RequestBody PasswordResetCompleteRequest request) {
        authService.resetPassword(request);
        return ResponseEntity.ok(Map.of());
    }
}
