package com.authcore.backend.modules.auth.presentation;

import java.util.Map;
import java.util.UUID;

import com.authcore.backend.global.security.SecurityUtils;
import com.authcore.backend.modules.auth.application.AuthService;
import com.authcore.backend.modules.auth.application.MfaService;
import com.authcore.backend.modules.auth.presentation.dto.BackupCodesResponse;
import com.authcore.backend.modules.auth.presentation.dto.MfaCodeRequest;
import com.authcore.backend.modules.auth.presentation.dto.MfaDisableRequest;
import com.authcore.backend.modules.auth.presentation.dto.MfaEnrollmentResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "MFA", description = "TOTP enrollment and backup codes")
public class MfaController {

    private final MfaService mfaService;
    private final AuthService authService;

    public MfaController(MfaService mfaService, AuthService authService) {
        this.mfaService = mfaService;
        this.authService = authService;
    }

    @PostMapping("/auth/mfa/enroll")
    @Operation(summary = "MFA 등록 시작", description = "비밀키와 백업 코드는 이 응답에서만 확인할 수 있다.")
    public ResponseEntity<MfaEnrollmentResponse> enroll() {
        return ResponseEntity.ok(mfaService.enable(SecurityUtils.getCurrentAccountId()));
    }

    @PostMapping("/auth/mfa/confirm")
    public ResponseEntity<Map<String, Object>> confirm(@Valid @RequestBody MfaCodeRequest request) {
        mfaService.confirm(SecurityUtils.getCurrentAccountId(), request.code());
        return ResponseEntity.ok(Map.of());
    }

    @PostMapping("/auth/mfa/disable")
    public ResponseEntity<Map<String, Object>> disable(@Valid @RequestBody MfaDisableRequest request) {
        authService.disableMfa(SecurityUtils.getCurrentAccountId(), request.password());
        return ResponseEntity.ok(Map.of());
    }

    @PostMapping("/auth/mfa/backup-codes")
    public ResponseEntity<BackupCodesResponse> regenerateBackupCodes() {
        UUID accountId = SecurityUtils.getCurrentAccountId();
        return ResponseEntity.ok(new BackupCodesResponse(mfaService.regenerateBackupCodes(accountId)));
    }
}
