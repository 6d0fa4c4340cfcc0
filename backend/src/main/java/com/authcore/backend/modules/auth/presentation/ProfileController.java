package com.authcore.backend.modules.auth.presentation;

import com.authcore.backend.global.security.JwtAuthenticationPrincipal;
import com.authcore.backend.modules.auth.application.AuthService;
import com.authcore.backend.modules.auth.presentation.dto.AccountProfileResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/profile/me")
    public ResponseEntity<AccountProfileResponse> currentAccount(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.accountId()));
    }
}
