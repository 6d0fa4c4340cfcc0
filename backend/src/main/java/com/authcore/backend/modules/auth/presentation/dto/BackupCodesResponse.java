package com.authcore.backend.modules.auth.presentation.dto;

import java.util.List;

public record BackupCodesResponse(List<String> backupCodes) {
}
