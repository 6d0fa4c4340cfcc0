package com.authcore.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class RefreshTokenCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenCleanupScheduler.class);

    private final RefreshTokenLedger refreshTokenLedger;

    public RefreshTokenCleanupScheduler(RefreshTokenLedger refreshTokenLedger) {
        this.refreshTokenLedger = refreshTokenLedger;
    }

    @Scheduled(fixedDelayString = "${app.auth.session.cleanup-interval:PT1H}")
    @Transactional
    public void purgeStaleRefreshTokens() {
        int purged = refreshTokenLedger.purgeStale();
        if (purged > 0) {
            log.info("Purged {} stale refresh token records", purged);
        }
    }
}
