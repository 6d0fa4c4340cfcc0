package com.authcore.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.global.error.RetryableProblemException;
import com.authcore.backend.global.error.StoreUnavailableException;
import com.authcore.backend.support.AuthFixture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class AuthRateLimiterTest {

    private AuthFixture fixture;
    private AuthRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        AuthProperties properties = new AuthProperties(null, null,
                new AuthProperties.RateLimit(
                        new AuthProperties.Limit(3, Duration.ofMinutes(1)),
                        new AuthProperties.Limit(2, Duration.ofMinutes(15))),
                null, null, null, null, null);
        fixture = new AuthFixture(properties);
        rateLimiter = fixture.rateLimiter;
    }

    @Test
    void rejectsRequestsOverTheClientLimitUntilTheWindowCloses() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.checkClient("203.0.113.7");
        }

        assertThatThrownBy(() -> rateLimiter.checkClient("203.0.113.7"))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(60L);
                });
        assertThatCode(() -> rateLimiter.checkClient("198.51.100.1")).doesNotThrowAnyException();

        fixture.clock.advance(Duration.ofMinutes(1));
        assertThatCode(() -> rateLimiter.checkClient("203.0.113.7")).doesNotThrowAnyException();
    }

    @Test
    void emailLimitIgnoresCase() {
        rateLimiter.checkEmail("Alice@Example.com");
        rateLimiter.checkEmail("alice@example.com");

        assertThatThrownBy(() -> rateLimiter.checkEmail("ALICE@example.com"))
                .isInstanceOf(RetryableProblemException.class);
        assertThat(fixture.auditLogRepository.actionTypes()).containsExactly(AuthAuditActions.RATE_LIMITED);
    }

    @Test
    void storeOutageFailsTheRequest() {
        fixture.fastStore.setAvailable(false);

        assertThatThrownBy(() -> rateLimiter.checkClient("203.0.113.7"))
                .isInstanceOf(StoreUnavailableException.class);
    }
}
