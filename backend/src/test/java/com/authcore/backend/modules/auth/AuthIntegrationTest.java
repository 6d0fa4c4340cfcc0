package com.authcore.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import jakarta.servlet.http.Cookie;

import com.authcore.backend.modules.auth.application.AuthNotifier;
import com.authcore.backend.support.AbstractIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractIntegrationTest {

    private static final String PASSWORD = "Passw0rd!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AuthNotifier authNotifier;

    @Test
    void registerVerifyLoginAndFetchProfile() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "Alice@Example.com",
                                  "password": "%s",
                                  "firstName": "Alice",
                                  "lastName": "Kim"
                                }
                                """.formatted(PASSWORD)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value("alice@example.com"));

        mockMvc.perform(login("alice@example.com", PASSWORD))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("EMAIL_NOT_VERIFIED"));

        verifyEmail("alice@example.com");

        JsonNode tokens = readJson(mockMvc.perform(login("alice@example.com", PASSWORD))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requiresMFA").value(false))
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.user.email").value("alice@example.com"))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("HttpOnly")))
                .andReturn());

        mockMvc.perform(get("/profile/me")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + tokens.path("accessToken").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("alice@example.com"))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.mfaEnabled").value(false));
    }

    @Test
    void duplicateAndInvalidRegistrationsAreRejected() throws Exception {
        register("bob@example.com");

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "BOB@example.com", "password": "%s", "firstName": "B", "lastName": "C"}
                                """.formatted(PASSWORD)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_ALREADY_REGISTERED"));

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "", "password": "%s", "firstName": "B", "lastName": "C"}
                                """.formatted(PASSWORD)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void refreshRotatesAndReplaysInsideGraceWindow() throws Exception {
        activeAccount("carol@example.com");
        String original = readJson(mockMvc.perform(login("carol@example.com", PASSWORD)).andReturn())
                .path("refreshToken").asText();

        String rotated = readJson(mockMvc.perform(refresh(original))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expiresIn").value(900))
                .andReturn()).path("refreshToken").asText();
        assertThat(rotated).isNotEqualTo(original);

        // a lost response retried straight away gets the same successor back
        mockMvc.perform(refresh(original))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refreshToken").value(rotated));

        mockMvc.perform(post("/auth/refresh").cookie(new Cookie("refresh_token", rotated)))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("refresh_token=")));
    }

    @Test
    void logoutRevokesSessionAndPreventsFurtherRefresh() throws Exception {
        activeAccount("dave@example.com");
        String refreshToken = readJson(mockMvc.perform(login("dave@example.com", PASSWORD)).andReturn())
                .path("refreshToken").asText();

        mockMvc.perform(post("/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(refreshToken)))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));

        mockMvc.perform(refresh(refreshToken))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("REFRESH_TOKEN_REVOKED"));

        mockMvc.perform(refresh("not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("REFRESH_TOKEN_NOT_FOUND"));
    }

    @Test
    void sessionsCanBeListedAndRevokedIndividually() throws Exception {
        activeAccount("erin@example.com");
        JsonNode first = readJson(mockMvc.perform(login("erin@example.com", PASSWORD)).andReturn());
        readJson(mockMvc.perform(login("erin@example.com", PASSWORD)).andReturn());
        String bearer = "Bearer " + first.path("accessToken").asText();

        JsonNode sessions = readJson(mockMvc.perform(get("/auth/sessions").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andReturn());

        mockMvc.perform(delete("/auth/sessions/" + sessions.get(0).path("id").asText())
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk());

        mockMvc.perform(post("/auth/logout-all").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revokedSessions").value(1));

        mockMvc.perform(refresh(first.path("refreshToken").asText()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void repeatedFailuresLockTheAccount() throws Exception {
        activeAccount("finn@example.com");
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(login("finn@example.com", "Wr0ng-pass!"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
        }

        mockMvc.perform(login("finn@example.com", PASSWORD))
                .andExpect(status().isLocked())
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
                .andExpect(jsonPath("$.code").value("ACCOUNT_LOCKED"));
    }

    @Test
    void rotatingForwardedForDoesNotEscapeTheAddressLimit() throws Exception {
        for (int i = 0; i < 20; i++) {
            mockMvc.perform(spoofedLogin("198.18.0." + i))
                    .andExpect(status().isUnauthorized());
        }

        mockMvc.perform(spoofedLogin("198.18.1.1"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("TOO_MANY_REQUESTS"));
    }

    @Test
    void sessionsShowTheSigningInUserAgent() throws Exception {
        activeAccount("gwen@example.com");
        JsonNode login = readJson(mockMvc.perform(login("gwen@example.com", PASSWORD)
                        .header(HttpHeaders.USER_AGENT, "DormClient/2.1 (Android 14)"))
                .andReturn());

        mockMvc.perform(get("/auth/sessions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + login.path("accessToken").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].userAgent").value("DormClient/2.1 (Android 14)"))
                .andExpect(jsonPath("$[0].ipAddress").value("127.0.0.1"));
    }

    @Test
    void protectedRoutesRequireValidAccessToken() throws Exception {
        mockMvc.perform(get("/profile/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(get("/profile/me").header(HttpHeaders.AUTHORIZATION, "Bearer garbage"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_ACCESS_TOKEN"));
    }

    private void activeAccount(String email) throws Exception {
        register(email);
        verifyEmail(email);
    }

    private void register(String email) throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "%s", "firstName": "Test", "lastName": "User"}
                                """.formatted(email, PASSWORD)))
                .andExpect(status().isCreated());
    }

    private void verifyEmail(String email) throws Exception {
        ArgumentCaptor<String> token = ArgumentCaptor.forClass(String.class);
        verify(authNotifier).sendVerification(eq(email), token.capture());
        mockMvc.perform(post("/auth/email/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"token": "%s"}
                                """.formatted(token.getValue())))
                .andExpect(status().isOk());
    }

    private static MockHttpServletRequestBuilder spoofedLogin(String forwardedFor) {
        return login("nobody@example.com", PASSWORD)
                .header("X-Forwarded-For", forwardedFor)
                .with(request -> {
                    request.setRemoteAddr("203.0.113.77");
                    return request;
                });
    }

    private static MockHttpServletRequestBuilder login(String email, String password) {
        return post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"email": "%s", "password": "%s"}
                        """.formatted(email, password));
    }

    private static RequestBuilder refresh(String refreshToken) {
        return post("/auth/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"refreshToken": "%s"}
                        """.formatted(refreshToken));
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
