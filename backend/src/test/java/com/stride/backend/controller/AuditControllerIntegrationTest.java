package com.stride.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuditControllerIntegrationTest {

    private static final String ADMIN_EMAIL = "admin@stride.test";
    private static final String PASSWORD = "correct-horse-battery";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String adminToken;

    @BeforeEach
    void setUp() throws Exception {
        adminToken = loginOrRegister(ADMIN_EMAIL);
    }

    @Test
    void auditEndpointsRequireAdmin() throws Exception {
        String userToken = loginOrRegister("user-" + UUID.randomUUID() + "@example.com");

        mockMvc.perform(get("/api/audit/events"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/audit/events").header(HttpHeaders.AUTHORIZATION, "Bearer " + userToken))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/security/metrics/reset").header(HttpHeaders.AUTHORIZATION, "Bearer " + userToken))
                .andExpect(status().isForbidden());
    }

    @Test
    void adminCanQueryAuthEvents() throws Exception {
        mockMvc.perform(get("/api/audit/events")
                        .param("action", "auth.register")
                        .param("outcome", "success")
                        .param("limit", "5")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].action").value("auth.register"))
                .andExpect(jsonPath("$[0].riskLevel").value("low"));
    }

    @Test
    void failedLoginIsAuditedWithoutPassword() throws Exception {
        String email = "victim-" + UUID.randomUUID() + "@example.com";
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("email", email, "password", "guess-123"))))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/api/audit/events")
                        .param("action", "auth.login")
                        .param("outcome", "failure")
                        .param("limit", "1")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].riskLevel").value("medium"))
                .andExpect(jsonPath("$[0].details.reason").value("invalid_credentials"));
    }

    @Test
    void invalidFiltersAreBadRequests() throws Exception {
        mockMvc.perform(get("/api/audit/events").param("action", "auth.nope")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/audit/events").param("limit", "0")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/audit/statistics").param("timeframe", "decade")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isBadRequest());
    }

    @Test
    void statisticsAndMetricsAreAvailable() throws Exception {
        mockMvc.perform(get("/api/audit/statistics").param("timeframe", "hour")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timeframe").value("HOUR"))
                .andExpect(jsonPath("$.byAction['auth.login']").exists());

        mockMvc.perform(get("/api/security/metrics").header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens_issued").exists());
    }

    private String loginOrRegister(String email) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of("email", email, "password", PASSWORD));
        var login = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andReturn();
        if (login.getResponse().getStatus() != 200) {
            login = mockMvc.perform(post("/api/auth/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isCreated())
                    .andReturn();
        }
        return objectMapper.readTree(login.getResponse().getContentAsString()).path("accessToken").asText();
    }
}
