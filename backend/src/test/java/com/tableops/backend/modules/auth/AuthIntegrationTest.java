package com.tableops.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.auth.domain.StaffAccount;
import com.tableops.backend.support.AbstractPostgresIntegrationTest;
import com.tableops.backend.support.ApiSession;
import com.tableops.backend.support.TestStaffFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestStaffFactory testStaffFactory;

    @Test
    void registerThenFetchProfile() throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "name": "Hana",
                                  "email": "Hana@TableOps.test",
                                  "password": "waiter1!",
                                  "role": "waiter",
                                  "deviceId": "pos-1"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.email").value("hana@tableops.test"))
                .andExpect(jsonPath("$.user.role").value("waiter"))
                .andReturn();
        JsonNode registered = objectMapper.readTree(result.getResponse().getContentAsString());

        mockMvc.perform(get("/profile/me").header("Authorization", ApiSession.bearer(registered)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Hana"))
                .andExpect(jsonPath("$.capabilities.length()").value(3));

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Dup", "email": "hana@tableops.test", "password": "waiter1!", "role": "chef"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("auth.email_taken"));
    }

    @Test
    void protectedEndpointsNeedBearerToken() throws Exception {
        mockMvc.perform(get("/orders"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.unauthenticated"));

        mockMvc.perform(get("/orders").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/menu"))
                .andExpect(status().isOk());
    }

    @Test
    void refreshRotatesAndOldTokenStopsWorking() throws Exception {
        testStaffFactory.ensureStaff(StaffRole.CHEF);
        JsonNode login = ApiSession.login(mockMvc, objectMapper, "chef@tableops.test",
                TestStaffFactory.DEFAULT_PASSWORD, "kitchen-tablet");
        String original = login.path("tokens").path("refreshToken").asText();

        MvcResult refreshed = mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(original, "kitchen-tablet")))
                .andExpect(status().isOk())
                .andReturn();
        String rotated = objectMapper.readTree(refreshed.getResponse().getContentAsString())
                .path("tokens").path("refreshToken").asText();
        assertThat(rotated).isNotBlank().isNotEqualTo(original);

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(original, "kitchen-tablet")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_refresh_token"));

        mockMvc.perform(post("/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(rotated, null)))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(rotated, "kitchen-tablet")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void deactivatedStaffCannotLoginOrRefresh() throws Exception {
        testStaffFactory.ensureStaff(StaffRole.OWNER);
        StaffAccount waiter = testStaffFactory.ensureStaff(StaffRole.WAITER);
        JsonNode owner = ApiSession.login(mockMvc, objectMapper, "owner@tableops.test",
                TestStaffFactory.DEFAULT_PASSWORD, "office");
        JsonNode waiterLogin = ApiSession.login(mockMvc, objectMapper, "waiter@tableops.test",
                TestStaffFactory.DEFAULT_PASSWORD, "pos");

        mockMvc.perform(patch("/staff/{id}/status", waiter.getId())
                        .header("Authorization", ApiSession.bearer(owner))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"active": false}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "waiter@tableops.test", "password": "%s"}
                                """.formatted(TestStaffFactory.DEFAULT_PASSWORD)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("auth.account_inactive"));

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(waiterLogin.path("tokens").path("refreshToken").asText(), "pos")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_refresh_token"));
    }

    @Test
    void managerCannotReachStaffAdministration() throws Exception {
        testStaffFactory.ensureStaff(StaffRole.MANAGER);
        JsonNode manager = ApiSession.login(mockMvc, objectMapper, "manager@tableops.test",
                TestStaffFactory.DEFAULT_PASSWORD, null);

        mockMvc.perform(get("/staff").header("Authorization", ApiSession.bearer(manager)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access.forbidden"));
    }

    private String refreshBody(String refreshToken, String deviceId) throws Exception {
        return objectMapper.writeValueAsString(objectMapper.createObjectNode()
                .put("refreshToken", refreshToken)
                .put("deviceId", deviceId));
    }
}
