package com.tableops.backend.support;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Logs in over HTTP and hands back the parsed token pair.
 */
public final class ApiSession {

    private ApiSession() {
    }

    public static JsonNode login(MockMvc mockMvc, ObjectMapper objectMapper, String email, String password,
                                 String deviceId) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new LoginBody(email, password, deviceId))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    public static String bearer(JsonNode loginResponse) {
        return "Bearer " + loginResponse.path("tokens").path("accessToken").asText();
    }

    private record LoginBody(String email, String password, String deviceId) {
    }
}
