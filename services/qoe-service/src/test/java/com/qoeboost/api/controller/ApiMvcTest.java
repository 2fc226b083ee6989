package com.qoeboost.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qoeboost.api.security.JwtUtil;
import com.qoeboost.api.security.PasswordHasher;
import com.qoeboost.api.service.AuthService;
import com.qoeboost.api.service.RecommendationService;
import com.qoeboost.api.service.TelemetryService;
import com.qoeboost.api.storage.InMemoryPersistenceGateway;
import com.qoeboost.api.storage.StorageMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Wires every controller over an in-memory gateway and a fixed clock, the
 * way the application runs in fallback mode.
 */
abstract class ApiMvcTest {

    static final String SECRET = "test-secret-for-qoe-boost-unit-tests-0123456789abcdef";
    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    protected final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json()
            .failOnUnknownProperties(true)
            .build();

    protected InMemoryPersistenceGateway gateway;
    protected MockMvc mvc;

    @BeforeEach
    void setUpMvc() {
        gateway = new InMemoryPersistenceGateway();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        AuthService authService = new AuthService(
                gateway, new PasswordHasher(), new JwtUtil(SECRET, 1_800_000L), new SimpleMeterRegistry());
        TelemetryService telemetryService = new TelemetryService(gateway);

        mvc = MockMvcBuilders.standaloneSetup(
                        new AuthController(authService, clock),
                        new UserController(gateway),
                        new FeedbackController(authService, telemetryService, clock),
                        new NetworkLogController(authService, telemetryService, clock),
                        new RecommendationController(new RecommendationService(gateway)),
                        new HealthController(StorageMode.FALLBACK))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    protected void register(String username, String password) throws Exception {
        mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"" + username + "\",\"email\":\"" + username
                                + "@example.com\",\"password\":\"" + password + "\"}"))
                .andExpect(status().isCreated());
    }

    protected String login(String username, String password) throws Exception {
        MvcResult result = mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"" + username + "\",\"password\":\"" + password + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        return json(result).get("access_token").asText();
    }

    protected JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
