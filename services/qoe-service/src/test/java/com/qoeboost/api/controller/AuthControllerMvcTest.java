package com.qoeboost.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AuthControllerMvcTest extends ApiMvcTest {

    @Test
    void registerReturnsUserWithoutHash() throws Exception {
        mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"email\":\"alice@example.com\","
                                + "\"password\":\"password-1\",\"provider\":\"Telekom\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.provider").value("Telekom"))
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.createdAt").value("2026-03-01T12:00:00Z"))
                .andExpect(jsonPath("$.passwordHash").doesNotExist())
                .andExpect(jsonPath("$.password").doesNotExist());
    }

    @Test
    void duplicateRegistrationIsConflict() throws Exception {
        register("alice", "password-1");

        mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"email\":\"new@example.com\",\"password\":\"password-2\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("conflict"));
    }

    @Test
    void invalidRegistrationNamesTheField() throws Exception {
        mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"email\":\"not-an-email\",\"password\":\"password-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"))
                .andExpect(jsonPath("$.field").value("email"));
    }

    @Test
    void multibytePasswordOverByteLimitIsAValidationError() throws Exception {
        String password = "\u00e9".repeat(36) + "correct";

        mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"email\":\"alice@example.com\","
                                + "\"password\":\"" + password + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"))
                .andExpect(jsonPath("$.field").value("password"));
    }

    @Test
    void malformedAndDoubleEncodedBodiesAreValidationErrors() throws Exception {
        mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\","))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));

        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("\"{\\\"username\\\":\\\"alice\\\",\\\"password\\\":\\\"password-1\\\"}\""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
    }

    @Test
    void unknownFieldsAreRejected() throws Exception {
        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"password\":\"password-1\",\"admin\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
    }

    @Test
    void loginReturnsBearerToken() throws Exception {
        register("alice", "password-1");

        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"password\":\"password-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").isString())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.expires_at").value("2026-03-01T12:30:00Z"));
    }

    @Test
    void failedLoginsLookTheSame() throws Exception {
        register("alice", "password-1");

        MvcResult wrongPassword = mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"password\":\"password-2\"}"))
                .andExpect(status().isUnauthorized())
                .andReturn();
        MvcResult unknownUser = mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"bob\",\"password\":\"password-1\"}"))
                .andExpect(status().isUnauthorized())
                .andReturn();

        JsonNode a = json(wrongPassword);
        JsonNode b = json(unknownUser);
        assertEquals(a.get("error"), b.get("error"));
        assertEquals(a.get("message"), b.get("message"));
        assertEquals(a.get("status"), b.get("status"));
        assertEquals(a.get("path"), b.get("path"));
        assertEquals(
                wrongPassword.getResponse().getHeader(HttpHeaders.WWW_AUTHENTICATE),
                unknownUser.getResponse().getHeader(HttpHeaders.WWW_AUTHENTICATE));
    }

    @Test
    void meResolvesTheTokenOwner() throws Exception {
        register("alice", "password-1");
        String token = login("alice", "password-1");

        mvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.email").value("alice@example.com"));
    }

    @Test
    void meWithoutValidTokenIsUnauthorized() throws Exception {
        mvc.perform(get("/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("unauthorized"));

        mvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer not.a.token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid credentials"));
    }

    @Test
    void userLookupById() throws Exception {
        register("alice", "password-1");

        mvc.perform(get("/users/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"));
        mvc.perform(get("/users/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }
}
