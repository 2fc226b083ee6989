package com.qoeboost.api.security;

import lombok.Value;

import java.time.Instant;

/**
 * A freshly signed bearer token together with the times it carries.
 */
@Value
public class IssuedToken {

    String token;
    Instant issuedAt;
    Instant expiresAt;
}
