package com.qoeboost.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * QoeServiceApplication - Main entry point for the QoE Boost API.
 *
 * This service backs the QoE Boost mobile client, responsible for:
 * - User registration and password authentication
 * - JWT bearer token issuance and validation (30 minute lifetime)
 * - Collecting network logs and user feedback
 * - Provider recommendations aggregated from network logs per location
 *
 * Architecture Context:
 * - Runs on port 8000 by default (PORT environment variable)
 * - Persists to PostgreSQL when reachable at startup
 * - Falls back to an in-process store when it is not (see StorageProbe)
 * - Stateless sessions: identity lives entirely in the signed token
 *
 * @see com.qoeboost.api.controller.AuthController for authentication endpoints
 * @see com.qoeboost.api.storage.StorageConfig for the storage mode decision
 */
@SpringBootApplication
public class QoeServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(QoeServiceApplication.class, args);
    }
}
