package com.qoeboost.api.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Creates the users, feedback and network_logs tables if they are missing.
 * Runs only after the probe has found the durable store reachable.
 */
@Slf4j
@RequiredArgsConstructor
public class DurableSchemaInitializer {

    static final String SCHEMA_LOCATION = "db/qoe-schema.sql";

    private final DataSource dataSource;

    public void apply() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.execute(dataSource);
        log.info("Durable schema applied from {}", SCHEMA_LOCATION);
    }
}
