package com.qoeboost.api.storage;

import com.qoeboost.api.repository.FeedbackRepository;
import com.qoeboost.api.repository.NetworkLogRepository;
import com.qoeboost.api.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * StorageConfig - wires the PersistenceGateway for the lifetime of the process.
 *
 * Startup sequence:
 * 1. StorageProbe checks the durable store once
 * 2. DURABLE: schema is applied, JpaPersistenceGateway serves all requests
 * 3. FALLBACK: InMemoryPersistenceGateway serves all requests
 *
 * The decision is exposed as a StorageMode bean so health and telemetry
 * responses can report it.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    public StorageProbe storageProbe(
            DataSource dataSource,
            @Value("${qoe.storage.probe-timeout-seconds:5}") int probeTimeoutSeconds) {
        return new StorageProbe(dataSource, probeTimeoutSeconds);
    }

    @Bean
    public StorageMode storageMode(StorageProbe storageProbe, DataSource dataSource) {
        StorageMode mode = storageProbe.probe();
        if (mode == StorageMode.DURABLE) {
            new DurableSchemaInitializer(dataSource).apply();
        }
        return mode;
    }

    @Bean
    public PersistenceGateway persistenceGateway(
            StorageMode storageMode,
            UserRepository userRepository,
            FeedbackRepository feedbackRepository,
            NetworkLogRepository networkLogRepository) {
        log.info("Persistence gateway running in {} mode", storageMode);
        if (storageMode == StorageMode.DURABLE) {
            return new JpaPersistenceGateway(userRepository, feedbackRepository, networkLogRepository);
        }
        return new InMemoryPersistenceGateway();
    }
}
