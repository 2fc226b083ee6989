package com.qoeboost.api.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * StorageProbe - one-time reachability check of the durable store.
 *
 * Borrows a single connection from the pool and asks the driver whether it
 * is usable. Any failure to obtain or validate the connection selects
 * {@link StorageMode#FALLBACK} for the lifetime of the process; there is no
 * retry and no per-request re-probe.
 */
@Slf4j
@RequiredArgsConstructor
public class StorageProbe {

    private final DataSource dataSource;
    private final int timeoutSeconds;

    public StorageMode probe() {
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(timeoutSeconds)) {
                log.info("Durable store reachable, using {} storage", StorageMode.DURABLE);
                return StorageMode.DURABLE;
            }
            log.warn("Durable store connection failed validation within {}s", timeoutSeconds);
        } catch (SQLException | RuntimeException e) {
            log.warn("Durable store unreachable: {}", e.getMessage());
        }
        log.warn("Switching to {} storage: data will not survive a restart", StorageMode.FALLBACK);
        return StorageMode.FALLBACK;
    }
}
