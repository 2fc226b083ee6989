package com.qoeboost.api.storage;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;

class StorageProbeTest {

    @Test
    void reachableDatabaseSelectsDurable() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(3)).thenReturn(true);

        assertEquals(StorageMode.DURABLE, new StorageProbe(dataSource, 3).probe());
        verify(connection).close();
    }

    @Test
    void unreachableDatabaseSelectsFallback() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLTransientConnectionException("Connection refused"));

        assertEquals(StorageMode.FALLBACK, new StorageProbe(dataSource, 3).probe());
    }

    @Test
    void invalidConnectionSelectsFallback() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(false);

        assertEquals(StorageMode.FALLBACK, new StorageProbe(dataSource, 3).probe());
        verify(connection).close();
    }

    @Test
    void probesExactlyOnce() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("down"));

        new StorageProbe(dataSource, 1).probe();

        verify(dataSource, times(1)).getConnection();
    }
}
