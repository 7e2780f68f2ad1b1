package com.vigil.healthmonitor.infrastructure.storage;

import com.vigil.monitoring.check.StorageProbe;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import javax.sql.DataSource;

/**
 * Liveness of the relational database: borrows a connection and asks the driver to validate it.
 */
public class JdbcStorageProbe implements StorageProbe {

    private final DataSource dataSource;
    private final int validationTimeoutSeconds;

    public JdbcStorageProbe(DataSource dataSource, Duration validationTimeout) {
        this.dataSource = dataSource;
        this.validationTimeoutSeconds = (int) Math.max(1, validationTimeout.toSeconds());
    }

    @Override
    public void ping() throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(validationTimeoutSeconds)) {
                throw new SQLException("Connection failed validation within " + validationTimeoutSeconds + "s");
            }
        }
    }
}
