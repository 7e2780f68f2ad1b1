/**
 * Relational persistence for the monitoring pipeline.
 *
 * <p>Schema changes are Flyway migrations under {@code db/migration/monitoring}; the stores in
 * {@link com.vigil.database.history} and {@link com.vigil.database.issue} implement the
 * monitoring-core store interfaces on top of {@code JdbcTemplate}.
 */
package com.vigil.database;
