/**
 * Flyway configuration of the monitoring database and a read-only migration status view.
 */
package com.vigil.database.migration;
