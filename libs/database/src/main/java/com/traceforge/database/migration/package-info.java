/**
 * Flyway configuration and utilities.
 *
 * <ul>
 *   <li>{@link com.traceforge.database.migration.BootstrapDatabaseProperties}: externalized
 *       connection settings
 *   <li>{@link com.traceforge.database.migration.FlywaySchemaConfig}: Spring wiring and the per-run
 *       data source and Flyway factories
 *   <li>{@link com.traceforge.database.migration.MigrationService}: migration status reporting
 * </ul>
 */
package com.traceforge.database.migration;
