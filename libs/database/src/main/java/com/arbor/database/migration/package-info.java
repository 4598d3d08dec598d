/**
 * Flyway configuration for the hierarchy schema.
 *
 * <ul>
 *   <li>{@link com.arbor.database.migration.FlywayConfigProperties} binds {@code arbor.flyway.*}
 *   <li>{@link com.arbor.database.migration.FlywayMigrationConfig} creates the migrating Flyway bean
 * </ul>
 */
package com.arbor.database.migration;
