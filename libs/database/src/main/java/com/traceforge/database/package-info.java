/**
 * Versioned requirements / test-case traceability schema for the Traceforge platform.
 *
 * <p>The schema is defined as Flyway SQL migrations:
 *
 * <ul>
 *   <li>{@code db/migration/traceforge/V1__versioned_schema.sql}: tables in dependency order
 *   <li>{@code V2__indexes.sql}: lookup and natural-key indexes
 *   <li>{@code V3__triggers.sql}: {@code updated_at} auditing and TCM mapping cleanup
 *   <li>{@code V4__views.sql}: {@code requirement_sections_v}
 *   <li>{@code db/seed/reference/R__*.sql}: default tenant and plans, insert-if-absent
 * </ul>
 *
 * @see com.traceforge.database.schema.SchemaInitializer
 * @see com.traceforge.database.repository
 */
package com.traceforge.database;
