/**
 * JDBC repositories over the traceability schema.
 *
 * <p>Requirement and testcase history is append-only: the repositories insert new version rows and
 * expose no operation that rewrites the content of an existing version.
 */
package com.traceforge.database.repository;
