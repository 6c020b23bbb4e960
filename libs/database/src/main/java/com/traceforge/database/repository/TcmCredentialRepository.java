package com.traceforge.database.repository;

import com.traceforge.database.model.TcmCredential;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Credentials of TCM integrations. Each integration holds exactly one credential record;
 * {@link #store(TcmCredential)} replaces the existing one.
 * <p>
 * Stores for the same integration are serialized on a row lock of the owning
 * {@code tcm_integrations} row.
 */
public class TcmCredentialRepository {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public TcmCredentialRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate =
                new TransactionTemplate(new DataSourceTransactionManager(jdbcTemplate.getDataSource()));
    }

    /**
     * Inserts or replaces the credential of an integration.
     *
     * @return the credential id
     * @throws IllegalArgumentException if the integration does not exist
     */
    public UUID store(TcmCredential credential) {
        return transactionTemplate.execute(tx -> {
            lockIntegration(credential.integrationId());
            Optional<UUID> existing = jdbcTemplate
                    .queryForList(
                            "SELECT credential_id FROM tcm_credentials WHERE integration_id = ?"
                                    + " ORDER BY created_at, credential_id",
                            UUID.class, credential.integrationId())
                    .stream()
                    .findFirst();
            if (existing.isPresent()) {
                jdbcTemplate.update(
                        "UPDATE tcm_credentials SET base_url = ?, api_key = ?, username = ?, password = ?"
                                + " WHERE credential_id = ?",
                        credential.baseUrl(), credential.apiKey(), credential.username(),
                        credential.password(), existing.get());
                return existing.get();
            }
            return jdbcTemplate.queryForObject(
                    "INSERT INTO tcm_credentials (integration_id, base_url, api_key, username, password)"
                            + " VALUES (?, ?, ?, ?, ?) RETURNING credential_id",
                    UUID.class,
                    credential.integrationId(), credential.baseUrl(), credential.apiKey(),
                    credential.username(), credential.password());
        });
    }

    public Optional<TcmCredential> findByIntegration(UUID integrationId) {
        return jdbcTemplate
                .query("SELECT integration_id, base_url, api_key, username, password"
                                + " FROM tcm_credentials WHERE integration_id = ?"
                                + " ORDER BY created_at, credential_id LIMIT 1",
                        (rs, rowNum) -> new TcmCredential(
                                ResultSets.uuid(rs, "integration_id"),
                                rs.getString("base_url"),
                                rs.getString("api_key"),
                                rs.getString("username"),
                                rs.getString("password")),
                        integrationId)
                .stream()
                .findFirst();
    }

    private void lockIntegration(UUID integrationId) {
        boolean found = !jdbcTemplate
                .queryForList(
                        "SELECT 1 FROM tcm_integrations WHERE integration_id = ? FOR UPDATE",
                        Integer.class, integrationId)
                .isEmpty();
        if (!found) {
            throw new IllegalArgumentException("Unknown TCM integration: " + integrationId);
        }
    }
}
