package com.company.matching.persistence;

import com.company.matching.core.model.MatchCandidate;
import com.company.matching.core.model.SourceLink;
import com.company.matching.core.model.UnifiedCompany;
import com.company.matching.metrics.MetricsService;
import com.company.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * JDBC implementation of {@link UnifiedCompanyWriter} over the
 * {@code company_unified} and {@code company_source_link} tables.
 *
 * <p>Truncate and inserts run in a single transaction. PostgreSQL uses
 * {@code TRUNCATE ... RESTART IDENTITY CASCADE}; other databases delete links, then companies.</p>
 */
public class JdbcUnifiedCompanyWriter implements UnifiedCompanyWriter {
    private static final Logger log = LoggerFactory.getLogger(JdbcUnifiedCompanyWriter.class);

    private static final String TRUNCATE_POSTGRES =
            "TRUNCATE TABLE company_source_link, company_unified RESTART IDENTITY CASCADE";
    private static final String DELETE_LINKS = "DELETE FROM company_source_link";
    private static final String DELETE_COMPANIES = "DELETE FROM company_unified";

    private static final String INSERT_UNIFIED = """
            INSERT INTO company_unified (
                abn, unified_name, unified_name_norm, website_domain, website_url_sample,
                industry, entity_type, entity_status, address_full, suburb,
                postcode, state, start_date, match_confidence, match_method
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String[] GENERATED_KEY = {"company_id"};

    private static final String INSERT_LINK =
            "INSERT INTO company_source_link (company_id, source_system, source_key) VALUES (?, ?, ?)";

    private final DataSource dataSource;
    private final UnifiedCompanyMapper mapper;
    private final MetricsService metricsService;

    public JdbcUnifiedCompanyWriter(DataSource dataSource) {
        this(dataSource, new UnifiedCompanyMapper(), new NoOpMetricsService());
    }

    public JdbcUnifiedCompanyWriter(DataSource dataSource, UnifiedCompanyMapper mapper, MetricsService metricsService) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    @Override
    public WriteResult write(List<MatchCandidate> accepted) {
        Objects.requireNonNull(accepted, "accepted is required");
        long start = System.nanoTime();

        try (Connection connection = dataSource.getConnection()) {
            boolean previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                WriteResult result = writeInTransaction(connection, accepted);
                connection.commit();
                metricsService.recordWrite(result.companiesWritten(), Duration.ofNanos(System.nanoTime() - start));
                log.info("unification.written companies={} links={}", result.companiesWritten(), result.linksWritten());
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            } finally {
                restoreAutoCommit(connection, previousAutoCommit);
            }
        } catch (SQLException e) {
            log.error("unification.failed error={}", e.getMessage());
            throw new UnificationWriteException("Failed to write unified companies: " + e.getMessage(), e);
        }
    }

    private WriteResult writeInTransaction(Connection connection, List<MatchCandidate> accepted) throws SQLException {
        truncate(connection);

        if (accepted.isEmpty()) {
            log.warn("No matches to write, unified set is now empty");
            return WriteResult.empty();
        }

        int companies = 0;
        int links = 0;

        try (PreparedStatement insertUnified = connection.prepareStatement(INSERT_UNIFIED, GENERATED_KEY);
             PreparedStatement insertLink = connection.prepareStatement(INSERT_LINK)) {

            for (MatchCandidate candidate : accepted) {
                UnifiedCompany company = mapper.toUnifiedCompany(candidate);
                long companyId = insertCompany(insertUnified, company);
                companies++;

                for (SourceLink link : company.sourceLinks()) {
                    insertLink.setLong(1, companyId);
                    insertLink.setString(2, link.sourceSystem().code());
                    insertLink.setString(3, link.sourceKey());
                    insertLink.executeUpdate();
                    links++;
                }
            }
        }

        return new WriteResult(companies, links);
    }

    private long insertCompany(PreparedStatement statement, UnifiedCompany company) throws SQLException {
        statement.setString(1, company.registryNumber());
        statement.setString(2, company.unifiedName());
        statement.setString(3, company.unifiedNameNorm());
        statement.setString(4, company.websiteDomain());
        statement.setString(5, company.websiteUrlSample());
        statement.setString(6, company.industry());
        statement.setString(7, company.entityType());
        statement.setString(8, company.entityStatus());
        statement.setString(9, company.addressFull());
        statement.setString(10, company.suburb());
        statement.setString(11, company.postcode());
        statement.setString(12, company.state());
        if (company.startDate() != null) {
            statement.setObject(13, company.startDate());
        } else {
            statement.setNull(13, Types.DATE);
        }
        statement.setBigDecimal(14, BigDecimal.valueOf(company.matchConfidence()).setScale(2, RoundingMode.HALF_UP));
        statement.setString(15, company.matchMethod().code());
        statement.executeUpdate();

        try (ResultSet keys = statement.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No company_id generated for " + company.registryNumber());
            }
            return keys.getLong(1);
        }
    }

    private void truncate(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            if (isPostgres(connection)) {
                statement.execute(TRUNCATE_POSTGRES);
            } else {
                statement.executeUpdate(DELETE_LINKS);
                statement.executeUpdate(DELETE_COMPANIES);
            }
        }
        log.debug("Existing unified company data removed");
    }

    private boolean isPostgres(Connection connection) throws SQLException {
        String productName = connection.getMetaData().getDatabaseProductName();
        return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
    }

    private void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
            log.warn("Unification write rolled back: {}", cause.getMessage());
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.error("Rollback failed after write error: {}", e.getMessage());
        }
    }

    private void restoreAutoCommit(Connection connection, boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.debug("Could not restore auto-commit: {}", e.getMessage());
        }
    }
}
