package com.company.matching.source;

import com.company.matching.core.model.RegistryEntity;
import com.company.matching.core.model.WebMention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the staging tables {@code stg_abr_entities} and {@code stg_commoncrawl_companies}.
 *
 * <p>Registry rows are limited to active entities with a state. Both tables are sampled
 * deterministically by key modulus (registry number mod {@code registrySampleModulus},
 * web id mod {@code webSampleModulus}); a modulus of 1 reads every row.
 * Rows are returned in key order.</p>
 */
public class JdbcSourceFeed implements SourceFeed {
    private static final Logger log = LoggerFactory.getLogger(JdbcSourceFeed.class);

    public static final int DEFAULT_REGISTRY_SAMPLE_MODULUS = 5000;
    public static final int DEFAULT_WEB_SAMPLE_MODULUS = 20;

    private static final String SELECT_REGISTRY = """
            SELECT abn, entity_name_norm, entity_name_raw, entity_type, entity_status,
                   address_full, suburb, postcode, state, start_date_raw
            FROM stg_abr_entities
            WHERE state IS NOT NULL
              AND entity_status = 'ACT'
              AND MOD(CAST(abn AS BIGINT), CAST(? AS BIGINT)) = 0
            ORDER BY abn
            """;

    private static final String SELECT_WEB = """
            SELECT commoncrawl_id, crawl_id, url, domain, tld, html_title,
                   company_name_raw, company_name_norm, industry, fetched_at
            FROM stg_commoncrawl_companies
            WHERE MOD(commoncrawl_id, CAST(? AS BIGINT)) = 0
            ORDER BY commoncrawl_id
            """;

    private final DataSource dataSource;
    private final int registrySampleModulus;
    private final int webSampleModulus;

    public JdbcSourceFeed(DataSource dataSource) {
        this(dataSource, DEFAULT_REGISTRY_SAMPLE_MODULUS, DEFAULT_WEB_SAMPLE_MODULUS);
    }

    public JdbcSourceFeed(DataSource dataSource, int registrySampleModulus, int webSampleModulus) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource is required");
        if (registrySampleModulus < 1 || webSampleModulus < 1) {
            throw new IllegalArgumentException("Sample modulus must be >= 1");
        }
        this.registrySampleModulus = registrySampleModulus;
        this.webSampleModulus = webSampleModulus;
    }

    @Override
    public SourceData load() {
        try (Connection connection = dataSource.getConnection()) {
            List<RegistryEntity> registryEntities = loadRegistry(connection);
            List<WebMention> webMentions = loadWeb(connection);
            log.info("source.loaded registryEntities={} webMentions={} registryModulus={} webModulus={}",
                    registryEntities.size(), webMentions.size(), registrySampleModulus, webSampleModulus);
            return new SourceData(registryEntities, webMentions);
        } catch (SQLException e) {
            throw new SourceFeedException("Failed to load staging data: " + e.getMessage(), e);
        }
    }

    private List<RegistryEntity> loadRegistry(Connection connection) throws SQLException {
        List<RegistryEntity> entities = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(SELECT_REGISTRY)) {
            statement.setLong(1, registrySampleModulus);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    String registryNumber = text(rs, "abn");
                    if (registryNumber.isBlank()) {
                        continue;
                    }
                    entities.add(RegistryEntity.builder()
                            .registryNumber(registryNumber)
                            .nameNorm(text(rs, "entity_name_norm"))
                            .nameRaw(text(rs, "entity_name_raw"))
                            .entityType(text(rs, "entity_type"))
                            .entityStatus(text(rs, "entity_status"))
                            .addressFull(text(rs, "address_full"))
                            .suburb(text(rs, "suburb"))
                            .postcode(text(rs, "postcode"))
                            .state(text(rs, "state"))
                            .startDateRaw(text(rs, "start_date_raw"))
                            .build());
                }
            }
        }
        return entities;
    }

    private List<WebMention> loadWeb(Connection connection) throws SQLException {
        List<WebMention> mentions = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(SELECT_WEB)) {
            statement.setLong(1, webSampleModulus);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    mentions.add(WebMention.builder()
                            .id(text(rs, "commoncrawl_id"))
                            .crawlId(text(rs, "crawl_id"))
                            .url(text(rs, "url"))
                            .domain(text(rs, "domain"))
                            .tld(text(rs, "tld"))
                            .htmlTitle(text(rs, "html_title"))
                            .nameRaw(text(rs, "company_name_raw"))
                            .nameNorm(text(rs, "company_name_norm"))
                            .industry(text(rs, "industry"))
                            .fetchedAt(text(rs, "fetched_at"))
                            .build());
                }
            }
        }
        return mentions;
    }

    private static String text(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? value : "";
    }
}
