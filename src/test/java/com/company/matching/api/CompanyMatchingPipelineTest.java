package com.company.matching.api;

import com.company.matching.TestDatabase;
import com.company.matching.audit.JsonLinesOracleAuditLog;
import com.company.matching.core.model.RegistryEntity;
import com.company.matching.core.model.WebMention;
import com.company.matching.metrics.MicrometerMetricsService;
import com.company.matching.metrics.NoOpMetricsService;
import com.company.matching.oracle.DecisionOracle;
import com.company.matching.oracle.OracleAvailability;
import com.company.matching.oracle.OracleException;
import com.company.matching.persistence.JdbcUnifiedCompanyWriter;
import com.company.matching.persistence.UnificationWriteException;
import com.company.matching.persistence.UnifiedCompanyWriter;
import com.company.matching.source.SourceData;
import com.company.matching.source.SourceFeed;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("CompanyMatchingPipeline Tests")
@ExtendWith(MockitoExtension.class)
class CompanyMatchingPipelineTest {

    private static final String ACCEPT_HIGH =
            "{\"is_match\": true, \"confidence\": \"high\", \"reason\": \"Identical legal name\"}";

    @Mock
    DecisionOracle oracle;

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private JsonLinesOracleAuditLog auditLog;

    private final SourceData acmeScenario = new SourceData(
            List.of(RegistryEntity.builder()
                    .registryNumber("A1")
                    .nameNorm("ACME PTY LTD")
                    .nameRaw("ACME PTY LTD")
                    .state("NSW")
                    .entityStatus("ACT")
                    .build()),
            List.of(
                    WebMention.builder().id("W1").nameNorm("ACME PTY LTD").domain("acme.com.au").build(),
                    WebMention.builder().id("W2").nameNorm("").build()));

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.createH2();
        auditLog = new JsonLinesOracleAuditLog(tempDir.resolve("llm_match_logs.jsonl"));
    }

    private CompanyMatchingPipeline pipeline(OracleAvailability availability, MatchingOptions options) {
        return CompanyMatchingPipeline.builder()
                .writer(new JdbcUnifiedCompanyWriter(dataSource))
                .context(new PipelineContext(availability, auditLog, new NoOpMetricsService()))
                .options(options)
                .build();
    }

    private int count(String table) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Nested
    @DisplayName("Blanket adjudication")
    class BlanketAdjudication {

        @Test
        @DisplayName("Exact match confirmed by the oracle becomes one unified company with two links")
        void endToEnd() throws Exception {
            when(oracle.complete(any())).thenReturn(ACCEPT_HIGH);

            RunSummary summary = pipeline(OracleAvailability.available(oracle), MatchingOptions.defaults())
                    .run(acmeScenario);

            assertEquals(new RunSummary(1, 2, 0, 1, 0, 0, 1, 1), summary);
            assertEquals(1, count("company_unified"));
            assertEquals(2, count("company_source_link"));
            verify(oracle, times(1)).complete(any());

            List<String> auditLines = Files.readAllLines(auditLog.getPath());
            assertEquals(1, auditLines.size());
            assertTrue(auditLines.get(0).contains("Identical legal name"));
        }

        @Test
        @DisplayName("Written company carries the oracle-assisted method and full score")
        void writtenAttributes() throws Exception {
            when(oracle.complete(any())).thenReturn(ACCEPT_HIGH);

            pipeline(OracleAvailability.available(oracle), MatchingOptions.defaults()).run(acmeScenario);

            try (Connection connection = dataSource.getConnection();
                 Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery(
                         "SELECT abn, website_domain, match_method, match_confidence FROM company_unified")) {
                assertTrue(rs.next());
                assertEquals("A1", rs.getString("abn"));
                assertEquals("acme.com.au", rs.getString("website_domain"));
                assertEquals("oracle_assisted", rs.getString("match_method"));
                assertEquals(100.0, rs.getDouble("match_confidence"), 0.001);
            }
        }

        @Test
        @DisplayName("Rejected verdict writes nothing and leaves the candidate ambiguous")
        void rejected() throws Exception {
            when(oracle.complete(any())).thenReturn(
                    "{\"is_match\": true, \"confidence\": \"low\", \"reason\": \"Could be a namesake\"}");

            RunSummary summary = pipeline(OracleAvailability.available(oracle), MatchingOptions.defaults())
                    .run(acmeScenario);

            assertEquals(0, summary.oracleAccepted());
            assertEquals(1, summary.stillAmbiguous());
            assertEquals(0, summary.totalWritten());
            assertEquals(0, count("company_unified"));
        }

        @Test
        @DisplayName("Unavailable oracle still runs, writes nothing and creates no audit file")
        void oracleUnavailable() throws SQLException {
            RunSummary summary = pipeline(OracleAvailability.unavailable("missing API key"), MatchingOptions.defaults())
                    .run(acmeScenario);

            assertEquals(new RunSummary(1, 2, 0, 0, 1, 0, 1, 0), summary);
            assertEquals(0, count("company_unified"));
            assertFalse(Files.exists(auditLog.getPath()));
        }
    }

    @Nested
    @DisplayName("Thresholded policy")
    class Thresholded {

        @Test
        @DisplayName("High-scoring candidates are written without consulting the oracle")
        void autoAccept() throws SQLException {
            RunSummary summary = pipeline(OracleAvailability.available(oracle), MatchingOptions.thresholded())
                    .run(acmeScenario);

            verifyNoInteractions(oracle);
            assertEquals(1, summary.autoAccepted());
            assertEquals(1, summary.totalWritten());
            assertEquals(1, count("company_unified"));
        }

        @Test
        @DisplayName("Low-scoring candidates are discarded")
        void discard() {
            SourceData data = new SourceData(
                    List.of(RegistryEntity.builder().registryNumber("A1").nameNorm("zenith traders").build()),
                    List.of(WebMention.builder().id("W1").nameNorm("acme").build()));

            RunSummary summary = pipeline(OracleAvailability.available(oracle), MatchingOptions.thresholded())
                    .run(data);

            verifyNoInteractions(oracle);
            assertEquals(1, summary.discarded());
            assertEquals(0, summary.totalWritten());
        }
    }

    @Nested
    @DisplayName("Wiring")
    class Wiring {

        @Mock
        SourceFeed sourceFeed;

        @Mock
        UnifiedCompanyWriter writer;

        @Test
        @DisplayName("run() loads from the configured source feed")
        void runLoadsFromFeed() {
            when(sourceFeed.load()).thenReturn(acmeScenario);
            CompanyMatchingPipeline pipeline = CompanyMatchingPipeline.builder()
                    .sourceFeed(sourceFeed)
                    .writer(new JdbcUnifiedCompanyWriter(dataSource))
                    .context(new PipelineContext(OracleAvailability.unavailable("off"), auditLog,
                            new NoOpMetricsService()))
                    .build();

            RunSummary summary = pipeline.run();

            verify(sourceFeed).load();
            assertEquals(2, summary.webMentions());
        }

        @Test
        @DisplayName("run() without a source feed is rejected")
        void runWithoutFeed() {
            CompanyMatchingPipeline pipeline = pipeline(OracleAvailability.unavailable("off"), MatchingOptions.defaults());

            assertThrows(IllegalStateException.class, pipeline::run);
        }

        @Test
        @DisplayName("Write failures propagate to the caller")
        void writeFailurePropagates() {
            when(writer.write(anyList())).thenThrow(new UnificationWriteException("disk full", null));
            CompanyMatchingPipeline pipeline = CompanyMatchingPipeline.builder()
                    .writer(writer)
                    .context(new PipelineContext(OracleAvailability.unavailable("off"), auditLog,
                            new NoOpMetricsService()))
                    .build();

            assertThrows(UnificationWriteException.class, () -> pipeline.run(acmeScenario));
        }

        @Test
        @DisplayName("Builder requires a writer and a context")
        void builderValidation() {
            assertThrows(NullPointerException.class, () -> CompanyMatchingPipeline.builder()
                    .context(new PipelineContext(OracleAvailability.unavailable("off"), auditLog,
                            new NoOpMetricsService()))
                    .build());
            assertThrows(NullPointerException.class, () -> CompanyMatchingPipeline.builder()
                    .writer(writer)
                    .build());
        }

        @Test
        @DisplayName("Options default to blanket adjudication")
        void defaultOptions() {
            CompanyMatchingPipeline pipeline = CompanyMatchingPipeline.builder()
                    .writer(writer)
                    .context(new PipelineContext(OracleAvailability.unavailable("off"), auditLog,
                            new NoOpMetricsService()))
                    .build();

            assertEquals(10, pipeline.getOptions().getOracleMaxReviews());
        }
    }

    @Test
    @DisplayName("Bucket counts are recorded in metrics")
    void recordsBucketMetrics() throws OracleException {
        when(oracle.complete(any())).thenReturn(ACCEPT_HIGH);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CompanyMatchingPipeline pipeline = CompanyMatchingPipeline.builder()
                .writer(new JdbcUnifiedCompanyWriter(dataSource))
                .context(new PipelineContext(OracleAvailability.available(oracle), auditLog,
                        new MicrometerMetricsService(registry)))
                .build();

        pipeline.run(acmeScenario);

        assertEquals(1.0, registry.find("company.match.bucket").tag("bucket", "ORACLE_ACCEPTED").counter().count());
        assertEquals(1.0, registry.find("company.match.bucket").tag("bucket", "UNMATCHED").counter().count());
        assertEquals(0.0, registry.find("company.match.bucket").tag("bucket", "DISCARDED").counter().count());
        assertEquals(1, registry.find("company.oracle.review").tag("outcome", "ACCEPTED").timer().count());
    }

    @Test
    @DisplayName("Audit file is not required to exist before the run")
    void auditFileCreatedOnDemand() throws Exception {
        when(oracle.complete(any())).thenReturn(ACCEPT_HIGH);
        auditLog = new JsonLinesOracleAuditLog(tempDir.resolve("data").resolve("llm_match_logs.jsonl"));

        pipeline(OracleAvailability.available(oracle), MatchingOptions.defaults()).run(acmeScenario);

        assertTrue(Files.exists(auditLog.getPath()));
    }
}
