package com.company.matching.cdi;

import com.company.matching.api.CompanyMatchingPipeline;
import com.company.matching.api.MatchingOptions;
import com.company.matching.api.PipelineContext;
import com.company.matching.audit.JsonLinesOracleAuditLog;
import com.company.matching.classify.BelowThresholdPolicy;
import com.company.matching.classify.MatchingPolicy;
import com.company.matching.metrics.MetricsService;
import com.company.matching.metrics.MicrometerMetricsService;
import com.company.matching.oracle.OracleAvailability;
import com.company.matching.oracle.OracleConnector;
import com.company.matching.oracle.OracleSettings;
import com.company.matching.persistence.JdbcUnifiedCompanyWriter;
import com.company.matching.persistence.UnifiedCompanyMapper;
import com.company.matching.source.JdbcSourceFeed;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer that wires the matching pipeline from MicroProfile Config properties.
 *
 * <h2>Required configuration</h2>
 * <pre>
 * company-matching:
 *   datasource:
 *     url: jdbc:postgresql://localhost:5432/companies
 *     username: matcher
 *     password: secret
 * </pre>
 *
 * <p>The OpenAI key is read from {@code OPENAI_API_KEY}. Without it the pipeline still runs,
 * but ambiguous candidates are left unreviewed.</p>
 */
@ApplicationScoped
public class CompanyMatchingProducer {

    private static final Logger log = LoggerFactory.getLogger(CompanyMatchingProducer.class);

    // ── Data source ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "company-matching.datasource.url")
    String jdbcUrl;

    @Inject
    @ConfigProperty(name = "company-matching.datasource.username")
    Optional<String> jdbcUsername;

    @Inject
    @ConfigProperty(name = "company-matching.datasource.password")
    Optional<String> jdbcPassword;

    @Inject
    @ConfigProperty(name = "company-matching.datasource.max-pool-size", defaultValue = "5")
    int maxPoolSize;

    // ── Sampling ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "company-matching.source.registry-sample-modulus", defaultValue = "5000")
    int registrySampleModulus;

    @Inject
    @ConfigProperty(name = "company-matching.source.web-sample-modulus", defaultValue = "20")
    int webSampleModulus;

    // ── Classification ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "company-matching.matching.policy", defaultValue = "blanket_adjudicate")
    String policy;

    @Inject
    @ConfigProperty(name = "company-matching.matching.high-threshold", defaultValue = "95")
    double highThreshold;

    @Inject
    @ConfigProperty(name = "company-matching.matching.low-threshold", defaultValue = "0")
    double lowThreshold;

    @Inject
    @ConfigProperty(name = "company-matching.matching.below-threshold", defaultValue = "adjudicate")
    String belowThreshold;

    // ── Oracle ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "company-matching.oracle.enabled", defaultValue = "true")
    boolean oracleEnabled;

    @Inject
    @ConfigProperty(name = "company-matching.oracle.provider", defaultValue = "openai")
    String oracleProvider;

    @Inject
    @ConfigProperty(name = "OPENAI_API_KEY")
    Optional<String> openAiApiKey;

    @Inject
    @ConfigProperty(name = "company-matching.oracle.base-url")
    Optional<String> oracleBaseUrl;

    @Inject
    @ConfigProperty(name = "company-matching.oracle.model", defaultValue = "gpt-4.1-mini")
    String oracleModel;

    @Inject
    @ConfigProperty(name = "company-matching.oracle.temperature", defaultValue = "0.1")
    double oracleTemperature;

    @Inject
    @ConfigProperty(name = "company-matching.oracle.timeout-seconds", defaultValue = "60")
    int oracleTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "company-matching.oracle.max-reviews", defaultValue = "10")
    int oracleMaxReviews;

    @Inject
    @ConfigProperty(name = "company-matching.oracle.audit-log", defaultValue = "data/llm_match_logs.jsonl")
    String auditLogPath;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public HikariDataSource dataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        jdbcUsername.ifPresent(config::setUsername);
        jdbcPassword.ifPresent(config::setPassword);
        config.setMaximumPoolSize(maxPoolSize);
        config.setPoolName("company-matching");
        log.info("Producing DataSource: url={} maxPoolSize={}", jdbcUrl, maxPoolSize);
        return new HikariDataSource(config);
    }

    public void closeDataSource(@Disposes HikariDataSource dataSource) {
        log.info("Closing DataSource");
        dataSource.close();
    }

    @Produces
    @ApplicationScoped
    public MatchingOptions matchingOptions() {
        MatchingOptions options = MatchingOptions.builder()
                .policy(MatchingPolicy.valueOf(policy.toUpperCase(Locale.ROOT)))
                .highThreshold(highThreshold)
                .lowThreshold(lowThreshold)
                .belowThresholdPolicy(BelowThresholdPolicy.valueOf(belowThreshold.toUpperCase(Locale.ROOT)))
                .oracleMaxReviews(oracleMaxReviews)
                .build();
        log.info("Matching options: {}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public OracleAvailability oracleAvailability() {
        OracleSettings settings = OracleSettings.builder()
                .enabled(oracleEnabled)
                .provider(oracleProvider)
                .apiKey(openAiApiKey.orElse(null))
                .baseUrl(oracleBaseUrl.orElse(null))
                .model(oracleModel)
                .temperature(oracleTemperature)
                .timeout(Duration.ofSeconds(oracleTimeoutSeconds))
                .build();
        OracleAvailability availability = new OracleConnector().connect(settings);
        log.info("Oracle availability: {}", availability);
        return availability;
    }

    @Produces
    @ApplicationScoped
    public PipelineContext pipelineContext(OracleAvailability availability) {
        MetricsService metrics = meterRegistry.isResolvable()
                ? new MicrometerMetricsService(meterRegistry.get())
                : new MicrometerMetricsService(new SimpleMeterRegistry());
        return new PipelineContext(availability, new JsonLinesOracleAuditLog(Path.of(auditLogPath)), metrics);
    }

    @Produces
    @ApplicationScoped
    public CompanyMatchingPipeline companyMatchingPipeline(HikariDataSource dataSource, MatchingOptions options,
                                                           PipelineContext context) {
        return CompanyMatchingPipeline.builder()
                .sourceFeed(new JdbcSourceFeed(dataSource, registrySampleModulus, webSampleModulus))
                .writer(new JdbcUnifiedCompanyWriter(dataSource, new UnifiedCompanyMapper(),
                        context.getMetricsService()))
                .context(context)
                .options(options)
                .build();
    }
}
