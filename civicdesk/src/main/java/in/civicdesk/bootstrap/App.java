package in.civicdesk.bootstrap;

import in.civicdesk.auth.AuthService;
import in.civicdesk.auth.JwtAuthenticator;
import in.civicdesk.auth.PasswordHasher;
import in.civicdesk.config.AppConfig;
import in.civicdesk.domain.repository.IssueRepository;
import in.civicdesk.domain.repository.UserRepository;
import in.civicdesk.metrics.PrometheusIssueMetrics;
import in.civicdesk.repository.InMemoryIssueRepository;
import in.civicdesk.repository.InMemoryUserRepository;
import in.civicdesk.service.classification.DefaultIssueClassifier;
import in.civicdesk.service.escalation.EscalationScheduler;
import in.civicdesk.service.issue.IssueLifecycleService;
import in.civicdesk.service.media.SizeHeuristicMediaGate;
import in.civicdesk.transport.http.ApiHandlers;
import in.civicdesk.transport.http.ApiRoutes;
import in.civicdesk.transport.http.PrometheusMetricsHandler;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the in-memory stores, auth, issue lifecycle and escalation scheduler,
 * then serves the HTTP API on Undertow.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== CivicDesk Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        AppConfig config = AppConfig.fromEnv();
        Clock clock = Clock.systemUTC();

        if (config.usesDevSecret()) {
            log.warn("TOKEN_SECRET not set, using the development secret");
        }

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusIssueMetrics metrics = new PrometheusIssueMetrics(new CollectorRegistry());
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Stores
        // ═══════════════════════════════════════════════════════════════
        UserRepository userRepo = new InMemoryUserRepository();
        IssueRepository issueRepo = new InMemoryIssueRepository();

        // ═══════════════════════════════════════════════════════════════
        // Auth
        // ═══════════════════════════════════════════════════════════════
        JwtAuthenticator authenticator = new JwtAuthenticator(config.tokenSecret(), config.tokenTtl(), clock);
        AuthService authService = new AuthService(userRepo, authenticator, new PasswordHasher(), metrics, clock);

        if (config.seedsAdmin()) {
            authService.ensureAdmin(config.adminEmail(), config.adminPassword());
        }
        log.info("✓ Auth service initialized (token expiry: {})",
            config.tokenTtl().isZero() ? "none" : config.tokenTtl());

        // ═══════════════════════════════════════════════════════════════
        // Issue lifecycle + escalation
        // ═══════════════════════════════════════════════════════════════
        IssueLifecycleService issueService = new IssueLifecycleService(
            issueRepo, new SizeHeuristicMediaGate(config.minPhotoBytes()), metrics, clock);

        EscalationScheduler escalationScheduler = new EscalationScheduler(
            issueRepo, issueService, metrics, clock,
            config.escalationPeriod(), config.escalationStaleAfter(), config.escalationDepartment());
        escalationScheduler.start();
        log.info("✓ Escalation scheduler started");

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        ApiHandlers api = new ApiHandlers(authService, issueService, new DefaultIssueClassifier());

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setServerOption(UndertowOptions.MAX_ENTITY_SIZE, config.maxBodyBytes())
            .setServerOption(UndertowOptions.RECORD_REQUEST_START_TIME, true)
            .setHandler(ApiRoutes.build(api, new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();

        server.start();
        log.info("CivicDesk API listening on http://localhost:{}/", config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            escalationScheduler.stop();
            server.stop();
        }, "shutdown"));
    }

    private App() {}
}
