package io.brokerguard.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.brokerguard.auth.AdminTokenGuard;
import io.brokerguard.config.BrokerGuardConfig;
import io.brokerguard.config.BrokerGuardConfig.RunMode;
import io.brokerguard.infrastructure.metrics.PrometheusGuardMetrics;
import io.brokerguard.infrastructure.metrics.PrometheusMetricsHandler;
import io.brokerguard.infrastructure.oauth.SchwabOAuthClient;
import io.brokerguard.integration.discord.DiscordDecisionTransport;
import io.brokerguard.integration.discord.DiscordInteractionHandler;
import io.brokerguard.integration.discord.DiscordInteractionProcessor;
import io.brokerguard.integration.discord.DiscordSettings;
import io.brokerguard.integration.discord.DiscordSignatureVerifier;
import io.brokerguard.migration.SchemaMigration;
import io.brokerguard.repository.ApprovalStore;
import io.brokerguard.repository.CredentialStore;
import io.brokerguard.repository.OAuthStateRepository;
import io.brokerguard.repository.PostgresApprovalStore;
import io.brokerguard.repository.PostgresCredentialStore;
import io.brokerguard.security.SecureAuditLogger;
import io.brokerguard.service.admin.ReauthService;
import io.brokerguard.service.approval.ApprovalExpirySweeper;
import io.brokerguard.service.approval.ApprovalGate;
import io.brokerguard.service.approval.ApprovalPolicy;
import io.brokerguard.service.approval.DecisionTransport;
import io.brokerguard.service.approval.LoggingDecisionTransport;
import io.brokerguard.service.execution.GuardedActionExecutor;
import io.brokerguard.service.token.TokenLifecycleManager;
import io.brokerguard.service.token.TokenPolicy;
import io.brokerguard.transport.http.AdminHandler;
import io.brokerguard.transport.http.ApprovalHandler;
import io.brokerguard.transport.http.StatusHandler;
import io.brokerguard.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * BrokerGuard entry point.
 *
 * RUN_MODE=TRADING: token lifecycle + approval gate + Discord/HTTP decisions.
 * RUN_MODE=ADMIN:   token lifecycle + interactive re-authentication.
 *
 * Both modes share one PostgreSQL database; every replica may run concurrently.
 * {@link #start} runs the same wiring in-process and hands back a {@link BrokerGuard}.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== BrokerGuard Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        BrokerGuard guard = start(BrokerGuardConfig.fromEnv());
        Runtime.getRuntime().addShutdownHook(new Thread(guard::stop, "shutdown-hook"));
    }

    /**
     * Validate {@code config}, migrate the schema and start every component of its run mode, HTTP server included.
     * A process embedding BrokerGuard calls this instead of {@link #main} and sends mutating tool calls through
     * {@link BrokerGuard#actions()}.
     *
     * @throws IllegalStateException the configuration is invalid
     */
    public static BrokerGuard start(BrokerGuardConfig config) {
        StartupConfigValidator.validate(config);

        RunMode runMode = config.runMode();
        String replicaId = Env.get("REPLICA_ID",
            runMode.name().toLowerCase() + "-" + UUID.randomUUID().toString().substring(0, 8));
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        new SchemaMigration(dataSource).migrate();

        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusGuardMetrics metrics = new PrometheusGuardMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Token Lifecycle
        // ═══════════════════════════════════════════════════════════════
        CredentialStore credentialStore = new PostgresCredentialStore(dataSource, config.accountKey());
        SchwabOAuthClient oauthClient = new SchwabOAuthClient(
            config.brokerBaseUrl(), config.clientId(), config.clientSecret(),
            config.oauthConnectTimeout(), config.oauthRequestTimeout(), mapper, metrics);
        TokenLifecycleManager tokens = new TokenLifecycleManager(
            credentialStore, oauthClient, TokenPolicy.fromConfig(config), clock, metrics,
            new SecureAuditLogger("TokenLifecycle"), replicaId);
        tokens.start();
        log.info("✓ Token lifecycle manager started (account={}, replica={})", config.accountKey(), replicaId);

        // ═══════════════════════════════════════════════════════════════
        // Approval Gate
        // ═══════════════════════════════════════════════════════════════
        ApprovalStore approvalStore = new PostgresApprovalStore(dataSource, mapper);
        DiscordDecisionTransport discordTransport = null;
        DecisionTransport transport;
        if (runMode == RunMode.TRADING && config.discordEnabled()) {
            discordTransport = new DiscordDecisionTransport(DiscordSettings.fromConfig(config), mapper);
            transport = discordTransport;
        } else {
            transport = new LoggingDecisionTransport();
        }
        ApprovalGate gate = new ApprovalGate(approvalStore, transport, ApprovalPolicy.fromConfig(config), clock,
            metrics, new SecureAuditLogger("ApprovalGate"));

        ApprovalExpirySweeper sweeper = null;
        ExecutorService actionPool = null;
        GuardedActionExecutor actions = null;
        if (runMode == RunMode.TRADING) {
            sweeper = new ApprovalExpirySweeper(approvalStore, gate, clock, config.approvalSweepInterval());
            sweeper.start();
            actionPool = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "GuardedAction");
                t.setDaemon(true);
                return t;
            });
            actions = new GuardedActionExecutor(gate, tokens, actionPool);
            log.info("✓ Approval gate ready (transport={}, bypass={})", transport.name(), config.approvalBypass());
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP Routes
        // ═══════════════════════════════════════════════════════════════
        AdminTokenGuard adminGuard = new AdminTokenGuard(config.adminApiToken());
        StatusHandler statusHandler = new StatusHandler(tokens, approvalStore, gate, mapper, clock, runMode.name());
        ApprovalHandler approvalHandler = new ApprovalHandler(gate, mapper);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/api/health", statusHandler::health)
            .get("/api/status/credential", blocking(statusHandler::credential))
            .get("/api/status/credential/history", blocking(statusHandler::credentialHistory))
            .get("/api/status/approvals", blocking(statusHandler::approvals))
            .get("/api/approvals/{id}", blocking(approvalHandler::getApproval));

        ScheduledExecutorService maintenance = null;
        if (runMode == RunMode.TRADING) {
            routes.post("/api/approvals/{id}/decision", adminGuard.protect(blocking(approvalHandler::postDecision)));
            if (discordTransport != null) {
                DiscordInteractionProcessor processor = new DiscordInteractionProcessor(gate, mapper);
                DiscordSignatureVerifier verifier = new DiscordSignatureVerifier(config.discordPublicKey());
                routes.post("/api/discord/interactions", new DiscordInteractionHandler(verifier, processor, mapper));
                log.info("✓ Discord interactions endpoint registered");
            }
        } else {
            OAuthStateRepository stateRepo = new OAuthStateRepository(dataSource);
            ReauthService reauth = new ReauthService(stateRepo, oauthClient, tokens, config.callbackUrl(),
                config.oauthStateTtl());
            AdminHandler adminHandler = new AdminHandler(reauth, tokens, mapper);

            routes.get("/admin/schwab/auth", adminGuard.protect(blocking(adminHandler::startAuth)))
                .get("/admin/oauth/callback", blocking(adminHandler::callback))
                .post("/admin/credential/refresh", adminGuard.protect(blocking(adminHandler::forceRefresh)));

            maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "OAuthStateCleanup");
                t.setDaemon(true);
                return t;
            });
            maintenance.scheduleWithFixedDelay(() -> {
                try {
                    reauth.cleanupExpiredStates();
                } catch (RuntimeException e) {
                    log.warn("[OAUTH] State cleanup failed: {}", e.getMessage());
                }
            }, 1, 60, TimeUnit.MINUTES);
            log.info("✓ Admin re-authentication endpoints registered");
        }

        routes.setFallbackHandler(exchange -> {
            exchange.setStatusCode(404);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send(
                "BrokerGuard (" + runMode + ")\n\n" +
                "Status: GET /api/health, /api/status/credential, /api/status/credential/history, /api/status/approvals\n" +
                "Metrics: GET /metrics\n"
            );
        });

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        int port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        log.info("✓ HTTP API server started on port {} (mode={})", port, runMode);

        ApprovalExpirySweeper sweeperRef = sweeper;
        ScheduledExecutorService maintenanceRef = maintenance;
        ExecutorService actionPoolRef = actionPool;
        return new BrokerGuard(runMode, port, tokens, gate, actions, () -> {
            log.info("Shutting down BrokerGuard...");
            server.stop();
            if (sweeperRef != null) {
                sweeperRef.stop();
            }
            if (maintenanceRef != null) {
                maintenanceRef.shutdownNow();
            }
            gate.shutdown();
            if (actionPoolRef != null) {
                actionPoolRef.shutdownNow();
            }
            tokens.shutdown();
            dataSource.close();
            log.info("✓ BrokerGuard stopped");
        });
    }

    private static HttpHandler blocking(HttpHandler handler) {
        return new BlockingHandler(handler);
    }

    private static HikariDataSource createDataSource(BrokerGuardConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPassword());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("brokerguard-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }
}
