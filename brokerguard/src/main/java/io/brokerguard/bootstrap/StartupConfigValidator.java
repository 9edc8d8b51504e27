package io.brokerguard.bootstrap;

import io.brokerguard.config.BrokerGuardConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Startup configuration validator.
 *
 * Called from App.main() before anything touches the database or the network.
 * Throws IllegalStateException if configuration is invalid; the service refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {
    }

    /**
     * @throws IllegalStateException listing every configuration error found
     */
    public static void validate(BrokerGuardConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Run mode: {}, production mode: {}", config.runMode(), config.productionMode());

        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            StringBuilder message = new StringBuilder("❌ INVALID CONFIG: ")
                .append(errors.size()).append(" problem(s)\n");
            for (String error : errors) {
                message.append("  - ").append(error).append('\n');
            }
            message.append("System refuses to start.");
            throw new IllegalStateException(message.toString());
        }

        if (config.runMode() == BrokerGuardConfig.RunMode.TRADING) {
            if (config.approvalBypass()) {
                warnBypass(config);
            } else {
                log.info("✓ Approval gate active: {} approver(s), timeout {}s, transport={}",
                    config.approverIds().size(), config.approvalTimeout().getSeconds(),
                    config.discordEnabled() ? "discord" : "log");
            }
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void warnBypass(BrokerGuardConfig config) {
        log.warn("════════════════════════════════════════════════════════");
        log.warn("⚠️  APPROVAL_BYPASS=true: WRITE ACTIONS RUN WITHOUT HUMAN APPROVAL");
        if (config.productionMode()) {
            log.warn("⚠️  Bypass acknowledged for PRODUCTION_MODE");
        }
        log.warn("Every bypassed action is audit-logged and counted in brokerguard_approval_bypass_total.");
        log.warn("════════════════════════════════════════════════════════");
    }
}
