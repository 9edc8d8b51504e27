package io.brokerguard.config;

import io.brokerguard.config.BrokerGuardConfig.RunMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Startup validation rules per run mode.
 */
class BrokerGuardConfigTest {

    private static BrokerGuardConfig config(RunMode mode, Set<String> approvers, boolean bypass, boolean acknowledged,
                                            boolean production, String discordBot, String discordKey,
                                            String adminToken, String callbackUrl) {
        return config(mode, approvers, bypass, acknowledged, production, discordBot, discordKey, adminToken,
            callbackUrl, Duration.ofSeconds(30), Duration.ofSeconds(10), Duration.ofSeconds(15));
    }

    private static BrokerGuardConfig config(RunMode mode, Set<String> approvers, boolean bypass, boolean acknowledged,
                                            boolean production, String discordBot, String discordKey,
                                            String adminToken, String callbackUrl,
                                            Duration lease, Duration connectTimeout, Duration requestTimeout) {
        return new BrokerGuardConfig(
            mode, 8080,
            "jdbc:postgresql://localhost:5432/brokerguard", "postgres", "", 10,
            "acct-1", "client-id", "client-secret", callbackUrl, "https://api.schwabapi.com",
            Duration.ofSeconds(60), Duration.ofHours(168), lease, 4,
            Duration.ofMillis(500), Duration.ofMillis(8000), Duration.ofSeconds(60), Duration.ofMinutes(15),
            connectTimeout, requestTimeout, Duration.ofSeconds(5),
            Duration.ofSeconds(600), Duration.ofSeconds(5), Duration.ofSeconds(30),
            approvers, bypass, acknowledged,
            discordBot, discordBot.isBlank() ? "" : "123456", discordKey,
            adminToken, production
        );
    }

    private static BrokerGuardConfig trading(Set<String> approvers, boolean bypass, boolean acknowledged,
                                             boolean production, String adminToken) {
        return config(RunMode.TRADING, approvers, bypass, acknowledged, production, "", "", adminToken, "");
    }

    @Test
    void testValidTradingConfig() {
        assertTrue(trading(Set.of("4242"), false, false, true, "admin-token").validate().isEmpty());
    }

    @Test
    void testApproversRequiredUnlessBypassed() {
        List<String> errors = trading(Set.of(), false, false, false, "admin-token").validate();

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("APPROVAL_APPROVERS"));
        assertTrue(trading(Set.of(), true, false, false, "").validate().isEmpty());
    }

    @Test
    void testBypassInProductionNeedsAcknowledgement() {
        List<String> errors = trading(Set.of(), true, false, true, "").validate();

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("APPROVAL_BYPASS_ACKNOWLEDGED"));
        assertTrue(trading(Set.of(), true, true, true, "").validate().isEmpty());
    }

    @Test
    void testHttpDecisionsNeedAdminToken() {
        List<String> errors = trading(Set.of("4242"), false, false, false, "").validate();

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("ADMIN_API_TOKEN"));
    }

    @Test
    void testDiscordNeedsPublicKey() {
        BrokerGuardConfig withoutKey = config(RunMode.TRADING, Set.of("4242"), false, false, false,
            "bot-token", "", "", "");
        BrokerGuardConfig withKey = config(RunMode.TRADING, Set.of("4242"), false, false, false,
            "bot-token", "ab".repeat(32), "", "");

        assertTrue(withoutKey.discordEnabled());
        assertEquals(List.of("DISCORD_PUBLIC_KEY is required to verify Discord interactions"), withoutKey.validate());
        assertTrue(withKey.validate().isEmpty());
    }

    @Test
    void testLeaseMustOutlastOAuthTimeouts() {
        List<String> errors = config(RunMode.TRADING, Set.of("4242"), false, false, false, "", "", "admin-token", "",
            Duration.ofSeconds(25), Duration.ofSeconds(10), Duration.ofSeconds(15)).validate();

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("REFRESH_LEASE_SECONDS (25s) must be greater than"), errors.get(0));

        assertTrue(config(RunMode.TRADING, Set.of("4242"), false, false, false, "", "", "admin-token", "",
            Duration.ofSeconds(26), Duration.ofSeconds(10), Duration.ofSeconds(15)).validate().isEmpty());
        assertEquals(1, config(RunMode.TRADING, Set.of("4242"), false, false, false, "", "", "admin-token", "",
            Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofSeconds(40)).validate().size());
    }

    @Test
    void testAdminModeRequirements() {
        List<String> errors = config(RunMode.ADMIN, Set.of(), false, false, false, "", "", "", "").validate();

        assertEquals(2, errors.size());
        assertTrue(config(RunMode.ADMIN, Set.of(), false, false, false, "", "", "tok",
            "https://admin.test/admin/oauth/callback").validate().isEmpty());
    }

    @Test
    void testRunModeParsing() {
        assertEquals(RunMode.TRADING, RunMode.parse(null));
        assertEquals(RunMode.TRADING, RunMode.parse(" "));
        assertEquals(RunMode.ADMIN, RunMode.parse(" admin "));
        assertThrows(IllegalArgumentException.class, () -> RunMode.parse("batch"));
    }
}
