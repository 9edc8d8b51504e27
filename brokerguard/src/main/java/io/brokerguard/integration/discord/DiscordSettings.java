package io.brokerguard.integration.discord;

import io.brokerguard.config.BrokerGuardConfig;

/**
 * Discord bot configuration for approval notifications.
 *
 * @param publicKeyHex application public key (hex) used to verify interaction signatures
 */
public record DiscordSettings(
    String botToken,
    String channelId,
    String publicKeyHex,
    String apiBaseUrl
) {
    public static final String DEFAULT_API_BASE = "https://discord.com/api/v10";

    public static DiscordSettings fromConfig(BrokerGuardConfig config) {
        return new DiscordSettings(
            config.discordBotToken(),
            config.discordChannelId(),
            config.discordPublicKey(),
            DEFAULT_API_BASE
        );
    }

    @Override
    public String toString() {
        return "DiscordSettings[channelId=" + channelId + ", apiBaseUrl=" + apiBaseUrl + "]";
    }
}
