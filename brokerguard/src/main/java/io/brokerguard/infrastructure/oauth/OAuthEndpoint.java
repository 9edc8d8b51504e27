package io.brokerguard.infrastructure.oauth;

import io.brokerguard.domain.credential.OAuthTokens;

/**
 * The brokerage's OAuth token endpoint.
 */
public interface OAuthEndpoint {

    /**
     * Exchange a refresh token for a new access token (and possibly a rotated refresh token).
     *
     * @throws OAuthExchangeException transient for network errors / 429 / 5xx, non-transient when the token is rejected
     */
    OAuthTokens exchangeRefreshToken(String refreshToken);

    /**
     * Exchange an authorization code from the interactive login for the first token pair.
     */
    OAuthTokens exchangeAuthorizationCode(String code, String redirectUri);

    /**
     * URL the operator's browser is sent to for interactive login.
     */
    String authorizeUrl(String redirectUri, String state);
}
