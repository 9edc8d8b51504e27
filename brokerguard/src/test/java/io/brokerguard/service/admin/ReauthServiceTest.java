package io.brokerguard.service.admin;

import io.brokerguard.domain.credential.Credential;
import io.brokerguard.domain.credential.OAuthTokens;
import io.brokerguard.domain.model.OAuthState;
import io.brokerguard.infrastructure.oauth.OAuthEndpoint;
import io.brokerguard.infrastructure.oauth.OAuthExchangeException;
import io.brokerguard.repository.OAuthStateRepository;
import io.brokerguard.service.token.TokenLifecycleManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Admin re-authentication callback handling.
 *
 * Tests:
 * - Authorize URL carries a freshly stored state
 * - Unknown, expired, used and foreign states are refused before any exchange
 * - State is consumed before the code exchange
 * - Successful exchange force-seeds the credential
 */
@ExtendWith(MockitoExtension.class)
class ReauthServiceTest {

    private static final String ACCOUNT = "acct-1";
    private static final String CALLBACK = "https://admin.test/admin/oauth/callback";

    @Mock
    private OAuthStateRepository stateRepo;
    @Mock
    private OAuthEndpoint oauth;
    @Mock
    private TokenLifecycleManager tokens;
    private ReauthService service;

    @BeforeEach
    void setUp() {
        lenient().when(tokens.getAccountKey()).thenReturn(ACCOUNT);
        service = new ReauthService(stateRepo, oauth, tokens, CALLBACK, Duration.ofMinutes(15));
    }

    private static OAuthState state(String value, String account, Instant expiresAt, Instant usedAt) {
        return new OAuthState(value, account, Instant.now().minusSeconds(60), expiresAt, usedAt, null);
    }

    @Test
    void testStartLoginStoresState() {
        when(stateRepo.generateState(ACCOUNT, Duration.ofMinutes(15))).thenReturn("st-1");
        when(oauth.authorizeUrl(CALLBACK, "st-1")).thenReturn("https://broker.test/authorize?state=st-1");

        assertEquals("https://broker.test/authorize?state=st-1", service.startLogin());
    }

    @Test
    void testMissingParameters() {
        assertEquals("MISSING_PARAMS", service.completeLogin(null, "st-1").errorCode());
        assertEquals("MISSING_PARAMS", service.completeLogin("code", " ").errorCode());
        verifyNoInteractions(stateRepo, oauth);
    }

    @Test
    void testUnknownState() {
        when(stateRepo.findByState("nope")).thenReturn(Optional.empty());

        ReauthService.ExchangeResult result = service.completeLogin("code", "nope");

        assertFalse(result.success());
        assertEquals("STATE_NOT_FOUND", result.errorCode());
        verify(oauth, never()).exchangeAuthorizationCode(anyString(), anyString());
    }

    @Test
    void testExpiredState() {
        when(stateRepo.findByState("st-1"))
            .thenReturn(Optional.of(state("st-1", ACCOUNT, Instant.now().minusSeconds(1), null)));

        assertEquals("STATE_EXPIRED", service.completeLogin("code", "st-1").errorCode());
        verify(stateRepo, never()).markUsed(anyString());
    }

    @Test
    void testUsedState() {
        Instant later = Instant.now().plusSeconds(600);
        when(stateRepo.findByState("st-1"))
            .thenReturn(Optional.of(state("st-1", ACCOUNT, later, Instant.now().minusSeconds(5))));

        assertEquals("STATE_ALREADY_USED", service.completeLogin("code", "st-1").errorCode());
    }

    @Test
    void testConcurrentCallbackLosesMarkUsed() {
        when(stateRepo.findByState("st-1"))
            .thenReturn(Optional.of(state("st-1", ACCOUNT, Instant.now().plusSeconds(600), null)));
        when(stateRepo.markUsed("st-1")).thenReturn(false);

        assertEquals("STATE_ALREADY_USED", service.completeLogin("code", "st-1").errorCode());
        verify(oauth, never()).exchangeAuthorizationCode(anyString(), anyString());
    }

    @Test
    void testStateForAnotherAccount() {
        when(stateRepo.findByState("st-1"))
            .thenReturn(Optional.of(state("st-1", "acct-2", Instant.now().plusSeconds(600), null)));

        assertEquals("STATE_ACCOUNT_MISMATCH", service.completeLogin("code", "st-1").errorCode());
    }

    @Test
    void testExchangeFailure() {
        when(stateRepo.findByState("st-1"))
            .thenReturn(Optional.of(state("st-1", ACCOUNT, Instant.now().plusSeconds(600), null)));
        when(stateRepo.markUsed("st-1")).thenReturn(true);
        when(oauth.exchangeAuthorizationCode("code", CALLBACK))
            .thenThrow(new OAuthExchangeException("invalid_grant", false, 400));

        ReauthService.ExchangeResult result = service.completeLogin("code", "st-1");

        assertEquals("TOKEN_EXCHANGE_FAILED", result.errorCode());
        verify(tokens, never()).seed(any(OAuthTokens.class), anyBoolean(), anyString());
    }

    @Test
    void testExchangeWithoutRefreshToken() {
        when(stateRepo.findByState("st-1"))
            .thenReturn(Optional.of(state("st-1", ACCOUNT, Instant.now().plusSeconds(600), null)));
        when(stateRepo.markUsed("st-1")).thenReturn(true);
        when(oauth.exchangeAuthorizationCode("code", CALLBACK))
            .thenReturn(new OAuthTokens("access", null, Duration.ofMinutes(30), null));

        assertEquals("TOKEN_EXCHANGE_FAILED", service.completeLogin("code", "st-1").errorCode());
    }

    @Test
    void testSuccessfulExchangeSeedsCredential() {
        Instant now = Instant.now();
        OAuthTokens exchanged = new OAuthTokens("access", "refresh", Duration.ofMinutes(30), null);
        Credential seeded = Credential.seeded(ACCOUNT, exchanged, now, Duration.ofDays(7), 4, "admin-oauth");
        when(stateRepo.findByState("st-1"))
            .thenReturn(Optional.of(state("st-1", ACCOUNT, now.plusSeconds(600), null)));
        when(stateRepo.markUsed("st-1")).thenReturn(true);
        when(oauth.exchangeAuthorizationCode("code", CALLBACK)).thenReturn(exchanged);
        when(tokens.seed(exchanged, true, "admin-oauth")).thenReturn(seeded);

        ReauthService.ExchangeResult result = service.completeLogin("code", "st-1");

        assertTrue(result.success());
        assertEquals(ACCOUNT, result.accountKey());
        assertEquals(4L, result.version());
        assertEquals(now.plus(Duration.ofDays(7)), result.refreshExpiresAt());

        var order = inOrder(stateRepo, oauth, tokens);
        order.verify(stateRepo).markUsed("st-1");
        order.verify(oauth).exchangeAuthorizationCode("code", CALLBACK);
        order.verify(tokens).seed(exchanged, true, "admin-oauth");
    }
}
