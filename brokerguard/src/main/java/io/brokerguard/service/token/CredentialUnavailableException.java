package io.brokerguard.service.token;

/**
 * No credential has been seeded yet. Brokerage calls fail until an operator completes the admin OAuth flow.
 */
public class CredentialUnavailableException extends TokenLifecycleException {
    public CredentialUnavailableException(String accountKey) {
        super(accountKey, "No credential stored; complete the admin OAuth flow to seed one");
    }
}
