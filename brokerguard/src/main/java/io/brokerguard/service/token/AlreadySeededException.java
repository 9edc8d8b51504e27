package io.brokerguard.service.token;

/**
 * Seeding was refused because a usable credential already exists and force was not requested.
 */
public class AlreadySeededException extends TokenLifecycleException {
    private final long currentVersion;

    public AlreadySeededException(String accountKey, long currentVersion) {
        super(accountKey, "A live credential (version " + currentVersion + ") already exists; use force to replace it");
        this.currentVersion = currentVersion;
    }

    public long getCurrentVersion() {
        return currentVersion;
    }
}
