package io.brokerguard.integration.discord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.HexFormat;

/**
 * Verifies Discord interaction requests: Ed25519 over (timestamp + raw body) with the application public key.
 */
public class DiscordSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(DiscordSignatureVerifier.class);

    // DER SubjectPublicKeyInfo prefix for a raw 32-byte Ed25519 key
    private static final byte[] ED25519_X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");

    private final PublicKey publicKey;

    public DiscordSignatureVerifier(String publicKeyHex) {
        this.publicKey = decodePublicKey(publicKeyHex);
    }

    public boolean verify(String signatureHex, String timestamp, byte[] body) {
        if (signatureHex == null || timestamp == null || body == null) {
            return false;
        }
        try {
            byte[] signatureBytes = HexFormat.of().parseHex(signatureHex);
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(publicKey);
            verifier.update(timestamp.getBytes(StandardCharsets.UTF_8));
            verifier.update(body);
            return verifier.verify(signatureBytes);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.warn("[DISCORD] Rejected interaction signature: {}", e.getMessage());
            return false;
        }
    }

    static PublicKey decodePublicKey(String publicKeyHex) {
        byte[] raw = HexFormat.of().parseHex(publicKeyHex.trim());
        if (raw.length != 32) {
            throw new IllegalArgumentException("Discord public key must be 32 bytes, got " + raw.length);
        }
        byte[] encoded = new byte[ED25519_X509_PREFIX.length + raw.length];
        System.arraycopy(ED25519_X509_PREFIX, 0, encoded, 0, ED25519_X509_PREFIX.length);
        System.arraycopy(raw, 0, encoded, ED25519_X509_PREFIX.length, raw.length);
        try {
            return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid Discord public key", e);
        }
    }
}
