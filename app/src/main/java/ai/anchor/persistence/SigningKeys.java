package ai.anchor.persistence;

import ai.anchor.util.AnchorPaths;
import ai.anchor.util.AtomicWrites;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Derives the key used to sign persisted sessions.
 *
 * <p>The key is PBKDF2-HMAC-SHA256 over an application salt, a per-machine random secret and the host name, so
 * session files copied to another machine do not verify there. The derived key is cached.
 */
public final class SigningKeys {
    private static final Logger logger = LogManager.getLogger(SigningKeys.class);

    static final String APP_SALT = "anchor_session_v1";
    static final int ITERATIONS = 100_000;
    private static final int KEY_BITS = 256;
    private static final int SECRET_BYTES = 32;

    private final AnchorPaths paths;
    private final SecureRandom rng = new SecureRandom();
    private byte @Nullable [] cachedKey;

    public SigningKeys(AnchorPaths paths) {
        this.paths = Objects.requireNonNull(paths);
    }

    public synchronized byte[] signingKey() {
        if (cachedKey == null) {
            cachedKey = deriveKey();
        }
        return cachedKey.clone();
    }

    /** Drop the cached key, forcing the next call to derive it again. */
    public synchronized void invalidate() {
        cachedKey = null;
    }

    private byte[] deriveKey() {
        var salt = APP_SALT + machineSecret() + hostname();
        var spec = new PBEKeySpec(APP_SALT.toCharArray(), salt.getBytes(StandardCharsets.UTF_8), ITERATIONS, KEY_BITS);
        try {
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Read the machine secret, creating it when missing or too short. Falls back to host-derived entropy when the
     * secret file cannot be written.
     */
    String machineSecret() {
        var path = paths.getMachineSecretPath();
        try {
            if (Files.isRegularFile(path)) {
                var existing = Files.readString(path, StandardCharsets.UTF_8).trim();
                if (existing.length() >= SECRET_BYTES) {
                    return existing;
                }
                logger.warn("Machine secret at {} is too short, regenerating", path);
            }
            var bytes = new byte[SECRET_BYTES];
            rng.nextBytes(bytes);
            var secret = HexFormat.of().formatHex(bytes);
            AtomicWrites.atomicOverwrite(path, secret.getBytes(StandardCharsets.UTF_8));
            AtomicWrites.applyOwnerOnlyPermissions(path);
            logger.info("Generated new machine secret at {}", path);
            return secret;
        } catch (IOException e) {
            logger.warn("Cannot use machine secret at {} ({}); falling back to host-derived entropy", path,
                    e.getMessage());
            return fallbackEntropy();
        }
    }

    private static String fallbackEntropy() {
        var seed = hostname() + "-" + System.getProperty("user.name", "");
        try {
            var digest = MessageDigest.getInstance("SHA-256").digest(seed.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String hostname() {
        var env = System.getenv("HOSTNAME");
        if (env != null && !env.isBlank()) {
            return env;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }
}
