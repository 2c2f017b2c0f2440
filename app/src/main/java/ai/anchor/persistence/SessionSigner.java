package ai.anchor.persistence;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signatures over the canonical encoding of a session record.
 *
 * <p>The signature covers every field except {@value #SIGNATURE_FIELD} itself and is stored Base64 encoded in that
 * field.
 */
public final class SessionSigner {
    public static final String SIGNATURE_FIELD = "signature";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    public enum Verification {
        VERIFIED,
        UNSIGNED
    }

    private final SigningKeys keys;

    public SessionSigner(SigningKeys keys) {
        this.keys = Objects.requireNonNull(keys);
    }

    /**
     * @return a copy of {@code record} with a fresh signature; any existing signature is replaced
     */
    public ObjectNode sign(ObjectNode record) {
        var unsigned = record.deepCopy();
        unsigned.remove(SIGNATURE_FIELD);
        var signature = computeSignature(CanonicalJson.encode(unsigned));
        unsigned.put(SIGNATURE_FIELD, signature);
        return unsigned;
    }

    /**
     * Check the record's signature.
     *
     * @return {@link Verification#UNSIGNED} if the record carries no signature at all
     * @throws SessionException {@code SIGNATURE_VERIFICATION_FAILED} if a signature is present but does not match
     */
    public Verification verify(ObjectNode record) throws SessionException {
        var provided = record.get(SIGNATURE_FIELD);
        if (provided == null || provided.isNull()) {
            return Verification.UNSIGNED;
        }
        if (!provided.isTextual()) {
            throw new SessionException(SessionError.SIGNATURE_VERIFICATION_FAILED, "Signature is not a string");
        }
        var unsigned = record.deepCopy();
        unsigned.remove(SIGNATURE_FIELD);
        var expected = computeSignature(CanonicalJson.encode(unsigned));
        if (!constantTimeEquals(expected, provided.asText())) {
            throw new SessionException(SessionError.SIGNATURE_VERIFICATION_FAILED, "Session signature does not match");
        }
        return Verification.VERIFIED;
    }

    String computeSignature(byte[] canonical) {
        try {
            var mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(keys.signingKey(), HMAC_ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(canonical));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to compute HMAC signature", e);
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
