package tech.lapse.platform.serviceclient;

import de.mkammerer.argon2.Argon2Advanced;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.lapse.platform.authentication.AuthConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Hashes and verifies service client secrets with Argon2id.
 *
 * <p>Stored form is {@code "<saltHex>:<derivedKeyHex>"}: a 16-byte random salt
 * and a 64-byte raw Argon2id output. Verification recomputes the derived key
 * with the stored salt and compares in constant time. Every failure (malformed
 * stored value, wrong length, wrong secret) is a plain non-match.
 *
 * <p>The cost parameters are not part of the stored value; changing them
 * invalidates existing secrets, which then have to be rotated.
 */
@Singleton
public class ServiceSecretHasher {

    private static final int SALT_LENGTH = 16;
    private static final int KEY_LENGTH = 64;
    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final Argon2Advanced argon2;
    private final int iterations;
    private final int memoryKib;
    private final int parallelism;

    @Inject
    public ServiceSecretHasher(AuthConfig authConfig) {
        this(authConfig.secretHashing().iterations(),
            authConfig.secretHashing().memoryKib(),
            authConfig.secretHashing().parallelism());
    }

    public ServiceSecretHasher(int iterations, int memoryKib, int parallelism) {
        this.argon2 = Argon2Factory.createAdvanced(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, KEY_LENGTH);
        this.iterations = iterations;
        this.memoryKib = memoryKib;
        this.parallelism = parallelism;
    }

    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret cannot be null or empty");
        }
        byte[] salt = new byte[SALT_LENGTH];
        SECURE_RANDOM.nextBytes(salt);
        byte[] derived = derive(secret, salt);
        return HEX.formatHex(salt) + ":" + HEX.formatHex(derived);
    }

    public boolean verify(String secret, String stored) {
        if (secret == null || stored == null) {
            return false;
        }
        int separator = stored.indexOf(':');
        if (separator <= 0 || separator == stored.length() - 1) {
            return false;
        }
        try {
            byte[] salt = HEX.parseHex(stored.substring(0, separator));
            byte[] expected = HEX.parseHex(stored.substring(separator + 1));
            if (expected.length != KEY_LENGTH) {
                return false;
            }
            byte[] actual = derive(secret, salt);
            return MessageDigest.isEqual(expected, actual);
        } catch (IllegalArgumentException e) {
            // not hex
            return false;
        }
    }

    private byte[] derive(String secret, byte[] salt) {
        char[] chars = secret.toCharArray();
        try {
            return argon2.rawHash(iterations, memoryKib, parallelism, chars, StandardCharsets.UTF_8, salt);
        } finally {
            argon2.wipeArray(chars);
        }
    }
}
