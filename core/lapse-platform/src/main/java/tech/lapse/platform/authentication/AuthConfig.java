package tech.lapse.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for token signing and service secret hashing.
 *
 * Example configuration:
 * <pre>
 * lapse.auth.jwt.private-key-path=/keys/private.pem
 * lapse.auth.jwt.public-key-path=/keys/public.pem
 * lapse.auth.secret-hashing.memory-kib=65536
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "lapse.auth")
public interface AuthConfig {

    /**
     * JWT signing key configuration.
     */
    JwtConfig jwt();

    /**
     * Cost parameters for the service client secret KDF.
     */
    @WithName("secret-hashing")
    SecretHashingConfig secretHashing();

    interface JwtConfig {
        /**
         * Path to the RSA private key (PEM, PKCS#8). When either path is
         * missing a dev key pair is used.
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        /**
         * Path to the RSA public key (PEM, X.509).
         */
        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        /**
         * Directory where generated dev keys are persisted, so primary
         * tokens survive restarts during development.
         */
        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();
    }

    interface SecretHashingConfig {
        @WithDefault("3")
        int iterations();

        @WithName("memory-kib")
        @WithDefault("65536")
        int memoryKib();

        @WithDefault("1")
        int parallelism();
    }
}
