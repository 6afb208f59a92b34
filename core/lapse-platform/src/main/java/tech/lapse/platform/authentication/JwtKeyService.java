package tech.lapse.platform.authentication;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * Holds the RSA key pair that signs primary and delegated tokens.
 *
 * Supports two modes:
 * 1. File-based keys (production) - PEM files from the configured paths
 * 2. Dev keys - loaded from, or generated into, the dev key directory
 */
@ApplicationScoped
public class JwtKeyService {

    private static final Logger LOG = Logger.getLogger(JwtKeyService.class);
    private static final int KEY_SIZE = 2048;

    @Inject
    AuthConfig authConfig;

    private RSAPrivateKey privateKey;
    private RSAPublicKey publicKey;
    private String keyId;

    @PostConstruct
    void init() {
        AuthConfig.JwtConfig jwt = authConfig.jwt();
        initialize(jwt.privateKeyPath(), jwt.publicKeyPath(), jwt.devKeyDir());
    }

    void initialize(Optional<String> privateKeyPath, Optional<String> publicKeyPath, String devKeyDir) {
        try {
            if (privateKeyPath.isPresent() && publicKeyPath.isPresent()) {
                loadKeysFromPemFiles(Path.of(privateKeyPath.get()), Path.of(publicKeyPath.get()));
            } else {
                loadOrGenerateDevKeys(Path.of(devKeyDir));
            }
            this.keyId = generateKeyId(publicKey);
            LOG.infof("JWT key service initialized with key ID: %s", keyId);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize JWT keys", e);
        }
    }

    private void loadOrGenerateDevKeys(Path keyDir) throws Exception {
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev JWT keys from %s", keyDir);
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(
                new PKCS8EncodedKeySpec(Files.readAllBytes(privateKeyFile)));
            this.publicKey = (RSAPublicKey) keyFactory.generatePublic(
                new X509EncodedKeySpec(Files.readAllBytes(publicKeyFile)));
        } else {
            LOG.infof("Generating new dev JWT keys (will be persisted to %s)", keyDir);
            generateKeyPair();
            persistDevKeys(keyDir, privateKeyFile, publicKeyFile);
        }
        LOG.warn("Using dev JWT keys. Configure lapse.auth.jwt.private-key-path and lapse.auth.jwt.public-key-path for production.");
    }

    private void persistDevKeys(Path keyDir, Path privateKeyFile, Path publicKeyFile) throws IOException {
        Files.createDirectories(keyDir);
        Files.write(privateKeyFile, privateKey.getEncoded());
        Files.write(publicKeyFile, publicKey.getEncoded());
    }

    private void loadKeysFromPemFiles(Path privateKeyFile, Path publicKeyFile) throws Exception {
        LOG.info("Loading JWT keys from files");

        byte[] privateKeyBytes = parsePemKey(Files.readString(privateKeyFile, StandardCharsets.US_ASCII), "PRIVATE KEY");
        byte[] publicKeyBytes = parsePemKey(Files.readString(publicKeyFile, StandardCharsets.US_ASCII), "PUBLIC KEY");

        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(privateKeyBytes));
        this.publicKey = (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(publicKeyBytes));
    }

    private byte[] parsePemKey(String pem, String type) {
        String base64 = pem
                .replace("-----BEGIN " + type + "-----", "")
                .replace("-----END " + type + "-----", "")
                .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    private void generateKeyPair() throws NoSuchAlgorithmException {
        KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(KEY_SIZE, new SecureRandom());
        KeyPair keyPair = keyGen.generateKeyPair();
        this.privateKey = (RSAPrivateKey) keyPair.getPrivate();
        this.publicKey = (RSAPublicKey) keyPair.getPublic();
    }

    private String generateKeyId(RSAPublicKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getEncoded());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            return UUID.randomUUID().toString().substring(0, 8);
        }
    }

    public String getKeyId() {
        return keyId;
    }

    public RSAPublicKey getPublicKey() {
        return publicKey;
    }

    public RSAPrivateKey getPrivateKey() {
        return privateKey;
    }
}
