package com.project.capsule.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime configuration, resolved from environment variables.
 *
 * <ul>
 *     <li>{@code CAPSULE_HOME}: data directory (default {@code ./data}).</li>
 *     <li>{@code CAPSULE_KEY_SECRET}: passphrase protecting private keys at rest (optional).</li>
 *     <li>{@code CAPSULE_ERROR_LOG}: error log file; blank disables the file sink.</li>
 * </ul>
 *
 * @param home      root of the persisted layout.
 * @param keySecret passphrase for private key encryption, if any.
 * @param errorLog  log file, empty when file logging is disabled.
 */
public record CapsuleConfig(Path home, Optional<String> keySecret, Optional<Path> errorLog) {

    public static final String DEFAULT_HOME = "data";
    public static final String DEFAULT_ERROR_LOG = "capsule-errors.log";

    public CapsuleConfig {
        Objects.requireNonNull(home, "home must not be null");
        keySecret = keySecret == null ? Optional.empty() : keySecret;
        errorLog = errorLog == null ? Optional.empty() : errorLog;
    }

    public static CapsuleConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static CapsuleConfig fromEnvironment(Map<String, String> env) {
        String home = env.get("CAPSULE_HOME");
        String secret = env.get("CAPSULE_KEY_SECRET");
        String errorLog = env.getOrDefault("CAPSULE_ERROR_LOG", DEFAULT_ERROR_LOG);

        return new CapsuleConfig(
                Path.of(home == null || home.isBlank() ? DEFAULT_HOME : home.trim()),
                secret == null || secret.isBlank() ? Optional.empty() : Optional.of(secret),
                errorLog.isBlank() ? Optional.empty() : Optional.of(Path.of(errorLog.trim()))
        );
    }

    public Path keysDirectory() {
        return home.resolve("keys");
    }

    public Path capsulesDirectory() {
        return home.resolve("capsules");
    }
}
