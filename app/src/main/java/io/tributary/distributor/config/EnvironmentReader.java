package io.tributary.distributor.config;

import java.util.Optional;

/**
 * Source of environment-style settings, the host environment in production and a map in tests.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value of {@code key}, empty when unset or blank.
     */
    default Optional<String> nonBlank(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
