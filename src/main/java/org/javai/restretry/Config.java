package org.javai.restretry;

import java.util.Optional;

/**
 * Resolves settings from system properties with environment variable fallbacks.
 */
public final class Config {

    private Config() {
        // Utility class
    }

    /**
     * Resolves an optional setting. The system property wins over the environment variable;
     * blank values count as unset.
     *
     * @param sysProp the system property name
     * @param envVar the environment variable name
     * @return the resolved value, or empty if neither is set
     */
    public static Optional<String> resolve(String sysProp, String envVar) {
        String value = System.getProperty(sysProp);
        if (value == null || value.isBlank()) {
            value = System.getenv(envVar);
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
