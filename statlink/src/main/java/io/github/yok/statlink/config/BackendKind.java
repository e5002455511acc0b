package io.github.yok.statlink.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported backend kinds.
 *
 * <p>
 * Each kind is recognized by one or more configuration names (case-insensitive) and carries the
 * JDBC driver and default port used when the configuration does not specify them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum BackendKind {

    // Embedded, file-based H2 database.
    EMBEDDED("org.h2.Driver", 0, "embedded", "h2"),

    // Networked MySQL server.
    MYSQL("com.mysql.cj.jdbc.Driver", 3306, "mysql"),

    // Networked PostgreSQL server.
    POSTGRESQL("org.postgresql.Driver", 5432, "postgresql", "postgres");

    // JDBC driver class loaded when no driver-class is configured.
    private final String defaultDriverClass;

    // Port used when none is configured (0 for the embedded kind).
    private final int defaultPort;

    // Configuration names of this kind (all lowercase).
    private final Set<String> names;

    BackendKind(String defaultDriverClass, int defaultPort, String... names) {
        this.defaultDriverClass = defaultDriverClass;
        this.defaultPort = defaultPort;
        this.names = Arrays.stream(names).map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given configuration name denotes this kind.
     *
     * @param name configuration name (case-insensitive)
     * @return {@code true} if the name matches this kind
     */
    public boolean matches(String name) {
        return name != null && names.contains(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Returns whether this kind connects to a database server over the network.
     *
     * @return {@code true} for server-based kinds
     */
    public boolean isNetworked() {
        return this != EMBEDDED;
    }

    /**
     * Resolves a backend kind from its configuration name.
     *
     * @param name configuration name
     * @return resolved kind
     * @throws ConfigurationException if the name is blank or unknown
     */
    public static BackendKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("backend.kind is not configured.");
        }
        return Arrays.stream(values()).filter(kind -> kind.matches(name)).findFirst()
                .orElseThrow(() -> new ConfigurationException("Unsupported backend kind: " + name
                        + " (expected one of embedded, mysql, postgresql)"));
    }
}
