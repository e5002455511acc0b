package io.github.yok.statlink.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code backend} section of {@code application.yml}.
 *
 * <pre>
 * backend:
 *   kind: postgresql        # embedded | mysql | postgresql
 *   host: localhost
 *   port: 5432
 *   user: statlink
 *   password: secret
 *   database: statistics
 * </pre>
 *
 * <p>
 * For {@code kind: embedded} only {@code path} (the H2 database file, without extension) is read.
 * The raw values are validated and frozen into {@link BackendSettings} by
 * {@link BackendSettings#from(ConnectionConfig)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "backend")
@Data
public class ConnectionConfig {

    // Backend kind name (e.g., "embedded", "mysql", "postgresql")
    private String kind;
    // File path of the embedded database
    private String path;
    // Host name of a networked database
    private String host;
    // TCP port of a networked database; the kind's default port when omitted
    private Integer port;
    // Database user name
    private String user;
    // Database password
    @ToString.Exclude
    private String password;
    // Database (schema) name of a networked database
    private String database;
    // Optional JDBC driver class overriding the kind's default driver
    private String driverClass;
}
