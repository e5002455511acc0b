package io.github.yok.statlink.config;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable connection settings of one backend, built once at startup.
 *
 * <p>
 * Instances are created from the Spring-bound {@link ConnectionConfig} by
 * {@link #from(ConnectionConfig)}, which validates the kind-specific required parameters and
 * composes the JDBC URL. The result is passed by reference to the connection manager; nothing
 * reads connection parameters from a shared mutable location afterwards.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class BackendSettings {

    @NonNull
    BackendKind kind;

    @NonNull
    String jdbcUrl;

    String user;

    @ToString.Exclude
    String password;

    @NonNull
    String driverClass;

    /**
     * Validates the raw configuration and builds the settings.
     *
     * <p>
     * Required parameters:
     * </p>
     * <ul>
     * <li>{@code embedded}: {@code path}</li>
     * <li>{@code mysql} / {@code postgresql}: {@code host}, {@code user}, {@code password},
     * {@code database} ({@code port} falls back to the kind's default)</li>
     * </ul>
     *
     * @param config raw connection configuration
     * @return validated settings
     * @throws ConfigurationException if the kind is unknown or required parameters are absent
     */
    public static BackendSettings from(ConnectionConfig config) {
        if (config == null) {
            throw new ConfigurationException("backend section is not configured.");
        }
        BackendKind kind = BackendKind.fromName(config.getKind());
        String driverClass = StringUtils.defaultIfBlank(config.getDriverClass(),
                kind.getDefaultDriverClass());

        if (!kind.isNetworked()) {
            if (StringUtils.isBlank(config.getPath())) {
                throw new ConfigurationException(
                        "backend.path is required for backend kind " + kind);
            }
            String file = Paths.get(config.getPath()).toAbsolutePath().normalize().toString();
            return BackendSettings.builder().kind(kind).jdbcUrl("jdbc:h2:file:" + file)
                    .user(StringUtils.defaultIfBlank(config.getUser(), "sa"))
                    .password(StringUtils.defaultString(config.getPassword()))
                    .driverClass(driverClass).build();
        }

        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(config.getHost())) {
            missing.add("backend.host");
        }
        if (StringUtils.isBlank(config.getUser())) {
            missing.add("backend.user");
        }
        if (config.getPassword() == null) {
            missing.add("backend.password");
        }
        if (StringUtils.isBlank(config.getDatabase())) {
            missing.add("backend.database");
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException(
                    "Missing connection parameters for backend kind " + kind + ": " + missing);
        }
        int port = config.getPort() != null ? config.getPort() : kind.getDefaultPort();
        if (port <= 0 || port > 65535) {
            throw new ConfigurationException("backend.port is out of range: " + port);
        }

        String scheme = kind == BackendKind.MYSQL ? "mysql" : "postgresql";
        String url = String.format("jdbc:%s://%s:%d/%s", scheme, config.getHost().trim(), port,
                config.getDatabase().trim());
        return BackendSettings.builder().kind(kind).jdbcUrl(url).user(config.getUser())
                .password(config.getPassword()).driverClass(driverClass).build();
    }
}
