package io.github.yok.statlink.util;

import lombok.Generated;

/**
 * Explicit JDBC driver class loading.
 *
 * <p>
 * A {@code null} or blank class name is a no-op and leaves driver discovery to JDBC 4 service
 * loading.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JdbcDriverLoader {

    @Generated
    private JdbcDriverLoader() {}

    /**
     * Loads the JDBC driver class when a name is given.
     *
     * @param driverClass fully qualified driver class name, or {@code null}/blank
     * @throws ClassNotFoundException when the class cannot be found
     */
    public static void loadIfConfigured(String driverClass) throws ClassNotFoundException {
        if (driverClass == null || driverClass.isBlank()) {
            return;
        }
        Class.forName(driverClass);
    }
}
