package io.github.yok.statlink.util;

import io.github.yok.statlink.config.BackendSettings;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Masks credentials before backend settings reach the log.
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    // user:password@ embedded in authority-style JDBC URLs
    private static final Pattern JDBC_AUTH_PATTERN =
            Pattern.compile("(jdbc:[^:]+://[^:/?#@]+:)([^@/]+)(@.*)", Pattern.CASE_INSENSITIVE);

    private static final Pattern PASSWORD_QUERY_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a secret.
     *
     * @param value raw text
     * @return {@code ***}, or the input when {@code null} or empty
     */
    public static String maskText(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return "***";
    }

    /**
     * Masks embedded credentials and password parameters in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = url;
        Matcher authMatcher = JDBC_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceFirst("$1***$3");
        }
        return PASSWORD_QUERY_PATTERN.matcher(masked).replaceAll("$1***");
    }

    /**
     * Formats backend settings for logging; the password is never printed.
     *
     * @param settings backend settings
     * @return log string
     */
    public static String maskSettings(BackendSettings settings) {
        if (settings == null) {
            return "<null>";
        }
        return "kind=" + settings.getKind() + ", url=" + maskJdbcUrl(settings.getJdbcUrl())
                + ", user=" + settings.getUser() + ", password=" + maskText(settings.getPassword())
                + ", driverClass=" + settings.getDriverClass();
    }
}
