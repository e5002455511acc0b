package io.github.yok.statlink.util;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;

/**
 * Renders file paths for log messages relative to the working directory when possible.
 */
public final class LogPathUtil {

    @Generated
    private LogPathUtil() {
        throw new AssertionError("No LogPathUtil instances for you!");
    }

    /**
     * Renders a path for logs.
     *
     * @param path file or directory
     * @return path relative to {@code user.dir} when below it, otherwise the absolute normalized
     *         path
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public static String renderPathForLog(Path path) {
        Preconditions.checkNotNull(path, "path must not be null");
        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = path.toAbsolutePath().normalize();
        if (abs.startsWith(base) && !abs.equals(base)) {
            return base.relativize(abs).toString();
        }
        return abs.toString();
    }
}
