package io.github.yok.statlink.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration and composes the directories holding entity descriptions and dataset files.
 *
 * <p>
 * The {@code data-path} must point to the base directory under which this tool expects
 * {@code /entities} (one {@code <entity>.json} description per table) and {@code /datasets}
 * (input files referenced by import jobs).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that serves as the application's root data directory
    private String dataPath;

    /**
     * Returns the directory of entity description files.
     *
     * @return the path to the entities directory
     * @throws ConfigurationException if {@code dataPath} has not been set
     */
    public String getEntities() {
        return resolve("entities");
    }

    /**
     * Returns the directory of dataset files.
     *
     * @return the path to the datasets directory
     * @throws ConfigurationException if {@code dataPath} has not been set
     */
    public String getDatasets() {
        return resolve("datasets");
    }

    private String resolve(String child) {
        if (StringUtils.isBlank(dataPath)) {
            throw new ConfigurationException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return dataPath.endsWith("/") ? dataPath + child : dataPath + "/" + child;
    }
}
