package io.github.yok.statlink.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code loader} section of {@code application.yml}.
 *
 * <pre>
 * loader:
 *   batch-size: 1000
 *   identifier-chunk-size: 500
 *   jobs:
 *     - name: regions
 *       entity: REGIONS
 *       file: regions/NUTS_RG_01M_2021_4326.geojson
 *       column-mapping:
 *         NUTS_ID: nuts_id
 *     - name: employment
 *       entity: employment
 *       file: eurostat/employment.tsv
 *       null-values: [":"]
 *       column-mapping:
 *         "[geo\\TIME_PERIOD]": nuts_id
 *       melt:
 *         id-columns: [nuts_id]
 *         variable-column: year
 *         value-column: employed
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "loader")
@Data
public class LoaderConfig {

    /**
     * Number of rows sent per JDBC batch when inserting new versions.
     */
    private int batchSize = 1000;

    /**
     * Maximum number of identifier values bound into one {@code IN (...)} lookup.
     */
    private int identifierChunkSize = 500;

    /**
     * Configured import jobs, executed in declaration order.
     */
    private List<Job> jobs = new ArrayList<>();

    /**
     * One import job: a dataset file loaded into one entity table.
     */
    @Data
    public static class Job {
        // Job name used on the command line and in logs (defaults to the entity name)
        private String name;
        // Entity description name (file name under <data-path>/entities without ".json")
        private String entity;
        // Dataset file, absolute or relative to <data-path>/datasets
        private String file;
        // Explicit format (csv, json, geojson); resolved from the extension when omitted
        private String format;
        // CSV delimiter; "," for .csv and tab for .tsv when omitted
        private String delimiter;
        // Cell values read as null (e.g., ":" for missing statistics)
        private List<String> nullValues = new ArrayList<>();
        // Dataset column renames applied before reshaping (source -> target)
        private Map<String, String> columnMapping = new LinkedHashMap<>();
        // Optional wide-to-long reshaping
        private Melt melt;

        /**
         * Returns the job name, falling back to the entity name.
         *
         * @return display name of the job
         */
        public String getDisplayName() {
            return name != null && !name.isBlank() ? name : entity;
        }
    }

    /**
     * Wide-to-long reshaping settings of a job.
     */
    @Data
    public static class Melt {
        // Columns kept as they are
        private List<String> idColumns = new ArrayList<>();
        // Column receiving the former header name (e.g., "year")
        private String variableColumn = "variable";
        // Column receiving the cell value (e.g., "employed")
        private String valueColumn = "value";
    }
}
