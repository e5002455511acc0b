package io.github.yok.statlink.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declarative description of an entity as stored in {@code <data-path>/entities/<name>.json}.
 *
 * <pre>
 * {
 *   "table_name": "REGIONS",
 *   "identifier": "nuts_id",
 *   "columns": [
 *     {"name": "nuts_id", "type": "String(10)"},
 *     {"name": "levl_code", "type": "Integer"}
 *   ]
 * }
 * </pre>
 *
 * <p>
 * This is the raw, unvalidated document; {@link SchemaRegistry#define(EntityDescription)} turns it
 * into an {@link EntityType}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityDescription {

    @JsonProperty("table_name")
    private String tableName;

    @JsonProperty("identifier")
    private String identifier;

    @JsonProperty("columns")
    private List<Column> columns = new ArrayList<>();

    /**
     * One column entry of the description.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Column {
        private String name;
        private String type;
    }
}
