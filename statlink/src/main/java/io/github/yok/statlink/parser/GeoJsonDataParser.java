package io.github.yok.statlink.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Implementation of {@link DataParser} for GeoJSON {@code FeatureCollection} files.
 *
 * <p>
 * Each feature's {@code properties} object becomes one row; geometries are ignored. Features
 * without properties are skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class GeoJsonDataParser implements DataParser {

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public ITable parse(File file) throws IOException, DataSetException {
        JsonNode root = mapper.readTree(file);
        if (root == null || !"FeatureCollection".equals(root.path("type").asText())) {
            throw new DataSetException("Not a GeoJSON FeatureCollection: " + file);
        }
        JsonNode features = root.path("features");
        if (!features.isArray()) {
            throw new DataSetException("FeatureCollection has no features array: " + file);
        }
        List<JsonNode> rows = new ArrayList<>();
        int skipped = 0;
        for (JsonNode feature : features) {
            JsonNode properties = feature.get("properties");
            if (properties == null || !properties.isObject()) {
                skipped++;
                continue;
            }
            rows.add(properties);
        }
        if (skipped > 0) {
            log.warn("Skipped {} features without properties in {}", skipped, file.getName());
        }
        return JsonDataParser.toTable(FilenameUtils.getBaseName(file.getName()), rows);
    }
}
