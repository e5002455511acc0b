package io.github.yok.statlink.parser;

import java.io.File;
import org.dbunit.dataset.ITable;

/**
 * Interface for parsing one dataset file into a DBUnit {@link ITable}.
 *
 * <p>
 * Every cell is returned as a {@link String} or {@code null}; typing happens when rows are loaded
 * into an entity type. The table name is the file's base name.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DataParser {

    /**
     * Parses the specified file.
     *
     * @param file dataset file
     * @return the parsed table
     * @throws Exception if reading or parsing fails
     */
    ITable parse(File file) throws Exception;
}
