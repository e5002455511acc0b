package io.github.yok.statlink.dataset;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.ITableMetaData;

/**
 * Wrapper {@link ITable} that exposes some columns of the delegate under new names.
 *
 * <p>
 * Used to align dataset headers with entity columns, for example {@code NUTS_ID -> nuts_id} or
 * {@code geo\TIME_PERIOD -> nuts_id}. Mappings whose source column is absent are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RenamedColumnsTable implements ITable {

    // The wrapped source table
    private final ITable delegate;

    private final ITableMetaData metaData;

    // exposed name -> delegate name
    private final Map<String, String> sourceNames = new HashMap<>();

    /**
     * Constructor.
     *
     * @param delegate source table
     * @param mapping source column name to new column name
     * @throws DataSetException if the delegate's metadata cannot be read or the renaming produces
     *         duplicate column names
     */
    public RenamedColumnsTable(ITable delegate, Map<String, String> mapping)
            throws DataSetException {
        this.delegate = delegate;
        ITableMetaData source = delegate.getTableMetaData();
        Column[] columns = source.getColumns();
        Column[] renamed = new Column[columns.length];
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < columns.length; i++) {
            String from = columns[i].getColumnName();
            String to = mapping.getOrDefault(from, from);
            if (!names.add(to)) {
                throw new DataSetException("Renaming produces duplicate column: " + to);
            }
            renamed[i] = new Column(to, columns[i].getDataType());
            sourceNames.put(to, from);
            if (!to.equals(from)) {
                log.debug("Renamed column {} -> {} in {}", from, to, source.getTableName());
            }
        }
        this.metaData = new DefaultTableMetaData(source.getTableName(), renamed);
    }

    @Override
    public ITableMetaData getTableMetaData() {
        return metaData;
    }

    @Override
    public int getRowCount() {
        return delegate.getRowCount();
    }

    @Override
    public Object getValue(int row, String columnName) throws DataSetException {
        int index = metaData.getColumnIndex(columnName);
        String exposed = metaData.getColumns()[index].getColumnName();
        return delegate.getValue(row, sourceNames.get(exposed));
    }
}
