package io.github.yok.statlink.dataset;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.ITableMetaData;
import org.dbunit.dataset.RowOutOfBoundsException;
import org.dbunit.dataset.datatype.DataType;

/**
 * Wrapper {@link ITable} that reshapes a wide table into long format.
 *
 * <p>
 * The id columns are kept; every other column of the delegate becomes one output row per source
 * row carrying the column header in the variable column and the cell in the value column. Rows are
 * ordered column-major: all source rows for the first value column, then all for the second.
 * </p>
 *
 * <pre>
 * geo | 2019 | 2020          geo | year | value
 * ----+------+-----    -&gt;    ----+------+------
 * DE  | 1    | 2             DE  | 2019 | 1
 *                            DE  | 2020 | 2
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public class MeltedTable implements ITable {

    private final ITable delegate;

    private final ITableMetaData metaData;

    private final List<String> idColumns;

    // Delegate columns turned into rows, in delegate order
    private final List<String> valueColumns = new ArrayList<>();

    private final String variableColumn;

    private final String valueColumn;

    /**
     * Constructor.
     *
     * @param delegate wide source table
     * @param idColumns columns kept as identifiers
     * @param variableColumn name of the output column holding the former header
     * @param valueColumn name of the output column holding the cell value
     * @throws DataSetException if an id column is absent or output names collide
     */
    public MeltedTable(ITable delegate, List<String> idColumns, String variableColumn,
            String valueColumn) throws DataSetException {
        this.delegate = delegate;
        this.variableColumn = variableColumn;
        this.valueColumn = valueColumn;

        ITableMetaData source = delegate.getTableMetaData();
        List<Column> columns = new ArrayList<>();
        List<String> resolvedIds = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (String id : idColumns) {
            Column column = source.getColumns()[source.getColumnIndex(id)];
            columns.add(column);
            resolvedIds.add(column.getColumnName());
            names.add(column.getColumnName());
        }
        this.idColumns = List.copyOf(resolvedIds);
        for (Column c : source.getColumns()) {
            if (!names.contains(c.getColumnName())) {
                valueColumns.add(c.getColumnName());
            }
        }
        for (String name : List.of(variableColumn, valueColumn)) {
            if (!names.add(name)) {
                throw new DataSetException("Melt output column collides with an existing one: "
                        + name);
            }
            columns.add(new Column(name, DataType.VARCHAR));
        }
        this.metaData = new DefaultTableMetaData(source.getTableName(),
                columns.toArray(new Column[0]));
    }

    @Override
    public ITableMetaData getTableMetaData() {
        return metaData;
    }

    @Override
    public int getRowCount() {
        return delegate.getRowCount() * valueColumns.size();
    }

    @Override
    public Object getValue(int row, String columnName) throws DataSetException {
        int sourceRows = delegate.getRowCount();
        if (row < 0 || row >= getRowCount()) {
            throw new RowOutOfBoundsException(
                    "Row " + row + " out of " + getRowCount());
        }
        int sourceRow = row % sourceRows;
        String melted = valueColumns.get(row / sourceRows);
        String column = metaData.getColumns()[metaData.getColumnIndex(columnName)].getColumnName();
        if (column.equals(variableColumn)) {
            return melted;
        }
        if (column.equals(valueColumn)) {
            return delegate.getValue(sourceRow, melted);
        }
        if (idColumns.contains(column)) {
            return delegate.getValue(sourceRow, column);
        }
        throw new DataSetException("No column " + columnName + " in " + metaData.getTableName());
    }
}
