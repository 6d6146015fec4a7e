package com.autoinsight.mapper.model.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable column-oriented table. Every column has a name and an ordered sequence of raw cell
 * values; cells may be {@code null} and may mix value kinds.
 *
 * <p>Operations that reshape the table ({@link #selectAndRename(Map)}) always return a new
 * instance and never touch the receiver.
 */
public final class DataTable {

  private final Map<String, List<Object>> columns;
  private final int rowCount;

  private DataTable(Map<String, List<Object>> columns, int rowCount) {
    this.columns = Collections.unmodifiableMap(columns);
    this.rowCount = rowCount;
  }

  /**
   * Creates a table from named columns. Column order follows the iteration order of the given
   * map.
   *
   * @throws IllegalArgumentException if the columns differ in length
   */
  public static DataTable fromColumns(Map<String, ? extends List<?>> columnValues) {
    Map<String, List<Object>> copy = new LinkedHashMap<>();
    int rows = -1;
    for (Map.Entry<String, ? extends List<?>> entry : columnValues.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("Column names must not be null");
      }
      List<?> values = entry.getValue() != null ? entry.getValue() : List.of();
      if (rows >= 0 && values.size() != rows) {
        throw new IllegalArgumentException(
            String.format(
                "Column '%s' has %d values but previous columns have %d",
                entry.getKey(), values.size(), rows));
      }
      rows = values.size();
      copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<Object>(values)));
    }
    return new DataTable(copy, Math.max(rows, 0));
  }

  /**
   * Creates a table from row maps keyed by column name. Cells missing from a row map are read as
   * {@code null}; keys not listed in {@code columnNames} are ignored.
   */
  public static DataTable fromRows(List<String> columnNames, List<Map<String, Object>> rows) {
    Map<String, List<Object>> values = new LinkedHashMap<>();
    for (String name : columnNames) {
      if (values.containsKey(name)) {
        throw new IllegalArgumentException("Duplicate column name: " + name);
      }
      values.put(name, new ArrayList<>(rows.size()));
    }
    for (Map<String, Object> row : rows) {
      for (String name : columnNames) {
        values.get(name).add(row != null ? row.get(name) : null);
      }
    }
    return fromColumns(values);
  }

  public List<String> getColumnNames() {
    return List.copyOf(columns.keySet());
  }

  public int getColumnCount() {
    return columns.size();
  }

  public int getRowCount() {
    return rowCount;
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  /**
   * @throws IllegalArgumentException if the table has no such column
   */
  public List<Object> getColumn(String name) {
    List<Object> values = columns.get(name);
    if (values == null) {
      throw new IllegalArgumentException("Unknown column: " + name);
    }
    return values;
  }

  public List<Object> getRow(int index) {
    if (index < 0 || index >= rowCount) {
      throw new IndexOutOfBoundsException("Row " + index + " outside 0.." + (rowCount - 1));
    }
    List<Object> row = new ArrayList<>(columns.size());
    for (List<Object> values : columns.values()) {
      row.add(values.get(index));
    }
    return row;
  }

  /** Row-oriented view used for JSON responses; keys keep the column order. */
  public List<Map<String, Object>> toRows() {
    List<Map<String, Object>> rows = new ArrayList<>(rowCount);
    for (int i = 0; i < rowCount; i++) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (Map.Entry<String, List<Object>> column : columns.entrySet()) {
        row.put(column.getKey(), column.getValue().get(i));
      }
      rows.add(row);
    }
    return rows;
  }

  /**
   * Builds a new table holding only the listed source columns, renamed to their targets, in the
   * iteration order of {@code sourceToTarget}. Cell values are shared, not copied.
   *
   * @throws IllegalArgumentException if a source column is unknown or two sources share a target
   */
  public DataTable selectAndRename(Map<String, String> sourceToTarget) {
    Map<String, List<Object>> selected = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : sourceToTarget.entrySet()) {
      List<Object> values = getColumn(entry.getKey());
      if (selected.put(entry.getValue(), values) != null) {
        throw new IllegalArgumentException("Duplicate target column: " + entry.getValue());
      }
    }
    return new DataTable(selected, rowCount);
  }

  @Override
  public String toString() {
    return "DataTable{columns=" + columns.keySet() + ", rows=" + rowCount + "}";
  }
}
