package com.autoinsight.mapper.model.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DataTable Tests")
class DataTableTest {

  private static DataTable sample() {
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("CustomerID", List.of(1, 2));
    columns.put("Quantity", Arrays.asList(5, null));
    return DataTable.fromColumns(columns);
  }

  @Test
  @DisplayName("Should keep column order and allow null cells")
  void shouldBuildFromColumns() {
    DataTable table = sample();

    assertThat(table.getColumnNames()).containsExactly("CustomerID", "Quantity");
    assertThat(table.getRowCount()).isEqualTo(2);
    assertThat(table.getRow(1)).containsExactly(2, null);
  }

  @Test
  @DisplayName("Should reject columns of different lengths")
  void shouldRejectRaggedColumns() {
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("a", List.of(1, 2));
    columns.put("b", List.of(1));

    assertThatThrownBy(() -> DataTable.fromColumns(columns))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("'b'");
  }

  @Test
  @DisplayName("Should read absent row keys as null")
  void shouldBuildFromRows() {
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("a", 1);
    first.put("ignored", "x");
    Map<String, Object> second = Map.of("b", "y");

    DataTable table = DataTable.fromRows(List.of("a", "b"), List.of(first, second));

    assertThat(table.getColumnNames()).containsExactly("a", "b");
    assertThat(table.getColumn("a")).containsExactly(1, null);
    assertThat(table.getColumn("b")).containsExactly(null, "y");
  }

  @Test
  @DisplayName("Should reject duplicate column names")
  void shouldRejectDuplicateNames() {
    assertThatThrownBy(() -> DataTable.fromRows(List.of("a", "a"), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should select and rename without touching the source")
  void shouldSelectAndRename() {
    DataTable table = sample();
    Map<String, String> renames = new LinkedHashMap<>();
    renames.put("Quantity", "quantity");

    DataTable renamed = table.selectAndRename(renames);

    assertThat(renamed.getColumnNames()).containsExactly("quantity");
    assertThat(renamed.getRowCount()).isEqualTo(2);
    assertThat(table.getColumnNames()).containsExactly("CustomerID", "Quantity");
    assertThat(renamed.toRows().get(0)).containsEntry("quantity", 5);
  }

  @Test
  @DisplayName("Should reject unknown columns")
  void shouldRejectUnknownColumn() {
    assertThatThrownBy(() -> sample().getColumn("price"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown column: price");
  }

  @Test
  @DisplayName("Should not expose mutable columns")
  void shouldBeImmutable() {
    DataTable table = sample();

    assertThatThrownBy(() -> table.getColumn("CustomerID").add(3))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
