package com.camcompat.sizer.dto.inventory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Customer inventory as a rectangular grid of tagged cells. Headers are kept as written and may
 * be blank; they are only trusted for locating a quantity column.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class InventoryTable {

  private final String name;
  private final List<String> headers;
  private final List<List<InventoryCell>> rows;

  public InventoryTable(String name, List<String> headers, List<List<InventoryCell>> rows) {
    if (headers == null || rows == null) {
      throw new IllegalArgumentException("Inventory headers and rows must not be null");
    }
    this.name = name != null ? name : "unnamed_inventory";
    this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
    List<List<InventoryCell>> normalized = new ArrayList<>(rows.size());
    for (List<InventoryCell> row : rows) {
      List<InventoryCell> cells = new ArrayList<>(headers.size());
      for (int i = 0; i < headers.size(); i++) {
        InventoryCell cell = row != null && i < row.size() ? row.get(i) : null;
        cells.add(cell != null ? cell : InventoryCell.blank());
      }
      normalized.add(Collections.unmodifiableList(cells));
    }
    this.rows = Collections.unmodifiableList(normalized);
  }

  /** Builds a table from raw values, tagging every cell. */
  public static InventoryTable fromValues(
      String name, List<String> headers, List<? extends List<?>> values) {
    List<List<InventoryCell>> rows = new ArrayList<>(values.size());
    for (List<?> rawRow : values) {
      List<InventoryCell> cells = new ArrayList<>(rawRow.size());
      for (Object raw : rawRow) {
        cells.add(InventoryCell.of(raw));
      }
      rows.add(cells);
    }
    return new InventoryTable(name, headers, rows);
  }

  public int getColumnCount() {
    return headers.size();
  }

  public int getRowCount() {
    return rows.size();
  }

  public List<InventoryCell> column(int index) {
    if (index < 0 || index >= headers.size()) {
      throw new IndexOutOfBoundsException(
          "Column " + index + " outside table with " + headers.size() + " columns");
    }
    List<InventoryCell> column = new ArrayList<>(rows.size());
    for (List<InventoryCell> row : rows) {
      column.add(row.get(index));
    }
    return column;
  }

  /** Returns a copy of this table without the given columns. */
  public InventoryTable withoutColumns(List<Integer> dropped) {
    if (dropped.isEmpty()) {
      return this;
    }
    List<String> keptHeaders = new ArrayList<>();
    for (int i = 0; i < headers.size(); i++) {
      if (!dropped.contains(i)) {
        keptHeaders.add(headers.get(i));
      }
    }
    List<List<InventoryCell>> keptRows = new ArrayList<>(rows.size());
    for (List<InventoryCell> row : rows) {
      List<InventoryCell> kept = new ArrayList<>(keptHeaders.size());
      for (int i = 0; i < row.size(); i++) {
        if (!dropped.contains(i)) {
          kept.add(row.get(i));
        }
      }
      keptRows.add(kept);
    }
    return new InventoryTable(name, keptHeaders, keptRows);
  }
}
