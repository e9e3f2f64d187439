package com.camcompat.sizer.dto.inventory;

import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One spreadsheet cell, tagged once when the table is loaded so later stages never have to guess
 * what a loosely typed value is.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class InventoryCell {

  private static final Pattern NUMERIC_PATTERN =
      Pattern.compile("^[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?$");

  private static final InventoryCell BLANK = new InventoryCell(CellKind.BLANK, "", null);

  private final CellKind kind;
  private final String text;
  private final Double number;

  public static InventoryCell blank() {
    return BLANK;
  }

  public static InventoryCell of(Object raw) {
    if (raw == null) {
      return BLANK;
    }
    if (raw instanceof Number) {
      double value = ((Number) raw).doubleValue();
      if (Double.isNaN(value)) {
        return BLANK;
      }
      return new InventoryCell(CellKind.NUMERIC, raw.toString(), value);
    }
    String text = raw.toString();
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return BLANK;
    }
    if (NUMERIC_PATTERN.matcher(trimmed).matches()) {
      return new InventoryCell(CellKind.NUMERIC, text, Double.parseDouble(trimmed));
    }
    return new InventoryCell(CellKind.TEXT, text, null);
  }

  public boolean isBlank() {
    return kind == CellKind.BLANK;
  }

  public boolean isNumeric() {
    return kind == CellKind.NUMERIC;
  }

  public boolean isText() {
    return kind == CellKind.TEXT;
  }
}
