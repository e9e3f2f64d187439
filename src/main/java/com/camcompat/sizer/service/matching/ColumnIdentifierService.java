package com.camcompat.sizer.service.matching;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.camcompat.sizer.dto.catalog.HardwareCatalog;
import com.camcompat.sizer.dto.inventory.InventoryCell;
import com.camcompat.sizer.dto.inventory.InventoryRow;
import com.camcompat.sizer.dto.inventory.InventoryTable;
import com.camcompat.sizer.service.matching.SimilarityScoringService.Scorer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Locates the model-name and quantity columns of a customer inventory. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ColumnIdentifierService {

  private static final Pattern COUNT_HEADER_PATTERN =
      Pattern.compile("(?i)\\bcount\\b|#|\\bquantity\\b");

  private static final Pattern GROUPED_NUMBER_PATTERN =
      Pattern.compile("^[-+]?\\d{1,3}([,\\s]\\d{3})+(\\.\\d+)?$");

  /** Per-row ceiling, keeps folded totals far from {@code long} overflow. */
  static final long MAX_ROW_QUANTITY = Integer.MAX_VALUE;

  private final SimilarityScoringService similarityScoringService;

  /**
   * Picks the column whose distinct text values best resemble catalog model names. Ties go to the
   * leftmost column.
   *
   * @return the column index, or empty when no column scores above zero
   */
  public OptionalInt identifyModelColumn(InventoryTable table, HardwareCatalog catalog) {
    int bestColumn = -1;
    long bestScore = 0;
    for (int column = 0; column < table.getColumnCount(); column++) {
      long score = scoreColumn(table.column(column), catalog);
      log.debug("Column {} '{}' scored {}", column, table.getHeaders().get(column), score);
      if (score > bestScore) {
        bestScore = score;
        bestColumn = column;
      }
    }
    if (bestColumn < 0) {
      log.warn("No column in '{}' resembles camera model names", table.getName());
      return OptionalInt.empty();
    }
    log.info(
        "Model column for '{}': {} ('{}') with score {}",
        table.getName(),
        bestColumn,
        table.getHeaders().get(bestColumn),
        bestScore);
    return OptionalInt.of(bestColumn);
  }

  /**
   * Sum of the best token-sort score of each distinct text value. A column that holds only numbers
   * (ignoring blanks) scores zero.
   */
  public long scoreColumn(List<InventoryCell> column, HardwareCatalog catalog) {
    boolean anyValue = false;
    boolean allNumeric = true;
    for (InventoryCell cell : column) {
      if (!cell.isBlank()) {
        anyValue = true;
        allNumeric &= cell.isNumeric();
      }
    }
    if (!anyValue || allNumeric) {
      return 0;
    }

    Set<String> seen = new HashSet<>();
    long total = 0;
    for (InventoryCell cell : column) {
      if (cell.isText() && seen.add(cell.getText())) {
        total +=
            similarityScoringService
                .bestMatch(Scorer.TOKEN_SORT, cell.getText(), catalog)
                .getScore();
      }
    }
    return total;
  }

  public OptionalInt identifyCountColumn(InventoryTable table) {
    return identifyCountColumn(table, -1);
  }

  /** First column whose header mentions a count, skipping {@code excludedColumn}. */
  public OptionalInt identifyCountColumn(InventoryTable table, int excludedColumn) {
    List<String> headers = table.getHeaders();
    for (int i = 0; i < headers.size(); i++) {
      String header = headers.get(i);
      if (i != excludedColumn && header != null && COUNT_HEADER_PATTERN.matcher(header).find()) {
        log.info("Found camera count column {} ('{}')", i, header);
        return OptionalInt.of(i);
      }
    }
    log.info("No camera count column found, counting repeated model names instead");
    return OptionalInt.empty();
  }

  /**
   * Pairs each non-blank model cell with its quantity. Without a count column every row stands for
   * one camera. Counts written with digit grouping ("1,200") are read as numbers. Blank or
   * unreadable counts are taken as 1, negative counts as 0, fractional counts are truncated and
   * anything above {@link #MAX_ROW_QUANTITY} is capped.
   */
  public List<InventoryRow> extractRows(
      InventoryTable table, int modelColumn, OptionalInt countColumn) {
    List<InventoryRow> rows = new ArrayList<>();
    for (List<InventoryCell> row : table.getRows()) {
      InventoryCell model = row.get(modelColumn);
      if (model.isBlank()) {
        continue;
      }
      long quantity = countColumn.isPresent() ? quantityOf(row.get(countColumn.getAsInt())) : 1;
      rows.add(InventoryRow.builder().model(model).quantity(quantity).build());
    }
    return rows;
  }

  long quantityOf(InventoryCell cell) {
    double value;
    if (cell.isNumeric()) {
      value = cell.getNumber();
    } else if (cell.isText() && GROUPED_NUMBER_PATTERN.matcher(cell.getText().trim()).matches()) {
      value = Double.parseDouble(cell.getText().trim().replaceAll("[,\\s]", ""));
    } else {
      if (cell.isText()) {
        log.warn("Unreadable camera count '{}', counting the row once", cell.getText());
      }
      return 1;
    }
    if (value <= 0) {
      return 0;
    }
    if (value >= MAX_ROW_QUANTITY) {
      log.warn("Camera count {} capped at {}", cell.getText().trim(), MAX_ROW_QUANTITY);
      return MAX_ROW_QUANTITY;
    }
    return (long) value;
  }
}
