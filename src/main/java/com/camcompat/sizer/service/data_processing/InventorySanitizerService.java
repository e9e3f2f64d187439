package com.camcompat.sizer.service.data_processing;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.camcompat.sizer.config.SizerProperties;
import com.camcompat.sizer.dto.inventory.InventoryCell;
import com.camcompat.sizer.dto.inventory.InventoryTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Removes inventory content that would otherwise be scored as model text: columns holding network
 * addresses or serial numbers, bare row-number columns, and noise tokens inside text cells.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventorySanitizerService {

  private static final Pattern IPV4_PATTERN =
      Pattern.compile(
          "^((25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}"
              + "(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$");

  private static final Pattern MAC_PATTERN =
      Pattern.compile(
          "^([0-9A-Fa-f]{2}[:-]){5}[0-9A-Fa-f]{2}$|^([0-9A-Fa-f]{4}[:-]){2}[0-9A-Fa-f]{4}$");

  private static final Pattern SERIAL_HEADER_PATTERN =
      Pattern.compile("(?i)serial|\\bs/?n\\b");

  private static final Pattern ROW_NUMBER_HEADER_PATTERN = Pattern.compile("^#$");

  private static final Pattern SYMBOL_TOKEN_PATTERN = Pattern.compile("^[\\p{Punct}]+$");

  private static final Pattern INTEGER_TOKEN_PATTERN = Pattern.compile("^[-+]?\\d+$");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final SizerProperties sizerProperties;

  public boolean isIpAddress(String value) {
    return value != null && IPV4_PATTERN.matcher(value.trim()).matches();
  }

  public boolean isMacAddress(String value) {
    return value != null && MAC_PATTERN.matcher(value.trim()).matches();
  }

  /** Headers such as "Serial Number", "SN" or "S/N". */
  public boolean isSerialHeader(String header) {
    return header != null && SERIAL_HEADER_PATTERN.matcher(header).find();
  }

  /** A header that is exactly "#" marks a row-number column, not a camera count. */
  public boolean isRowNumberHeader(String header) {
    return header != null && ROW_NUMBER_HEADER_PATTERN.matcher(header.trim()).matches();
  }

  /** Indexes of columns containing at least one IPv4 or MAC address. */
  public List<Integer> findNetworkColumns(InventoryTable table) {
    List<Integer> networkColumns = new ArrayList<>();
    for (int column = 0; column < table.getColumnCount(); column++) {
      for (InventoryCell cell : table.column(column)) {
        if (cell.isText() && (isIpAddress(cell.getText()) || isMacAddress(cell.getText()))) {
          log.debug(
              "Column {} ('{}') holds network addresses", column, table.getHeaders().get(column));
          networkColumns.add(column);
          break;
        }
      }
    }
    return networkColumns;
  }

  public List<Integer> findSerialColumns(InventoryTable table) {
    List<Integer> serialColumns = new ArrayList<>();
    List<String> headers = table.getHeaders();
    for (int column = 0; column < headers.size(); column++) {
      if (isSerialHeader(headers.get(column))) {
        serialColumns.add(column);
      }
    }
    return serialColumns;
  }

  public List<Integer> findRowNumberColumns(InventoryTable table) {
    List<Integer> rowNumberColumns = new ArrayList<>();
    List<String> headers = table.getHeaders();
    for (int column = 0; column < headers.size(); column++) {
      if (isRowNumberHeader(headers.get(column))) {
        rowNumberColumns.add(column);
      }
    }
    return rowNumberColumns;
  }

  /** Ascending indexes of every column the enabled rules drop. */
  public List<Integer> findColumnsToDrop(InventoryTable table) {
    SizerProperties.Sanitize settings = sizerProperties.getSanitize();
    TreeSet<Integer> columns = new TreeSet<>();
    if (settings.isDropNetworkColumns()) {
      columns.addAll(findNetworkColumns(table));
    }
    if (settings.isDropSerialColumns()) {
      columns.addAll(findSerialColumns(table));
    }
    if (settings.isDropRowNumberColumns()) {
      columns.addAll(findRowNumberColumns(table));
    }
    return new ArrayList<>(columns);
  }

  /**
   * Removes symbol-only, IP and MAC tokens from a text value, and integer tokens when the value has
   * more than one token. Returns the value unchanged when nothing is removed.
   */
  public String stripNoise(String value) {
    if (value == null || value.isBlank()) {
      return value;
    }
    String[] tokens = WHITESPACE.split(value.trim());
    boolean multipleTokens = tokens.length > 1;
    List<String> kept = new ArrayList<>(tokens.length);
    for (String token : tokens) {
      boolean noise =
          SYMBOL_TOKEN_PATTERN.matcher(token).matches()
              || isIpAddress(token)
              || isMacAddress(token)
              || (multipleTokens && INTEGER_TOKEN_PATTERN.matcher(token).matches());
      if (!noise) {
        kept.add(token);
      }
    }
    return kept.size() == tokens.length ? value : String.join(" ", kept);
  }

  /**
   * Applies {@link #stripNoise} to every text cell outside {@code verbatimColumn}, re-tagging the
   * cells that changed. Pass -1 to clean every column. A no-op when cell cleaning is disabled.
   */
  public InventoryTable stripCellNoise(InventoryTable table, int verbatimColumn) {
    if (!sizerProperties.getSanitize().isStripCellNoise()) {
      return table;
    }
    int changed = 0;
    List<List<InventoryCell>> rows = new ArrayList<>(table.getRowCount());
    for (List<InventoryCell> row : table.getRows()) {
      List<InventoryCell> cleaned = new ArrayList<>(row.size());
      for (int column = 0; column < row.size(); column++) {
        InventoryCell cell = row.get(column);
        if (column != verbatimColumn && cell.isText()) {
          String stripped = stripNoise(cell.getText());
          if (!stripped.equals(cell.getText())) {
            cell = InventoryCell.of(stripped);
            changed++;
          }
        }
        cleaned.add(cell);
      }
      rows.add(cleaned);
    }
    if (changed == 0) {
      return table;
    }
    log.info("Removed noise tokens from {} cell(s) of '{}'", changed, table.getName());
    return new InventoryTable(table.getName(), table.getHeaders(), rows);
  }
}
