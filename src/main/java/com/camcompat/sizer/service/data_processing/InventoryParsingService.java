package com.camcompat.sizer.service.data_processing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.stereotype.Service;

import com.camcompat.sizer.dto.inventory.InventoryCell;
import com.camcompat.sizer.dto.inventory.InventoryTable;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/** Reads a customer inventory CSV into a table of tagged cells. The first record is the header. */
@Slf4j
@Service
public class InventoryParsingService {

  public InventoryTable parseCsv(byte[] csvData, String fileName)
      throws IOException, CsvValidationException {
    return parseCsv(new ByteArrayInputStream(csvData), fileName);
  }

  public InventoryTable parseCsv(InputStream csvStream, String fileName)
      throws IOException, CsvValidationException {
    List<String> headers = new ArrayList<>();
    List<List<InventoryCell>> rows = new ArrayList<>();

    try (CSVReader reader =
        new CSVReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {
      String[] headerRow = reader.readNext();
      if (headerRow == null || headerRow.length == 0) {
        throw new IllegalArgumentException("CSV file has no headers");
      }
      headers.addAll(Arrays.asList(headerRow));

      String[] record;
      while ((record = reader.readNext()) != null) {
        if (record.length > headers.size()) {
          log.debug(
              "Truncating row with {} values to {} columns", record.length, headers.size());
        }
        List<InventoryCell> cells = new ArrayList<>(headers.size());
        boolean allBlank = true;
        for (int i = 0; i < Math.min(record.length, headers.size()); i++) {
          InventoryCell cell = InventoryCell.of(record[i]);
          allBlank &= cell.isBlank();
          cells.add(cell);
        }
        if (allBlank) {
          continue;
        }
        rows.add(cells);
      }
    }

    log.info("Parsed inventory '{}': {} columns, {} rows", fileName, headers.size(), rows.size());
    return new InventoryTable(extractInventoryName(fileName), headers, rows);
  }

  private String extractInventoryName(String fileName) {
    if (fileName == null || fileName.isEmpty()) {
      return "unnamed_inventory";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return lastDotIndex > 0 ? fileName.substring(0, lastDotIndex) : fileName;
  }
}
