package com.camcompat.sizer.service.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.camcompat.sizer.config.SizerProperties;
import com.camcompat.sizer.dto.catalog.CatalogCamera;
import com.camcompat.sizer.dto.catalog.GatewayUnit;
import com.camcompat.sizer.dto.catalog.HardwareCatalog;
import com.camcompat.sizer.exception.MalformedCatalogEntryException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the compatible-camera and gateway-unit catalogs once at startup. The loaded snapshot is
 * never modified afterwards and is shared by every sizing run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogLoaderService {

  static final String MANUFACTURER = "manufacturer";
  static final String MODEL_NAME = "model name";
  static final String MINIMUM_FIRMWARE = "minimum firmware";
  static final String NOTES = "notes";
  static final String MEGAPIXELS = "mp";
  static final String CHANNELS = "channels";

  static final String UNIT_NAME = "name";
  static final String STORAGE_TB = "storage tb";
  static final String LOW_CHANNELS = "low channels";
  static final String HIGH_CHANNELS = "high channels";

  private final SizerProperties sizerProperties;
  private final ResourceLoader resourceLoader;

  private volatile HardwareCatalog catalog;

  @PostConstruct
  public void init() {
    String camerasLocation = sizerProperties.getCatalog().getCamerasResource();
    String unitsLocation = sizerProperties.getCatalog().getUnitsResource();

    List<CatalogCamera> cameras;
    List<GatewayUnit> units;
    try (InputStream camerasStream = open(camerasLocation);
        InputStream unitsStream = open(unitsLocation)) {
      cameras = parseCameras(camerasStream, camerasLocation);
      units = parseUnits(unitsStream, unitsLocation);
    } catch (IOException e) {
      throw new MalformedCatalogEntryException(camerasLocation, -1, "unreadable catalog", e);
    }

    catalog = HardwareCatalog.of(cameras, units);
    log.info(
        "Loaded hardware catalog: {} compatible cameras, {} gateway units",
        cameras.size(),
        units.size());
  }

  public HardwareCatalog getCatalog() {
    if (catalog == null) {
      throw new IllegalStateException("Hardware catalog has not been loaded");
    }
    return catalog;
  }

  public List<CatalogCamera> parseCameras(InputStream stream, String source) throws IOException {
    List<CatalogCamera> cameras = new ArrayList<>();
    readRecords(
        stream,
        source,
        List.of(MANUFACTURER, MODEL_NAME, MINIMUM_FIRMWARE, NOTES, MEGAPIXELS, CHANNELS),
        record -> {
          CatalogCamera camera =
              CatalogCamera.builder()
                  .manufacturer(record.text(MANUFACTURER))
                  .modelName(record.text(MODEL_NAME))
                  .minimumFirmwareVersion(record.text(MINIMUM_FIRMWARE))
                  .notes(normalizeNotes(record.text(NOTES)))
                  .megapixels(record.decimal(MEGAPIXELS))
                  .channelCost((int) record.whole(CHANNELS))
                  .build();
          HardwareCatalog.validateCamera(camera);
          cameras.add(camera);
        });
    return cameras;
  }

  public List<GatewayUnit> parseUnits(InputStream stream, String source) throws IOException {
    List<GatewayUnit> units = new ArrayList<>();
    readRecords(
        stream,
        source,
        List.of(UNIT_NAME, STORAGE_TB, LOW_CHANNELS, HIGH_CHANNELS),
        record -> {
          GatewayUnit unit =
              GatewayUnit.builder()
                  .name(record.text(UNIT_NAME))
                  .storageTb(record.decimal(STORAGE_TB))
                  .lowChannels((int) record.whole(LOW_CHANNELS))
                  .highChannels((int) record.whole(HIGH_CHANNELS))
                  .build();
          HardwareCatalog.validateUnit(unit);
          units.add(unit);
        });
    return units;
  }

  private void readRecords(
      InputStream stream, String source, List<String> requiredColumns, RecordHandler handler)
      throws IOException {
    try (CSVReader reader =
        new CSVReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String[] headerRow = reader.readNext();
      if (headerRow == null) {
        throw new MalformedCatalogEntryException(source, 1, "missing header row");
      }
      Map<String, Integer> columns = new HashMap<>();
      for (int i = 0; i < headerRow.length; i++) {
        columns.putIfAbsent(normalizeHeader(headerRow[i]), i);
      }
      for (String required : requiredColumns) {
        if (!columns.containsKey(required)) {
          throw new MalformedCatalogEntryException(
              source, 1, "missing required column '" + required + "'");
        }
      }

      String[] values;
      while ((values = reader.readNext()) != null) {
        long line = reader.getLinesRead();
        if (values.length == 1 && values[0].isBlank()) {
          continue;
        }
        CatalogRecord record = new CatalogRecord(source, line, columns, values);
        try {
          handler.handle(record);
        } catch (MalformedCatalogEntryException e) {
          if (e.getSource() == null) {
            throw new MalformedCatalogEntryException(source, line, e.getDetail(), e);
          }
          throw e;
        }
      }
    } catch (CsvValidationException e) {
      throw new MalformedCatalogEntryException(source, e.getLineNumber(), e.getMessage(), e);
    }
  }

  private String normalizeHeader(String header) {
    return header.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
  }

  private String normalizeNotes(String notes) {
    return notes == null || "nan".equalsIgnoreCase(notes) ? "" : notes;
  }

  private InputStream open(String location) throws IOException {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new MalformedCatalogEntryException(location, -1, "catalog resource not found");
    }
    return resource.getInputStream();
  }

  @FunctionalInterface
  private interface RecordHandler {
    void handle(CatalogRecord record);
  }

  private static final class CatalogRecord {
    private final String source;
    private final long line;
    private final Map<String, Integer> columns;
    private final String[] values;

    private CatalogRecord(String source, long line, Map<String, Integer> columns, String[] values) {
      this.source = source;
      this.line = line;
      this.columns = columns;
      this.values = values;
    }

    String text(String column) {
      int index = columns.get(column);
      return index < values.length ? values[index].trim() : "";
    }

    double decimal(String column) {
      String value = text(column);
      try {
        return Double.parseDouble(value);
      } catch (NumberFormatException e) {
        throw new MalformedCatalogEntryException(
            source, line, String.format("'%s' is not a number in column '%s'", value, column), e);
      }
    }

    long whole(String column) {
      double value = decimal(column);
      if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
        throw new MalformedCatalogEntryException(
            source,
            line,
            String.format("'%s' is not a whole number in column '%s'", value, column));
      }
      return (long) value;
    }
  }
}
