package com.camcompat.sizer.service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.camcompat.sizer.config.SizerProperties;
import com.camcompat.sizer.dto.analysis.CompatibilityReport;
import com.camcompat.sizer.dto.analysis.CompatibilityReport.ProcessingMetadata;
import com.camcompat.sizer.dto.analysis.CompatibilityReport.Summary;
import com.camcompat.sizer.dto.analysis.CompatibilityRequest;
import com.camcompat.sizer.dto.catalog.HardwareCatalog;
import com.camcompat.sizer.dto.inventory.InventoryRow;
import com.camcompat.sizer.dto.inventory.InventoryTable;
import com.camcompat.sizer.dto.matching.MatchResult;
import com.camcompat.sizer.dto.matching.MatchTier;
import com.camcompat.sizer.dto.sizing.ChannelDemand;
import com.camcompat.sizer.dto.sizing.Recommendation;
import com.camcompat.sizer.dto.sizing.ResolutionTier;
import com.camcompat.sizer.dto.sizing.StorageEstimate;
import com.camcompat.sizer.exception.NoModelColumnFoundException;
import com.camcompat.sizer.exception.UnsupportedRetentionPeriodException;
import com.camcompat.sizer.service.catalog.CatalogLoaderService;
import com.camcompat.sizer.service.data_processing.InventorySanitizerService;
import com.camcompat.sizer.service.matching.ColumnIdentifierService;
import com.camcompat.sizer.service.matching.FuzzyMatcherService;
import com.camcompat.sizer.service.sizing.ChannelAggregatorService;
import com.camcompat.sizer.service.sizing.StorageEstimatorService;
import com.camcompat.sizer.service.sizing.UnitRecommenderService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one inventory through the whole pipeline: column identification, classification, channel
 * aggregation, unit recommendation and storage estimation. Each call works on its own copy of the
 * data and returns a fresh report; the only shared state is the read-only catalog.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompatibilityAnalysisService {

  static final String RUN_ID_MDC_KEY = "runId";
  static final String INVENTORY_MDC_KEY = "inventory";

  private final CatalogLoaderService catalogLoaderService;
  private final InventorySanitizerService inventorySanitizerService;
  private final ColumnIdentifierService columnIdentifierService;
  private final FuzzyMatcherService fuzzyMatcherService;
  private final ChannelAggregatorService channelAggregatorService;
  private final UnitRecommenderService unitRecommenderService;
  private final StorageEstimatorService storageEstimatorService;
  private final SizerProperties sizerProperties;

  public CompatibilityReport analyze(CompatibilityRequest request) {
    return analyze(request, catalogLoaderService.getCatalog());
  }

  /**
   * Analyzes {@code request} against an explicit catalog snapshot.
   *
   * @throws NoModelColumnFoundException if no column resembles camera model names
   * @throws UnsupportedRetentionPeriodException if the retention is outside 1-90 days
   * @throws IllegalArgumentException if the request has no inventory or the forced model column
   *     is outside the table
   */
  public CompatibilityReport analyze(CompatibilityRequest request, HardwareCatalog catalog) {
    if (request == null || request.getInventory() == null) {
      throw new IllegalArgumentException("Request must contain an inventory table");
    }
    if (catalog == null) {
      throw new IllegalArgumentException("Catalog must not be null");
    }
    long startTime = System.currentTimeMillis();
    InventoryTable table = request.getInventory();
    String runId = UUID.randomUUID().toString();

    try {
      MDC.put(RUN_ID_MDC_KEY, runId);
      MDC.put(INVENTORY_MDC_KEY, table.getName());

      log.info(
          "Starting compatibility analysis of '{}' with {} columns and {} rows",
          table.getName(),
          table.getColumnCount(),
          table.getRowCount());

      int retentionDays = resolveRetentionDays(request);
      Integer forcedColumn = request.getModelColumn();
      if (forcedColumn != null && (forcedColumn < 0 || forcedColumn >= table.getColumnCount())) {
        throw new IllegalArgumentException(
            String.format(
                "Model column %d is outside the inventory's %d columns",
                forcedColumn, table.getColumnCount()));
      }

      List<Integer> droppedColumns = columnsToDrop(table, forcedColumn);
      Integer forcedWorkingColumn =
          forcedColumn != null ? toWorkingIndex(forcedColumn, droppedColumns) : null;
      InventoryTable working =
          inventorySanitizerService.stripCellNoise(
              table.withoutColumns(droppedColumns),
              forcedWorkingColumn != null ? forcedWorkingColumn : -1);

      int modelColumn;
      if (forcedWorkingColumn != null) {
        modelColumn = forcedWorkingColumn;
        log.info("Using forced model column {}", forcedColumn);
      } else {
        OptionalInt identified = columnIdentifierService.identifyModelColumn(working, catalog);
        if (identified.isEmpty()) {
          throw new NoModelColumnFoundException(working.getColumnCount());
        }
        modelColumn = identified.getAsInt();
      }
      OptionalInt countColumn = columnIdentifierService.identifyCountColumn(working, modelColumn);

      List<InventoryRow> rows =
          columnIdentifierService.extractRows(working, modelColumn, countColumn);
      List<MatchResult> matchResults = fuzzyMatcherService.classifyAll(rows, catalog);
      ChannelDemand demand = channelAggregatorService.aggregate(matchResults, catalog);
      Map<ResolutionTier, Recommendation> recommendations =
          unitRecommenderService.recommend(demand, catalog.getUnits());
      Map<ResolutionTier, StorageEstimate> storage =
          storageEstimatorService.estimate(demand, retentionDays);

      long processingTime = System.currentTimeMillis() - startTime;
      log.info(
          "Completed compatibility analysis of '{}' in {}ms: {} distinct models",
          table.getName(),
          processingTime,
          matchResults.size());

      return CompatibilityReport.builder()
          .inventoryName(table.getName())
          .modelColumn(toOriginalIndex(modelColumn, droppedColumns))
          .countColumn(
              countColumn.isPresent()
                  ? toOriginalIndex(countColumn.getAsInt(), droppedColumns)
                  : null)
          .matchResults(matchResults)
          .channelDemand(demand)
          .recommendations(recommendations)
          .storage(storage)
          .summary(summarize(matchResults))
          .processingMetadata(
              ProcessingMetadata.builder()
                  .runId(runId)
                  .totalColumns(table.getColumnCount())
                  .droppedColumns(droppedColumns)
                  .totalRowsProcessed(rows.size())
                  .retentionDays(retentionDays)
                  .processingTimeMs(processingTime)
                  .build())
          .build();
    } finally {
      MDC.remove(RUN_ID_MDC_KEY);
      MDC.remove(INVENTORY_MDC_KEY);
    }
  }

  private int resolveRetentionDays(CompatibilityRequest request) {
    int retentionDays =
        request.getRetentionDays() != null
            ? request.getRetentionDays()
            : sizerProperties.getStorage().getDefaultRetentionDays();
    try {
      storageEstimatorService.retentionBand(retentionDays);
    } catch (UnsupportedRetentionPeriodException e) {
      log.warn("Rejecting retention of {} days", retentionDays);
      throw e;
    }
    return retentionDays;
  }

  private List<Integer> columnsToDrop(InventoryTable table, Integer forcedColumn) {
    List<Integer> columns = new ArrayList<>(inventorySanitizerService.findColumnsToDrop(table));
    if (forcedColumn != null) {
      columns.remove(forcedColumn);
    }
    if (!columns.isEmpty()) {
      log.info("Dropping {} address, serial or row-number column(s): {}", columns.size(), columns);
    }
    return columns;
  }

  private int toWorkingIndex(int originalIndex, List<Integer> droppedColumns) {
    int shift = 0;
    for (int dropped : droppedColumns) {
      if (dropped < originalIndex) {
        shift++;
      }
    }
    return originalIndex - shift;
  }

  private int toOriginalIndex(int workingIndex, List<Integer> droppedColumns) {
    int original = -1;
    int seen = -1;
    while (seen < workingIndex) {
      original++;
      if (!droppedColumns.contains(original)) {
        seen++;
      }
    }
    return original;
  }

  private Summary summarize(List<MatchResult> matchResults) {
    Map<MatchTier, Long> unitsByTier = new EnumMap<>(MatchTier.class);
    for (MatchTier tier : MatchTier.values()) {
      unitsByTier.put(tier, 0L);
    }
    long total = 0;
    long supported = 0;
    for (MatchResult result : matchResults) {
      unitsByTier.merge(result.getTier(), result.getCount(), Math::addExact);
      total = Math.addExact(total, result.getCount());
      if (result.getTier().isSupported()) {
        supported = Math.addExact(supported, result.getCount());
      }
    }
    return Summary.builder()
        .unitsByTier(unitsByTier)
        .totalUnits(total)
        .supportedUnits(supported)
        .supportedFraction(total == 0 ? 0.0 : (double) supported / total)
        .build();
  }
}
