package com.camcompat.sizer.dto.analysis;

import java.util.List;
import java.util.Map;

import com.camcompat.sizer.dto.matching.MatchResult;
import com.camcompat.sizer.dto.matching.MatchTier;
import com.camcompat.sizer.dto.sizing.ChannelDemand;
import com.camcompat.sizer.dto.sizing.Recommendation;
import com.camcompat.sizer.dto.sizing.ResolutionTier;
import com.camcompat.sizer.dto.sizing.StorageEstimate;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Everything one sizing run produces, handed to the caller for display or export. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompatibilityReport {

  @JsonProperty("inventory_name")
  private String inventoryName;

  @JsonProperty("model_column")
  private Integer modelColumn;

  @JsonProperty("count_column")
  private Integer countColumn;

  @JsonProperty("match_results")
  private List<MatchResult> matchResults;

  @JsonProperty("channel_demand")
  private ChannelDemand channelDemand;

  @JsonProperty("recommendations")
  private Map<ResolutionTier, Recommendation> recommendations;

  @JsonProperty("storage")
  private Map<ResolutionTier, StorageEstimate> storage;

  @JsonProperty("summary")
  private Summary summary;

  @JsonProperty("processing_metadata")
  private ProcessingMetadata processingMetadata;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Summary {

    /** Inventory units (summed counts) per match tier. */
    @JsonProperty("units_by_tier")
    private Map<MatchTier, Long> unitsByTier;

    @JsonProperty("total_units")
    private Long totalUnits;

    @JsonProperty("supported_units")
    private Long supportedUnits;

    @JsonProperty("supported_fraction")
    private Double supportedFraction;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ProcessingMetadata {

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("total_columns")
    private Integer totalColumns;

    @JsonProperty("dropped_columns")
    private List<Integer> droppedColumns;

    @JsonProperty("total_rows_processed")
    private Integer totalRowsProcessed;

    @JsonProperty("retention_days")
    private Integer retentionDays;

    @JsonProperty("processing_time_ms")
    private Long processingTimeMs;
  }
}
