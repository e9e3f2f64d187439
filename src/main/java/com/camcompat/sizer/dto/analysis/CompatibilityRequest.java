package com.camcompat.sizer.dto.analysis;

import com.camcompat.sizer.dto.inventory.InventoryTable;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompatibilityRequest {

  private InventoryTable inventory;

  /** Forces the model column; when null the column is identified from the cell values. */
  private Integer modelColumn;

  /** Retention in days; when null the configured default applies. */
  private Integer retentionDays;
}
