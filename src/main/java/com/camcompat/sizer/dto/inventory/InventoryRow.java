package com.camcompat.sizer.dto.inventory;

import lombok.Builder;
import lombok.Value;

/** The model cell of one spreadsheet row plus the quantity that row stands for. */
@Value
@Builder
public class InventoryRow {

  InventoryCell model;

  long quantity;
}
