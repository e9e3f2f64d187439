package com.camcompat.sizer.dto.inventory;

public enum CellKind {
  BLANK,
  NUMERIC,
  TEXT
}
