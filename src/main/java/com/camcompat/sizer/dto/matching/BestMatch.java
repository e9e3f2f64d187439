package com.camcompat.sizer.dto.matching;

import com.camcompat.sizer.dto.catalog.CatalogCamera;

import lombok.Value;

/** Highest-scoring catalog camera for one scorer, with its 0-100 score. */
@Value
public class BestMatch {

  private static final BestMatch NONE = new BestMatch(null, 0);

  CatalogCamera camera;

  int score;

  public static BestMatch none() {
    return NONE;
  }

  public boolean isPerfect() {
    return camera != null && score == 100;
  }
}
