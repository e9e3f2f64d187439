package com.camcompat.sizer.dto.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import com.camcompat.sizer.exception.MalformedCatalogEntryException;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Read-only snapshot of the compatible cameras and gateway units. Declaration order is preserved
 * and is the tie-break order wherever two entries score the same.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class HardwareCatalog {

  private final List<CatalogCamera> cameras;
  private final List<GatewayUnit> units;

  private HardwareCatalog(List<CatalogCamera> cameras, List<GatewayUnit> units) {
    this.cameras = Collections.unmodifiableList(new ArrayList<>(cameras));
    this.units = Collections.unmodifiableList(new ArrayList<>(units));
  }

  /**
   * Builds a catalog after checking every record.
   *
   * @throws MalformedCatalogEntryException if a camera has a blank or duplicate model name, a
   *     negative resolution or a channel cost below 1, or a unit has an inverted channel range
   */
  public static HardwareCatalog of(List<CatalogCamera> cameras, List<GatewayUnit> units) {
    if (cameras == null || units == null) {
      throw new IllegalArgumentException("Catalog cameras and units must not be null");
    }
    Set<String> seenModels = new HashSet<>();
    for (CatalogCamera camera : cameras) {
      validateCamera(camera);
      if (!seenModels.add(camera.getModelName().trim().toLowerCase(Locale.ROOT))) {
        throw new MalformedCatalogEntryException(
            "duplicate camera model '" + camera.getModelName() + "'");
      }
    }
    for (GatewayUnit unit : units) {
      validateUnit(unit);
    }
    return new HardwareCatalog(cameras, units);
  }

  public static void validateCamera(CatalogCamera camera) {
    if (camera == null) {
      throw new MalformedCatalogEntryException("null camera record");
    }
    if (camera.getModelName() == null || camera.getModelName().isBlank()) {
      throw new MalformedCatalogEntryException("camera model name is blank");
    }
    if (camera.getChannelCost() < 1) {
      throw new MalformedCatalogEntryException(
          String.format(
              "camera '%s' has channel cost %d, must be at least 1",
              camera.getModelName(), camera.getChannelCost()));
    }
    if (camera.getMegapixels() < 0 || Double.isNaN(camera.getMegapixels())) {
      throw new MalformedCatalogEntryException(
          String.format(
              "camera '%s' has invalid resolution %s",
              camera.getModelName(), camera.getMegapixels()));
    }
  }

  public static void validateUnit(GatewayUnit unit) {
    if (unit == null) {
      throw new MalformedCatalogEntryException("null gateway unit record");
    }
    if (unit.getName() == null || unit.getName().isBlank()) {
      throw new MalformedCatalogEntryException("gateway unit name is blank");
    }
    if (unit.getLowChannels() < 0 || unit.getLowChannels() > unit.getHighChannels()) {
      throw new MalformedCatalogEntryException(
          String.format(
              "gateway unit '%s' has channel range %d..%d",
              unit.getName(), unit.getLowChannels(), unit.getHighChannels()));
    }
    if (unit.getStorageTb() < 0) {
      throw new MalformedCatalogEntryException(
          String.format("gateway unit '%s' has negative storage", unit.getName()));
    }
  }

  public Optional<CatalogCamera> findCamera(String modelName) {
    return cameras.stream().filter(camera -> camera.hasModelName(modelName)).findFirst();
  }
}
