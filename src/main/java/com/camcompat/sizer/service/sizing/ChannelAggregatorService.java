package com.camcompat.sizer.service.sizing;

import java.util.List;

import org.springframework.stereotype.Service;

import com.camcompat.sizer.config.SizerProperties;
import com.camcompat.sizer.dto.catalog.CatalogCamera;
import com.camcompat.sizer.dto.catalog.HardwareCatalog;
import com.camcompat.sizer.dto.matching.MatchResult;
import com.camcompat.sizer.dto.sizing.ChannelDemand;
import com.camcompat.sizer.dto.sizing.ResolutionTier;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelAggregatorService {

  private final SizerProperties sizerProperties;

  /**
   * Sums channel cost times count for every matched result into the tier of its camera.
   * Unsupported results add nothing.
   *
   * @throws IllegalArgumentException if a result references a camera missing from {@code catalog}
   */
  public ChannelDemand aggregate(List<MatchResult> matchResults, HardwareCatalog catalog) {
    ChannelDemand demand = ChannelDemand.none();
    for (MatchResult result : matchResults) {
      if (!result.isMatched()) {
        continue;
      }
      CatalogCamera camera =
          catalog
              .findCamera(result.getMatchedModel())
              .orElseThrow(
                  () ->
                      new IllegalArgumentException(
                          "Matched model '"
                              + result.getMatchedModel()
                              + "' is not part of the catalog"));
      demand = demand.add(tierOf(camera), channelsFor(camera, result.getCount()));
    }
    log.info(
        "Channel demand: low tier {}, high tier {}",
        demand.getLowTierChannels(),
        demand.getHighTierChannels());
    return demand;
  }

  public ResolutionTier tierOf(CatalogCamera camera) {
    return ResolutionTier.forMegapixels(
        camera.getMegapixels(), sizerProperties.getMatching().getResolutionThresholdMp());
  }

  private long channelsFor(CatalogCamera camera, long count) {
    return Math.multiplyExact(camera.getChannelCost(), count);
  }
}
