package com.camcompat.sizer.service.sizing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.camcompat.sizer.dto.catalog.GatewayUnit;
import com.camcompat.sizer.dto.sizing.ChannelDemand;
import com.camcompat.sizer.dto.sizing.Recommendation;
import com.camcompat.sizer.dto.sizing.ResolutionTier;
import com.camcompat.sizer.dto.sizing.UnitAllocation;
import com.camcompat.sizer.exception.NoUnitCoversDemandException;

import lombok.extern.slf4j.Slf4j;

/**
 * Chooses gateway units whose summed channel ceiling covers a demand.
 *
 * <p>Selections are ranked by ceiling excess, then by number of units, then by using more of the
 * units declared earlier in the catalog. The search is an exact dynamic program over capacity
 * sums up to {@code demand + largestCeiling - 1}: a cover with more excess than that contains a
 * unit that could be removed.
 *
 * <p>Large demands are first reduced by placing copies of the largest unit. A best selection never
 * holds {@code largestCeiling} copies of a smaller unit (that many could be swapped for fewer
 * large ones), so above {@code unitTypes * largestCeiling^2} channels it always contains the
 * pre-placed copies and the search only has to cover the bounded remainder.
 */
@Slf4j
@Service
public class UnitRecommenderService {

  public Map<ResolutionTier, Recommendation> recommend(
      ChannelDemand demand, List<GatewayUnit> units) {
    Map<ResolutionTier, Recommendation> recommendations = new EnumMap<>(ResolutionTier.class);
    for (ResolutionTier tier : ResolutionTier.values()) {
      recommendations.put(tier, recommend(demand.forTier(tier), tier, units));
    }
    return recommendations;
  }

  public Recommendation recommend(
      long requiredChannels, ResolutionTier tier, List<GatewayUnit> units) {
    if (requiredChannels < 0) {
      throw new IllegalArgumentException("Required channels must not be negative");
    }
    if (requiredChannels == 0) {
      return Recommendation.empty(tier);
    }
    if (units == null || units.isEmpty()) {
      throw new NoUnitCoversDemandException(requiredChannels, "the unit catalog is empty");
    }

    int largest = -1;
    for (int i = 0; i < units.size(); i++) {
      if (largest < 0 || units.get(i).getHighChannels() > units.get(largest).getHighChannels()) {
        largest = i;
      }
    }
    int maxCeiling = units.get(largest).getHighChannels();
    if (maxCeiling <= 0) {
      throw new NoUnitCoversDemandException(requiredChannels, "no unit has channel capacity");
    }

    long searchBound = (long) units.size() * maxCeiling * maxCeiling;
    long preplaced =
        requiredChannels > searchBound ? (requiredChannels - searchBound) / maxCeiling : 0;
    int remainder = Math.toIntExact(requiredChannels - preplaced * maxCeiling);

    long[] counts = new long[units.size()];
    int[] searched = cheapestCover(remainder, maxCeiling, units);
    for (int i = 0; i < units.size(); i++) {
      counts[i] = searched[i];
    }
    counts[largest] += preplaced;
    if (preplaced > 0) {
      log.debug(
          "Placed {} x {} before searching the remaining {} channels",
          preplaced,
          units.get(largest).getName(),
          remainder);
    }

    List<UnitAllocation> allocations = new ArrayList<>();
    long ceiling = 0;
    double storage = 0;
    for (int i = 0; i < units.size(); i++) {
      if (counts[i] > 0) {
        GatewayUnit unit = units.get(i);
        allocations.add(new UnitAllocation(unit, counts[i]));
        ceiling += unit.getHighChannels() * counts[i];
        storage += unit.getStorageTb() * counts[i];
      }
    }

    Recommendation recommendation =
        Recommendation.builder()
            .tier(tier)
            .requiredChannels(requiredChannels)
            .allocations(allocations)
            .ceilingCapacity(ceiling)
            .excessChannels(calculateExcess(requiredChannels, allocations))
            .storageTb(storage)
            .build();

    log.info(
        "Recommended {} unit(s) for {} {}-tier channels, ceiling {}, excess {}",
        recommendation.getUnitCount(),
        requiredChannels,
        tier.getLabel(),
        ceiling,
        recommendation.getExcessChannels());
    return recommendation;
  }

  /**
   * Worst-case spare capacity: the chosen units' low channel bounds minus the requirement. Not
   * clamped; a negative value means the conservative figure falls short of the demand.
   */
  public long calculateExcess(long channelsRequired, List<UnitAllocation> chosenUnits) {
    long lowCapacity = 0;
    for (UnitAllocation allocation : chosenUnits) {
      lowCapacity += allocation.getUnit().getLowChannels() * allocation.getCount();
    }
    return lowCapacity - channelsRequired;
  }

  private int[] cheapestCover(int required, int maxCeiling, List<GatewayUnit> units) {
    int limit = Math.addExact(required, maxCeiling - 1);
    int unitTypes = units.size();

    // unitCount[t] < 0 marks sums no combination reaches exactly
    int[] unitCount = new int[limit + 1];
    int[][] mix = new int[limit + 1][];
    Arrays.fill(unitCount, -1);
    unitCount[0] = 0;
    mix[0] = new int[unitTypes];

    for (int total = 1; total <= limit; total++) {
      for (int i = 0; i < unitTypes; i++) {
        int ceiling = units.get(i).getHighChannels();
        if (ceiling <= 0 || ceiling > total || unitCount[total - ceiling] < 0) {
          continue;
        }
        int candidateCount = unitCount[total - ceiling] + 1;
        int[] candidate = mix[total - ceiling].clone();
        candidate[i]++;
        if (unitCount[total] < 0
            || candidateCount < unitCount[total]
            || (candidateCount == unitCount[total] && prefersEarlierUnits(candidate, mix[total]))) {
          unitCount[total] = candidateCount;
          mix[total] = candidate;
        }
      }
    }

    for (int total = required; total <= limit; total++) {
      if (unitCount[total] >= 0) {
        log.debug(
            "Cheapest cover for {} channels reaches {} with {} units",
            required,
            total,
            unitCount[total]);
        return mix[total];
      }
    }
    // unreachable while any unit has a positive ceiling
    throw new NoUnitCoversDemandException(required, "no combination of units covers the demand");
  }

  private boolean prefersEarlierUnits(int[] candidate, int[] current) {
    for (int i = 0; i < candidate.length; i++) {
      if (candidate[i] != current[i]) {
        return candidate[i] > current[i];
      }
    }
    return false;
  }
}
