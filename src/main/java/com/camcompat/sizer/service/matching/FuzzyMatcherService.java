package com.camcompat.sizer.service.matching;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.camcompat.sizer.config.SizerProperties;
import com.camcompat.sizer.dto.catalog.HardwareCatalog;
import com.camcompat.sizer.dto.inventory.InventoryCell;
import com.camcompat.sizer.dto.inventory.InventoryRow;
import com.camcompat.sizer.dto.matching.BestMatch;
import com.camcompat.sizer.dto.matching.MatchResult;
import com.camcompat.sizer.dto.matching.MatchTier;
import com.camcompat.sizer.service.matching.SimilarityScoringService.Scorer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies inventory model strings against the catalog.
 *
 * <p>Tiers are decided in a fixed order, first hit wins:
 *
 * <ol>
 *   <li>plain or token-set score of 100: {@code exact} (plain scorer's camera preferred)
 *   <li>token-sort score of 100: {@code identified}
 *   <li>token-set score at or above the potential threshold: {@code potential}
 *   <li>anything else: {@code unsupported}
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FuzzyMatcherService {

  private final SimilarityScoringService similarityScoringService;
  private final SizerProperties sizerProperties;

  public MatchResult classify(String rawValue, HardwareCatalog catalog) {
    return classify(InventoryCell.of(rawValue), catalog);
  }

  /** Classifies one cell with a count of 1. Blank and numeric cells are always unsupported. */
  public MatchResult classify(InventoryCell cell, HardwareCatalog catalog) {
    if (cell == null || !cell.isText()) {
      return MatchResult.unsupported(cell != null ? cell.getText() : null, 1);
    }
    String raw = cell.getText();

    BestMatch plain = similarityScoringService.bestMatch(Scorer.PLAIN, raw, catalog);
    BestMatch tokenSort = similarityScoringService.bestMatch(Scorer.TOKEN_SORT, raw, catalog);
    BestMatch tokenSet = similarityScoringService.bestMatch(Scorer.TOKEN_SET, raw, catalog);

    log.debug(
        "Scores for '{}': plain={} sort={} set={}",
        raw,
        plain.getScore(),
        tokenSort.getScore(),
        tokenSet.getScore());

    if (plain.isPerfect() || tokenSet.isPerfect()) {
      BestMatch winner = plain.isPerfect() ? plain : tokenSet;
      return new MatchResult(raw, MatchTier.EXACT, winner.getCamera(), 1);
    }
    if (tokenSort.isPerfect()) {
      return new MatchResult(raw, MatchTier.IDENTIFIED, tokenSort.getCamera(), 1);
    }
    if (tokenSet.getCamera() != null
        && tokenSet.getScore() >= sizerProperties.getMatching().getPotentialThreshold()) {
      return new MatchResult(raw, MatchTier.POTENTIAL, tokenSet.getCamera(), 1);
    }
    return MatchResult.unsupported(raw, 1);
  }

  /**
   * Classifies each distinct raw model string once and folds the quantities of all rows sharing
   * it. Blank model cells are skipped. Results are ordered by tier, then by first appearance.
   */
  public List<MatchResult> classifyAll(List<InventoryRow> rows, HardwareCatalog catalog) {
    Map<String, InventoryCell> firstCells = new LinkedHashMap<>();
    Map<String, Long> counts = new LinkedHashMap<>();
    for (InventoryRow row : rows) {
      InventoryCell cell = row.getModel();
      if (cell == null || cell.isBlank()) {
        continue;
      }
      firstCells.putIfAbsent(cell.getText(), cell);
      counts.merge(cell.getText(), row.getQuantity(), Math::addExact);
    }

    List<MatchResult> results = new ArrayList<>(firstCells.size());
    for (Map.Entry<String, InventoryCell> entry : firstCells.entrySet()) {
      MatchResult result = classify(entry.getValue(), catalog);
      results.add(result.withCount(counts.get(entry.getKey())));
    }
    results.sort(MatchResult.BY_TIER);

    log.info(
        "Classified {} distinct model values from {} rows against {} catalog cameras",
        results.size(),
        rows.size(),
        catalog.getCameras().size());
    return results;
  }
}
