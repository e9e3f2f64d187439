package com.camcompat.sizer.service.matching;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.camcompat.sizer.dto.catalog.CatalogCamera;
import com.camcompat.sizer.dto.catalog.HardwareCatalog;
import com.camcompat.sizer.dto.matching.BestMatch;

/**
 * String similarity scorers on a 0-100 scale. Both sides are lower-cased, stripped of punctuation
 * and whitespace-collapsed before comparison, so "Dome-4MP" and "dome 4mp " compare equal.
 */
@Service
public class SimilarityScoringService {

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public enum Scorer {
    /** Character-level ratio over the whole string. */
    PLAIN,
    /** Ratio after sorting the tokens of both strings. */
    TOKEN_SORT,
    /** Ratio built from shared and leftover token sets. */
    TOKEN_SET
  }

  public String preprocess(String value) {
    if (value == null) {
      return "";
    }
    String lowered = value.toLowerCase(Locale.ROOT);
    String spaced = NON_ALPHANUMERIC.matcher(lowered).replaceAll(" ");
    return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
  }

  public int score(Scorer scorer, String left, String right) {
    String a = preprocess(left);
    String b = preprocess(right);
    switch (scorer) {
      case PLAIN:
        return indelRatio(a, b);
      case TOKEN_SORT:
        return indelRatio(sortTokens(a), sortTokens(b));
      case TOKEN_SET:
        return setRatio(a, b);
      default:
        throw new IllegalArgumentException("Unknown scorer: " + scorer);
    }
  }

  public int ratio(String left, String right) {
    return score(Scorer.PLAIN, left, right);
  }

  public int tokenSortRatio(String left, String right) {
    return score(Scorer.TOKEN_SORT, left, right);
  }

  public int tokenSetRatio(String left, String right) {
    return score(Scorer.TOKEN_SET, left, right);
  }

  /**
   * Scores {@code query} against every catalog model name. The first camera in catalog order wins
   * a tie, so the result is stable for a fixed catalog.
   */
  public BestMatch bestMatch(Scorer scorer, String query, HardwareCatalog catalog) {
    if (preprocess(query).isEmpty()) {
      return BestMatch.none();
    }
    CatalogCamera best = null;
    int bestScore = -1;
    for (CatalogCamera camera : catalog.getCameras()) {
      int current = score(scorer, query, camera.getModelName());
      if (current > bestScore) {
        best = camera;
        bestScore = current;
        if (bestScore == 100) {
          break;
        }
      }
    }
    return best == null ? BestMatch.none() : new BestMatch(best, bestScore);
  }

  /**
   * 200 * LCS / (|a| + |b|), rounded. Only identical strings reach 100, rounding never promotes a
   * near miss to a perfect score.
   */
  private int indelRatio(String a, String b) {
    if (a.isEmpty() || b.isEmpty()) {
      return 0;
    }
    if (a.equals(b)) {
      return 100;
    }
    int lcs = longestCommonSubsequence(a, b);
    int rounded = (int) Math.round(200.0 * lcs / (a.length() + b.length()));
    return Math.min(rounded, 99);
  }

  private int setRatio(String a, String b) {
    TreeSet<String> tokensA = tokens(a);
    TreeSet<String> tokensB = tokens(b);
    if (tokensA.isEmpty() || tokensB.isEmpty()) {
      return 0;
    }
    TreeSet<String> intersection = new TreeSet<>(tokensA);
    intersection.retainAll(tokensB);
    TreeSet<String> onlyA = new TreeSet<>(tokensA);
    onlyA.removeAll(tokensB);
    TreeSet<String> onlyB = new TreeSet<>(tokensB);
    onlyB.removeAll(tokensA);

    if (!intersection.isEmpty() && (onlyA.isEmpty() || onlyB.isEmpty())) {
      return 100;
    }

    String shared = String.join(" ", intersection);
    String combinedA = (shared + " " + String.join(" ", onlyA)).trim();
    String combinedB = (shared + " " + String.join(" ", onlyB)).trim();

    return Math.max(
        indelRatio(shared, combinedA),
        Math.max(indelRatio(shared, combinedB), indelRatio(combinedA, combinedB)));
  }

  private String sortTokens(String value) {
    if (value.isEmpty()) {
      return value;
    }
    // repeated tokens are kept, unlike the token-set comparison
    List<String> sorted = new ArrayList<>(Arrays.asList(value.split(" ")));
    sorted.sort(String::compareTo);
    return String.join(" ", sorted);
  }

  private TreeSet<String> tokens(String value) {
    TreeSet<String> tokens = new TreeSet<>();
    if (value.isEmpty()) {
      return tokens;
    }
    tokens.addAll(Arrays.asList(value.split(" ")));
    return tokens;
  }

  private int longestCommonSubsequence(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int i = 1; i <= a.length(); i++) {
      char ca = a.charAt(i - 1);
      for (int j = 1; j <= b.length(); j++) {
        if (ca == b.charAt(j - 1)) {
          current[j] = previous[j - 1] + 1;
        } else {
          current[j] = Math.max(previous[j], current[j - 1]);
        }
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }
}
