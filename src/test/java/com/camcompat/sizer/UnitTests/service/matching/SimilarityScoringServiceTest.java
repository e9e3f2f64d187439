package com.camcompat.sizer.service.matching;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.camcompat.sizer.dto.catalog.HardwareCatalog;
import com.camcompat.sizer.dto.matching.BestMatch;
import com.camcompat.sizer.fixtures.TestFixtures;
import com.camcompat.sizer.service.matching.SimilarityScoringService.Scorer;

@DisplayName("Similarity Scoring Service Tests")
class SimilarityScoringServiceTest {

  private SimilarityScoringService scoringService;

  @BeforeEach
  void setUp() {
    scoringService = new SimilarityScoringService();
  }

  @Nested
  @DisplayName("Preprocessing")
  class Preprocessing {

    @Test
    @DisplayName("Should lower-case, strip punctuation and collapse whitespace")
    void shouldNormalizeNoise() {
      assertThat(scoringService.preprocess("  Dome-4MP  ")).isEqualTo("dome 4mp");
      assertThat(scoringService.preprocess("DS-2CD2143G2-I")).isEqualTo("ds 2cd2143g2 i");
      assertThat(scoringService.preprocess("Axis\tM3106-L   Mk II"))
          .isEqualTo("axis m3106 l mk ii");
    }

    @Test
    @DisplayName("Should map null and punctuation-only values to an empty string")
    void shouldHandleEmptyInput() {
      assertThat(scoringService.preprocess(null)).isEmpty();
      assertThat(scoringService.preprocess(" -- / ")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Plain ratio")
  class PlainRatio {

    @Test
    @DisplayName("Should score identical strings after preprocessing as 100")
    void shouldScoreIdenticalAsPerfect() {
      assertThat(scoringService.ratio("dome 4mp ", "Dome-4MP")).isEqualTo(100);
    }

    @Test
    @DisplayName("Should score by longest common subsequence")
    void shouldScoreByCommonSubsequence() {
      // LCS("abc", "abd") = 2, 200 * 2 / 6 rounds to 67
      assertThat(scoringService.ratio("abc", "abd")).isEqualTo(67);
      // LCS("av4656", "av4656dn") = 6, 200 * 6 / 14 rounds to 86
      assertThat(scoringService.ratio("AV4656", "AV4656DN")).isEqualTo(86);
    }

    @Test
    @DisplayName("Should never round a near miss up to 100")
    void shouldCapNearMisses() {
      String longer = "x".repeat(151);
      String shorter = "x".repeat(150);

      assertThat(scoringService.ratio(shorter, longer)).isEqualTo(99);
    }

    @Test
    @DisplayName("Should score empty input as 0")
    void shouldScoreEmptyAsZero() {
      assertThat(scoringService.ratio("", "dome")).isZero();
      assertThat(scoringService.ratio(null, null)).isZero();
    }
  }

  @Nested
  @DisplayName("Token scorers")
  class TokenScorers {

    @Test
    @DisplayName("Token sort should ignore word order")
    void tokenSortShouldIgnoreOrder() {
      assertThat(scoringService.tokenSortRatio("Dome 4MP Hikvision", "Hikvision Dome 4MP"))
          .isEqualTo(100);
      assertThat(scoringService.ratio("Dome 4MP Hikvision", "Hikvision Dome 4MP"))
          .isLessThan(100);
    }

    @Test
    @DisplayName("Token sort should keep repeated tokens")
    void tokenSortShouldKeepRepeats() {
      assertThat(scoringService.tokenSortRatio("dome dome 4mp", "dome 4mp")).isLessThan(100);
    }

    @Test
    @DisplayName("Token set should tolerate a manufacturer prefix")
    void tokenSetShouldTolerateExtraTokens() {
      assertThat(scoringService.tokenSetRatio("Hikvision Dome 4MP", "dome-4mp")).isEqualTo(100);
      assertThat(scoringService.tokenSetRatio("Axis P3245-V", "P3245-V")).isEqualTo(100);
    }

    @Test
    @DisplayName("Token set should fall back to the combined ratios without shared tokens")
    void tokenSetWithoutSharedTokens() {
      assertThat(scoringService.tokenSetRatio("AV4656", "AV4656DN")).isEqualTo(86);
      assertThat(scoringService.tokenSetRatio("dome 4mp", "bullet 8mp")).isLessThan(80);
    }

    @Test
    @DisplayName("Score should dispatch on the scorer")
    void scoreShouldDispatch() {
      assertThat(scoringService.score(Scorer.PLAIN, "4mp dome", "dome 4mp")).isLessThan(100);
      assertThat(scoringService.score(Scorer.TOKEN_SORT, "4mp dome", "dome 4mp")).isEqualTo(100);
      assertThat(scoringService.score(Scorer.TOKEN_SET, "4mp dome", "dome 4mp")).isEqualTo(100);
    }
  }

  @Nested
  @DisplayName("Best match")
  class BestMatchSearch {

    @Test
    @DisplayName("Should return the best scoring catalog camera")
    void shouldFindBestCamera() {
      HardwareCatalog catalog = TestFixtures.smallCatalog();

      BestMatch match = scoringService.bestMatch(Scorer.PLAIN, "bullet 8mp", catalog);

      assertThat(match.getCamera()).isEqualTo(TestFixtures.bulletCamera());
      assertThat(match.getScore()).isEqualTo(100);
      assertThat(match.isPerfect()).isTrue();
    }

    @Test
    @DisplayName("Should break ties by catalog order")
    void shouldBreakTiesByCatalogOrder() {
      // Given
      HardwareCatalog catalog =
          TestFixtures.catalogOf(
              TestFixtures.camera("Cam A1", 2.0, 1), TestFixtures.camera("Cam A2", 2.0, 1));

      // When
      BestMatch match = scoringService.bestMatch(Scorer.PLAIN, "cam a", catalog);

      // Then
      assertThat(match.getCamera().getModelName()).isEqualTo("Cam A1");
      assertThat(match.getScore()).isEqualTo(91);
    }

    @Test
    @DisplayName("Should return no match for a blank query or an empty catalog")
    void shouldReturnNoneForBlankQuery() {
      assertThat(scoringService.bestMatch(Scorer.TOKEN_SET, "  ", TestFixtures.smallCatalog()))
          .isEqualTo(BestMatch.none());
      assertThat(scoringService.bestMatch(Scorer.PLAIN, "dome", TestFixtures.catalogOf()))
          .isEqualTo(BestMatch.none());
    }
  }
}
