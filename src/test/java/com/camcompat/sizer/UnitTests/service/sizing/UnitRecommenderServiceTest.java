package com.camcompat.sizer.service.sizing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.camcompat.sizer.dto.catalog.GatewayUnit;
import com.camcompat.sizer.dto.sizing.ChannelDemand;
import com.camcompat.sizer.dto.sizing.Recommendation;
import com.camcompat.sizer.dto.sizing.ResolutionTier;
import com.camcompat.sizer.dto.sizing.UnitAllocation;
import com.camcompat.sizer.exception.NoUnitCoversDemandException;
import com.camcompat.sizer.fixtures.TestFixtures;

@DisplayName("Unit Recommender Service Tests")
class UnitRecommenderServiceTest {

  private UnitRecommenderService recommenderService;

  @BeforeEach
  void setUp() {
    recommenderService = new UnitRecommenderService();
  }

  @Nested
  @DisplayName("Selection")
  class Selection {

    @Test
    @DisplayName("Should cover 20 channels with a single X2")
    void shouldPickSingleLargeUnit() {
      // When
      Recommendation recommendation =
          recommenderService.recommend(20, ResolutionTier.LOW, TestFixtures.walkthroughUnits());

      // Then
      assertThat(recommendation.getAllocations()).hasSize(1);
      UnitAllocation allocation = recommendation.getAllocations().get(0);
      assertThat(allocation.getUnit().getName()).isEqualTo("X2");
      assertThat(allocation.getCount()).isEqualTo(1);
      assertThat(recommendation.getCeilingCapacity()).isEqualTo(32);
      assertThat(recommendation.getStorageTb()).isEqualTo(8.0);
      // conservative excess uses the low bound and is reported unclamped
      assertThat(recommendation.getExcessChannels()).isEqualTo(-19);
    }

    @Test
    @DisplayName("Should prefer the earlier declared unit between equivalent choices")
    void shouldPreferEarlierUnit() {
      Recommendation recommendation =
          recommenderService.recommend(10, ResolutionTier.HIGH, TestFixtures.connectorUnits());

      assertThat(recommendation.getAllocations()).hasSize(1);
      assertThat(recommendation.getAllocations().get(0).getUnit().getName())
          .isEqualTo("CC300-4TB");
      assertThat(recommendation.getExcessChannels()).isEqualTo(-5);
      assertThat(recommendation.getTier()).isEqualTo(ResolutionTier.HIGH);
    }

    @Test
    @DisplayName("Should mix unit sizes to hit the demand exactly")
    void shouldMixUnits() {
      Recommendation recommendation =
          recommenderService.recommend(60, ResolutionTier.LOW, TestFixtures.connectorUnits());

      assertThat(recommendation.getCeilingCapacity()).isEqualTo(60);
      assertThat(recommendation.getUnitCount()).isEqualTo(2);
      assertThat(recommendation.getAllocations())
          .extracting(allocation -> allocation.getUnit().getName())
          .containsExactly("CC300-4TB", "CC700-16TB");
      assertThat(recommendation.getStorageTb()).isEqualTo(20.0);
      assertThat(recommendation.getExcessChannels()).isEqualTo(5 + 25 - 60);
    }

    @Test
    @DisplayName("Should return an empty selection for zero demand")
    void shouldReturnEmptyForZeroDemand() {
      Recommendation recommendation =
          recommenderService.recommend(0, ResolutionTier.LOW, TestFixtures.walkthroughUnits());

      assertThat(recommendation.isEmpty()).isTrue();
      assertThat(recommendation.getUnitCount()).isZero();
      assertThat(recommendation.getExcessChannels()).isZero();
      assertThat(recommendation.getCeilingCapacity()).isZero();
    }

    @Test
    @DisplayName("Should return the same selection on every call")
    void shouldBeDeterministic() {
      List<GatewayUnit> units = TestFixtures.connectorUnits();

      for (int demand = 1; demand <= 120; demand += 7) {
        assertThat(recommenderService.recommend(demand, ResolutionTier.LOW, units))
            .isEqualTo(recommenderService.recommend(demand, ResolutionTier.LOW, units));
      }
    }

    @Test
    @DisplayName("Should cover a demand in the millions exactly")
    void shouldCoverMillionsExactly() {
      // Given
      List<GatewayUnit> units =
          Arrays.asList(TestFixtures.unit("S", 1, 7, 1), TestFixtures.unit("L", 1, 13, 2));

      // When
      Recommendation recommendation =
          recommenderService.recommend(7_654_321, ResolutionTier.HIGH, units);

      // Then
      assertThat(recommendation.getCeilingCapacity()).isEqualTo(7_654_321L);
      assertThat(recommendation.getAllocations())
          .extracting(UnitAllocation::getCount)
          .containsExactly(11L, 588_788L);
      assertThat(recommendation.getStorageTb()).isEqualTo(11 + 588_788 * 2.0);
    }

    @Test
    @DisplayName("Should recommend each tier independently")
    void shouldRecommendPerTier() {
      Map<ResolutionTier, Recommendation> recommendations =
          recommenderService.recommend(new ChannelDemand(20, 0), TestFixtures.walkthroughUnits());

      assertThat(recommendations).containsOnlyKeys(ResolutionTier.LOW, ResolutionTier.HIGH);
      assertThat(recommendations.get(ResolutionTier.LOW).getCeilingCapacity()).isEqualTo(32);
      assertThat(recommendations.get(ResolutionTier.HIGH).isEmpty()).isTrue();
    }
  }

  @Nested
  @DisplayName("Coverage")
  class Coverage {

    private final List<GatewayUnit> units =
        Arrays.asList(
            TestFixtures.unit("X1", 1, 16, 4),
            TestFixtures.unit("X2", 1, 32, 8),
            TestFixtures.unit("X3", 2, 10, 2));

    @Test
    @DisplayName("Should never under-cover and never exceed the optimal excess")
    void shouldCoverWithMinimalExcess() {
      for (int demand = 1; demand <= 150; demand++) {
        Recommendation recommendation =
            recommenderService.recommend(demand, ResolutionTier.LOW, units);
        int[] optimum = bruteForce(demand);

        assertThat(recommendation.getCeilingCapacity())
            .as("ceiling for %d", demand)
            .isGreaterThanOrEqualTo(demand);
        assertThat(recommendation.getCeilingCapacity() - demand)
            .as("excess for %d", demand)
            .isEqualTo(optimum[0]);
        assertThat(recommendation.getUnitCount()).as("units for %d", demand).isEqualTo(optimum[1]);
      }
    }

    @Test
    @DisplayName("Should stay optimal where large demands are reduced before searching")
    void shouldStayOptimalAcrossReductionBound() {
      // three unit types with a largest ceiling of 32 start reducing above 3072 channels
      for (int demand = 3000; demand <= 3200; demand += 10) {
        Recommendation recommendation =
            recommenderService.recommend(demand, ResolutionTier.LOW, units);
        int[] optimum = bruteForce(demand);

        assertThat(recommendation.getCeilingCapacity() - demand)
            .as("excess for %d", demand)
            .isEqualTo(optimum[0]);
        assertThat(recommendation.getUnitCount()).as("units for %d", demand).isEqualTo(optimum[1]);
      }
    }

    @Test
    @DisplayName("Should size a demand of a billion channels")
    void shouldSizeBillionChannelDemand() {
      // When
      Recommendation recommendation =
          recommenderService.recommend(1_000_000_001L, ResolutionTier.LOW, units);

      // Then
      assertThat(recommendation.getCeilingCapacity()).isEqualTo(1_000_000_002L);
      assertThat(recommendation.getAllocations())
          .extracting(allocation -> allocation.getUnit().getName(), UnitAllocation::getCount)
          .containsExactly(tuple("X1", 1L), tuple("X2", 31_249_998L), tuple("X3", 5L));
      assertThat(recommendation.getExcessChannels())
          .isEqualTo(1 + 31_249_998L + 5 * 2 - 1_000_000_001L);
    }

    /** Smallest excess, then fewest units, over every multiset of the three units. */
    private int[] bruteForce(int demand) {
      int bestExcess = Integer.MAX_VALUE;
      int bestUnits = Integer.MAX_VALUE;
      for (int a = 0; a <= demand / 16 + 1; a++) {
        for (int b = 0; b <= demand / 32 + 1; b++) {
          for (int c = 0; c <= demand / 10 + 1; c++) {
            int capacity = a * 16 + b * 32 + c * 10;
            if (capacity < demand) {
              continue;
            }
            int excess = capacity - demand;
            int count = a + b + c;
            if (excess < bestExcess || (excess == bestExcess && count < bestUnits)) {
              bestExcess = excess;
              bestUnits = count;
            }
          }
        }
      }
      return new int[] {bestExcess, bestUnits};
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should fail when the unit catalog is empty")
    void shouldFailOnEmptyCatalog() {
      assertThatThrownBy(
              () -> recommenderService.recommend(5, ResolutionTier.LOW, Collections.emptyList()))
          .isInstanceOf(NoUnitCoversDemandException.class)
          .hasMessageContaining("5 channels");
    }

    @Test
    @DisplayName("Should fail when no unit has capacity")
    void shouldFailWithoutCapacity() {
      List<GatewayUnit> units = Arrays.asList(TestFixtures.unit("Dummy", 0, 0, 1));

      assertThatThrownBy(() -> recommenderService.recommend(1, ResolutionTier.HIGH, units))
          .isInstanceOf(NoUnitCoversDemandException.class);
    }

    @Test
    @DisplayName("Should still return an empty selection for zero demand without units")
    void shouldAllowZeroDemandWithoutUnits() {
      assertThat(recommenderService.recommend(0, ResolutionTier.LOW, Collections.emptyList()))
          .isEqualTo(Recommendation.empty(ResolutionTier.LOW));
    }

    @Test
    @DisplayName("Should reject negative demand")
    void shouldRejectNegativeDemand() {
      List<GatewayUnit> units = TestFixtures.walkthroughUnits();

      assertThatThrownBy(() -> recommenderService.recommend(-1, ResolutionTier.LOW, units))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  @DisplayName("Excess should sum low bounds times counts minus the requirement")
  void shouldCalculateExcess() {
    List<UnitAllocation> chosen =
        Arrays.asList(
            new UnitAllocation(TestFixtures.unit("A", 12, 25, 8), 2),
            new UnitAllocation(TestFixtures.unit("B", 5, 10, 4), 1));

    assertThat(recommenderService.calculateExcess(20, chosen)).isEqualTo(24 + 5 - 20);
    assertThat(recommenderService.calculateExcess(40, chosen)).isEqualTo(-11);
  }
}
