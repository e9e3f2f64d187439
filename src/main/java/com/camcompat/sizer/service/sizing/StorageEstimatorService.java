package com.camcompat.sizer.service.sizing;

import java.util.EnumMap;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.camcompat.sizer.config.SizerProperties;
import com.camcompat.sizer.config.SizerProperties.BandCoefficients;
import com.camcompat.sizer.dto.sizing.ChannelDemand;
import com.camcompat.sizer.dto.sizing.ResolutionTier;
import com.camcompat.sizer.dto.sizing.StorageEstimate;
import com.camcompat.sizer.exception.UnsupportedRetentionPeriodException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Estimates recording storage as channels x coefficient x retention days. The coefficient is a
 * fixed reference point per tier and retention band (up to 30, 60 or 90 days); retention outside
 * those bands is rejected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorageEstimatorService {

  public static final int MAX_RETENTION_DAYS = 90;

  private final SizerProperties sizerProperties;

  public Map<ResolutionTier, StorageEstimate> estimate(ChannelDemand demand, int retentionDays) {
    Map<ResolutionTier, StorageEstimate> estimates = new EnumMap<>(ResolutionTier.class);
    for (ResolutionTier tier : ResolutionTier.values()) {
      estimates.put(tier, estimate(demand.forTier(tier), tier, retentionDays));
    }
    return estimates;
  }

  public StorageEstimate estimate(long channels, ResolutionTier tier, int retentionDays) {
    if (channels < 0) {
      throw new IllegalArgumentException("Channels must not be negative");
    }
    int bandDays = retentionBand(retentionDays);
    double coefficient = coefficient(tier, bandDays);
    double gigabytes = channels * coefficient * retentionDays;

    log.debug(
        "{} {}-tier channels for {} days ({}-day band, {} GB/channel/day): {} GB",
        channels,
        tier.getLabel(),
        retentionDays,
        bandDays,
        coefficient,
        gigabytes);

    return StorageEstimate.builder()
        .tier(tier)
        .channels(channels)
        .retentionDays(retentionDays)
        .bandDays(bandDays)
        .coefficient(coefficient)
        .gigabytes(gigabytes)
        .build();
  }

  /** Upper bound of the band containing {@code retentionDays}. */
  public int retentionBand(int retentionDays) {
    if (retentionDays < 1 || retentionDays > MAX_RETENTION_DAYS) {
      throw new UnsupportedRetentionPeriodException(retentionDays);
    }
    if (retentionDays <= 30) {
      return 30;
    }
    return retentionDays <= 60 ? 60 : 90;
  }

  private double coefficient(ResolutionTier tier, int bandDays) {
    BandCoefficients coefficients =
        tier == ResolutionTier.LOW
            ? sizerProperties.getStorage().getLowTier()
            : sizerProperties.getStorage().getHighTier();
    switch (bandDays) {
      case 30:
        return coefficients.getUpTo30Days();
      case 60:
        return coefficients.getUpTo60Days();
      default:
        return coefficients.getUpTo90Days();
    }
  }
}
