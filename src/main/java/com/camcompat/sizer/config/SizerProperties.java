package com.camcompat.sizer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Validated
@ConfigurationProperties(prefix = "sizer")
public class SizerProperties {

  @Valid private Catalog catalog = new Catalog();

  @Valid private Matching matching = new Matching();

  @Valid private Sanitize sanitize = new Sanitize();

  @Valid private Storage storage = new Storage();

  @Data
  public static class Catalog {
    @NotBlank private String camerasResource = "classpath:catalog/cameras.csv";
    @NotBlank private String unitsResource = "classpath:catalog/gateway-units.csv";
  }

  @Data
  public static class Matching {
    @Min(0)
    @Max(100)
    private int potentialThreshold = 80;

    @DecimalMin("0.0")
    private double resolutionThresholdMp = 5.0;
  }

  @Data
  public static class Sanitize {
    private boolean dropNetworkColumns = true;

    private boolean dropSerialColumns = true;

    /** Drops columns headed exactly "#"; when off, such a column may be taken as the count. */
    private boolean dropRowNumberColumns = true;

    private boolean stripCellNoise = true;
  }

  @Data
  public static class Storage {
    @Min(1)
    @Max(90)
    private int defaultRetentionDays = 30;

    @Valid private BandCoefficients lowTier = new BandCoefficients(0.256, 0.512, 0.768);

    @Valid private BandCoefficients highTier = new BandCoefficients(0.512, 1.024, 2.048);
  }

  /** Gigabytes consumed per channel per retained day, one coefficient per retention band. */
  @Data
  public static class BandCoefficients {
    @DecimalMin("0.0")
    private double upTo30Days;

    @DecimalMin("0.0")
    private double upTo60Days;

    @DecimalMin("0.0")
    private double upTo90Days;

    public BandCoefficients() {}

    public BandCoefficients(double upTo30Days, double upTo60Days, double upTo90Days) {
      this.upTo30Days = upTo30Days;
      this.upTo60Days = upTo60Days;
      this.upTo90Days = upTo90Days;
    }
  }
}
