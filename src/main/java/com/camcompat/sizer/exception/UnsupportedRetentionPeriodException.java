package com.camcompat.sizer.exception;

import lombok.Getter;

@Getter
public class UnsupportedRetentionPeriodException extends SizingException {

  private final int retentionDays;

  public UnsupportedRetentionPeriodException(int retentionDays) {
    super(
        String.format(
            "Unsupported retention period: %d days (supported: 1-30, 31-60 or 61-90 days)",
            retentionDays));
    this.retentionDays = retentionDays;
  }
}
