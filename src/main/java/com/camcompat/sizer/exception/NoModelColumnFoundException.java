package com.camcompat.sizer.exception;

import lombok.Getter;

@Getter
public class NoModelColumnFoundException extends SizingException {

  private final int columnCount;

  public NoModelColumnFoundException(int columnCount) {
    super(
        String.format(
            "No column out of %d contains recognizable camera model names", columnCount));
    this.columnCount = columnCount;
  }
}
