package com.camcompat.sizer.exception;

/** Base type for failures that stop a sizing run or invalidate the hardware catalog. */
public class SizingException extends RuntimeException {

  public SizingException(String message) {
    super(message);
  }

  public SizingException(String message, Throwable cause) {
    super(message, cause);
  }
}
