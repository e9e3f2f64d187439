package com.camcompat.sizer.exception;

import lombok.Getter;

@Getter
public class NoUnitCoversDemandException extends SizingException {

  private final long requiredChannels;

  public NoUnitCoversDemandException(long requiredChannels, String reason) {
    super(String.format("Cannot cover %d channels: %s", requiredChannels, reason));
    this.requiredChannels = requiredChannels;
  }
}
