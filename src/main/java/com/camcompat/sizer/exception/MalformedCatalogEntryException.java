package com.camcompat.sizer.exception;

import lombok.Getter;

/**
 * The hardware catalog is trusted reference data, so any record that breaks an invariant makes
 * the whole catalog unusable.
 */
@Getter
public class MalformedCatalogEntryException extends SizingException {

  private final String source;
  private final long line;
  private final String detail;

  public MalformedCatalogEntryException(String source, long line, String message) {
    super(format(source, line, message));
    this.source = source;
    this.line = line;
    this.detail = message;
  }

  public MalformedCatalogEntryException(String source, long line, String message, Throwable cause) {
    super(format(source, line, message), cause);
    this.source = source;
    this.line = line;
    this.detail = message;
  }

  public MalformedCatalogEntryException(String message) {
    this(null, -1, message);
  }

  private static String format(String source, long line, String message) {
    if (source == null) {
      return "Malformed catalog entry: " + message;
    }
    return line > 0
        ? String.format("Malformed catalog entry in %s at line %d: %s", source, line, message)
        : String.format("Malformed catalog %s: %s", source, message);
  }
}
