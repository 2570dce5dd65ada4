package io.chainarchive.error;

public enum ErrorKind {
  /** A malformed input line. */
  DECODE(true),
  /** A composite identifier without a numeric height prefix. */
  MALFORMED_IDENTIFIER(true),
  /** A field value that cannot be put into its column. */
  ENCODING(true),
  /** File or sidecar store failure. */
  IO(false),
  /** A column received a value of the wrong physical type. */
  SCHEMA_INVARIANT(false);

  private final boolean skippable;

  ErrorKind(boolean skippable) {
    this.skippable = skippable;
  }

  public boolean isSkippable() {
    return skippable;
  }
}
