package io.chainarchive.error;

public class DecodeException extends ArchiveException {
  private static final long serialVersionUID = -6279330528372245116L;
  private final long lineNumber;

  public DecodeException(long lineNumber, String message, Throwable cause) {
    super(ErrorKind.DECODE, message, cause);
    this.lineNumber = lineNumber;
  }

  public DecodeException(long lineNumber, String message) {
    super(ErrorKind.DECODE, message);
    this.lineNumber = lineNumber;
  }

  /**
   * @return The 1-based input line, or {@code -1} when the input was not read from a stream.
   */
  public long getLineNumber() {
    return lineNumber;
  }
}
