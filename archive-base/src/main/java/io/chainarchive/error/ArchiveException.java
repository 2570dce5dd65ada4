package io.chainarchive.error;

public class ArchiveException extends RuntimeException {
  private static final long serialVersionUID = 3017269818542377101L;
  private final ErrorKind kind;

  public ArchiveException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ArchiveException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}
