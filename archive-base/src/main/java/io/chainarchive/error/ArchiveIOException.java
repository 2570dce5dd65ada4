package io.chainarchive.error;

public class ArchiveIOException extends ArchiveException {
  private static final long serialVersionUID = 7152090844367700221L;

  public ArchiveIOException(String message, Throwable cause) {
    super(ErrorKind.IO, message, cause);
  }
}
