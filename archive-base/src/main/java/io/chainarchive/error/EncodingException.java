package io.chainarchive.error;

public class EncodingException extends ArchiveException {
  private static final long serialVersionUID = -1489003772164617635L;
  private final String field;

  public EncodingException(String field, String message) {
    super(ErrorKind.ENCODING, message);
    this.field = field;
  }

  public EncodingException(String field, String message, Throwable cause) {
    super(ErrorKind.ENCODING, message, cause);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
