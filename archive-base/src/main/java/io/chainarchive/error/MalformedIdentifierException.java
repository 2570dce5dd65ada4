package io.chainarchive.error;

public class MalformedIdentifierException extends ArchiveException {
  private static final long serialVersionUID = 5830125664721902378L;
  private final String identifier;

  public MalformedIdentifierException(String identifier, String message) {
    super(ErrorKind.MALFORMED_IDENTIFIER, message);
    this.identifier = identifier;
  }

  public MalformedIdentifierException(String identifier, String message, Throwable cause) {
    super(ErrorKind.MALFORMED_IDENTIFIER, message, cause);
    this.identifier = identifier;
  }

  public String getIdentifier() {
    return identifier;
  }
}
