package io.chainarchive.error;

/**
 * Raised when a column is handed a value, or a buffer, of a physical type other than the one its schema
 * declares. Schema and push logic agreeing makes this unreachable, it is always fatal.
 */
public class SchemaInvariantViolation extends ArchiveException {
  private static final long serialVersionUID = 2247718820461923351L;

  public SchemaInvariantViolation(String message) {
    super(ErrorKind.SCHEMA_INVARIANT, message);
  }
}
