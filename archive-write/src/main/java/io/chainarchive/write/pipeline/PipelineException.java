package io.chainarchive.write.pipeline;

import io.chainarchive.schema.RecordKind;

/**
 * Raised to the producer once a pipeline's worker has failed. The worker's error is the cause.
 */
public class PipelineException extends RuntimeException {
  private static final long serialVersionUID = -4407518216720563914L;
  private final RecordKind kind;

  public PipelineException(RecordKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public RecordKind getKind() {
    return kind;
  }
}
