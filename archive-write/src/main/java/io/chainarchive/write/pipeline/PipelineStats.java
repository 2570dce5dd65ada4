package io.chainarchive.write.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.chainarchive.schema.RecordKind;

/**
 * A snapshot of the counters of one pipeline.
 */
@JsonInclude(value = Include.NON_NULL)
public class PipelineStats {
  private final RecordKind kind;
  private final long rowsWritten;
  private final long rowGroupsWritten;
  private final long filesWritten;
  private final long recordsSkipped;

  public PipelineStats(RecordKind kind, long rowsWritten, long rowGroupsWritten, long filesWritten, long recordsSkipped) {
    this.kind = kind;
    this.rowsWritten = rowsWritten;
    this.rowGroupsWritten = rowGroupsWritten;
    this.filesWritten = filesWritten;
    this.recordsSkipped = recordsSkipped;
  }

  public RecordKind getKind() {
    return kind;
  }

  @JsonProperty("rows_written")
  public long getRowsWritten() {
    return rowsWritten;
  }

  @JsonProperty("row_groups_written")
  public long getRowGroupsWritten() {
    return rowGroupsWritten;
  }

  @JsonProperty("files_written")
  public long getFilesWritten() {
    return filesWritten;
  }

  @JsonProperty("records_skipped")
  public long getRecordsSkipped() {
    return recordsSkipped;
  }

  @Override
  public String toString() {
    return kind + "{rows=" + rowsWritten + ", rowGroups=" + rowGroupsWritten + ", files=" + filesWritten + ", skipped=" + recordsSkipped + '}';
  }
}
