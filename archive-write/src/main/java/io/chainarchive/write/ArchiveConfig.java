package io.chainarchive.write;

import java.io.IOException;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.chainarchive.Constants;
import io.chainarchive.error.ErrorPolicy;
import io.chainarchive.io.Compression;
import io.chainarchive.write.batch.IdentifierOrder;
import io.chainarchive.write.rotation.FileNaming;

/**
 * Settings of one archive run. Loaded from JSON with snake_case keys, every key is optional.
 */
@JsonInclude(value = Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchiveConfig {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  @JsonProperty("out_dir")
  private String outDir;
  @JsonProperty("rows_per_file")
  private int rowsPerFile = Constants.DEFAULT_ROWS_PER_FILE;
  @JsonProperty("rows_per_row_group")
  private int rowsPerRowGroup = Constants.DEFAULT_ROWS_PER_ROW_GROUP;
  @JsonProperty("queue_capacity")
  private int queueCapacity = Constants.DEFAULT_QUEUE_CAPACITY;
  private Compression compression = Compression.ZSTD;
  @JsonProperty("file_naming")
  private FileNaming fileNaming = FileNaming.BLOCK_HEIGHT;
  @JsonProperty("identifier_order")
  private IdentifierOrder identifierOrder = IdentifierOrder.LEXICAL;
  @JsonProperty("flush_on_close")
  private boolean flushOnClose = true;
  @JsonProperty("skip_invalid_records")
  private boolean skipInvalidRecords = false;
  private boolean metadata = false;

  public ArchiveConfig() {}

  public ArchiveConfig(String outDir) {
    this.outDir = outDir;
  }

  public static ArchiveConfig load(Path path) throws IOException {
    return OBJECT_MAPPER.readValue(path.toFile(), ArchiveConfig.class);
  }

  /**
   * @throws IllegalArgumentException On a missing output directory or inconsistent thresholds.
   */
  public void validate() {
    if (outDir == null || outDir.isEmpty())
      throw new IllegalArgumentException("An output directory is required");
    if (rowsPerFile <= 0)
      throw new IllegalArgumentException("rows_per_file must be positive but was " + rowsPerFile);
    if (rowsPerRowGroup <= 0)
      throw new IllegalArgumentException("rows_per_row_group must be positive but was " + rowsPerRowGroup);
    if (rowsPerRowGroup > rowsPerFile)
      throw new IllegalArgumentException("rows_per_row_group " + rowsPerRowGroup + " exceeds rows_per_file " + rowsPerFile);
    if (queueCapacity <= 0)
      throw new IllegalArgumentException("queue_capacity must be positive but was " + queueCapacity);
  }

  public ErrorPolicy errorPolicy() {
    return skipInvalidRecords ? ErrorPolicy.skipInvalidRecords() : ErrorPolicy.defaults();
  }

  /**
   * Sets rows per file and rows per row group to the same value, every flush then rotates the file.
   */
  public ArchiveConfig withCapacity(int capacity) {
    this.rowsPerFile = capacity;
    this.rowsPerRowGroup = capacity;
    return this;
  }

  public String getOutDir() {
    return outDir;
  }

  public ArchiveConfig setOutDir(String outDir) {
    this.outDir = outDir;
    return this;
  }

  public int getRowsPerFile() {
    return rowsPerFile;
  }

  public ArchiveConfig setRowsPerFile(int rowsPerFile) {
    this.rowsPerFile = rowsPerFile;
    return this;
  }

  public int getRowsPerRowGroup() {
    return rowsPerRowGroup;
  }

  public ArchiveConfig setRowsPerRowGroup(int rowsPerRowGroup) {
    this.rowsPerRowGroup = rowsPerRowGroup;
    return this;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public ArchiveConfig setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
    return this;
  }

  public Compression getCompression() {
    return compression;
  }

  public ArchiveConfig setCompression(Compression compression) {
    this.compression = compression;
    return this;
  }

  public FileNaming getFileNaming() {
    return fileNaming;
  }

  public ArchiveConfig setFileNaming(FileNaming fileNaming) {
    this.fileNaming = fileNaming;
    return this;
  }

  public IdentifierOrder getIdentifierOrder() {
    return identifierOrder;
  }

  public ArchiveConfig setIdentifierOrder(IdentifierOrder identifierOrder) {
    this.identifierOrder = identifierOrder;
    return this;
  }

  public boolean isFlushOnClose() {
    return flushOnClose;
  }

  public ArchiveConfig setFlushOnClose(boolean flushOnClose) {
    this.flushOnClose = flushOnClose;
    return this;
  }

  public boolean isSkipInvalidRecords() {
    return skipInvalidRecords;
  }

  public ArchiveConfig setSkipInvalidRecords(boolean skipInvalidRecords) {
    this.skipInvalidRecords = skipInvalidRecords;
    return this;
  }

  public boolean isMetadata() {
    return metadata;
  }

  public ArchiveConfig setMetadata(boolean metadata) {
    this.metadata = metadata;
    return this;
  }

  @Override
  public String toString() {
    return "ArchiveConfig{outDir=" + outDir + ", rowsPerFile=" + rowsPerFile + ", rowsPerRowGroup=" + rowsPerRowGroup
        + ", queueCapacity=" + queueCapacity + ", compression=" + compression + ", fileNaming=" + fileNaming
        + ", identifierOrder=" + identifierOrder + ", flushOnClose=" + flushOnClose
        + ", skipInvalidRecords=" + skipInvalidRecords + ", metadata=" + metadata + '}';
  }
}
