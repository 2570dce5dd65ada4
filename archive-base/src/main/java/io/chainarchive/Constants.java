package io.chainarchive;

public final class Constants {
  // Composite identifiers are "<height>-<suffix>"
  public final static char ID_SEPARATOR = '-';

  public final static String PARQUET_EXTENSION = ".parquet";
  public final static String IN_PROGRESS_SUFFIX = ".inprogress";
  public final static String METADATA_STORE_FILE = "metadata.sqlite";

  public final static int DEFAULT_ROWS_PER_FILE = 100_000;
  public final static int DEFAULT_ROWS_PER_ROW_GROUP = 10_000;
  public final static int DEFAULT_QUEUE_CAPACITY = 16;

  // Parquet footer key-value metadata
  public final static String CREATED_BY_KEY = "created.by";
  public final static String CREATED_BY = "chain-archive";
  public final static String BLOCK_RANGE_KEY = "chain-archive.block-range";
  public final static String RECORD_KIND_KEY = "chain-archive.record-kind";

  private Constants() {
  }
}
