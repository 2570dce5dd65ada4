package io.chainarchive.write.file;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import io.chainarchive.io.Compression;
import io.chainarchive.schema.RecordSchema;

public class ParquetColumnarFileWriterFactory implements ColumnarFileWriterFactory {
  public static final int DEFAULT_PAGE_SIZE = 1024 * 1024;
  private final CompressionCodecName codecName;
  private final int pageSize;

  public ParquetColumnarFileWriterFactory(Compression compression) {
    this(compression, DEFAULT_PAGE_SIZE);
  }

  public ParquetColumnarFileWriterFactory(Compression compression, int pageSize) {
    this.codecName = codecFor(compression);
    this.pageSize = pageSize;
  }

  public static CompressionCodecName codecFor(Compression compression) {
    if (compression == null)
      return CompressionCodecName.UNCOMPRESSED;
    switch (compression) {
      case NONE:
        return CompressionCodecName.UNCOMPRESSED;
      case SNAPPY:
        return CompressionCodecName.SNAPPY;
      case ZSTD:
        return CompressionCodecName.ZSTD;
    }
    throw new IllegalStateException("unknown compression " + compression);
  }

  @Override
  public ColumnarFileWriter open(Path path, RecordSchema schema) throws IOException {
    return new ParquetColumnarFileWriter(path, schema, codecName, pageSize);
  }
}
