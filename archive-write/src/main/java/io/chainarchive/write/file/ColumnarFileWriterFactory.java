package io.chainarchive.write.file;

import java.io.IOException;
import java.nio.file.Path;

import io.chainarchive.schema.RecordSchema;

@FunctionalInterface
public interface ColumnarFileWriterFactory {
  ColumnarFileWriter open(Path path, RecordSchema schema) throws IOException;
}
