package io.chainarchive.write.rotation;

import java.nio.file.Files;
import java.nio.file.Path;

import io.chainarchive.Constants;

/**
 * Names a finished file after its rotation boundary.
 */
public enum FileNaming {
  /** The highest block height contained in the file. */
  BLOCK_HEIGHT,
  /** The zero-based position of the file among the files of its kind written by this run. */
  SEQUENCE;

  public String boundary(long maxBlockHeight, long sequence) {
    switch (this) {
      case BLOCK_HEIGHT:
        return Long.toString(maxBlockHeight);
      case SEQUENCE:
        return Long.toString(sequence);
    }
    throw new IllegalStateException("unknown naming " + this);
  }

  /**
   * @return A path in {@code directory} that doesn't exist yet, {@code <boundary>.parquet} or
   *         {@code <boundary>-<n>.parquet} on collision.
   */
  public Path resolve(Path directory, long maxBlockHeight, long sequence) {
    String boundary = boundary(maxBlockHeight, sequence);
    Path candidate = directory.resolve(boundary + Constants.PARQUET_EXTENSION);
    int suffix = 1;
    while (Files.exists(candidate)) {
      candidate = directory.resolve(boundary + Constants.ID_SEPARATOR + suffix + Constants.PARQUET_EXTENSION);
      suffix++;
    }
    return candidate;
  }

  public static FileNaming getFileNaming(String value) {
    for (FileNaming naming : FileNaming.values()) {
      if (naming.name().equalsIgnoreCase(value))
        return naming;
    }
    return null;
  }
}
