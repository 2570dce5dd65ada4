package io.chainarchive.io;

public enum Compression {
  NONE,
  SNAPPY,
  ZSTD;

  public static Compression getCompression(String value) {
    for (Compression compression : Compression.values()) {
      if (compression.name().equalsIgnoreCase(value))
        return compression;
    }
    return null;
  }
}
