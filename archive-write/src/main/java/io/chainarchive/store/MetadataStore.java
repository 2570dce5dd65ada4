package io.chainarchive.store;

import java.io.Closeable;

import io.chainarchive.entity.Metadata;

/**
 * Sidecar for runtime metadata, which doesn't fit the columnar files.
 */
public interface MetadataStore extends Closeable {
  void insert(Metadata metadata);

  @Override
  void close();
}
