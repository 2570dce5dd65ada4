package io.chainarchive.write;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainarchive.Constants;
import io.chainarchive.decode.ArchiveDecoder;
import io.chainarchive.entity.Block;
import io.chainarchive.entity.BlockData;
import io.chainarchive.entity.Call;
import io.chainarchive.entity.Event;
import io.chainarchive.entity.Extrinsic;
import io.chainarchive.error.ArchiveException;
import io.chainarchive.error.ArchiveIOException;
import io.chainarchive.error.DecodeException;
import io.chainarchive.error.ErrorPolicy;
import io.chainarchive.key.BlockRange;
import io.chainarchive.schema.RecordKind;
import io.chainarchive.store.MetadataStore;
import io.chainarchive.store.SqliteMetadataStore;
import io.chainarchive.write.batch.BlockBatch;
import io.chainarchive.write.batch.CallBatch;
import io.chainarchive.write.batch.EventBatch;
import io.chainarchive.write.batch.ExtrinsicBatch;
import io.chainarchive.write.file.ColumnarFileWriterFactory;
import io.chainarchive.write.file.ParquetColumnarFileWriterFactory;
import io.chainarchive.write.pipeline.PipelineStats;
import io.chainarchive.write.pipeline.RecordPipeline;

/**
 * Routes every decoded block to the four record pipelines and its metadata to the sidecar store.
 * All calls are expected from one producer thread.
 */
public class ArchiveWriter implements Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveWriter.class);
  private final ArchiveConfig config;
  private final ErrorPolicy errorPolicy;
  private final RecordPipeline<Block> blocks;
  private final RecordPipeline<Extrinsic> extrinsics;
  private final RecordPipeline<Event> events;
  private final RecordPipeline<Call> calls;
  private final MetadataStore metadataStore;
  private long blocksWritten;
  private long linesSkipped;
  private long metadataSkipped;
  private boolean closed;

  public ArchiveWriter(ArchiveConfig config) {
    this(config, new ParquetColumnarFileWriterFactory(config.getCompression()));
  }

  public ArchiveWriter(ArchiveConfig config, ColumnarFileWriterFactory writerFactory) {
    config.validate();
    this.config = config;
    this.errorPolicy = config.errorPolicy();
    Path root = Paths.get(config.getOutDir());
    List<RecordPipeline<?>> started = new ArrayList<>(4);
    try {
      this.blocks = start(started, new RecordPipeline<>(new BlockBatch(), root, writerFactory, config));
      this.extrinsics = start(started, new RecordPipeline<>(new ExtrinsicBatch(config.getIdentifierOrder()), root, writerFactory, config));
      this.events = start(started, new RecordPipeline<>(new EventBatch(config.getIdentifierOrder()), root, writerFactory, config));
      this.calls = start(started, new RecordPipeline<>(new CallBatch(config.getIdentifierOrder()), root, writerFactory, config));
      this.metadataStore = config.isMetadata() ? new SqliteMetadataStore(root.resolve(Constants.METADATA_STORE_FILE)) : null;
    } catch (RuntimeException e) {
      for (RecordPipeline<?> pipeline : started) {
        try {
          pipeline.close();
        } catch (RuntimeException closeFailure) {
          e.addSuppressed(closeFailure);
        }
      }
      throw e;
    }
    LOGGER.info("Writing archive with {}", config);
  }

  private static <R> RecordPipeline<R> start(List<RecordPipeline<?>> started, RecordPipeline<R> pipeline) {
    started.add(pipeline);
    return pipeline;
  }

  public void write(BlockData blockData) {
    if (closed)
      throw new IllegalStateException("The archive writer is closed");
    BlockRange range = blockData.blockRange();
    blocks.submit(Collections.singletonList(blockData.getHeader()), range);
    if (!blockData.getExtrinsics().isEmpty())
      extrinsics.submit(blockData.getExtrinsics(), range);
    if (!blockData.getEvents().isEmpty())
      events.submit(blockData.getEvents(), range);
    if (!blockData.getCalls().isEmpty())
      calls.submit(blockData.getCalls(), range);
    if (blockData.getMetadata() != null && metadataStore != null)
      insertMetadata(blockData);
    blocksWritten++;
  }

  private void insertMetadata(BlockData blockData) {
    try {
      metadataStore.insert(blockData.getMetadata());
    } catch (ArchiveException e) {
      if (!errorPolicy.shouldSkip(e))
        throw e;
      metadataSkipped++;
      LOGGER.warn("Skipping metadata of block {}: {}", blockData.getHeader().getHeight(), e.getMessage());
    }
  }

  /**
   * Reads one JSON block per line until the end of input, then closes the writer. Blank lines are ignored,
   * lines that fail to decode are skipped or abort the run depending on the error policy.
   *
   * @param in The input, read as UTF-8.
   */
  public void ingest(InputStream in) {
    try {
      BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
      long lineNumber = 0;
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.trim().isEmpty())
          continue;
        BlockData blockData;
        try {
          blockData = ArchiveDecoder.decode(line, lineNumber);
        } catch (DecodeException e) {
          if (!errorPolicy.shouldSkip(e))
            throw e;
          linesSkipped++;
          LOGGER.warn("Skipping line {}: {}", lineNumber, e.getMessage());
          continue;
        }
        write(blockData);
      }
    } catch (IOException e) {
      closeAfterFailure(new ArchiveIOException("Unable to read input", e));
    } catch (RuntimeException e) {
      closeAfterFailure(e);
    }
    close();
  }

  private void closeAfterFailure(RuntimeException failure) {
    try {
      close();
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    }
    throw failure;
  }

  /**
   * Drains and closes all pipelines and the metadata store. Every pipeline is closed even when an earlier one
   * fails, the first failure is rethrown.
   */
  @Override
  public void close() {
    if (closed)
      return;
    closed = true;
    RuntimeException failure = null;
    for (RecordPipeline<?> pipeline : pipelines()) {
      try {
        pipeline.close();
      } catch (RuntimeException e) {
        if (failure == null)
          failure = e;
        else
          failure.addSuppressed(e);
      }
    }
    if (metadataStore != null) {
      try {
        metadataStore.close();
      } catch (RuntimeException e) {
        if (failure == null)
          failure = e;
        else
          failure.addSuppressed(e);
      }
    }
    if (failure != null)
      throw failure;
    LOGGER.info("Archived {} blocks, skipped {} lines and {} metadata entries: {}", blocksWritten, linesSkipped, metadataSkipped, stats().values());
  }

  private List<RecordPipeline<?>> pipelines() {
    List<RecordPipeline<?>> pipelines = new ArrayList<>(4);
    pipelines.add(blocks);
    pipelines.add(extrinsics);
    pipelines.add(events);
    pipelines.add(calls);
    return pipelines;
  }

  public RecordPipeline<?> pipeline(RecordKind kind) {
    switch (kind) {
      case BLOCK:
        return blocks;
      case EXTRINSIC:
        return extrinsics;
      case EVENT:
        return events;
      case CALL:
        return calls;
    }
    throw new IllegalStateException("unknown record kind " + kind);
  }

  public Map<RecordKind, PipelineStats> stats() {
    Map<RecordKind, PipelineStats> stats = new EnumMap<>(RecordKind.class);
    for (RecordPipeline<?> pipeline : pipelines())
      stats.put(pipeline.getKind(), pipeline.stats());
    return stats;
  }

  public ArchiveConfig getConfig() {
    return config;
  }

  public long getBlocksWritten() {
    return blocksWritten;
  }

  public long getLinesSkipped() {
    return linesSkipped;
  }

  public long getMetadataSkipped() {
    return metadataSkipped;
  }
}
