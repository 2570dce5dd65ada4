package io.chainarchive.write.pipeline;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.chainarchive.Constants;
import io.chainarchive.column.ColumnBuffer;
import io.chainarchive.error.ArchiveException;
import io.chainarchive.error.ArchiveIOException;
import io.chainarchive.error.EncodingException;
import io.chainarchive.error.ErrorPolicy;
import io.chainarchive.key.BlockRange;
import io.chainarchive.schema.RecordKind;
import io.chainarchive.write.ArchiveConfig;
import io.chainarchive.write.batch.RecordBatch;
import io.chainarchive.write.file.ColumnarFileWriter;
import io.chainarchive.write.file.ColumnarFileWriterFactory;
import io.chainarchive.write.rotation.FileNaming;
import io.chainarchive.write.rotation.RotationPolicy;

/**
 * Turns the records of one kind into files under {@code <out>/<kind>/}. Producers hand over lists of records
 * through a bounded queue, a single worker thread owns the batch, the rotation counters and the open file.
 * <p>
 * The queue bound counts submissions that are queued or being processed, a producer blocks until one of them
 * has been fully processed. Once the worker fails every later {@link #submit(List, BlockRange)} and
 * {@link #close()} throws a {@link PipelineException}.
 */
public class RecordPipeline<R> implements Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(RecordPipeline.class);
  public static final String RECORD_KIND_MDC = "record_kind";
  private static final long FAILURE_POLL_MILLIS = 100;

  private final RecordKind kind;
  private final RecordBatch<R> batch;
  private final RotationPolicy rotation;
  private final ColumnarFileWriterFactory writerFactory;
  private final Path directory;
  private final FileNaming naming;
  private final ErrorPolicy errorPolicy;
  private final boolean flushOnClose;

  private final LinkedBlockingQueue<Submission<R>> queue = new LinkedBlockingQueue<>();
  private final Semaphore capacity;
  private final ExecutorService worker;
  private final Future<?> workerFuture;
  private volatile Throwable failure;
  private volatile boolean closed;

  private final AtomicLong rowsWritten = new AtomicLong();
  private final AtomicLong rowGroupsWritten = new AtomicLong();
  private final AtomicLong filesWritten = new AtomicLong();
  private final AtomicLong recordsSkipped = new AtomicLong();

  // Worker state
  private ColumnarFileWriter currentFile;
  private long fileSequence;
  private long batchMaxHeight = -1;
  private long fileMaxHeight = -1;
  private BlockRange batchRange;
  private BlockRange fileRange;

  public RecordPipeline(RecordBatch<R> batch, Path outputRoot, ColumnarFileWriterFactory writerFactory, ArchiveConfig config) {
    this.kind = batch.kind();
    this.batch = batch;
    this.rotation = new RotationPolicy(config.getRowsPerRowGroup(), config.getRowsPerFile());
    this.writerFactory = writerFactory;
    this.directory = outputRoot.resolve(kind.getDirectory());
    this.naming = config.getFileNaming();
    this.errorPolicy = config.errorPolicy();
    this.flushOnClose = config.isFlushOnClose();
    this.capacity = new Semaphore(config.getQueueCapacity());
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new ArchiveIOException("Unable to create output directory " + directory, e);
    }
    this.worker = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
        .setNameFormat("archive-" + kind.getDirectory() + "-%d")
        .setDaemon(true)
        .build());
    this.workerFuture = worker.submit(this::run);
  }

  public RecordKind getKind() {
    return kind;
  }

  public Path getDirectory() {
    return directory;
  }

  /**
   * Enqueues records, blocking while the queue is full.
   *
   * @param records The records, all of this pipeline's kind.
   * @param range   The blocks the records were taken from.
   */
  public void submit(List<R> records, BlockRange range) {
    if (closed)
      throw new IllegalStateException("Pipeline " + kind + " is closed");
    checkFailure();
    try {
      while (!capacity.tryAcquire(FAILURE_POLL_MILLIS, TimeUnit.MILLISECONDS))
        checkFailure();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipelineException(kind, "Interrupted while waiting on the " + kind.getDirectory() + " queue", e);
    }
    if (failure != null) {
      capacity.release();
      checkFailure();
    }
    queue.add(Submission.of(records, range));
  }

  private void checkFailure() {
    Throwable t = failure;
    if (t != null)
      throw new PipelineException(kind, "The " + kind.getDirectory() + " pipeline failed: " + t.getMessage(), t);
  }

  private void run() {
    MDC.put(RECORD_KIND_MDC, kind.getDirectory());
    try {
      while (true) {
        Submission<R> submission = queue.take();
        if (submission.isDrain()) {
          drain();
          return;
        }
        try {
          process(submission);
        } finally {
          capacity.release();
        }
      }
    } catch (InterruptedException e) {
      failure = e;
      Thread.currentThread().interrupt();
      abortFile();
    } catch (Throwable t) {
      LOGGER.error("Detected an error in the {} pipeline, it is stopped", kind.getDirectory(), t);
      failure = t;
      abortFile();
    } finally {
      MDC.remove(RECORD_KIND_MDC);
    }
  }

  private void process(Submission<R> submission) {
    for (R record : submission.getRecords()) {
      long height;
      try {
        if (record == null)
          throw new EncodingException(null, "Blocks " + submission.getRange() + " carry a null " + kind.getDirectory() + " record");
        height = batch.blockHeight(record);
        batch.push(record);
      } catch (ArchiveException e) {
        if (!errorPolicy.shouldSkip(e))
          throw e;
        recordsSkipped.incrementAndGet();
        LOGGER.warn("Skipping {} record {} from blocks {}: {}", kind.getDirectory(), record, submission.getRange(), e.getMessage());
        continue;
      }
      batchMaxHeight = Math.max(batchMaxHeight, height);
      batchRange = submission.getRange() == null ? batchRange : submission.getRange().union(batchRange);
      switch (rotation.onPush()) {
        case FLUSH_ROW_GROUP:
          flushRowGroup();
          break;
        case FLUSH_AND_ROTATE:
          flushRowGroup();
          closeFile();
          break;
        default:
          break;
      }
    }
  }

  private void flushRowGroup() {
    int rows = batch.size();
    if (rows == 0)
      return;
    List<ColumnBuffer> columns = batch.sortedColumns();
    try {
      if (currentFile == null)
        openFile();
      currentFile.startRowGroup(rows);
      for (int i = 0; i < columns.size(); i++)
        currentFile.writeColumn(i, columns.get(i));
      currentFile.endRowGroup();
    } catch (IOException e) {
      throw new ArchiveIOException("Unable to write a row group of " + rows + " " + kind.getDirectory() + " rows", e);
    }
    rowsWritten.addAndGet(rows);
    rowGroupsWritten.incrementAndGet();
    fileMaxHeight = Math.max(fileMaxHeight, batchMaxHeight);
    fileRange = batchRange == null ? fileRange : batchRange.union(fileRange);
    batchMaxHeight = -1;
    batchRange = null;
    batch.reset();
  }

  private void openFile() throws IOException {
    Path inProgress = directory.resolve(fileSequence + Constants.PARQUET_EXTENSION + Constants.IN_PROGRESS_SUFFIX);
    Files.deleteIfExists(inProgress);
    currentFile = writerFactory.open(inProgress, batch.schema());
  }

  private void closeFile() {
    if (currentFile == null)
      return;
    ColumnarFileWriter file = currentFile;
    currentFile = null;
    Path target = naming.resolve(directory, fileMaxHeight, fileSequence);
    try {
      file.putFooterMetadata(Constants.RECORD_KIND_KEY, kind.getDirectory());
      if (fileRange != null)
        file.putFooterMetadata(Constants.BLOCK_RANGE_KEY, fileRange.getFrom() + "-" + fileRange.getTo());
      file.close();
      Files.move(file.getPath(), target);
    } catch (IOException e) {
      throw new ArchiveIOException("Unable to finish " + file.getPath() + " as " + target, e);
    }
    LOGGER.info("Finished {} with {} rows in {} row groups for blocks {}", target, file.getRowCount(), file.getRowGroupCount(), fileRange);
    filesWritten.incrementAndGet();
    fileSequence++;
    fileMaxHeight = -1;
    fileRange = null;
  }

  private void drain() {
    if (flushOnClose) {
      flushRowGroup();
    } else if (batch.size() > 0) {
      LOGGER.warn("Discarding {} buffered {} rows on close", batch.size(), kind.getDirectory());
      batch.reset();
      batchMaxHeight = -1;
      batchRange = null;
    }
    closeFile();
    rotation.reset();
  }

  private void abortFile() {
    if (currentFile == null)
      return;
    LOGGER.warn("Leaving partial file {} behind", currentFile.getPath());
    currentFile.abort();
    currentFile = null;
  }

  /**
   * Waits for every queued submission, writes what is still buffered (unless flush on close is off) and
   * closes the current file.
   */
  @Override
  public void close() {
    if (closed)
      return;
    closed = true;
    if (failure == null)
      queue.add(Submission.<R>drain());
    worker.shutdown();
    try {
      workerFuture.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipelineException(kind, "Interrupted while draining the " + kind.getDirectory() + " pipeline", e);
    } catch (ExecutionException e) {
      throw new PipelineException(kind, "The " + kind.getDirectory() + " pipeline failed", e.getCause());
    }
    checkFailure();
    LOGGER.info("Closed the {} pipeline: {}", kind.getDirectory(), stats());
  }

  public PipelineStats stats() {
    return new PipelineStats(kind, rowsWritten.get(), rowGroupsWritten.get(), filesWritten.get(), recordsSkipped.get());
  }

  public long getRowsWritten() {
    return rowsWritten.get();
  }

  public long getRowGroupsWritten() {
    return rowGroupsWritten.get();
  }

  public long getFilesWritten() {
    return filesWritten.get();
  }

  public long getRecordsSkipped() {
    return recordsSkipped.get();
  }
}
