package io.chainarchive.write.pipeline;

import java.util.Collections;
import java.util.List;

import io.chainarchive.key.BlockRange;

/**
 * One unit of the ingestion queue, the records of one kind taken from a range of blocks. The drain marker
 * carries no records and tells the worker to flush what it holds and stop.
 */
final class Submission<R> {
  private final List<R> records;
  private final BlockRange range;
  private final boolean drain;

  private Submission(List<R> records, BlockRange range, boolean drain) {
    this.records = records;
    this.range = range;
    this.drain = drain;
  }

  static <R> Submission<R> of(List<R> records, BlockRange range) {
    return new Submission<>(records, range, false);
  }

  static <R> Submission<R> drain() {
    return new Submission<>(Collections.emptyList(), null, true);
  }

  List<R> getRecords() {
    return records;
  }

  BlockRange getRange() {
    return range;
  }

  boolean isDrain() {
    return drain;
  }
}
