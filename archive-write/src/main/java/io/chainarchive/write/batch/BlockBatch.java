package io.chainarchive.write.batch;

import java.util.Comparator;

import io.chainarchive.entity.Block;
import io.chainarchive.error.EncodingException;
import io.chainarchive.schema.ArchiveSchemas;
import io.chainarchive.schema.RecordKind;

/**
 * Block headers, ordered by height.
 */
public class BlockBatch extends AbstractRecordBatch<Block> {
  public BlockBatch() {
    super(RecordKind.BLOCK, ArchiveSchemas.BLOCK);
  }

  @Override
  protected void extract(Block block, Object[] row) {
    row[0] = text(block.getId());
    row[1] = block.getHeight();
    row[2] = text(block.getHash());
    row[3] = text(block.getParentHash());
    row[4] = text(block.getStateRoot());
    row[5] = text(block.getExtrinsicsRoot());
    row[6] = block.timestampMillis();
    row[7] = text(block.getSpecId());
    row[8] = text(block.getValidator());
  }

  @Override
  protected int[] sortPermutation() {
    return RowPermutation.<Integer>sort(column("height"), Comparator.naturalOrder());
  }

  @Override
  public long blockHeight(Block block) {
    if (block.getHeight() == null)
      throw new EncodingException("height", "Block " + block.getId() + " has no height");
    return block.getHeight();
  }
}
