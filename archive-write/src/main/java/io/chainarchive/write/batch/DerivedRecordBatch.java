package io.chainarchive.write.batch;

import io.chainarchive.column.ByteArrayColumnBuffer;
import io.chainarchive.key.CompositeKeyExtractor;
import io.chainarchive.schema.RecordKind;
import io.chainarchive.schema.RecordSchema;

/**
 * Base of the kinds that carry no height of their own. The height comes from the composite {@code block_id}
 * and rows are ordered by their {@code id} column.
 */
public abstract class DerivedRecordBatch<R> extends AbstractRecordBatch<R> {
  private final IdentifierOrder identifierOrder;

  protected DerivedRecordBatch(RecordKind kind, RecordSchema schema, IdentifierOrder identifierOrder) {
    super(kind, schema);
    this.identifierOrder = identifierOrder;
  }

  protected abstract String id(R record);

  protected abstract String blockId(R record);

  @Override
  public int push(R record) {
    // a numeric order needs a parsable id, reject it here rather than at flush time
    if (identifierOrder == IdentifierOrder.NUMERIC_PREFIX && record != null)
      CompositeKeyExtractor.extractNumericPrefix(id(record));
    return super.push(record);
  }

  @Override
  protected int[] sortPermutation() {
    return identifierOrder.sort((ByteArrayColumnBuffer) column("id"));
  }

  @Override
  public long blockHeight(R record) {
    return CompositeKeyExtractor.extractHeight(blockId(record));
  }

  public IdentifierOrder getIdentifierOrder() {
    return identifierOrder;
  }
}
