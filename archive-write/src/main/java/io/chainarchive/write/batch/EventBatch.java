package io.chainarchive.write.batch;

import io.chainarchive.entity.Event;
import io.chainarchive.schema.ArchiveSchemas;
import io.chainarchive.schema.RecordKind;

public class EventBatch extends DerivedRecordBatch<Event> {
  public EventBatch(IdentifierOrder identifierOrder) {
    super(RecordKind.EVENT, ArchiveSchemas.EVENT, identifierOrder);
  }

  @Override
  protected void extract(Event event, Object[] row) {
    row[0] = text(event.getId());
    row[1] = text(event.getBlockId());
    row[2] = event.getIndexInBlock();
    row[3] = text(event.getPhase());
    row[4] = text(event.getExtrinsicId());
    row[5] = text(event.getCallId());
    row[6] = text(event.getName());
    row[7] = json("args", event.getArgs());
    row[8] = event.getPos();
  }

  @Override
  protected String id(Event event) {
    return event.getId();
  }

  @Override
  protected String blockId(Event event) {
    return event.getBlockId();
  }
}
