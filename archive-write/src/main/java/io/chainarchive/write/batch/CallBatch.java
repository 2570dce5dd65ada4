package io.chainarchive.write.batch;

import io.chainarchive.entity.Call;
import io.chainarchive.schema.ArchiveSchemas;
import io.chainarchive.schema.RecordKind;

public class CallBatch extends DerivedRecordBatch<Call> {
  public CallBatch(IdentifierOrder identifierOrder) {
    super(RecordKind.CALL, ArchiveSchemas.CALL, identifierOrder);
  }

  @Override
  protected void extract(Call call, Object[] row) {
    row[0] = text(call.getId());
    row[1] = text(call.getParentId());
    row[2] = text(call.getBlockId());
    row[3] = text(call.getExtrinsicId());
    row[4] = call.getSuccess();
    row[5] = json("error", call.getError());
    row[6] = json("origin", call.getOrigin());
    row[7] = text(call.getName());
    row[8] = json("args", call.getArgs());
    row[9] = call.getPos();
  }

  @Override
  protected String id(Call call) {
    return call.getId();
  }

  @Override
  protected String blockId(Call call) {
    return call.getBlockId();
  }
}
