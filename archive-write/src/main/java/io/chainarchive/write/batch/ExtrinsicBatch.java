package io.chainarchive.write.batch;

import io.chainarchive.entity.Extrinsic;
import io.chainarchive.schema.ArchiveSchemas;
import io.chainarchive.schema.RecordKind;

public class ExtrinsicBatch extends DerivedRecordBatch<Extrinsic> {
  public ExtrinsicBatch(IdentifierOrder identifierOrder) {
    super(RecordKind.EXTRINSIC, ArchiveSchemas.EXTRINSIC, identifierOrder);
  }

  @Override
  protected void extract(Extrinsic extrinsic, Object[] row) {
    row[0] = text(extrinsic.getId());
    row[1] = text(extrinsic.getBlockId());
    row[2] = extrinsic.getIndexInBlock();
    row[3] = extrinsic.getVersion();
    row[4] = json("signature", extrinsic.getSignature());
    row[5] = text(extrinsic.getCallId());
    row[6] = extrinsic.getFee();
    row[7] = extrinsic.getTip();
    row[8] = extrinsic.getSuccess();
    row[9] = json("error", extrinsic.getError());
    row[10] = text(extrinsic.getHash());
    row[11] = extrinsic.getPos();
  }

  @Override
  protected String id(Extrinsic extrinsic) {
    return extrinsic.getId();
  }

  @Override
  protected String blockId(Extrinsic extrinsic) {
    return extrinsic.getBlockId();
  }
}
