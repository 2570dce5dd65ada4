package io.chainarchive.decode;

import io.chainarchive.entity.BlockData;
import io.chainarchive.entity.Call;
import io.chainarchive.entity.Extrinsic;
import io.chainarchive.error.DecodeException;
import io.chainarchive.error.EncodingException;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArchiveDecoderTest {
  private static final String LINE = "{\"header\":{\"id\":\"0000000010-abcde\",\"height\":10,\"hash\":\"0x10\",\"parent_hash\":\"0x09\","
      + "\"timestamp\":\"2021-05-01T10:00:00Z\",\"spec_id\":\"polkadot@9\",\"unknown\":1},"
      + "\"extrinsics\":[{\"id\":\"0000000010-000000-abcde\",\"block_id\":\"0000000010-abcde\",\"index_in_block\":0,"
      + "\"signature\":{\"address\":\"0xff\"},\"call_id\":\"0000000010-000000-abcde\",\"fee\":\"1500\",\"success\":true,\"hash\":\"0xaa\",\"pos\":1}],"
      + "\"events\":[],"
      + "\"calls\":[{\"id\":\"0000000010-000000-abcde\",\"block_id\":\"0000000010-abcde\",\"extrinsic_id\":\"0000000010-000000-abcde\","
      + "\"success\":true,\"name\":\"Timestamp.set\",\"args\":{\"now\":1619863200000},\"error\":null}],"
      + "\"metadata\":{\"spec_name\":\"polkadot\",\"spec_version\":9,\"block_height\":10,\"block_hash\":\"0x10\",\"hex\":\"0x6d657461\"}}";

  @Test
  public void decodesFullLine() {
    BlockData blockData = ArchiveDecoder.decode(LINE, 1);
    assertEquals(10, blockData.getHeader().getHeight());
    assertEquals("0x09", blockData.getHeader().getParentHash());
    assertEquals(1619863200000L, blockData.getHeader().timestampMillis());
    assertEquals(1, blockData.getExtrinsics().size());
    assertTrue(blockData.getEvents().isEmpty());

    Extrinsic extrinsic = blockData.getExtrinsics().get(0);
    assertEquals(1500L, extrinsic.getFee());
    assertNull(extrinsic.getTip());
    assertEquals("{\"address\":\"0xff\"}", ArchiveDecoder.toJsonText("signature", extrinsic.getSignature()));

    Call call = blockData.getCalls().get(0);
    assertNull(call.getParentId());
    assertNull(ArchiveDecoder.toJsonText("error", call.getError()));
    assertEquals("{\"now\":1619863200000}", ArchiveDecoder.toJsonText("args", call.getArgs()));

    assertEquals("polkadot@9", blockData.getMetadata().resolveId());
  }

  @Test
  public void missingListsDefaultToEmpty() {
    BlockData blockData = ArchiveDecoder.decode("{\"header\":{\"id\":\"1-a\",\"height\":1,\"hash\":\"h\",\"parent_hash\":\"p\",\"timestamp\":5}}", 2);
    assertEquals(5L, blockData.getHeader().timestampMillis());
    assertTrue(blockData.getExtrinsics().isEmpty());
    assertTrue(blockData.getCalls().isEmpty());
    assertNull(blockData.getMetadata());
  }

  @Test
  public void malformedLinesRaiseDecodeErrors() {
    DecodeException e = assertThrows(DecodeException.class, () -> ArchiveDecoder.decode("{not json", 7));
    assertEquals(7, e.getLineNumber());
    assertThrows(DecodeException.class, () -> ArchiveDecoder.decode("{\"extrinsics\":[]}", 8));
    assertThrows(DecodeException.class, () -> ArchiveDecoder.decode("{\"header\":{\"id\":\"1-a\"}}", 9));
    assertThrows(DecodeException.class, () -> ArchiveDecoder.decode("null", 10));
    assertThrows(DecodeException.class, () -> ArchiveDecoder.decode("{\"header\":{\"height\":\"ten\"}}", 11));
  }

  @Test
  public void nullRecordsAreKeptForThePipelines() {
    BlockData blockData = ArchiveDecoder.decode("{\"header\":{\"id\":\"1-a\",\"height\":1},"
        + "\"extrinsics\":[null],\"events\":[null,null],\"calls\":null}", 3);
    assertEquals(1, blockData.getExtrinsics().size());
    assertNull(blockData.getExtrinsics().get(0));
    assertEquals(2, blockData.getEvents().size());
    assertTrue(blockData.getCalls().isEmpty());
  }

  @Test
  public void unparsableTimestampIsAnEncodingError() {
    BlockData blockData = ArchiveDecoder.decode("{\"header\":{\"id\":\"1-a\",\"height\":1,\"timestamp\":\"yesterday\"}}", 1);
    assertThrows(EncodingException.class, () -> blockData.getHeader().timestampMillis());
  }
}
