package io.chainarchive.write;

import io.chainarchive.Constants;
import io.chainarchive.decode.ArchiveDecoder;
import io.chainarchive.entity.BlockData;
import io.chainarchive.error.ArchiveIOException;
import io.chainarchive.error.EncodingException;
import io.chainarchive.io.Compression;
import io.chainarchive.schema.RecordKind;
import io.chainarchive.write.batch.IdentifierOrder;
import io.chainarchive.write.pipeline.PipelineException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.parquet.example.data.Group;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArchiveWriterTest {
  private static String line(int height, String extra) {
    return "{\"header\":{\"id\":\"" + height + "-aa\",\"height\":" + height + ",\"hash\":\"0x" + height + "\",\"parent_hash\":\"0x" + (height - 1) + "\","
        + "\"timestamp\":" + (1000L * height) + "},"
        + "\"extrinsics\":[{\"id\":\"" + height + "-0\",\"block_id\":\"" + height + "-aa\",\"index_in_block\":0,\"call_id\":\"" + height + "-0\","
        + "\"success\":true,\"hash\":\"0xe" + height + "\",\"signature\":{\"signer\":\"bob\"}}],"
        + "\"events\":[{\"id\":\"" + height + "-0\",\"block_id\":\"" + height + "-aa\",\"index_in_block\":0,\"phase\":\"ApplyExtrinsic\","
        + "\"extrinsic_id\":\"" + height + "-0\",\"name\":\"System.ExtrinsicSuccess\"}],"
        + "\"calls\":[{\"id\":\"" + height + "-0\",\"block_id\":\"" + height + "-aa\",\"extrinsic_id\":\"" + height + "-0\",\"success\":true,"
        + "\"name\":\"Timestamp.set\",\"args\":{\"now\":" + height + "}}]"
        + extra + "}";
  }

  private static ByteArrayInputStream input(String... lines) {
    return new ByteArrayInputStream(String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
  }

  private static ArchiveConfig config(Path dir) {
    return new ArchiveConfig(dir.toString()).withCapacity(2).setCompression(Compression.NONE);
  }

  @Test
  public void logsThroughLogback() {
    assertEquals("ch.qos.logback.classic.LoggerContext", LoggerFactory.getILoggerFactory().getClass().getName());
  }

  @Test
  public void twoBlocksEndToEnd(@TempDir Path dir) throws Exception {
    ArchiveWriter writer = new ArchiveWriter(config(dir));
    writer.ingest(input(line(1, ""), line(2, "")));

    assertEquals(Collections.singletonList("2.parquet"), ParquetTestReader.fileNames(dir.resolve("block")));
    List<Group> blocks = ParquetTestReader.readRows(dir.resolve("block").resolve("2.parquet"));
    assertEquals(2, blocks.size());
    assertEquals(1, blocks.get(0).getInteger("height", 0));
    assertEquals(2, blocks.get(1).getInteger("height", 0));
    assertEquals(1000L, blocks.get(0).getLong("timestamp", 0));
    assertTrue(ParquetTestReader.isAbsent(blocks.get(0), "validator"));

    assertEquals(Collections.singletonList("2.parquet"), ParquetTestReader.fileNames(dir.resolve("extrinsic")));
    List<Group> extrinsics = ParquetTestReader.readRows(dir.resolve("extrinsic").resolve("2.parquet"));
    assertEquals(2, extrinsics.size());
    assertEquals("1-0", extrinsics.get(0).getString("id", 0));
    assertEquals("2-0", extrinsics.get(1).getString("id", 0));
    assertEquals("{\"signer\":\"bob\"}", extrinsics.get(0).getString("signature", 0));
    assertTrue(extrinsics.get(0).getBoolean("success", 0));

    assertEquals(2, ParquetTestReader.totalRows(dir.resolve("event")));
    List<Group> calls = ParquetTestReader.readRows(dir.resolve("call").resolve("2.parquet"));
    assertEquals("{\"now\":2}", calls.get(1).getString("args", 0));
    assertTrue(ParquetTestReader.isAbsent(calls.get(0), "parent_id"));

    assertEquals(2, writer.getBlocksWritten());
    assertEquals(2, writer.stats().get(RecordKind.CALL).getRowsWritten());
    assertFalse(Files.exists(dir.resolve(Constants.METADATA_STORE_FILE)));
  }

  @Test
  public void badLinesAreSkippedAndBlankLinesIgnored(@TempDir Path dir) throws Exception {
    ArchiveWriter writer = new ArchiveWriter(config(dir).setRowsPerFile(10).setRowsPerRowGroup(10));
    writer.ingest(input(line(1, ""), "", "{\"header\": oops", "   ", line(2, ""), line(3, "")));
    assertEquals(1, writer.getLinesSkipped());
    assertEquals(3, writer.getBlocksWritten());
    assertEquals(3, ParquetTestReader.totalRows(dir.resolve("block")));
    assertEquals(Collections.singletonList("3.parquet"), ParquetTestReader.fileNames(dir.resolve("block")));
  }

  @Test
  public void ingestClosesTheWriter(@TempDir Path dir) throws Exception {
    ArchiveWriter writer = new ArchiveWriter(config(dir));
    // a header without height is a decode error, skipped by default
    writer.ingest(input("{\"header\":{\"id\":\"1-a\"}}", line(4, "")));
    assertEquals(1, writer.getLinesSkipped());
    assertEquals(1, ParquetTestReader.totalRows(dir.resolve("block")));
    BlockData late = ArchiveDecoder.decode(line(5, ""), 1);
    assertThrows(IllegalStateException.class, () -> writer.write(late));
  }

  private static String withNullRecord(String line, RecordKind kind) {
    return line.replace("\"" + kind.getDirectory() + "s\":[", "\"" + kind.getDirectory() + "s\":[null,");
  }

  @Test
  public void nullDerivedRecordsFailTheRunByDefault(@TempDir Path dir) {
    for (RecordKind kind : Arrays.asList(RecordKind.EXTRINSIC, RecordKind.EVENT, RecordKind.CALL)) {
      ArchiveWriter writer = new ArchiveWriter(config(dir.resolve(kind.getDirectory())));
      PipelineException e = assertThrows(PipelineException.class,
          () -> writer.ingest(input(line(1, ""), withNullRecord(line(2, ""), kind), line(3, ""))));
      assertEquals(kind, e.getKind());
      assertTrue(e.getCause() instanceof EncodingException, kind + ": " + e.getCause());
    }
  }

  @Test
  public void nullDerivedRecordsAreSkippedOnRequest(@TempDir Path dir) throws Exception {
    for (RecordKind kind : Arrays.asList(RecordKind.EXTRINSIC, RecordKind.EVENT, RecordKind.CALL)) {
      Path out = dir.resolve(kind.getDirectory());
      ArchiveWriter writer = new ArchiveWriter(config(out).setSkipInvalidRecords(true));
      writer.ingest(input(line(1, ""), withNullRecord(line(2, ""), kind), line(3, "")));
      assertEquals(3, writer.getBlocksWritten());
      assertEquals(3, ParquetTestReader.totalRows(out.resolve("block")));
      assertEquals(3, ParquetTestReader.totalRows(out.resolve(kind.getDirectory())));
      assertEquals(1, writer.stats().get(kind).getRecordsSkipped());
      assertEquals(0, writer.stats().get(RecordKind.BLOCK).getRecordsSkipped());
    }
  }

  @Test
  public void metadataGoesToTheSidecar(@TempDir Path dir) throws Exception {
    String metadata = ",\"metadata\":{\"spec_name\":\"polkadot\",\"spec_version\":9,\"block_height\":1,\"block_hash\":\"0x1\",\"hex\":\"0x6d657461\"}";
    ArchiveWriter writer = new ArchiveWriter(config(dir).setMetadata(true));
    writer.ingest(input(line(1, metadata), line(2, "")));
    try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dir.resolve(Constants.METADATA_STORE_FILE));
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("SELECT id, block_height FROM metadata")) {
      assertTrue(rs.next());
      assertEquals("polkadot@9", rs.getString("id"));
      assertEquals(1, rs.getInt("block_height"));
      assertFalse(rs.next());
    }
  }

  @Test
  public void numericIdentifierOrderAcrossDigitCounts(@TempDir Path dir) throws Exception {
    ArchiveWriter writer = new ArchiveWriter(config(dir).withCapacity(3)
        .setIdentifierOrder(IdentifierOrder.NUMERIC_PREFIX));
    writer.ingest(input(line(9, ""), line(10, ""), line(100, "")));
    List<Group> extrinsics = ParquetTestReader.readRows(dir.resolve("extrinsic").resolve("100.parquet"));
    assertEquals(Arrays.asList("9-0", "10-0", "100-0"), Arrays.asList(
        extrinsics.get(0).getString("id", 0), extrinsics.get(1).getString("id", 0), extrinsics.get(2).getString("id", 0)));
  }

  private static Set<Thread> pipelineThreads() {
    return Thread.getAllStackTraces().keySet().stream()
        .filter(thread -> thread.getName().startsWith("archive-") && thread.isAlive())
        .collect(Collectors.toSet());
  }

  @Test
  public void startedPipelinesStopWhenTheMetadataStoreCannotOpen(@TempDir Path dir) throws Exception {
    Files.createDirectories(dir.resolve(Constants.METADATA_STORE_FILE));
    Set<Thread> before = pipelineThreads();
    assertThrows(ArchiveIOException.class, () -> new ArchiveWriter(config(dir).setMetadata(true)));
    long deadline = System.currentTimeMillis() + 5000;
    Set<Thread> leaked = pipelineThreads();
    leaked.removeAll(before);
    while (!leaked.isEmpty() && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
      leaked = pipelineThreads();
      leaked.removeAll(before);
    }
    assertTrue(leaked.isEmpty(), "still running: " + leaked);
  }

  @Test
  public void invalidConfigurationIsRejected(@TempDir Path dir) {
    assertThrows(IllegalArgumentException.class, () -> new ArchiveWriter(config(dir).setRowsPerRowGroup(5).setRowsPerFile(2)));
    assertThrows(IllegalArgumentException.class, () -> new ArchiveWriter(new ArchiveConfig()));
  }
}
