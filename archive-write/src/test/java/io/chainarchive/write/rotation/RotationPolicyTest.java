package io.chainarchive.write.rotation;

import io.chainarchive.write.rotation.RotationPolicy.Decision;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RotationPolicyTest {
  @Test
  public void rowGroupsThenRotation() {
    RotationPolicy policy = new RotationPolicy(2, 4);
    assertEquals(Decision.NONE, policy.onPush());
    assertEquals(Decision.FLUSH_ROW_GROUP, policy.onPush());
    assertEquals(0, policy.rowsInGroup());
    assertEquals(2, policy.rowsInFile());
    assertEquals(Decision.NONE, policy.onPush());
    assertEquals(Decision.FLUSH_AND_ROTATE, policy.onPush());
    assertEquals(0, policy.rowsInFile());
    // the fifth row starts over
    assertEquals(Decision.NONE, policy.onPush());
    assertEquals(1, policy.rowsInFile());
  }

  @Test
  public void singleCapacityRotatesEveryTime() {
    RotationPolicy policy = new RotationPolicy(3, 3);
    assertEquals(Decision.NONE, policy.onPush());
    assertEquals(Decision.NONE, policy.onPush());
    assertEquals(Decision.FLUSH_AND_ROTATE, policy.onPush());
    assertEquals(Decision.NONE, policy.onPush());
  }

  @Test
  public void fileThresholdNotAMultipleOfRowGroups() {
    RotationPolicy policy = new RotationPolicy(3, 4);
    assertEquals(Decision.NONE, policy.onPush());
    assertEquals(Decision.NONE, policy.onPush());
    assertEquals(Decision.FLUSH_ROW_GROUP, policy.onPush());
    assertEquals(Decision.FLUSH_AND_ROTATE, policy.onPush());
    assertEquals(0, policy.rowsInGroup());
  }

  @Test
  public void thresholdsMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new RotationPolicy(0, 4));
    assertThrows(IllegalArgumentException.class, () -> new RotationPolicy(2, -1));
  }

  @Test
  public void namesAvoidCollisions(@TempDir Path dir) throws Exception {
    assertEquals(dir.resolve("12.parquet"), FileNaming.BLOCK_HEIGHT.resolve(dir, 12, 0));
    Files.createFile(dir.resolve("12.parquet"));
    assertEquals(dir.resolve("12-1.parquet"), FileNaming.BLOCK_HEIGHT.resolve(dir, 12, 1));
    Files.createFile(dir.resolve("12-1.parquet"));
    assertEquals(dir.resolve("12-2.parquet"), FileNaming.BLOCK_HEIGHT.resolve(dir, 12, 2));
    assertEquals(dir.resolve("3.parquet"), FileNaming.SEQUENCE.resolve(dir, 12, 3));
    assertEquals(FileNaming.SEQUENCE, FileNaming.getFileNaming("sequence"));
  }
}
