package io.chainarchive.key;

import io.chainarchive.error.ErrorKind;
import io.chainarchive.error.MalformedIdentifierException;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CompositeKeyExtractorTest {
  @Test
  public void parsesLeadingHeight() {
    assertEquals(12345L, CompositeKeyExtractor.extractNumericPrefix("12345-3"));
    assertEquals(12345L, CompositeKeyExtractor.extractNumericPrefix("0000012345-000003-ab12f"));
    assertEquals(0L, CompositeKeyExtractor.extractNumericPrefix("0-"));
    assertEquals(7, CompositeKeyExtractor.extractHeight("7-1"));
  }

  @Test
  public void rejectsMalformedIdentifiers() {
    MalformedIdentifierException e = assertThrows(MalformedIdentifierException.class, () -> CompositeKeyExtractor.extractNumericPrefix("12345"));
    assertEquals("12345", e.getIdentifier());
    assertEquals(ErrorKind.MALFORMED_IDENTIFIER, e.getKind());
    assertThrows(MalformedIdentifierException.class, () -> CompositeKeyExtractor.extractNumericPrefix("-12"));
    assertThrows(MalformedIdentifierException.class, () -> CompositeKeyExtractor.extractNumericPrefix("12a-3"));
    assertThrows(MalformedIdentifierException.class, () -> CompositeKeyExtractor.extractNumericPrefix("+12-3"));
    assertThrows(MalformedIdentifierException.class, () -> CompositeKeyExtractor.extractNumericPrefix(null));
    assertThrows(MalformedIdentifierException.class, () -> CompositeKeyExtractor.extractNumericPrefix("99999999999999999999-1"));
    assertThrows(MalformedIdentifierException.class, () -> CompositeKeyExtractor.extractHeight("9999999999-1"));
  }

  @Test
  public void blockRangeUnion() {
    BlockRange range = BlockRange.of(5).union(BlockRange.of(9)).union(new BlockRange(2, 3));
    assertEquals(new BlockRange(2, 9), range);
    assertTrue(range.contains(7));
    assertThrows(IllegalArgumentException.class, () -> new BlockRange(4, 3));
  }
}
