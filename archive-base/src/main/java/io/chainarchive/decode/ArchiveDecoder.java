package io.chainarchive.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.chainarchive.entity.BlockData;
import io.chainarchive.error.DecodeException;
import io.chainarchive.error.EncodingException;

/**
 * Turns one line of the input stream into a {@link BlockData} and flattens opaque JSON values back to compact text.
 */
public class ArchiveDecoder {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private ArchiveDecoder() {
  }

  public static ObjectMapper objectMapper() {
    return OBJECT_MAPPER;
  }

  /**
   * @param line       One JSON object.
   * @param lineNumber The 1-based line the object was read from, used in diagnostics only.
   *
   * @return The decoded block.
   *
   * @throws DecodeException If the line isn't valid JSON for a block or lacks the header's height.
   */
  public static BlockData decode(String line, long lineNumber) {
    BlockData blockData;
    try {
      blockData = OBJECT_MAPPER.readValue(line, BlockData.class);
    } catch (JsonProcessingException e) {
      throw new DecodeException(lineNumber, "Unable to decode line " + lineNumber + ": " + e.getOriginalMessage(), e);
    }
    if (blockData == null)
      throw new DecodeException(lineNumber, "Line " + lineNumber + " is a JSON null");
    if (blockData.getHeader() == null)
      throw new DecodeException(lineNumber, "Line " + lineNumber + " has no header");
    if (blockData.getHeader().getHeight() == null)
      throw new DecodeException(lineNumber, "Line " + lineNumber + " has a header without height");
    if (blockData.getHeader().getHeight() < 0)
      throw new DecodeException(lineNumber, "Line " + lineNumber + " has a negative height " + blockData.getHeader().getHeight());
    return blockData;
  }

  /**
   * @param field The field name, used in diagnostics only.
   * @param value An opaque JSON value.
   *
   * @return Its compact JSON text or {@code null} when the value is absent or a JSON null.
   */
  public static String toJsonText(String field, JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode())
      return null;
    try {
      return OBJECT_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new EncodingException(field, "Unable to serialize " + field + " to JSON text", e);
    }
  }
}
