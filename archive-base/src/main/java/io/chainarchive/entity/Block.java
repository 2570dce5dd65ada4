package io.chainarchive.entity;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import io.chainarchive.error.EncodingException;

/**
 * A block header. The timestamp is kept as it appeared on input, epoch millis or an ISO-8601 instant.
 */
@JsonInclude(value = Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Block {
  private String id;
  private Integer height;
  private String hash;
  @JsonProperty("parent_hash")
  private String parentHash;
  @JsonProperty("state_root")
  private String stateRoot;
  @JsonProperty("extrinsics_root")
  private String extrinsicsRoot;
  private JsonNode timestamp;
  @JsonProperty("spec_id")
  private String specId;
  private String validator;

  public Block() {}

  public Block(String id, Integer height, String hash, String parentHash, JsonNode timestamp) {
    this.id = id;
    this.height = height;
    this.hash = hash;
    this.parentHash = parentHash;
    this.timestamp = timestamp;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public Integer getHeight() {
    return height;
  }

  public void setHeight(Integer height) {
    this.height = height;
  }

  public String getHash() {
    return hash;
  }

  public void setHash(String hash) {
    this.hash = hash;
  }

  public String getParentHash() {
    return parentHash;
  }

  public void setParentHash(String parentHash) {
    this.parentHash = parentHash;
  }

  public String getStateRoot() {
    return stateRoot;
  }

  public void setStateRoot(String stateRoot) {
    this.stateRoot = stateRoot;
  }

  public String getExtrinsicsRoot() {
    return extrinsicsRoot;
  }

  public void setExtrinsicsRoot(String extrinsicsRoot) {
    this.extrinsicsRoot = extrinsicsRoot;
  }

  public JsonNode getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(JsonNode timestamp) {
    this.timestamp = timestamp;
  }

  public String getSpecId() {
    return specId;
  }

  public void setSpecId(String specId) {
    this.specId = specId;
  }

  public String getValidator() {
    return validator;
  }

  public void setValidator(String validator) {
    this.validator = validator;
  }

  /**
   * @return The timestamp as epoch millis, {@code null} if the header has none.
   *
   * @throws EncodingException If the timestamp is neither an integral number nor an ISO-8601 instant.
   */
  public Long timestampMillis() {
    if (timestamp == null || timestamp.isNull() || timestamp.isMissingNode())
      return null;
    if (timestamp.isIntegralNumber() && timestamp.canConvertToLong())
      return timestamp.longValue();
    if (timestamp.isTextual()) {
      try {
        return Instant.parse(timestamp.textValue()).toEpochMilli();
      } catch (DateTimeParseException e) {
        throw new EncodingException("timestamp", "Block " + id + " has an unparsable timestamp " + timestamp.textValue(), e);
      }
    }
    throw new EncodingException("timestamp", "Block " + id + " has a timestamp of unsupported type " + timestamp.getNodeType());
  }

  @Override
  public String toString() {
    return "Block{id=" + id + ", height=" + height + ", hash=" + hash + '}';
  }
}
