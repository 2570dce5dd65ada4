package io.chainarchive.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(value = Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event {
  private String id;
  @JsonProperty("block_id")
  private String blockId;
  @JsonProperty("index_in_block")
  private Integer indexInBlock;
  private String phase;
  @JsonProperty("extrinsic_id")
  private String extrinsicId;
  @JsonProperty("call_id")
  private String callId;
  private String name;
  private JsonNode args;
  private Integer pos;

  public Event() {}

  public Event(String id, String blockId, Integer indexInBlock, String phase, String name) {
    this.id = id;
    this.blockId = blockId;
    this.indexInBlock = indexInBlock;
    this.phase = phase;
    this.name = name;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getBlockId() {
    return blockId;
  }

  public void setBlockId(String blockId) {
    this.blockId = blockId;
  }

  public Integer getIndexInBlock() {
    return indexInBlock;
  }

  public void setIndexInBlock(Integer indexInBlock) {
    this.indexInBlock = indexInBlock;
  }

  public String getPhase() {
    return phase;
  }

  public void setPhase(String phase) {
    this.phase = phase;
  }

  public String getExtrinsicId() {
    return extrinsicId;
  }

  public void setExtrinsicId(String extrinsicId) {
    this.extrinsicId = extrinsicId;
  }

  public String getCallId() {
    return callId;
  }

  public void setCallId(String callId) {
    this.callId = callId;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public JsonNode getArgs() {
    return args;
  }

  public void setArgs(JsonNode args) {
    this.args = args;
  }

  public Integer getPos() {
    return pos;
  }

  public void setPos(Integer pos) {
    this.pos = pos;
  }

  @Override
  public String toString() {
    return "Event{id=" + id + ", name=" + name + ", phase=" + phase + '}';
  }
}
