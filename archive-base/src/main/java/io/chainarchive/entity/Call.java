package io.chainarchive.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One call in an extrinsic's call tree, {@code parentId} is absent on the root call.
 */
@JsonInclude(value = Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Call {
  private String id;
  @JsonProperty("parent_id")
  private String parentId;
  @JsonProperty("block_id")
  private String blockId;
  @JsonProperty("extrinsic_id")
  private String extrinsicId;
  private Boolean success;
  private JsonNode error;
  private JsonNode origin;
  private String name;
  private JsonNode args;
  private Integer pos;

  public Call() {}

  public Call(String id, String parentId, String blockId, String extrinsicId, Boolean success, String name) {
    this.id = id;
    this.parentId = parentId;
    this.blockId = blockId;
    this.extrinsicId = extrinsicId;
    this.success = success;
    this.name = name;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getParentId() {
    return parentId;
  }

  public void setParentId(String parentId) {
    this.parentId = parentId;
  }

  public String getBlockId() {
    return blockId;
  }

  public void setBlockId(String blockId) {
    this.blockId = blockId;
  }

  public String getExtrinsicId() {
    return extrinsicId;
  }

  public void setExtrinsicId(String extrinsicId) {
    this.extrinsicId = extrinsicId;
  }

  public Boolean getSuccess() {
    return success;
  }

  public void setSuccess(Boolean success) {
    this.success = success;
  }

  public JsonNode getError() {
    return error;
  }

  public void setError(JsonNode error) {
    this.error = error;
  }

  public JsonNode getOrigin() {
    return origin;
  }

  public void setOrigin(JsonNode origin) {
    this.origin = origin;
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
    return "Call{id=" + id + ", parentId=" + parentId + ", name=" + name + '}';
  }
}
