package io.chainarchive.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(value = Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Extrinsic {
  private String id;
  @JsonProperty("block_id")
  private String blockId;
  @JsonProperty("index_in_block")
  private Integer indexInBlock;
  private Integer version;
  private JsonNode signature;
  @JsonProperty("call_id")
  private String callId;
  private Long fee;
  private Long tip;
  private Boolean success;
  private JsonNode error;
  private String hash;
  private Integer pos;

  public Extrinsic() {}

  public Extrinsic(String id, String blockId, Integer indexInBlock, String callId, Boolean success, String hash) {
    this.id = id;
    this.blockId = blockId;
    this.indexInBlock = indexInBlock;
    this.callId = callId;
    this.success = success;
    this.hash = hash;
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

  public Integer getVersion() {
    return version;
  }

  public void setVersion(Integer version) {
    this.version = version;
  }

  public JsonNode getSignature() {
    return signature;
  }

  public void setSignature(JsonNode signature) {
    this.signature = signature;
  }

  public String getCallId() {
    return callId;
  }

  public void setCallId(String callId) {
    this.callId = callId;
  }

  public Long getFee() {
    return fee;
  }

  public void setFee(Long fee) {
    this.fee = fee;
  }

  public Long getTip() {
    return tip;
  }

  public void setTip(Long tip) {
    this.tip = tip;
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

  public String getHash() {
    return hash;
  }

  public void setHash(String hash) {
    this.hash = hash;
  }

  public Integer getPos() {
    return pos;
  }

  public void setPos(Integer pos) {
    this.pos = pos;
  }

  @Override
  public String toString() {
    return "Extrinsic{id=" + id + ", callId=" + callId + ", success=" + success + '}';
  }
}
