package io.chainarchive.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Runtime metadata announced at a block, archived in the sidecar store rather than in a columnar file.
 */
@JsonInclude(value = Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Metadata {
  private String id;
  @JsonProperty("spec_name")
  private String specName;
  @JsonProperty("spec_version")
  private Integer specVersion;
  @JsonProperty("block_height")
  private Integer blockHeight;
  @JsonProperty("block_hash")
  private String blockHash;
  private String hex;

  public Metadata() {}

  public Metadata(String id, String specName, Integer specVersion, Integer blockHeight, String blockHash, String hex) {
    this.id = id;
    this.specName = specName;
    this.specVersion = specVersion;
    this.blockHeight = blockHeight;
    this.blockHash = blockHash;
    this.hex = hex;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  /**
   * @return The explicit id or {@code <spec_name>@<spec_version>} when the input carried none.
   */
  public String resolveId() {
    if (id != null)
      return id;
    return specName + "@" + specVersion;
  }

  public String getSpecName() {
    return specName;
  }

  public void setSpecName(String specName) {
    this.specName = specName;
  }

  public Integer getSpecVersion() {
    return specVersion;
  }

  public void setSpecVersion(Integer specVersion) {
    this.specVersion = specVersion;
  }

  public Integer getBlockHeight() {
    return blockHeight;
  }

  public void setBlockHeight(Integer blockHeight) {
    this.blockHeight = blockHeight;
  }

  public String getBlockHash() {
    return blockHash;
  }

  public void setBlockHash(String blockHash) {
    this.blockHash = blockHash;
  }

  public String getHex() {
    return hex;
  }

  public void setHex(String hex) {
    this.hex = hex;
  }

  @Override
  public String toString() {
    return "Metadata{id=" + resolveId() + ", blockHeight=" + blockHeight + '}';
  }
}
