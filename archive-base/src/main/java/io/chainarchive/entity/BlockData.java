package io.chainarchive.entity;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;

import io.chainarchive.key.BlockRange;

/**
 * Everything one input line carries about a single block.
 */
@JsonInclude(value = Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlockData {
  private Block header;
  private List<Extrinsic> extrinsics = new ArrayList<>();
  private List<Event> events = new ArrayList<>();
  private List<Call> calls = new ArrayList<>();
  private Metadata metadata;

  public BlockData() {}

  public BlockData(Block header, List<Extrinsic> extrinsics, List<Event> events, List<Call> calls) {
    this.header = header;
    setExtrinsics(extrinsics);
    setEvents(events);
    setCalls(calls);
  }

  public Block getHeader() {
    return header;
  }

  public void setHeader(Block header) {
    this.header = header;
  }

  public List<Extrinsic> getExtrinsics() {
    return extrinsics;
  }

  public void setExtrinsics(List<Extrinsic> extrinsics) {
    this.extrinsics = extrinsics == null ? new ArrayList<>() : extrinsics;
  }

  public List<Event> getEvents() {
    return events;
  }

  public void setEvents(List<Event> events) {
    this.events = events == null ? new ArrayList<>() : events;
  }

  public List<Call> getCalls() {
    return calls;
  }

  public void setCalls(List<Call> calls) {
    this.calls = calls == null ? new ArrayList<>() : calls;
  }

  public Metadata getMetadata() {
    return metadata;
  }

  public void setMetadata(Metadata metadata) {
    this.metadata = metadata;
  }

  public BlockRange blockRange() {
    return BlockRange.of(header.getHeight());
  }
}
