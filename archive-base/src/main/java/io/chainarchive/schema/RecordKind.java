package io.chainarchive.schema;

public enum RecordKind {
  BLOCK("block"),
  EXTRINSIC("extrinsic"),
  EVENT("event"),
  CALL("call");

  private final String directory;

  RecordKind(String directory) {
    this.directory = directory;
  }

  /**
   * @return The directory name under the output root files of this kind are written to.
   */
  public String getDirectory() {
    return directory;
  }

  public static RecordKind fromDirectory(String directory) {
    for (RecordKind kind : RecordKind.values()) {
      if (kind.directory.equalsIgnoreCase(directory))
        return kind;
    }
    return null;
  }
}
