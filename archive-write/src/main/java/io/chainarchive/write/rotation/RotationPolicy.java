package io.chainarchive.write.rotation;

/**
 * Counts pushed rows against the row group and file thresholds of one pipeline.
 */
public class RotationPolicy {
  public enum Decision {
    NONE,
    /** Write the buffered rows as a row group of the current file. */
    FLUSH_ROW_GROUP,
    /** Write the buffered rows as a row group then close the current file. */
    FLUSH_AND_ROTATE
  }

  private final int rowsPerRowGroup;
  private final int rowsPerFile;
  private int rowsInGroup;
  private int rowsInFile;

  public RotationPolicy(int rowsPerRowGroup, int rowsPerFile) {
    if (rowsPerRowGroup <= 0 || rowsPerFile <= 0)
      throw new IllegalArgumentException("Thresholds must be positive: rowsPerRowGroup=" + rowsPerRowGroup + " rowsPerFile=" + rowsPerFile);
    this.rowsPerRowGroup = rowsPerRowGroup;
    this.rowsPerFile = rowsPerFile;
  }

  /**
   * Accounts for one pushed row. Counters reset as part of the decision returned.
   *
   * @return What the pipeline must do now.
   */
  public Decision onPush() {
    rowsInGroup++;
    rowsInFile++;
    if (rowsInFile >= rowsPerFile) {
      rowsInGroup = 0;
      rowsInFile = 0;
      return Decision.FLUSH_AND_ROTATE;
    }
    if (rowsInGroup >= rowsPerRowGroup) {
      rowsInGroup = 0;
      return Decision.FLUSH_ROW_GROUP;
    }
    return Decision.NONE;
  }

  public void reset() {
    rowsInGroup = 0;
    rowsInFile = 0;
  }

  public int rowsInGroup() {
    return rowsInGroup;
  }

  public int rowsInFile() {
    return rowsInFile;
  }

  public int getRowsPerRowGroup() {
    return rowsPerRowGroup;
  }

  public int getRowsPerFile() {
    return rowsPerFile;
  }
}
