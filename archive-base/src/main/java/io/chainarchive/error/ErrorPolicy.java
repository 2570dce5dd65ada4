package io.chainarchive.error;

import java.util.EnumMap;
import java.util.Map;

/**
 * Decides per {@link ErrorKind} whether a failing record is skipped (logged and counted) or aborts the run.
 */
public class ErrorPolicy {
  public enum Action {
    SKIP,
    FATAL
  }

  private final Map<ErrorKind, Action> actions = new EnumMap<>(ErrorKind.class);

  private ErrorPolicy() {
    for (ErrorKind kind : ErrorKind.values())
      actions.put(kind, Action.FATAL);
  }

  /**
   * Malformed lines are skipped, anything else is fatal.
   *
   * @return The default policy.
   */
  public static ErrorPolicy defaults() {
    return new ErrorPolicy().with(ErrorKind.DECODE, Action.SKIP);
  }

  /**
   * Same as {@link #defaults()} but records with a malformed identifier or an unencodable field are skipped as well.
   *
   * @return The lenient policy.
   */
  public static ErrorPolicy skipInvalidRecords() {
    return defaults()
        .with(ErrorKind.MALFORMED_IDENTIFIER, Action.SKIP)
        .with(ErrorKind.ENCODING, Action.SKIP);
  }

  public static ErrorPolicy failFast() {
    return new ErrorPolicy();
  }

  public ErrorPolicy with(ErrorKind kind, Action action) {
    if (action == Action.SKIP && !kind.isSkippable())
      throw new IllegalArgumentException(kind + " errors cannot be skipped");
    actions.put(kind, action);
    return this;
  }

  public Action actionFor(ErrorKind kind) {
    return actions.get(kind);
  }

  public boolean shouldSkip(ArchiveException e) {
    return actionFor(e.getKind()) == Action.SKIP;
  }

  @Override
  public String toString() {
    return "ErrorPolicy" + actions;
  }
}
