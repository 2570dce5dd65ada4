package io.chainarchive.key;

import io.chainarchive.Constants;
import io.chainarchive.error.MalformedIdentifierException;

/**
 * Parses the numeric block height embedded at the front of a composite identifier such as
 * {@code 0000012345-000003-ab12f} or {@code 12345-3}.
 */
public final class CompositeKeyExtractor {
  private CompositeKeyExtractor() {
  }

  /**
   * @param id A composite identifier {@code <height>-<suffix>}.
   *
   * @return The non-negative integer left of the first separator.
   *
   * @throws MalformedIdentifierException If there is no separator or the left segment isn't a non-negative decimal.
   */
  public static long extractNumericPrefix(String id) {
    if (id == null)
      throw new MalformedIdentifierException(null, "Identifier is missing");
    int separator = id.indexOf(Constants.ID_SEPARATOR);
    if (separator < 0)
      throw new MalformedIdentifierException(id, "Identifier " + id + " has no '" + Constants.ID_SEPARATOR + "' separator");
    if (separator == 0)
      throw new MalformedIdentifierException(id, "Identifier " + id + " has an empty numeric prefix");
    long value = 0;
    for (int i = 0; i < separator; i++) {
      char c = id.charAt(i);
      if (c < '0' || c > '9')
        throw new MalformedIdentifierException(id, "Identifier " + id + " has a non numeric prefix");
      int digit = c - '0';
      if (value > (Long.MAX_VALUE - digit) / 10)
        throw new MalformedIdentifierException(id, "Identifier " + id + " has a numeric prefix that overflows");
      value = value * 10 + digit;
    }
    return value;
  }

  /**
   * Same as {@link #extractNumericPrefix(String)} but the result must fit a block height column.
   */
  public static int extractHeight(String id) {
    long value = extractNumericPrefix(id);
    if (value > Integer.MAX_VALUE)
      throw new MalformedIdentifierException(id, "Identifier " + id + " has a height beyond " + Integer.MAX_VALUE);
    return (int) value;
  }
}
