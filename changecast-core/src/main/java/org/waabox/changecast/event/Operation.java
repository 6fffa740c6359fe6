package org.waabox.changecast.event;

import java.util.Locale;
import java.util.Objects;

/**
 * The kind of row change carried by a {@link ChangeEvent}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Operation {

  /** A row was inserted. */
  INSERT("created"),

  /** A row was updated. */
  UPDATE("updated"),

  /** A row was deleted. */
  DELETE("deleted");

  /** The past-tense verb used in client event types. */
  private final String verb;

  Operation(final String theVerb) {
    verb = theVerb;
  }

  /**
   * Returns the past-tense verb of this operation, e.g. {@code updated}.
   *
   * @return the verb, never null
   */
  public String verb() {
    return verb;
  }

  /**
   * Parses a native operation code.
   *
   * <p>Accepts the full names ({@code INSERT}, {@code UPDATE},
   * {@code DELETE}), their single-letter forms ({@code I}, {@code U},
   * {@code D}) and the Debezium codes ({@code c}, {@code u}, {@code d},
   * {@code r}). Snapshot reads ({@code r}) are treated as inserts.
   *
   * @param code the native code, never null
   *
   * @return the operation, never null
   *
   * @throws IllegalArgumentException if the code is not recognized
   */
  public static Operation fromCode(final String code) {
    Objects.requireNonNull(code, "code cannot be null");
    switch (code.trim().toUpperCase(Locale.ROOT)) {
      case "INSERT":
      case "I":
      case "C":
      case "R":
        return INSERT;
      case "UPDATE":
      case "U":
        return UPDATE;
      case "DELETE":
      case "D":
        return DELETE;
      default:
        throw new IllegalArgumentException(
            "Unknown operation code: " + code);
    }
  }
}
