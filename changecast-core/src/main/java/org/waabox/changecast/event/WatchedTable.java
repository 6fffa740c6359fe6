package org.waabox.changecast.event;

import java.util.Locale;
import java.util.Objects;

/**
 * The tables of the college backend whose row changes are republished to
 * stream clients.
 *
 * <p>Each constant knows the SQL name of its table and the name of the
 * domain entity stored in it; the latter prefixes the event type sent to
 * clients (e.g. {@code student_updated}).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum WatchedTable {

  /** Enrolled students. */
  STUDENTS("students", "student"),

  /** Course catalog. */
  COURSES("courses", "course"),

  /** Subjects taught within courses. */
  SUBJECTS("subjects", "subject"),

  /** Scheduled exams. */
  EXAMS("exams", "exam"),

  /** Exam marks per student. */
  MARKS("marks", "mark"),

  /** Daily attendance records. */
  ATTENDANCE("attendance", "attendance"),

  /** Faculty members. */
  FACULTY("faculty", "faculty"),

  /** Fee payments. */
  FEE_PAYMENTS("fee_payments", "fee_payment"),

  /** Admission applications. */
  ADMISSIONS("admissions", "admission"),

  /** User notifications. */
  NOTIFICATIONS("notifications", "notification");

  /** The SQL table name, never null. */
  private final String tableName;

  /** The domain entity name, never null. */
  private final String entityName;

  WatchedTable(final String theTableName, final String theEntityName) {
    tableName = theTableName;
    entityName = theEntityName;
  }

  /**
   * Returns the SQL table name.
   *
   * @return the table name as stored in the database, never null
   */
  public String tableName() {
    return tableName;
  }

  /**
   * Returns the domain entity name used to build client event types.
   *
   * @return the entity name, never null
   */
  public String entityName() {
    return entityName;
  }

  /**
   * Resolves a watched table from its SQL name, ignoring case.
   *
   * @param name the table name, never null
   *
   * @return the matching table, never null
   *
   * @throws IllegalArgumentException if no watched table has that name
   */
  public static WatchedTable fromTableName(final String name) {
    Objects.requireNonNull(name, "name cannot be null");
    final String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (final WatchedTable table : values()) {
      if (table.tableName.equals(normalized)) {
        return table;
      }
    }
    throw new IllegalArgumentException("Not a watched table: " + name);
  }
}
