package org.waabox.changecast.example.application;

import java.util.Map;
import java.util.Objects;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.waabox.changecast.event.Operation;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.source.jdbc.JdbcChangeLogSource;

/** REST controller that records row changes in the change log, standing
 * in for the CRUD layer of the college application.
 *
 * <p>{@code POST /api/changes/{table}} takes a body of the form
 * {@code {"operation": "UPDATE", "old": {...}, "new": {...}}}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
@RequestMapping("/api/changes")
public class ChangeLogController {

  /** The change-log source, never null. */
  private final JdbcChangeLogSource changeLog;

  /** Creates a new ChangeLogController.
   *
   * @param theChangeLog the change-log source, never null
   */
  public ChangeLogController(final JdbcChangeLogSource theChangeLog) {
    changeLog = Objects.requireNonNull(theChangeLog,
        "changeLog cannot be null");
  }

  /** Appends a row change.
   *
   * @param table   the changed table name, never null
   * @param request the change, never null
   *
   * @return a map with the id of the change-log row, never null
   */
  @PostMapping("/{table}")
  @ResponseStatus(HttpStatus.CREATED)
  public Map<String, Object> append(@PathVariable("table") final String table,
      @RequestBody final ChangeRequest request) {
    if (request.operation() == null) {
      throw new IllegalArgumentException("operation is required");
    }
    final long id = changeLog.append(WatchedTable.fromTableName(table),
        Operation.fromCode(request.operation()), request.oldRecord(),
        request.newRecord());
    return Map.of("id", id);
  }

  /** Maps an invalid change to a 400 JSON response.
   *
   * @param e the failure, never null
   *
   * @return the error body, never null
   */
  @ExceptionHandler(IllegalArgumentException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public Map<String, String> handleInvalidChange(
      final IllegalArgumentException e) {
    return Map.of("error", "INVALID_CHANGE", "message", e.getMessage());
  }
}
