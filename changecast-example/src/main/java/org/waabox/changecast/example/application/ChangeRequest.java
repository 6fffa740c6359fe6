package org.waabox.changecast.example.application;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The body of a change-log append.
 *
 * @param operation the operation code (INSERT, UPDATE or DELETE)
 * @param oldRecord the row before the change, null for inserts
 * @param newRecord the row after the change, null for deletes
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeRequest(
    @JsonProperty("operation") String operation,
    @JsonProperty("old") Map<String, Object> oldRecord,
    @JsonProperty("new") Map<String, Object> newRecord
) {
}
