/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.trapfeed.api.event;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;

/**
 * One received event line from the {@code rcv_log} table.
 *
 * <p>The JSON property names are the column names, which is also the shape
 * subscribers receive inside {@code init}, {@code update} and {@code page} messages.
 * Timestamps travel as {@code yyyy-MM-dd HH:mm:ss} strings.</p>
 *
 * @param id          store-assigned identifier, immutable and monotonically increasing
 * @param nodeId      inventory node the event was raised for, may be null
 * @param active      true while the event is still outstanding
 * @param severity    small integer severity level
 * @param eventName   event name
 * @param utcTime     origin time reported by the agent
 * @param trapTime    time the event was received, used for time-range paging
 * @param updateTime  last time the row was mutated, may be null
 * @param hostname    source host name
 * @param agentIp     source agent address
 * @param formatLine  free-text formatted line
 * @param updated     true when the row changed since it was last emitted
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"id", "node_id", "active", "eventname", "severity", "utctime", "traptime",
        "updatetime", "hostname", "agentip", "formatline", "updated"})
public record EventRecord(
        @JsonProperty("id") long id,
        @JsonProperty("node_id") Long nodeId,
        @JsonProperty("active") boolean active,
        @JsonProperty("severity") int severity,
        @JsonProperty("eventname") String eventName,
        @JsonProperty("utctime") @JsonFormat(pattern = EventRecord.TIMESTAMP_PATTERN) LocalDateTime utcTime,
        @JsonProperty("traptime") @JsonFormat(pattern = EventRecord.TIMESTAMP_PATTERN) LocalDateTime trapTime,
        @JsonProperty("updatetime") @JsonFormat(pattern = EventRecord.TIMESTAMP_PATTERN) LocalDateTime updateTime,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("agentip") String agentIp,
        @JsonProperty("formatline") String formatLine,
        @JsonProperty("updated") boolean updated) {

    /** Wire format of every timestamp column. */
    public static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";

    /**
     * Whether this row carries the given severity.
     */
    public boolean hasSeverity(int expected) {
        return severity == expected;
    }
}
