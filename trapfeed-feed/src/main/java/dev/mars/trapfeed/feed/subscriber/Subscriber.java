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

package dev.mars.trapfeed.feed.subscriber;

import dev.mars.trapfeed.api.event.EventRecord;

import java.time.Instant;
import java.util.Objects;

/**
 * A connected consumer of the feed together with its own filter state.
 *
 * <p>The severity filter is written by the connection's message handler and read by the
 * broadcaster, so it is kept in a volatile field.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class Subscriber {

    private final FeedConnection connection;
    private final Instant connectedAt;
    private volatile Integer severityFilter;

    public Subscriber(FeedConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.connectedAt = Instant.now();
    }

    public String id() {
        return connection.id();
    }

    public FeedConnection connection() {
        return connection;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public boolean isOpen() {
        return connection.isOpen();
    }

    /** Severity this subscriber is restricted to, or null when it receives everything. */
    public Integer severityFilter() {
        return severityFilter;
    }

    public void setSeverityFilter(Integer severity) {
        this.severityFilter = severity;
    }

    public void clearSeverityFilter() {
        this.severityFilter = null;
    }

    public boolean accepts(EventRecord row) {
        Integer filter = severityFilter;
        return filter == null || row.hasSeverity(filter);
    }

    /**
     * Sends a message if the connection is still open.
     *
     * @return true if the message was handed to the connection
     */
    public boolean send(String text) {
        if (!connection.isOpen()) {
            return false;
        }
        connection.send(text);
        return true;
    }

    @Override
    public String toString() {
        return "Subscriber{id='" + id() + "', severityFilter=" + severityFilter + '}';
    }
}
