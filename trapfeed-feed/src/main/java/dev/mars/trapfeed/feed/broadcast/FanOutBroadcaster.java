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

package dev.mars.trapfeed.feed.broadcast;

import dev.mars.trapfeed.api.event.EventRecord;
import dev.mars.trapfeed.feed.metrics.FeedMetrics;
import dev.mars.trapfeed.feed.protocol.FeedMessages;
import dev.mars.trapfeed.feed.protocol.MessageType;
import dev.mars.trapfeed.feed.subscriber.Subscriber;
import dev.mars.trapfeed.feed.subscriber.SubscriberRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pushes a batch of rows to every connected subscriber in bounded chunks.
 *
 * <p>Each chunk is encoded at most once per distinct filter: subscribers without a filter
 * share the encoding of the whole chunk, subscribers filtering on the same severity share
 * the encoding of that subset. A subscriber whose subset of a chunk is empty gets nothing
 * for that chunk. A failing send is logged and does not affect other subscribers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class FanOutBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(FanOutBroadcaster.class);

    public static final int DEFAULT_CHUNK_SIZE = 250;

    private final SubscriberRegistry registry;
    private final FeedMessages messages;
    private final FeedMetrics metrics;
    private final int chunkSize;

    public FanOutBroadcaster(SubscriberRegistry registry, FeedMessages messages, FeedMetrics metrics, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        this.registry = Objects.requireNonNull(registry, "registry");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.chunkSize = chunkSize;
    }

    public BroadcastReport broadcast(List<EventRecord> rows, MessageType type) {
        if (rows == null || rows.isEmpty()) {
            return BroadcastReport.EMPTY;
        }

        List<Subscriber> subscribers = registry.snapshot();
        int chunks = 0;
        int messagesSent = 0;
        int rowsSent = 0;
        int sendFailures = 0;
        Set<String> reached = new HashSet<>();

        for (int start = 0; start < rows.size(); start += chunkSize) {
            List<EventRecord> chunk = rows.subList(start, Math.min(start + chunkSize, rows.size()));
            chunks++;

            String unfiltered = null;
            Map<Integer, Encoded> bySeverity = new HashMap<>();

            for (Subscriber subscriber : subscribers) {
                if (!subscriber.isOpen()) {
                    continue;
                }

                Integer severity = subscriber.severityFilter();
                String payload;
                int rowCount;
                if (severity == null) {
                    if (unfiltered == null) {
                        unfiltered = messages.rows(type, chunk);
                    }
                    payload = unfiltered;
                    rowCount = chunk.size();
                } else {
                    Encoded subset = bySeverity.computeIfAbsent(severity, s -> encodeSubset(type, chunk, s));
                    if (subset.rowCount() == 0) {
                        continue;
                    }
                    payload = subset.payload();
                    rowCount = subset.rowCount();
                }

                try {
                    if (subscriber.send(payload)) {
                        messagesSent++;
                        rowsSent += rowCount;
                        reached.add(subscriber.id());
                    }
                } catch (RuntimeException e) {
                    sendFailures++;
                    logger.warn("Failed to send {} chunk to subscriber {}: {}",
                        type.wireName(), subscriber.id(), e.getMessage());
                }
            }
        }

        metrics.rowsBroadcast(rows.size());
        BroadcastReport report = new BroadcastReport(chunks, messagesSent, rowsSent, reached.size(), sendFailures);
        logger.debug("Broadcast {} rows as {}: {}", rows.size(), type.wireName(), report);
        return report;
    }

    public int chunkSize() {
        return chunkSize;
    }

    private Encoded encodeSubset(MessageType type, List<EventRecord> chunk, int severity) {
        List<EventRecord> subset = chunk.stream()
            .filter(row -> row.hasSeverity(severity))
            .toList();
        return subset.isEmpty() ? Encoded.NONE : new Encoded(messages.rows(type, subset), subset.size());
    }

    private record Encoded(String payload, int rowCount) {
        static final Encoded NONE = new Encoded(null, 0);
    }
}
