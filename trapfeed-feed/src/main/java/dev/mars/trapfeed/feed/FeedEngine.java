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

package dev.mars.trapfeed.feed;

import dev.mars.trapfeed.api.event.CheckpointSnapshot;
import dev.mars.trapfeed.api.store.EventStore;
import dev.mars.trapfeed.api.store.InventoryStore;
import dev.mars.trapfeed.feed.acknowledge.AcknowledgeHandler;
import dev.mars.trapfeed.feed.broadcast.FanOutBroadcaster;
import dev.mars.trapfeed.feed.checkpoint.CheckpointTracker;
import dev.mars.trapfeed.feed.metrics.FeedMetrics;
import dev.mars.trapfeed.feed.page.PageQueryService;
import dev.mars.trapfeed.feed.poller.ChangePoller;
import dev.mars.trapfeed.feed.protocol.FeedMessages;
import dev.mars.trapfeed.feed.subscriber.SubscriberRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the feed components over a pair of stores.
 *
 * <p>Transports register subscribers with {@link #subscribers()} and route client requests
 * to {@link #pages()} and {@link #acknowledgements()}. The poll loop owns the checkpoint;
 * nothing else advances it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class FeedEngine {

    private static final Logger logger = LoggerFactory.getLogger(FeedEngine.class);

    private final FeedSettings settings;
    private final FeedMetrics metrics;
    private final FeedMessages messages;
    private final SubscriberRegistry subscribers;
    private final CheckpointTracker checkpoint;
    private final FanOutBroadcaster broadcaster;
    private final ChangePoller poller;
    private final PageQueryService pages;
    private final AcknowledgeHandler acknowledgements;

    public FeedEngine(Vertx vertx, EventStore eventStore, InventoryStore inventoryStore,
                      FeedSettings settings, MeterRegistry meterRegistry) {
        this.settings = settings;
        this.metrics = new FeedMetrics(meterRegistry);
        this.messages = new FeedMessages();
        this.subscribers = new SubscriberRegistry();
        this.checkpoint = new CheckpointTracker(eventStore);
        this.broadcaster = new FanOutBroadcaster(subscribers, messages, metrics, settings.chunkSize());
        this.poller = new ChangePoller(vertx, eventStore, checkpoint, broadcaster, metrics,
            settings.pollIntervalMs(), settings.pollBatchLimit());
        this.pages = new PageQueryService(eventStore, settings.pageSize(), settings.maxPageRows());
        this.acknowledgements = new AcknowledgeHandler(eventStore, inventoryStore, metrics);
        metrics.bindSubscriberCount(subscribers::size);
    }

    /**
     * Seeds the checkpoint from the store and starts the poll loop. Never fails: an unreadable
     * checkpoint starts the feed from zero.
     */
    public Future<CheckpointSnapshot> start() {
        return checkpoint.initialize()
            .onSuccess(snapshot -> {
                poller.start();
                logger.info("Feed engine started with {}", settings);
            });
    }

    /**
     * Stops polling and closes every subscriber connection.
     */
    public void stop() {
        poller.stop();
        subscribers.closeAll();
        logger.info("Feed engine stopped");
    }

    public FeedSettings settings() {
        return settings;
    }

    public FeedMetrics metrics() {
        return metrics;
    }

    public FeedMessages messages() {
        return messages;
    }

    public SubscriberRegistry subscribers() {
        return subscribers;
    }

    public CheckpointTracker checkpoint() {
        return checkpoint;
    }

    public FanOutBroadcaster broadcaster() {
        return broadcaster;
    }

    public ChangePoller poller() {
        return poller;
    }

    public PageQueryService pages() {
        return pages;
    }

    public AcknowledgeHandler acknowledgements() {
        return acknowledgements;
    }
}
