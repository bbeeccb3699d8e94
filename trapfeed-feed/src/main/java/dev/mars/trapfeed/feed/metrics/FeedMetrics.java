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

package dev.mars.trapfeed.feed.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * Micrometer meters of the feed engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class FeedMetrics {

    private final MeterRegistry registry;
    private final Counter pollCycles;
    private final Counter pollFailures;
    private final Counter rowsBroadcast;
    private final Counter partialAcknowledges;

    public FeedMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.pollCycles = Counter.builder("trapfeed.poll.cycles")
            .description("Completed change poll cycles")
            .register(registry);
        this.pollFailures = Counter.builder("trapfeed.poll.failures")
            .description("Change poll cycles that failed")
            .register(registry);
        this.rowsBroadcast = Counter.builder("trapfeed.rows.broadcast")
            .description("Rows handed to the fan-out broadcaster")
            .register(registry);
        this.partialAcknowledges = Counter.builder("trapfeed.acknowledge.partial")
            .description("Acknowledges whose inventory update failed after the rows were resolved")
            .register(registry);
    }

    /**
     * Metrics backed by a private in-memory registry.
     */
    public static FeedMetrics inMemory() {
        return new FeedMetrics(new SimpleMeterRegistry());
    }

    public void bindSubscriberCount(Supplier<Number> subscriberCount) {
        Gauge.builder("trapfeed.subscribers", subscriberCount)
            .description("Currently connected feed subscribers")
            .register(registry);
    }

    public void pollCompleted() {
        pollCycles.increment();
    }

    public void pollFailed() {
        pollFailures.increment();
    }

    public void rowsBroadcast(int rows) {
        rowsBroadcast.increment(rows);
    }

    public void partialAcknowledge() {
        partialAcknowledges.increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
