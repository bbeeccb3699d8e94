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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Set of currently connected subscribers, keyed by connection id.
 *
 * <p>Membership changes never disturb a broadcast in progress: the broadcaster iterates a
 * {@link #snapshot()} and a subscriber that disconnects mid-iteration is skipped because
 * its connection reports closed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class SubscriberRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SubscriberRegistry.class);

    private final ConcurrentMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    public Subscriber register(FeedConnection connection) {
        Subscriber subscriber = new Subscriber(connection);
        Subscriber previous = subscribers.put(subscriber.id(), subscriber);
        if (previous != null) {
            logger.warn("Connection id {} was already registered, replacing it", subscriber.id());
        }
        logger.info("Subscriber {} registered ({} connected)", subscriber.id(), subscribers.size());
        return subscriber;
    }

    public Optional<Subscriber> unregister(String connectionId) {
        Subscriber removed = subscribers.remove(connectionId);
        if (removed != null) {
            logger.info("Subscriber {} unregistered ({} connected)", connectionId, subscribers.size());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Subscriber> find(String connectionId) {
        return Optional.ofNullable(subscribers.get(connectionId));
    }

    /**
     * Immutable copy of the current members.
     */
    public List<Subscriber> snapshot() {
        return List.copyOf(subscribers.values());
    }

    public int size() {
        return subscribers.size();
    }

    /**
     * Closes every connection and empties the registry.
     */
    public void closeAll() {
        for (Subscriber subscriber : snapshot()) {
            try {
                subscriber.connection().close();
            } catch (RuntimeException e) {
                logger.warn("Error closing subscriber {}: {}", subscriber.id(), e.getMessage());
            }
            subscribers.remove(subscriber.id());
        }
    }
}
