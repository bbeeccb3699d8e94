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

package dev.mars.trapfeed.rest.handlers;

import dev.mars.trapfeed.api.acknowledge.AcknowledgeRequest;
import dev.mars.trapfeed.api.event.PageFilter;
import dev.mars.trapfeed.feed.subscriber.Subscriber;
import dev.mars.trapfeed.feed.subscriber.SubscriberRegistry;
import dev.mars.trapfeed.rest.support.NoopConnection;
import dev.mars.trapfeed.test.categories.TestCategories;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class FeedRequestParserTest {

    private Subscriber subscriber;

    @BeforeEach
    void setUp() {
        subscriber = new SubscriberRegistry().register(new NoopConnection("c-1"));
        subscriber.setSeverityFilter(3);
    }

    @Test
    void testAbsentSeverityKeepsFilter() {
        apply(new JsonObject().put("type", "getPage"));
        assertEquals(3, subscriber.severityFilter());
    }

    @Test
    void testNullSeverityClearsFilter() {
        apply(new JsonObject().put("type", "getPage").putNull("severity"));
        assertNull(subscriber.severityFilter());
    }

    @Test
    void testNumericAndNumericStringSeveritySetFilter() {
        apply(new JsonObject().put("severity", 5));
        assertEquals(5, subscriber.severityFilter());

        apply(new JsonObject().put("severity", " 2 "));
        assertEquals(2, subscriber.severityFilter());
    }

    @Test
    void testInvalidSeverityClearsFilter() {
        apply(new JsonObject().put("severity", "critical"));
        assertNull(subscriber.severityFilter());

        subscriber.setSeverityFilter(1);
        apply(new JsonObject().put("severity", new JsonObject()));
        assertNull(subscriber.severityFilter());
    }

    @Test
    void testPagingAndFilterFields() {
        GetPageRequest request = FeedRequestParser.parseGetPage(new JsonObject()
            .put("offset", "100")
            .put("pageSize", 25)
            .put("active", 1)
            .put("hostname", "core")
            .put("agentip", "10.1.1.1")
            .put("timeFrom", "2026-01-01 00:00:00")
            .put("timeTo", "2026-01-31T23:59:59"));

        assertEquals(100, request.offset());
        assertEquals(25, request.pageSize());

        PageFilter filter = request.toFilter(4);
        assertEquals(4, filter.severity());
        assertTrue(filter.activeOnly());
        assertEquals("core", filter.hostname());
        assertEquals("10.1.1.1", filter.agentIp());
        assertEquals(LocalDateTime.of(2026, 1, 1, 0, 0), filter.timeFrom());
        assertEquals(LocalDateTime.of(2026, 1, 31, 23, 59, 59), filter.timeTo());
    }

    @Test
    void testActiveOnlyForOneOrTrue() {
        assertTrue(FeedRequestParser.parseGetPage(new JsonObject().put("active", true)).activeOnly());
        assertTrue(FeedRequestParser.parseGetPage(new JsonObject().put("active", 1)).activeOnly());
        assertFalse(FeedRequestParser.parseGetPage(new JsonObject().put("active", 0)).activeOnly());
        assertFalse(FeedRequestParser.parseGetPage(new JsonObject().put("active", "1")).activeOnly());
        assertFalse(FeedRequestParser.parseGetPage(new JsonObject()).activeOnly());
    }

    @Test
    void testInvalidPagingAndTimesBecomeAbsent() {
        GetPageRequest request = FeedRequestParser.parseGetPage(new JsonObject()
            .put("offset", "ten")
            .put("pageSize", true)
            .put("timeFrom", "yesterday")
            .put("hostname", "  "));

        assertNull(request.offset());
        assertNull(request.pageSize());
        assertNull(request.timeFrom());
        assertNull(request.hostname());
    }

    @Test
    void testNumbersOutsideIntRangeAreAbsentNotWrapped() {
        GetPageRequest request = FeedRequestParser.parseGetPage(new JsonObject(
            "{\"type\":\"getPage\",\"offset\":4294967346,\"pageSize\":2.5,\"severity\":4294967297}"));

        assertNull(request.offset());
        assertNull(request.pageSize());
        request.severityChange().applyTo(subscriber);
        assertNull(subscriber.severityFilter());
    }

    @Test
    void testFractionalSeverityClearsFilterButWholeDoubleSetsIt() {
        apply(new JsonObject().put("severity", 2.7));
        assertNull(subscriber.severityFilter());

        apply(new JsonObject().put("severity", 4.0));
        assertEquals(4, subscriber.severityFilter());
    }

    @Test
    void testAcknowledgeSkipsFractionalAndOversizedIds() {
        AcknowledgeRequest request = FeedRequestParser.parseAcknowledge(new JsonObject(
            "{\"rowIds\":[5,9.5,123456789012345678901234567890,7]}"));

        assertEquals(List.of(5L, 7L), request.rowIds());
    }

    @Test
    void testAcknowledgeSkipsNonNumericIds() {
        AcknowledgeRequest request = FeedRequestParser.parseAcknowledge(new JsonObject()
            .put("rowIds", new JsonArray().add(5).add("9").add("abc").addNull())
            .put("nodeIds", new JsonArray().add(12L))
            .put("eventname", new JsonArray().add("linkDown")));

        assertEquals(List.of(5L, 9L), request.rowIds());
        assertEquals(List.of(12L), request.nodeIds());
        assertEquals(List.of("linkDown"), request.eventNames());
    }

    @Test
    void testAcknowledgeWithMissingListsIsEmpty() {
        AcknowledgeRequest request = FeedRequestParser.parseAcknowledge(new JsonObject()
            .put("rowIds", "5,9"));

        assertTrue(request.rowIds().isEmpty());
        assertTrue(request.nodeIds().isEmpty());
        assertTrue(request.eventNames().isEmpty());
    }

    private void apply(JsonObject message) {
        FeedRequestParser.parseGetPage(message).severityChange().applyTo(subscriber);
    }
}
