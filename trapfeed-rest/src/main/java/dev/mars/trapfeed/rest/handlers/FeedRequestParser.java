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
import dev.mars.trapfeed.api.event.EventRecord;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns client JSON messages into typed requests.
 *
 * <p>Parsing is lenient: numbers may arrive as JSON numbers or numeric strings, and a field
 * that cannot be understood is treated as absent rather than failing the message.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 * @version 1.0
 */
public final class FeedRequestParser {

    private static final Logger logger = LoggerFactory.getLogger(FeedRequestParser.class);

    private static final DateTimeFormatter WIRE_TIMESTAMP = DateTimeFormatter.ofPattern(EventRecord.TIMESTAMP_PATTERN);

    private FeedRequestParser() {
    }

    public static GetPageRequest parseGetPage(JsonObject message) {
        GetPageRequest.SeverityChange severityChange = GetPageRequest.SeverityChange.KEEP;
        if (message.containsKey("severity")) {
            // null clears; a value that is not a number clears as well
            severityChange = GetPageRequest.SeverityChange.set(toInteger(message.getValue("severity")));
        }

        return new GetPageRequest(
            toInteger(message.getValue("offset")),
            toInteger(message.getValue("pageSize")),
            severityChange,
            isActiveOnly(message.getValue("active")),
            toText(message.getValue("hostname")),
            toText(message.getValue("agentip")),
            toTimestamp(message.getValue("timeFrom")),
            toTimestamp(message.getValue("timeTo")));
    }

    public static AcknowledgeRequest parseAcknowledge(JsonObject message) {
        List<Long> rowIds = toIds(message.getValue("rowIds"), "rowIds");
        List<Long> nodeIds = toIds(message.getValue("nodeIds"), "nodeIds");
        List<String> eventNames = new ArrayList<>();
        if (message.getValue("eventname") instanceof JsonArray names) {
            for (Object name : names) {
                if (name != null) {
                    eventNames.add(name.toString());
                }
            }
        }
        return new AcknowledgeRequest(rowIds, nodeIds, eventNames);
    }

    static Integer toInteger(Object value) {
        if (value instanceof Number number) {
            Long exact = exactLong(number);
            if (exact == null || exact < Integer.MIN_VALUE || exact > Integer.MAX_VALUE) {
                return null;
            }
            return exact.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static Long toLong(Object value) {
        if (value instanceof Number number) {
            return exactLong(number);
        }
        if (value instanceof String text) {
            try {
                return Long.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // null for fractional values and for values outside the long range
    private static Long exactLong(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        try {
            return new BigDecimal(number.toString()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    static LocalDateTime toTimestamp(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        try {
            return LocalDateTime.parse(trimmed, WIRE_TIMESTAMP);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(trimmed);
            } catch (DateTimeParseException iso) {
                logger.warn("Ignoring unparsable timestamp '{}'", trimmed);
                return null;
            }
        }
    }

    private static boolean isActiveOnly(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.intValue() == 1;
        }
        return false;
    }

    private static String toText(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    private static List<Long> toIds(Object value, String field) {
        List<Long> ids = new ArrayList<>();
        if (!(value instanceof JsonArray array)) {
            return ids;
        }
        for (Object element : array) {
            Long id = toLong(element);
            if (id == null) {
                logger.warn("Skipping invalid {} entry: {}", field, element);
            } else {
                ids.add(id);
            }
        }
        return ids;
    }
}
