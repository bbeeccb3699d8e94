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

package dev.mars.trapfeed.feed.page;

import dev.mars.trapfeed.api.event.EventRecord;
import dev.mars.trapfeed.api.event.PageFilter;
import dev.mars.trapfeed.api.store.EventStore;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * On-demand paging over the event log, newest rows first.
 *
 * <p>A page never holds more than {@code maxPageRows} rows, whatever the caller asks for and
 * whatever the store returns. Missing or out-of-range paging input is normalized rather than
 * rejected.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class PageQueryService {

    private static final Logger logger = LoggerFactory.getLogger(PageQueryService.class);

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int DEFAULT_MAX_PAGE_ROWS = 50;

    private final EventStore eventStore;
    private final int defaultPageSize;
    private final int maxPageRows;

    public PageQueryService(EventStore eventStore) {
        this(eventStore, DEFAULT_PAGE_SIZE, DEFAULT_MAX_PAGE_ROWS);
    }

    public PageQueryService(EventStore eventStore, int defaultPageSize, int maxPageRows) {
        if (defaultPageSize <= 0) {
            throw new IllegalArgumentException("defaultPageSize must be positive, got " + defaultPageSize);
        }
        if (maxPageRows <= 0) {
            throw new IllegalArgumentException("maxPageRows must be positive, got " + maxPageRows);
        }
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.defaultPageSize = defaultPageSize;
        this.maxPageRows = maxPageRows;
    }

    /**
     * Fetches one page.
     *
     * @param offset   rows to skip; null or negative means 0
     * @param pageSize requested size; null or non-positive means the default page size
     * @param filter   restrictions, null for none
     */
    public Future<PageResult> getPage(Integer offset, Integer pageSize, PageFilter filter) {
        int effectiveOffset = normalizeOffset(offset);
        int limit = Math.min(normalizePageSize(pageSize), maxPageRows);
        PageFilter effectiveFilter = filter != null ? filter : PageFilter.NONE;

        logger.debug("Page request: offset={}, limit={}, filter={}", effectiveOffset, limit, effectiveFilter);
        return eventStore.fetchPage(effectiveFilter, effectiveOffset, limit)
            .map(rows -> new PageResult(effectiveOffset, truncate(rows)));
    }

    /**
     * The first unfiltered page, as sent to a newly connected subscriber.
     */
    public Future<PageResult> firstPage() {
        return getPage(0, defaultPageSize, PageFilter.NONE);
    }

    int normalizeOffset(Integer offset) {
        return offset == null || offset < 0 ? 0 : offset;
    }

    int normalizePageSize(Integer pageSize) {
        return pageSize == null || pageSize <= 0 ? defaultPageSize : pageSize;
    }

    private List<EventRecord> truncate(List<EventRecord> rows) {
        if (rows.size() <= maxPageRows) {
            return rows;
        }
        logger.debug("Store returned {} rows, truncating page to {}", rows.size(), maxPageRows);
        return rows.subList(0, maxPageRows);
    }
}
