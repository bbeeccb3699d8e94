package dev.mars.trapfeed.db.store;

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

import dev.mars.trapfeed.api.event.PageFilter;
import io.vertx.sqlclient.Tuple;

/**
 * Builds the parameterized page statement for a {@link PageFilter}.
 *
 * <p>Only the restrictions present in the filter become predicates; values are always
 * bound as parameters. The hostname restriction is a case-insensitive substring match.</p>
 */
final class PageQuery {

    private final String sql;
    private final Tuple params;

    private PageQuery(String sql, Tuple params) {
        this.sql = sql;
        this.params = params;
    }

    static PageQuery of(PageFilter filter, int offset, int limit) {
        StringBuilder sql = new StringBuilder("SELECT ")
            .append(EventRowMapper.COLUMNS)
            .append(" FROM rcv_log WHERE 1=1");
        Tuple params = Tuple.tuple();

        if (filter.activeOnly()) {
            sql.append(" AND active = TRUE");
        }
        if (filter.hasSeverity()) {
            params.addInteger(filter.severity());
            sql.append(" AND severity = $").append(params.size());
        }
        if (filter.hasHostname()) {
            params.addString("%" + escapeLike(filter.hostname()) + "%");
            sql.append(" AND hostname ILIKE $").append(params.size());
        }
        if (filter.hasAgentIp()) {
            params.addString(filter.agentIp());
            sql.append(" AND agentip = $").append(params.size());
        }
        if (filter.timeFrom() != null) {
            params.addLocalDateTime(filter.timeFrom());
            sql.append(" AND traptime >= $").append(params.size());
        }
        if (filter.timeTo() != null) {
            params.addLocalDateTime(filter.timeTo());
            sql.append(" AND traptime <= $").append(params.size());
        }

        params.addLong((long) limit);
        sql.append(" ORDER BY id DESC LIMIT $").append(params.size());
        params.addLong((long) offset);
        sql.append(" OFFSET $").append(params.size());

        return new PageQuery(sql.toString(), params);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    String sql() {
        return sql;
    }

    Tuple params() {
        return params;
    }
}
