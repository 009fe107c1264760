package com.slicebot.slice;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Graph-derived part of an external query: which connection, which events, which extra event filters.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class QueryShape {
    public static final QueryShape EMPTY = new QueryShape("", "", "", Map.of(), "");

    public final String connection;
    public final String fromEventId;
    public final String toEventId;
    public final Map<String, String> eventFilters;
    public final String condition;
}
