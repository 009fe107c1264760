package com.slicebot.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Link from an edge slot to a stored parameter and the connection that can populate it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ParameterBinding {
    public final String objectId;
    public final String connection;
    public final Double t95Days;

    public boolean hasConnection() {
        return connection != null && !connection.trim().isEmpty();
    }
}
