package com.slicebot.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class CaseBinding {
    public final String objectId;
    public final String connection;

    public boolean hasConnection() {
        return connection != null && !connection.trim().isEmpty();
    }
}
