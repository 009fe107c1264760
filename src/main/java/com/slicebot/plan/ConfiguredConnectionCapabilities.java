package com.slicebot.plan;

import com.slicebot.config.Config;
import com.slicebot.graph.GraphEdge;
import com.slicebot.graph.GraphNode;
import com.slicebot.graph.ParameterBinding;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Connections require event ids unless explicitly declared otherwise, either through
 * {@code connections.without_event_ids} or a per-connection flag.
 */
public final class ConfiguredConnectionCapabilities implements ConnectionCapabilities {
    private final Set<String> withoutEventIds = new HashSet<>();
    private final Map<String, Boolean> explicitFlags = new HashMap<>();

    public ConfiguredConnectionCapabilities(Config config) {
        this(config, Map.of());
    }

    public ConfiguredConnectionCapabilities(Config config, Map<String, Boolean> requiresEventIdsByConnection) {
        for (String name : config.getList("connections.without_event_ids")) {
            withoutEventIds.add(normalize(name));
        }
        if (requiresEventIdsByConnection != null) {
            for (Map.Entry<String, Boolean> e : requiresEventIdsByConnection.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    explicitFlags.put(normalize(e.getKey()), e.getValue());
                }
            }
        }
    }

    @Override
    public boolean hasConnection(GraphEdge edge, ParameterBinding parameter) {
        return parameter != null && parameter.hasConnection();
    }

    @Override
    public boolean hasCaseConnection(GraphNode node) {
        return node != null && node.caseBinding != null && node.caseBinding.hasConnection();
    }

    @Override
    public boolean requiresEventIds(String connectionName) {
        String key = normalize(connectionName);
        Boolean explicit = explicitFlags.get(key);
        if (explicit != null) {
            return explicit;
        }
        return !withoutEventIds.contains(key);
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
