package com.slicebot.coverage;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class InMemoryContextRegistry implements ContextRegistry {
    private final Map<String, ContextDefinition> definitions = new LinkedHashMap<>();

    public InMemoryContextRegistry(Collection<ContextDefinition> definitions) {
        if (definitions != null) {
            for (ContextDefinition def : definitions) {
                this.definitions.put(def.id, def);
            }
        }
    }

    @Override
    public Optional<ContextDefinition> find(String contextKey) {
        return Optional.ofNullable(contextKey == null ? null : definitions.get(contextKey.trim()));
    }
}
