package com.slicebot.coverage;

import java.util.Optional;

/**
 * Source of context definitions (value enumeration and other-policy).
 */
public interface ContextRegistry {

    Optional<ContextDefinition> find(String contextKey);
}
