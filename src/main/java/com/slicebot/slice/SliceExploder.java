package com.slicebot.slice;

import java.util.List;

/**
 * Turns a pinned query into the ordered list of concrete slice strings to retrieve.
 */
public interface SliceExploder {

    List<String> explode(String pinnedDsl);
}
