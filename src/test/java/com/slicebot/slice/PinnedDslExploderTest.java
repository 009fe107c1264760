package com.slicebot.slice;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PinnedDslExploderTest {
    private final PinnedDslExploder exploder = new PinnedDslExploder();

    @Test
    void explodeShouldKeepFirstSeenOrderAndDropDuplicates() {
        List<String> slices = exploder.explode(
                "window(1-Jan-26:2-Jan-26); window(3-Jan-26:4-Jan-26) ;window(1-Jan-26:2-Jan-26)");

        assertEquals(List.of("window(1-Jan-26:2-Jan-26)", "window(3-Jan-26:4-Jan-26)"), slices);
    }

    @Test
    void orGroupShouldContributeEachAlternative() {
        List<String> slices = exploder.explode(
                "or(window(1-Jan-26:2-Jan-26).context(channel:google),window(1-Jan-26:2-Jan-26).context(channel:facebook))");

        assertEquals(2, slices.size());
        assertEquals("window(1-Jan-26:2-Jan-26).context(channel:google)", slices.get(0));
        assertEquals("window(1-Jan-26:2-Jan-26).context(channel:facebook)", slices.get(1));
    }

    @Test
    void blankInputShouldYieldNoSlices() {
        assertTrue(exploder.explode("  ").isEmpty());
        assertTrue(exploder.explode(null).isEmpty());
    }
}
