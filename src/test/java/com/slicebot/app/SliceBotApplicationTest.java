package com.slicebot.app;

import com.slicebot.model.TimeBounds;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SliceBotApplicationTest {
    private static final LocalDate REF = LocalDate.of(2026, 1, 15);

    @Test
    void helpShouldExitCleanly() {
        assertEquals(SliceBotApplication.EXIT_OK, new SliceBotApplication().run(new String[]{"--help"}));
    }

    @Test
    void missingRequiredOptionsShouldBeUsageErrors() {
        SliceBotApplication app = new SliceBotApplication();

        assertEquals(SliceBotApplication.EXIT_USAGE, app.run(new String[]{"--dsl", "window(-7d:)"}));
        assertEquals(SliceBotApplication.EXIT_USAGE, app.run(new String[]{"--graph", "graph.json"}));
        assertEquals(SliceBotApplication.EXIT_USAGE, app.run(new String[]{"--no-such-flag"}));
    }

    @Test
    void badCooldownShouldFailBeforeAnyWork() {
        int exit = new SliceBotApplication().run(new String[]{
                "--graph", "missing.json", "--dsl", "window(-7d:)", "--cooldown-minutes", "soon"});

        assertEquals(SliceBotApplication.EXIT_USAGE, exit);
    }

    @Test
    void parseCooldownShouldConvertMinutes() {
        assertNull(SliceBotApplication.parseCooldown(null));
        assertNull(SliceBotApplication.parseCooldown(" "));
        assertEquals(Long.valueOf(90_000L), SliceBotApplication.parseCooldown("1.5"));
        assertEquals(Long.valueOf(0L), SliceBotApplication.parseCooldown("0"));
        assertThrows(IllegalArgumentException.class, () -> SliceBotApplication.parseCooldown("-1"));
        assertThrows(IllegalArgumentException.class, () -> SliceBotApplication.parseCooldown("abc"));
    }

    @Test
    void parseWindowShouldAcceptDslAndRelativeDates() {
        assertNull(SliceBotApplication.parseWindow("", REF));
        assertEquals(TimeBounds.of(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 10)),
                SliceBotApplication.parseWindow("1-Jan-26:10-Jan-26", REF));
        assertEquals(TimeBounds.of(LocalDate.of(2026, 1, 8), LocalDate.of(2026, 1, 14)),
                SliceBotApplication.parseWindow("-7d:-1d", REF));
        assertThrows(IllegalArgumentException.class, () -> SliceBotApplication.parseWindow("1-Jan-26", REF));
        assertThrows(IllegalArgumentException.class, () -> SliceBotApplication.parseWindow(":1-Jan-26", REF));
        assertThrows(IllegalArgumentException.class, () -> SliceBotApplication.parseWindow("1-Jan-26:", REF));
    }
}
