package com.slicebot.runner;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CooldownTimerTest {

    @Test
    void awaitShouldSleepInPollSizedSteps() throws Exception {
        List<Long> sleeps = new ArrayList<>();
        CooldownTimer timer = new CooldownTimer(sleeps::add, 400L);

        assertTrue(timer.await(1000L, () -> false));
        assertEquals(List.of(400L, 400L, 200L), sleeps);
    }

    @Test
    void awaitShouldStopAtNextPollOnceAbortFires() throws Exception {
        List<Long> sleeps = new ArrayList<>();
        CooldownTimer timer = new CooldownTimer(sleeps::add, 100L);

        boolean completed = timer.await(10_000L, () -> sleeps.size() >= 3);

        assertFalse(completed);
        assertEquals(3, sleeps.size());
    }

    @Test
    void zeroDurationShouldCompleteWithoutSleeping() throws Exception {
        List<Long> sleeps = new ArrayList<>();

        assertTrue(new CooldownTimer(sleeps::add, 100L).await(0L, null));
        assertTrue(sleeps.isEmpty());
    }
}
