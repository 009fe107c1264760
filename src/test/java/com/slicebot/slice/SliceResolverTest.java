package com.slicebot.slice;

import com.slicebot.model.QueryMode;
import com.slicebot.model.SliceConstraint;
import com.slicebot.model.TimeBounds;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SliceResolverTest {
    private static final LocalDate REF = LocalDate.of(2026, 3, 31);
    private static final QueryShape SHAPE = new QueryShape("amplitude-prod", "landing", "checkout", Map.of(), "");

    private final SliceResolver resolver = new SliceResolver();

    @Test
    void parseShouldReadWindowAndContexts() {
        SliceConstraint c = resolver.parse("window(1-Jan-26:31-Jan-26).context(channel:google)", REF);

        assertEquals(QueryMode.WINDOW, c.mode);
        assertEquals(TimeBounds.of(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31)), c.bounds);
        assertEquals("context(channel:google)", c.sliceFamily());
    }

    @Test
    void parseShouldReadCohortAnchorAndIsoDates() {
        SliceConstraint c = resolver.parse("cohort(landing,2026-01-01:2026-01-07)", REF);

        assertEquals(QueryMode.COHORT, c.mode);
        assertEquals("landing", c.cohortAnchor);
        assertEquals(7, c.bounds.dayCount());
    }

    @Test
    void relativeOpenEndedWindowResolvesAgainstReferenceDate() {
        SliceConstraint c = resolver.parse("window(-30d:)", REF);

        assertEquals(LocalDate.of(2026, 3, 1), c.bounds.start);
        assertEquals(REF, c.bounds.end);
    }

    @Test
    void familyShouldBeCanonicalRegardlessOfClauseOrder() {
        String a = resolver.parse("context(region:uk).window(1-Jan-26:2-Jan-26).context(channel:google)", REF)
                .sliceFamily();
        String b = resolver.parse("window(5-Jan-26:9-Jan-26).context(channel:google).context(region:uk)", REF)
                .sliceFamily();

        assertEquals("context(channel:google).context(region:uk)", a);
        assertEquals(a, b);
    }

    @Test
    void visitedAndExcludeStayOutOfFamilyButChangeSignature() {
        SliceConstraint plain = resolver.parse("window(1-Jan-26:2-Jan-26)", REF);
        SliceConstraint visited = resolver.parse("window(1-Jan-26:2-Jan-26).visited(pricing)", REF);

        assertEquals(plain.sliceFamily(), visited.sliceFamily());
        assertNotEquals(resolver.signatureFor(plain, SHAPE), resolver.signatureFor(visited, SHAPE));
    }

    @Test
    void signatureShouldNotDependOnTimeBounds() {
        ResolvedSlice jan = resolver.resolve("window(1-Jan-26:31-Jan-26).context(channel:google)", SHAPE, REF);
        ResolvedSlice feb = resolver.resolve("window(1-Feb-26:28-Feb-26).context(channel:google)", SHAPE, REF);

        assertEquals(jan.querySignature, feb.querySignature);
        assertEquals(jan.sliceFamily, feb.sliceFamily);
        assertEquals(64, jan.querySignature.length());
    }

    @Test
    void signatureShouldChangeWithFiltersModeAndShape() {
        String base = resolver.resolve("window(1-Jan-26:2-Jan-26)", SHAPE, REF).querySignature;
        String contexted = resolver.resolve("window(1-Jan-26:2-Jan-26).context(channel:google)", SHAPE, REF)
                .querySignature;
        String cohort = resolver.resolve("cohort(1-Jan-26:2-Jan-26)", SHAPE, REF).querySignature;
        String otherConnection = resolver.resolve("window(1-Jan-26:2-Jan-26)",
                SHAPE.toBuilder().connection("amplitude-staging").build(), REF).querySignature;

        assertNotEquals(base, contexted);
        assertNotEquals(base, cohort);
        assertNotEquals(base, otherConnection);
    }

    @Test
    void explicitWindowOverridesDslBounds() {
        SliceConstraint c = resolver.parse("window(1-Jan-26:31-Jan-26)", REF);
        TimeBounds override = TimeBounds.of(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 3));

        ResolvedSlice resolved = resolver.resolve("window(1-Jan-26:31-Jan-26)", c, SHAPE, override);

        assertEquals(override, resolved.timeBounds);
        assertEquals(override, resolved.constraint.bounds);
    }

    @Test
    void malformedSliceShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> resolver.parse("window(1-Jan-26:31-Jan-26", REF));
        assertThrows(IllegalArgumentException.class, () -> resolver.parse("bogus(x)", REF));
        assertThrows(IllegalArgumentException.class, () -> resolver.parse("window(31-Jan-26:1-Jan-26)", REF));
        assertThrows(IllegalArgumentException.class,
                () -> resolver.parse("window(1-Jan-26:2-Jan-26).cohort(1-Jan-26:2-Jan-26)", REF));
    }

    @Test
    void familyOfMalformedRecordDslNeverMatchesARealFamily() {
        String family = resolver.familyOf("context(channel");

        assertTrue(family.startsWith("#unparseable:"));
        assertEquals("", resolver.familyOf("window(1-Jan-26:2-Jan-26)"));
    }
}
