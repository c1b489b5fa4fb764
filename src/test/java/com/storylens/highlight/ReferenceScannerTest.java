package com.storylens.highlight;

import com.storylens.models.Entity;
import com.storylens.models.EntityType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceScannerTest {

    private static Entity entity(String id, String name, String... tags) {
        Entity entity = new Entity(id, name, EntityType.CHARACTER);
        entity.setTags(Arrays.asList(tags));
        return entity;
    }

    private static List<String> matchedText(String window, List<RawMatch> matches) {
        List<String> texts = new ArrayList<>();
        for (RawMatch match : matches) {
            texts.add(window.substring(match.getStart(), match.getEnd()));
        }
        return texts;
    }

    @Test
    void respectsWordBoundaries() {
        EntityIndex index = EntityIndex.build(List.of(entity("e1", "Aria")));
        String text = "Ariadne met Aria. Aria's cloak, Maria, and aria-like songs.";

        List<RawMatch> matches = new ReferenceScanner().scan(text, index);

        assertEquals(List.of("Aria", "Aria", "aria"), matchedText(text, matches));
        assertEquals(text.indexOf("Aria."), matches.get(0).getStart());
        assertEquals(text.indexOf("Aria's"), matches.get(1).getStart());
    }

    @Test
    void lettersOutsideBasicPlaneAreWordCharacters() {
        EntityIndex index = EntityIndex.build(List.of(entity("e1", "Aria")));
        String scriptA = "\uD835\uDC9C";

        assertTrue(new ReferenceScanner().scan(scriptA + "Aria waits", index).isEmpty());
        assertTrue(new ReferenceScanner().scan("Aria" + scriptA + " waits", index).isEmpty());

        String spaced = scriptA + " Aria " + scriptA;
        assertEquals(List.of("Aria"), matchedText(spaced, new ReferenceScanner().scan(spaced, index)));
        assertTrue(ReferenceScanner.isWordChar(scriptA.codePointAt(0)));
    }

    @Test
    void matchesCaseInsensitively() {
        EntityIndex index = EntityIndex.build(List.of(entity("e1", "Aria")));
        String text = "aria, ARIA and ArIa";

        assertEquals(3, new ReferenceScanner().scan(text, index).size());
    }

    @Test
    void multiWordNameSpansAnyWhitespace() {
        EntityIndex index = EntityIndex.build(List.of(entity("e1", "Crystal Tower")));
        String text = "They reached the crystal\n  tower at dusk. Crystaltower is not it.";

        List<RawMatch> matches = new ReferenceScanner().scan(text, index);

        assertEquals(1, matches.size());
        assertEquals("crystal\n  tower", text.substring(matches.get(0).getStart(), matches.get(0).getEnd()));
    }

    @Test
    void reportsNestedOccurrences() {
        EntityIndex index = EntityIndex.build(List.of(
            entity("e1", "Aria"),
            entity("e2", "Aria Blackwood")));
        String text = "Aria Blackwood arrived.";

        List<RawMatch> matches = new ReferenceScanner().scan(text, index);

        assertEquals(2, matches.size());
        assertTrue(matches.contains(new RawMatch(0, 0, 4)));
        assertTrue(matches.contains(new RawMatch(1, 0, 14)));
    }

    @Test
    void tagsAreMatchedLikeNames() {
        EntityIndex index = EntityIndex.build(List.of(entity("e1", "Aria", "scholar")));
        String text = "The scholar spoke; the scholars listened.";

        List<RawMatch> matches = new ReferenceScanner().scan(text, index);

        assertEquals(1, matches.size());
        assertEquals(PatternKind.TAG, index.getPattern(matches.get(0).getPatternId()).getKind());
    }

    @Test
    void emptyInputsYieldNothing() {
        EntityIndex index = EntityIndex.build(List.of(entity("e1", "Aria")));
        ReferenceScanner scanner = new ReferenceScanner();

        assertTrue(scanner.scan("", index).isEmpty());
        assertTrue(scanner.scan("Aria", EntityIndex.empty()).isEmpty());
        assertEquals(-1, ReferenceScanner.matchAt("Ari", 0, "aria"));
        assertEquals(4, ReferenceScanner.matchAt("ARIA!", 0, "aria"));
    }

    @Test
    void stopsWhenBudgetIsExhausted() {
        EntityIndex index = EntityIndex.build(List.of(entity("e1", "Aria")));
        String text = "word ".repeat(1000) + "Aria";
        AtomicLong clock = new AtomicLong();
        ReferenceScanner scanner = new ReferenceScanner(() -> clock.getAndAdd(1_000_000L));

        ScanBudgetExceededException e = assertThrows(ScanBudgetExceededException.class,
            () -> scanner.scan(text, index, 500_000L));
        assertEquals(1024, e.getScannedChars());

        List<RawMatch> unlimited = scanner.scan(text, index, 0L);
        assertEquals(1, unlimited.size());
    }
}
