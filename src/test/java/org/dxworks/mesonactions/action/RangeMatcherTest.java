package org.dxworks.mesonactions.action;

import org.dxworks.mesonactions.model.IntegerLiteral;
import org.dxworks.mesonactions.model.Location;
import org.dxworks.mesonactions.model.Node;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.dxworks.mesonactions.TestUtils.range;
import static org.junit.jupiter.api.Assertions.*;

public class RangeMatcherTest {
    // occupies columns 4 and 5 of line 0
    private final Node literal = new IntegerLiteral(new Location(0, 4, 0, 6), 42, "42");

    @ParameterizedTest
    @CsvSource({
            "0, 4, 0, 6, true",
            "0, 0, 0, 10, true",
            "0, 5, 0, 8, true",
            "0, 0, 0, 5, true",
            "0, 6, 0, 10, false",
            "0, 0, 0, 4, false",
            "1, 0, 1, 3, false"
    })
    void matchesOverlappingRanges(int startLine, int startCharacter, int endLine, int endCharacter, boolean expected) {
        RangeMatcher matcher = new RangeMatcher(range(startLine, startCharacter, endLine, endCharacter));

        assertEquals(expected, matcher.inRange(literal, false));
    }

    @ParameterizedTest
    @CsvSource({
            "4, true",
            "5, true",
            "6, true",
            "3, false",
            "7, false"
    })
    void cursorMatchesNodesItTouches(int character, boolean expected) {
        RangeMatcher matcher = new RangeMatcher(range(0, character, 0, character));

        assertEquals(expected, matcher.inRange(literal, false));
    }

    @Test
    void multiLineNodes() {
        Location block = new Location(1, 2, 3, 0);

        assertTrue(new RangeMatcher(range(0, 0, 1, 3)).overlaps(block));
        assertTrue(new RangeMatcher(range(2, 0, 2, 0)).overlaps(block));
        assertFalse(new RangeMatcher(range(3, 0, 4, 0)).overlaps(block));
        assertFalse(new RangeMatcher(range(0, 0, 1, 2)).overlaps(block));
    }

    @Test
    void recordedNodesMatchOnce() {
        RangeMatcher matcher = new RangeMatcher(range(0, 0, 0, 10));

        assertTrue(matcher.inRange(literal));
        assertFalse(matcher.inRange(literal));
        assertTrue(matcher.inRange(literal, false));
        assertTrue(matcher.inRange(new IntegerLiteral(new Location(0, 4, 0, 6), 42, "42")));
    }
}
