package com.qualsim.core.space;

import com.qualsim.core.error.UnknownLevelException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QualitativeSpaceTest {

    private final QualitativeSpace level =
            new QualitativeSpace("battery_level", List.of("empty", "low", "medium", "high", "full"));

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects empty level list")
        void rejectsEmpty() {
            assertThrows(IllegalArgumentException.class, () -> new QualitativeSpace("s", List.of()));
        }

        @Test
        @DisplayName("rejects duplicate levels")
        void rejectsDuplicates() {
            assertThrows(IllegalArgumentException.class, () -> new QualitativeSpace("s", List.of("a", "b", "a")));
        }

        @Test
        @DisplayName("indexOf fails on a level outside the space")
        void unknownLevel() {
            var e = assertThrows(UnknownLevelException.class, () -> level.indexOf("overcharged"));
            assertEquals("battery_level", e.getSpace());
            assertEquals("overcharged", e.getLevel());
        }
    }

    @Nested
    @DisplayName("expand")
    class Expand {

        @Test
        @DisplayName("ordering operators follow level order")
        void orderingOperators() {
            assertEquals(List.of("empty", "low"), level.expand(Operator.LESS_THAN, List.of("medium")));
            assertEquals(List.of("empty", "low", "medium"), level.expand(Operator.LESS_THAN_OR_EQUAL, List.of("medium")));
            assertEquals(List.of("high", "full"), level.expand(Operator.GREATER_THAN, List.of("medium")));
            assertEquals(List.of("medium", "high", "full"), level.expand(Operator.GREATER_THAN_OR_EQUAL, List.of("medium")));
        }

        @Test
        @DisplayName("equality and set operators")
        void equalityAndSets() {
            assertEquals(List.of("full"), level.expand(Operator.EQUALS, List.of("full")));
            assertEquals(List.of("empty", "low", "medium", "high"), level.expand(Operator.NOT_EQUALS, List.of("full")));
            assertEquals(List.of("low", "high"), level.expand(Operator.IN, List.of("high", "low")));
            assertEquals(List.of("empty", "medium", "full"), level.expand(Operator.NOT_IN, List.of("high", "low")));
        }

        @Test
        @DisplayName("equals with several levels behaves as in")
        void equalsWithList() {
            assertEquals(List.of("low", "medium"), level.expand(Operator.EQUALS, List.of("medium", "low")));
            assertEquals(List.of("empty", "high", "full"), level.expand(Operator.NOT_EQUALS, List.of("medium", "low")));
        }

        @Test
        @DisplayName("boundaries yield empty results")
        void boundaries() {
            assertEquals(List.of(), level.expand(Operator.LESS_THAN, List.of("empty")));
            assertEquals(List.of(), level.expand(Operator.GREATER_THAN, List.of("full")));
        }

        @Test
        @DisplayName("ordering operator with several levels is rejected")
        void orderingWithList() {
            assertThrows(IllegalArgumentException.class,
                    () -> level.expand(Operator.LESS_THAN, List.of("low", "high")));
        }

        @Test
        @DisplayName("unknown pivot is rejected")
        void unknownPivot() {
            assertThrows(UnknownLevelException.class, () -> level.expand(Operator.EQUALS, List.of("brimming")));
        }

        @Test
        @DisplayName("lower-than sets grow monotonically with the pivot")
        void monotonic() {
            for (int i = 0; i < level.levels().size() - 1; i++) {
                List<String> smaller = level.expand(Operator.LESS_THAN_OR_EQUAL, List.of(level.levels().get(i)));
                List<String> larger = level.expand(Operator.LESS_THAN_OR_EQUAL, List.of(level.levels().get(i + 1)));
                assertTrue(larger.containsAll(smaller));
                assertEquals(smaller.size() + 1, larger.size());
            }
        }
    }

    @Nested
    @DisplayName("trends")
    class Trends {

        @Test
        @DisplayName("step clamps at both ends")
        void stepClamps() {
            assertEquals("high", level.step("medium", Trend.UP));
            assertEquals("full", level.step("full", Trend.UP));
            assertEquals("empty", level.step("empty", Trend.DOWN));
            assertEquals("medium", level.step("medium", Trend.NONE));
        }

        @Test
        @DisplayName("downward trend admits everything at or below the highest level")
        void downward() {
            assertEquals(List.of("empty", "low", "medium", "high"),
                    level.valueSetFromTrend(List.of("high"), Trend.DOWN));
            assertEquals(List.of("empty", "low", "medium"),
                    level.valueSetFromTrend(List.of("medium", "low"), Trend.DOWN));
        }

        @Test
        @DisplayName("upward trend admits everything at or above the lowest level")
        void upward() {
            assertEquals(List.of("low", "medium", "high", "full"),
                    level.valueSetFromTrend(List.of("low", "medium"), Trend.UP));
        }

        @Test
        @DisplayName("no trend keeps the current levels")
        void none() {
            assertEquals(List.of("low", "high"), level.valueSetFromTrend(List.of("high", "low"), Trend.NONE));
        }
    }

    @Test
    @DisplayName("set helpers return levels in space order")
    void setHelpers() {
        assertEquals(List.of("low", "high"), level.intersect(List.of("high", "full", "low"), List.of("low", "high")));
        assertEquals(List.of("empty", "full"), level.subtract(List.of("full", "empty", "low"), List.of("low")));
        assertEquals(List.of("empty", "medium", "full"), level.union(List.of("full"), List.of("medium", "empty")));
    }

    @Test
    @DisplayName("operators parse ids, long names and symbols")
    void operatorParsing() {
        assertEquals(Operator.LESS_THAN, Operator.parse("lt"));
        assertEquals(Operator.LESS_THAN, Operator.parse("less_than"));
        assertEquals(Operator.GREATER_THAN_OR_EQUAL, Operator.parse(">="));
        assertEquals(Operator.NOT_EQUALS, Operator.parse("!="));
        assertEquals(Operator.NOT_IN, Operator.IN.negate());
        assertThrows(IllegalArgumentException.class, () -> Operator.parse("about"));
    }
}
