package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.feature.Ordering.Direction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.finos.legend.dsl.SchoolFixtures.STUDENT;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Ordering Tests")
class OrderingTest {

    private final Column surname = STUDENT.column("surname");
    private final Column score = STUDENT.column("score");

    @ParameterizedTest
    @CsvSource({
            "asc, ASCENDING",
            "ASC, ASCENDING",
            "Ascending, ASCENDING",
            "desc, DESCENDING",
            "DESCENDING, DESCENDING"
    })
    @DisplayName("Direction tokens")
    void testDirection(String token, Direction expected) {
        assertEquals(expected, Direction.of(token));
    }

    @Test
    @DisplayName("Invalid direction token")
    void testInvalidDirection() {
        GrammarException e = assertThrows(GrammarException.class, () -> Direction.of("up"));
        assertEquals("Invalid ordering direction up", e.getMessage());
    }

    @Test
    @DisplayName("Features default to ascending")
    void testDefaults() {
        List<Ordering> orderings = Ordering.make(surname, score, "desc");

        assertEquals(List.of(surname.asc(), score.desc()), orderings);
    }

    @Test
    @DisplayName("Orderings, pairs and entries")
    void testTerms() {
        List<Ordering> orderings = Ordering.make(score.desc(), List.of(surname, "desc"),
                Map.entry(score, Direction.ASCENDING));

        assertEquals(List.of(score.desc(), surname.desc(), score.asc()), orderings);
    }

    @Test
    @DisplayName("Aliased features are ordered by their operable")
    void testAliased() {
        assertEquals(List.of(surname.desc()), Ordering.make(surname.alias("pupil"), "descending"));
    }

    @Test
    @DisplayName("Terms that are not features")
    void testInvalidTerms() {
        GrammarException e = assertThrows(GrammarException.class, () -> Ordering.make("desc", surname));
        assertEquals("Expecting pair of feature and direction", e.getMessage());
        assertThrows(GrammarException.class, () -> Ordering.make(surname, "sideways"));
    }
}
