package org.finos.legend.dsl.feature;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.finos.legend.dsl.SchoolFixtures.SCHOOL;
import static org.finos.legend.dsl.SchoolFixtures.STUDENT;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Factors Tests")
class FactorsTest {

    private final Comparison cheap = STUDENT.column("score").lt(2);
    private final Comparison local = STUDENT.column("school").eq(1);
    private final Comparison oxford = SCHOOL.column("name").eq("oxford");
    private final Comparison enrolled = SCHOOL.column("id").eq(STUDENT.column("school"));

    @Test
    @DisplayName("Single table comparison is its own factor")
    void testComparison() {
        Factors factors = cheap.factors();

        assertEquals(1, factors.size());
        assertEquals(Optional.of(cheap), factors.get(STUDENT));
        assertEquals(Optional.empty(), factors.get(SCHOOL));
    }

    @Test
    @DisplayName("Multi table comparison has no factors")
    void testJoinCondition() {
        assertTrue(enrolled.factors().isEmpty());
    }

    @Test
    @DisplayName("Conjunction keeps each table's factors")
    void testAnd() {
        Factors factors = cheap.and(oxford).and(enrolled).factors();

        assertEquals(Set.of(STUDENT, SCHOOL), factors.tables());
        assertEquals(cheap, factors.asMap().get(STUDENT));
        assertEquals(oxford, factors.asMap().get(SCHOOL));
    }

    @Test
    @DisplayName("Factors of the same table are merged")
    void testMerge() {
        assertEquals(Optional.of(Logical.and(cheap, local)), cheap.and(local).factors().get(STUDENT));
        assertEquals(Optional.of(Logical.or(cheap, local)), cheap.or(local).factors().get(STUDENT));
        assertEquals(Optional.of(cheap), cheap.and(cheap).factors().get(STUDENT));
    }

    @Test
    @DisplayName("Disjunction of disjoint tables keeps each table's factor")
    void testDisjointOr() {
        Factors factors = cheap.or(oxford).factors();

        assertEquals(Set.of(STUDENT, SCHOOL), factors.tables());
        assertEquals(Optional.of(cheap), factors.get(STUDENT));
        assertEquals(Optional.of(oxford), factors.get(SCHOOL));
        assertEquals(Factors.primitive(cheap, oxford), Factors.primitive(cheap).or(Factors.primitive(oxford)));
    }

    @Test
    @DisplayName("Combining factors with themselves is idempotent")
    void testIdempotent() {
        Factors single = cheap.and(oxford).factors();
        Factors merged = cheap.and(local).and(oxford).factors();

        assertEquals(single, single.and(single).or(single));
        assertEquals(merged, merged.and(merged).or(merged));
        assertEquals(merged, merged.or(merged).and(merged));
    }

    @Test
    @DisplayName("Negation negates every factor")
    void testNot() {
        Factors factors = cheap.and(oxford).not().factors();

        assertEquals(Optional.of(Logical.not(cheap)), factors.get(STUDENT));
        assertEquals(Optional.of(Logical.not(oxford)), factors.get(SCHOOL));
    }

    @Test
    @DisplayName("Primitive factors must be distinct single table predicates")
    void testPrimitive() {
        assertEquals(2, Factors.primitive(cheap, oxford).size());
        assertThrows(IllegalArgumentException.class, () -> Factors.primitive(cheap, local));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Factors.primitive(enrolled));
        assertEquals("Repeated or non-primitive predicates", e.getMessage());
    }

    @Test
    @DisplayName("Empty factors")
    void testEmpty() {
        assertTrue(Factors.empty().isEmpty());
        assertEquals(Factors.empty(), Factors.primitive());
        assertEquals(List.of(), List.copyOf(Factors.empty().tables()));
    }
}
