package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.kind.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.finos.legend.dsl.SchoolFixtures.SCHOOL;
import static org.finos.legend.dsl.SchoolFixtures.STUDENT;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Operable Tests")
class OperableTest {

    private final Column surname = STUDENT.column("surname");
    private final Column dob = STUDENT.column("dob");
    private final Column level = STUDENT.column("level");
    private final Column score = STUDENT.column("score");

    // ==================== Kinds ====================

    @Nested
    @DisplayName("Kinds")
    class KindTests {

        @Test
        @DisplayName("Columns take their schema field kind and name")
        void testColumn() {
            assertEquals("class", level.name());
            assertEquals(Kind.Primitive.INTEGER, level.kind());
            assertEquals(Kind.Primitive.DATE, dob.kind());
        }

        @Test
        @DisplayName("Arithmetic takes the widest operand kind")
        void testArithmetic() {
            assertEquals(Kind.Primitive.FLOAT, level.add(score).kind());
            assertEquals(Kind.Primitive.FLOAT, score.mul(2).kind());
            assertEquals(Kind.Primitive.INTEGER, level.mod(2).kind());
        }

        @Test
        @DisplayName("Predicates and functions")
        void testFunctions() {
            assertEquals(Kind.Primitive.BOOLEAN, level.gt(1).and(score.isNull()).kind());
            assertEquals(Kind.Primitive.INTEGER, DateFunction.year(dob).kind());
            assertEquals(Kind.Primitive.INTEGER, Aggregate.count(surname).kind());
            assertEquals(Kind.Primitive.FLOAT, Aggregate.max(score).kind());
            assertEquals(Kind.Primitive.STRING, level.cast(Kind.Primitive.STRING).kind());
        }
    }

    // ==================== Validation ====================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Comparison of incompatible kinds")
        void testComparison() {
            assertThrows(GrammarException.class, () -> surname.eq(1));
            assertThrows(GrammarException.class, () -> dob.lt("2020-01-01"));
            assertDoesNotThrow(() -> level.lt(score));
        }

        @Test
        @DisplayName("Arithmetic of non-numeric operands")
        void testArithmetic() {
            assertThrows(GrammarException.class, () -> surname.add(1));
            assertThrows(GrammarException.class, () -> MathFunction.ceil(dob));
        }

        @Test
        @DisplayName("Aggregates of non-numeric operands")
        void testAggregate() {
            assertThrows(GrammarException.class, () -> Aggregate.sum(surname));
            assertThrows(GrammarException.class, () -> new Aggregate(Aggregate.Function.AVG, null));
            assertDoesNotThrow(() -> Aggregate.count(surname));
        }

        @Test
        @DisplayName("Date functions of non-date operands")
        void testDateFunction() {
            assertThrows(GrammarException.class, () -> DateFunction.year(score));
        }

        @Test
        @DisplayName("Logical operators of non-boolean operands")
        void testLogical() {
            assertThrows(GrammarException.class, () -> score.and(true));
            assertThrows(GrammarException.class, () -> level.gt(1).or(score));
            assertThrows(GrammarException.class, () -> surname.not());
        }

        @Test
        @DisplayName("Literals of unknown kind")
        void testLiteral() {
            assertThrows(GrammarException.class, () -> new Literal(new Object()));
        }
    }

    // ==================== Decomposition ====================

    @Test
    @DisplayName("Operable conversion unwraps aliases")
    void testOperableOf() {
        Aliased aliased = surname.alias("pupil");

        assertEquals(surname, Operable.of(aliased));
        assertEquals(new Literal(1), Operable.of(1));
        assertEquals("pupil", aliased.name());
        assertEquals("pupil=[student.surname]", aliased.toString());
    }

    @Test
    @DisplayName("Elements are dissected from nested expressions")
    void testDissect() {
        Operable condition = SCHOOL.column("id").eq(STUDENT.column("school")).and(score.add(1).lt(2));

        Set<Column> columns = Features.dissect(Column.class, condition);

        assertEquals(Set.of(SCHOOL.column("id"), STUDENT.column("school"), score), columns);
        assertEquals(List.of(new Literal(1), new Literal(2)),
                List.copyOf(Features.dissect(Literal.class, condition)));
    }

    @Test
    @DisplayName("Windows are descended into")
    void testDissectWindow() {
        Window window = Aggregate.max(score).over(List.of(surname), level, "desc");

        assertEquals(Set.of(score, surname, level), Features.dissect(Column.class, window));
        assertEquals(Set.of(window), Features.dissect(Window.class, window.gt(1)));
        assertEquals(List.of(score, surname, level), window.operands());
        assertThrows(GrammarException.class, () -> Features.ensureNotIn(Cumulative.class, window.gt(1)));
    }

    @Test
    @DisplayName("Rendering")
    void testToString() {
        assertEquals("student.score < 2", score.lt(2).toString());
        assertEquals("student.class + 1", level.add(1).toString());
        assertEquals("NOT student.surname IS NULL", surname.isNull().not().toString());
        assertEquals("count(*)", Aggregate.count().toString());
        assertEquals("year(student.dob)", DateFunction.year(dob).toString());
        assertEquals("student.surname == 'smith'", surname.eq("smith").toString());
    }
}
