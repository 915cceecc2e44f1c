package org.finos.legend.dsl.transpiler;

import org.finos.legend.dsl.UnprovisionedException;
import org.finos.legend.dsl.UnsupportedException;
import org.finos.legend.dsl.feature.Aggregate;
import org.finos.legend.dsl.feature.DateFunction;
import org.finos.legend.dsl.feature.Element;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.feature.Literal;
import org.finos.legend.dsl.feature.MathFunction;
import org.finos.legend.dsl.feature.Operable;
import org.finos.legend.dsl.feature.Window;
import org.finos.legend.dsl.frame.Join;
import org.finos.legend.dsl.frame.Query;
import org.finos.legend.dsl.frame.Reference;
import org.finos.legend.dsl.frame.Source;
import org.finos.legend.dsl.kind.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.finos.legend.dsl.SchoolFixtures.SCHOOL;
import static org.finos.legend.dsl.SchoolFixtures.STUDENT;
import static org.finos.legend.dsl.SchoolFixtures.canonicalQuery;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SQLGenerator - compiles frame sources into SQL text.
 */
@DisplayName("SQLGenerator Tests")
class SQLGeneratorTest {

    private static final Map<Source, String> SOURCES = Map.of(STUDENT, "student", SCHOOL, "school");

    private static String generate(Source source) {
        return new SQLGenerator(SOURCES, Map.of()).parse(source);
    }

    private static String normalize(String sql) {
        return sql.replaceAll("\\s+", " ").trim();
    }

    // ==================== Queries ====================

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("Join, filter, grouping, ordering and limit")
        void testCanonicalQuery() {
            String sql = generate(canonicalQuery());

            assertEquals("SELECT \"student\".\"surname\" AS \"student\", count(\"school\".\"name\") AS \"num\"\n"
                    + "FROM \"student\" JOIN \"school\" ON \"school\".\"id\" = \"student\".\"school\"\n"
                    + "WHERE \"student\".\"score\" < 2\n"
                    + "GROUP BY \"student\".\"surname\"\n"
                    + "HAVING count(\"school\".\"name\") > 1\n"
                    + "ORDER BY \"student\".\"class\" ASC, \"student\".\"score\" DESC\n"
                    + "LIMIT 10", sql);
        }

        @Test
        @DisplayName("Plain table selects all its columns")
        void testTableQuery() {
            String sql = generate(SCHOOL.query());

            assertEquals("SELECT \"school\".\"id\", \"school\".\"name\" FROM \"school\"", normalize(sql));
        }

        @Test
        @DisplayName("Repeated where calls are combined")
        void testCombinedWhere() {
            Query query = STUDENT.select(STUDENT.column("surname"))
                    .where(STUDENT.column("score").gt(1))
                    .where(STUDENT.column("school").eq(2));

            assertEquals("SELECT \"student\".\"surname\" FROM \"student\" "
                            + "WHERE (\"student\".\"school\" = 2) AND (\"student\".\"score\" > 1)",
                    normalize(generate(query)));
        }

        @Test
        @DisplayName("Limit with offset")
        void testLimitOffset() {
            Query query = STUDENT.select(STUDENT.column("surname")).limit(5, 10);

            assertTrue(generate(query).endsWith("\nLIMIT 10, 5"));
        }

        @Test
        @DisplayName("DuckDB limit with offset")
        void testDuckDBLimitOffset() {
            Query query = STUDENT.select(STUDENT.column("surname")).limit(5, 10);

            String sql = new SQLGenerator(SOURCES, Map.of(), DuckDBDialect.INSTANCE).parse(query);

            assertTrue(sql.endsWith("\nLIMIT 5 OFFSET 10"));
        }

        @Test
        @DisplayName("Left join")
        void testLeftJoin() {
            Query query = STUDENT.leftJoin(SCHOOL, SCHOOL.column("id").eq(STUDENT.column("school")))
                    .select(STUDENT.column("surname"), SCHOOL.column("name"));

            assertEquals("SELECT \"student\".\"surname\", \"school\".\"name\" "
                            + "FROM \"student\" LEFT OUTER JOIN \"school\" ON \"school\".\"id\" = \"student\".\"school\"",
                    normalize(generate(query)));
        }

        @Test
        @DisplayName("Cross join has no condition")
        void testCrossJoin() {
            Query query = STUDENT.crossJoin(SCHOOL).select(STUDENT.column("surname"), SCHOOL.column("name"));

            assertEquals("SELECT \"student\".\"surname\", \"school\".\"name\" FROM \"student\" CROSS JOIN \"school\"",
                    normalize(generate(query)));
        }

        @Test
        @DisplayName("Set operations")
        void testSetOperations() {
            Query all = STUDENT.select(STUDENT.column("surname"));
            Query good = STUDENT.where(STUDENT.column("score").lt(1)).select(STUDENT.column("surname"));

            assertEquals("SELECT \"student\".\"surname\" FROM \"student\" UNION "
                            + "SELECT \"student\".\"surname\" FROM \"student\" WHERE \"student\".\"score\" < 1",
                    normalize(generate(all.union(good))));
            assertTrue(generate(all.difference(good)).contains(" EXCEPT "));
            assertTrue(generate(all.intersection(good)).contains(" INTERSECT "));
        }
    }

    // ==================== Expressions ====================

    @Nested
    @DisplayName("Expressions")
    class ExpressionTests {

        private String select(Feature feature) {
            return generate(STUDENT.select(feature)).split("\n")[0];
        }

        @Test
        @DisplayName("Cast and addition")
        void testCast() {
            Operable expression = new Literal("1").cast(Kind.Primitive.INTEGER).add(1);

            assertEquals("SELECT CAST('1' AS INTEGER) + 1 AS \"int\"", select(expression.alias("int")));
        }

        @Test
        @DisplayName("Non-associative operands are parenthesized")
        void testParentheses() {
            Operable expression = new Literal(1).add(1).mul(2);

            assertEquals("SELECT (1 + 1) * 2 AS \"int\"", select(expression.alias("int")));
        }

        @Test
        @DisplayName("Sums of function calls are parenthesized")
        void testFunctionOperands() {
            Operable expression = new Literal(2).mul(MathFunction.abs(STUDENT.column("score"))
                    .add(MathFunction.abs(STUDENT.column("level"))));

            assertEquals("SELECT 2 * (abs(\"student\".\"score\") + abs(\"student\".\"class\")) AS \"sum\"",
                    select(expression.alias("sum")));
            assertEquals("SELECT abs(\"student\".\"score\") * 2 AS \"product\"",
                    select(MathFunction.abs(STUDENT.column("score")).mul(2).alias("product")));
        }

        @Test
        @DisplayName("Call detection respects nesting and quotes")
        void testEnclosed() {
            assertTrue(SQLGenerator.enclosed("count(*)"));
            assertTrue(SQLGenerator.enclosed("abs(floor(\"a\") + 1)"));
            assertTrue(SQLGenerator.enclosed("concat(')', \"b\")"));
            assertFalse(SQLGenerator.enclosed("abs(\"a\") + abs(\"b\")"));
            assertFalse(SQLGenerator.enclosed("NOT (\"a\")"));
            assertFalse(SQLGenerator.enclosed("\"a\""));
        }

        @Test
        @DisplayName("Timestamp literal")
        void testTimestamp() {
            LocalDateTime timestamp = LocalDateTime.of(2020, 7, 9, 16, 58, 32, 654321000);

            assertEquals("SELECT year(TIMESTAMP '2020-07-09 16:58:32.654321') AS \"year\"",
                    select(DateFunction.year(new Literal(timestamp)).alias("year")));
        }

        @Test
        @DisplayName("Timestamp literal fraction only when present")
        void testTimestampFraction() {
            SQLDialect dialect = AnsiDialect.INSTANCE;

            assertEquals("TIMESTAMP '2020-07-09 16:58:32'",
                    dialect.formatTimestamp(LocalDateTime.of(2020, 7, 9, 16, 58, 32)));
            assertEquals("TIMESTAMP '2020-07-09 00:00:00'",
                    dialect.formatTimestamp(LocalDate.of(2020, 7, 9).atStartOfDay()));
            assertEquals("TIMESTAMP '2020-07-09 16:58:32.250000'",
                    dialect.formatTimestamp(LocalDateTime.of(2020, 7, 9, 16, 58, 32, 250000000)));
            assertEquals("SELECT TIMESTAMP '2020-07-09 16:58:32' AS \"at\"",
                    select(new Literal(LocalDateTime.of(2020, 7, 9, 16, 58, 32)).alias("at")));
        }

        @Test
        @DisplayName("Date function in arithmetic")
        void testDateArithmetic() {
            Operable expression = new Literal(2).mul(DateFunction.year(new Literal(LocalDate.of(2020, 7, 9))).add(1));

            assertEquals("SELECT 2 * (year(DATE '2020-07-09') + 1) AS \"calc\"", select(expression.alias("calc")));
        }

        @Test
        @DisplayName("String literals are escaped")
        void testStringEscape() {
            Operable condition = STUDENT.column("surname").eq("o'brien");

            assertEquals("SELECT \"student\".\"surname\" = 'o''brien' AS \"match\"", select(condition.alias("match")));
        }

        @Test
        @DisplayName("Boolean logic and null tests")
        void testLogic() {
            Operable condition = STUDENT.column("score").isNull().or(STUDENT.column("school").ne(1)).not();

            assertEquals("SELECT NOT ((\"student\".\"score\" IS NULL) OR (\"student\".\"school\" != 1)) AS \"flag\"",
                    select(condition.alias("flag")));
        }

        @Test
        @DisplayName("Window over partition and ordering")
        void testWindow() {
            Window rank = Aggregate.count().over(List.of(STUDENT.column("school")), STUDENT.column("score"), "desc");

            assertEquals("SELECT count(*) OVER (PARTITION BY \"student\".\"school\" "
                    + "ORDER BY \"student\".\"score\" DESC) AS \"rank\"", select(rank.alias("rank")));
        }

        @Test
        @DisplayName("Window with explicit frame")
        void testWindowFrame() {
            Window running = Aggregate.sum(STUDENT.column("score")).over(List.of(), List.of(
                    STUDENT.column("dob").asc()), new Window.Frame(Window.Frame.Mode.ROWS, -2, 0));

            assertEquals("SELECT sum(\"student\".\"score\") OVER (ORDER BY \"student\".\"dob\" ASC "
                    + "ROWS BETWEEN 2 PRECEDING AND CURRENT ROW) AS \"running\"", select(running.alias("running")));
        }

        @Test
        @DisplayName("Casting to a compound kind is not supported")
        void testCompoundCast() {
            Operable expression = STUDENT.column("surname").cast(new Kind.Array(Kind.Primitive.STRING));

            assertThrows(UnsupportedException.class, () -> select(expression));
        }
    }

    // ==================== References ====================

    @Nested
    @DisplayName("References")
    class ReferenceTests {

        @Test
        @DisplayName("Sub-query reference")
        void testSubQuery() {
            // GIVEN
            Reference foo = STUDENT.reference("foo");
            Query inner = foo.join(SCHOOL, SCHOOL.column("id").eq(Element.of(foo, "school")))
                    .select(Element.of(foo, "surname").alias("student"), SCHOOL.column("name").alias("school"));
            Reference bar = inner.reference("bar");

            // WHEN
            String sql = generate(bar.select(Element.of(bar, "student")));

            // THEN
            assertEquals("SELECT \"bar\".\"student\" FROM (SELECT \"foo\".\"surname\" AS \"student\", "
                    + "\"school\".\"name\" AS \"school\" FROM \"student\" AS \"foo\" "
                    + "JOIN \"school\" ON \"school\".\"id\" = \"foo\".\"school\") AS \"bar\"", normalize(sql));
        }

        @Test
        @DisplayName("Self join through two references")
        void testSelfJoin() {
            Reference a = STUDENT.reference("a");
            Reference b = STUDENT.reference("b");
            Query query = a.join(b, Element.of(a, "school").eq(Element.of(b, "school")))
                    .select(Element.of(a, "surname").alias("left"), Element.of(b, "surname").alias("right"));

            assertEquals("SELECT \"a\".\"surname\" AS \"left\", \"b\".\"surname\" AS \"right\" "
                    + "FROM \"student\" AS \"a\" JOIN \"student\" AS \"b\" ON \"a\".\"school\" = \"b\".\"school\"",
                    normalize(generate(query)));
        }
    }

    // ==================== Mappings ====================

    @Nested
    @DisplayName("Mappings")
    class MappingTests {

        @Test
        @DisplayName("Explicit feature mapping replaces the generated expression")
        void testFeatureBypass() {
            Operable next = STUDENT.column("score").add(1);
            Query query = STUDENT.select(next.alias("next"));

            String sql = new SQLGenerator(SOURCES, Map.of(next, "\"student\".\"next_score\"")).parse(query);

            assertEquals("SELECT \"student\".\"next_score\" AS \"next\" FROM \"student\"", normalize(sql));
        }

        @Test
        @DisplayName("Explicit source mapping replaces the generated join")
        void testSourceBypass() {
            Join join = STUDENT.join(SCHOOL, SCHOOL.column("id").eq(STUDENT.column("school")));
            Map<Source, String> sources = Map.of(STUDENT, "student", SCHOOL, "school", join, "\"enrolment\"");

            String sql = new SQLGenerator(sources, Map.of()).parse(join.select(STUDENT.column("surname")));

            assertEquals("SELECT \"student\".\"surname\" FROM \"enrolment\"", normalize(sql));
        }

        @Test
        @DisplayName("Explicit column mapping")
        void testColumnMapping() {
            Map<Feature, String> features = Map.of(STUDENT.column("surname"), "last_name");

            String sql = new SQLGenerator(SOURCES, features).parse(STUDENT.select(STUDENT.column("surname")));

            assertEquals("SELECT \"student\".\"last_name\" FROM \"student\"", normalize(sql));
        }

        @Test
        @DisplayName("Unmapped source")
        void testUnmappedSource() {
            SQLGenerator generator = new SQLGenerator(Map.of(STUDENT, "student"), Map.of());

            UnprovisionedException e = assertThrows(UnprovisionedException.class,
                    () -> generator.parse(SCHOOL.query()));
            assertTrue(e.getMessage().startsWith("Unknown mapping for source"));
        }
    }
}
