package org.finos.legend.dsl.sql;

import org.finos.legend.dsl.feature.Aggregate;
import org.finos.legend.dsl.feature.Element;
import org.finos.legend.dsl.feature.Literal;
import org.finos.legend.dsl.feature.Operable;
import org.finos.legend.dsl.frame.Query;
import org.finos.legend.dsl.frame.Reference;
import org.finos.legend.dsl.frame.Source;
import org.finos.legend.dsl.sql.ast.FromItem;
import org.finos.legend.dsl.sql.ast.QueryStatement;
import org.finos.legend.dsl.sql.ast.SQLNode;
import org.finos.legend.dsl.sql.ast.SelectStatement;
import org.finos.legend.dsl.sql.ast.SetStatement;
import org.finos.legend.dsl.transpiler.AnsiDialect;
import org.finos.legend.dsl.transpiler.DuckDBDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.finos.legend.dsl.SchoolFixtures.SCHOOL;
import static org.finos.legend.dsl.SchoolFixtures.STUDENT;
import static org.finos.legend.dsl.SchoolFixtures.canonicalQuery;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SQLTreeGenerator and SQLRenderer - frame sources to SQL AST to text.
 */
@DisplayName("SQLTreeGenerator Tests")
class SQLTreeGeneratorTest {

    private Map<Source, SQLNode> sources;
    private SQLRenderer renderer;

    @BeforeEach
    void setUp() {
        sources = Map.of(STUDENT, FromItem.TableRef.of("student"), SCHOOL, FromItem.TableRef.of("school"));
        renderer = new SQLRenderer(AnsiDialect.INSTANCE);
    }

    private QueryStatement generate(Source source) {
        return new SQLTreeGenerator(sources, Map.of()).generate(source);
    }

    private String render(Source source) {
        return renderer.render(generate(source));
    }

    // ==================== Statements ====================

    @Nested
    @DisplayName("Statements")
    class StatementTests {

        @Test
        @DisplayName("Join, filter, grouping, ordering and limit")
        void testCanonicalQuery() {
            // WHEN
            QueryStatement statement = generate(canonicalQuery());

            // THEN
            assertInstanceOf(SelectStatement.class, statement);
            SelectStatement select = (SelectStatement) statement;
            assertEquals(2, select.selectItems().size());
            assertEquals(1, select.groupBy().size());
            assertEquals(2, select.orderBy().size());
            assertEquals(Integer.valueOf(10), select.limit());
            assertEquals("SELECT \"student\".\"surname\" AS \"student\", count(\"school\".\"name\") AS \"num\" "
                    + "FROM \"student\" INNER JOIN \"school\" ON \"school\".\"id\" = \"student\".\"school\" "
                    + "WHERE \"student\".\"score\" < 2 "
                    + "GROUP BY \"student\".\"surname\" "
                    + "HAVING count(\"school\".\"name\") > 1 "
                    + "ORDER BY \"student\".\"class\" ASC, \"student\".\"score\" DESC "
                    + "LIMIT 10", renderer.render(statement));
        }

        @Test
        @DisplayName("Right join is emitted as a swapped left join")
        void testRightJoin() {
            Query query = STUDENT.rightJoin(SCHOOL, SCHOOL.column("id").eq(STUDENT.column("school")))
                    .select(STUDENT.column("surname"), SCHOOL.column("name"));

            assertEquals("SELECT \"student\".\"surname\", \"school\".\"name\" "
                    + "FROM \"school\" LEFT OUTER JOIN \"student\" ON \"school\".\"id\" = \"student\".\"school\"",
                    render(query));
        }

        @Test
        @DisplayName("Set operation")
        void testSet() {
            Query names = STUDENT.select(STUDENT.column("surname"));

            QueryStatement statement = generate(names.intersection(names.where(STUDENT.column("school").ne(1))));

            assertInstanceOf(SetStatement.class, statement);
            assertEquals("SELECT \"student\".\"surname\" FROM \"student\" INTERSECT "
                    + "SELECT \"student\".\"surname\" FROM \"student\" WHERE \"student\".\"school\" <> 1",
                    renderer.render(statement));
        }

        @Test
        @DisplayName("Sub-query reference")
        void testReference() {
            Query inner = STUDENT.select(STUDENT.column("surname").alias("student"), STUDENT.column("score"));
            Reference bar = inner.reference("bar");

            assertEquals("SELECT \"bar\".\"student\" FROM (SELECT \"student\".\"surname\" AS \"student\", "
                    + "\"student\".\"score\" FROM \"student\") AS \"bar\" WHERE \"bar\".\"score\" > 1",
                    render(bar.select(Element.of(bar, "student")).where(Element.of(bar, "score").gt(1))));
        }

        @Test
        @DisplayName("DuckDB limit and offset")
        void testDuckDBLimit() {
            Query query = STUDENT.select(STUDENT.column("surname")).limit(3, 6);

            String sql = new SQLRenderer(DuckDBDialect.INSTANCE).render(generate(query));

            assertTrue(sql.endsWith(" LIMIT 3 OFFSET 6"));
        }
    }

    // ==================== Expressions ====================

    @Nested
    @DisplayName("Expressions")
    class ExpressionTests {

        private String expression(Operable feature) {
            String sql = render(STUDENT.select(feature.alias("x")));
            return sql.substring("SELECT ".length(), sql.indexOf(" AS \"x\""));
        }

        @Test
        @DisplayName("Arithmetic precedence")
        void testArithmeticPrecedence() {
            assertEquals("(1 + 1) * 2", expression(new Literal(1).add(1).mul(2)));
            assertEquals("1 + 1 * 2", expression(new Literal(1).add(new Literal(1).mul(2))));
            assertEquals("1 - (2 - 3)", expression(new Literal(1).sub(new Literal(2).sub(3))));
        }

        @Test
        @DisplayName("Logical precedence")
        void testLogicalPrecedence() {
            Operable score = STUDENT.column("score");
            Operable condition = score.lt(1).or(score.gt(2)).and(STUDENT.column("level").eq(1));

            assertEquals("(\"student\".\"score\" < 1 OR \"student\".\"score\" > 2) AND \"student\".\"class\" = 1",
                    expression(condition));
        }

        @Test
        @DisplayName("Count of rows")
        void testCountStar() {
            assertEquals("count(*)", expression(Aggregate.count()));
        }

        @Test
        @DisplayName("Window")
        void testWindow() {
            Operable window = Aggregate.max(STUDENT.column("score")).over(List.of(STUDENT.column("school")));

            assertEquals("max(\"student\".\"score\") OVER (PARTITION BY \"student\".\"school\")", expression(window));
        }
    }
}
