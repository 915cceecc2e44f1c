package org.finos.legend.dsl.feed;

import org.finos.legend.dsl.UnprovisionedException;
import org.finos.legend.dsl.execution.ColumnarEvaluator;
import org.finos.legend.dsl.feature.Aggregate;
import org.finos.legend.dsl.frame.Query;
import org.finos.legend.dsl.frame.Source;
import org.finos.legend.dsl.transpiler.DuckDBDialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.finos.legend.dsl.SchoolFixtures.SCHOOL;
import static org.finos.legend.dsl.SchoolFixtures.STUDENT;
import static org.finos.legend.dsl.SchoolFixtures.data;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests running generated SQL against an in-memory DuckDB.
 */
@DisplayName("JdbcReader Tests")
class JdbcReaderTest {

    private Connection connection;
    private JdbcReader reader;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:duckdb:");
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE student (surname VARCHAR, dob DATE, \"class\" INTEGER, score DOUBLE, "
                    + "school INTEGER)");
            stmt.execute("CREATE TABLE school (id INTEGER, name VARCHAR)");
            stmt.execute("INSERT INTO student VALUES "
                    + "('smith', DATE '2001-01-01', 1, 1.0, 1), "
                    + "('smith', DATE '2001-02-02', 2, 1.5, 2), "
                    + "('brown', DATE '2002-03-03', 1, 0.5, 1), "
                    + "('brown', DATE '2002-04-04', 3, 1.8, 1), "
                    + "('white', DATE '2003-05-05', 2, 3.0, 2), "
                    + "('green', DATE '2004-06-06', 1, 1.2, 3)");
            stmt.execute("INSERT INTO school VALUES (1, 'oxford'), (2, 'cambridge')");
        }
        Map<Source, String> sources = Map.of(STUDENT, "student", SCHOOL, "school");
        reader = new JdbcReader(connection, sources, Map.of(), DuckDBDialect.INSTANCE);
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (connection != null) {
            connection.close();
        }
    }

    private static Query grouped() {
        return STUDENT.join(SCHOOL, SCHOOL.column("id").eq(STUDENT.column("school")))
                .select(STUDENT.column("surname").alias("pupil"),
                        Aggregate.count(SCHOOL.column("name")).alias("num"))
                .where(STUDENT.column("score").lt(2))
                .groupby(STUDENT.column("surname"))
                .having(Aggregate.count(SCHOOL.column("name")).gt(1))
                .orderby(STUDENT.column("surname"));
    }

    @Test
    @DisplayName("Grouped join query")
    void testGroupedQuery() {
        // WHEN
        List<List<Object>> columns = reader.apply(grouped());

        // THEN
        assertEquals(2, columns.size());
        assertEquals(List.of("brown", "smith"), columns.get(0));
        assertEquals(List.of(2L, 2L), columns.get(1));
    }

    @Test
    @DisplayName("Database and in-memory evaluation agree")
    void testAgreesWithEvaluator() {
        Query query = grouped();

        List<List<Object>> expected = new ColumnarEvaluator(data()).evaluate(query).columns();

        assertEquals(expected, reader.apply(query));
    }

    @Test
    @DisplayName("Ordering with limit and offset")
    void testLimitOffset() {
        Query query = STUDENT.select(STUDENT.column("surname"), STUDENT.column("dob"))
                .orderby(STUDENT.column("score"))
                .limit(2, 1);

        List<List<Object>> columns = reader.apply(query);

        assertEquals(List.of("smith", "green"), columns.get(0));
        assertEquals(List.of(LocalDate.of(2001, 1, 1), LocalDate.of(2004, 6, 6)), columns.get(1));
    }

    @Test
    @DisplayName("Left join yields nulls")
    void testLeftJoin() {
        Query query = STUDENT.leftJoin(SCHOOL, SCHOOL.column("id").eq(STUDENT.column("school")))
                .select(STUDENT.column("surname"), SCHOOL.column("name"))
                .where(STUDENT.column("level").eq(1))
                .orderby(STUDENT.column("surname"));

        List<List<Object>> columns = reader.apply(query);

        assertEquals(List.of("brown", "green", "smith"), columns.get(0));
        assertEquals(Arrays.asList("oxford", null, "oxford"), columns.get(1));
    }

    @Test
    @DisplayName("Invalid SQL is reported with the statement")
    void testSqlError() {
        Map<Source, String> sources = Map.of(STUDENT, "missing");
        JdbcReader broken = new JdbcReader(connection, sources, Map.of(), DuckDBDialect.INSTANCE);

        RuntimeException e = assertThrows(RuntimeException.class,
                () -> broken.apply(STUDENT.select(STUDENT.column("surname"))));
        assertTrue(e.getMessage().startsWith("Error executing query: SELECT"));
    }

    @Test
    @DisplayName("Unmapped source")
    void testUnmapped() {
        JdbcReader empty = new JdbcReader(connection, Map.of(), Map.of());

        assertThrows(UnprovisionedException.class, () -> empty.apply(STUDENT.query()));
    }
}
